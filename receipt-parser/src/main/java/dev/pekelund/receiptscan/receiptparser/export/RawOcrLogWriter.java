package dev.pekelund.receiptscan.receiptparser.export;

import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.util.List;
import java.util.Objects;

/**
 * Renders recognised receipts as a raw OCR log: a title line, then one block per receipt delimited
 * by START and END markers that carry the file name.
 *
 * <p>A file name or line containing a line break, and a line that reads as a START or END marker,
 * cannot be read back from the log and is rejected.
 */
public class RawOcrLogWriter {

    public String write(List<RecognizedReceipt> receipts) {
        StringBuilder log = new StringBuilder(RawOcrLog.TITLE).append('\n');
        for (RecognizedReceipt receipt : Objects.requireNonNullElse(receipts, List.<RecognizedReceipt>of())) {
            String filename = receipt.filename();
            if (filename == null || filename.isEmpty() || RawOcrLog.hasLineBreak(filename)) {
                throw new ReceiptParsingException("File name '" + filename + "' cannot be written to the OCR log");
            }
            log.append('\n').append(RawOcrLog.start(filename)).append('\n');
            for (String line : receipt.lines()) {
                if (RawOcrLog.hasLineBreak(line)) {
                    throw new ReceiptParsingException("Line of " + filename + " contains a line break");
                }
                if (RawOcrLog.isMarker(line)) {
                    throw new ReceiptParsingException("Line '" + line + "' of " + filename + " reads as a block marker");
                }
                log.append(line).append('\n');
            }
            log.append(RawOcrLog.end(filename)).append('\n');
        }
        return log.toString();
    }
}
