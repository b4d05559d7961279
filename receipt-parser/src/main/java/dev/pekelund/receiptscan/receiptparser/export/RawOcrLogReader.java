package dev.pekelund.receiptscan.receiptparser.export;

import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a raw OCR log back into recognised receipts so that a saved scan can be extracted again.
 * Text outside START/END blocks, such as the title line, is ignored.
 */
public class RawOcrLogReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RawOcrLogReader.class);

    public List<RecognizedReceipt> read(String log) {
        return read(new StringReader(log != null ? log : ""));
    }

    public List<RecognizedReceipt> read(Reader source) {
        List<RecognizedReceipt> receipts = new ArrayList<>();
        String currentFile = null;
        List<String> currentLines = new ArrayList<>();
        int lineNumber = 0;

        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String startFile = RawOcrLog.markerFilename(line, RawOcrLog.START_PREFIX);
                String endFile = RawOcrLog.markerFilename(line, RawOcrLog.END_PREFIX);

                if (currentFile == null) {
                    if (startFile != null) {
                        currentFile = startFile;
                        currentLines = new ArrayList<>();
                    } else if (endFile != null) {
                        throw new ReceiptParsingException(
                            "Line " + lineNumber + ": END marker for " + endFile + " without a matching START");
                    }
                    continue;
                }

                if (startFile != null) {
                    throw new ReceiptParsingException(
                        "Line " + lineNumber + ": START marker for " + startFile + " inside the block of " + currentFile);
                }
                if (endFile != null) {
                    if (!endFile.equals(currentFile)) {
                        throw new ReceiptParsingException(
                            "Line " + lineNumber + ": END marker for " + endFile + " closes the block of " + currentFile);
                    }
                    receipts.add(new RecognizedReceipt(currentFile, currentLines));
                    currentFile = null;
                    continue;
                }
                currentLines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read OCR log", ex);
        }

        if (currentFile != null) {
            throw new ReceiptParsingException("OCR log ends inside the block of " + currentFile);
        }
        LOGGER.debug("Read {} receipts from OCR log", receipts.size());
        return List.copyOf(receipts);
    }
}
