package dev.pekelund.receiptscan.receiptparser.export;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.ReceiptRow;
import dev.pekelund.receiptscan.receipts.ReceiptRowConstants;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes exported receipt rows as CSV with a header line.
 */
public class ReceiptCsvWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptCsvWriter.class);

    public static final String DEFAULT_FILENAME = "receipts_data.csv";

    private static final String HEADER = String.join(",", ReceiptRowConstants.COLUMNS) + "\n";

    private final ObjectWriter rowWriter;

    public ReceiptCsvWriter() {
        CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
        CsvSchema.Builder schema = CsvSchema.builder();
        ReceiptRowConstants.COLUMNS.forEach(schema::addColumn);
        this.rowWriter = mapper.writerFor(ReceiptRow.class).with(schema.build().withHeader());
    }

    public String write(List<ReceiptRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return HEADER;
        }
        StringWriter buffer = new StringWriter();
        try (SequenceWriter sequence = rowWriter.writeValues(buffer)) {
            sequence.writeAll(rows);
        } catch (IOException ex) {
            throw new ReceiptParsingException("Failed to write receipt rows as CSV", ex);
        }
        LOGGER.debug("Wrote {} rows as CSV", rows.size());
        return buffer.toString();
    }

    public void write(List<ReceiptRow> rows, Writer target) {
        try {
            target.write(write(rows));
            target.flush();
        } catch (IOException ex) {
            throw new ReceiptParsingException("Failed to write receipt rows as CSV", ex);
        }
    }
}
