package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptRecord;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running the engine over one receipt.
 *
 * @param locale locale the receipt was read with, or {@code null} when it had no text to classify
 * @param record extracted fields
 */
public record ReceiptExtraction(ReceiptLocale locale, ReceiptRecord record) {

    public ReceiptExtraction {
        Objects.requireNonNull(record, "record");
    }

    public Optional<ReceiptLocale> detectedLocale() {
        return Optional.ofNullable(locale);
    }
}
