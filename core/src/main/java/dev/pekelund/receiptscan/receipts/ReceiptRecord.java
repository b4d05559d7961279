package dev.pekelund.receiptscan.receipts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Fields extracted from a single receipt image. Every field except the file name may be
 * {@code null} when the extraction engine could not resolve it.
 *
 * @param filename name of the scanned image, never blank
 * @param vendor   merchant name
 * @param location address line(s) of the merchant
 * @param date     receipt date
 * @param total    amount paid, scaled to two fraction digits
 * @param currency currency of the amount
 */
public record ReceiptRecord(
    String filename,
    String vendor,
    String location,
    ReceiptDate date,
    BigDecimal total,
    ReceiptCurrency currency
) {

    public ReceiptRecord {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("A receipt record requires a file name");
        }
        if (total != null) {
            total = total.setScale(2, RoundingMode.HALF_UP);
        }
    }

    /**
     * Record for a receipt whose OCR pass produced no text at all.
     */
    public static ReceiptRecord unresolved(String filename) {
        return new ReceiptRecord(filename, null, null, null, null, null);
    }

    public Optional<String> vendorValue() {
        return Optional.ofNullable(vendor);
    }

    public Optional<String> locationValue() {
        return Optional.ofNullable(location);
    }

    public Optional<ReceiptDate> dateValue() {
        return Optional.ofNullable(date);
    }

    public Optional<BigDecimal> totalValue() {
        return Optional.ofNullable(total);
    }

    public Optional<ReceiptCurrency> currencyValue() {
        return Optional.ofNullable(currency);
    }
}
