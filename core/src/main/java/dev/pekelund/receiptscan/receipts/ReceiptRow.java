package dev.pekelund.receiptscan.receipts;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * One exported row. All cells are strings; unresolved fields carry {@link ReceiptRowConstants#NULL_VALUE}
 * while the separator row and the unused cells of summary rows are empty.
 */
@JsonPropertyOrder({"filename", "vendor", "location", "date", "total", "currency"})
public record ReceiptRow(
    String filename,
    String vendor,
    String location,
    String date,
    String total,
    String currency
) {

    private static final ReceiptRow SEPARATOR = new ReceiptRow("", "", "", "", "", "");

    public ReceiptRow {
        filename = Objects.requireNonNullElse(filename, "");
        vendor = Objects.requireNonNullElse(vendor, "");
        location = Objects.requireNonNullElse(location, "");
        date = Objects.requireNonNullElse(date, "");
        total = Objects.requireNonNullElse(total, "");
        currency = Objects.requireNonNullElse(currency, "");
    }

    public static ReceiptRow fromRecord(ReceiptRecord record) {
        Objects.requireNonNull(record, "record");
        return new ReceiptRow(
            record.filename(),
            orNull(record.vendor()),
            orNull(record.location()),
            record.dateValue().map(ReceiptDate::format).orElse(ReceiptRowConstants.NULL_VALUE),
            record.totalValue().map(BigDecimal::toPlainString).orElse(ReceiptRowConstants.NULL_VALUE),
            record.currencyValue().map(Enum::name).orElse(ReceiptRowConstants.NULL_VALUE));
    }

    public static ReceiptRow separator() {
        return SEPARATOR;
    }

    public static ReceiptRow summary(CurrencyTotal currencyTotal) {
        Objects.requireNonNull(currencyTotal, "currencyTotal");
        return new ReceiptRow("", ReceiptRowConstants.SUMMARY_LABEL_PREFIX + currencyTotal.currency(), "", "",
            currencyTotal.total().toPlainString(), currencyTotal.currency());
    }

    @JsonIgnore
    public boolean isSeparator() {
        return SEPARATOR.equals(this);
    }

    private static String orNull(String value) {
        return value == null || value.isBlank() ? ReceiptRowConstants.NULL_VALUE : value;
    }
}
