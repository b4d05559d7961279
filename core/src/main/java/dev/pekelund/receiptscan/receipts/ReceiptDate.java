package dev.pekelund.receiptscan.receipts;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Date detected on a receipt.
 *
 * <p>A date is either parsed into a {@link LocalDate}, or kept as the raw OCR token when no known
 * layout matched it. Parsed dates may be {@code inferred}, meaning the receipt carried no date and
 * the processing day was used instead.
 *
 * @param value    parsed calendar date, or {@code null} when the token could not be parsed
 * @param rawText  token as found on the receipt, or {@code null} for inferred dates
 * @param inferred whether the date was defaulted rather than read from the receipt
 */
public record ReceiptDate(LocalDate value, String rawText, boolean inferred) {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern(ReceiptRowConstants.DATE_PATTERN);

    public ReceiptDate {
        if (value == null && (rawText == null || rawText.isBlank())) {
            throw new IllegalArgumentException("A receipt date needs either a parsed value or the raw token");
        }
        if (inferred && value == null) {
            throw new IllegalArgumentException("Inferred receipt dates must carry a parsed value");
        }
    }

    public static ReceiptDate parsed(LocalDate value, String rawText) {
        return new ReceiptDate(Objects.requireNonNull(value, "value"), rawText, false);
    }

    public static ReceiptDate inferred(LocalDate today) {
        return new ReceiptDate(Objects.requireNonNull(today, "today"), null, true);
    }

    public static ReceiptDate unparsed(String rawText) {
        return new ReceiptDate(null, rawText, false);
    }

    public boolean isParsed() {
        return value != null;
    }

    public Optional<LocalDate> asLocalDate() {
        return Optional.ofNullable(value);
    }

    /**
     * Renders the date the way it is exported: {@code dd/MM/yyyy}, wrapped in parentheses for
     * inferred dates, or the raw token when the date could not be parsed.
     */
    public String format() {
        if (value == null) {
            return rawText;
        }
        String formatted = CANONICAL.format(value);
        return inferred ? "(" + formatted + ")" : formatted;
    }

    @Override
    public String toString() {
        return format();
    }
}
