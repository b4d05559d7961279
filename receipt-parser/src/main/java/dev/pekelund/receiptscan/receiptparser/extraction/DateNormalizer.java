package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptDate;
import dev.pekelund.receiptscan.receipts.ReceiptRowConstants;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw date token read by OCR into a calendar date.
 *
 * <p>The token is repaired first: OCR frequently renders the century of a year as an apostrophe
 * ({@code '23}), and separators come out as arbitrary punctuation. The repaired token is then
 * matched against the supported layouts in priority order; numeric day-first layouts win over
 * month-first ones, which win over layouts with an English month name.
 */
public class DateNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DateNormalizer.class);

    private static final Pattern APOSTROPHE_YEAR = Pattern.compile("'(\\d{2})\\b");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LOOSE_MONTH_DAY_YEAR = Pattern.compile("([a-zA-Z]{3})\\s*(\\d{1,2})\\s*(\\d{2,4})");

    private static final String DAY = "(?<day>\\d{1,2})";
    private static final String MONTH = "(?<month>\\d{1,2})";
    private static final String MONTH_NAME = "(?<monthName>[a-z]+)";
    private static final String MONTH_ABBREVIATION = "(?<monthName>[a-z]{3})";
    private static final String LONG_YEAR = "(?<year>\\d{4})";
    private static final String SHORT_YEAR = "(?<shortYear>\\d{2})";

    private static final List<DateLayout> LAYOUTS = List.of(
        new DateLayout("d M yyyy", DAY + " " + MONTH + " " + LONG_YEAR, MonthStyle.NUMBER),
        new DateLayout("d M yy", DAY + " " + MONTH + " " + SHORT_YEAR, MonthStyle.NUMBER),
        new DateLayout("M d yyyy", MONTH + " " + DAY + " " + LONG_YEAR, MonthStyle.NUMBER),
        new DateLayout("M d yy", MONTH + " " + DAY + " " + SHORT_YEAR, MonthStyle.NUMBER),
        new DateLayout("MMM d yyyy", MONTH_ABBREVIATION + " " + DAY + " " + LONG_YEAR, MonthStyle.ABBREVIATION),
        new DateLayout("MMM d yy", MONTH_ABBREVIATION + " " + DAY + " " + SHORT_YEAR, MonthStyle.ABBREVIATION),
        new DateLayout("MMMM d yyyy", MONTH_NAME + " " + DAY + " " + LONG_YEAR, MonthStyle.FULL_NAME),
        new DateLayout("MMMM d yy", MONTH_NAME + " " + DAY + " " + SHORT_YEAR, MonthStyle.FULL_NAME),
        new DateLayout("MMMd yyyy", MONTH_ABBREVIATION + DAY + " " + LONG_YEAR, MonthStyle.ABBREVIATION),
        new DateLayout("MMMdyyyy", MONTH_ABBREVIATION + DAY + LONG_YEAR, MonthStyle.ABBREVIATION)
    );

    private static final Map<String, Integer> MONTH_ABBREVIATIONS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
        Map.entry("january", 1), Map.entry("february", 2), Map.entry("march", 3), Map.entry("april", 4),
        Map.entry("may", 5), Map.entry("june", 6), Map.entry("july", 7), Map.entry("august", 8),
        Map.entry("september", 9), Map.entry("october", 10), Map.entry("november", 11), Map.entry("december", 12));

    /**
     * Normalises a raw token. Returns empty for a blank token or the {@code "null"} marker; a token
     * that matches no layout is returned as an unparsed {@link ReceiptDate} holding the original text.
     */
    public Optional<ReceiptDate> normalize(String rawToken, ReceiptLocale locale) {
        if (rawToken == null || rawToken.isBlank() || ReceiptRowConstants.NULL_VALUE.equals(rawToken)) {
            return Optional.empty();
        }

        String repaired = repair(rawToken);
        Optional<LocalDate> parsed = parseLayouts(repaired).or(() -> parseLoosely(repaired));
        if (parsed.isEmpty()) {
            LOGGER.debug("Could not normalise date token '{}' (repaired '{}', locale {})", rawToken, repaired, locale);
            return Optional.of(ReceiptDate.unparsed(rawToken));
        }
        return Optional.of(ReceiptDate.parsed(parsed.get(), rawToken));
    }

    /**
     * String form of {@link #normalize}: {@code dd/MM/yyyy} when the token parses, otherwise the
     * input unchanged.
     */
    public String normalizeText(String rawToken, ReceiptLocale locale) {
        return normalize(rawToken, locale)
            .map(ReceiptDate::format)
            .orElse(rawToken);
    }

    String repair(String rawToken) {
        String repaired = APOSTROPHE_YEAR.matcher(rawToken).replaceAll("20$1");
        repaired = repaired.replace("'", "20");
        repaired = PUNCTUATION.matcher(repaired).replaceAll(" ");
        return WHITESPACE.matcher(repaired).replaceAll(" ").strip();
    }

    private Optional<LocalDate> parseLayouts(String repaired) {
        String candidate = repaired.toLowerCase(Locale.US);
        for (DateLayout layout : LAYOUTS) {
            Matcher matcher = layout.pattern().matcher(candidate);
            if (!matcher.matches()) {
                continue;
            }
            Optional<LocalDate> date = layout.toDate(matcher);
            if (date.isPresent()) {
                LOGGER.trace("Date '{}' matched layout {}", repaired, layout.name());
                return date;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDate> parseLoosely(String repaired) {
        Matcher matcher = LOOSE_MONTH_DAY_YEAR.matcher(repaired);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Integer month = MONTH_ABBREVIATIONS.get(matcher.group(1).toLowerCase(Locale.US));
        String year = matcher.group(3);
        if (year.length() == 2) {
            year = "20" + year;
        }
        if (month == null || year.length() != 4) {
            return Optional.empty();
        }
        return toDate(Integer.parseInt(year), month, Integer.parseInt(matcher.group(2)));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private enum MonthStyle {
        NUMBER,
        ABBREVIATION,
        FULL_NAME
    }

    private record DateLayout(String name, Pattern pattern, MonthStyle monthStyle, boolean shortYear) {

        DateLayout(String name, String regex, MonthStyle monthStyle) {
            this(name, Pattern.compile(regex), monthStyle, regex.contains(SHORT_YEAR));
        }

        Optional<LocalDate> toDate(Matcher matcher) {
            Integer month = switch (monthStyle) {
                case NUMBER -> Integer.valueOf(matcher.group("month"));
                case ABBREVIATION -> MONTH_ABBREVIATIONS.get(matcher.group("monthName"));
                case FULL_NAME -> MONTH_NAMES.get(matcher.group("monthName"));
            };
            if (month == null) {
                return Optional.empty();
            }
            int day = Integer.parseInt(matcher.group("day"));
            return DateNormalizer.toDate(resolveYear(matcher), month, day);
        }

        private int resolveYear(Matcher matcher) {
            if (!shortYear) {
                return Integer.parseInt(matcher.group("year"));
            }
            // Two-digit years pivot at 69, as C strptime does.
            int year = Integer.parseInt(matcher.group("shortYear"));
            return year < 69 ? 2000 + year : 1900 + year;
        }
    }
}
