package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receiptparser.extraction.LocaleProfile.DateTokenPattern;
import dev.pekelund.receiptscan.receipts.ReceiptDate;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the first date-shaped token on a receipt and normalises it. Receipts without any date
 * get the current day, flagged as inferred.
 */
public class DateExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DateExtractor.class);

    private final DateNormalizer dateNormalizer;
    private final Clock clock;

    public DateExtractor(DateNormalizer dateNormalizer, Clock clock) {
        this.dateNormalizer = dateNormalizer;
        this.clock = clock;
    }

    public ReceiptDate extract(List<String> lines, ReceiptLocale locale) {
        Optional<String> rawToken = findDateToken(lines, locale);
        if (rawToken.isPresent()) {
            Optional<ReceiptDate> normalized = dateNormalizer.normalize(rawToken.get(), locale);
            if (normalized.isPresent()) {
                return normalized.get();
            }
        }
        LocalDate today = LocalDate.now(clock);
        LOGGER.debug("No date found on receipt, defaulting to {}", today);
        return ReceiptDate.inferred(today);
    }

    /**
     * Scans lines top to bottom and returns the first token matched by any of the locale's date
     * patterns, tried in priority order on each line.
     */
    Optional<String> findDateToken(List<String> lines, ReceiptLocale locale) {
        for (String line : lines) {
            for (DateTokenPattern datePattern : locale.profile().datePatterns()) {
                Matcher matcher = datePattern.pattern().matcher(line);
                if (matcher.find()) {
                    String token = datePattern.wholeMatch() ? matcher.group() : matcher.group(1).replace(" ", "");
                    LOGGER.debug("Date token '{}' found in line '{}'", token, line);
                    return Optional.of(token);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the line contains anything the locale's date patterns would pick up.
     */
    static boolean looksLikeDate(String line, ReceiptLocale locale) {
        for (DateTokenPattern datePattern : locale.profile().datePatterns()) {
            if (datePattern.matchesAnywhere(line)) {
                return true;
            }
        }
        return false;
    }
}
