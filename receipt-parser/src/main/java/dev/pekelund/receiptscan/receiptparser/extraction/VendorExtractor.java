package dev.pekelund.receiptscan.receiptparser.extraction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the merchant name from the top of a receipt.
 */
public class VendorExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(VendorExtractor.class);

    static final int DEFAULT_HEADER_WINDOW = 8;

    private static final int MIN_LENGTH = 3;

    private final int headerWindow;

    public VendorExtractor() {
        this(DEFAULT_HEADER_WINDOW);
    }

    public VendorExtractor(int headerWindow) {
        if (headerWindow < 1) {
            throw new IllegalArgumentException("headerWindow must be positive");
        }
        this.headerWindow = headerWindow;
    }

    /**
     * Prefers a header line carrying a legal-entity suffix (S.R.L., INC, ...). Without one, the
     * first line with letters that is not a generic header (receipt title, copy marker, ...) wins.
     */
    public Optional<String> extract(List<String> lines, ReceiptLocale locale) {
        LocaleProfile profile = locale.profile();

        for (String line : lines.subList(0, Math.min(headerWindow, lines.size()))) {
            String candidate = line.strip();
            if (candidate.length() < MIN_LENGTH) {
                continue;
            }
            if (LocaleProfile.containsAny(candidate.toUpperCase(Locale.US), profile.vendorSuffixes())) {
                LOGGER.debug("Vendor '{}' identified by corporate suffix", candidate);
                return Optional.of(candidate);
            }
        }

        for (String line : lines) {
            String candidate = line.strip();
            if (candidate.length() < MIN_LENGTH || !hasLetter(candidate)) {
                continue;
            }
            if (LocaleProfile.containsAny(candidate.toUpperCase(Locale.US), profile.vendorSkipKeywords())) {
                continue;
            }
            LOGGER.debug("Vendor '{}' taken from first prominent line", candidate);
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private boolean hasLetter(String value) {
        return value.codePoints().anyMatch(Character::isLetter);
    }
}
