package dev.pekelund.receiptscan.receiptparser.extraction;

import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guesses whether a receipt is Italian or English/US by counting locale keywords.
 */
public class LanguageClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageClassifier.class);

    /**
     * Every keyword found in a line scores one point for its locale. English wins only with a
     * strictly higher score; ties, including receipts without any keyword, are read as Italian.
     */
    public ReceiptLocale classify(List<String> lines) {
        int italianScore = 0;
        int englishScore = 0;
        for (String line : lines) {
            String upper = line.strip().toUpperCase(Locale.US);
            italianScore += countKeywords(upper, ReceiptLocale.IT.profile().classifierKeywords());
            englishScore += countKeywords(upper, ReceiptLocale.EN.profile().classifierKeywords());
        }
        ReceiptLocale locale = englishScore > italianScore ? ReceiptLocale.EN : ReceiptLocale.IT;
        LOGGER.debug("Classified receipt as {} (IT score {}, EN score {})", locale, italianScore, englishScore);
        return locale;
    }

    private int countKeywords(String upperLine, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (upperLine.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }
}
