package dev.pekelund.receiptscan.receiptparser.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores lines for how much they look like an address and returns the best one, joined with
 * its neighbour when both score.
 */
public class LocationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocationExtractor.class);

    private static final int ADDRESS_KEYWORD_SCORE = 5;
    private static final int POSTAL_CODE_SCORE = 6;
    private static final int LOCALITY_SCORE = 4;
    private static final int DISQUALIFIED_PENALTY = -20;
    private static final int ADJACENCY_BONUS = 5;

    // Phone, tax id, order and payment-card lines often carry five-digit numbers.
    private static final List<String> DISQUALIFYING_TOKENS = List.of(
        "TEL", "FAX", "TAX", "VAT", "ORDER", "TABLE", "GUEST", "ID", "OP:", "CASSA:", "IBAN", "N.CARTA", "CARD", "ACCT");

    public Optional<String> extract(List<String> lines, ReceiptLocale locale) {
        List<ScoredLine> scored = scoreLines(lines, locale);
        if (scored.isEmpty()) {
            return Optional.empty();
        }

        ScoredLine best = null;
        for (ScoredLine candidate : mergeAdjacent(scored)) {
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }
        LOGGER.debug("Location '{}' chosen with score {}", best.text(), best.score());
        return Optional.of(best.text());
    }

    List<ScoredLine> scoreLines(List<String> lines, ReceiptLocale locale) {
        LocaleProfile profile = locale.profile();
        List<ScoredLine> scored = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            if (DateExtractor.looksLikeDate(line, locale)) {
                continue;
            }
            String text = line.strip();
            String upper = text.toUpperCase(Locale.US);

            int score = 0;
            if (LocaleProfile.containsAny(upper, profile.addressKeywords())) {
                score += ADDRESS_KEYWORD_SCORE;
            }
            if (profile.postalCodePattern().matcher(text).find()) {
                score += POSTAL_CODE_SCORE;
            }
            if (profile.localityPattern().matcher(text).find()) {
                score += LOCALITY_SCORE;
            }
            if (LocaleProfile.containsAny(upper, DISQUALIFYING_TOKENS)) {
                score += DISQUALIFIED_PENALTY;
            }
            if (score > 0) {
                scored.add(new ScoredLine(index, text, score));
            }
        }
        return scored;
    }

    /**
     * Joins each candidate with the next one when they sit on consecutive lines. Merging is
     * pairwise: a joined pair is never extended with a third line.
     */
    List<ScoredLine> mergeAdjacent(List<ScoredLine> scored) {
        List<ScoredLine> merged = new ArrayList<>();
        int position = 0;
        while (position < scored.size()) {
            ScoredLine current = scored.get(position);
            if (position + 1 < scored.size() && scored.get(position + 1).index() == current.index() + 1) {
                ScoredLine next = scored.get(position + 1);
                merged.add(new ScoredLine(current.index(), current.text() + " " + next.text(),
                    current.score() + next.score() + ADJACENCY_BONUS));
                position += 2;
            } else {
                merged.add(current);
                position++;
            }
        }
        return merged;
    }

    record ScoredLine(int index, String text, int score) { }
}
