package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptCurrency;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the amount paid and its currency.
 *
 * <p>Two strategies collect candidates independently. The explicit strategy reads the amounts
 * printed on, and shortly after, a line labelled as the total. The blind strategy reads every
 * amount near the bottom of the receipt. Amounts on tender lines (cash, paid) are kept apart and
 * only used to cap blind candidates, because the total can never exceed what the customer
 * handed over. Subtotal, tax and change lines never contribute.
 */
public class TotalExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TotalExtractor.class);

    static final int DEFAULT_EXPLICIT_LOOKAHEAD = 5;
    static final int DEFAULT_BLIND_WINDOW = 15;

    private static final BigDecimal CASH_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal EARLIEST_YEAR = new BigDecimal("1900");
    private static final BigDecimal LATEST_YEAR = new BigDecimal("2100");

    private final int explicitLookahead;
    private final int blindWindow;

    public TotalExtractor() {
        this(DEFAULT_EXPLICIT_LOOKAHEAD, DEFAULT_BLIND_WINDOW);
    }

    /**
     * @param explicitLookahead number of lines, starting with the labelled one, read after a total keyword
     * @param blindWindow       number of trailing lines read by the blind strategy
     */
    public TotalExtractor(int explicitLookahead, int blindWindow) {
        if (explicitLookahead < 1 || blindWindow < 1) {
            throw new IllegalArgumentException("explicitLookahead and blindWindow must be positive");
        }
        this.explicitLookahead = explicitLookahead;
        this.blindWindow = blindWindow;
    }

    public TotalAndCurrency extract(List<String> lines, ReceiptLocale locale) {
        ReceiptCurrency currency = detectCurrency(lines, locale);
        LocaleProfile profile = locale.profile();

        List<BigDecimal> explicitTotals = new ArrayList<>();
        List<BigDecimal> blindTotals = new ArrayList<>();
        List<BigDecimal> cashCandidates = new ArrayList<>();

        for (int index = 0; index < lines.size(); index++) {
            String upper = lines.get(index).strip().toUpperCase(Locale.US);
            if (LocaleProfile.containsAny(upper, profile.cashKeywords())) {
                cashCandidates.addAll(amountsOn(lines.get(index), locale));
                if (index + 1 < lines.size()) {
                    cashCandidates.addAll(amountsOn(lines.get(index + 1), locale));
                }
                continue;
            }
            if (LocaleProfile.containsAny(upper, profile.ignoreKeywords())) {
                continue;
            }
            if (LocaleProfile.containsAny(upper, profile.totalKeywords())) {
                int end = Math.min(index + explicitLookahead, lines.size());
                for (int offset = index; offset < end; offset++) {
                    explicitTotals.addAll(amountsOn(lines.get(offset), locale));
                }
            }
        }

        for (String line : lines.subList(Math.max(0, lines.size() - blindWindow), lines.size())) {
            List<BigDecimal> amounts = amountsOn(line, locale);
            if (amounts.isEmpty()) {
                continue;
            }
            String upper = line.strip().toUpperCase(Locale.US);
            if (LocaleProfile.containsAny(upper, profile.cashKeywords())) {
                cashCandidates.addAll(amounts);
            } else if (!LocaleProfile.containsAny(upper, profile.ignoreKeywords())) {
                blindTotals.addAll(amounts);
            }
        }

        BigDecimal total = resolve(explicitTotals, blindTotals, cashCandidates)
            .filter(value -> value.signum() > 0)
            .orElse(null);
        LOGGER.debug("Resolved total {} {} from {} explicit, {} blind and {} cash candidates", total, currency,
            explicitTotals.size(), blindTotals.size(), cashCandidates.size());
        return new TotalAndCurrency(total, currency);
    }

    /**
     * The first line mentioning the euro (sign or code) or the dollar (sign or code) decides the
     * currency; without any, the locale default applies.
     */
    ReceiptCurrency detectCurrency(List<String> lines, ReceiptLocale locale) {
        for (String line : lines) {
            String upper = line.toUpperCase(Locale.US);
            if (line.contains("€") || upper.contains("EUR")) {
                return ReceiptCurrency.EUR;
            }
            if (line.contains("$") || upper.contains("USD")) {
                return ReceiptCurrency.USD;
            }
        }
        return locale.profile().defaultCurrency();
    }

    /**
     * Monetary amounts printed on a line. Lines with a percent sign carry rates, not amounts, and
     * whole numbers that look like years are skipped.
     */
    List<BigDecimal> amountsOn(String line, ReceiptLocale locale) {
        if (line.contains("%")) {
            return List.of();
        }
        List<BigDecimal> amounts = new ArrayList<>();
        Matcher matcher = locale.profile().amountPattern().matcher(line);
        while (matcher.find()) {
            BigDecimal amount = new BigDecimal(matcher.group(1).replace(',', '.'));
            if (looksLikeYear(amount)) {
                continue;
            }
            amounts.add(amount);
        }
        return amounts;
    }

    private Optional<BigDecimal> resolve(List<BigDecimal> explicitTotals, List<BigDecimal> blindTotals,
        List<BigDecimal> cashCandidates) {

        if (!explicitTotals.isEmpty()) {
            return max(explicitTotals);
        }

        Optional<BigDecimal> maxCash = max(cashCandidates);
        if (!blindTotals.isEmpty()) {
            if (maxCash.isEmpty()) {
                return max(blindTotals);
            }
            BigDecimal cap = maxCash.get().add(CASH_TOLERANCE);
            List<BigDecimal> withinCash = blindTotals.stream()
                .filter(value -> value.compareTo(cap) <= 0)
                .toList();
            return max(withinCash).or(() -> max(blindTotals));
        }
        return maxCash;
    }

    private static Optional<BigDecimal> max(Collection<BigDecimal> values) {
        return values.stream().max(Comparator.naturalOrder());
    }

    private static boolean looksLikeYear(BigDecimal amount) {
        boolean integral = amount.stripTrailingZeros().scale() <= 0;
        return integral && amount.compareTo(EARLIEST_YEAR) > 0 && amount.compareTo(LATEST_YEAR) < 0;
    }
}
