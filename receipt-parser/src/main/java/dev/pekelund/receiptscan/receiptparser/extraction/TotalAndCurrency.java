package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptCurrency;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Amount paid and currency read from a receipt. The currency is always known, falling back to
 * the locale default; the total is {@code null} when no positive amount could be chosen.
 */
public record TotalAndCurrency(BigDecimal total, ReceiptCurrency currency) {

    public TotalAndCurrency {
        Objects.requireNonNull(currency, "currency");
    }

    public Optional<BigDecimal> totalValue() {
        return Optional.ofNullable(total);
    }
}
