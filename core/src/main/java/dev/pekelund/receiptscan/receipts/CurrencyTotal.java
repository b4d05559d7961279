package dev.pekelund.receiptscan.receipts;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Sum of all receipt totals sharing one currency.
 */
public record CurrencyTotal(String currency, BigDecimal total) {

    public CurrencyTotal {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency must not be blank");
        }
        total = total == null ? BigDecimal.ZERO.setScale(2) : total.setScale(2, RoundingMode.HALF_UP);
    }
}
