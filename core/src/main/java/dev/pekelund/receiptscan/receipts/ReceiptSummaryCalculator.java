package dev.pekelund.receiptscan.receipts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds extracted receipts into the per-currency totals appended below the exported rows.
 */
public class ReceiptSummaryCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptSummaryCalculator.class);

    /**
     * Sums the totals of the given data rows per currency, in the order currencies are first seen.
     * Rows without a currency are left out; totals that are not numbers count as zero.
     */
    public List<CurrencyTotal> summarize(List<ReceiptRow> rows) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        for (ReceiptRow row : Objects.requireNonNullElse(rows, List.<ReceiptRow>of())) {
            String currency = row.currency();
            if (currency.isBlank() || ReceiptRowConstants.NULL_VALUE.equals(currency)) {
                continue;
            }
            sums.merge(currency, parseTotal(row), BigDecimal::add);
        }
        return sums.entrySet().stream()
            .map(entry -> new CurrencyTotal(entry.getKey(), entry.getValue()))
            .toList();
    }

    /**
     * Builds the complete export: one row per record in the given order, then, when there is at
     * least one record, an empty separator row and one summary row per currency.
     */
    public List<ReceiptRow> toExportRows(List<ReceiptRecord> records) {
        List<ReceiptRow> dataRows = Objects.requireNonNullElse(records, List.<ReceiptRecord>of()).stream()
            .map(ReceiptRow::fromRecord)
            .toList();
        return appendSummary(dataRows);
    }

    public List<ReceiptRow> appendSummary(List<ReceiptRow> dataRows) {
        if (dataRows == null || dataRows.isEmpty()) {
            return List.of();
        }
        List<ReceiptRow> rows = new ArrayList<>(dataRows);
        rows.add(ReceiptRow.separator());
        summarize(dataRows).stream()
            .map(ReceiptRow::summary)
            .forEach(rows::add);
        return List.copyOf(rows);
    }

    private BigDecimal parseTotal(ReceiptRow row) {
        String total = row.total();
        if (total.isBlank() || ReceiptRowConstants.NULL_VALUE.equals(total)) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(total.trim());
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring non-numeric total '{}' for {}", total, row.filename());
            return BigDecimal.ZERO;
        }
    }
}
