package dev.pekelund.receiptscan.receiptparser.batch;

import dev.pekelund.receiptscan.receipts.CurrencyTotal;
import dev.pekelund.receiptscan.receipts.ReceiptRecord;
import dev.pekelund.receiptscan.receipts.ReceiptRow;
import java.util.List;

/**
 * Result of processing several receipts: the extracted records in submission order, the receipts
 * that failed, the per-currency totals and the rows ready for export.
 */
public record ReceiptBatchResult(
    String batchId,
    List<ReceiptRecord> records,
    List<BatchFailure> failures,
    List<CurrencyTotal> summary,
    List<ReceiptRow> rows
) {

    public ReceiptBatchResult {
        records = records != null ? List.copyOf(records) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        summary = summary != null ? List.copyOf(summary) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int successCount() {
        return records.size();
    }

    public int failureCount() {
        return failures.size();
    }
}
