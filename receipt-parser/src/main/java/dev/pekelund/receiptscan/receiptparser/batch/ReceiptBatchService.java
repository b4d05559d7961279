package dev.pekelund.receiptscan.receiptparser.batch;

import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptFieldExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptProcessingMdc;
import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.ReceiptRecord;
import dev.pekelund.receiptscan.receipts.ReceiptRow;
import dev.pekelund.receiptscan.receipts.ReceiptSummaryCalculator;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Extracts several receipts concurrently and folds the per-currency summary once every
 * extraction has finished. A receipt that fails or times out is reported and does not stop the
 * rest of the batch.
 */
public class ReceiptBatchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptBatchService.class);

    private static final List<String> SUPPORTED_IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".bmp", ".tiff");

    private final ReceiptFieldExtractor fieldExtractor;
    private final ReceiptSummaryCalculator summaryCalculator;
    private final ExecutorService executor;
    private final Duration receiptTimeout;

    public ReceiptBatchService(ReceiptFieldExtractor fieldExtractor, ReceiptSummaryCalculator summaryCalculator,
        ExecutorService executor, Duration receiptTimeout) {
        this.fieldExtractor = fieldExtractor;
        this.summaryCalculator = summaryCalculator;
        this.executor = executor;
        this.receiptTimeout = Objects.requireNonNull(receiptTimeout, "receiptTimeout");
    }

    public static boolean isSupportedImage(String filename) {
        if (filename == null) {
            return false;
        }
        String normalized = filename.trim().toLowerCase(Locale.US);
        return SUPPORTED_IMAGE_EXTENSIONS.stream().anyMatch(normalized::endsWith);
    }

    public ReceiptBatchResult process(List<RecognizedReceipt> receipts) {
        return process(receipts, List.of());
    }

    /**
     * Processes the given receipts; {@code priorFailures} are receipts rejected before extraction
     * and are reported first.
     */
    public ReceiptBatchResult process(List<RecognizedReceipt> receipts, List<BatchFailure> priorFailures) {
        String batchId = UUID.randomUUID().toString();
        List<RecognizedReceipt> pending = receipts != null ? receipts : List.of();

        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open()) {
            ReceiptProcessingMdc.attachBatch(batchId);
            LOGGER.info("Starting batch {} with {} receipts", batchId, pending.size());

            Map<String, String> callerContext = MDC.getCopyOfContextMap();
            List<Future<ReceiptRecord>> futures = new ArrayList<>(pending.size());
            for (RecognizedReceipt receipt : pending) {
                futures.add(executor.submit(() -> {
                    try (ReceiptProcessingMdc.Context workerContext = ReceiptProcessingMdc.openWith(callerContext)) {
                        return fieldExtractor.analyse(receipt).record();
                    }
                }));
            }

            List<ReceiptRecord> records = new ArrayList<>();
            List<BatchFailure> failures = new ArrayList<>(Objects.requireNonNullElse(priorFailures, List.of()));
            for (int index = 0; index < futures.size(); index++) {
                String filename = pending.get(index).filename();
                try {
                    records.add(futures.get(index).get(receiptTimeout.toMillis(), TimeUnit.MILLISECONDS));
                } catch (TimeoutException ex) {
                    futures.get(index).cancel(true);
                    LOGGER.warn("Extraction of {} timed out after {}", filename, receiptTimeout);
                    failures.add(new BatchFailure(filename, "Extraction timed out after " + receiptTimeout.toSeconds() + "s"));
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    LOGGER.error("Error extracting {}", filename, cause);
                    failures.add(new BatchFailure(filename, cause.getMessage()));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    futures.forEach(future -> future.cancel(true));
                    throw new ReceiptParsingException("Batch " + batchId + " was interrupted", ex);
                }
            }

            List<ReceiptRow> dataRows = records.stream().map(ReceiptRow::fromRecord).toList();
            ReceiptBatchResult result = new ReceiptBatchResult(batchId, records, failures,
                summaryCalculator.summarize(dataRows), summaryCalculator.appendSummary(dataRows));
            LOGGER.info("Finished batch {}: {} receipts extracted, {} failed", batchId, result.successCount(),
                result.failureCount());
            return result;
        }
    }
}
