package dev.pekelund.receiptscan.receiptparser.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.pekelund.receiptscan.receiptparser.extraction.DateExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.DateNormalizer;
import dev.pekelund.receiptscan.receiptparser.extraction.LanguageClassifier;
import dev.pekelund.receiptscan.receiptparser.extraction.LocationExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptExtraction;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptFieldExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptLocale;
import dev.pekelund.receiptscan.receiptparser.extraction.TotalExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.VendorExtractor;
import dev.pekelund.receiptscan.receipts.CurrencyTotal;
import dev.pekelund.receiptscan.receipts.ReceiptCurrency;
import dev.pekelund.receiptscan.receipts.ReceiptRecord;
import dev.pekelund.receiptscan.receipts.ReceiptRow;
import dev.pekelund.receiptscan.receipts.ReceiptSummaryCalculator;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ReceiptBatchServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-08T10:15:30Z"), ZoneOffset.UTC);

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    private final ReceiptFieldExtractor fieldExtractor = new ReceiptFieldExtractor(
        new LanguageClassifier(),
        new VendorExtractor(),
        new DateExtractor(new DateNormalizer(), FIXED),
        new TotalExtractor(),
        new LocationExtractor());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void processesReceiptsInSubmissionOrderAndSummarisesPerCurrency() {
        ReceiptBatchService service = new ReceiptBatchService(fieldExtractor, new ReceiptSummaryCalculator(), executor,
            Duration.ofSeconds(10));

        ReceiptBatchResult result = service.process(List.of(
            new RecognizedReceipt("a.jpg", List.of("BAR ROMA SRL", "23/05/23", "TOTALE", "10,00")),
            new RecognizedReceipt("b.jpg", List.of("DINER LLC", "RECEIPT", "TOTAL $4.25")),
            new RecognizedReceipt("c.jpg", List.of("PIZZERIA SNC", "TOTALE EURO 20,00"))));

        assertThat(result.batchId()).isNotBlank();
        assertThat(result.failures()).isEmpty();
        assertThat(result.records()).extracting(ReceiptRecord::filename).containsExactly("a.jpg", "b.jpg", "c.jpg");
        assertThat(result.summary()).containsExactly(
            new CurrencyTotal("EUR", new BigDecimal("30.00")),
            new CurrencyTotal("USD", new BigDecimal("4.25")));
        assertThat(result.rows()).hasSize(6);
        assertThat(result.rows().get(3)).isEqualTo(ReceiptRow.separator());
        assertThat(result.rows().get(4).vendor()).isEqualTo("TOTALE EUR");
    }

    @Test
    void failingReceiptIsReportedWithoutStoppingTheBatch() {
        ReceiptFieldExtractor failing = mock(ReceiptFieldExtractor.class);
        RecognizedReceipt good = new RecognizedReceipt("good.jpg", List.of("SHOP"));
        RecognizedReceipt bad = new RecognizedReceipt("bad.jpg", List.of("SHOP"));
        when(failing.analyse(any())).thenAnswer(invocation -> {
            RecognizedReceipt receipt = invocation.getArgument(0);
            if (receipt.filename().equals("bad.jpg")) {
                throw new IllegalStateException("OCR text unreadable");
            }
            return new ReceiptExtraction(ReceiptLocale.IT, new ReceiptRecord(receipt.filename(), "SHOP", null, null,
                new BigDecimal("2.00"), ReceiptCurrency.EUR));
        });
        ReceiptBatchService service = new ReceiptBatchService(failing, new ReceiptSummaryCalculator(), executor,
            Duration.ofSeconds(10));

        ReceiptBatchResult result = service.process(List.of(bad, good));

        assertThat(result.records()).extracting(ReceiptRecord::filename).containsExactly("good.jpg");
        assertThat(result.failures()).containsExactly(new BatchFailure("bad.jpg", "OCR text unreadable"));
        assertThat(result.hasFailures()).isTrue();
    }

    @Test
    void slowReceiptTimesOut() {
        ReceiptFieldExtractor slow = mock(ReceiptFieldExtractor.class);
        when(slow.analyse(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        });
        ReceiptBatchService service = new ReceiptBatchService(slow, new ReceiptSummaryCalculator(), executor,
            Duration.ofMillis(100));

        ReceiptBatchResult result = service.process(List.of(new RecognizedReceipt("slow.jpg", List.of("SHOP"))));

        assertThat(result.records()).isEmpty();
        assertThat(result.failures()).extracting(BatchFailure::filename).containsExactly("slow.jpg");
        assertThat(result.rows()).isEmpty();
    }

    @Test
    void priorFailuresAreReportedFirst() {
        ReceiptBatchService service = new ReceiptBatchService(fieldExtractor, new ReceiptSummaryCalculator(), executor,
            Duration.ofSeconds(10));

        ReceiptBatchResult result = service.process(List.of(), List.of(new BatchFailure("notes.txt", "Unsupported file type")));

        assertThat(result.records()).isEmpty();
        assertThat(result.failures()).extracting(BatchFailure::filename).containsExactly("notes.txt");
    }

    @Test
    void recognisesSupportedImageExtensions() {
        assertThat(ReceiptBatchService.isSupportedImage("scan.JPG")).isTrue();
        assertThat(ReceiptBatchService.isSupportedImage("scan.jpeg")).isTrue();
        assertThat(ReceiptBatchService.isSupportedImage("scan.tiff")).isTrue();
        assertThat(ReceiptBatchService.isSupportedImage("scan.pdf")).isFalse();
        assertThat(ReceiptBatchService.isSupportedImage(null)).isFalse();
    }
}
