package dev.pekelund.receiptscan.receiptparser;

import dev.pekelund.receiptscan.receiptparser.batch.ReceiptBatchService;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogReader;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogWriter;
import dev.pekelund.receiptscan.receiptparser.export.ReceiptCsvWriter;
import dev.pekelund.receiptscan.receiptparser.extraction.DateExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.DateNormalizer;
import dev.pekelund.receiptscan.receiptparser.extraction.LanguageClassifier;
import dev.pekelund.receiptscan.receiptparser.extraction.LocationExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptFieldExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.TotalExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.VendorExtractor;
import dev.pekelund.receiptscan.receipts.ReceiptSummaryCalculator;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the extraction engine, the batch executor and the export codecs.
 */
@Configuration
public class ReceiptProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptProcessingConfiguration.class);

    @Bean
    public ExtractionSettings extractionSettings() {
        return ExtractionSettings.fromEnvironment();
    }

    @Bean
    public Clock receiptClock(ExtractionSettings extractionSettings) {
        return Clock.system(extractionSettings.zoneId());
    }

    @Bean
    public ReceiptFieldExtractor receiptFieldExtractor(ExtractionSettings extractionSettings, Clock receiptClock) {
        return new ReceiptFieldExtractor(
            new LanguageClassifier(),
            new VendorExtractor(extractionSettings.vendorHeaderWindow()),
            new DateExtractor(new DateNormalizer(), receiptClock),
            new TotalExtractor(extractionSettings.explicitTotalLookahead(), extractionSettings.blindTotalWindow()),
            new LocationExtractor());
    }

    @Bean
    public ReceiptSummaryCalculator receiptSummaryCalculator() {
        return new ReceiptSummaryCalculator();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService receiptExtractionExecutor(ExtractionSettings extractionSettings) {
        LOGGER.info("Starting receipt extraction pool with {} threads", extractionSettings.batchParallelism());
        return Executors.newFixedThreadPool(extractionSettings.batchParallelism(),
            new CustomizableThreadFactory("receipt-extract-"));
    }

    @Bean
    public ReceiptBatchService receiptBatchService(ReceiptFieldExtractor receiptFieldExtractor,
        ReceiptSummaryCalculator receiptSummaryCalculator, ExecutorService receiptExtractionExecutor,
        ExtractionSettings extractionSettings) {
        return new ReceiptBatchService(receiptFieldExtractor, receiptSummaryCalculator, receiptExtractionExecutor,
            extractionSettings.receiptTimeout());
    }

    @Bean
    public ReceiptCsvWriter receiptCsvWriter() {
        return new ReceiptCsvWriter();
    }

    @Bean
    public RawOcrLogWriter rawOcrLogWriter() {
        return new RawOcrLogWriter();
    }

    @Bean
    public RawOcrLogReader rawOcrLogReader() {
        return new RawOcrLogReader();
    }
}
