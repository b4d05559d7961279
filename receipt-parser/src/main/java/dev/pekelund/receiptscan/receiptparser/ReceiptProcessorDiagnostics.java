package dev.pekelund.receiptscan.receiptparser;

import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the resolved extraction settings when the service boots.
 */
@Component
public class ReceiptProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptProcessorDiagnostics.class);

    private final Environment environment;
    private final ExtractionSettings extractionSettings;

    public ReceiptProcessorDiagnostics(Environment environment, ExtractionSettings extractionSettings) {
        this.environment = environment;
        this.extractionSettings = extractionSettings;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt scanner diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Total lookahead: {} lines, blind total window: {} lines, vendor header window: {} lines",
            extractionSettings.explicitTotalLookahead(), extractionSettings.blindTotalWindow(),
            extractionSettings.vendorHeaderWindow());
        LOGGER.info("Batch parallelism: {}, per-receipt timeout: {}, zone: {}", extractionSettings.batchParallelism(),
            extractionSettings.receiptTimeout(), extractionSettings.zoneId());
    }
}
