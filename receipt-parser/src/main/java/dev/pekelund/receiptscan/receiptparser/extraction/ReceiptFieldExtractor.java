package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptDate;
import dev.pekelund.receiptscan.receipts.ReceiptRecord;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Runs the field extractors over the recognised text of one receipt. The language is classified
 * once; vendor, date, total with currency and location are then extracted independently from the
 * same lines.
 */
public class ReceiptFieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptFieldExtractor.class);

    private final LanguageClassifier languageClassifier;
    private final VendorExtractor vendorExtractor;
    private final DateExtractor dateExtractor;
    private final TotalExtractor totalExtractor;
    private final LocationExtractor locationExtractor;

    public ReceiptFieldExtractor(LanguageClassifier languageClassifier, VendorExtractor vendorExtractor,
        DateExtractor dateExtractor, TotalExtractor totalExtractor, LocationExtractor locationExtractor) {
        this.languageClassifier = languageClassifier;
        this.vendorExtractor = vendorExtractor;
        this.dateExtractor = dateExtractor;
        this.totalExtractor = totalExtractor;
        this.locationExtractor = locationExtractor;
    }

    public ReceiptRecord extract(List<String> lines, String filename) {
        return analyse(new RecognizedReceipt(filename, lines)).record();
    }

    public ReceiptExtraction analyse(RecognizedReceipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        String filename = receipt.filename();
        if (!StringUtils.hasText(filename)) {
            throw new IllegalArgumentException("A receipt must have a file name");
        }

        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open()) {
            ReceiptProcessingMdc.attachFile(filename);
            List<String> lines = receipt.lines();
            if (lines.isEmpty()) {
                LOGGER.info("Receipt {} has no recognised text; all fields left unresolved", filename);
                return new ReceiptExtraction(null, ReceiptRecord.unresolved(filename));
            }

            ReceiptProcessingMdc.setStage("classify");
            ReceiptLocale locale = languageClassifier.classify(lines);
            ReceiptProcessingMdc.attachLocale(locale);

            ReceiptProcessingMdc.setStage("vendor");
            String vendor = vendorExtractor.extract(lines, locale).orElse(null);

            ReceiptProcessingMdc.setStage("date");
            ReceiptDate date = dateExtractor.extract(lines, locale);

            ReceiptProcessingMdc.setStage("total");
            TotalAndCurrency totalAndCurrency = totalExtractor.extract(lines, locale);

            ReceiptProcessingMdc.setStage("location");
            String location = locationExtractor.extract(lines, locale).orElse(null);

            ReceiptRecord record = new ReceiptRecord(filename, vendor, location, date, totalAndCurrency.total(),
                totalAndCurrency.currency());
            LOGGER.info("Extracted receipt {} ({} lines, locale {}): vendor={}, date={}, total={} {}", filename,
                lines.size(), locale, vendor, date, record.total(), record.currency());
            return new ReceiptExtraction(locale, record);
        }
    }
}
