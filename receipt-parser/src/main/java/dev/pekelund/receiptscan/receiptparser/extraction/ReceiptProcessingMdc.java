package dev.pekelund.receiptscan.receiptparser.extraction;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a
 * receipt is processed share the same identifiers (batch id, file, locale, stage).
 */
public final class ReceiptProcessingMdc {

    static final String KEY_BATCH_ID = "receipt.batchId";
    static final String KEY_FILE = "receipt.file";
    static final String KEY_LOCALE = "receipt.locale";
    static final String KEY_STAGE = "receipt.stage";

    private ReceiptProcessingMdc() {
        // Utility class
    }

    /**
     * Opens a context that restores the caller's MDC when closed.
     */
    public static Context open() {
        return new Context(MDC.getCopyOfContextMap());
    }

    /**
     * Opens a context on a worker thread, seeded with the MDC captured on the submitting thread.
     */
    public static Context openWith(Map<String, String> inherited) {
        Context context = new Context(MDC.getCopyOfContextMap());
        if (inherited != null) {
            MDC.setContextMap(inherited);
        }
        return context;
    }

    public static void attachBatch(String batchId) {
        putIfHasText(KEY_BATCH_ID, batchId);
    }

    public static void attachFile(String filename) {
        putIfHasText(KEY_FILE, filename);
    }

    public static void attachLocale(ReceiptLocale locale) {
        putIfHasText(KEY_LOCALE, locale != null ? locale.name() : null);
    }

    public static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
