package dev.pekelund.receiptscan.receiptparser;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Tuning values for the extraction engine and the batch executor, resolved from the environment.
 */
public record ExtractionSettings(
    int explicitTotalLookahead,
    int blindTotalWindow,
    int vendorHeaderWindow,
    int batchParallelism,
    Duration receiptTimeout,
    ZoneId zoneId
) {

    static final int DEFAULT_EXPLICIT_TOTAL_LOOKAHEAD = 5;
    static final int DEFAULT_BLIND_TOTAL_WINDOW = 15;
    static final int DEFAULT_VENDOR_HEADER_WINDOW = 8;
    static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public ExtractionSettings {
        requirePositive("explicitTotalLookahead", explicitTotalLookahead);
        requirePositive("blindTotalWindow", blindTotalWindow);
        requirePositive("vendorHeaderWindow", vendorHeaderWindow);
        requirePositive("batchParallelism", batchParallelism);
        Objects.requireNonNull(receiptTimeout, "receiptTimeout");
        Objects.requireNonNull(zoneId, "zoneId");
        if (receiptTimeout.isZero() || receiptTimeout.isNegative()) {
            throw new IllegalStateException("receiptTimeout must be positive but was " + receiptTimeout);
        }
    }

    public static ExtractionSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), Runtime.getRuntime().availableProcessors(), ZoneId::systemDefault);
    }

    static ExtractionSettings fromEnvironment(Map<String, String> env, int availableProcessors,
        Supplier<ZoneId> defaultZoneSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultZoneSupplier, "defaultZoneSupplier");

        int lookahead = intValue(env, "RECEIPT_EXPLICIT_TOTAL_LOOKAHEAD", DEFAULT_EXPLICIT_TOTAL_LOOKAHEAD);
        int blindWindow = intValue(env, "RECEIPT_BLIND_TOTAL_WINDOW", DEFAULT_BLIND_TOTAL_WINDOW);
        int headerWindow = intValue(env, "RECEIPT_VENDOR_HEADER_WINDOW", DEFAULT_VENDOR_HEADER_WINDOW);
        int parallelism = intValue(env, "RECEIPT_BATCH_PARALLELISM", Math.max(1, availableProcessors));
        int timeoutSeconds = intValue(env, "RECEIPT_TIMEOUT_SECONDS", DEFAULT_TIMEOUT_SECONDS);

        ZoneId zoneId;
        String zone = env.get("RECEIPT_ZONE_ID");
        if (StringUtils.hasText(zone)) {
            try {
                zoneId = ZoneId.of(zone.trim());
            } catch (DateTimeException ex) {
                throw new IllegalStateException("RECEIPT_ZONE_ID is not a valid time zone: '" + zone + "'", ex);
            }
        } else {
            zoneId = defaultZoneSupplier.get();
        }

        return new ExtractionSettings(lookahead, blindWindow, headerWindow, parallelism,
            Duration.ofSeconds(timeoutSeconds), zoneId);
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be a whole number but was '%s'", name, value), ex);
        }
        if (parsed < 1) {
            throw new IllegalStateException(String.format("%s must be at least 1 but was %d", name, parsed));
        }
        return parsed;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException(name + " must be at least 1 but was " + value);
        }
    }
}
