package dev.pekelund.receiptscan.receipts;

import java.util.List;

/**
 * Shared constants describing the exported receipt row layout. The same values must be used by
 * the extraction service and by anything that reads the exported sheets back.
 */
public final class ReceiptRowConstants {

    /**
     * Marker written for a field the extraction engine could not resolve.
     */
    public static final String NULL_VALUE = "null";

    /**
     * Prefix of the vendor cell on per-currency summary rows, followed by the currency code.
     */
    public static final String SUMMARY_LABEL_PREFIX = "TOTALE ";

    /**
     * Canonical date layout used for every resolved receipt date.
     */
    public static final String DATE_PATTERN = "dd/MM/yyyy";

    /**
     * Column order of exported rows.
     */
    public static final List<String> COLUMNS = List.of("filename", "vendor", "location", "date", "total", "currency");

    private ReceiptRowConstants() {
    }
}
