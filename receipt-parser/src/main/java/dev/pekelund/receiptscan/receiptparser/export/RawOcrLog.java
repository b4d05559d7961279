package dev.pekelund.receiptscan.receiptparser.export;

/**
 * Markers of the plain-text log that keeps the recognised lines of every scanned receipt.
 */
final class RawOcrLog {

    static final String TITLE = "=== OCR RAW DATA LOG ===";
    static final String START_PREFIX = "--- START ";
    static final String END_PREFIX = "--- END ";
    static final String MARKER_SUFFIX = " ---";

    private RawOcrLog() {
    }

    static String start(String filename) {
        return START_PREFIX + filename + MARKER_SUFFIX;
    }

    static String end(String filename) {
        return END_PREFIX + filename + MARKER_SUFFIX;
    }

    /**
     * File name carried by a marker line with the given prefix, or {@code null} when the line is
     * not such a marker.
     */
    static String markerFilename(String line, String prefix) {
        if (!line.startsWith(prefix) || !line.endsWith(MARKER_SUFFIX)
            || line.length() <= prefix.length() + MARKER_SUFFIX.length()) {
            return null;
        }
        return line.substring(prefix.length(), line.length() - MARKER_SUFFIX.length());
    }

    static boolean isMarker(String line) {
        return markerFilename(line, START_PREFIX) != null || markerFilename(line, END_PREFIX) != null;
    }

    static boolean hasLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }
}
