package dev.pekelund.receiptscan.receipts;

/**
 * Signals input that cannot be turned into receipt records, such as a request without a file
 * name or a malformed OCR log.
 */
public class ReceiptParsingException extends RuntimeException {

    public ReceiptParsingException(String message) {
        super(message);
    }

    public ReceiptParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
