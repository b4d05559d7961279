package dev.pekelund.receiptscan.receiptparser.batch;

/**
 * A receipt that could not be processed as part of a batch.
 */
public record BatchFailure(String filename, String message) {
}
