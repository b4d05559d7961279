package dev.pekelund.receiptscan.receipts;

/**
 * Currencies the extraction engine can attribute to a receipt.
 */
public enum ReceiptCurrency {
    EUR,
    USD
}
