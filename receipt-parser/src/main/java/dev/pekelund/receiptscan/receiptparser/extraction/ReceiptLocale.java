package dev.pekelund.receiptscan.receiptparser.extraction;

/**
 * Receipt conventions the engine knows about. Each locale carries the vocabulary and patterns
 * used to read receipts printed under it.
 */
public enum ReceiptLocale {
    IT(LocaleProfile.italian()),
    EN(LocaleProfile.english());

    private final LocaleProfile profile;

    ReceiptLocale(LocaleProfile profile) {
        this.profile = profile;
    }

    public LocaleProfile profile() {
        return profile;
    }
}
