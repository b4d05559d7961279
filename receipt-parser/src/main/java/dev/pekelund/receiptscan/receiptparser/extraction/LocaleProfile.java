package dev.pekelund.receiptscan.receiptparser.extraction;

import dev.pekelund.receiptscan.receipts.ReceiptCurrency;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword tables and patterns for one {@link ReceiptLocale}. Keywords are matched as substrings
 * of the upper-cased line, so several of them deliberately carry a leading or trailing space.
 *
 * @param classifierKeywords  words counted when guessing the receipt language
 * @param defaultCurrency     currency assumed when no symbol or code is printed
 * @param vendorSuffixes      legal-entity suffixes that identify the merchant line
 * @param vendorSkipKeywords  header words that never name the merchant
 * @param datePatterns        date-shaped tokens, in priority order
 * @param amountPattern       monetary amount with two fraction digits; group 1 holds the number
 * @param totalKeywords       labels of the amount due
 * @param cashKeywords        labels of the amount tendered
 * @param ignoreKeywords      labels of amounts that are never the total (subtotal, tax, change)
 * @param addressKeywords     street-type words
 * @param postalCodePattern   postal code
 * @param localityPattern     province code or state followed by zip
 */
public record LocaleProfile(
    List<String> classifierKeywords,
    ReceiptCurrency defaultCurrency,
    List<String> vendorSuffixes,
    List<String> vendorSkipKeywords,
    List<DateTokenPattern> datePatterns,
    Pattern amountPattern,
    List<String> totalKeywords,
    List<String> cashKeywords,
    List<String> ignoreKeywords,
    List<String> addressKeywords,
    Pattern postalCodePattern,
    Pattern localityPattern
) {

    public LocaleProfile {
        classifierKeywords = List.copyOf(classifierKeywords);
        vendorSuffixes = List.copyOf(vendorSuffixes);
        vendorSkipKeywords = List.copyOf(vendorSkipKeywords);
        datePatterns = List.copyOf(datePatterns);
        totalKeywords = List.copyOf(totalKeywords);
        cashKeywords = List.copyOf(cashKeywords);
        ignoreKeywords = List.copyOf(ignoreKeywords);
        addressKeywords = List.copyOf(addressKeywords);
    }

    static LocaleProfile italian() {
        return new LocaleProfile(
            List.of("TOTALE", "SCONTRINO", "P.IVA", "EURO", "IMPORTO", "CASSA", "SERVIZIO", "COPERTO", "VIA ",
                "PIAZZA "),
            ReceiptCurrency.EUR,
            List.of("S.P.A", "S.R.L", "SRL", "SPA", "S.N.C", "SNC"),
            List.of("DOCUMENTO", "COMMERCIALE", "SCONTRINO", "CLIENTE", "COPIA", "RT", "CASSA", "PAGAMENTO"),
            List.of(DateTokenPattern.capturing("\\b(\\d{2}\\s*[/-]\\s*\\d{2}\\s*[/-]\\s*\\d{2,4})\\b")),
            Pattern.compile("(\\d+[.,]\\d{2})(?![\"\\d.,/])"),
            List.of("TOTALE", "IMPORTO", "PAGAMENTO", "CREDIT", "AMMOUNT"),
            List.of("CONTANTI", "CONTANTE", "CASH", "VERSAMENTO"),
            List.of("SUBTOTALE", "IMPONIBILE", "RESTO"),
            List.of("VIA ", "VIALE ", "PIAZZA ", "CORSO ", "C.SO ", "VICOLO ", "LARGO ", "STRADA ", "P.ZZA ", "V. "),
            Pattern.compile("\\b\\d{5}\\b"),
            Pattern.compile("\\s\\(?([A-Z]{2})\\)?$"));
    }

    static LocaleProfile english() {
        return new LocaleProfile(
            List.of("TOTAL", "RECEIPT", "TAX", "TIPS", "GRATUITY", "CHANGE", "CASH", "SUBTOTAL", "AVE", "BLVD",
                "STREET"),
            ReceiptCurrency.USD,
            List.of("INC", "LTD", "LLC", "CORP", "INC.", "LLC."),
            List.of("RECEIPT", "GUEST", "CHECK", "TABLE", "SERVER", "ORDER", "WELCOME", "COPY", "MERCHANT"),
            List.of(
                DateTokenPattern.capturing("\\b(\\d{1,2}\\s*[/-]\\s*\\d{1,2}\\s*[/-]\\s*\\d{4})"),
                DateTokenPattern.capturing("\\b(\\d{1,2}\\s*[/-]\\s*\\d{1,2}\\s*[/-]\\s*\\d{2})\\b"),
                DateTokenPattern.wholeMatch(
                    "(?i)(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s*(\\d{1,2})[\\s.,']*(\\d{2,4})")),
            Pattern.compile("\\$?\\s*(\\d+\\.\\d{2})(?![\"\\d.,/])"),
            List.of("TOTAL", "BALANCE", "AMOUNT", "DUE", "VISA", "CHARGE", "BILL", "TOTA"),
            List.of("CASH", "TENDER", "PAID"),
            List.of("SUBTOTAL", "SUB TOTAL", "TAX", "CHANGE", "TIP", "GRATUITY"),
            List.of(" AVE", " ST", " BLVD", " BL VD", " RD", " DRIVE", " LANE", " HIGHWAY", " PKWY", " WAY"),
            Pattern.compile("\\b(?:[A-Z]{2}\\s*)?\\d{5}\\b"),
            Pattern.compile("\\b[A-Z]{2}\\s+\\d{5}"));
    }

    /**
     * Returns whether the upper-cased line contains any of the given keywords.
     */
    static boolean containsAny(String upperLine, List<String> keywords) {
        for (String keyword : keywords) {
            if (upperLine.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A date-shaped token pattern. Numeric patterns capture the token in group 1; month-name
     * patterns use the whole match because day and year are captured separately.
     */
    public record DateTokenPattern(Pattern pattern, boolean wholeMatch) {

        static DateTokenPattern capturing(String regex) {
            return new DateTokenPattern(Pattern.compile(regex), false);
        }

        static DateTokenPattern wholeMatch(String regex) {
            return new DateTokenPattern(Pattern.compile(regex), true);
        }

        public boolean matchesAnywhere(String line) {
            return pattern.matcher(line).find();
        }
    }
}
