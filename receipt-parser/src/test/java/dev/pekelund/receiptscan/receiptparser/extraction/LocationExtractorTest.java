package dev.pekelund.receiptscan.receiptparser.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.receiptscan.receiptparser.extraction.LocationExtractor.ScoredLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class LocationExtractorTest {

    private final LocationExtractor extractor = new LocationExtractor();

    @Test
    void mergesStreetAndPostalLines() {
        List<String> lines = List.of("ACME S.P.A", "VIA ROMA 10", "20100 MILANO (MI)", "23/05/23", "TOTALE", "12,50");

        assertThat(extractor.scoreLines(lines, ReceiptLocale.IT)).containsExactly(
            new ScoredLine(1, "VIA ROMA 10", 5),
            new ScoredLine(2, "20100 MILANO (MI)", 10));
        assertThat(extractor.extract(lines, ReceiptLocale.IT)).contains("VIA ROMA 10 20100 MILANO (MI)");
    }

    @Test
    void scoresEnglishStateAndZip() {
        List<String> lines = List.of("DINER LLC", "123 OCEAN AVE", "SPRINGFIELD, IL 62704", "TOTAL 12.00");

        assertThat(extractor.extract(lines, ReceiptLocale.EN)).contains("123 OCEAN AVE SPRINGFIELD, IL 62704");
    }

    @Test
    void phoneAndTaxLinesAreDisqualified() {
        List<String> lines = List.of("SHOP", "TEL 02 12345", "P.IVA 12345678901", "CORSO COMO 5");

        assertThat(extractor.extract(lines, ReceiptLocale.IT)).contains("CORSO COMO 5");
    }

    @Test
    void dateLinesAreNeverAddresses() {
        assertThat(extractor.scoreLines(List.of("12/05/2023 20100"), ReceiptLocale.IT)).isEmpty();
    }

    @Test
    void mergingIsPairwiseOnly() {
        List<ScoredLine> merged = extractor.mergeAdjacent(List.of(
            new ScoredLine(0, "A", 5),
            new ScoredLine(1, "B", 5),
            new ScoredLine(2, "C", 6),
            new ScoredLine(4, "D", 4)));

        assertThat(merged).containsExactly(
            new ScoredLine(0, "A B", 15),
            new ScoredLine(2, "C", 6),
            new ScoredLine(4, "D", 4));
    }

    @Test
    void firstCandidateWinsTies() {
        List<String> lines = List.of("VIA ROMA 1", "SHOP", "VIA MILANO 2");

        assertThat(extractor.extract(lines, ReceiptLocale.IT)).contains("VIA ROMA 1");
    }

    @Test
    void returnsEmptyWithoutAddressLines() {
        assertThat(extractor.extract(List.of("SHOP", "TOTALE 3,00"), ReceiptLocale.IT)).isEmpty();
    }
}
