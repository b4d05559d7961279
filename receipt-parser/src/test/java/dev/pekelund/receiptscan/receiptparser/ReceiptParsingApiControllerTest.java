package dev.pekelund.receiptscan.receiptparser;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.receiptscan.receiptparser.batch.ReceiptBatchService;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogReader;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogWriter;
import dev.pekelund.receiptscan.receiptparser.export.ReceiptCsvWriter;
import dev.pekelund.receiptscan.receiptparser.extraction.DateExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.DateNormalizer;
import dev.pekelund.receiptscan.receiptparser.extraction.LanguageClassifier;
import dev.pekelund.receiptscan.receiptparser.extraction.LocationExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptFieldExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.TotalExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.VendorExtractor;
import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.ReceiptSummaryCalculator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ReceiptParsingApiControllerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-08T10:15:30Z"), ZoneOffset.UTC);

    private static final String ITALIAN_RECEIPT = """
        {"filename": "scontrino.jpg",
         "lines": ["ACME S.P.A", "VIA ROMA 10", "20100 MILANO (MI)", "23/05/23", "TOTALE", "12,50"]}
        """;

    private static final String BATCH = """
        {"receipts": [
          {"filename": "a.jpg", "lines": ["BAR ROMA SRL", "TOTALE", "10,00"]},
          {"filename": "b.jpg", "lines": ["DINER LLC", "RECEIPT", "TOTAL $4.25"]}
        ]}
        """;

    @Mock
    private ReceiptBatchService failingBatchService;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    private ReceiptFieldExtractor fieldExtractor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fieldExtractor = new ReceiptFieldExtractor(new LanguageClassifier(), new VendorExtractor(),
            new DateExtractor(new DateNormalizer(), FIXED), new TotalExtractor(), new LocationExtractor());
        ReceiptBatchService batchService = new ReceiptBatchService(fieldExtractor, new ReceiptSummaryCalculator(),
            executor, Duration.ofSeconds(10));
        mockMvc = MockMvcBuilders.standaloneSetup(controllerWith(batchService)).build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void extractsSingleReceipt() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ITALIAN_RECEIPT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.filename").value("scontrino.jpg"))
            .andExpect(jsonPath("$.vendor").value("ACME S.P.A"))
            .andExpect(jsonPath("$.location").value("VIA ROMA 10 20100 MILANO (MI)"))
            .andExpect(jsonPath("$.date").value("23/05/2023"))
            .andExpect(jsonPath("$.total").value("12.50"))
            .andExpect(jsonPath("$.currency").value("EUR"))
            .andExpect(jsonPath("$.locale").value("IT"));
    }

    @Test
    void rejectsReceiptWithoutFilename() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\": \" \", \"lines\": [\"SHOP\"]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsReceiptWithoutLines() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\": \"a.jpg\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void processesBatchWithSummaryRows() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BATCH))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows.length()").value(5))
            .andExpect(jsonPath("$.rows[0].total").value("10.00"))
            .andExpect(jsonPath("$.rows[1].currency").value("USD"))
            .andExpect(jsonPath("$.rows[2].filename").value(""))
            .andExpect(jsonPath("$.rows[3].vendor").value("TOTALE EUR"))
            .andExpect(jsonPath("$.rows[4].vendor").value("TOTALE USD"))
            .andExpect(jsonPath("$.failures").isEmpty());
    }

    @Test
    void rejectsBatchWithoutReceipts() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void exportsBatchAsCsvAttachment() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BATCH))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", "attachment; filename=\"receipts_data.csv\""))
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(content().string(startsWith(
                "filename,vendor,location,date,total,currency\n")));
    }

    @Test
    void rendersRawOcrLog() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/raw-log")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BATCH))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string(containsString("--- START b.jpg ---\nDINER LLC\n")));
    }

    @Test
    void refusesRawLogForLinesThatLookLikeMarkers() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/receipts/raw-log")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"receipts\": [{\"filename\": \"a.jpg\", \"lines\": [\"--- END a.jpg ---\"]}]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value(containsString("block marker")));
    }

    @Test
    void replaysSavedLogAndSkipsUnsupportedFiles() throws Exception {
        byte[] log = getClass().getResourceAsStream("/receipts/sample-ocr-log.txt").readAllBytes();
        MockMultipartFile file = new MockMultipartFile("file", "ocr_raw.txt", "text/plain", log);

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/replay").file(file))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows[0].filename").value("scontrino_bar.jpg"))
            .andExpect(jsonPath("$.rows[0].vendor").value("BAR CENTRALE S.N.C."))
            .andExpect(jsonPath("$.rows[0].date").value("02/10/2023"))
            .andExpect(jsonPath("$.rows[0].total").value("4.20"))
            .andExpect(jsonPath("$.rows[1].filename").value("diner.png"))
            .andExpect(jsonPath("$.rows[1].total").value("13.50"))
            .andExpect(jsonPath("$.failures[0].filename").value("notes.txt"))
            .andExpect(jsonPath("$.failures[0].message").value("Unsupported file type"));
    }

    @Test
    void rejectsMalformedLog() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ocr_raw.txt", "text/plain",
            "--- START a.jpg ---\nSHOP\n".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/replay").file(file))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("OCR log ends inside the block of a.jpg"));
    }

    @Test
    void mapsParsingFailuresToUnprocessableEntity() throws Exception {
        when(failingBatchService.process(anyList())).thenThrow(new ReceiptParsingException("Batch was interrupted"));
        MockMvc failingMvc = MockMvcBuilders.standaloneSetup(controllerWith(failingBatchService)).build();

        failingMvc.perform(MockMvcRequestBuilders.post("/api/receipts/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BATCH))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Batch was interrupted"));
    }

    private ReceiptParsingApiController controllerWith(ReceiptBatchService batchService) {
        return new ReceiptParsingApiController(fieldExtractor, batchService, new ReceiptCsvWriter(),
            new RawOcrLogWriter(), new RawOcrLogReader());
    }
}
