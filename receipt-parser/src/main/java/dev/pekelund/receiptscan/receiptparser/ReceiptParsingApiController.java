package dev.pekelund.receiptscan.receiptparser;

import dev.pekelund.receiptscan.receiptparser.batch.BatchFailure;
import dev.pekelund.receiptscan.receiptparser.batch.ReceiptBatchResult;
import dev.pekelund.receiptscan.receiptparser.batch.ReceiptBatchService;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogReader;
import dev.pekelund.receiptscan.receiptparser.export.RawOcrLogWriter;
import dev.pekelund.receiptscan.receiptparser.export.ReceiptCsvWriter;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptExtraction;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptFieldExtractor;
import dev.pekelund.receiptscan.receiptparser.extraction.ReceiptLocale;
import dev.pekelund.receiptscan.receipts.CurrencyTotal;
import dev.pekelund.receiptscan.receipts.ReceiptParsingException;
import dev.pekelund.receiptscan.receipts.ReceiptRow;
import dev.pekelund.receiptscan.receipts.RecognizedReceipt;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for extracting receipt fields from OCR text. Clients post the recognised lines of one
 * or more receipts and receive the extracted rows as JSON, as a CSV export or as a raw OCR log.
 */
@RestController
@RequestMapping(path = "/api/receipts")
public class ReceiptParsingApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptParsingApiController.class);

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ReceiptFieldExtractor fieldExtractor;
    private final ReceiptBatchService batchService;
    private final ReceiptCsvWriter csvWriter;
    private final RawOcrLogWriter rawOcrLogWriter;
    private final RawOcrLogReader rawOcrLogReader;

    public ReceiptParsingApiController(ReceiptFieldExtractor fieldExtractor, ReceiptBatchService batchService,
        ReceiptCsvWriter csvWriter, RawOcrLogWriter rawOcrLogWriter, RawOcrLogReader rawOcrLogReader) {
        this.fieldExtractor = fieldExtractor;
        this.batchService = batchService;
        this.csvWriter = csvWriter;
        this.rawOcrLogWriter = rawOcrLogWriter;
        this.rawOcrLogReader = rawOcrLogReader;
    }

    @PostMapping(path = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ExtractResponse extract(@RequestBody ReceiptRequest request) {
        RecognizedReceipt receipt = toReceipt(request);
        LOGGER.info("Extracting receipt '{}' with {} lines", receipt.filename(), receipt.lines().size());
        ReceiptExtraction extraction = fieldExtractor.analyse(receipt);
        return ExtractResponse.from(extraction);
    }

    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public BatchResponse batch(@RequestBody BatchRequest request) {
        ReceiptBatchResult result = batchService.process(toReceipts(request));
        return BatchResponse.from(result);
    }

    @PostMapping(path = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export(@RequestBody BatchRequest request) {
        ReceiptBatchResult result = batchService.process(toReceipts(request));
        String csv = csvWriter.write(result.rows());
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(ReceiptCsvWriter.DEFAULT_FILENAME).build().toString())
            .contentType(TEXT_CSV)
            .body(csv);
    }

    @PostMapping(path = "/raw-log", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> rawLog(@RequestBody BatchRequest request) {
        return ResponseEntity.ok()
            .contentType(TEXT_PLAIN_UTF8)
            .body(rawOcrLogWriter.write(toReceipts(request)));
    }

    @PostMapping(path = "/replay", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public BatchResponse replay(@RequestPart("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty OCR log must be provided as the 'file' part");
        }

        List<RecognizedReceipt> logged = rawOcrLogReader.read(new String(file.getBytes(), StandardCharsets.UTF_8));
        List<RecognizedReceipt> supported = new ArrayList<>();
        List<BatchFailure> skipped = new ArrayList<>();
        for (RecognizedReceipt receipt : logged) {
            if (ReceiptBatchService.isSupportedImage(receipt.filename())) {
                supported.add(receipt);
            } else {
                skipped.add(new BatchFailure(receipt.filename(), "Unsupported file type"));
            }
        }
        LOGGER.info("Replaying OCR log '{}': {} receipts, {} skipped", file.getOriginalFilename(), supported.size(),
            skipped.size());
        return BatchResponse.from(batchService.process(supported, skipped));
    }

    @ExceptionHandler(ReceiptParsingException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleParsingException(ReceiptParsingException exception) {
        LOGGER.warn("Receipt extraction failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    private List<RecognizedReceipt> toReceipts(BatchRequest request) {
        if (request == null || request.receipts() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "A 'receipts' array must be provided");
        }
        return request.receipts().stream()
            .map(this::toReceipt)
            .toList();
    }

    private RecognizedReceipt toReceipt(ReceiptRequest request) {
        if (request == null || !StringUtils.hasText(request.filename())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Every receipt needs a 'filename'");
        }
        if (request.lines() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Receipt '" + request.filename() + "' has no 'lines' array");
        }
        return new RecognizedReceipt(request.filename().trim(), request.lines());
    }

    public record ReceiptRequest(String filename, List<String> lines) { }

    public record BatchRequest(List<ReceiptRequest> receipts) { }

    public record ExtractResponse(String filename, String vendor, String location, String date, String total,
        String currency, ReceiptLocale locale) {

        static ExtractResponse from(ReceiptExtraction extraction) {
            ReceiptRow row = ReceiptRow.fromRecord(extraction.record());
            return new ExtractResponse(row.filename(), row.vendor(), row.location(), row.date(), row.total(),
                row.currency(), extraction.locale());
        }
    }

    public record BatchResponse(String batchId, List<ReceiptRow> rows, List<CurrencyTotal> summary,
        List<BatchFailure> failures) {

        static BatchResponse from(ReceiptBatchResult result) {
            return new BatchResponse(result.batchId(), result.rows(), result.summary(), result.failures());
        }
    }
}
