package dev.pekelund.receiptscan.receipts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text recognised by the OCR engine for one receipt image, top to bottom.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecognizedReceipt(
    @JsonProperty("filename") String filename,
    @JsonProperty("lines") List<String> lines
) {

    public RecognizedReceipt {
        lines = lines == null
            ? List.of()
            : lines.stream()
                .map(line -> Objects.requireNonNullElse(line, ""))
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    public boolean hasText() {
        return !lines.isEmpty();
    }
}
