package io.koios.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Question plus structured details that become the generation context verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeRequest(String prompt, List<JsonNode> details, String model, Double temperature) {
    public AnalyzeRequest {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
