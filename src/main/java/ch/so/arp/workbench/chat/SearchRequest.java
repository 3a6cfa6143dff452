package ch.so.arp.workbench.chat;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Retrieval-only query against the vector index.
 *
 * @param filters optional metadata filter passed through to the index
 */
public record SearchRequest(
        @NotBlank String query,
        @JsonProperty("top_k") @Min(1) @Max(100) Integer topK,
        String namespace,
        Map<String, Object> filters) {
}
