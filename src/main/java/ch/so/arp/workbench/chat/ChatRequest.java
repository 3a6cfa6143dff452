package ch.so.arp.workbench.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.workbench.client.ChatMessage;
import ch.so.arp.workbench.pipeline.PipelineRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests. Omitted optional fields fall back to the
 * configured pipeline defaults.
 */
public record ChatRequest(
        @NotBlank String query,
        String namespace,
        @JsonProperty("top_k") @Min(1) @Max(100) Integer topK,
        @JsonProperty("min_score") @DecimalMin("0.0") @DecimalMax("1.0") Double minScore,
        @JsonProperty("use_web_fallback") Boolean useWebFallback,
        @JsonProperty("max_web_results") @Min(1) @Max(20) Integer maxWebResults,
        @JsonProperty("chat_history") List<ChatMessage> chatHistory) {

    public PipelineRequest toPipelineRequest() {
        return new PipelineRequest(query, namespace, topK, minScore, useWebFallback == null || useWebFallback,
                maxWebResults, chatHistory);
    }
}
