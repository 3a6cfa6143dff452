package ch.so.arp.workbench.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Durations in milliseconds of the retrieval, web search and generation
 * stages and of the whole run.
 */
public record StageTimings(
        @JsonProperty("retrieve_ms") double retrieveMs,
        @JsonProperty("web_ms") double webMs,
        @JsonProperty("generate_ms") double generateMs,
        @JsonProperty("total_ms") double totalMs) {
}
