package ch.so.arp.workbench.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Durations in milliseconds recorded for one chat request.
 */
public record TimingSample(
        @JsonProperty("retrieve_ms") double retrieveMs,
        @JsonProperty("web_ms") double webMs,
        @JsonProperty("generate_ms") double generateMs,
        @JsonProperty("total_ms") double totalMs) {

    @JsonIgnore
    public double value(TimingField field) {
        return switch (field) {
            case RETRIEVE -> retrieveMs;
            case WEB -> webMs;
            case GENERATE -> generateMs;
            case TOTAL -> totalMs;
        };
    }
}
