package ch.so.arp.workbench.metrics;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-field timing aggregates keyed by {@link TimingField#key()}. Averages
 * cover every sample since start-up, percentiles only the buffered ones.
 */
public record TimingStatistics(
        @JsonProperty("average_ms") Map<String, Double> averageMs,
        @JsonProperty("p50_ms") Map<String, Double> p50Ms,
        @JsonProperty("p95_ms") Map<String, Double> p95Ms) {

    public TimingStatistics {
        averageMs = Map.copyOf(averageMs);
        p50Ms = Map.copyOf(p50Ms);
        p95Ms = Map.copyOf(p95Ms);
    }
}
