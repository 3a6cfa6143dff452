package ch.so.arp.workbench.metrics;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.workbench.cache.CacheStats;

/**
 * Immutable, consistent copy of all in-memory metrics.
 *
 * @param requestsByPath request counter per logical path
 * @param errorsByPath   error counter per logical path
 * @param timings        averages and percentiles per timing field
 * @param cache          hit/miss counters per cache name
 * @param sampleCount    number of timing samples recorded since start-up
 * @param samples        the most recent samples, oldest first
 */
public record MetricsSnapshot(
        @JsonProperty("requests_by_path") Map<String, Long> requestsByPath,
        @JsonProperty("errors_by_path") Map<String, Long> errorsByPath,
        TimingStatistics timings,
        Map<String, CacheStats> cache,
        @JsonProperty("sample_count") long sampleCount,
        List<TimingSample> samples) {

    public MetricsSnapshot {
        requestsByPath = Map.copyOf(requestsByPath);
        errorsByPath = Map.copyOf(errorsByPath);
        cache = Map.copyOf(cache);
        samples = List.copyOf(samples);
    }
}
