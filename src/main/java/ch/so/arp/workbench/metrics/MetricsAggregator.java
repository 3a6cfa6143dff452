package ch.so.arp.workbench.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.workbench.cache.CacheStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Process-wide request counters and chat timing statistics.
 * <p>
 * Mutations happen under a single lock. The most recent samples are kept in a
 * fixed size ring buffer for percentiles, while running sums track every
 * sample ever recorded for the averages. Counters and timers are mirrored to a
 * Micrometer {@link MeterRegistry} for export.
 */
public class MetricsAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsAggregator.class);

    public static final int DEFAULT_BUFFER_SIZE = 20;

    private static final String METRIC_PREFIX = "rag";

    private final int bufferSize;
    private final Supplier<Map<String, CacheStats>> cacheStats;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> requestCounts = new HashMap<>();
    private final Map<String, Long> errorCounts = new HashMap<>();
    private final ArrayDeque<TimingSample> samples;
    private final EnumMap<TimingField, Double> sums = new EnumMap<>(TimingField.class);
    private long sampleCount;

    public MetricsAggregator(int bufferSize, Supplier<Map<String, CacheStats>> cacheStats,
            MeterRegistry meterRegistry) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.bufferSize = bufferSize;
        this.cacheStats = Objects.requireNonNull(cacheStats, "cacheStats");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.samples = new ArrayDeque<>(bufferSize);
        resetSums();
    }

    public void recordRequest(String path, boolean error) {
        Objects.requireNonNull(path, "path");
        lock.lock();
        try {
            requestCounts.merge(path, 1L, Long::sum);
            if (error) {
                errorCounts.merge(path, 1L, Long::sum);
            }
        } finally {
            lock.unlock();
        }
        counter("requests", path).increment();
        if (error) {
            counter("errors", path).increment();
        }
    }

    public void recordTiming(TimingSample sample) {
        Objects.requireNonNull(sample, "sample");
        lock.lock();
        try {
            if (samples.size() == bufferSize) {
                samples.removeFirst();
            }
            samples.addLast(sample);
            for (TimingField field : TimingField.values()) {
                sums.merge(field, sample.value(field), Double::sum);
            }
            sampleCount++;
        } finally {
            lock.unlock();
        }
        for (TimingField field : TimingField.values()) {
            Timer.builder(METRIC_PREFIX + ".chat.stage")
                    .tag("stage", field.stage())
                    .description("Duration of a chat pipeline stage")
                    .register(meterRegistry)
                    .record(Math.round(sample.value(field) * 1000.0d), TimeUnit.MICROSECONDS);
        }
    }

    public MetricsSnapshot snapshot() {
        Map<String, Long> requests;
        Map<String, Long> errors;
        List<TimingSample> buffered;
        EnumMap<TimingField, Double> sumsCopy;
        long count;
        lock.lock();
        try {
            requests = new LinkedHashMap<>(requestCounts);
            errors = new LinkedHashMap<>(errorCounts);
            buffered = new ArrayList<>(samples);
            sumsCopy = new EnumMap<>(sums);
            count = sampleCount;
        } finally {
            lock.unlock();
        }

        Map<String, Double> averages = new LinkedHashMap<>();
        Map<String, Double> p50 = new LinkedHashMap<>();
        Map<String, Double> p95 = new LinkedHashMap<>();
        for (TimingField field : TimingField.values()) {
            averages.put(field.key(), count > 0 ? sumsCopy.get(field) / count : 0.0d);
            List<Double> values = buffered.stream().map(sample -> sample.value(field)).sorted().toList();
            p50.put(field.key(), percentile(values, 50.0d));
            p95.put(field.key(), percentile(values, 95.0d));
        }
        return new MetricsSnapshot(requests, errors, new TimingStatistics(averages, p50, p95), cacheStats.get(),
                count, buffered);
    }

    /**
     * Clears all counters and samples. Intended for tests.
     */
    public void reset() {
        lock.lock();
        try {
            requestCounts.clear();
            errorCounts.clear();
            samples.clear();
            resetSums();
            sampleCount = 0L;
        } finally {
            lock.unlock();
        }
        LOGGER.debug("In-memory metrics reset");
    }

    /**
     * Nearest-rank percentile over values sorted ascending.
     */
    static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0.0d;
        }
        int last = sortedValues.size() - 1;
        int index = (int) Math.round(percentile / 100.0d * last);
        return sortedValues.get(Math.max(0, Math.min(last, index)));
    }

    private void resetSums() {
        for (TimingField field : TimingField.values()) {
            sums.put(field, 0.0d);
        }
    }

    private Counter counter(String name, String path) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .tag("path", path)
                .register(meterRegistry);
    }
}
