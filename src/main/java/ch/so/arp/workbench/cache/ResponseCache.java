package ch.so.arp.workbench.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, time limited cache shared by concurrent requests.
 * <p>
 * Entries expire {@code ttl} after insertion. When the capacity is reached the
 * oldest inserted entry is evicted. Data and hit/miss counters are guarded by
 * one lock so they never diverge. A disabled cache ignores every {@code put}
 * and answers every {@code get} with empty without touching the counters.
 *
 * @param <K> key type, must implement value equality
 * @param <V> cached value type, should be immutable
 */
public class ResponseCache<K, V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCache.class);

    private final String name;
    private final boolean enabled;
    private final Duration ttl;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // insertion ordered, so expired entries always sit at the head
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;

    public ResponseCache(String name, boolean enabled, Duration ttl, int capacity, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.enabled = enabled;
        this.capacity = capacity;
    }

    public Optional<V> get(K key) {
        if (!enabled) {
            return Optional.empty();
        }
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        V value = null;
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry != null && entry.isExpired(now, ttl)) {
                entries.remove(key);
                entry = null;
            }
            if (entry != null) {
                hits++;
                value = entry.value();
            } else {
                misses++;
            }
        } finally {
            lock.unlock();
        }
        LOGGER.debug("{} cache {} for key {}", name, value != null ? "hit" : "miss", key);
        return Optional.ofNullable(value);
    }

    public void put(K key, V value) {
        if (!enabled) {
            return;
        }
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Instant now = clock.instant();
        lock.lock();
        try {
            entries.remove(key);
            purgeExpired(now);
            while (entries.size() >= capacity) {
                Iterator<K> oldest = entries.keySet().iterator();
                K evicted = oldest.next();
                oldest.remove();
                LOGGER.debug("{} cache full, evicted oldest key {}", name, evicted);
            }
            entries.put(key, new Entry<>(value, now));
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored entries, expired ones not yet purged included.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all entries and zeroes the counters. Intended for tests.
     */
    public void reset() {
        lock.lock();
        try {
            entries.clear();
            hits = 0L;
            misses = 0L;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private void purgeExpired(Instant now) {
        Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().getValue().isExpired(now, ttl)) {
                return;
            }
            iterator.remove();
        }
    }

    private record Entry<V>(V value, Instant insertedAt) {

        boolean isExpired(Instant now, Duration ttl) {
            return now.isAfter(insertedAt.plus(ttl));
        }
    }
}
