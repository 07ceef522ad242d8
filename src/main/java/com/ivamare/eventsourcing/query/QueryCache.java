package com.ivamare.eventsourcing.query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local TTL cache for query results. Expired entries are evicted on read.
 */
public class QueryCache {

    private record Entry(Object value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration defaultTtl;
    private final Clock clock;

    public QueryCache(Duration defaultTtl) {
        this(defaultTtl, Clock.systemUTC());
    }

    public QueryCache(Duration defaultTtl, Clock clock) {
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public Optional<Object> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, Object value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    /**
     * @return number of removed entries
     */
    public int invalidate(String pattern) {
        if (pattern == null) {
            int size = entries.size();
            entries.clear();
            return size;
        }
        int before = entries.size();
        entries.keySet().removeIf(key -> key.contains(pattern));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
