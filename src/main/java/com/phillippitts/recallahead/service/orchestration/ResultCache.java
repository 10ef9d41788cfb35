package com.phillippitts.recallahead.service.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Short-lived memo of normalized query to result list.
 *
 * <p>Expiry is lazy: an entry older than the TTL supplied at read time is removed by that read
 * and reported as a miss. Confined to the event loop; not thread-safe.
 *
 * @param <T> result item type
 */
public final class ResultCache<T> {

    /**
     * @param timestamp when the result was stored
     * @param result    the stored result
     */
    public record Entry<T>(Instant timestamp, List<T> result) {
    }

    private final Map<String, Entry<T>> entries = new HashMap<>();
    private final Clock clock;

    public ResultCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return cached result, or null when absent or older than {@code ttl}
     */
    public List<T> get(String query, Duration ttl) {
        Entry<T> entry = entries.get(query);
        if (entry == null) {
            return null;
        }
        Duration age = Duration.between(entry.timestamp(), clock.instant());
        if (age.compareTo(ttl) > 0) {
            entries.remove(query);
            return null;
        }
        return entry.result();
    }

    public void put(String query, List<T> result) {
        entries.put(query, new Entry<>(clock.instant(), result));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
