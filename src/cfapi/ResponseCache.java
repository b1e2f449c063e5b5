package cfapi;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Time-to-live store for raw API response bodies, bounded to a maximum number of entries.
 *
 * Safe for concurrent use. Two callers missing on the same key will both go to
 * the network; nothing here joins in-flight requests.
 */
public class ResponseCache {

    private static class CacheEntry {
        final String body;
        final Instant expiresAt;

        CacheEntry(String body, Instant expiresAt) {
            this.body = body;
            this.expiresAt = expiresAt;
        }
    }

    // insertion order, so the first key is the oldest write
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public ResponseCache(Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * @return the stored body, or empty if there is none or it has expired
     */
    public synchronized Optional<String> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.body);
    }

    public void put(String key, String body) {
        put(key, body, ttl);
    }

    public synchronized void put(String key, String body, Duration timeToLive) {
        Instant now = clock.instant();
        entries.remove(key);
        if (entries.size() >= maxEntries) {
            entries.values().removeIf(e -> !now.isBefore(e.expiresAt));
        }
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() >= maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new CacheEntry(body, now.plus(timeToLive)));
    }

    public synchronized void clear() {
        entries.clear();
    }

    /** Number of stored entries, expired ones included until they are read or evicted. */
    public synchronized int size() {
        return entries.size();
    }
}
