package cfapi;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import cf.MutableClock;

public class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new ResponseCache(Duration.ofMinutes(5), 3, clock);
    }

    @Test
    public void returnsValueBeforeExpiry() {
        cache.put("user.info?handles=tourist", "value");
        clock.advance(Duration.ofMinutes(4));
        Optional<String> hit = cache.get("user.info?handles=tourist");
        assertEquals(Optional.of("value"), hit);
    }

    @Test
    public void expiresExactlyAtTtl() {
        cache.put("k", "42");
        clock.advance(Duration.ofMinutes(5));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    public void perEntryTtl() {
        cache.put("short", "a", Duration.ofSeconds(1));
        cache.put("long", "b");
        clock.advance(Duration.ofSeconds(2));
        assertTrue(cache.get("short").isEmpty());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    public void clearDropsEverything() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    public void fullCacheDropsExpiredEntriesFirst() {
        cache.put("old", "a", Duration.ofSeconds(1));
        cache.put("b", "b");
        cache.put("c", "c");
        clock.advance(Duration.ofSeconds(2));
        cache.put("d", "d");
        assertEquals(3, cache.size());
        assertTrue(cache.get("b").isPresent());
        assertTrue(cache.get("c").isPresent());
        assertTrue(cache.get("d").isPresent());
    }

    @Test
    public void fullCacheEvictsOldestWrite() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.put("d", "4");
        assertEquals(3, cache.size());
        assertTrue(cache.get("a").isEmpty());
        assertEquals(Optional.of("4"), cache.get("d"));
    }

    @Test
    public void rewritingAKeyDoesNotEvict() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.put("a", "5");
        assertEquals(3, cache.size());
        assertEquals(Optional.of("2"), cache.get("b"));
        assertEquals(Optional.of("5"), cache.get("a"));
    }

    @Test
    public void rejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache(Duration.ofMinutes(1), 0, clock));
    }
}
