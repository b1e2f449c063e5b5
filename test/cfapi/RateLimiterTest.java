package cfapi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class RateLimiterTest {

    @AfterEach
    public void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    public void spacesAdmissions() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(20);
        long start = System.nanoTime();
        for (int i = 0; i < 4; i++) {
            limiter.acquire();
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        // first admission is free, the next three wait 50 ms each
        assertTrue(elapsedMillis >= 140, "elapsed " + elapsedMillis + " ms");
    }

    @Test
    public void intervalFollowsRate() {
        assertEquals(TimeUnit.MILLISECONDS.toNanos(200), new RateLimiter(5).getIntervalNanos());
    }

    @Test
    public void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0));
    }

    @Test
    public void interruptedWhileWaiting() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(1);
        limiter.acquire();
        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, limiter::acquire);
    }

    @Test
    public void interruptedWithoutWaiting() {
        RateLimiter limiter = new RateLimiter(1);
        Thread.currentThread().interrupt();
        assertThrows(InterruptedException.class, limiter::acquire);
    }
}
