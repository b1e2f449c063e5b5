package cfapi;

import java.util.concurrent.TimeUnit;

/**
 * Token bucket with a burst of one: admissions are spaced at least
 * {@code 1 / permitsPerSecond} apart, across every thread sharing the instance.
 * Callers wait for their slot rather than being rejected.
 */
public class RateLimiter {

    private final long intervalNanos;
    private long nextFreeNanos;

    public RateLimiter(double permitsPerSecond) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive");
        }
        this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / permitsPerSecond);
        this.nextFreeNanos = System.nanoTime();
    }

    /**
     * Blocks until the caller may issue one request.
     *
     * @throws InterruptedException if interrupted while waiting; the slot is not handed back
     */
    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextFreeNanos);
            nextFreeNanos = slot + intervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } else if (Thread.interrupted()) {
            throw new InterruptedException("interrupted while waiting for rate limiter");
        }
    }

    public long getIntervalNanos() {
        return intervalNanos;
    }
}
