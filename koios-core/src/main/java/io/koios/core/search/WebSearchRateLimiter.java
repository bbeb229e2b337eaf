package io.koios.core.search;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide minimum spacing between web search calls. Each caller reserves
 * the next free slot under the lock and then waits for it without holding the
 * lock, so concurrent callers queue up one interval apart.
 */
public final class WebSearchRateLimiter {
    private static final Logger LOG = LoggerFactory.getLogger(WebSearchRateLimiter.class);

    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    private long nextSlotNanos;
    private boolean first = true;

    public WebSearchRateLimiter(Duration minInterval) {
        this(minInterval, System::nanoTime);
    }

    WebSearchRateLimiter(Duration minInterval, LongSupplier nanoClock) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.intervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    /**
     * Blocks until the caller may issue its request.
     *
     * @throws InterruptedException if interrupted while waiting for the slot
     */
    public void acquire() throws InterruptedException {
        long waitNanos = reserve();
        if (waitNanos > 0) {
            LOG.info("Rate limiting: waiting {} ms before web search", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    long reserve() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            long slot = first || now - nextSlotNanos >= 0 ? now : nextSlotNanos;
            first = false;
            nextSlotNanos = slot + intervalNanos;
            return slot - now;
        } finally {
            lock.unlock();
        }
    }
}
