package io.koios.core.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class WebSearchRateLimiterTest {

    private static final long INTERVAL = TimeUnit.MILLISECONDS.toNanos(1000);

    @Test
    void shouldSpaceReservationsOneIntervalApart() {
        AtomicLong clock = new AtomicLong(5_000_000_000L);
        WebSearchRateLimiter limiter = new WebSearchRateLimiter(Duration.ofSeconds(1), clock::get);

        assertThat(limiter.reserve()).isZero();
        assertThat(limiter.reserve()).isEqualTo(INTERVAL);
        assertThat(limiter.reserve()).isEqualTo(2 * INTERVAL);
    }

    @Test
    void shouldNotWaitOnceIntervalHasPassed() {
        AtomicLong clock = new AtomicLong(0);
        WebSearchRateLimiter limiter = new WebSearchRateLimiter(Duration.ofSeconds(1), clock::get);

        limiter.reserve();
        clock.addAndGet(INTERVAL + 1);

        assertThat(limiter.reserve()).isZero();

        clock.addAndGet(INTERVAL / 4);
        assertThat(limiter.reserve()).isEqualTo(INTERVAL - INTERVAL / 4);
    }

    @Test
    void shouldSeparateConcurrentCallersInRealTime() throws Exception {
        WebSearchRateLimiter limiter = new WebSearchRateLimiter(Duration.ofMillis(100));
        List<Long> starts = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch ready = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            for (int i = 0; i < 3; i++) {
                executor.submit(() -> {
                    ready.await();
                    limiter.acquire();
                    starts.add(System.nanoTime());
                    return null;
                });
            }
            ready.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        List<Long> sorted = new ArrayList<>(starts);
        Collections.sort(sorted);
        assertThat(sorted).hasSize(3);
        for (int i = 1; i < sorted.size(); i++) {
            assertThat(sorted.get(i) - sorted.get(i - 1))
                .isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(90));
        }
    }

    @Test
    void shouldRejectNegativeInterval() {
        assertThatThrownBy(() -> new WebSearchRateLimiter(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
