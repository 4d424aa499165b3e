package com.portfolioradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    @Test
    @DisplayName("tryAcquire allows first call and denies second immediately at 1/min")
    void tryAcquireOnePerMinute() {
        RateLimiter limiter = RateLimiter.perMinute(1);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("acquire blocks until the interval has passed")
    void acquireBlocksThenAllows() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(500));
        limiter.acquire();
        long start = System.nanoTime();
        limiter.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(400);
    }

    @Test
    @DisplayName("zero interval never blocks")
    void zeroInterval() {
        RateLimiter limiter = new RateLimiter(Duration.ZERO);
        for (int i = 0; i < 100; i++) {
            assertThat(limiter.tryAcquire()).isTrue();
        }
    }

    @Test
    @DisplayName("multiple threads all get their permits")
    void multipleThreadsRespectRate() throws InterruptedException {
        RateLimiter limiter = RateLimiter.perMinute(600);
        int threadCount = 5;
        int acquiresPerThread = 4;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < acquiresPerThread; i++) {
                        limiter.acquire();
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(successCount.get()).isEqualTo(threadCount * acquiresPerThread);
    }

    @Test
    @DisplayName("perMinute rejects non-positive rate")
    void rejectsNonPositive() {
        assertThatThrownBy(() -> RateLimiter.perMinute(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> new RateLimiter(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("perMinute derives the interval")
    void perMinuteInterval() {
        assertThat(RateLimiter.perMinute(30).getMinInterval()).isEqualTo(Duration.ofSeconds(2));
    }
}
