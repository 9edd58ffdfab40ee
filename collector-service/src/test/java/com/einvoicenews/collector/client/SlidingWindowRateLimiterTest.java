package com.einvoicenews.collector.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong();
    private final List<Duration> sleeps = new ArrayList<>();

    private SlidingWindowRateLimiter limiter(int calls, Duration window) {
        return new SlidingWindowRateLimiter(calls, window, nanos::get, d -> {
            sleeps.add(d);
            nanos.addAndGet(d.toNanos());
        });
    }

    @BeforeEach
    void setUp() {
        nanos.set(0);
        sleeps.clear();
    }

    @Test
    @DisplayName("calls within the quota go through without waiting")
    void withinQuota() throws InterruptedException {
        // given
        SlidingWindowRateLimiter limiter = limiter(3, Duration.ofSeconds(60));

        // when
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.acquire()).isZero();
        }

        // then
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("the call over quota waits until the oldest call leaves the window")
    void overQuotaWaits() throws InterruptedException {
        // given
        SlidingWindowRateLimiter limiter = limiter(2, Duration.ofSeconds(60));
        limiter.acquire();
        nanos.addAndGet(Duration.ofSeconds(20).toNanos());
        limiter.acquire();

        // when
        Duration waited = limiter.acquire();

        // then
        assertThat(sleeps).containsExactly(Duration.ofSeconds(40));
        assertThat(waited).isEqualTo(Duration.ofSeconds(40));
    }

    @Test
    @DisplayName("never admits more than the quota in any window")
    void neverExceedsQuota() throws InterruptedException {
        // given
        SlidingWindowRateLimiter limiter = limiter(10, Duration.ofSeconds(60));
        List<Long> admitted = new ArrayList<>();

        // when
        for (int i = 0; i < 35; i++) {
            limiter.acquire();
            admitted.add(nanos.get());
        }

        // then
        long window = Duration.ofSeconds(60).toNanos();
        for (int i = 10; i < admitted.size(); i++) {
            assertThat(admitted.get(i) - admitted.get(i - 10)).isGreaterThanOrEqualTo(window);
        }
    }

    @Test
    @DisplayName("limiters do not share quota")
    void independentLimiters() throws InterruptedException {
        SlidingWindowRateLimiter first = limiter(1, Duration.ofSeconds(60));
        SlidingWindowRateLimiter second = limiter(1, Duration.ofSeconds(60));

        first.acquire();
        second.acquire();

        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("an interrupted caller gets InterruptedException")
    void interrupted() {
        SlidingWindowRateLimiter limiter = limiter(1, Duration.ofSeconds(60));
        Thread.currentThread().interrupt();

        assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);
        Thread.interrupted();
    }

    @Test
    @DisplayName("rejects a non-positive quota or window")
    void validatesArguments() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
