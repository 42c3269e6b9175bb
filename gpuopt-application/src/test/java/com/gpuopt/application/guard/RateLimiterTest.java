package com.gpuopt.application.guard;

import com.gpuopt.application.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final RateLimiter limiter = new RateLimiter(clock);
    private final Duration window = Duration.ofSeconds(60);

    @Test
    void allowsFiveThenDeniesSixthUntilOldestAgesOut() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.tryAcquire("k", 5, window)).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }
        assertThat(limiter.tryAcquire("k", 5, window)).isFalse();

        // first call was at t=0; at t=60 it is out of the window
        clock.advance(Duration.ofSeconds(55));
        assertThat(limiter.tryAcquire("k", 5, window)).isTrue();
        assertThat(limiter.tryAcquire("k", 5, window)).isFalse();
    }

    @Test
    void identifiersAreIndependent() {
        for (int i = 0; i < 3; i++) limiter.tryAcquire("a", 3, window);
        assertThat(limiter.tryAcquire("a", 3, window)).isFalse();
        assertThat(limiter.tryAcquire("b", 3, window)).isTrue();
    }

    @Test
    void negativeLimitIsUnbounded() {
        for (int i = 0; i < 1000; i++) {
            assertThat(limiter.tryAcquire("ent", -1, window)).isTrue();
        }
        assertThat(limiter.trackedIdentifiers()).isZero();
    }

    @Test
    void boundaryBurstAdmitsTwiceTheLimit() {
        clock.advance(Duration.ofSeconds(59));
        int allowed = 0;
        for (int i = 0; i < 5; i++) if (limiter.tryAcquire("k", 5, window)) allowed++;
        clock.advance(Duration.ofSeconds(60));
        for (int i = 0; i < 5; i++) if (limiter.tryAcquire("k", 5, window)) allowed++;
        assertThat(allowed).isEqualTo(10);
    }

    @Test
    void evictIdleDropsExpiredWindows() {
        limiter.tryAcquire("a", 5, window);
        clock.advance(Duration.ofMinutes(2));
        limiter.tryAcquire("b", 5, window);

        assertThat(limiter.evictIdle(window)).isEqualTo(1);
        assertThat(limiter.trackedIdentifiers()).isEqualTo(1);
    }
}
