package com.gpuopt.application.cache;

import com.gpuopt.application.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final TtlCache<String, String> cache = new TtlCache<>(Duration.ofMinutes(5), clock);

    @Test
    void entryExpiresLazilyAfterTtl() {
        cache.set("a", "1", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertThat(cache.get("a")).contains("1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void defaultTtlApplies() {
        cache.set("a", "1");
        clock.advance(Duration.ofMinutes(5));
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void deleteAndClearRemoveEntries() {
        cache.set("a", "1");
        cache.set("b", "2");

        assertThat(cache.delete("a")).isTrue();
        assertThat(cache.delete("a")).isFalse();
        assertThat(cache.get("b")).contains("2");

        cache.clear();
        assertThat(cache.get("b")).isEmpty();
    }

    @Test
    void populateIsRefusedAfterConcurrentInvalidation() {
        long seen = cache.generation();
        cache.delete("customer");

        assertThat(cache.setIfGeneration("customer", "stale", Duration.ofMinutes(1), seen)).isFalse();
        assertThat(cache.get("customer")).isEmpty();

        long fresh = cache.generation();
        assertThat(cache.setIfGeneration("customer", "fresh", Duration.ofMinutes(1), fresh)).isTrue();
        assertThat(cache.get("customer")).contains("fresh");
    }

    @Test
    void purgeExpiredSweepsOnlyExpired() {
        cache.set("short", "1", Duration.ofSeconds(10));
        cache.set("long", "2", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get("long")).contains("2");
    }

    @Test
    void rejectsNullValuesAndNonPositiveTtl() {
        assertThatThrownBy(() -> cache.set("a", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache.set("a", "1", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
