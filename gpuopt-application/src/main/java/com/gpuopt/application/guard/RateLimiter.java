package com.gpuopt.application.guard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-identifier request windows kept in process memory.
 *
 * Timestamps older than the window are pruned on every check, then the remaining count is
 * compared to the limit. Two adjacent windows can therefore admit up to twice the limit.
 */
public class RateLimiter {

    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records the call and returns true, or returns false without recording when the limit is reached.
     * A negative limit means unbounded.
     */
    public boolean tryAcquire(String identifier, int limit, Duration window) {
        Objects.requireNonNull(identifier, "identifier");
        if (limit < 0) return true;

        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        boolean[] allowed = new boolean[1];

        windows.compute(identifier, (k, q) -> {
            Deque<Instant> d = q == null ? new ArrayDeque<>() : q;
            prune(d, cutoff);
            if (d.size() < limit) {
                d.addLast(now);
                allowed[0] = true;
            }
            return d;
        });
        return allowed[0];
    }

    /** Drops identifiers whose window has fully aged out. */
    public int evictIdle(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        int before = windows.size();
        for (String id : windows.keySet()) {
            windows.computeIfPresent(id, (k, d) -> {
                prune(d, cutoff);
                return d.isEmpty() ? null : d;
            });
        }
        return Math.max(0, before - windows.size());
    }

    int trackedIdentifiers() {
        return windows.size();
    }

    private static void prune(Deque<Instant> d, Instant cutoff) {
        while (!d.isEmpty() && !d.peekFirst().isAfter(cutoff)) {
            d.pollFirst();
        }
    }
}
