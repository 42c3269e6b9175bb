package com.gpuopt.application.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-process key/value cache with per-entry expiry.
 *
 * All bookkeeping happens under one lock; values are never loaded while it is held.
 * Expired entries are dropped lazily on {@link #get} or by {@link #purgeExpired()}.
 *
 * Every {@link #delete} and {@link #clear} bumps a generation counter. A reader that loads
 * from storage should take {@link #generation()} first and populate with
 * {@link #setIfGeneration}, so a value read before a concurrent invalidation is discarded.
 */
public final class TtlCache<K, V> {

    private record Entry<V>(V value, Instant expiresAt) {
    }

    private final Object lock = new Object();
    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private long generation;

    public TtlCache(Duration defaultTtl, Clock clock) {
        this.defaultTtl = requirePositive(defaultTtl);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TtlCache(Duration defaultTtl) {
        this(defaultTtl, Clock.systemUTC());
    }

    public Optional<V> get(K key) {
        Instant now = clock.instant();
        synchronized (lock) {
            Entry<V> e = entries.get(key);
            if (e == null) return Optional.empty();
            if (!now.isBefore(e.expiresAt())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(e.value());
        }
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(K key, V value, Duration ttl) {
        Entry<V> e = entry(value, ttl);
        synchronized (lock) {
            entries.put(Objects.requireNonNull(key, "key"), e);
        }
    }

    /**
     * Stores the value only if no invalidation happened since {@code expectedGeneration} was read.
     *
     * @return true when stored
     */
    public boolean setIfGeneration(K key, V value, Duration ttl, long expectedGeneration) {
        Entry<V> e = entry(value, ttl);
        synchronized (lock) {
            if (generation != expectedGeneration) return false;
            entries.put(Objects.requireNonNull(key, "key"), e);
            return true;
        }
    }

    public long generation() {
        synchronized (lock) {
            return generation;
        }
    }

    public boolean delete(K key) {
        synchronized (lock) {
            generation++;
            return entries.remove(key) != null;
        }
    }

    public void clear() {
        synchronized (lock) {
            generation++;
            entries.clear();
        }
    }

    /** @return number of entries removed */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (lock) {
            Iterator<Entry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (!now.isBefore(it.next().expiresAt())) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private Entry<V> entry(V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        return new Entry<>(value, clock.instant().plus(requirePositive(ttl)));
    }

    private static Duration requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        return ttl;
    }
}
