/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Signspace.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.signspace.spatial.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One bounded tier of the multi-level cache. Every read or write of the entry map happens under the tier's lock, so
 * insertion with its eviction, and lookup with its expiry purge, are atomic per key.
 *
 * @author hal.hildebrand
 * @param <V> cached value type
 */
public class CacheTier<V> {

    public enum Outcome {
        HIT,
        MISS,
        EXPIRED
    }

    /**
     * Result of a lookup; the value is null unless the outcome is {@link Outcome#HIT}
     */
    public record Lookup<V>(Outcome outcome, V value) {
    }

    private static final double ADAPTIVE_AGE_WEIGHT       = 0.5;
    private static final double ADAPTIVE_FREQUENCY_WEIGHT = 0.3;
    private static final double ADAPTIVE_SIZE_WEIGHT      = 0.2;

    private final CacheLevel             level;
    private final TierConfiguration      config;
    private final Map<String, Entry<V>>  entries     = new HashMap<>();
    private final Lock                   lock        = new ReentrantLock();
    private final AtomicLong             hits        = new AtomicLong();
    private final AtomicLong             evictions   = new AtomicLong();
    private final AtomicLong             expirations = new AtomicLong();
    private       long                   sequence;

    public CacheTier(CacheLevel level, TierConfiguration config) {
        this.level = Objects.requireNonNull(level, "level");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Look the key up, counting a hit and recording the access. An expired entry is removed.
     */
    public Lookup<V> get(String key, Instant now) {
        lock.lock();
        try {
            var entry = entries.get(key);
            if (entry == null) {
                return new Lookup<>(Outcome.MISS, null);
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations.incrementAndGet();
                return new Lookup<>(Outcome.EXPIRED, null);
            }
            entry.touch(now, ++sequence);
            hits.incrementAndGet();
            return new Lookup<>(Outcome.HIT, entry.value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live value without counting or recording an access
     */
    public Optional<V> peek(String key, Instant now) {
        lock.lock();
        try {
            var entry = entries.get(key);
            return entry == null || entry.isExpired(now) ? Optional.empty() : Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace, evicting by the tier's policy while at capacity.
     *
     * @return keys evicted to make room
     */
    public List<String> put(String key, V value, int size, Instant now) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            var existing = entries.get(key);
            if (existing != null) {
                existing.value = value;
                existing.size = size;
                existing.expiresAt = now.plus(config.ttl());
                existing.touch(now, ++sequence);
                return List.of();
            }
            var evicted = new ArrayList<String>();
            while (entries.size() >= config.maxSize()) {
                var victim = selectVictim(now);
                entries.remove(victim);
                evictions.incrementAndGet();
                evicted.add(victim);
            }
            long seq = ++sequence;
            entries.put(key, new Entry<>(value, size, seq, now, now.plus(config.ttl())));
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key, Instant now) {
        lock.lock();
        try {
            var entry = entries.get(key);
            return entry != null && !entry.isExpired(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return keys of the expired entries removed
     */
    public List<String> purgeExpired(Instant now) {
        lock.lock();
        try {
            var expired = new ArrayList<String>();
            var iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                var e = iterator.next();
                if (e.getValue().isExpired(now)) {
                    iterator.remove();
                    expired.add(e.getKey());
                }
            }
            expirations.addAndGet(expired.size());
            return expired;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheLevel getLevel() {
        return level;
    }

    public TierConfiguration getConfiguration() {
        return config;
    }

    public long hits() {
        return hits.get();
    }

    public long evictions() {
        return evictions.get();
    }

    public long expirations() {
        return expirations.get();
    }

    /**
     * Caller holds the lock; the map is not empty
     */
    private String selectVictim(Instant now) {
        String victim = null;
        Entry<V> chosen = null;
        for (var e : entries.entrySet()) {
            var candidate = e.getValue();
            if (chosen == null || evictsBefore(candidate, chosen, now)) {
                victim = e.getKey();
                chosen = candidate;
            }
        }
        return victim;
    }

    private boolean evictsBefore(Entry<V> candidate, Entry<V> current, Instant now) {
        return switch (config.evictionPolicy()) {
            case LRU -> candidate.accessSequence < current.accessSequence;
            case FIFO -> candidate.insertSequence < current.insertSequence;
            case LFU -> candidate.accessCount < current.accessCount || (candidate.accessCount == current.accessCount
                                                                        && candidate.accessSequence
                                                                           < current.accessSequence);
            case ADAPTIVE -> {
                var a = adaptiveScore(candidate, now);
                var b = adaptiveScore(current, now);
                yield a > b || (a == b && candidate.accessSequence < current.accessSequence);
            }
        };
    }

    /**
     * Higher is evicted first: idle minutes, rarity and size
     */
    static double adaptiveScore(Entry<?> entry, Instant now) {
        var idleMinutes = Duration.between(entry.lastAccessed, now).toMillis() / 60_000.0;
        return idleMinutes * ADAPTIVE_AGE_WEIGHT + ADAPTIVE_FREQUENCY_WEIGHT / (entry.accessCount + 1)
        + entry.size * ADAPTIVE_SIZE_WEIGHT;
    }

    static final class Entry<V> {
        private final long    insertSequence;
        private       V       value;
        private       int     size;
        private       Instant lastAccessed;
        private       long    accessSequence;
        private       long    accessCount;
        private       Instant expiresAt;

        Entry(V value, int size, long sequence, Instant now, Instant expiresAt) {
            this.value = value;
            this.size = size;
            this.insertSequence = sequence;
            this.accessSequence = sequence;
            this.lastAccessed = now;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }

        void touch(Instant now, long sequence) {
            lastAccessed = now;
            accessSequence = sequence;
            accessCount++;
        }
    }
}
