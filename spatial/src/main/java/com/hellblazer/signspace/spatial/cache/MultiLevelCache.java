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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Three tier cache. Lookups fall through L1, L2 and the predictive tier in that order; a hit below L1 is promoted to
 * L1. When the predictive tier preloads by pattern, every lookup records which key followed the previous one, and a
 * hit copies the known followers of the key from L2 into the predictive tier. Followers are only tracked for keys
 * resident in some tier, at most {@link #MAX_FOLLOWERS} per key, and are forgotten once the key leaves every tier.
 *
 * <p>Thread-safe. Each tier guards its own entries; listeners are notified on the calling thread after the tier lock
 * is released.
 *
 * @author hal.hildebrand
 * @param <V> cached value type
 */
public class MultiLevelCache<V> {
    /** Followers remembered per key */
    public static final int MAX_FOLLOWERS = 8;

    private static final Logger log = LoggerFactory.getLogger(MultiLevelCache.class);

    private final Map<CacheLevel, CacheTier<V>> tiers      = new EnumMap<>(CacheLevel.class);
    private final Map<String, Set<String>>      followers  = new ConcurrentHashMap<>();
    private final AtomicReference<String>       lastKey    = new AtomicReference<>();
    private final AtomicLong                    misses     = new AtomicLong();
    private final AtomicLong                    preloads   = new AtomicLong();
    private final List<CacheListener>           listeners  = new CopyOnWriteArrayList<>();
    private final CacheConfiguration            configuration;
    private final Clock                         clock;

    public MultiLevelCache() {
        this(CacheConfiguration.defaultConfig(), Clock.systemUTC());
    }

    public MultiLevelCache(CacheConfiguration configuration, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (var level : CacheLevel.values()) {
            tiers.put(level, new CacheTier<>(level, configuration.tier(level)));
        }
    }

    public void put(String key, V value, CacheLevel level) {
        put(key, value, level, 1);
    }

    /**
     * @param size relative weight of the entry, used by adaptive eviction
     */
    public void put(String key, V value, CacheLevel level, int size) {
        Objects.requireNonNull(level, "level");
        var now = clock.instant();
        var evicted = tiers.get(level).put(key, value, size, now);
        fire(CacheEvent.Type.ADD, key, level, now);
        evicted.forEach(k -> fire(CacheEvent.Type.EVICT, k, level, now));
        forgetPatterns(evicted, now);
    }

    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        var now = clock.instant();
        recordAccess(key, now);
        for (var level : CacheLevel.values()) {
            var lookup = tiers.get(level).get(key, now);
            switch (lookup.outcome()) {
                case EXPIRED -> {
                    fire(CacheEvent.Type.EXPIRE, key, level, now);
                    forgetPatterns(List.of(key), now);
                }
                case HIT -> {
                    fire(CacheEvent.Type.HIT, key, level, now);
                    if (level != CacheLevel.L1) {
                        promote(key, lookup.value(), level, now);
                    }
                    preloadFollowers(key, now);
                    return Optional.of(lookup.value());
                }
                case MISS -> {
                }
            }
        }
        misses.incrementAndGet();
        fire(CacheEvent.Type.MISS, key, null, now);
        return Optional.empty();
    }

    public boolean contains(String key) {
        return resident(key, clock.instant());
    }

    private boolean resident(String key, Instant now) {
        for (var tier : tiers.values()) {
            if (tier.contains(key, now)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove the key from every tier
     *
     * @return true when any tier held it
     */
    public boolean remove(String key) {
        boolean removed = false;
        for (var tier : tiers.values()) {
            removed |= tier.remove(key);
        }
        followers.remove(key);
        return removed;
    }

    public void clear() {
        tiers.values().forEach(CacheTier::clear);
        followers.clear();
        lastKey.set(null);
        log.debug("Cache cleared");
    }

    /**
     * @return number of expired entries removed across all tiers
     */
    public int purgeExpired() {
        var now = clock.instant();
        int purged = 0;
        for (var tier : tiers.values()) {
            var expired = tier.purgeExpired(now);
            expired.forEach(k -> fire(CacheEvent.Type.EXPIRE, k, tier.getLevel(), now));
            forgetPatterns(expired, now);
            purged += expired.size();
        }
        return purged;
    }

    public CacheStats getStats() {
        var hits = new EnumMap<CacheLevel, Long>(CacheLevel.class);
        var evictions = new EnumMap<CacheLevel, Long>(CacheLevel.class);
        var expirations = new EnumMap<CacheLevel, Long>(CacheLevel.class);
        var sizes = new EnumMap<CacheLevel, Integer>(CacheLevel.class);
        for (var tier : tiers.values()) {
            hits.put(tier.getLevel(), tier.hits());
            evictions.put(tier.getLevel(), tier.evictions());
            expirations.put(tier.getLevel(), tier.expirations());
            sizes.put(tier.getLevel(), tier.size());
        }
        return new CacheStats(hits, misses.get(), evictions, expirations, sizes, preloads.get());
    }

    public CacheConfiguration getConfiguration() {
        return configuration;
    }

    public void addListener(CacheListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(CacheListener listener) {
        return listeners.remove(listener);
    }

    private void promote(String key, V value, CacheLevel from, Instant now) {
        var evicted = tiers.get(CacheLevel.L1).put(key, value, 1, now);
        log.trace("Promoted {} from {} to L1", key, from);
        fire(CacheEvent.Type.ADD, key, CacheLevel.L1, now);
        evicted.forEach(k -> fire(CacheEvent.Type.EVICT, k, CacheLevel.L1, now));
        forgetPatterns(evicted, now);
    }

    private boolean patternsEnabled() {
        return configuration.tier(CacheLevel.PREDICTIVE).preloadStrategy().usesPatterns();
    }

    private void recordAccess(String key, Instant now) {
        if (!patternsEnabled()) {
            return;
        }
        var previous = lastKey.getAndSet(key);
        if (previous == null || previous.equals(key) || !resident(previous, now)) {
            return;
        }
        var known = followers.computeIfAbsent(previous, k -> ConcurrentHashMap.newKeySet());
        if (known.size() < MAX_FOLLOWERS) {
            known.add(key);
        }
    }

    /**
     * Drop the follower sets of keys no longer held by any tier
     */
    private void forgetPatterns(Collection<String> keys, Instant now) {
        for (var key : keys) {
            if (!resident(key, now)) {
                followers.remove(key);
            }
        }
    }

    int trackedPatternCount() {
        return followers.size();
    }

    int followerCount(String key) {
        var known = followers.get(key);
        return known == null ? 0 : known.size();
    }

    private void preloadFollowers(String key, Instant now) {
        if (!patternsEnabled()) {
            return;
        }
        var known = followers.get(key);
        if (known == null) {
            return;
        }
        var l1 = tiers.get(CacheLevel.L1);
        var l2 = tiers.get(CacheLevel.L2);
        var predictive = tiers.get(CacheLevel.PREDICTIVE);
        for (var follower : known) {
            if (l1.contains(follower, now) || predictive.contains(follower, now)) {
                continue;
            }
            var value = l2.peek(follower, now);
            if (value.isEmpty()) {
                continue;
            }
            var evicted = predictive.put(follower, value.get(), 1, now);
            preloads.incrementAndGet();
            fire(CacheEvent.Type.PRELOAD, follower, CacheLevel.PREDICTIVE, now);
            evicted.forEach(k -> fire(CacheEvent.Type.EVICT, k, CacheLevel.PREDICTIVE, now));
            forgetPatterns(evicted, now);
        }
    }

    private void fire(CacheEvent.Type type, String key, CacheLevel level, Instant now) {
        if (listeners.isEmpty()) {
            return;
        }
        var event = new CacheEvent(type, key, level, now);
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Cache listener failed on {}: {}", event, e.getMessage());
            }
        }
    }
}
