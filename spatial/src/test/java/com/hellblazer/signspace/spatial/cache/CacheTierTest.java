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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CacheTierTest {
    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static CacheTier<String> tier(EvictionPolicy policy) {
        return new CacheTier<>(CacheLevel.L1, new TierConfiguration(2, policy, Duration.ofMinutes(1)));
    }

    @Test
    public void testLruEvictsLeastRecentlyUsed() {
        var tier = tier(EvictionPolicy.LRU);
        tier.put("a", "A", 1, T0);
        tier.put("b", "B", 1, T0);
        tier.get("a", T0);
        assertEquals(List.of("b"), tier.put("c", "C", 1, T0));
        assertTrue(tier.contains("a", T0));
        assertEquals(1, tier.evictions());
    }

    @Test
    public void testLfuEvictsLeastFrequentlyUsed() {
        var tier = tier(EvictionPolicy.LFU);
        tier.put("a", "A", 1, T0);
        tier.put("b", "B", 1, T0);
        tier.get("b", T0);
        tier.get("a", T0);
        tier.get("a", T0);
        assertEquals(List.of("b"), tier.put("c", "C", 1, T0));
    }

    @Test
    public void testFifoEvictsOldestInsertion() {
        var tier = tier(EvictionPolicy.FIFO);
        tier.put("a", "A", 1, T0);
        tier.put("b", "B", 1, T0);
        tier.get("a", T0);
        assertEquals(List.of("a"), tier.put("c", "C", 1, T0));
    }

    @Test
    public void testAdaptiveEvictsLargeRarelyUsedEntries() {
        var tier = tier(EvictionPolicy.ADAPTIVE);
        tier.put("small", "S", 1, T0);
        tier.put("large", "L", 5, T0);
        tier.get("small", T0);
        assertEquals(List.of("large"), tier.put("c", "C", 1, T0));
    }

    @Test
    public void testAdaptiveScore() {
        var entry = new CacheTier.Entry<>("v", 2, 1, T0, T0.plusSeconds(60));
        // idle for two minutes, never accessed, size two
        assertEquals(2 * 0.5 + 0.3 + 2 * 0.2, CacheTier.adaptiveScore(entry, T0.plusSeconds(120)), 1e-9);
    }

    @Test
    public void testReplaceDoesNotEvict() {
        var tier = tier(EvictionPolicy.LRU);
        tier.put("a", "A", 1, T0);
        tier.put("b", "B", 1, T0);
        assertTrue(tier.put("a", "A2", 1, T0).isEmpty());
        assertEquals(2, tier.size());
        assertEquals("A2", tier.peek("a", T0).orElseThrow());
    }

    @Test
    public void testExpiry() {
        var tier = tier(EvictionPolicy.LRU);
        tier.put("a", "A", 1, T0);
        tier.put("b", "B", 1, T0.plusSeconds(30));

        var later = T0.plusSeconds(60);
        assertFalse(tier.contains("a", later));
        assertTrue(tier.peek("a", later).isEmpty());
        assertEquals(CacheTier.Outcome.EXPIRED, tier.get("a", later).outcome());
        assertEquals(CacheTier.Outcome.MISS, tier.get("a", later).outcome());
        assertEquals(1, tier.expirations());

        assertEquals(List.of("b"), tier.purgeExpired(T0.plusSeconds(90)));
        assertEquals(0, tier.size());
        assertEquals(2, tier.expirations());
    }

    @Test
    public void testPeekDoesNotCountHits() {
        var tier = tier(EvictionPolicy.LRU);
        tier.put("a", "A", 1, T0);
        tier.peek("a", T0);
        assertEquals(0, tier.hits());
        var lookup = tier.get("a", T0);
        assertEquals(CacheTier.Outcome.HIT, lookup.outcome());
        assertEquals("A", lookup.value());
        assertEquals(1, tier.hits());
    }

    @Test
    public void testTierConfigurationValidation() {
        assertThrows(IllegalArgumentException.class,
                     () -> new TierConfiguration(0, EvictionPolicy.LRU, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> new TierConfiguration(1, EvictionPolicy.LRU, Duration.ZERO));
        assertEquals(PreloadStrategy.NONE,
                     new TierConfiguration(1, EvictionPolicy.LRU, Duration.ofMinutes(1), null).preloadStrategy());
    }
}
