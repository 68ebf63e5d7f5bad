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

import java.util.Map;

/**
 * Statistics snapshot across the three tiers.
 *
 * @param preloadCount entries copied into the predictive tier by pattern preloading
 * @author hal.hildebrand
 */
public record CacheStats(Map<CacheLevel, Long> hits, long misses, Map<CacheLevel, Long> evictions,
                         Map<CacheLevel, Long> expirations, Map<CacheLevel, Integer> sizes, long preloadCount) {

    public CacheStats {
        hits = Map.copyOf(hits);
        evictions = Map.copyOf(evictions);
        expirations = Map.copyOf(expirations);
        sizes = Map.copyOf(sizes);
    }

    public long totalHits() {
        return hits.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalEvictions() {
        return evictions.values().stream().mapToLong(Long::longValue).sum();
    }

    public int totalSize() {
        return sizes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public double hitRatio() {
        long total = totalHits() + misses;
        return total == 0 ? 0.0 : (double) totalHits() / total;
    }

    /**
     * Hits served by the predictive tier per preloaded entry
     */
    public double preloadHitRatio() {
        return preloadCount == 0 ? 0.0 : (double) hits.getOrDefault(CacheLevel.PREDICTIVE, 0L) / preloadCount;
    }

    @Override
    public String toString() {
        return String.format("CacheStats[hits=%s, misses=%d, hitRate=%.1f%%, evictions=%s, sizes=%s, preloads=%d]",
                             hits, misses, hitRatio() * 100, evictions, sizes, preloadCount);
    }
}
