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
import java.util.Objects;

/**
 * Capacity, eviction policy, time to live and preload strategy of one tier.
 *
 * @author hal.hildebrand
 */
public record TierConfiguration(int maxSize, EvictionPolicy evictionPolicy, Duration ttl,
                                PreloadStrategy preloadStrategy) {

    public TierConfiguration {
        Objects.requireNonNull(evictionPolicy, "evictionPolicy cannot be null");
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (preloadStrategy == null) {
            preloadStrategy = PreloadStrategy.NONE;
        }
    }

    public TierConfiguration(int maxSize, EvictionPolicy evictionPolicy, Duration ttl) {
        this(maxSize, evictionPolicy, ttl, PreloadStrategy.NONE);
    }

    public TierConfiguration withMaxSize(int newMaxSize) {
        return new TierConfiguration(newMaxSize, evictionPolicy, ttl, preloadStrategy);
    }

    public TierConfiguration withTtl(Duration newTtl) {
        return new TierConfiguration(maxSize, evictionPolicy, newTtl, preloadStrategy);
    }

    public TierConfiguration withPreloadStrategy(PreloadStrategy newStrategy) {
        return new TierConfiguration(maxSize, evictionPolicy, ttl, newStrategy);
    }
}
