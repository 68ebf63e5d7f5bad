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
 * Configuration of the three cache tiers.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class CacheConfiguration {

    /** Default L1: 100 entries, LRU, one minute */
    public static final TierConfiguration DEFAULT_L1 = new TierConfiguration(100, EvictionPolicy.LRU,
                                                                             Duration.ofMinutes(1));

    /** Default L2: 500 entries, LFU, five minutes */
    public static final TierConfiguration DEFAULT_L2 = new TierConfiguration(500, EvictionPolicy.LFU,
                                                                             Duration.ofMinutes(5));

    /** Default predictive tier: 200 entries, adaptive, ten minutes, pattern preloading */
    public static final TierConfiguration DEFAULT_PREDICTIVE = new TierConfiguration(200, EvictionPolicy.ADAPTIVE,
                                                                                     Duration.ofMinutes(10),
                                                                                     PreloadStrategy.PATTERN);

    private final TierConfiguration l1;
    private final TierConfiguration l2;
    private final TierConfiguration predictive;

    public CacheConfiguration(TierConfiguration l1, TierConfiguration l2, TierConfiguration predictive) {
        this.l1 = Objects.requireNonNull(l1, "l1 cannot be null");
        this.l2 = Objects.requireNonNull(l2, "l2 cannot be null");
        this.predictive = Objects.requireNonNull(predictive, "predictive cannot be null");
    }

    public static CacheConfiguration defaultConfig() {
        return new CacheConfiguration(DEFAULT_L1, DEFAULT_L2, DEFAULT_PREDICTIVE);
    }

    public TierConfiguration tier(CacheLevel level) {
        return switch (level) {
            case L1 -> l1;
            case L2 -> l2;
            case PREDICTIVE -> predictive;
        };
    }

    public CacheConfiguration withL1(TierConfiguration newL1) {
        return new CacheConfiguration(newL1, l2, predictive);
    }

    public CacheConfiguration withL2(TierConfiguration newL2) {
        return new CacheConfiguration(l1, newL2, predictive);
    }

    public CacheConfiguration withPredictive(TierConfiguration newPredictive) {
        return new CacheConfiguration(l1, l2, newPredictive);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheConfiguration that)) {
            return false;
        }
        return l1.equals(that.l1) && l2.equals(that.l2) && predictive.equals(that.predictive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(l1, l2, predictive);
    }

    @Override
    public String toString() {
        return "CacheConfiguration[l1=" + l1 + ", l2=" + l2 + ", predictive=" + predictive + "]";
    }
}
