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
package com.hellblazer.signspace.spatial.structure;

import com.hellblazer.signspace.spatial.cache.CacheConfiguration;

import java.util.Objects;

/**
 * Settings of the structure manager.
 *
 * @param strictValidation reject generated structures whose coherence metrics fall below the validator threshold
 * @param cacheConfiguration tiers of the cache built by {@link SpatialStructureManager#create(ManagerConfiguration)}
 * @author hal.hildebrand
 */
public record ManagerConfiguration(boolean strictValidation, CacheConfiguration cacheConfiguration) {

    public ManagerConfiguration {
        Objects.requireNonNull(cacheConfiguration, "cacheConfiguration cannot be null");
    }

    public static ManagerConfiguration defaultConfig() {
        return new ManagerConfiguration(false, CacheConfiguration.defaultConfig());
    }

    public ManagerConfiguration withStrictValidation(boolean strict) {
        return new ManagerConfiguration(strict, cacheConfiguration);
    }

    public ManagerConfiguration withCacheConfiguration(CacheConfiguration newCacheConfiguration) {
        return new ManagerConfiguration(strictValidation, newCacheConfiguration);
    }
}
