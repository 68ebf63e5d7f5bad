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
package com.hellblazer.signspace.spatial.layout;

import java.util.Map;

/**
 * Directed, weighted relation between two elements or components. Immutable; corrections produce a replacement.
 *
 * @param strength clamped to [0, 1]
 * @author hal.hildebrand
 */
public record SpatialRelation(String id, RelationKind kind, String sourceId, String targetId, float strength,
                              Map<String, Object> properties) {

    public SpatialRelation {
        strength = Float.isNaN(strength) ? 0f : Math.max(0f, Math.min(1f, strength));
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public SpatialRelation(String id, RelationKind kind, String sourceId, String targetId, float strength) {
        this(id, kind, sourceId, targetId, strength, Map.of());
    }

    public SpatialRelation withEndpoints(String newSource, String newTarget) {
        return new SpatialRelation(id, kind, newSource, newTarget, strength, properties);
    }

    public SpatialRelation withStrength(float newStrength) {
        return new SpatialRelation(id, kind, sourceId, targetId, newStrength, properties);
    }
}
