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
package com.hellblazer.signspace.spatial.analysis;

import com.hellblazer.signspace.geometry.Point3D;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable spatial component extracted from input or derived from a layout element.
 *
 * @author hal.hildebrand
 */
public record SpatialComponent(String id, ComponentKind kind, Point3D position, Map<String, Object> properties) {

    public SpatialComponent {
        Objects.requireNonNull(position, "position");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
