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

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;

import java.util.Objects;
import java.util.Optional;

/**
 * An element placed in the signing space. The position is adjusted while the layout is optimized.
 *
 * @author hal.hildebrand
 */
public class SpatialElement {
    /** Radius assumed for elements without dimensions */
    public static final float DEFAULT_RADIUS = 0.1f;

    private final String            id;
    private final ElementKind       kind;
    private final Vector3D          dimensions;
    private final ElementProperties properties;
    private final String            zoneId;
    private       Point3D           position;

    /**
     * @param dimensions width, height and depth; null for point-like elements
     * @param zoneId     reference zone the element was placed in, may be null
     */
    public SpatialElement(String id, ElementKind kind, Point3D position, Vector3D dimensions,
                          ElementProperties properties, String zoneId) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = Objects.requireNonNull(position, "position");
        this.dimensions = dimensions;
        this.properties = properties == null ? ElementProperties.EMPTY : properties;
        this.zoneId = zoneId;
    }

    public String getId() {
        return id;
    }

    public ElementKind getKind() {
        return kind;
    }

    public Point3D getPosition() {
        return position;
    }

    public void setPosition(Point3D position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public Optional<Vector3D> getDimensions() {
        return Optional.ofNullable(dimensions);
    }

    public ElementProperties getProperties() {
        return properties;
    }

    public Optional<String> getZoneId() {
        return Optional.ofNullable(zoneId);
    }

    public float importance() {
        return properties.importanceOrDefault();
    }

    /**
     * Half the largest dimension, or {@link #DEFAULT_RADIUS}
     */
    public float radius() {
        if (dimensions == null) {
            return DEFAULT_RADIUS;
        }
        return Math.max(dimensions.x, Math.max(dimensions.y, dimensions.z)) / 2f;
    }

    /**
     * Bounding volume at the current position, empty for point-like elements
     */
    public Optional<Area3D> bounds() {
        if (dimensions == null) {
            return Optional.empty();
        }
        return Optional.of(new Area3D(position, dimensions.x, dimensions.y, dimensions.z));
    }

    public boolean overlaps(SpatialElement other) {
        return position.distance(other.position) < radius() + other.radius();
    }

    public SpatialElement copy() {
        return new SpatialElement(id, kind, position, dimensions, properties, zoneId);
    }

    @Override
    public String toString() {
        return String.format("SpatialElement[id=%s, kind=%s, position=%s, zone=%s]", id, kind, position, zoneId);
    }
}
