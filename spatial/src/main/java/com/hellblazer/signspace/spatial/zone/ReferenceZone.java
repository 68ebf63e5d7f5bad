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
package com.hellblazer.signspace.spatial.zone;

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;

import java.util.Objects;

/**
 * A named, typed region of the signing space used to anchor meaning. The area is the only mutable part: overlap
 * resolution moves zones in place. Identity and metadata are fixed at construction.
 *
 * @author hal.hildebrand
 */
public class ReferenceZone {
    private final String       id;
    private final String       name;
    private final ZoneKind     kind;
    private final float        significance;
    private final int          priority;
    private final ZoneMetadata metadata;
    private       Area3D       area;

    /**
     * @param id           identifier, unique within a layout
     * @param name         display name
     * @param kind         zone kind
     * @param area         bounding volume, may be null for malformed input
     * @param significance importance weight, clamped to [0, 1]
     * @param priority     lower values are processed first and never displaced by higher values
     * @param metadata     typed metadata
     */
    public ReferenceZone(String id, String name, ZoneKind kind, Area3D area, float significance, int priority,
                         ZoneMetadata metadata) {
        this.id = id;
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.area = area;
        this.significance = Float.isNaN(significance) ? 0f : Math.max(0f, Math.min(1f, significance));
        this.priority = priority;
        this.metadata = metadata == null ? new ZoneMetadata.Neutral() : metadata;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ZoneKind getKind() {
        return kind;
    }

    public Area3D getArea() {
        return area;
    }

    public Point3D getCenter() {
        return area == null ? null : area.getCenter();
    }

    public float getSignificance() {
        return significance;
    }

    public int getPriority() {
        return priority;
    }

    public ZoneMetadata getMetadata() {
        return metadata;
    }

    /**
     * Metadata as the given variant, or null when the zone carries a different variant
     */
    public <M extends ZoneMetadata> M getMetadata(Class<M> type) {
        return type.isInstance(metadata) ? type.cast(metadata) : null;
    }

    public void setArea(Area3D area) {
        this.area = area;
    }

    public void moveTo(Point3D center) {
        this.area = area.moveTo(center);
    }

    public void translate(Vector3D displacement) {
        this.area = area.translate(displacement);
    }

    /**
     * Bounding volume overlap on all three axes
     */
    public boolean overlaps(ReferenceZone other) {
        return area != null && other.area != null && area.intersects(other.area);
    }

    /**
     * Independent copy; metadata is immutable and shared
     */
    public ReferenceZone copy() {
        return new ReferenceZone(id, name, kind, area, significance, priority, metadata);
    }

    @Override
    public String toString() {
        return String.format("ReferenceZone[id=%s, kind=%s, priority=%d, significance=%.2f, %s]", id, kind, priority,
                             significance, area);
    }
}
