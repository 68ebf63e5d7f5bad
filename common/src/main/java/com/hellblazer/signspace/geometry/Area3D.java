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
package com.hellblazer.signspace.geometry;

import java.util.Objects;

/**
 * Axis-aligned volume described by its center and full width (x), height (y) and depth (z). Immutable; moving an
 * area produces a new instance.
 *
 * @author hal.hildebrand
 */
public final class Area3D {
    private final Point3D center;
    private final float   width;
    private final float   height;
    private final float   depth;

    public Area3D(Point3D center, float width, float height, float depth) {
        this.center = Objects.requireNonNull(center, "center");
        this.width = width;
        this.height = height;
        this.depth = depth;
    }

    /**
     * Create a cube of the given side length
     */
    public static Area3D cube(Point3D center, float side) {
        return new Area3D(center, side, side, side);
    }

    public Point3D getCenter() {
        return center;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public float getDepth() {
        return depth;
    }

    public float getHalfWidth() {
        return width / 2;
    }

    public float getHalfHeight() {
        return height / 2;
    }

    public float getHalfDepth() {
        return depth / 2;
    }

    /**
     * Largest of the three dimensions
     */
    public float getMaxDimension() {
        return Math.max(width, Math.max(height, depth));
    }

    /**
     * Positive sizes and a finite center
     */
    public boolean isValid() {
        return center.isFinite() && width > 0 && height > 0 && depth > 0 && Float.isFinite(width)
        && Float.isFinite(height) && Float.isFinite(depth);
    }

    public Area3D moveTo(Point3D newCenter) {
        return new Area3D(newCenter, width, height, depth);
    }

    public Area3D translate(Vector3D displacement) {
        return new Area3D(center.add(displacement), width, height, depth);
    }

    /**
     * Strict point containment; points on the boundary are outside.
     */
    public boolean contains(Point3D point) {
        return Math.abs(point.x - center.x) < getHalfWidth() && Math.abs(point.y - center.y) < getHalfHeight()
        && Math.abs(point.z - center.z) < getHalfDepth();
    }

    /**
     * Check whether the two volumes overlap on every axis
     */
    public boolean intersects(Area3D other) {
        return intersects(other, 1.0f);
    }

    /**
     * Overlap test where the combined half extents are scaled by {@code factor}. A factor below one only reports
     * overlaps that encroach deeper than the scaled extents.
     */
    public boolean intersects(Area3D other, float factor) {
        float dx = Math.abs(center.x - other.center.x);
        float dy = Math.abs(center.y - other.center.y);
        float dz = Math.abs(center.z - other.center.z);
        return dx < (getHalfWidth() + other.getHalfWidth()) * factor
        && dy < (getHalfHeight() + other.getHalfHeight()) * factor
        && dz < (getHalfDepth() + other.getHalfDepth()) * factor;
    }

    /**
     * Fraction of the combined half extent consumed on the least overlapping axis, 0 when the volumes are separated
     * and approaching 1 as their centers coincide.
     */
    public float encroachment(Area3D other) {
        if (!intersects(other)) {
            return 0f;
        }
        float ex = 1f - Math.abs(center.x - other.center.x) / (getHalfWidth() + other.getHalfWidth());
        float ey = 1f - Math.abs(center.y - other.center.y) / (getHalfHeight() + other.getHalfHeight());
        float ez = 1f - Math.abs(center.z - other.center.z) / (getHalfDepth() + other.getHalfDepth());
        return Math.min(ex, Math.min(ey, ez));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Area3D other)) return false;
        return center.equals(other.center) && Float.compare(width, other.width) == 0
        && Float.compare(height, other.height) == 0 && Float.compare(depth, other.depth) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(center, width, height, depth);
    }

    @Override
    public String toString() {
        return String.format("Area3D[center=(%.2f,%.2f,%.2f), size=%.2fx%.2fx%.2f]", center.x, center.y, center.z,
                             width, height, depth);
    }
}
