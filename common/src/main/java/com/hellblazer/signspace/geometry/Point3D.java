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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

/**
 * Immutable 3D point with float coordinates. Positions in the signing space are expressed in body-relative units
 * where the signer's chest is the origin, x grows to the signer's right, y grows upward and z grows away from the
 * body.
 *
 * @author hal.hildebrand
 */
public final class Point3D {

    public static final Point3D ORIGIN = new Point3D(0, 0, 0);

    /** X coordinate */
    public final float x;

    /** Y coordinate */
    public final float y;

    /** Z coordinate */
    public final float z;

    public Point3D(float x, float y, float z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Create a point from any vecmath tuple.
     */
    public static Point3D of(Tuple3f tuple) {
        return new Point3D(tuple.x, tuple.y, tuple.z);
    }

    /**
     * Translate this point by a vector.
     *
     * @param v displacement
     * @return new translated point
     */
    public Point3D add(Vector3D v) {
        return new Point3D(x + v.x, y + v.y, z + v.z);
    }

    /**
     * Vector from {@code other} to this point.
     */
    public Vector3D subtract(Point3D other) {
        return new Vector3D(x - other.x, y - other.y, z - other.z);
    }

    /**
     * Scale every coordinate by a factor.
     */
    public Point3D scale(float factor) {
        return new Point3D(x * factor, y * factor, z * factor);
    }

    public float distance(Point3D other) {
        return (float) Math.sqrt(distanceSquared(other));
    }

    /**
     * Squared Euclidean distance, avoids sqrt()
     */
    public float distanceSquared(Point3D other) {
        float dx = x - other.x;
        float dy = y - other.y;
        float dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public boolean isFinite() {
        return Float.isFinite(x) && Float.isFinite(y) && Float.isFinite(z);
    }

    public Point3D withX(float newX) {
        return new Point3D(newX, y, z);
    }

    public Point3D withY(float newY) {
        return new Point3D(x, newY, z);
    }

    public Point3D withZ(float newZ) {
        return new Point3D(x, y, newZ);
    }

    public Point3f toPoint3f() {
        return new Point3f(x, y, z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3D other)) return false;
        return Float.compare(x, other.x) == 0 && Float.compare(y, other.y) == 0 && Float.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        int result = Float.hashCode(x);
        result = 31 * result + Float.hashCode(y);
        result = 31 * result + Float.hashCode(z);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Point3D(%.3f, %.3f, %.3f)", x, y, z);
    }
}
