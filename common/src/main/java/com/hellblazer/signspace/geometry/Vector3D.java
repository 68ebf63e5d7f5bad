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

import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Immutable 3D vector with float components.
 *
 * @author hal.hildebrand
 */
public final class Vector3D {

    public static final Vector3D ZERO    = new Vector3D(0, 0, 0);
    public static final Vector3D FORWARD = new Vector3D(0, 0, 1);

    public final float x;
    public final float y;
    public final float z;

    public Vector3D(float x, float y, float z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Vector3D of(Tuple3f tuple) {
        return new Vector3D(tuple.x, tuple.y, tuple.z);
    }

    public Vector3D add(Vector3D other) {
        return new Vector3D(x + other.x, y + other.y, z + other.z);
    }

    public Vector3D scale(float factor) {
        return new Vector3D(x * factor, y * factor, z * factor);
    }

    public float dot(Vector3D other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public float length() {
        return (float) Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Unit vector in the same direction. The zero vector normalizes to itself.
     */
    public Vector3D normalize() {
        float len = length();
        if (len == 0f) {
            return this;
        }
        return new Vector3D(x / len, y / len, z / len);
    }

    public boolean isFinite() {
        return Float.isFinite(x) && Float.isFinite(y) && Float.isFinite(z);
    }

    public Vector3f toVector3f() {
        return new Vector3f(x, y, z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vector3D other)) return false;
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
        return String.format("Vector3D(%.3f, %.3f, %.3f)", x, y, z);
    }
}
