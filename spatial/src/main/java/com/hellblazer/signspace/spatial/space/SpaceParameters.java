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
package com.hellblazer.signspace.spatial.space;

import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;

import java.util.Optional;

/**
 * Partial override of the signing space frame. Absent values leave the current setting untouched.
 *
 * @param scale       uniform scale, must be positive when present
 * @param orientation facing direction, normalized on application
 * @param origin      frame origin in world coordinates
 * @param size        full width/height/depth of the bounding volume
 * @author hal.hildebrand
 */
public record SpaceParameters(Float scale, Vector3D orientation, Point3D origin, Vector3D size) {

    public SpaceParameters {
        if (scale != null && !(scale > 0f && Float.isFinite(scale))) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
        if (orientation != null && orientation.length() == 0f) {
            throw new IllegalArgumentException("orientation cannot be the zero vector");
        }
        if (size != null && (size.x <= 0f || size.y <= 0f || size.z <= 0f)) {
            throw new IllegalArgumentException("size must be positive on every axis: " + size);
        }
    }

    public static SpaceParameters none() {
        return new SpaceParameters(null, null, null, null);
    }

    public SpaceParameters withScale(float newScale) {
        return new SpaceParameters(newScale, orientation, origin, size);
    }

    public SpaceParameters withOrientation(Vector3D newOrientation) {
        return new SpaceParameters(scale, newOrientation, origin, size);
    }

    public SpaceParameters withOrigin(Point3D newOrigin) {
        return new SpaceParameters(scale, orientation, newOrigin, size);
    }

    public SpaceParameters withSize(Vector3D newSize) {
        return new SpaceParameters(scale, orientation, origin, newSize);
    }

    public Optional<Float> scaleOverride() {
        return Optional.ofNullable(scale);
    }

    public Optional<Vector3D> orientationOverride() {
        return Optional.ofNullable(orientation);
    }

    public Optional<Point3D> originOverride() {
        return Optional.ofNullable(origin);
    }

    public Optional<Vector3D> sizeOverride() {
        return Optional.ofNullable(size);
    }
}
