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
package com.hellblazer.signspace.spatial.proforme;

import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hand configuration: a named shape, one {@link FingerConfig} per finger and an overall tension in [0, 1].
 *
 * @author hal.hildebrand
 */
public record HandshapeConfig(String type, List<FingerConfig> fingers, float tension) {

    public HandshapeConfig {
        Objects.requireNonNull(type, "type");
        fingers = List.copyOf(fingers);
        var seen = new EnumMap<Finger, Boolean>(Finger.class);
        for (var config : fingers) {
            if (seen.put(config.finger(), Boolean.TRUE) != null) {
                throw new IllegalArgumentException("Duplicate finger " + config.finger() + " in handshape " + type);
            }
        }
        tension = clampUnit(tension);
    }

    /**
     * Every finger extended and closed together, neutral tension
     */
    public static HandshapeConfig basic(String type) {
        return new HandshapeConfig(type, List.of(new FingerConfig(Finger.INDEX, 0f, 0f),
                                                 new FingerConfig(Finger.MIDDLE, 0f, 0f),
                                                 new FingerConfig(Finger.RING, 0f, 0f),
                                                 new FingerConfig(Finger.PINKY, 0f, 0f),
                                                 new FingerConfig(Finger.THUMB, 0f, 0f)), 0.5f);
    }

    static float clampUnit(float value) {
        if (Float.isNaN(value)) {
            return 0f;
        }
        return Math.max(0f, Math.min(1f, value));
    }

    public Optional<FingerConfig> finger(Finger finger) {
        return fingers.stream().filter(f -> f.finger() == finger).findFirst();
    }

    /**
     * All five fingers described
     */
    public boolean isComplete() {
        return fingers.size() == Finger.values().length;
    }

    public HandshapeConfig withTension(float newTension) {
        return new HandshapeConfig(type, fingers, newTension);
    }
}
