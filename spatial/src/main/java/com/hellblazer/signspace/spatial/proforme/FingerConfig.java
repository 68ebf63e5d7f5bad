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

import java.util.Objects;

/**
 * Bend and spread of one finger, both clamped to [0, 1]. Bend 0 is fully extended, 1 fully closed.
 *
 * @author hal.hildebrand
 */
public record FingerConfig(Finger finger, float bend, float spread) {

    public FingerConfig {
        Objects.requireNonNull(finger, "finger");
        bend = HandshapeConfig.clampUnit(bend);
        spread = HandshapeConfig.clampUnit(spread);
    }
}
