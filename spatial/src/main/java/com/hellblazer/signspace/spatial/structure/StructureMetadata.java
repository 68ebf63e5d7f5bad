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
package com.hellblazer.signspace.spatial.structure;

import com.hellblazer.signspace.spatial.context.CulturalContext;

import java.time.Instant;
import java.util.Objects;

/**
 * @param coherenceScore    weighted coherence of the generated layout
 * @param complexityScore   component kind diversity and relation density
 * @param optimizationScore one minus the fraction of element pairs still overlapping
 * @author hal.hildebrand
 */
public record StructureMetadata(Instant createdAt, CulturalContext context, double coherenceScore,
                                double complexityScore, double optimizationScore, int elementCount,
                                int relationCount) {

    public StructureMetadata {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(context, "context");
    }
}
