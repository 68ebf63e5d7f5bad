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

import java.time.Duration;
import java.util.List;

/**
 * @param confidence  confidence in the extraction
 * @param complexity  structural complexity in [0, 1]
 * @param coherence   fraction of relations whose endpoints resolve; 0 without components
 * @param warnings    problems with the input or the run
 * @param suggestions advice for improving the structure
 * @author hal.hildebrand
 */
public record AnalysisMetadata(Duration processingTime, double confidence, String modelVersion, List<String> warnings,
                               List<String> suggestions, int componentCount, int relationCount, double complexity,
                               double coherence) {

    public AnalysisMetadata {
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
    }
}
