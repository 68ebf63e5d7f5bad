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
package com.hellblazer.signspace.spatial.validation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Itemized coherence of a layout.
 *
 * @author hal.hildebrand
 */
public record CoherenceReport(double zoneCoherence, double relationConsistency, double proformeUsage,
                              double overall) {

    public static final String ZONE_COHERENCE       = "zoneCoherence";
    public static final String RELATION_CONSISTENCY = "relationConsistency";
    public static final String PROFORME_USAGE       = "proformeUsage";

    /**
     * Per metric scores keyed by metric name, in a stable order
     */
    public Map<String, Double> scores() {
        var scores = new LinkedHashMap<String, Double>();
        scores.put(ZONE_COHERENCE, zoneCoherence);
        scores.put(RELATION_CONSISTENCY, relationConsistency);
        scores.put(PROFORME_USAGE, proformeUsage);
        return scores;
    }

    public boolean passes(double threshold) {
        return zoneCoherence >= threshold && relationConsistency >= threshold && proformeUsage >= threshold;
    }
}
