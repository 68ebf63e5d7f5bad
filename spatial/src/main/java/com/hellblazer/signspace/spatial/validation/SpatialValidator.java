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

import com.hellblazer.signspace.spatial.SpatialException.ValidationException;
import com.hellblazer.signspace.spatial.layout.ElementKind;
import com.hellblazer.signspace.spatial.layout.RelationKind;
import com.hellblazer.signspace.spatial.layout.SpatialLayout;
import com.hellblazer.signspace.spatial.proforme.ProformeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Scores the internal coherence of a layout: zone separation, relation consistency and proforme availability.
 *
 * @author hal.hildebrand
 */
public class SpatialValidator {
    /** Minimum score every metric must reach in {@link #validateStructure} */
    public static final double THRESHOLD = 0.85;

    private static final Logger log = LoggerFactory.getLogger(SpatialValidator.class);

    private static final double ZONE_BASE                 = 0.7;
    private static final double ZONE_COVERAGE             = 0.3;
    private static final int    ZONE_COVERAGE_COUNT       = 5;
    private static final double OVERLAP_PENALTY           = 0.1;
    private static final double DANGLING_PENALTY          = 0.2;
    private static final double CONFLICT_PENALTY          = 0.1;
    private static final int    MAX_KINDS_PER_PAIR        = 2;
    private static final double PROFORME_USAGE            = 0.95;
    private static final double PROFORME_USAGE_UNASSIGNED = 0.5;
    private static final double ZONE_WEIGHT               = 0.4;
    private static final double RELATION_WEIGHT           = 0.3;
    private static final double PROFORME_WEIGHT           = 0.3;

    private final ProformeRegistry proformes;

    public SpatialValidator(ProformeRegistry proformes) {
        this.proformes = Objects.requireNonNull(proformes, "proformes");
    }

    /**
     * Base score, less a penalty proportional to how deeply each overlapping pair encroaches, plus credit for zone
     * coverage. Clamped to [0, 1].
     */
    public double validateZoneCoherence(SpatialLayout layout) {
        var zones = layout.getZones();
        double penalty = 0.0;
        for (int i = 0; i < zones.size(); i++) {
            var a = zones.get(i).getArea();
            if (a == null) {
                continue;
            }
            for (int j = i + 1; j < zones.size(); j++) {
                var b = zones.get(j).getArea();
                if (b != null && a.intersects(b)) {
                    penalty += OVERLAP_PENALTY * a.encroachment(b);
                }
            }
        }
        var coverage = ZONE_COVERAGE * Math.min(1.0, (double) zones.size() / ZONE_COVERAGE_COUNT);
        return clamp(ZONE_BASE - penalty + coverage);
    }

    /**
     * Penalize relations with unresolved endpoints and element pairs linked by more than two distinct kinds
     */
    public double validateRelationConsistency(SpatialLayout layout) {
        int dangling = 0;
        var kindsByPair = new HashMap<List<String>, Set<RelationKind>>();
        for (var relation : layout.getRelations()) {
            if (!layout.hasElement(relation.sourceId()) || !layout.hasElement(relation.targetId())) {
                dangling++;
            }
            kindsByPair.computeIfAbsent(Arrays.asList(relation.sourceId(), relation.targetId()),
                                        k -> EnumSet.noneOf(RelationKind.class)).add(relation.kind());
        }
        int conflicts = 0;
        for (var kinds : kindsByPair.values()) {
            if (kinds.size() > MAX_KINDS_PER_PAIR) {
                conflicts++;
            }
        }
        return clamp(1.0 - DANGLING_PENALTY * dangling - CONFLICT_PENALTY * conflicts);
    }

    /**
     * Entities need some active proforme representing a concept to be signed with
     */
    public double validateProformeUsage(SpatialLayout layout) {
        if (layout.getElements(ElementKind.ENTITY).isEmpty()) {
            return PROFORME_USAGE;
        }
        for (var proforme : proformes.getActiveProformes()) {
            if (proforme.getRepresents() != null) {
                return PROFORME_USAGE;
            }
        }
        return PROFORME_USAGE_UNASSIGNED;
    }

    public double measureCoherence(SpatialLayout layout) {
        return report(layout).overall();
    }

    public CoherenceReport report(SpatialLayout layout) {
        Objects.requireNonNull(layout, "layout");
        var zone = validateZoneCoherence(layout);
        var relation = validateRelationConsistency(layout);
        var proforme = validateProformeUsage(layout);
        return new CoherenceReport(zone, relation, proforme,
                                   ZONE_WEIGHT * zone + RELATION_WEIGHT * relation + PROFORME_WEIGHT * proforme);
    }

    /**
     * @throws ValidationException carrying every metric when any falls below {@link #THRESHOLD}
     */
    public CoherenceReport validateStructure(SpatialLayout layout) {
        var report = report(layout);
        if (!report.passes(THRESHOLD)) {
            log.warn("Layout failed coherence validation: {}", report.scores());
            throw new ValidationException("Spatial structure below coherence threshold: " + report.scores(),
                                          report.scores(), THRESHOLD);
        }
        return report;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
