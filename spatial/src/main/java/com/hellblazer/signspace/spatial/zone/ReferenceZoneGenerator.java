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
package com.hellblazer.signspace.spatial.zone;

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;
import com.hellblazer.signspace.spatial.context.ContextTag;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Synthesizes the reference zones for a cultural context and resolves overlaps between them.
 *
 * <p>Overlap resolution is deterministic and capped. Zones are processed in ascending priority number; a zone is only
 * ever displaced away from zones processed before it, so the lowest priority numbers are never moved.
 *
 * @author hal.hildebrand
 */
public class ReferenceZoneGenerator {
    public static final String TIMELINE_MAIN     = "timeline-main";
    public static final String ACTANT_LEFT       = "actant-left";
    public static final String ACTANT_RIGHT      = "actant-right";
    public static final String TOPIC_MAIN        = "topic-main";
    public static final String NEUTRAL_CENTER    = "neutral-center";
    public static final String ABSTRACT_CONCEPTS = "abstract-concepts";
    public static final String CONTAINER_MAIN    = "container-main";

    public static final List<String> DEFAULT_TIME_SEGMENTS = List.of("past", "present", "future");

    /** Sweeps over the already placed zones before giving up on a zone */
    public static final int MAX_SWEEPS = 8;

    private static final Logger log = LoggerFactory.getLogger(ReferenceZoneGenerator.class);

    private static final float ACTANT_BASE_SIZE      = 0.4f;
    private static final float ACTANT_FORMALITY_SIZE = 0.1f;
    private static final float FORMAL_EMPHASIS       = 0.7f;
    private static final float DISPLACEMENT_MARGIN   = 1.05f;
    private static final float DISPLACEMENT_EPSILON  = 1e-4f;
    private static final float COINCIDENT            = 0.001f;
    private static final float AXIS_EPSILON          = 1e-6f;

    /**
     * Every zone kind applicable to the context, overlap resolved
     */
    public List<ReferenceZone> generateZones(CulturalContext context) {
        Objects.requireNonNull(context, "context");
        var zones = new ArrayList<ReferenceZone>();
        for (var kind : ZoneKind.values()) {
            zones.addAll(generateZonesByType(context, kind));
        }
        var optimized = optimizeZoneLayout(zones);
        log.debug("Generated {} zones for {}", optimized.size(), context.getRegion());
        return optimized;
    }

    public List<ReferenceZone> generateZonesByType(CulturalContext context, ZoneKind kind) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case TIMELINE -> timelineZones(context);
            case ACTANT -> actantZones(context);
            case TOPIC -> topicZones(context);
            case NEUTRAL -> neutralZones();
            case ABSTRACT -> abstractZones(context);
            case CONTAINER -> containerZones(context);
        };
    }

    /**
     * Resolve overlaps on copies of the given zones.
     *
     * @return the copies, ordered by ascending priority number
     */
    public List<ReferenceZone> optimizeZoneLayout(List<ReferenceZone> zones) {
        var placed = new ArrayList<ReferenceZone>(zones.size());
        for (var zone : zones) {
            placed.add(zone.copy());
        }
        placed.sort(Comparator.comparingInt(ReferenceZone::getPriority));

        for (int i = 1; i < placed.size(); i++) {
            var current = placed.get(i);
            if (current.getArea() == null) {
                continue;
            }
            boolean moved = true;
            for (int sweep = 0; moved && sweep < MAX_SWEEPS; sweep++) {
                moved = false;
                for (int j = 0; j < i; j++) {
                    var previous = placed.get(j);
                    if (current.overlaps(previous)) {
                        displace(current, previous);
                        moved = true;
                    }
                }
            }
            if (moved && overlapsAny(current, placed.subList(0, i))) {
                log.warn("Zone {} still overlaps after {} sweeps", current.getId(), MAX_SWEEPS);
            }
        }
        return placed;
    }

    /**
     * Move {@code current} away from {@code fixed} along the center to center direction, far enough to separate the
     * two volumes on the first axis that clears, plus a margin.
     */
    void displace(ReferenceZone current, ReferenceZone fixed) {
        var a = current.getArea();
        var b = fixed.getArea();
        var delta = a.getCenter().subtract(b.getCenter());
        var length = delta.length();
        if (length < COINCIDENT) {
            current.translate(new Vector3D(0.2f, 0f, 0.1f));
            log.debug("Coincident zones {} and {}, fixed offset applied", current.getId(), fixed.getId());
            return;
        }
        var direction = delta.scale(1f / length);
        float travel = Float.MAX_VALUE;
        travel = Math.min(travel, axisTravel(delta.x, direction.x, a.getHalfWidth() + b.getHalfWidth()));
        travel = Math.min(travel, axisTravel(delta.y, direction.y, a.getHalfHeight() + b.getHalfHeight()));
        travel = Math.min(travel, axisTravel(delta.z, direction.z, a.getHalfDepth() + b.getHalfDepth()));
        travel = travel * DISPLACEMENT_MARGIN + DISPLACEMENT_EPSILON;
        current.translate(direction.scale(travel));
        log.debug("Displaced zone {} by {} away from {}", current.getId(), travel, fixed.getId());
    }

    private static float axisTravel(float separation, float direction, float combinedHalfExtent) {
        var rate = Math.abs(direction);
        if (rate < AXIS_EPSILON) {
            return Float.MAX_VALUE;
        }
        return Math.max(0f, combinedHalfExtent - Math.abs(separation)) / rate;
    }

    private static boolean overlapsAny(ReferenceZone zone, List<ReferenceZone> others) {
        for (var other : others) {
            if (zone.overlaps(other)) {
                return true;
            }
        }
        return false;
    }

    private List<ReferenceZone> timelineZones(CulturalContext context) {
        var direction = "france".equals(context.getRegion()) ? "left-to-right" : "context-dependent";
        var segments = List.copyOf(new LinkedHashSet<>(
        context.getListParameter(CulturalContext.PARAM_TIME_SEGMENTS, DEFAULT_TIME_SEGMENTS)));
        return List.of(new ReferenceZone(TIMELINE_MAIN, "Main timeline", ZoneKind.TIMELINE,
                                         new Area3D(new Point3D(0f, 0f, 0.5f), 1.5f, 0.2f, 0.2f), 0.9f, 1,
                                         new ZoneMetadata.Timeline(direction, segments)));
    }

    private List<ReferenceZone> actantZones(CulturalContext context) {
        var size = context.hasFormalityLevel() ? ACTANT_BASE_SIZE + context.getFormalityLevel() * ACTANT_FORMALITY_SIZE
                                               : ACTANT_BASE_SIZE;
        var usage = context.getTag().map(ContextTag::label).orElse("standard");
        return List.of(new ReferenceZone(ACTANT_LEFT, "Left actant", ZoneKind.ACTANT,
                                         Area3D.cube(new Point3D(-0.7f, 0f, 0.3f), size), 0.8f, 2,
                                         new ZoneMetadata.Actant("subject", usage)),
                       new ReferenceZone(ACTANT_RIGHT, "Right actant", ZoneKind.ACTANT,
                                         Area3D.cube(new Point3D(0.7f, 0f, 0.3f), size), 0.8f, 2,
                                         new ZoneMetadata.Actant("object", usage)));
    }

    private List<ReferenceZone> topicZones(CulturalContext context) {
        var thematicField = context.getStringParameter(CulturalContext.PARAM_THEMATIC_FIELD, "general");
        var emphasis = context.isFormal(FORMAL_EMPHASIS) ? "formal" : "standard";
        return List.of(new ReferenceZone(TOPIC_MAIN, "Main topic", ZoneKind.TOPIC,
                                         new Area3D(new Point3D(0f, 0.3f, 0.3f), 0.5f, 0.5f, 0.3f), 0.75f, 3,
                                         new ZoneMetadata.Topic(thematicField, emphasis)));
    }

    private List<ReferenceZone> neutralZones() {
        return List.of(new ReferenceZone(NEUTRAL_CENTER, "Neutral center", ZoneKind.NEUTRAL,
                                         Area3D.cube(Point3D.ORIGIN, 0.5f), 0.8f, 2, new ZoneMetadata.Neutral()));
    }

    private List<ReferenceZone> abstractZones(CulturalContext context) {
        if (context.getTag().orElse(null) != ContextTag.ABSTRACT_REASONING) {
            return List.of();
        }
        return List.of(new ReferenceZone(ABSTRACT_CONCEPTS, "Abstract concepts", ZoneKind.ABSTRACT,
                                         Area3D.cube(new Point3D(0f, 0.5f, 0.5f), 0.6f), 0.7f, 4,
                                         new ZoneMetadata.Abstract("abstract")));
    }

    private List<ReferenceZone> containerZones(CulturalContext context) {
        if (!context.getBooleanParameter(CulturalContext.PARAM_HAS_CONTAINERS)) {
            return List.of();
        }
        var containerType = context.getStringParameter(CulturalContext.PARAM_CONTAINER_TYPE, "generic");
        return List.of(new ReferenceZone(CONTAINER_MAIN, "Main container", ZoneKind.CONTAINER,
                                         new Area3D(new Point3D(0f, 0.2f, 0.7f), 0.8f, 0.6f, 0.6f), 0.6f, 5,
                                         new ZoneMetadata.Container(containerType)));
    }
}
