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
package com.hellblazer.signspace.spatial.layout;

import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;
import com.hellblazer.signspace.spatial.SpatialException.LayoutException;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import com.hellblazer.signspace.spatial.zone.ReferenceZone;
import com.hellblazer.signspace.spatial.zone.ReferenceZoneGenerator;
import com.hellblazer.signspace.spatial.zone.ZoneMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Places elements in reference zones, relates them and spreads them out so that they remain distinguishable.
 *
 * <p>Position optimization is a fixed-cap pairwise pass, so results are reproducible.
 *
 * @author hal.hildebrand
 */
public class LayoutGenerator {
    public static final float  CIRCLE_RADIUS      = 0.3f;
    public static final int    OVERLAP_ITERATIONS = 5;
    public static final float  SEPARATION_MARGIN  = 1.1f;
    public static final int    VISIBLE_ELEMENTS   = 3;
    public static final String PRESENT_SEGMENT    = "present";

    private static final Logger log = LoggerFactory.getLogger(LayoutGenerator.class);

    private static final float ACTANT_FILL        = 0.8f;
    private static final float CONTAINER_FILL     = 0.9f;
    private static final float PRESENT_IMPORTANCE = 0.9f;
    private static final float SEGMENT_IMPORTANCE = 0.7f;
    private static final float COINCIDENT         = 0.001f;
    private static final float COINCIDENT_OFFSET  = 0.1f;
    private static final float VISIBILITY_DEPTH   = 0.9f;
    private static final float VISIBILITY_LIFT    = 0.05f;

    /**
     * @param context generating context, may be null
     * @throws LayoutException when there are no zones or the result fails {@link #validateLayout}
     */
    public SpatialLayout generateLayout(List<ReferenceZone> zones, CulturalContext context) {
        if (zones == null || zones.isEmpty()) {
            throw new LayoutException("Cannot generate a layout without reference zones");
        }
        var layout = new SpatialLayout(zones);
        placeElements(layout);
        createRelations(layout);
        optimizeElementPositions(layout);
        if (!validateLayout(layout)) {
            throw new LayoutException("Invalid spatial layout generated: " + layout);
        }
        log.debug("Generated layout for {}: {}", context == null ? "no context" : context.getRegion(), layout);
        return layout;
    }

    public void placeElements(SpatialLayout layout) {
        for (var zone : layout.getZones()) {
            if (zone.getArea() == null) {
                log.warn("Zone {} has no area, no elements placed", zone.getId());
                continue;
            }
            switch (zone.getKind()) {
                case ACTANT -> placeActant(zone, layout);
                case TIMELINE -> placeTimeMarkers(zone, layout);
                case TOPIC -> placeTopicMarker(zone, layout);
                case CONTAINER -> placeContainer(zone, layout);
                case ABSTRACT -> placeAbstractConcept(zone, layout);
                case NEUTRAL -> {
                    // anchors nothing
                }
            }
        }
    }

    public void createRelations(SpatialLayout layout) {
        var entities = layout.getElements(ElementKind.ENTITY);
        for (int i = 0; i < entities.size(); i++) {
            for (int j = i + 1; j < entities.size(); j++) {
                var a = entities.get(i);
                var b = entities.get(j);
                layout.addRelation(new SpatialRelation(relationId(a, b), RelationKind.HIERARCHY, a.getId(), b.getId(),
                                                       0.8f, Map.of("relationName", "subject-object")));
            }
        }

        for (var marker : layout.getElements()) {
            var segment = marker.getProperties().timeSegment();
            if (segment == null) {
                continue;
            }
            for (var entity : entities) {
                layout.addRelation(new SpatialRelation(relationId(marker, entity), RelationKind.ALIGNMENT,
                                                       marker.getId(), entity.getId(), 0.7f,
                                                       Map.of("temporalAlignment", segment)));
            }
        }

        for (var container : layout.getElements(ElementKind.CONTAINER)) {
            var bounds = container.bounds();
            if (bounds.isEmpty()) {
                continue;
            }
            for (var element : layout.getElements()) {
                if (element.getKind() != ElementKind.CONTAINER && bounds.get().contains(element.getPosition())) {
                    layout.addRelation(new SpatialRelation(relationId(container, element), RelationKind.CONTAINMENT,
                                                           container.getId(), element.getId(), 0.9f,
                                                           Map.of("relationName", "container-contained")));
                }
            }
        }
    }

    /**
     * Spread elements sharing a zone on a circle around its center, push overlapping elements apart, then bring the
     * most important elements forward and up.
     */
    public void optimizeElementPositions(SpatialLayout layout) {
        var byZone = new LinkedHashMap<String, List<SpatialElement>>();
        for (var element : layout.getElements()) {
            element.getZoneId().ifPresent(z -> byZone.computeIfAbsent(z, k -> new ArrayList<>()).add(element));
        }
        for (var entry : byZone.entrySet()) {
            if (entry.getValue().size() > 1) {
                layout.getZone(entry.getKey())
                      .filter(z -> z.getArea() != null)
                      .ifPresent(z -> distribute(entry.getValue(), z.getCenter()));
            }
        }

        var elements = layout.getElements();
        resolveOverlaps(elements);
        improveVisibility(elements);
    }

    /**
     * Zones and elements present, every zone reference and relation endpoint resolves
     */
    public boolean validateLayout(SpatialLayout layout) {
        if (layout.getZones().isEmpty() || layout.elementCount() == 0) {
            return false;
        }
        for (var element : layout.getElements()) {
            var zoneId = element.getZoneId();
            if (zoneId.isPresent() && layout.getZone(zoneId.get()).isEmpty()) {
                return false;
            }
        }
        for (var relation : layout.getRelations()) {
            if (!layout.hasElement(relation.sourceId()) || !layout.hasElement(relation.targetId())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Element pairs still overlapping
     */
    public static int countOverlaps(SpatialLayout layout) {
        var elements = layout.getElements();
        int count = 0;
        for (int i = 0; i < elements.size(); i++) {
            for (int j = i + 1; j < elements.size(); j++) {
                if (elements.get(i).overlaps(elements.get(j))) {
                    count++;
                }
            }
        }
        return count;
    }

    private void distribute(List<SpatialElement> elements, Point3D center) {
        var step = 2.0 * Math.PI / elements.size();
        for (int i = 0; i < elements.size(); i++) {
            var angle = i * step;
            elements.get(i)
                    .setPosition(new Point3D(center.x + CIRCLE_RADIUS * (float) Math.cos(angle), center.y,
                                             center.z + CIRCLE_RADIUS * (float) Math.sin(angle)));
        }
    }

    private void resolveOverlaps(List<SpatialElement> elements) {
        for (int iteration = 0; iteration < OVERLAP_ITERATIONS; iteration++) {
            boolean resolved = true;
            for (int i = 0; i < elements.size(); i++) {
                for (int j = i + 1; j < elements.size(); j++) {
                    var a = elements.get(i);
                    var b = elements.get(j);
                    if (a.overlaps(b)) {
                        separate(a, b);
                        resolved = false;
                    }
                }
            }
            if (resolved) {
                log.debug("Element overlaps resolved after {} iterations", iteration);
                return;
            }
        }
    }

    /**
     * Push the pair apart to the required separation, the less important element moving further
     */
    private void separate(SpatialElement a, SpatialElement b) {
        var delta = b.getPosition().subtract(a.getPosition());
        var distance = delta.length();
        if (distance < COINCIDENT) {
            b.setPosition(b.getPosition().add(new Vector3D(COINCIDENT_OFFSET, 0f, COINCIDENT_OFFSET)));
            return;
        }
        var direction = delta.scale(1f / distance);
        var move = (a.radius() + b.radius()) * SEPARATION_MARGIN - distance;
        var importanceA = a.importance();
        var importanceB = b.importance();
        var total = importanceA + importanceB;
        float shareA = total > 0f ? importanceB / total : 0.5f;
        float shareB = total > 0f ? importanceA / total : 0.5f;
        a.setPosition(a.getPosition().add(direction.scale(-move * shareA)));
        b.setPosition(b.getPosition().add(direction.scale(move * shareB)));
    }

    private void improveVisibility(List<SpatialElement> elements) {
        var sorted = new ArrayList<>(elements);
        sorted.sort(Comparator.comparingDouble(SpatialElement::importance).reversed());
        for (int i = 0; i < Math.min(VISIBLE_ELEMENTS, sorted.size()); i++) {
            var element = sorted.get(i);
            var p = element.getPosition();
            element.setPosition(new Point3D(p.x, p.y + VISIBILITY_LIFT, p.z * VISIBILITY_DEPTH));
        }
    }

    private void placeActant(ReferenceZone zone, SpatialLayout layout) {
        var area = zone.getArea();
        var actant = zone.getMetadata(ZoneMetadata.Actant.class);
        var properties = ElementProperties.builder()
                                          .role(actant == null ? "generic" : actant.role())
                                          .importance(zone.getSignificance())
                                          .build();
        layout.putElement(new SpatialElement("actant-" + zone.getId(), ElementKind.ENTITY, area.getCenter(),
                                             new Vector3D(area.getWidth() * ACTANT_FILL,
                                                          area.getHeight() * ACTANT_FILL,
                                                          area.getDepth() * ACTANT_FILL), properties, zone.getId()));
    }

    private void placeTimeMarkers(ReferenceZone zone, SpatialLayout layout) {
        var area = zone.getArea();
        var timeline = zone.getMetadata(ZoneMetadata.Timeline.class);
        // one landmark per distinct segment, element ids derive from the segment name
        var segments = timeline == null || timeline.segments().isEmpty()
                       ? ReferenceZoneGenerator.DEFAULT_TIME_SEGMENTS
                       : List.copyOf(new LinkedHashSet<>(timeline.segments()));
        var segmentWidth = area.getWidth() / segments.size();
        var center = area.getCenter();
        for (int i = 0; i < segments.size(); i++) {
            var segment = segments.get(i);
            var offset = (i - (segments.size() - 1) / 2f) * segmentWidth;
            var properties = ElementProperties.builder()
                                              .timeSegment(segment)
                                              .importance(PRESENT_SEGMENT.equals(segment) ? PRESENT_IMPORTANCE
                                                                                          : SEGMENT_IMPORTANCE)
                                              .build();
            layout.putElement(new SpatialElement("time-" + segment, ElementKind.LANDMARK,
                                                 center.withX(center.x + offset), null, properties, zone.getId()));
        }
    }

    private void placeTopicMarker(ReferenceZone zone, SpatialLayout layout) {
        var topic = zone.getMetadata(ZoneMetadata.Topic.class);
        var properties = ElementProperties.builder()
                                          .thematicField(orDefault(topic == null ? null : topic.thematicField(),
                                                                   "general"))
                                          .emphasis(orDefault(topic == null ? null : topic.emphasis(), "standard"))
                                          .build();
        layout.putElement(new SpatialElement("topic-" + zone.getId(), ElementKind.LANDMARK, zone.getCenter(), null,
                                             properties, zone.getId()));
    }

    private void placeContainer(ReferenceZone zone, SpatialLayout layout) {
        var area = zone.getArea();
        var container = zone.getMetadata(ZoneMetadata.Container.class);
        var properties = ElementProperties.builder()
                                          .containerType(orDefault(
                                          container == null ? null : container.containerType(), "generic"))
                                          .importance(zone.getSignificance())
                                          .build();
        layout.putElement(new SpatialElement("container-" + zone.getId(), ElementKind.CONTAINER, area.getCenter(),
                                             new Vector3D(area.getWidth() * CONTAINER_FILL,
                                                          area.getHeight() * CONTAINER_FILL,
                                                          area.getDepth() * CONTAINER_FILL), properties,
                                             zone.getId()));
    }

    private void placeAbstractConcept(ReferenceZone zone, SpatialLayout layout) {
        var concept = zone.getMetadata(ZoneMetadata.Abstract.class);
        var properties = ElementProperties.builder()
                                          .conceptType(orDefault(concept == null ? null : concept.conceptType(),
                                                                 "abstract"))
                                          .importance(zone.getSignificance())
                                          .build();
        layout.putElement(new SpatialElement("abstract-" + zone.getId(), ElementKind.CONCEPT, zone.getCenter(), null,
                                             properties, zone.getId()));
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static String relationId(SpatialElement source, SpatialElement target) {
        return "relation-" + source.getId() + "-" + target.getId();
    }
}
