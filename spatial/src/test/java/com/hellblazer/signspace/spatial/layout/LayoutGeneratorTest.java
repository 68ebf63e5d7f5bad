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

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;
import com.hellblazer.signspace.spatial.SpatialException.LayoutException;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import com.hellblazer.signspace.spatial.zone.ReferenceZone;
import com.hellblazer.signspace.spatial.zone.ReferenceZoneGenerator;
import com.hellblazer.signspace.spatial.zone.ZoneKind;
import com.hellblazer.signspace.spatial.zone.ZoneMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LayoutGeneratorTest {

    private LayoutGenerator generator;

    @BeforeEach
    public void setUp() {
        generator = new LayoutGenerator();
    }

    private static ReferenceZone neutralZone() {
        return new ReferenceZone("zone", "zone", ZoneKind.NEUTRAL, Area3D.cube(Point3D.ORIGIN, 1f), 0.5f, 1,
                                 new ZoneMetadata.Neutral());
    }

    private static SpatialElement point(String id, Point3D position, float importance, String zoneId) {
        return new SpatialElement(id, ElementKind.LANDMARK, position, null,
                                  ElementProperties.builder().importance(importance).build(), zoneId);
    }

    @Test
    @DisplayName("Layout generation without zones fails")
    public void testEmptyZones() {
        assertThrows(LayoutException.class, () -> generator.generateLayout(List.of(), null));
        assertThrows(LayoutException.class, () -> generator.generateLayout(null, null));
    }

    @Test
    public void testGeneratedLayout() {
        var context = CulturalContext.of("france", 0.5f);
        var zones = new ReferenceZoneGenerator().generateZones(context);
        var layout = generator.generateLayout(zones, context);

        assertEquals(2, layout.getElements(ElementKind.ENTITY).size());
        assertEquals(4, layout.getElements(ElementKind.LANDMARK).size());
        assertTrue(layout.hasElement("time-present"));
        assertEquals("subject", layout.getElement("actant-actant-left").orElseThrow().getProperties().role());

        // one hierarchy, three segments aligned with two entities
        assertEquals(7, layout.getRelations().size());
        assertEquals(1, layout.getRelations().stream().filter(r -> r.kind() == RelationKind.HIERARCHY).count());
        for (var relation : layout.getRelations()) {
            assertTrue(layout.hasElement(relation.sourceId()), relation.id());
            assertTrue(layout.hasElement(relation.targetId()), relation.id());
        }
        assertTrue(generator.validateLayout(layout));
        assertEquals(0, LayoutGenerator.countOverlaps(layout));
    }

    @Test
    public void testAlignmentCarriesTimeSegment() {
        var context = CulturalContext.of("france", 0.5f);
        var layout = generator.generateLayout(new ReferenceZoneGenerator().generateZones(context), context);
        var alignment = layout.getRelations()
                              .stream()
                              .filter(r -> r.id().equals("relation-time-past-actant-actant-right"))
                              .findFirst()
                              .orElseThrow();
        assertEquals(RelationKind.ALIGNMENT, alignment.kind());
        assertEquals("past", alignment.properties().get("temporalAlignment"));
        assertEquals(0.7f, alignment.strength(), 1e-6f);
    }

    @Test
    public void testRepeatedTimeSegmentsPlacedOnce() {
        var timeline = new ReferenceZone("timeline", "timeline", ZoneKind.TIMELINE,
                                         new Area3D(Point3D.ORIGIN, 1.5f, 0.2f, 0.2f), 0.9f, 1,
                                         new ZoneMetadata.Timeline("left-to-right", List.of("now", "now", "later")));
        var layout = new SpatialLayout(List.of(timeline));
        generator.placeElements(layout);

        assertEquals(2, layout.getElements(ElementKind.LANDMARK).size());
        assertEquals(-0.375f, layout.getElement("time-now").orElseThrow().getPosition().x, 1e-5f);
        assertEquals(0.375f, layout.getElement("time-later").orElseThrow().getPosition().x, 1e-5f);
    }

    @Test
    public void testContainmentRelations() {
        var layout = new SpatialLayout(List.of(neutralZone()));
        layout.putElement(new SpatialElement("box", ElementKind.CONTAINER, Point3D.ORIGIN, new Vector3D(1f, 1f, 1f),
                                             ElementProperties.EMPTY, "zone"));
        layout.putElement(point("inside", new Point3D(0.1f, 0f, 0f), 0.5f, "zone"));
        layout.putElement(point("outside", new Point3D(2f, 0f, 0f), 0.5f, "zone"));

        generator.createRelations(layout);
        assertEquals(1, layout.getRelations().size());
        var containment = layout.getRelations().get(0);
        assertEquals(RelationKind.CONTAINMENT, containment.kind());
        assertEquals("box", containment.sourceId());
        assertEquals("inside", containment.targetId());
        assertEquals(0.9f, containment.strength(), 1e-6f);
    }

    @Test
    public void testElementsDistributedAroundZone() {
        var layout = new SpatialLayout(List.of(neutralZone()));
        layout.putElement(point("a", Point3D.ORIGIN, 0.5f, "zone"));
        layout.putElement(point("b", Point3D.ORIGIN, 0.5f, "zone"));

        generator.optimizeElementPositions(layout);
        var a = layout.getElement("a").orElseThrow().getPosition();
        var b = layout.getElement("b").orElseThrow().getPosition();
        assertEquals(LayoutGenerator.CIRCLE_RADIUS, a.x, 1e-5f);
        assertEquals(-LayoutGenerator.CIRCLE_RADIUS, b.x, 1e-5f);
        // both among the most important, lifted
        assertEquals(0.05f, a.y, 1e-5f);
        assertEquals(0.05f, b.y, 1e-5f);
    }

    @Test
    @DisplayName("The less important element moves further when separating")
    public void testOverlapSplitByImportance() {
        var layout = new SpatialLayout(List.of());
        layout.putElement(point("important", Point3D.ORIGIN, 0.9f, null));
        layout.putElement(point("minor", new Point3D(0.05f, 0f, 0f), 0.1f, null));
        assertEquals(1, LayoutGenerator.countOverlaps(layout));

        generator.optimizeElementPositions(layout);
        var important = layout.getElement("important").orElseThrow().getPosition();
        var minor = layout.getElement("minor").orElseThrow().getPosition();
        assertEquals(0, LayoutGenerator.countOverlaps(layout));
        assertTrue(Math.abs(minor.x - 0.05f) > Math.abs(important.x));
        assertEquals(-0.017f, important.x, 1e-4f);
        assertEquals(0.203f, minor.x, 1e-4f);
    }

    @Test
    public void testValidateLayout() {
        var layout = new SpatialLayout(List.of(neutralZone()));
        assertFalse(generator.validateLayout(layout), "no elements");

        layout.putElement(point("a", Point3D.ORIGIN, 0.5f, "zone"));
        assertTrue(generator.validateLayout(layout));

        layout.addRelation(new SpatialRelation("dangling", RelationKind.HIERARCHY, "a", "ghost", 0.8f));
        assertFalse(generator.validateLayout(layout));

        var orphan = new SpatialLayout(List.of(neutralZone()));
        orphan.putElement(point("b", Point3D.ORIGIN, 0.5f, "missing-zone"));
        assertFalse(generator.validateLayout(orphan));
    }

    @Test
    public void testRelationKindParse() {
        assertEquals(RelationKind.CAUSAL, RelationKind.parse("causal", RelationKind.SEMANTIC));
        assertEquals(RelationKind.SEMANTIC, RelationKind.parse("unknown", RelationKind.SEMANTIC));
        assertEquals(RelationKind.SEMANTIC, RelationKind.parse(null, RelationKind.SEMANTIC));
    }
}
