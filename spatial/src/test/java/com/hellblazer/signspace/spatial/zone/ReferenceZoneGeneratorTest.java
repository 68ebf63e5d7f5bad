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
import com.hellblazer.signspace.spatial.context.ContextTag;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ReferenceZoneGeneratorTest {

    private ReferenceZoneGenerator generator;

    @BeforeEach
    public void setUp() {
        generator = new ReferenceZoneGenerator();
    }

    private static ReferenceZone unitZone(String id, Point3D center, int priority) {
        return new ReferenceZone(id, id, ZoneKind.TOPIC, Area3D.cube(center, 1f), 0.5f, priority,
                                 new ZoneMetadata.Topic("general", "standard"));
    }

    private static void assertNoOverlap(List<ReferenceZone> zones) {
        for (int i = 0; i < zones.size(); i++) {
            for (int j = i + 1; j < zones.size(); j++) {
                assertFalse(zones.get(i).overlaps(zones.get(j)),
                            zones.get(i).getId() + " overlaps " + zones.get(j).getId());
            }
        }
    }

    @Test
    @DisplayName("France actant zones: subject on the left, object on the right")
    public void testFranceActantZones() {
        var zones = generator.generateZonesByType(CulturalContext.of("france", 0.5f), ZoneKind.ACTANT);
        assertEquals(2, zones.size());

        var left = zones.get(0);
        assertEquals(ReferenceZoneGenerator.ACTANT_LEFT, left.getId());
        assertEquals(-0.7f, left.getCenter().x, 1e-6f);
        assertEquals("subject", left.getMetadata(ZoneMetadata.Actant.class).role());
        assertEquals(0.4f, left.getArea().getWidth(), 0.06f);

        var right = zones.get(1);
        assertEquals(ReferenceZoneGenerator.ACTANT_RIGHT, right.getId());
        assertEquals(0.7f, right.getCenter().x, 1e-6f);
        assertEquals("object", right.getMetadata(ZoneMetadata.Actant.class).role());
        assertEquals(0.4f, right.getArea().getWidth(), 0.06f);
        assertEquals(right.getArea().getWidth(), right.getArea().getDepth());
    }

    @Test
    public void testActantSizeWithoutFormality() {
        var zones = generator.generateZonesByType(CulturalContext.of("france"), ZoneKind.ACTANT);
        assertEquals(0.4f, zones.get(0).getArea().getWidth(), 1e-6f);
        assertEquals("standard", zones.get(0).getMetadata(ZoneMetadata.Actant.class).contextualUsage());
    }

    @Test
    @DisplayName("Two overlapping unit zones are separated")
    public void testOverlapResolution() {
        var first = unitZone("first", Point3D.ORIGIN, 1);
        var second = unitZone("second", new Point3D(0.2f, 0.2f, 0.2f), 2);
        assertTrue(first.overlaps(second));

        var optimized = generator.optimizeZoneLayout(List.of(second, first));
        assertEquals("first", optimized.get(0).getId());
        assertEquals(Point3D.ORIGIN, optimized.get(0).getCenter(), "the lower priority number is never moved");
        assertFalse(optimized.get(0).overlaps(optimized.get(1)));

        // inputs untouched
        assertEquals(new Point3D(0.2f, 0.2f, 0.2f), second.getCenter());
    }

    @Test
    public void testCoincidentZonesSeparated() {
        var optimized = generator.optimizeZoneLayout(List.of(unitZone("a", Point3D.ORIGIN, 1),
                                                             unitZone("b", Point3D.ORIGIN, 2)));
        assertNoOverlap(optimized);
        assertEquals(Point3D.ORIGIN, optimized.get(0).getCenter());
    }

    @Test
    public void testGeneratedZonesDoNotOverlap() {
        var zones = generator.generateZones(CulturalContext.of("france", 0.5f));
        assertEquals(5, zones.size());
        assertNoOverlap(zones);
        for (int i = 1; i < zones.size(); i++) {
            assertTrue(zones.get(i - 1).getPriority() <= zones.get(i).getPriority());
        }

        var everything = CulturalContext.of("france", 0.9f, ContextTag.ABSTRACT_REASONING)
                                        .withParameter(CulturalContext.PARAM_HAS_CONTAINERS, true);
        var all = generator.generateZones(everything);
        assertEquals(7, all.size());
        assertNoOverlap(all);
    }

    @Test
    public void testTimelineDirection() {
        var france = generator.generateZonesByType(CulturalContext.of("france"), ZoneKind.TIMELINE).get(0);
        assertEquals("left-to-right", france.getMetadata(ZoneMetadata.Timeline.class).direction());
        assertEquals(ReferenceZoneGenerator.DEFAULT_TIME_SEGMENTS,
                     france.getMetadata(ZoneMetadata.Timeline.class).segments());

        var quebec = generator.generateZonesByType(
        CulturalContext.of("quebec").withParameter(CulturalContext.PARAM_TIME_SEGMENTS, List.of("before", "after")),
        ZoneKind.TIMELINE).get(0);
        assertEquals("context-dependent", quebec.getMetadata(ZoneMetadata.Timeline.class).direction());
        assertEquals(List.of("before", "after"), quebec.getMetadata(ZoneMetadata.Timeline.class).segments());

        var repeated = generator.generateZonesByType(
        CulturalContext.of("quebec").withParameter(CulturalContext.PARAM_TIME_SEGMENTS, "now,now,later"),
        ZoneKind.TIMELINE).get(0);
        assertEquals(List.of("now", "later"), repeated.getMetadata(ZoneMetadata.Timeline.class).segments());
    }

    @Test
    public void testConditionalZones() {
        var plain = CulturalContext.of("france", 0.5f);
        assertTrue(generator.generateZonesByType(plain, ZoneKind.ABSTRACT).isEmpty());
        assertTrue(generator.generateZonesByType(plain, ZoneKind.CONTAINER).isEmpty());

        var abstractZones = generator.generateZonesByType(plain.withTag(ContextTag.ABSTRACT_REASONING),
                                                          ZoneKind.ABSTRACT);
        assertEquals(List.of(ReferenceZoneGenerator.ABSTRACT_CONCEPTS),
                     abstractZones.stream().map(ReferenceZone::getId).toList());

        var containers = generator.generateZonesByType(
        plain.withParameter(CulturalContext.PARAM_HAS_CONTAINERS, "true")
             .withParameter(CulturalContext.PARAM_CONTAINER_TYPE, "box"), ZoneKind.CONTAINER);
        assertEquals("box", containers.get(0).getMetadata(ZoneMetadata.Container.class).containerType());
    }

    @Test
    public void testTopicEmphasis() {
        var formal = generator.generateZonesByType(CulturalContext.of("france", 0.9f), ZoneKind.TOPIC).get(0);
        assertEquals("formal", formal.getMetadata(ZoneMetadata.Topic.class).emphasis());
        assertEquals("general", formal.getMetadata(ZoneMetadata.Topic.class).thematicField());

        var casual = generator.generateZonesByType(CulturalContext.of("france", 0.3f), ZoneKind.TOPIC).get(0);
        assertEquals("standard", casual.getMetadata(ZoneMetadata.Topic.class).emphasis());
    }
}
