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
package com.hellblazer.signspace.spatial.space;

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import com.hellblazer.signspace.spatial.zone.ReferenceZone;
import com.hellblazer.signspace.spatial.zone.ZoneKind;
import com.hellblazer.signspace.spatial.zone.ZoneMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SigningSpaceTest {

    private SigningSpace space;

    @BeforeEach
    public void setUp() {
        space = new SigningSpace();
    }

    private static ReferenceZone zone(String id, Point3D center) {
        return new ReferenceZone(id, id, ZoneKind.TOPIC, Area3D.cube(center, 0.4f), 0.5f, 3,
                                 new ZoneMetadata.Topic("general", "standard"));
    }

    @Test
    @DisplayName("Scale strictly increases with formality")
    public void testScaleMonotonicInFormality() {
        float previous = Float.NEGATIVE_INFINITY;
        for (var formality : new float[] { 0.1f, 0.3f, 0.5f, 0.7f, 0.9f }) {
            space.initialize(CulturalContext.of("france", formality));
            assertTrue(space.getScale() > previous, "scale must grow at formality " + formality);
            previous = space.getScale();
        }
    }

    @Test
    public void testInitializeSeedsZones() {
        space.initialize(CulturalContext.of("france", 0.5f));
        assertTrue(space.hasZone(SigningSpace.NEUTRAL_CENTER_ID));
        assertFalse(space.hasZone(SigningSpace.FORMAL_SPACE_ID));

        space.initialize(CulturalContext.of("france", 0.9f));
        assertTrue(space.hasZone(SigningSpace.NEUTRAL_CENTER_ID));
        assertTrue(space.hasZone(SigningSpace.FORMAL_SPACE_ID));
        assertEquals(2, space.zoneCount());
    }

    @Test
    public void testAddAndRemoveReturnStatus() {
        assertTrue(space.addZone(zone("topic", Point3D.ORIGIN)));
        assertFalse(space.addZone(zone("topic", new Point3D(1f, 0f, 0f))), "duplicate id must be rejected");
        assertEquals(Point3D.ORIGIN, space.getZone("topic").orElseThrow().getCenter());

        assertTrue(space.removeZone("topic"));
        assertFalse(space.removeZone("topic"));
        assertTrue(space.getZone("topic").isEmpty());
    }

    @Test
    public void testContainsPoint() {
        assertTrue(space.containsPoint(new Point3D(0.9f, 0f, 0f)));
        assertFalse(space.containsPoint(new Point3D(1f, 0f, 0f)), "boundary is outside");
        assertFalse(space.containsPoint(new Point3D(1.5f, 0f, 0f)));

        space.configure(SpaceParameters.none().withSize(new Vector3D(4f, 4f, 4f)));
        assertTrue(space.containsPoint(new Point3D(1.5f, 0f, 0f)));

        space.configure(SpaceParameters.none().withOrigin(new Point3D(5f, 0f, 0f)));
        assertTrue(space.containsPoint(new Point3D(5.5f, 0f, 0f)));
        assertFalse(space.containsPoint(Point3D.ORIGIN));
    }

    @Test
    public void testConfigureKeepsZones() {
        space.initialize(CulturalContext.of("france"));
        space.configure(SpaceParameters.none().withScale(2f).withOrientation(new Vector3D(0f, 0f, 3f)));
        assertEquals(2f, space.getScale());
        assertEquals(1f, space.getOrientation().length(), 1e-6f);
        assertTrue(space.hasZone(SigningSpace.NEUTRAL_CENTER_ID));
    }

    @Test
    public void testTransformsAreInverse() {
        space.configure(SpaceParameters.none().withScale(2f).withOrigin(new Point3D(1f, 2f, 3f)));
        var world = new Point3D(0.5f, -1f, 4f);

        var local = space.transformToSpace(world);
        assertEquals(-1f, local.x, 1e-6f);
        assertEquals(-6f, local.y, 1e-6f);
        assertEquals(2f, local.z, 1e-6f);

        var back = space.transformFromSpace(local);
        assertEquals(world.x, back.x, 1e-5f);
        assertEquals(world.y, back.y, 1e-5f);
        assertEquals(world.z, back.z, 1e-5f);
    }

    @Test
    public void testCopyIsDeep() {
        space.addZone(zone("topic", Point3D.ORIGIN));
        var copy = space.copy();
        copy.getZone("topic").orElseThrow().moveTo(new Point3D(1f, 1f, 1f));
        copy.configure(SpaceParameters.none().withScale(3f));

        assertEquals(Point3D.ORIGIN, space.getZone("topic").orElseThrow().getCenter());
        assertEquals(SigningSpace.DEFAULT_SCALE, space.getScale());
    }

    @Test
    public void testReset() {
        space.initialize(CulturalContext.of("france", 0.9f));
        space.configure(SpaceParameters.none().withOrigin(new Point3D(1f, 1f, 1f)));
        space.reset();

        assertEquals(1f, space.getScale());
        assertEquals(Point3D.ORIGIN, space.getOrigin());
        assertEquals(SigningSpace.DEFAULT_ORIENTATION, space.getOrientation());
        assertEquals(0, space.zoneCount());
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> SpaceParameters.none().withScale(0f));
        assertThrows(IllegalArgumentException.class, () -> SpaceParameters.none().withOrientation(Vector3D.ZERO));
    }
}
