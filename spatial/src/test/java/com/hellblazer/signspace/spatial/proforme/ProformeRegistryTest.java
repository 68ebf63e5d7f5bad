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

import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class ProformeRegistryTest {

    private ProformeRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new ProformeRegistry();
    }

    private static Proforme proforme(String id, String represents, Point3D position) {
        return new Proforme(id, id, HandshapeConfig.basic("test"), Orientation.DEFAULT, represents, List.of(),
                            List.of(), position);
    }

    @Test
    public void testBaseCatalog() {
        assertEquals(3, registry.size());
        assertEquals(3, registry.getActiveProformes().size());
        assertTrue(registry.isActive(ProformeRegistry.BASE_INDEX_POINTING));
        assertEquals(0.7f, registry.getProforme(ProformeRegistry.BASE_INDEX_POINTING).orElseThrow().getTension());
        assertEquals(1, registry.getProformesByRepresentation("Surface").size());
        assertTrue(registry.getProforme(ProformeRegistry.BASE_C_HANDSHAPE).orElseThrow().getHandshape().isComplete());
    }

    @Test
    public void testRegionalCatalog() {
        registry.prepareForContext(CulturalContext.of("france", 0.5f));
        assertEquals(5, registry.size());
        assertEquals(5, registry.getActiveProformes().size());
        assertEquals(List.of("region-france-vehicle"),
                     registry.getProformesByRepresentation("VEHICLE").stream().map(Proforme::getId).toList());
        assertTrue(registry.getLoadedRegions().contains("france"));

        registry.prepareForContext(CulturalContext.of("quebec", 0.5f));
        assertEquals(6, registry.size());
        assertEquals(4, registry.getActiveProformes().size());
        assertFalse(registry.isActive("region-france-vehicle"));
        assertEquals(List.of("region-quebec-vehicle"),
                     registry.getProformesByRepresentation("vehicle").stream().map(Proforme::getId).toList());
    }

    @Test
    @DisplayName("Preparing the same region twice does not duplicate its proformes")
    public void testPrepareIdempotent() {
        var context = CulturalContext.of("france", 0.5f);
        registry.prepareForContext(context);
        registry.prepareForContext(context);
        assertEquals(5, registry.size());
        var ids = new HashSet<String>();
        for (var proforme : registry.getActiveProformes()) {
            assertTrue(ids.add(proforme.getId()), "duplicate active proforme " + proforme.getId());
        }
    }

    @Test
    @DisplayName("Tension strictly increases with formality")
    public void testTensionMonotonicInFormality() {
        registry.prepareForContext(CulturalContext.of("france", 0.1f));
        var informal = registry.getProforme(ProformeRegistry.BASE_FLAT_HAND).orElseThrow().getTension();
        assertEquals(0.53f, informal, 1e-5f);

        registry.prepareForContext(CulturalContext.of("france", 0.9f));
        var formal = registry.getProforme(ProformeRegistry.BASE_FLAT_HAND).orElseThrow().getTension();
        assertEquals(0.77f, formal, 1e-5f);
        assertTrue(formal > informal);
    }

    @Test
    public void testUnspecifiedFormalityLeavesTension() {
        registry.prepareForContext(CulturalContext.of("france"));
        assertEquals(0.7f, registry.getProforme(ProformeRegistry.BASE_INDEX_POINTING).orElseThrow().getTension());
        assertEquals(0.6f, registry.getProforme(ProformeRegistry.BASE_C_HANDSHAPE).orElseThrow().getTension());
    }

    @Test
    public void testPositionAdaptationFromCatalogSource() {
        var source = mock(ProformeCatalogSource.class);
        when(source.load("testland")).thenReturn(List.of(proforme("test-tree", "tree", new Point3D(1f, 0f, 0.5f))));
        var custom = new ProformeRegistry(source);

        var context = CulturalContext.of("testland", 0.5f);
        custom.prepareForContext(context);
        custom.prepareForContext(context);

        var tree = custom.getProforme("test-tree").orElseThrow();
        var position = tree.getPosition().orElseThrow();
        assertEquals(0.9f, position.x, 1e-5f);
        assertEquals(0.01f, position.y, 1e-5f);
        assertEquals(0.495f, position.z, 1e-5f);
        assertEquals(new Point3D(1f, 0f, 0.5f), tree.getDefaultPosition().orElseThrow());
        assertEquals(0.65f, tree.getTension(), 1e-5f);
        verify(source, times(2)).load("testland");
        assertEquals(4, custom.size());
    }

    @Test
    @DisplayName("A context without formality restores the proformes adapted by an earlier context")
    public void testPreparationRestoresDefaults() {
        var source = mock(ProformeCatalogSource.class);
        when(source.load("testland")).thenReturn(List.of(proforme("test-tree", "tree", new Point3D(1f, 0f, 0.5f))));
        var custom = new ProformeRegistry(source);

        custom.prepareForContext(CulturalContext.of("testland", 0.9f));
        var tree = custom.getProforme("test-tree").orElseThrow();
        assertNotEquals(new Point3D(1f, 0f, 0.5f), tree.getPosition().orElseThrow());
        assertEquals(0.77f, tree.getTension(), 1e-5f);

        custom.prepareForContext(CulturalContext.of("testland"));
        assertEquals(new Point3D(1f, 0f, 0.5f), tree.getPosition().orElseThrow());
        assertEquals(0.5f, tree.getTension());
        assertEquals(0.7f, custom.getProforme(ProformeRegistry.BASE_INDEX_POINTING).orElseThrow().getTension());
        assertEquals(0.5f, custom.getProforme(ProformeRegistry.BASE_FLAT_HAND).orElseThrow().getTension());
    }

    @Test
    public void testConceptsListRepresentedFirst() {
        var vehicle = new Proforme("v", "v", HandshapeConfig.basic("test"), Orientation.DEFAULT, "vehicle",
                                   List.of("car", "truck"), List.of(), null);
        assertEquals(List.of("vehicle", "car", "truck"), vehicle.concepts());

        var anonymous = new Proforme("a", "a", null, null, null, List.of("thing"), List.of(), null);
        assertEquals(List.of("thing"), anonymous.concepts());
    }

    @Test
    public void testUnknownRegion() {
        registry.prepareForContext(CulturalContext.of("atlantis", 0.5f));
        assertEquals(3, registry.size());
        assertTrue(registry.getLoadedRegions().isEmpty());
    }

    @Test
    public void testAddAndRemove() {
        assertTrue(registry.addProforme(proforme("tree", "Tree", null)));
        assertFalse(registry.addProforme(proforme("tree", "bush", null)), "duplicate id must be rejected");
        assertEquals("Tree", registry.getProforme("tree").orElseThrow().getRepresents());

        assertTrue(registry.getProformesByRepresentation("tree").isEmpty(), "inactive proformes are not returned");
        assertTrue(registry.activateProforme("tree"));
        assertEquals(1, registry.getProformesByRepresentation("TREE").size());

        assertTrue(registry.removeProforme("tree"));
        assertFalse(registry.removeProforme("tree"));
        assertFalse(registry.isActive("tree"));
        assertTrue(registry.getProformesByRepresentation("tree").isEmpty());
        assertFalse(registry.activateProforme("tree"));
    }

    @Test
    public void testStoredCopyIsIndependent() {
        var original = proforme("tree", "tree", new Point3D(0f, 0f, 0f));
        registry.addProforme(original);
        original.setTension(0.1f);
        assertEquals(0.5f, registry.getProforme("tree").orElseThrow().getTension());
    }

    @Test
    public void testReset() {
        registry.prepareForContext(CulturalContext.of("france", 0.5f));
        registry.reset();
        assertEquals(3, registry.size());
        assertTrue(registry.getLoadedRegions().isEmpty());
        assertEquals(0.7f, registry.getProforme(ProformeRegistry.BASE_INDEX_POINTING).orElseThrow().getTension());
    }
}
