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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.signspace.geometry.Point3D;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class JsonProformeCatalogSourceTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void testLoadBundledCatalogs() {
        var source = new JsonProformeCatalogSource();
        var france = source.load("France");
        assertEquals(2, france.size());
        assertEquals("region-france-vehicle", france.get(0).getId());
        assertEquals("person", france.get(1).getRepresents());
        assertEquals(new Orientation("side", "up"), france.get(1).getOrientation());
        assertTrue(france.get(0).getHandshape().isComplete());

        assertEquals(1, source.load("quebec").size());
        assertTrue(source.load("atlantis").isEmpty());
        assertTrue(source.load(null).isEmpty());
        assertTrue(new JsonProformeCatalogSource("/missing").load("france").isEmpty());
    }

    @Test
    public void testParseCatalog() throws Exception {
        var root = MAPPER.readTree("""
                                   { "proformes": [
                                       { "name": "no id" },
                                       { "id": "tree", "represents": "tree",
                                         "handshape": { "type": "claw", "tension": 0.8,
                                                        "fingers": [ { "finger": "index", "bend": 0.7 },
                                                                     { "finger": "thumb", "spread": 2.0 } ] },
                                         "position": { "x": 0.1, "z": 0.3 } } ] }
                                   """);
        var catalog = JsonProformeCatalogSource.parseCatalog(root);
        assertEquals(1, catalog.size());

        var tree = catalog.get(0);
        assertEquals("tree", tree.getName());
        assertEquals(Orientation.DEFAULT, tree.getOrientation());
        assertEquals(0.8f, tree.getTension(), 1e-6f);
        assertFalse(tree.getHandshape().isComplete());
        assertEquals(0.7f, tree.getHandshape().finger(Finger.INDEX).orElseThrow().bend(), 1e-6f);
        assertEquals(1f, tree.getHandshape().finger(Finger.THUMB).orElseThrow().spread(), 1e-6f);
        assertEquals(new Point3D(0.1f, 0f, 0.3f), tree.getPosition().orElseThrow());
    }

    @Test
    public void testParseWithoutEntries() throws Exception {
        assertTrue(JsonProformeCatalogSource.parseCatalog(MAPPER.readTree("{ \"region\": \"x\" }")).isEmpty());
    }
}
