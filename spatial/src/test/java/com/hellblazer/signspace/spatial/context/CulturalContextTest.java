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
package com.hellblazer.signspace.spatial.context;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CulturalContextTest {

    @Test
    public void testNormalization() {
        var context = new CulturalContext("  France ", 1.5f, ContextTag.NARRATIVE, null, null);
        assertEquals("france", context.getRegion());
        assertEquals(1f, context.getFormalityLevel());
        assertTrue(context.hasFormalityLevel());
        assertEquals(ContextTag.NARRATIVE, context.getTag().orElseThrow());

        assertThrows(IllegalArgumentException.class, () -> CulturalContext.of("france", Float.NaN));
    }

    @Test
    public void testUnspecifiedFormality() {
        var context = CulturalContext.of("quebec");
        assertFalse(context.hasFormalityLevel());
        assertEquals(CulturalContext.DEFAULT_FORMALITY, context.getFormalityLevel());
        assertFalse(context.isFormal(0.1f), "an unspecified formality is never formal");
    }

    @Test
    public void testParameters() {
        var context = CulturalContext.of("france")
                                     .withParameter(CulturalContext.PARAM_TIME_SEGMENTS, "before, now ,after")
                                     .withParameter(CulturalContext.PARAM_HAS_CONTAINERS, "true")
                                     .withParameter(CulturalContext.PARAM_THEMATIC_FIELD, "family");

        assertEquals(List.of("before", "now", "after"),
                     context.getListParameter(CulturalContext.PARAM_TIME_SEGMENTS, List.of()));
        assertTrue(context.getBooleanParameter(CulturalContext.PARAM_HAS_CONTAINERS));
        assertEquals("family", context.getStringParameter(CulturalContext.PARAM_THEMATIC_FIELD, "general"));
        assertEquals("generic", context.getStringParameter(CulturalContext.PARAM_CONTAINER_TYPE, "generic"));
        assertEquals(List.of("x"), context.getListParameter("missing", List.of("x")));
    }

    @Test
    public void testCacheKey() {
        var base = CulturalContext.of("france", 0.5f);
        assertEquals("structure_france_0.5_default", base.cacheKey());
        assertEquals(base.cacheKey(), CulturalContext.of("FRANCE", 0.5f).cacheKey());
        assertNotEquals(base.cacheKey(), base.withTag(ContextTag.EDUCATIONAL).cacheKey());
        assertNotEquals(base.cacheKey(), base.withDialect("marseille").cacheKey());
        assertNotEquals(base.cacheKey(), base.withParameter(CulturalContext.PARAM_HAS_CONTAINERS, true).cacheKey());
        assertEquals(base, CulturalContext.of("france", 0.5f));
    }

    @Test
    public void testTagLabels() {
        assertEquals("abstract-reasoning", ContextTag.ABSTRACT_REASONING.label());
        assertEquals(ContextTag.ABSTRACT_REASONING, ContextTag.fromLabel("Abstract_Reasoning").orElseThrow());
        assertTrue(ContextTag.fromLabel("poetry").isEmpty());
        assertTrue(ContextTag.fromLabel(null).isEmpty());
    }
}
