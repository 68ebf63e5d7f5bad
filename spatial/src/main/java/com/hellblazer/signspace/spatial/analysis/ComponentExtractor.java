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
package com.hellblazer.signspace.spatial.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.spatial.layout.RelationKind;
import com.hellblazer.signspace.spatial.layout.SpatialRelation;

import java.util.*;

/**
 * Extracts components and relations from raw text or structured input. Text handling is token classification only.
 *
 * @author hal.hildebrand
 */
public class ComponentExtractor {
    public static final float GRID_STEP         = 0.5f;
    public static final float GRID_WIDTH        = 3.0f;
    public static final float SEQUENCE_STRENGTH = 0.8f;
    public static final float DEFAULT_STRENGTH  = 0.7f;

    private static final List<String> POINTING_MARKERS = List.of("point", "montre", "pointe");
    private static final List<String> GAZE_MARKERS     = List.of("regard", "voir", "look", "gaze");
    private static final List<String> MOVEMENT_MARKERS = List.of("mouvement", "move");

    /**
     * Components and relations extracted from one input
     */
    public record Extraction(List<SpatialComponent> components, List<SpatialRelation> relations) {
        public Extraction {
            components = List.copyOf(components);
            relations = List.copyOf(relations);
        }
    }

    /**
     * One component per whitespace separated token, laid out on a grid, each linked to the next by a temporal
     * sequence relation
     */
    public Extraction extractFromText(String text) {
        var tokens = new ArrayList<String>();
        if (text != null) {
            for (var token : text.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }

        var components = new ArrayList<SpatialComponent>(tokens.size());
        var relations = new ArrayList<SpatialRelation>();
        float x = 0f;
        float y = 0f;
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            components.add(new SpatialComponent(componentId(i), classify(token), new Point3D(x, y, 0f),
                                                Map.of("word", token, "index", i, "extractedFrom", "text")));
            x += GRID_STEP;
            if (x > GRID_WIDTH) {
                x = 0f;
                y -= GRID_STEP;
            }
            if (i < tokens.size() - 1) {
                relations.add(new SpatialRelation("rel_" + i, RelationKind.TEMPORAL, componentId(i),
                                                  componentId(i + 1), SEQUENCE_STRENGTH,
                                                  Map.of("type", "sequence", "extractedFrom", "text")));
            }
        }
        return new Extraction(components, relations);
    }

    /**
     * Read the {@code components} and {@code relations} arrays of the document. Unknown component types map to
     * {@link ComponentKind#ZONE}, unknown relation types to {@link RelationKind#SEMANTIC}.
     */
    public Extraction extractFromStructured(JsonNode document) {
        var components = new ArrayList<SpatialComponent>();
        var relations = new ArrayList<SpatialRelation>();
        if (document == null) {
            return new Extraction(components, relations);
        }

        var inputComponents = document.path("components");
        if (inputComponents.isArray()) {
            int i = 0;
            for (var node : inputComponents) {
                var id = node.hasNonNull("id") ? node.get("id").asText() : componentId(i);
                var properties = scalarFields(node);
                properties.put("extractedFrom", "structured");
                components.add(new SpatialComponent(id, ComponentKind.parse(text(node, "type"), ComponentKind.ZONE),
                                                    position(node), properties));
                i++;
            }
        }

        var inputRelations = document.path("relations");
        if (inputRelations.isArray()) {
            int i = 0;
            for (var node : inputRelations) {
                var id = node.hasNonNull("id") ? node.get("id").asText() : "rel_" + i;
                var strength = node.path("strength").isNumber() ? (float) node.get("strength").asDouble()
                                                                : DEFAULT_STRENGTH;
                var properties = scalarFields(node);
                properties.put("extractedFrom", "structured");
                relations.add(new SpatialRelation(id, RelationKind.parse(text(node, "type"), RelationKind.SEMANTIC),
                                                  text(node, "source"), text(node, "target"), strength, properties));
                i++;
            }
        }
        return new Extraction(components, relations);
    }

    static ComponentKind classify(String token) {
        var word = token.toLowerCase(Locale.ROOT);
        if (containsAny(word, POINTING_MARKERS)) {
            return ComponentKind.POINTING;
        }
        if (containsAny(word, GAZE_MARKERS)) {
            return ComponentKind.GAZE;
        }
        if (containsAny(word, MOVEMENT_MARKERS)) {
            return ComponentKind.MOVEMENT;
        }
        return ComponentKind.ZONE;
    }

    private static boolean containsAny(String word, List<String> markers) {
        for (var marker : markers) {
            if (word.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String componentId(int index) {
        return "comp_" + index;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    /**
     * Position from a nested {@code position} object, else flat x/y/z fields, missing coordinates 0
     */
    private static Point3D position(JsonNode node) {
        var source = node.path("position").isObject() ? node.get("position") : node;
        return new Point3D((float) source.path("x").asDouble(0.0), (float) source.path("y").asDouble(0.0),
                           (float) source.path("z").asDouble(0.0));
    }

    private static Map<String, Object> scalarFields(JsonNode node) {
        var fields = new LinkedHashMap<String, Object>();
        var names = node.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            var value = node.get(name);
            if (value.isTextual()) {
                fields.put(name, value.asText());
            } else if (value.isIntegralNumber()) {
                fields.put(name, value.asLong());
            } else if (value.isNumber()) {
                fields.put(name, value.asDouble());
            } else if (value.isBoolean()) {
                fields.put(name, value.asBoolean());
            }
        }
        return fields;
    }
}
