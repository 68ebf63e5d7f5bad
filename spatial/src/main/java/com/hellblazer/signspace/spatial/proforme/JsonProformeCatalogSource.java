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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.signspace.geometry.Point3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Loads regional proforme catalogs from classpath resources at {@code /proformes/<region>.json}.
 *
 * <pre>
 * { "region": "france",
 *   "proformes": [ { "id": "...", "name": "...", "represents": "vehicle",
 *                    "handshape": { "type": "...", "tension": 0.5,
 *                                   "fingers": [ { "finger": "index", "bend": 0, "spread": 0 }, ... ] },
 *                    "orientation": { "palm": "down", "fingers": "forward" },
 *                    "associatedConcepts": [...], "culturalContext": [...],
 *                    "position": { "x": 0, "y": 0, "z": 0.3 } } ] }
 * </pre>
 *
 * A missing handshape falls back to {@link HandshapeConfig#basic(String)}, a missing orientation to
 * {@link Orientation#DEFAULT}.
 *
 * @author hal.hildebrand
 */
public class JsonProformeCatalogSource implements ProformeCatalogSource {
    private static final Logger       log    = LoggerFactory.getLogger(JsonProformeCatalogSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String resourceRoot;

    public JsonProformeCatalogSource() {
        this("/proformes");
    }

    public JsonProformeCatalogSource(String resourceRoot) {
        this.resourceRoot = resourceRoot;
    }

    @Override
    public List<Proforme> load(String region) {
        if (region == null || region.isBlank()) {
            return List.of();
        }
        var resourcePath = String.format("%s/%s.json", resourceRoot, region.toLowerCase(Locale.ROOT));
        try (var is = JsonProformeCatalogSource.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.debug("No proforme catalog found for region {}", region);
                return List.of();
            }
            var root = MAPPER.readTree(is);
            var catalog = parseCatalog(root);
            log.info("Loaded {} proformes for region {}", catalog.size(), region);
            return catalog;
        } catch (IOException e) {
            log.warn("Failed to load proforme catalog for region {}: {}", region, e.getMessage());
            return List.of();
        }
    }

    static List<Proforme> parseCatalog(JsonNode root) {
        var entries = root.get("proformes");
        if (entries == null || !entries.isArray()) {
            return List.of();
        }
        var result = new ArrayList<Proforme>();
        for (var node : entries) {
            if (!node.has("id")) {
                log.warn("Skipping proforme entry without id: {}", node);
                continue;
            }
            result.add(parseProforme(node));
        }
        return Collections.unmodifiableList(result);
    }

    private static Proforme parseProforme(JsonNode node) {
        var id = node.get("id").asText();
        var name = node.has("name") ? node.get("name").asText() : id;
        var represents = node.has("represents") ? node.get("represents").asText() : null;
        var handshape = node.has("handshape") ? parseHandshape(node.get("handshape"))
                                              : HandshapeConfig.basic("basic");
        var orientation = node.has("orientation") ? new Orientation(text(node.get("orientation"), "palm"),
                                                                    text(node.get("orientation"), "fingers"))
                                                  : Orientation.DEFAULT;
        var position = node.has("position") ? new Point3D((float) node.get("position").path("x").asDouble(0.0),
                                                          (float) node.get("position").path("y").asDouble(0.0),
                                                          (float) node.get("position").path("z").asDouble(0.0))
                                            : null;
        return new Proforme(id, name, handshape, orientation, represents, strings(node.get("associatedConcepts")),
                            strings(node.get("culturalContext")), position);
    }

    private static HandshapeConfig parseHandshape(JsonNode node) {
        var type = node.has("type") ? node.get("type").asText() : "basic";
        if (!node.has("fingers")) {
            var basic = HandshapeConfig.basic(type);
            return node.has("tension") ? basic.withTension((float) node.get("tension").asDouble()) : basic;
        }
        var fingers = new ArrayList<FingerConfig>();
        for (var f : node.get("fingers")) {
            var finger = Finger.valueOf(f.path("finger").asText().toUpperCase(Locale.ROOT));
            fingers.add(new FingerConfig(finger, (float) f.path("bend").asDouble(0.0),
                                         (float) f.path("spread").asDouble(0.0)));
        }
        return new HandshapeConfig(type, fingers, (float) node.path("tension").asDouble(0.5));
    }

    private static String text(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        var result = new ArrayList<String>();
        node.forEach(n -> result.add(n.asText()));
        return Collections.unmodifiableList(result);
    }
}
