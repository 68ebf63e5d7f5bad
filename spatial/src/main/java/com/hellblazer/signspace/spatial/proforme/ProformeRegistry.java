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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Catalog of proformes with an index by represented concept and the set of proformes active for the current context.
 * The three base proformes are always present after construction and {@link #reset()}.
 *
 * <p>Not thread-safe; single writer.
 *
 * @author hal.hildebrand
 */
public class ProformeRegistry {
    public static final String BASE_PREFIX         = "base-";
    public static final String BASE_INDEX_POINTING = "base-index-pointing";
    public static final String BASE_FLAT_HAND      = "base-flat-hand";
    public static final String BASE_C_HANDSHAPE    = "base-c-handshape";

    private static final Logger log = LoggerFactory.getLogger(ProformeRegistry.class);

    private static final float BASE_TENSION         = 0.5f;
    private static final float FORMALITY_TENSION    = 0.3f;
    private static final float FORMALITY_ADJUSTMENT = 0.2f;
    private static final float FORMALITY_LIFT       = 0.1f;
    private static final float FORMALITY_DRAW_IN    = 0.05f;

    private final Map<String, Proforme>    proformes     = new LinkedHashMap<>();
    private final Map<String, Set<String>> conceptIndex  = new HashMap<>();
    private final Set<String>              activeIds     = new LinkedHashSet<>();
    private final Set<String>              loadedRegions = new LinkedHashSet<>();
    private final ProformeCatalogSource    catalogSource;

    public ProformeRegistry() {
        this(new JsonProformeCatalogSource());
    }

    public ProformeRegistry(ProformeCatalogSource catalogSource) {
        this.catalogSource = Objects.requireNonNull(catalogSource, "catalogSource");
        initializeBaseProformes();
    }

    /**
     * Activate the base proformes and the region's catalog, then adapt tension and position to the context's
     * formality. Every proforme is first restored to its defaults, so the outcome depends only on the context. Regional
     * proformes already in the catalog are not added twice.
     */
    public void prepareForContext(CulturalContext context) {
        Objects.requireNonNull(context, "context");
        activeIds.clear();
        proformes.values().forEach(Proforme::restoreDefaults);
        for (var id : proformes.keySet()) {
            if (id.startsWith(BASE_PREFIX)) {
                activeIds.add(id);
            }
        }

        var regional = catalogSource.load(context.getRegion());
        for (var proforme : regional) {
            if (!proformes.containsKey(proforme.getId())) {
                addProforme(proforme);
            }
            activeIds.add(proforme.getId());
        }
        if (!regional.isEmpty()) {
            loadedRegions.add(context.getRegion());
        }

        if (context.hasFormalityLevel()) {
            adaptToFormality(context.getFormalityLevel());
        }
        log.debug("Prepared {} active proformes for {}", activeIds.size(), context.getRegion());
    }

    /**
     * @return false, leaving the registry untouched, when the id is already present
     */
    public boolean addProforme(Proforme proforme) {
        Objects.requireNonNull(proforme, "proforme");
        if (proforme.getId() == null || proformes.containsKey(proforme.getId())) {
            return false;
        }
        proformes.put(proforme.getId(), proforme.copy());
        if (proforme.getRepresents() != null) {
            conceptIndex.computeIfAbsent(conceptKey(proforme.getRepresents()), k -> new LinkedHashSet<>())
                        .add(proforme.getId());
        }
        return true;
    }

    /**
     * Remove from the catalog, the concept index and the active set
     *
     * @return false when no such proforme exists
     */
    public boolean removeProforme(String id) {
        var removed = proformes.remove(id);
        if (removed == null) {
            return false;
        }
        if (removed.getRepresents() != null) {
            var key = conceptKey(removed.getRepresents());
            var ids = conceptIndex.get(key);
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    conceptIndex.remove(key);
                }
            }
        }
        activeIds.remove(id);
        return true;
    }

    /**
     * @return false when the proforme is not in the catalog
     */
    public boolean activateProforme(String id) {
        if (!proformes.containsKey(id)) {
            return false;
        }
        activeIds.add(id);
        return true;
    }

    public Optional<Proforme> getProforme(String id) {
        return Optional.ofNullable(proformes.get(id));
    }

    public List<Proforme> getActiveProformes() {
        var result = new ArrayList<Proforme>(activeIds.size());
        for (var id : activeIds) {
            var proforme = proformes.get(id);
            if (proforme != null) {
                result.add(proforme);
            }
        }
        return result;
    }

    public boolean isActive(String id) {
        return activeIds.contains(id);
    }

    /**
     * Active proformes representing the concept, matched case-insensitively
     */
    public List<Proforme> getProformesByRepresentation(String concept) {
        if (concept == null) {
            return List.of();
        }
        var ids = conceptIndex.getOrDefault(conceptKey(concept), Set.of());
        var result = new ArrayList<Proforme>();
        for (var id : ids) {
            if (activeIds.contains(id)) {
                result.add(proformes.get(id));
            }
        }
        return result;
    }

    public Set<String> getLoadedRegions() {
        return Collections.unmodifiableSet(loadedRegions);
    }

    public int size() {
        return proformes.size();
    }

    /**
     * Drop every proforme and region, then reseed the base catalog
     */
    public void reset() {
        proformes.clear();
        conceptIndex.clear();
        activeIds.clear();
        loadedRegions.clear();
        initializeBaseProformes();
    }

    private void adaptToFormality(float formality) {
        var adjustment = formality * FORMALITY_ADJUSTMENT;
        for (var id : activeIds) {
            var proforme = proformes.get(id);
            if (proforme == null || proforme.getHandshape() == null) {
                continue;
            }
            proforme.setTension(BASE_TENSION + formality * FORMALITY_TENSION);
            var anchor = proforme.getPosition();
            anchor.ifPresent(p -> proforme.setPosition(new Point3D(p.x * (1f - adjustment),
                                                                   p.y + adjustment * FORMALITY_LIFT,
                                                                   p.z - adjustment * FORMALITY_DRAW_IN)));
        }
    }

    private static String conceptKey(String concept) {
        return concept.toLowerCase(Locale.ROOT);
    }

    private void initializeBaseProformes() {
        addProforme(new Proforme(BASE_INDEX_POINTING, "Index pointing",
                                 new HandshapeConfig("index-pointing", hand(0f, 0f, 1f, 0f, 1f, 0f, 1f, 0f, 0.5f, 0.5f),
                                                     0.7f), new Orientation("side", "forward"), "pointing-reference",
                                 List.of("pointing", "reference", "direction"), List.of(), null));
        addProforme(new Proforme(BASE_FLAT_HAND, "Flat hand",
                                 new HandshapeConfig("flat-hand", hand(0f, 0f, 0f, 0f, 0f, 0f, 0f, 0f, 0f, 1f), 0.5f),
                                 Orientation.DEFAULT, "surface", List.of("surface", "plane", "flat"), List.of(),
                                 null));
        addProforme(new Proforme(BASE_C_HANDSHAPE, "C handshape",
                                 new HandshapeConfig("c-handshape",
                                                     hand(0.5f, 0f, 0.5f, 0f, 0.5f, 0f, 0.5f, 0f, 0.5f, 0.8f), 0.6f),
                                 new Orientation("side", "up"), "cylindrical-object",
                                 List.of("cylinder", "round object", "circle"), List.of(), null));
        activeIds.add(BASE_INDEX_POINTING);
        activeIds.add(BASE_FLAT_HAND);
        activeIds.add(BASE_C_HANDSHAPE);
    }

    /**
     * Bend/spread pairs in index, middle, ring, pinky, thumb order
     */
    private static List<FingerConfig> hand(float... bendSpread) {
        var order = new Finger[] { Finger.INDEX, Finger.MIDDLE, Finger.RING, Finger.PINKY, Finger.THUMB };
        var fingers = new ArrayList<FingerConfig>(order.length);
        for (int i = 0; i < order.length; i++) {
            fingers.add(new FingerConfig(order[i], bendSpread[2 * i], bendSpread[2 * i + 1]));
        }
        return fingers;
    }
}
