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
package com.hellblazer.signspace.spatial.structure;

import com.hellblazer.signspace.spatial.analysis.SpatialComponent;
import com.hellblazer.signspace.spatial.layout.SpatialLayout;
import com.hellblazer.signspace.spatial.layout.SpatialRelation;
import com.hellblazer.signspace.spatial.proforme.Proforme;
import com.hellblazer.signspace.spatial.zone.ReferenceZone;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate produced by {@link SpatialStructureManager#generateSpatialStructure}. Instances are shared through the
 * cache, so the mutable parts (zones, proformes and the layout) are held privately and handed out as copies.
 *
 * @author hal.hildebrand
 */
public final class SpatialStructure {
    private final String                 id;
    private final List<ReferenceZone>    zones;
    private final List<Proforme>         proformes;
    private final List<SpatialComponent> components;
    private final List<SpatialRelation>  relations;
    private final SpatialLayout          layout;
    private final StructureMetadata      metadata;

    public SpatialStructure(String id, List<ReferenceZone> zones, List<Proforme> proformes,
                            List<SpatialComponent> components, List<SpatialRelation> relations, SpatialLayout layout,
                            StructureMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.zones = copyZones(zones);
        this.proformes = copyProformes(proformes);
        this.components = List.copyOf(components);
        this.relations = List.copyOf(relations);
        this.layout = layout == null ? null : layout.copy();
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public String getId() {
        return id;
    }

    public List<ReferenceZone> getZones() {
        return copyZones(zones);
    }

    public List<Proforme> getProformes() {
        return copyProformes(proformes);
    }

    public List<SpatialComponent> getComponents() {
        return components;
    }

    public List<SpatialRelation> getRelations() {
        return relations;
    }

    /**
     * Copy of the layout the structure was derived from, null for structures assembled without one
     */
    public SpatialLayout getLayout() {
        return layout == null ? null : layout.copy();
    }

    public StructureMetadata getMetadata() {
        return metadata;
    }

    private static List<ReferenceZone> copyZones(List<ReferenceZone> source) {
        var copies = new ArrayList<ReferenceZone>(source.size());
        for (var zone : source) {
            copies.add(zone.copy());
        }
        return List.copyOf(copies);
    }

    private static List<Proforme> copyProformes(List<Proforme> source) {
        var copies = new ArrayList<Proforme>(source.size());
        for (var proforme : source) {
            copies.add(proforme.copy());
        }
        return List.copyOf(copies);
    }

    @Override
    public String toString() {
        return String.format("SpatialStructure[id=%s, zones=%d, proformes=%d, components=%d, relations=%d]", id,
                             zones.size(), proformes.size(), components.size(), relations.size());
    }
}
