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

import com.hellblazer.signspace.spatial.zone.ReferenceZone;

import java.util.*;

/**
 * Zones, the elements placed in them keyed by id in insertion order, and the relations between elements.
 *
 * @author hal.hildebrand
 */
public class SpatialLayout {
    private final List<ReferenceZone>         zones;
    private final Map<String, SpatialElement> elements  = new LinkedHashMap<>();
    private final List<SpatialRelation>       relations = new ArrayList<>();

    public SpatialLayout(List<ReferenceZone> zones) {
        this.zones = List.copyOf(zones);
    }

    public List<ReferenceZone> getZones() {
        return zones;
    }

    public Optional<ReferenceZone> getZone(String zoneId) {
        for (var zone : zones) {
            if (Objects.equals(zone.getId(), zoneId)) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    /**
     * Add or replace the element with the same id
     */
    public void putElement(SpatialElement element) {
        elements.put(element.getId(), element);
    }

    public Optional<SpatialElement> getElement(String id) {
        return Optional.ofNullable(elements.get(id));
    }

    public boolean hasElement(String id) {
        return elements.containsKey(id);
    }

    public List<SpatialElement> getElements() {
        return List.copyOf(elements.values());
    }

    public List<SpatialElement> getElements(ElementKind kind) {
        var result = new ArrayList<SpatialElement>();
        for (var element : elements.values()) {
            if (element.getKind() == kind) {
                result.add(element);
            }
        }
        return result;
    }

    public int elementCount() {
        return elements.size();
    }

    public void addRelation(SpatialRelation relation) {
        relations.add(Objects.requireNonNull(relation, "relation"));
    }

    public List<SpatialRelation> getRelations() {
        return Collections.unmodifiableList(relations);
    }

    /**
     * Independent copy: zones and elements are copied, relations are immutable and shared
     */
    public SpatialLayout copy() {
        var zoneCopies = new ArrayList<ReferenceZone>(zones.size());
        for (var zone : zones) {
            zoneCopies.add(zone.copy());
        }
        var copy = new SpatialLayout(zoneCopies);
        for (var element : elements.values()) {
            copy.putElement(element.copy());
        }
        copy.relations.addAll(relations);
        return copy;
    }

    @Override
    public String toString() {
        return String.format("SpatialLayout[zones=%d, elements=%d, relations=%d]", zones.size(), elements.size(),
                             relations.size());
    }
}
