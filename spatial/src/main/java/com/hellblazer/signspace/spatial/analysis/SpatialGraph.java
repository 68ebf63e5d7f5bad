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

import com.hellblazer.signspace.spatial.layout.SpatialRelation;

import java.util.List;

/**
 * Components as nodes, relations as directed edges.
 *
 * @author hal.hildebrand
 */
public record SpatialGraph(List<SpatialComponent> nodes, List<SpatialRelation> edges) {

    public SpatialGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Directed density {@code e / (n (n - 1))}, 0 below two nodes
     */
    public double density() {
        int n = nodes.size();
        if (n < 2) {
            return 0.0;
        }
        return (double) edges.size() / ((double) n * (n - 1));
    }
}
