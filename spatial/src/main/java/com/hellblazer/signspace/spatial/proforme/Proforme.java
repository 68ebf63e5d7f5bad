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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reusable hand configuration representing a concept. Identity and shape are fixed; the handshape tension and the
 * current position are adapted to the context the proforme is used in.
 *
 * @author hal.hildebrand
 */
public class Proforme {
    private final String          id;
    private final String          name;
    private final Orientation     orientation;
    private final String          represents;
    private final List<String>    associatedConcepts;
    private final List<String>    culturalContext;
    private final Point3D         defaultPosition;
    private final HandshapeConfig defaultHandshape;
    private       HandshapeConfig handshape;
    private       Point3D         position;

    public Proforme(String id, String name, HandshapeConfig handshape, Orientation orientation, String represents,
                    List<String> associatedConcepts, List<String> culturalContext, Point3D defaultPosition) {
        this(id, name, handshape, handshape, orientation, represents, associatedConcepts, culturalContext,
             defaultPosition);
    }

    private Proforme(String id, String name, HandshapeConfig defaultHandshape, HandshapeConfig handshape,
                     Orientation orientation, String represents, List<String> associatedConcepts,
                     List<String> culturalContext, Point3D defaultPosition) {
        this.id = id;
        this.name = name;
        this.defaultHandshape = defaultHandshape;
        this.handshape = handshape;
        this.orientation = orientation;
        this.represents = represents;
        this.associatedConcepts = associatedConcepts == null ? List.of() : List.copyOf(associatedConcepts);
        this.culturalContext = culturalContext == null ? List.of() : List.copyOf(culturalContext);
        this.defaultPosition = defaultPosition;
        this.position = defaultPosition;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public HandshapeConfig getHandshape() {
        return handshape;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public String getRepresents() {
        return represents;
    }

    public List<String> getAssociatedConcepts() {
        return associatedConcepts;
    }

    public List<String> getCulturalContext() {
        return culturalContext;
    }

    public Optional<Point3D> getDefaultPosition() {
        return Optional.ofNullable(defaultPosition);
    }

    public Optional<Point3D> getPosition() {
        return Optional.ofNullable(position);
    }

    public float getTension() {
        return handshape == null ? 0f : handshape.tension();
    }

    public void setTension(float tension) {
        Objects.requireNonNull(handshape, "handshape");
        handshape = handshape.withTension(tension);
    }

    public void setPosition(Point3D position) {
        this.position = position;
    }

    /**
     * Undo any contextual adaptation: the handshape as constructed and the default position
     */
    public void restoreDefaults() {
        handshape = defaultHandshape;
        position = defaultPosition;
    }

    /**
     * All concepts this proforme can stand for: the represented concept followed by the associated ones
     */
    public List<String> concepts() {
        if (represents == null) {
            return associatedConcepts;
        }
        var all = new ArrayList<String>(associatedConcepts.size() + 1);
        all.add(represents);
        all.addAll(associatedConcepts);
        return all;
    }

    public Proforme copy() {
        var copy = new Proforme(id, name, defaultHandshape, handshape, orientation, represents, associatedConcepts,
                                culturalContext, defaultPosition);
        copy.position = position;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("Proforme[id=%s, represents=%s, tension=%.2f, position=%s]", id, represents,
                             getTension(), position);
    }
}
