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
package com.hellblazer.signspace.spatial.space;

import com.hellblazer.signspace.geometry.Area3D;
import com.hellblazer.signspace.geometry.Point3D;
import com.hellblazer.signspace.geometry.Vector3D;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import com.hellblazer.signspace.spatial.zone.ReferenceZone;
import com.hellblazer.signspace.spatial.zone.ZoneKind;
import com.hellblazer.signspace.spatial.zone.ZoneMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Mutable 3D coordinate frame in which an utterance is signed: scale, origin, orientation, bounding volume and a
 * registry of active zones.
 *
 * <p>Not thread-safe. One instance belongs to one logical session; owners that share it must lock externally.
 *
 * @author hal.hildebrand
 */
public class SigningSpace {
    private static final Logger log = LoggerFactory.getLogger(SigningSpace.class);

    public static final float    DEFAULT_SCALE       = 1.0f;
    public static final Vector3D DEFAULT_ORIENTATION = Vector3D.FORWARD;
    public static final Vector3D DEFAULT_SIZE        = new Vector3D(2f, 2f, 2f);

    public static final String NEUTRAL_CENTER_ID = "neutral-center";
    public static final String FORMAL_SPACE_ID   = "formal-space";

    /** Formality above which the formal register zone is seeded */
    public static final float FORMAL_THRESHOLD = 0.7f;

    private static final float BASE_CONTEXT_SCALE = 0.9f;
    private static final float FORMALITY_SCALE    = 0.2f;

    private final Map<String, ReferenceZone> zones = new LinkedHashMap<>();
    private       float                      scale;
    private       Point3D                    origin;
    private       Vector3D                   orientation;
    private       Area3D                     bounds;

    public SigningSpace() {
        reset();
    }

    /**
     * Reset, then seed the zones appropriate for the context. The scale grows with formality so that formal signing
     * occupies a proportionally larger frame.
     */
    public void initialize(CulturalContext context) {
        Objects.requireNonNull(context, "context");
        reset();
        scale = BASE_CONTEXT_SCALE + FORMALITY_SCALE * context.getFormalityLevel();

        addZone(new ReferenceZone(NEUTRAL_CENTER_ID, "Neutral center", ZoneKind.NEUTRAL,
                                  Area3D.cube(Point3D.ORIGIN, 0.5f), 0.8f, 2, new ZoneMetadata.Neutral()));
        if (context.isFormal(FORMAL_THRESHOLD)) {
            addZone(new ReferenceZone(FORMAL_SPACE_ID, "Formal space", ZoneKind.NEUTRAL,
                                      new Area3D(new Point3D(0f, 0.1f, 0.2f), 0.8f, 0.6f, 0.4f), 0.7f, 3,
                                      new ZoneMetadata.Space("formal-register")));
        }
        log.info("Signing space initialized for {}: scale={}, zones={}", context.getRegion(), scale, zones.keySet());
    }

    /**
     * Apply partial overrides without touching the zone registry
     */
    public void configure(SpaceParameters params) {
        Objects.requireNonNull(params, "params");
        params.scaleOverride().ifPresent(s -> scale = s);
        params.orientationOverride().ifPresent(o -> orientation = o.normalize());
        params.originOverride().ifPresent(o -> {
            origin = o;
            bounds = bounds.moveTo(o);
        });
        params.sizeOverride().ifPresent(s -> bounds = new Area3D(bounds.getCenter(), s.x, s.y, s.z));
        log.debug("Signing space configured: scale={}, origin={}, orientation={}, bounds={}", scale, origin,
                  orientation, bounds);
    }

    /**
     * @return false if a zone with the same id is already registered
     */
    public boolean addZone(ReferenceZone zone) {
        Objects.requireNonNull(zone, "zone");
        if (zone.getId() == null || zones.containsKey(zone.getId())) {
            return false;
        }
        zones.put(zone.getId(), zone);
        return true;
    }

    /**
     * @return false if no zone with that id is registered
     */
    public boolean removeZone(String zoneId) {
        return zones.remove(zoneId) != null;
    }

    public Optional<ReferenceZone> getZone(String zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    public boolean hasZone(String zoneId) {
        return zones.containsKey(zoneId);
    }

    /**
     * Registered zones in insertion order
     */
    public List<ReferenceZone> getZones() {
        return List.copyOf(zones.values());
    }

    public int zoneCount() {
        return zones.size();
    }

    /**
     * World to space coordinates: translate by the origin, then scale
     */
    public Point3D transformToSpace(Point3D world) {
        return new Point3D((world.x - origin.x) * scale, (world.y - origin.y) * scale, (world.z - origin.z) * scale);
    }

    /**
     * Space to world coordinates: scale, then translate by the origin. Inverse of {@link #transformToSpace}.
     */
    public Point3D transformFromSpace(Point3D local) {
        return new Point3D(local.x / scale + origin.x, local.y / scale + origin.y, local.z / scale + origin.z);
    }

    /**
     * Whether a world point falls inside the bounding volume
     */
    public boolean containsPoint(Point3D world) {
        return bounds.contains(world);
    }

    /**
     * Deep copy, zones included
     */
    public SigningSpace copy() {
        var copy = new SigningSpace();
        copy.scale = scale;
        copy.origin = origin;
        copy.orientation = orientation;
        copy.bounds = bounds;
        for (var zone : zones.values()) {
            copy.zones.put(zone.getId(), zone.copy());
        }
        return copy;
    }

    /**
     * Restore default scale, origin, orientation and bounds, and drop every zone
     */
    public void reset() {
        scale = DEFAULT_SCALE;
        origin = Point3D.ORIGIN;
        orientation = DEFAULT_ORIENTATION;
        bounds = new Area3D(Point3D.ORIGIN, DEFAULT_SIZE.x, DEFAULT_SIZE.y, DEFAULT_SIZE.z);
        zones.clear();
    }

    public float getScale() {
        return scale;
    }

    public Point3D getOrigin() {
        return origin;
    }

    public Vector3D getOrientation() {
        return orientation;
    }

    public Area3D getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return String.format("SigningSpace[scale=%.3f, origin=%s, orientation=%s, zones=%d]", scale, origin,
                             orientation, zones.size());
    }
}
