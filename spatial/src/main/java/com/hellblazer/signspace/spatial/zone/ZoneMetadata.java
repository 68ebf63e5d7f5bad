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
package com.hellblazer.signspace.spatial.zone;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed metadata attached to a reference zone. Each variant holds the fields the generators depend on; culture
 * specific fields that no algorithm reads go into the residual {@link #extensions()} map.
 *
 * @author hal.hildebrand
 */
public sealed interface ZoneMetadata
    permits ZoneMetadata.Timeline, ZoneMetadata.Actant, ZoneMetadata.Topic, ZoneMetadata.Neutral,
            ZoneMetadata.Abstract, ZoneMetadata.Container, ZoneMetadata.Space {

    /**
     * Fields not covered by the variant, immutable
     */
    Map<String, Object> extensions();

    /**
     * @param direction reading direction of the time line, e.g. {@code left-to-right}
     * @param segments  ordered time segments, one landmark is placed per segment
     */
    record Timeline(String direction, List<String> segments, Map<String, Object> extensions) implements ZoneMetadata {
        public Timeline {
            Objects.requireNonNull(direction, "direction");
            segments = List.copyOf(segments);
            extensions = Map.copyOf(extensions);
        }

        public Timeline(String direction, List<String> segments) {
            this(direction, segments, Map.of());
        }
    }

    /**
     * @param role            default grammatical role of the actant placed here
     * @param contextualUsage usage tag of the generating context
     */
    record Actant(String role, String contextualUsage, Map<String, Object> extensions) implements ZoneMetadata {
        public Actant {
            Objects.requireNonNull(role, "role");
            extensions = Map.copyOf(extensions);
        }

        public Actant(String role, String contextualUsage) {
            this(role, contextualUsage, Map.of());
        }
    }

    record Topic(String thematicField, String emphasis, Map<String, Object> extensions) implements ZoneMetadata {
        public Topic {
            extensions = Map.copyOf(extensions);
        }

        public Topic(String thematicField, String emphasis) {
            this(thematicField, emphasis, Map.of());
        }
    }

    record Neutral(Map<String, Object> extensions) implements ZoneMetadata {
        public Neutral {
            extensions = Map.copyOf(extensions);
        }

        public Neutral() {
            this(Map.of());
        }
    }

    record Abstract(String conceptType, Map<String, Object> extensions) implements ZoneMetadata {
        public Abstract {
            extensions = Map.copyOf(extensions);
        }

        public Abstract(String conceptType) {
            this(conceptType, Map.of());
        }
    }

    record Container(String containerType, Map<String, Object> extensions) implements ZoneMetadata {
        public Container {
            extensions = Map.copyOf(extensions);
        }

        public Container(String containerType) {
            this(containerType, Map.of());
        }
    }

    /**
     * Zones seeded by the signing space itself rather than by the zone generator
     *
     * @param purpose what the zone is reserved for, e.g. {@code formal-register}
     */
    record Space(String purpose, Map<String, Object> extensions) implements ZoneMetadata {
        public Space {
            extensions = Map.copyOf(extensions);
        }

        public Space(String purpose) {
            this(purpose, Map.of());
        }
    }
}
