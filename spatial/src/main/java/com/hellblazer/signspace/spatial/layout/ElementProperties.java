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

import java.util.Map;

/**
 * Typed properties of a layout element. Every field except the extension map is optional.
 *
 * @param importance relative weight in [0, 1] used to split overlap displacement and to pick visible elements
 * @param extensions culture specific fields with no typed counterpart
 * @author hal.hildebrand
 */
public record ElementProperties(String role, Float importance, String timeSegment, String thematicField,
                                String emphasis, String containerType, String conceptType,
                                Map<String, Object> extensions) {

    public static final float DEFAULT_IMPORTANCE = 0.5f;

    public static final ElementProperties EMPTY = builder().build();

    public ElementProperties {
        if (importance != null) {
            if (!Float.isFinite(importance)) {
                throw new IllegalArgumentException("Importance must be finite: " + importance);
            }
            importance = Math.max(0f, Math.min(1f, importance));
        }
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public float importanceOrDefault() {
        return importance == null ? DEFAULT_IMPORTANCE : importance;
    }

    public static final class Builder {
        private String              role;
        private Float               importance;
        private String              timeSegment;
        private String              thematicField;
        private String              emphasis;
        private String              containerType;
        private String              conceptType;
        private Map<String, Object> extensions = Map.of();

        private Builder() {
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder importance(float importance) {
            this.importance = importance;
            return this;
        }

        public Builder timeSegment(String timeSegment) {
            this.timeSegment = timeSegment;
            return this;
        }

        public Builder thematicField(String thematicField) {
            this.thematicField = thematicField;
            return this;
        }

        public Builder emphasis(String emphasis) {
            this.emphasis = emphasis;
            return this;
        }

        public Builder containerType(String containerType) {
            this.containerType = containerType;
            return this;
        }

        public Builder conceptType(String conceptType) {
            this.conceptType = conceptType;
            return this;
        }

        public Builder extensions(Map<String, Object> extensions) {
            this.extensions = extensions;
            return this;
        }

        public ElementProperties build() {
            return new ElementProperties(role, importance, timeSegment, thematicField, emphasis, containerType,
                                         conceptType, extensions);
        }
    }
}
