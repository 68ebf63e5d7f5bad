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
package com.hellblazer.signspace.spatial.context;

import java.util.Locale;
import java.util.Optional;

/**
 * Usage context of a signed utterance.
 *
 * @author hal.hildebrand
 */
public enum ContextTag {
    EDUCATIONAL,
    CONVERSATIONAL,
    NARRATIVE,
    TECHNICAL,
    CUSTOM,
    /** Reasoning over abstract concepts, enables the abstract reference zone */
    ABSTRACT_REASONING;

    /**
     * Lower-case, hyphenated label, e.g. {@code abstract-reasoning}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parse a label as produced by {@link #label()}, case-insensitive; underscores and hyphens are interchangeable.
     */
    public static Optional<ContextTag> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        var normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var tag : values()) {
            if (tag.name().equals(normalized)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
