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

/**
 * Kinds of reference zone, in generation order.
 *
 * @author hal.hildebrand
 */
public enum ZoneKind {
    /** Time line running across the signing space */
    TIMELINE,
    /** Locus assigned to a participant (subject, object) */
    ACTANT,
    /** Locus of the discourse topic */
    TOPIC,
    /** Rest and default articulation area */
    NEUTRAL,
    /** Area reserved for abstract concepts */
    ABSTRACT,
    /** Volume standing for a container or an environment */
    CONTAINER
}
