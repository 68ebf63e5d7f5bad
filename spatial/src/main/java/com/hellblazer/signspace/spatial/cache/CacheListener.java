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
package com.hellblazer.signspace.spatial.cache;

import java.util.EnumSet;

/**
 * Receives cache events. Called synchronously on the thread performing the operation, outside any tier lock.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface CacheListener {

    void onEvent(CacheEvent event);

    /**
     * Listener that only forwards events of the given types
     */
    static CacheListener filtered(CacheListener listener, CacheEvent.Type first, CacheEvent.Type... rest) {
        var types = EnumSet.of(first, rest);
        return event -> {
            if (types.contains(event.type())) {
                listener.onEvent(event);
            }
        };
    }
}
