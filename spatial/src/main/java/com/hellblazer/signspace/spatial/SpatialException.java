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
package com.hellblazer.signspace.spatial;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sealed exception hierarchy for spatial structure operations.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link StructureGenerationException} - zone, proforme or element synthesis failed</li>
 * <li>{@link LayoutException} - a generated layout failed its own validity check</li>
 * <li>{@link ValidationException} - a coherence metric fell below the acceptance threshold</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class SpatialException extends RuntimeException
    permits SpatialException.StructureGenerationException,
            SpatialException.LayoutException,
            SpatialException.ValidationException {

    /**
     * Failure category reported by {@link StructureGenerationException}
     */
    public enum ErrorCode {
        GENERATION_ERROR,
        ANALYSIS_ERROR,
        VALIDATION_ERROR
    }

    public SpatialException(String message) {
        super(message);
    }

    public SpatialException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps any failure during zone, proforme, element or analysis synthesis.
     */
    public static final class StructureGenerationException extends SpatialException {
        private final ErrorCode           code;
        private final Map<String, Object> details;

        public StructureGenerationException(String message, ErrorCode code, Map<String, ?> details) {
            this(message, code, details, null);
        }

        public StructureGenerationException(String message, ErrorCode code, Map<String, ?> details,
                                            Throwable cause) {
            super(message, cause);
            this.code = code;
            this.details = details == null ? Map.of()
                                           : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(details));
        }

        public ErrorCode getCode() {
            return code;
        }

        /**
         * Immutable detail map describing the failing request
         */
        public Map<String, Object> getDetails() {
            return details;
        }
    }

    /**
     * Thrown when a generated layout fails its validity check, e.g. for empty zone input.
     */
    public static final class LayoutException extends SpatialException {

        public LayoutException(String message) {
            super(message);
        }

        public LayoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when any coherence metric falls below the threshold. Carries the full per-metric breakdown.
     */
    public static final class ValidationException extends SpatialException {
        private final Map<String, Double> scores;
        private final double              threshold;

        public ValidationException(String message, Map<String, Double> scores, double threshold) {
            super(message);
            this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
            this.threshold = threshold;
        }

        /**
         * Metric name to score, in evaluation order
         */
        public Map<String, Double> getScores() {
            return scores;
        }

        public double getThreshold() {
            return threshold;
        }
    }
}
