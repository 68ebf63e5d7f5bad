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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for input analysis.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class AnalyzerConfiguration {

    /** Default confidence reported for a non-empty extraction */
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    /** Default processing time after which a warning is attached */
    public static final Duration DEFAULT_PROCESSING_TIME_LIMIT = Duration.ofMillis(5000);

    /** Default component count above which simplification is suggested */
    public static final int DEFAULT_MAX_COMPONENTS = 20;

    /** Default coherence below which reorganization is suggested */
    public static final double DEFAULT_LOW_COHERENCE_THRESHOLD = 0.5;

    public static final String MODEL_VERSION = "1.0.0";

    private final double   confidenceThreshold;
    private final Duration processingTimeLimit;
    private final int      maxComponents;
    private final double   lowCoherenceThreshold;

    /**
     * @param confidenceThreshold   confidence in [0, 1] reported for a non-empty extraction
     * @param processingTimeLimit   non-negative time budget
     * @param maxComponents         positive component count above which simplification is suggested
     * @param lowCoherenceThreshold coherence in [0, 1] below which reorganization is suggested
     * @throws IllegalArgumentException if parameters are invalid
     */
    public AnalyzerConfiguration(double confidenceThreshold, Duration processingTimeLimit, int maxComponents,
                                 double lowCoherenceThreshold) {
        Objects.requireNonNull(processingTimeLimit, "processingTimeLimit cannot be null");
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException(
            "confidenceThreshold must be between 0.0 and 1.0: " + confidenceThreshold);
        }
        if (processingTimeLimit.isNegative()) {
            throw new IllegalArgumentException("processingTimeLimit must not be negative: " + processingTimeLimit);
        }
        if (maxComponents <= 0) {
            throw new IllegalArgumentException("maxComponents must be positive: " + maxComponents);
        }
        if (lowCoherenceThreshold < 0.0 || lowCoherenceThreshold > 1.0) {
            throw new IllegalArgumentException(
            "lowCoherenceThreshold must be between 0.0 and 1.0: " + lowCoherenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
        this.processingTimeLimit = processingTimeLimit;
        this.maxComponents = maxComponents;
        this.lowCoherenceThreshold = lowCoherenceThreshold;
    }

    public static AnalyzerConfiguration defaultConfig() {
        return new AnalyzerConfiguration(DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_PROCESSING_TIME_LIMIT,
                                         DEFAULT_MAX_COMPONENTS, DEFAULT_LOW_COHERENCE_THRESHOLD);
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }

    public Duration processingTimeLimit() {
        return processingTimeLimit;
    }

    public int maxComponents() {
        return maxComponents;
    }

    public double lowCoherenceThreshold() {
        return lowCoherenceThreshold;
    }

    public AnalyzerConfiguration withConfidenceThreshold(double newThreshold) {
        return new AnalyzerConfiguration(newThreshold, processingTimeLimit, maxComponents, lowCoherenceThreshold);
    }

    public AnalyzerConfiguration withProcessingTimeLimit(Duration newLimit) {
        return new AnalyzerConfiguration(confidenceThreshold, newLimit, maxComponents, lowCoherenceThreshold);
    }

    public AnalyzerConfiguration withMaxComponents(int newMax) {
        return new AnalyzerConfiguration(confidenceThreshold, processingTimeLimit, newMax, lowCoherenceThreshold);
    }

    public AnalyzerConfiguration withLowCoherenceThreshold(double newThreshold) {
        return new AnalyzerConfiguration(confidenceThreshold, processingTimeLimit, maxComponents, newThreshold);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnalyzerConfiguration that)) {
            return false;
        }
        return Double.compare(confidenceThreshold, that.confidenceThreshold) == 0
        && maxComponents == that.maxComponents
        && Double.compare(lowCoherenceThreshold, that.lowCoherenceThreshold) == 0
        && processingTimeLimit.equals(that.processingTimeLimit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(confidenceThreshold, processingTimeLimit, maxComponents, lowCoherenceThreshold);
    }

    @Override
    public String toString() {
        return String.format(
        "AnalyzerConfiguration[confidence=%.2f, timeLimit=%s, maxComponents=%d, lowCoherence=%.2f]",
        confidenceThreshold, processingTimeLimit, maxComponents, lowCoherenceThreshold);
    }
}
