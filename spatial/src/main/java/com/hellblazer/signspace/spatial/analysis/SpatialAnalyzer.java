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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;

/**
 * Turns text or structured input into components, relations, a graph and scored metadata.
 *
 * <p>Malformed input never fails: it produces a low confidence analysis carrying warnings.
 *
 * @author hal.hildebrand
 */
public class SpatialAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SpatialAnalyzer.class);

    private static final double DIVERSITY_WEIGHT = 0.4;
    private static final double DENSITY_WEIGHT   = 0.6;
    private static final double EMPTY_CONFIDENCE = 0.5;

    private final AnalyzerConfiguration config;
    private final ComponentExtractor    extractor;
    private final Clock                 clock;

    public SpatialAnalyzer() {
        this(AnalyzerConfiguration.defaultConfig(), new ComponentExtractor(), Clock.systemUTC());
    }

    public SpatialAnalyzer(AnalyzerConfiguration config, ComponentExtractor extractor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Complexity in [0, 1]: weighted component kind diversity and undirected relation density
     */
    public static double complexityScore(List<SpatialComponent> components, int relationCount) {
        int n = components.size();
        if (n == 0) {
            return 0.0;
        }
        var kinds = EnumSet.noneOf(ComponentKind.class);
        for (var component : components) {
            kinds.add(component.kind());
        }
        var diversity = (double) kinds.size() / ComponentKind.values().length;
        var density = n < 2 ? 0.0 : relationCount / (n * (n - 1) / 2.0);
        return Math.min(1.0, DIVERSITY_WEIGHT * diversity + DENSITY_WEIGHT * density);
    }

    /**
     * Fraction of relations whose endpoints both resolve; 1 without relations, 0 without components
     */
    public static double coherenceScore(List<SpatialComponent> components, List<SpatialRelation> relations) {
        if (components.isEmpty()) {
            return 0.0;
        }
        if (relations.isEmpty()) {
            return 1.0;
        }
        var ids = new HashSet<String>();
        for (var component : components) {
            ids.add(component.id());
        }
        int resolved = 0;
        for (var relation : relations) {
            if (ids.contains(relation.sourceId()) && ids.contains(relation.targetId())) {
                resolved++;
            }
        }
        return (double) resolved / relations.size();
    }

    public SpatialAnalysis analyzeLsfInput(LsfInput input) {
        Objects.requireNonNull(input, "input");
        var start = clock.millis();

        var extraction = input.isText() ? extractor.extractFromText(input.getText().orElse(""))
                                        : extractor.extractFromStructured(input.getStructured().orElse(null));
        var components = extraction.components();
        var relations = extraction.relations();
        var graph = new SpatialGraph(components, relations);

        var processingTime = Duration.ofMillis(Math.max(0L, clock.millis() - start));
        var metadata = metadata(components, relations, processingTime);
        for (var warning : metadata.warnings()) {
            log.warn("Analysis warning: {}", warning);
        }
        return new SpatialAnalysis("analysis_" + UUID.randomUUID(), components, relations, graph, metadata);
    }

    /**
     * Analysis with its coherence as the score
     */
    public SpatialAnalysis.Scored analyze(LsfInput input) {
        var analysis = analyzeLsfInput(input);
        return new SpatialAnalysis.Scored(analysis, analysis.metadata().coherence());
    }

    public AnalyzerConfiguration getConfiguration() {
        return config;
    }

    private AnalysisMetadata metadata(List<SpatialComponent> components, List<SpatialRelation> relations,
                                      Duration processingTime) {
        var complexity = complexityScore(components, relations.size());
        var coherence = coherenceScore(components, relations);

        var warnings = new ArrayList<String>();
        if (processingTime.compareTo(config.processingTimeLimit()) > 0) {
            warnings.add(String.format("Processing time (%dms) exceeded limit (%dms)", processingTime.toMillis(),
                                       config.processingTimeLimit().toMillis()));
        }
        if (components.isEmpty()) {
            warnings.add("No components were extracted from the input");
        }

        var suggestions = new ArrayList<String>();
        if (coherence < config.lowCoherenceThreshold()) {
            suggestions.add("Consider reorganizing spatial components for better coherence");
        }
        if (components.size() > config.maxComponents()) {
            suggestions.add("Consider simplifying the spatial structure, too many components reduce clarity");
        }

        var confidence = components.isEmpty() ? config.confidenceThreshold() * EMPTY_CONFIDENCE
                                              : config.confidenceThreshold();
        return new AnalysisMetadata(processingTime, confidence, AnalyzerConfiguration.MODEL_VERSION, warnings,
                                    suggestions, components.size(), relations.size(), complexity, coherence);
    }
}
