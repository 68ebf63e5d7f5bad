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
package com.hellblazer.signspace.spatial.structure;

import com.hellblazer.signspace.spatial.SpatialException;
import com.hellblazer.signspace.spatial.SpatialException.ErrorCode;
import com.hellblazer.signspace.spatial.SpatialException.StructureGenerationException;
import com.hellblazer.signspace.spatial.analysis.ComponentKind;
import com.hellblazer.signspace.spatial.analysis.LsfInput;
import com.hellblazer.signspace.spatial.analysis.SpatialAnalysis;
import com.hellblazer.signspace.spatial.analysis.SpatialAnalyzer;
import com.hellblazer.signspace.spatial.analysis.SpatialComponent;
import com.hellblazer.signspace.spatial.cache.CacheLevel;
import com.hellblazer.signspace.spatial.cache.CacheStats;
import com.hellblazer.signspace.spatial.cache.MultiLevelCache;
import com.hellblazer.signspace.spatial.context.CulturalContext;
import com.hellblazer.signspace.spatial.layout.ElementKind;
import com.hellblazer.signspace.spatial.layout.LayoutGenerator;
import com.hellblazer.signspace.spatial.layout.SpatialElement;
import com.hellblazer.signspace.spatial.layout.SpatialLayout;
import com.hellblazer.signspace.spatial.layout.SpatialRelation;
import com.hellblazer.signspace.spatial.proforme.Proforme;
import com.hellblazer.signspace.spatial.proforme.ProformeRegistry;
import com.hellblazer.signspace.spatial.space.SigningSpace;
import com.hellblazer.signspace.spatial.validation.SpatialValidator;
import com.hellblazer.signspace.spatial.zone.ReferenceZoneGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Facade over the spatial pipeline. Generates structures for cultural contexts, analyzes raw input and checks the
 * structural integrity of a structure, caching generated structures and analyses in the injected cache.
 *
 * <p>The signing space and proforme registry owned by the manager are mutable, so generation is serialized on a
 * single lock. Analysis is stateless and runs unlocked. Operations complete on the calling thread; the futures let
 * asynchronous callers compose them.
 *
 * @author hal.hildebrand
 */
public class SpatialStructureManager {
    public static final String STRUCTURE_PREFIX = "structure_";
    public static final String ANALYSIS_PREFIX  = "analysis_";

    /** Fraction of the combined half extents two zones may share before they are reported as overlapping */
    public static final float ZONE_OVERLAP_FACTOR = 0.7f;

    /** Concept matched against the proforme catalog for entity elements */
    static final String ENTITY_CONCEPT = "person";

    private static final Logger log = LoggerFactory.getLogger(SpatialStructureManager.class);

    private final ManagerConfiguration    configuration;
    private final MultiLevelCache<Object> cache;
    private final SigningSpace            space;
    private final ProformeRegistry        proformes;
    private final ReferenceZoneGenerator  zoneGenerator;
    private final LayoutGenerator         layoutGenerator;
    private final SpatialValidator        validator;
    private final SpatialAnalyzer         analyzer;
    private final Clock                   clock;
    private final Lock                    generationLock = new ReentrantLock();

    public SpatialStructureManager(MultiLevelCache<Object> cache) {
        this(ManagerConfiguration.defaultConfig(), cache, new SigningSpace(), new ProformeRegistry(),
             new ReferenceZoneGenerator(), new LayoutGenerator(), new SpatialAnalyzer(), Clock.systemUTC());
    }

    public SpatialStructureManager(ManagerConfiguration configuration, MultiLevelCache<Object> cache,
                                   SigningSpace space, ProformeRegistry proformes,
                                   ReferenceZoneGenerator zoneGenerator, LayoutGenerator layoutGenerator,
                                   SpatialAnalyzer analyzer, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.space = Objects.requireNonNull(space, "space");
        this.proformes = Objects.requireNonNull(proformes, "proformes");
        this.zoneGenerator = Objects.requireNonNull(zoneGenerator, "zoneGenerator");
        this.layoutGenerator = Objects.requireNonNull(layoutGenerator, "layoutGenerator");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.validator = new SpatialValidator(proformes);
    }

    /**
     * Manager with default collaborators and a fresh cache built from the configuration
     */
    public static SpatialStructureManager create(ManagerConfiguration configuration) {
        var cache = new MultiLevelCache<Object>(configuration.cacheConfiguration(), Clock.systemUTC());
        return new SpatialStructureManager(configuration, cache, new SigningSpace(), new ProformeRegistry(),
                                           new ReferenceZoneGenerator(), new LayoutGenerator(), new SpatialAnalyzer(),
                                           Clock.systemUTC());
    }

    /**
     * Structure for the context, served from the cache when an identical context was generated before. Spatial
     * failures complete the future with the original exception; anything else is wrapped in a
     * {@link StructureGenerationException} with {@link ErrorCode#GENERATION_ERROR}.
     */
    public CompletableFuture<SpatialStructure> generateSpatialStructure(CulturalContext context) {
        Objects.requireNonNull(context, "context");
        try {
            return CompletableFuture.completedFuture(generate(context));
        } catch (SpatialException e) {
            log.warn("Spatial structure generation failed for {}: {}", context.getRegion(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure generating spatial structure for {}", context.getRegion(), e);
            var details = Map.of("region", context.getRegion(), "context", context.cacheKey());
            return CompletableFuture.failedFuture(
            new StructureGenerationException("Failed to generate spatial structure", ErrorCode.GENERATION_ERROR,
                                             details, e));
        }
    }

    /**
     * Analysis of the input, cached by a digest of its canonical form
     */
    public CompletableFuture<SpatialAnalysis> analyzeSpatialStructure(LsfInput input) {
        Objects.requireNonNull(input, "input");
        try {
            return CompletableFuture.completedFuture(analyze(input));
        } catch (RuntimeException e) {
            log.error("Spatial analysis failed", e);
            var details = Map.of("inputKind", input.isText() ? "text" : "structured");
            return CompletableFuture.failedFuture(
            new StructureGenerationException("Failed to analyze spatial structure", ErrorCode.ANALYSIS_ERROR,
                                             details, e));
        }
    }

    /**
     * Integrity check of zones, proformes, components and relations. Always completes normally; problems are
     * reported as issues.
     */
    public CompletableFuture<IntegrityReport> validateSpatialStructure(SpatialStructure structure) {
        Objects.requireNonNull(structure, "structure");
        return CompletableFuture.completedFuture(checkIntegrity(structure));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public void clearCache() {
        cache.clear();
        log.info("Spatial structure cache cleared");
    }

    public ManagerConfiguration getConfiguration() {
        return configuration;
    }

    private SpatialStructure generate(CulturalContext context) {
        var key = context.cacheKey();
        generationLock.lock();
        try {
            var cached = cache.get(key);
            if (cached.isPresent() && cached.get() instanceof SpatialStructure structure) {
                log.debug("Cache hit for {}", key);
                return structure;
            }

            space.initialize(context);
            proformes.prepareForContext(context);
            var zones = zoneGenerator.generateZones(context);
            for (var zone : zones) {
                if (!space.addZone(zone)) {
                    log.debug("Zone {} already registered in the signing space", zone.getId());
                }
            }
            var layout = layoutGenerator.generateLayout(zones, context);
            var components = deriveComponents(layout);
            var relations = new ArrayList<>(layout.getRelations());

            if (configuration.strictValidation()) {
                validator.validateStructure(layout);
            }
            var metadata = new StructureMetadata(clock.instant(), context, validator.measureCoherence(layout),
                                                 SpatialAnalyzer.complexityScore(components, relations.size()),
                                                 optimizationScore(layout), layout.elementCount(), relations.size());
            var structure = new SpatialStructure(STRUCTURE_PREFIX + UUID.randomUUID(), zones,
                                                 proformes.getActiveProformes(), components, relations, layout,
                                                 metadata);
            cache.put(key, structure, CacheLevel.L2);
            log.info("Generated spatial structure {} for {}: {} zones, {} elements, {} relations", structure.getId(),
                     context.getRegion(), zones.size(), layout.elementCount(), relations.size());
            return structure;
        } finally {
            generationLock.unlock();
        }
    }

    private SpatialAnalysis analyze(LsfInput input) {
        var key = ANALYSIS_PREFIX + digest(input.canonicalForm());
        var cached = cache.get(key);
        if (cached.isPresent() && cached.get() instanceof SpatialAnalysis analysis) {
            log.debug("Cache hit for {}", key);
            return analysis;
        }
        var analysis = analyzer.analyzeLsfInput(input);
        cache.put(key, analysis, CacheLevel.L2);
        return analysis;
    }

    /**
     * One component per element, sharing the element's id so that layout relations resolve against the components
     */
    List<SpatialComponent> deriveComponents(SpatialLayout layout) {
        var entityProforme = proformes.getProformesByRepresentation(ENTITY_CONCEPT)
                                      .stream()
                                      .findFirst()
                                      .map(Proforme::getId)
                                      .orElse(ProformeRegistry.BASE_INDEX_POINTING);
        var components = new ArrayList<SpatialComponent>(layout.elementCount());
        for (var element : layout.getElements()) {
            var kind = switch (element.getKind()) {
                case ENTITY -> ComponentKind.PROFORME;
                case LANDMARK -> ComponentKind.POINTING;
                case CONTAINER, CONCEPT -> ComponentKind.ZONE;
            };
            var properties = componentProperties(element);
            if (element.getKind() == ElementKind.ENTITY) {
                properties.put("proformeId", entityProforme);
            }
            components.add(new SpatialComponent(element.getId(), kind, element.getPosition(), properties));
        }
        return components;
    }

    private static Map<String, Object> componentProperties(SpatialElement element) {
        var properties = new LinkedHashMap<String, Object>();
        var elementProperties = element.getProperties();
        properties.put("elementKind", element.getKind().name());
        properties.put("importance", element.importance());
        element.getZoneId().ifPresent(zoneId -> properties.put("zoneId", zoneId));
        if (elementProperties.role() != null) {
            properties.put("role", elementProperties.role());
        }
        if (elementProperties.timeSegment() != null) {
            properties.put("timeSegment", elementProperties.timeSegment());
        }
        return properties;
    }

    /**
     * One minus the fraction of element pairs still overlapping, 1 below two elements
     */
    static double optimizationScore(SpatialLayout layout) {
        int n = layout.elementCount();
        if (n < 2) {
            return 1.0;
        }
        var pairs = n * (n - 1) / 2.0;
        return Math.max(0.0, 1.0 - LayoutGenerator.countOverlaps(layout) / pairs);
    }

    IntegrityReport checkIntegrity(SpatialStructure structure) {
        var issues = new ArrayList<String>();
        var zones = structure.getZones();
        var structureProformes = structure.getProformes();
        var components = structure.getComponents();
        var relations = structure.getRelations();

        for (var zone : zones) {
            if (isBlank(zone.getId())) {
                issues.add("Zone missing id");
            }
            if (zone.getArea() == null) {
                issues.add("Zone " + zone.getId() + " missing area");
            } else if (!zone.getArea().isValid()) {
                issues.add("Zone " + zone.getId() + " has invalid size");
            }
        }
        for (int i = 0; i < zones.size(); i++) {
            for (int j = i + 1; j < zones.size(); j++) {
                var a = zones.get(i).getArea();
                var b = zones.get(j).getArea();
                if (a != null && b != null && a.isValid() && b.isValid() && a.intersects(b, ZONE_OVERLAP_FACTOR)) {
                    issues.add("Zones " + zones.get(i).getId() + " and " + zones.get(j).getId() + " overlap");
                }
            }
        }

        for (var proforme : structureProformes) {
            if (isBlank(proforme.getId())) {
                issues.add("Proforme missing id");
            }
            if (isBlank(proforme.getName())) {
                issues.add("Proforme " + proforme.getId() + " missing name");
            }
            if (proforme.getHandshape() == null) {
                issues.add("Proforme " + proforme.getId() + " missing handshape");
            }
            if (proforme.getOrientation() == null || !proforme.getOrientation().isComplete()) {
                issues.add("Proforme " + proforme.getId() + " has incomplete orientation");
            }
        }

        var componentIds = new HashSet<String>();
        for (var component : components) {
            if (isBlank(component.id())) {
                issues.add("Component missing id");
            } else {
                componentIds.add(component.id());
            }
            if (component.kind() == null) {
                issues.add("Component " + component.id() + " missing kind");
            }
            if (component.properties().isEmpty()) {
                issues.add("Component " + component.id() + " has no properties");
            }
        }

        for (var relation : relations) {
            checkRelation(relation, componentIds, issues);
        }

        int items = zones.size() + structureProformes.size() + components.size() + relations.size();
        var score = items == 0 ? 1.0 : Math.max(0.0, 1.0 - (double) issues.size() / items);
        if (!issues.isEmpty()) {
            log.debug("Structure {} has {} integrity issues", structure.getId(), issues.size());
        }
        return new IntegrityReport(issues.isEmpty(), issues, score);
    }

    private static void checkRelation(SpatialRelation relation, Set<String> componentIds, List<String> issues) {
        if (isBlank(relation.id())) {
            issues.add("Relation missing id");
        }
        if (relation.kind() == null) {
            issues.add("Relation " + relation.id() + " missing kind");
        }
        if (!componentIds.contains(relation.sourceId())) {
            issues.add("Relation " + relation.id() + " has dangling source " + relation.sourceId());
        }
        if (!componentIds.contains(relation.targetId())) {
            issues.add("Relation " + relation.id() + " has dangling target " + relation.targetId());
        }
        if (!(relation.strength() >= 0f && relation.strength() <= 1f)) {
            issues.add("Relation " + relation.id() + " has strength out of range: " + relation.strength());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String digest(String text) {
        try {
            var hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
