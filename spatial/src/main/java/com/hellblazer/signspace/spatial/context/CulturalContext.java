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

import java.util.*;

/**
 * Cultural context driving zone and proforme generation: region, formality level, usage tag, optional dialect and
 * free-form parameters ({@code thematicField}, {@code hasContainers}, {@code containerType}, {@code timeSegments}).
 *
 * <p>Immutable. The formality level is clamped to [0, 1]. A context built without a formality level reports
 * {@link #DEFAULT_FORMALITY} but {@link #hasFormalityLevel()} is false, which suppresses formality adaptation.
 *
 * @author hal.hildebrand
 */
public final class CulturalContext {

    /** Formality assumed when the context does not specify one */
    public static final float DEFAULT_FORMALITY = 0.5f;

    public static final String PARAM_THEMATIC_FIELD = "thematicField";
    public static final String PARAM_HAS_CONTAINERS = "hasContainers";
    public static final String PARAM_CONTAINER_TYPE = "containerType";
    public static final String PARAM_TIME_SEGMENTS  = "timeSegments";

    private final String              region;
    private final Float               formalityLevel;
    private final ContextTag          tag;
    private final String              dialect;
    private final Map<String, Object> parameters;

    /**
     * @param region         cultural region, e.g. {@code france}
     * @param formalityLevel formality in [0, 1], null when unspecified
     * @param tag            usage context, may be null
     * @param dialect        optional dialect, may be null
     * @param parameters     custom parameters, may be null
     */
    public CulturalContext(String region, Float formalityLevel, ContextTag tag, String dialect,
                           Map<String, Object> parameters) {
        Objects.requireNonNull(region, "region cannot be null");
        if (formalityLevel != null && formalityLevel.isNaN()) {
            throw new IllegalArgumentException("formalityLevel must be a number");
        }
        this.region = region.trim().toLowerCase(Locale.ROOT);
        this.formalityLevel = formalityLevel == null ? null : clamp(formalityLevel);
        this.tag = tag;
        this.dialect = dialect;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    public static CulturalContext of(String region) {
        return new CulturalContext(region, null, null, null, null);
    }

    public static CulturalContext of(String region, float formalityLevel) {
        return new CulturalContext(region, formalityLevel, null, null, null);
    }

    public static CulturalContext of(String region, float formalityLevel, ContextTag tag) {
        return new CulturalContext(region, formalityLevel, tag, null, null);
    }

    private static float clamp(float value) {
        return Math.max(0f, Math.min(1f, value));
    }

    public String getRegion() {
        return region;
    }

    /**
     * Formality level, {@link #DEFAULT_FORMALITY} when unspecified
     */
    public float getFormalityLevel() {
        return formalityLevel == null ? DEFAULT_FORMALITY : formalityLevel;
    }

    public boolean hasFormalityLevel() {
        return formalityLevel != null;
    }

    public Optional<ContextTag> getTag() {
        return Optional.ofNullable(tag);
    }

    public Optional<String> getDialect() {
        return Optional.ofNullable(dialect);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getStringParameter(String key, String defaultValue) {
        var value = parameters.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public boolean getBooleanParameter(String key) {
        var value = parameters.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * List parameter; accepts a collection or a comma separated string
     */
    public List<String> getListParameter(String key, List<String> defaultValue) {
        var value = parameters.get(key);
        if (value instanceof Collection<?> c && !c.isEmpty()) {
            var result = new ArrayList<String>(c.size());
            for (var item : c) {
                result.add(String.valueOf(item));
            }
            return List.copyOf(result);
        }
        if (value instanceof String s && !s.isBlank()) {
            var result = new ArrayList<String>();
            for (var part : s.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return List.copyOf(result);
        }
        return defaultValue;
    }

    public boolean isFormal(float threshold) {
        return hasFormalityLevel() && formalityLevel > threshold;
    }

    public CulturalContext withFormalityLevel(float newFormality) {
        return new CulturalContext(region, newFormality, tag, dialect, parameters);
    }

    public CulturalContext withTag(ContextTag newTag) {
        return new CulturalContext(region, formalityLevel, newTag, dialect, parameters);
    }

    public CulturalContext withDialect(String newDialect) {
        return new CulturalContext(region, formalityLevel, tag, newDialect, parameters);
    }

    public CulturalContext withParameter(String key, Object value) {
        var updated = new HashMap<>(parameters);
        updated.put(key, value);
        return new CulturalContext(region, formalityLevel, tag, dialect, updated);
    }

    /**
     * Stable textual key covering every field that influences generation
     */
    public String cacheKey() {
        var sb = new StringBuilder("structure_").append(region)
                                                .append('_')
                                                .append(formalityLevel == null ? "default" : formalityLevel.toString())
                                                .append('_')
                                                .append(tag == null ? "default" : tag.label());
        if (dialect != null) {
            sb.append("_dialect=").append(dialect);
        }
        if (!parameters.isEmpty()) {
            sb.append('_').append(parameters);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CulturalContext other)) return false;
        return region.equals(other.region) && Objects.equals(formalityLevel, other.formalityLevel)
        && tag == other.tag && Objects.equals(dialect, other.dialect) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, formalityLevel, tag, dialect, parameters);
    }

    @Override
    public String toString() {
        return String.format("CulturalContext[region=%s, formality=%s, tag=%s, dialect=%s, parameters=%s]", region,
                             formalityLevel == null ? "unspecified" : String.format("%.2f", formalityLevel),
                             tag == null ? "none" : tag.label(), dialect, parameters);
    }
}
