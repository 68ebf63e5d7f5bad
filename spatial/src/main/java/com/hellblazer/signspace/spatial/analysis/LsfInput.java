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

import com.fasterxml.jackson.databind.JsonNode;
import com.hellblazer.signspace.spatial.context.CulturalContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Analyzer input: either raw text or a structured JSON document, with an optional cultural context.
 *
 * @author hal.hildebrand
 */
public final class LsfInput {
    private final String          text;
    private final JsonNode        structured;
    private final CulturalContext context;

    private LsfInput(String text, JsonNode structured, CulturalContext context) {
        this.text = text;
        this.structured = structured;
        this.context = context;
    }

    public static LsfInput text(String text) {
        return new LsfInput(Objects.requireNonNull(text, "text"), null, null);
    }

    /**
     * @param document object with optional {@code components} and {@code relations} arrays
     */
    public static LsfInput structured(JsonNode document) {
        return new LsfInput(null, Objects.requireNonNull(document, "document"), null);
    }

    public LsfInput withContext(CulturalContext newContext) {
        return new LsfInput(text, structured, newContext);
    }

    public boolean isText() {
        return text != null;
    }

    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    public Optional<JsonNode> getStructured() {
        return Optional.ofNullable(structured);
    }

    public Optional<CulturalContext> getContext() {
        return Optional.ofNullable(context);
    }

    /**
     * Stable textual form covering the whole input, used to key analysis results
     */
    public String canonicalForm() {
        var sb = new StringBuilder();
        if (text != null) {
            sb.append("text:").append(text);
        } else {
            sb.append("structured:").append(structured.toString());
        }
        if (context != null) {
            sb.append(";context:").append(context.cacheKey());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LsfInput other && canonicalForm().equals(other.canonicalForm());
    }

    @Override
    public int hashCode() {
        return canonicalForm().hashCode();
    }

    @Override
    public String toString() {
        return isText() ? "LsfInput[text=" + text + "]" : "LsfInput[structured=" + structured + "]";
    }
}
