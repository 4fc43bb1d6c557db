/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Untrusted rule as delivered by the upstream checklist parser.
 * Every field is optional here; the compiler validates and defaults them.
 *
 * <p>{@code passCondition} is either a kind name ({@code "not_empty"}) or an
 * object ({@code {"kind": "matches", "value": "^https://"}}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawRule(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("section") String section,
        @JsonProperty("item") String item,
        @JsonProperty("description") String description,
        @JsonProperty("extraction_key") String extractionKey,
        @JsonProperty("extraction_prompt") String extractionPrompt,
        @JsonProperty("pass_condition") Object passCondition,
        @JsonProperty("severity") String severity,
        @JsonProperty("weight") Double weight
) {

    /**
     * Builder-style factory for the common case in code and tests.
     */
    public static RawRule of(String ruleId, String section, String extractionKey, Object passCondition) {
        return new RawRule(ruleId, section, null, null, extractionKey, null, passCondition, null, null);
    }

    public RawRule withSection(String newSection) {
        return new RawRule(ruleId, newSection, item, description, extractionKey, extractionPrompt,
                passCondition, severity, weight);
    }

    public RawRule withSeverity(String newSeverity) {
        return new RawRule(ruleId, section, item, description, extractionKey, extractionPrompt,
                passCondition, newSeverity, weight);
    }

    public RawRule withWeight(Double newWeight) {
        return new RawRule(ruleId, section, item, description, extractionKey, extractionPrompt,
                passCondition, severity, newWeight);
    }
}
