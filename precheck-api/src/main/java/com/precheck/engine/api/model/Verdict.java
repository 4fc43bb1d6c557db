/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Result of evaluating one rule against one fact store.
 *
 * <p>Exactly one verdict is produced per active rule per evaluation run.
 * {@code recommendation} is null for {@link VerdictStatus#PASS} and never empty otherwise.
 */
public record Verdict(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("section") String section,
        @JsonProperty("item") String item,
        @JsonProperty("status") VerdictStatus status,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("found_value") String foundValue,
        @JsonProperty("recommendation") String recommendation
) implements Serializable {

    public Verdict {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (status == VerdictStatus.PASS) {
            recommendation = null;
        } else if (recommendation == null || recommendation.isBlank()) {
            throw new IllegalArgumentException("Non-pass verdict for '" + ruleId + "' requires a recommendation");
        }
    }

    public boolean passed() {
        return status == VerdictStatus.PASS;
    }

    /**
     * Whether this verdict counts towards the COMPLIANT decision.
     * Failing informational rules are reported but do not gate.
     */
    public boolean gating() {
        return severity.isGating();
    }
}
