/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import java.util.Objects;

/**
 * A compiled, immutable compliance check.
 *
 * <p>Rules are produced only by the checklist compiler, which guarantees that
 * {@code ruleId} is unique within its checklist and that every rule belongs to
 * exactly one section.
 *
 * @param ruleId        unique identifier within the checklist (e.g. "CMP-001")
 * @param section       section the rule is aggregated under
 * @param item          short human label
 * @param description   full requirement text
 * @param extractionKey key (or dotted path) into the {@link FactStore}
 * @param passCondition condition applied to the extracted value
 * @param severity      effect of a failing condition
 * @param weight        relative weight within the section, {@code >= 0}
 * @param downgradeNote set when the compiler coerced an unusable condition to
 *                      {@code not_empty}, otherwise null
 */
public record Rule(
        String ruleId,
        String section,
        String item,
        String description,
        String extractionKey,
        PassCondition passCondition,
        Severity severity,
        double weight,
        String downgradeNote
) {

    public Rule {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(extractionKey, "extractionKey must not be null");
        Objects.requireNonNull(passCondition, "passCondition must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (!Double.isFinite(weight) || weight < 0) {
            throw new IllegalArgumentException("Rule '" + ruleId + "' weight must be finite and >= 0, got " + weight);
        }
        if (item == null) item = ruleId;
        if (description == null) description = item;
    }

    /**
     * Creates a rule without a downgrade note.
     */
    public Rule(String ruleId, String section, String item, String description,
                String extractionKey, PassCondition passCondition, Severity severity, double weight) {
        this(ruleId, section, item, description, extractionKey, passCondition, severity, weight, null);
    }

    public boolean isDowngraded() {
        return downgradeNote != null;
    }

    public boolean isManual() {
        return passCondition.requiresManualReview();
    }
}
