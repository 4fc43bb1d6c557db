/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of one checklist section.
 *
 * @param sectionName   section name
 * @param items         verdicts in rule-definition order
 * @param sectionScore  points earned, in {@code [0, sectionWeight]}
 * @param sectionWeight share of the overall 100 points
 * @param gatingScore   section score with failing informational rules credited
 *                      in full; drives the status decision only
 */
public record SectionResult(
        @JsonProperty("section_name") String sectionName,
        @JsonProperty("items") List<Verdict> items,
        @JsonProperty("section_score") double sectionScore,
        @JsonProperty("section_weight") double sectionWeight,
        @JsonIgnore double gatingScore
) implements Serializable {

    private static final double EPSILON = 1e-9;

    public SectionResult {
        Objects.requireNonNull(sectionName, "sectionName must not be null");
        items = items == null ? List.of() : List.copyOf(items);
        if (!Double.isFinite(sectionWeight) || sectionWeight < 0) {
            throw new IllegalArgumentException("Section '" + sectionName + "' weight must be >= 0, got " + sectionWeight);
        }
        requireWithinWeight(sectionName, "sectionScore", sectionScore, sectionWeight);
        requireWithinWeight(sectionName, "gatingScore", gatingScore, sectionWeight);
    }

    /**
     * Creates a section result whose gating score equals its section score.
     */
    public SectionResult(String sectionName, List<Verdict> items, double sectionScore, double sectionWeight) {
        this(sectionName, items, sectionScore, sectionWeight, sectionScore);
    }

    /**
     * Earned fraction of the section weight; 1.0 for zero-weight sections.
     */
    public double ratio() {
        return sectionWeight > 0 ? sectionScore / sectionWeight : 1.0;
    }

    private static void requireWithinWeight(String sectionName, String name, double value, double weight) {
        if (!Double.isFinite(value) || value < -EPSILON || value > weight + EPSILON) {
            throw new IllegalArgumentException(
                    "Section '" + sectionName + "' " + name + " " + value + " outside [0, " + weight + "]");
        }
    }
}
