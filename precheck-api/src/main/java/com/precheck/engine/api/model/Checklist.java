/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The active, compiled rule set for an evaluation run.
 *
 * <p>Immutable once built. The built-in checklist is a single shared instance
 * for the whole process; custom checklists are compiled per request.
 *
 * @param name           checklist name
 * @param version        checklist version ("custom" for uploaded checklists)
 * @param rules          rules in definition order
 * @param sectionWeights section name to weight, in section order, summing to 100
 * @param warnings       compile-time notes (condition downgrades, degenerate sections)
 */
public record Checklist(
        String name,
        String version,
        List<Rule> rules,
        Map<String, Double> sectionWeights,
        List<String> warnings
) {

    public Checklist {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(version, "version must not be null");
        rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        sectionWeights = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(sectionWeights, "sectionWeights must not be null")));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        for (Rule rule : rules) {
            if (!sectionWeights.containsKey(rule.section())) {
                throw new IllegalArgumentException(
                        "Rule '" + rule.ruleId() + "' belongs to unknown section '" + rule.section() + "'");
            }
        }
    }

    /**
     * Section names in order of first appearance.
     */
    public List<String> sections() {
        return List.copyOf(sectionWeights.keySet());
    }

    public double sectionWeight(String section) {
        Double weight = sectionWeights.get(section);
        return weight != null ? weight : 0.0;
    }

    /**
     * Rules grouped by section, both in definition order.
     */
    public Map<String, List<Rule>> rulesBySection() {
        Map<String, List<Rule>> grouped = new LinkedHashMap<>();
        for (String section : sectionWeights.keySet()) {
            grouped.put(section, new ArrayList<>());
        }
        for (Rule rule : rules) {
            grouped.get(rule.section()).add(rule);
        }
        grouped.replaceAll((section, sectionRules) -> List.copyOf(sectionRules));
        return Collections.unmodifiableMap(grouped);
    }

    public int size() {
        return rules.size();
    }
}
