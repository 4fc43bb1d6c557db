/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.runtime.aggregation;

import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.api.model.SectionResult;
import com.precheck.engine.api.model.Severity;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.api.model.VerdictStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the verdicts of one section into a weighted section score.
 *
 * <pre>
 * sectionScore = sectionWeight * sum(ruleWeight * credit) / sum(ruleWeight)
 * </pre>
 *
 * Credit is 1.0 for PASS, {@value #PARTIAL_CREDIT} for WARNING and
 * MANUAL_REVIEW, 0.0 for FAIL. A section whose rules weigh nothing in total
 * scores its full weight. Rule weights are divided by the heaviest one before
 * summing, so very large weights cannot overflow the totals.
 */
public final class SectionAggregator {

    /**
     * Credit for verdicts that are uncertain rather than proven failing.
     */
    public static final double PARTIAL_CREDIT = 0.5;

    /**
     * Aggregates one section.
     *
     * @param sectionName   section name
     * @param rules         rules of the section in definition order
     * @param verdicts      verdicts for those rules, any order
     * @param sectionWeight share of the overall 100 points
     * @throws IllegalArgumentException if a rule has no verdict
     */
    public SectionResult aggregate(String sectionName, List<Rule> rules, List<Verdict> verdicts, double sectionWeight) {
        Objects.requireNonNull(sectionName, "sectionName must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(verdicts, "verdicts must not be null");

        Map<String, Verdict> byRuleId = new HashMap<>();
        for (Verdict verdict : verdicts) {
            byRuleId.put(verdict.ruleId(), verdict);
        }

        double maxWeight = 0.0;
        for (Rule rule : rules) {
            maxWeight = Math.max(maxWeight, rule.weight());
        }

        List<Verdict> items = new ArrayList<>(rules.size());
        double totalWeight = 0.0;
        double earned = 0.0;
        double gatingEarned = 0.0;

        for (Rule rule : rules) {
            Verdict verdict = byRuleId.get(rule.ruleId());
            if (verdict == null) {
                throw new IllegalArgumentException(
                        "No verdict for rule '" + rule.ruleId() + "' in section '" + sectionName + "'");
            }
            items.add(verdict);

            double weight = maxWeight > 0.0 ? rule.weight() / maxWeight : 0.0;
            double credit = credit(verdict.status());
            totalWeight += weight;
            earned += weight * credit;
            gatingEarned += weight * (rule.severity() == Severity.INFO ? 1.0 : credit);
        }

        if (totalWeight <= 0.0) {
            return new SectionResult(sectionName, items, sectionWeight, sectionWeight, sectionWeight);
        }

        double score = clamp(sectionWeight * (earned / totalWeight), sectionWeight);
        double gatingScore = clamp(sectionWeight * (gatingEarned / totalWeight), sectionWeight);
        return new SectionResult(sectionName, items, score, sectionWeight, gatingScore);
    }

    /**
     * Aggregates every section of a checklist, in section order.
     */
    public List<SectionResult> aggregateAll(Checklist checklist, List<Verdict> verdicts) {
        List<SectionResult> results = new ArrayList<>();
        for (Map.Entry<String, List<Rule>> section : checklist.rulesBySection().entrySet()) {
            results.add(aggregate(section.getKey(), section.getValue(), verdicts,
                    checklist.sectionWeight(section.getKey())));
        }
        return results;
    }

    public static double credit(VerdictStatus status) {
        return switch (status) {
            case PASS -> 1.0;
            case WARNING, MANUAL_REVIEW -> PARTIAL_CREDIT;
            case FAIL -> 0.0;
        };
    }

    private static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(max, value));
    }
}
