/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.runtime.evaluation;

import com.precheck.engine.api.model.FactStore;
import com.precheck.engine.api.model.PassCondition;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.api.model.Severity;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.api.model.VerdictStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies one rule to one fact store.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>The fact is looked up by the rule's extraction key; a miss is the
 *       "Not found" sentinel, never an error.</li>
 *   <li>An absent fact (missing, null, blank or "Not found") fails every
 *       automated condition.</li>
 *   <li>{@code manual} rules always yield {@link VerdictStatus#MANUAL_REVIEW}.</li>
 *   <li>A failing condition yields FAIL for severity {@code fail} and WARNING
 *       for {@code warning} and {@code info}.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless; one instance may be shared by all threads.
 */
public final class RuleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    /**
     * Evaluates a rule. Never throws for any non-null rule and fact store.
     *
     * @throws NullPointerException if {@code rule} or {@code facts} is null
     */
    public Verdict evaluate(Rule rule, FactStore facts) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(facts, "facts must not be null");

        String text = facts.text(rule.extractionKey()).orElse(null);
        String foundValue = text != null ? text : FactStore.NOT_FOUND;

        VerdictStatus status;
        if (rule.isManual()) {
            status = VerdictStatus.MANUAL_REVIEW;
        } else if (text != null && test(rule, text)) {
            status = VerdictStatus.PASS;
        } else {
            status = failureStatus(rule.severity());
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Rule {} [{}] on '{}' -> {}", rule.ruleId(), rule.passCondition().describe(),
                    rule.extractionKey(), status);
        }

        return new Verdict(
                rule.ruleId(),
                rule.section(),
                rule.item(),
                status,
                rule.severity(),
                foundValue,
                RecommendationTemplates.recommend(rule, status));
    }

    static VerdictStatus failureStatus(Severity severity) {
        return severity == Severity.FAIL ? VerdictStatus.FAIL : VerdictStatus.WARNING;
    }

    private static boolean test(Rule rule, String text) {
        PassCondition condition = rule.passCondition();
        try {
            return condition.test(text);
        } catch (RuntimeException e) {
            // a condition that cannot interpret the value counts as not met
            logger.warn("Condition {} of rule {} failed on value of length {}: {}",
                    condition.describe(), rule.ruleId(), text.length(), e.toString());
            return false;
        }
    }
}
