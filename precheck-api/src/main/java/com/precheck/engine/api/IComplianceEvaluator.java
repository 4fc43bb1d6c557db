/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api;

import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.ComplianceReport;
import com.precheck.engine.api.model.FactStore;
import com.precheck.engine.api.model.RawRule;

import java.util.List;

/**
 * Contract for evaluating a site's extracted facts against a checklist.
 *
 * <p>This is the primary interface for engine consumers (the API layer, batch
 * re-scoring jobs).
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IComplianceEvaluator engine = new ComplianceEngine();
 *
 * FactStore facts = FactStore.of(Map.of(
 *     "company_name", "Demo Company Ltd",
 *     "has_privacy_policy", true
 * ));
 *
 * ComplianceReport report = engine.evaluate(facts);
 * System.out.println(report.overallScore() + " " + report.status());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe and keep no state between calls that
 * could influence a result. The same instance is used concurrently for
 * different sites.
 */
public interface IComplianceEvaluator {

    /**
     * Evaluates facts against a compiled checklist.
     *
     * @param checklist compiled checklist (must not be null)
     * @param facts     extracted facts (must not be null)
     * @return the compliance report
     * @throws NullPointerException if either argument is null
     */
    ComplianceReport evaluate(Checklist checklist, FactStore facts);

    /**
     * Evaluates facts against the built-in checklist.
     */
    ComplianceReport evaluate(FactStore facts);

    /**
     * Compiles {@code customRules} and evaluates facts against them.
     * A null rule list selects the built-in checklist; an empty one is rejected.
     *
     * @throws com.precheck.engine.api.exceptions.InvalidChecklistException if the custom rules are invalid
     */
    ComplianceReport evaluate(List<RawRule> customRules, FactStore facts);

    /**
     * Evaluates several sites against the same checklist.
     *
     * @return reports in the same order as {@code factStores}
     */
    default List<ComplianceReport> evaluateBatch(Checklist checklist, List<FactStore> factStores) {
        return factStores.stream()
                .map(facts -> evaluate(checklist, facts))
                .toList();
    }
}
