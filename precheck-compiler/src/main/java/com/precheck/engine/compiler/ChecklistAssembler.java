/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.compiler;

import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.RawRule;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.api.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation and defaulting pass from raw rules to an immutable {@link Checklist}.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>the rule list is not empty</li>
 *   <li>every rule has an id (or gets {@code GEN-<position>}) and ids are unique</li>
 *   <li>every rule has a section</li>
 *   <li>pass conditions parse (or are downgraded, see {@link PassConditionParser})</li>
 *   <li>rule weights of each section sum to a finite total</li>
 *   <li>section weights sum to 100, rescaled when off by at most 1%</li>
 * </ol>
 */
final class ChecklistAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ChecklistAssembler.class);

    static final double TOTAL_SECTION_WEIGHT = 100.0;
    static final double MAX_WEIGHT_DRIFT = 1.0;
    static final String GENERATED_ID_PREFIX = "GEN-";

    private final boolean strictConditions;

    ChecklistAssembler(boolean strictConditions) {
        this.strictConditions = strictConditions;
    }

    /**
     * @param sectionWeights declared section weights in order, or null to give
     *                       each section an equal share of 100
     */
    Checklist assemble(String name, String version, List<RawRule> rawRules, Map<String, Double> sectionWeights) {
        if (rawRules == null || rawRules.isEmpty()) {
            throw new InvalidChecklistException("Checklist rules cannot be empty");
        }

        List<String> warnings = new ArrayList<>();
        List<ValidatedRule> validated = validateRules(rawRules, warnings);

        Map<String, Integer> rulesPerSection = new LinkedHashMap<>();
        for (ValidatedRule rule : validated) {
            rulesPerSection.merge(rule.section(), 1, Integer::sum);
        }

        List<Rule> rules = new ArrayList<>(validated.size());
        Map<String, Double> ruleWeightTotals = new LinkedHashMap<>();
        for (ValidatedRule v : validated) {
            double weight = v.weight() != null ? v.weight() : TOTAL_SECTION_WEIGHT / rulesPerSection.get(v.section());
            ruleWeightTotals.merge(v.section(), weight, Double::sum);
            rules.add(new Rule(v.ruleId(), v.section(), v.item(), v.description(), v.extractionKey(),
                    v.parsed().condition(), v.severity(), weight, v.parsed().note()));
        }

        for (Map.Entry<String, Double> total : ruleWeightTotals.entrySet()) {
            if (!Double.isFinite(total.getValue())) {
                throw new InvalidChecklistException(
                        "Section '" + total.getKey() + "' rule weights sum to " + total.getValue());
            }
            if (total.getValue() <= 0.0) {
                String warning = "Section '" + total.getKey() + "' has zero total rule weight and is credited in full";
                logger.warn(warning);
                warnings.add(warning);
            }
        }

        Map<String, Double> weights = sectionWeights == null
                ? equalShares(rulesPerSection.keySet())
                : normalizeDeclared(sectionWeights, rulesPerSection.keySet(), warnings);

        return new Checklist(name, version, rules, weights, warnings);
    }

    private List<ValidatedRule> validateRules(List<RawRule> rawRules, List<String> warnings) {
        Set<String> ruleIds = new HashSet<>();
        List<ValidatedRule> validated = new ArrayList<>(rawRules.size());

        for (int i = 0; i < rawRules.size(); i++) {
            RawRule raw = rawRules.get(i);
            if (raw == null) {
                throw new InvalidChecklistException("Rule at index " + i + " is null", i);
            }

            String ruleId = isBlank(raw.ruleId()) ? GENERATED_ID_PREFIX + (i + 1) : raw.ruleId().trim();
            if (!ruleIds.add(ruleId)) {
                throw new InvalidChecklistException("Duplicate rule_id: " + ruleId, i);
            }

            if (isBlank(raw.section())) {
                throw new InvalidChecklistException("Rule '" + ruleId + "' (index " + i + ") has no section", i);
            }
            String section = raw.section().trim();

            Severity severity = Severity.FAIL;
            if (!isBlank(raw.severity())) {
                severity = Severity.fromString(raw.severity());
                if (severity == null) {
                    severity = Severity.FAIL;
                    String warning = "Rule '" + ruleId + "' has unknown severity '" + raw.severity() + "'; using fail";
                    logger.warn(warning);
                    warnings.add(warning);
                }
            }

            Double weight = raw.weight();
            if (weight != null && (!Double.isFinite(weight) || weight < 0)) {
                String warning = "Rule '" + ruleId + "' has invalid weight " + weight + "; using section default";
                logger.warn(warning);
                warnings.add(warning);
                weight = null;
            }

            PassConditionParser.Parsed parsed = PassConditionParser.parse(ruleId, i, raw.passCondition(), strictConditions);
            if (parsed.downgraded()) {
                logger.warn(parsed.note());
                warnings.add(parsed.note());
            }

            String item = isBlank(raw.item()) ? ruleId : raw.item().trim();
            String description = isBlank(raw.description()) ? item : raw.description().trim();
            String extractionKey = isBlank(raw.extractionKey()) ? ruleId : raw.extractionKey().trim();

            validated.add(new ValidatedRule(ruleId, section, item, description, extractionKey, parsed, severity, weight));
        }
        return validated;
    }

    private static Map<String, Double> equalShares(Set<String> sections) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double share = TOTAL_SECTION_WEIGHT / sections.size();
        for (String section : sections) {
            weights.put(section, share);
        }
        return weights;
    }

    private static Map<String, Double> normalizeDeclared(Map<String, Double> declared, Set<String> usedSections,
                                                         List<String> warnings) {
        for (String section : usedSections) {
            if (!declared.containsKey(section)) {
                throw new InvalidChecklistException("Section '" + section + "' has no declared weight");
            }
        }

        double total = 0.0;
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : declared.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new InvalidChecklistException("Section '" + entry.getKey() + "' has invalid weight " + weight);
            }
            if (!usedSections.contains(entry.getKey())) {
                throw new InvalidChecklistException("Section '" + entry.getKey() + "' declares a weight but has no rules");
            }
            weights.put(entry.getKey(), weight);
            total += weight;
        }

        double drift = Math.abs(total - TOTAL_SECTION_WEIGHT);
        if (drift > MAX_WEIGHT_DRIFT) {
            throw new InvalidChecklistException(
                    "Section weights sum to " + total + ", expected " + TOTAL_SECTION_WEIGHT);
        }
        if (drift > 0.0) {
            double scale = TOTAL_SECTION_WEIGHT / total;
            weights.replaceAll((section, weight) -> weight * scale);
            String warning = String.format("Section weights summed to %.4f and were rescaled to 100", total);
            logger.warn(warning);
            warnings.add(warning);
        }

        // Declared order may differ from rule order; keep rule order for report layout.
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (String section : usedSections) {
            ordered.put(section, weights.get(section));
        }
        return ordered;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ValidatedRule(
            String ruleId,
            String section,
            String item,
            String description,
            String extractionKey,
            PassConditionParser.Parsed parsed,
            Severity severity,
            Double weight
    ) {
    }
}
