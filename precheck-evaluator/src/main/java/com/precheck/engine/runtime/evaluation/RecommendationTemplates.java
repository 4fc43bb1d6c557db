package com.precheck.engine.runtime.evaluation;

import com.precheck.engine.api.model.Rule;
import com.precheck.engine.api.model.VerdictStatus;

/**
 * Deterministic recommendation text for non-passing verdicts.
 * Output depends only on the rule's item, description and the verdict status.
 */
public final class RecommendationTemplates {

    private RecommendationTemplates() {
    }

    /**
     * @return the recommendation, or null for {@link VerdictStatus#PASS}
     */
    public static String recommend(Rule rule, VerdictStatus status) {
        String item = rule.item() == null || rule.item().isBlank() ? rule.ruleId() : rule.item().trim();
        String detail = detail(item, rule.description());

        return switch (status) {
            case PASS -> null;
            case FAIL -> item + " is missing or does not meet the requirement." + detail;
            case WARNING -> "Review " + item + "." + detail;
            case MANUAL_REVIEW -> item + " cannot be verified automatically and requires human verification." + detail;
        };
    }

    private static String detail(String item, String description) {
        if (description == null || description.isBlank() || description.trim().equals(item)) {
            return "";
        }
        return " " + description.trim();
    }
}
