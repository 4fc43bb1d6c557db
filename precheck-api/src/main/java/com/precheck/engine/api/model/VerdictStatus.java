package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of evaluating one rule.
 */
public enum VerdictStatus {
    PASS("pass"),
    FAIL("fail"),
    WARNING("warning"),

    /**
     * The check cannot be automated and needs a human.
     */
    MANUAL_REVIEW("manual_review");

    private final String wireName;

    VerdictStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
