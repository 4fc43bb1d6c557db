/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a failing rule affects the verdict and the overall status.
 */
public enum Severity {
    /**
     * Failing rule yields {@link VerdictStatus#FAIL}.
     */
    FAIL("fail"),

    /**
     * Failing rule yields {@link VerdictStatus#WARNING}.
     */
    WARNING("warning"),

    /**
     * Failing rule yields {@link VerdictStatus#WARNING} and never blocks COMPLIANT.
     */
    INFO("info");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Safely converts checklist text to a severity.
     * Accepts the wire names plus {@code critical} and {@code minor}, any casing.
     *
     * @param text the severity string
     * @return the severity, or null if not recognized
     */
    public static Severity fromString(String text) {
        if (text == null) return null;
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "fail", "failure", "critical", "error" -> FAIL;
            case "warning", "warn", "minor" -> WARNING;
            case "info", "informational" -> INFO;
            default -> null;
        };
    }

    /**
     * Whether a failure at this severity takes part in the compliance gating decision.
     */
    public boolean isGating() {
        return this != INFO;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
