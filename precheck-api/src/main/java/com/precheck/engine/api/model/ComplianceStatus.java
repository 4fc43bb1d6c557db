package com.precheck.engine.api.model;

/**
 * Overall compliance status derived from the report score.
 */
public enum ComplianceStatus {
    COMPLIANT,
    NEEDS_REVIEW,
    NON_COMPLIANT
}
