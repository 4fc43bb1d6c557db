package com.precheck.engine.api.model;

/**
 * Overall score, status and one-sentence summary of a report.
 */
public record ScoreSummary(int overallScore, ComplianceStatus status, String summary) {
}
