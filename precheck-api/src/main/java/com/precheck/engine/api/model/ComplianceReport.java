/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final, immutable output of one evaluation run.
 *
 * <p>Everything except {@code generatedAt} is a pure function of the checklist
 * and the fact store, so two runs over the same inputs produce reports for which
 * {@link #sameContentAs(ComplianceReport)} holds.
 *
 * <h2>Usage</h2>
 * <pre>
 * ComplianceReport report = engine.evaluate(facts);
 *
 * if (report.status() != ComplianceStatus.COMPLIANT) {
 *     for (Verdict issue : report.criticalIssues()) {
 *         System.out.println(issue.ruleId() + ": " + issue.recommendation());
 *     }
 * }
 * </pre>
 */
public record ComplianceReport(
        @JsonProperty("report_id") String reportId,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("checklist_name") String checklistName,
        @JsonProperty("checklist_version") String checklistVersion,
        @JsonProperty("overall_score") int overallScore,
        @JsonProperty("status") ComplianceStatus status,
        @JsonProperty("sections") List<SectionResult> sections,
        @JsonProperty("summary") String summary,
        @JsonProperty("compiler_notes") List<String> compilerNotes,
        @JsonProperty("generated_at") Instant generatedAt
) implements Serializable {

    public ComplianceReport {
        Objects.requireNonNull(reportId, "reportId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        if (overallScore < 0 || overallScore > 100) {
            throw new IllegalArgumentException("overallScore must be within [0, 100], got " + overallScore);
        }
        if (companyName == null) companyName = "Unknown";
        sections = sections == null ? List.of() : List.copyOf(sections);
        compilerNotes = compilerNotes == null ? List.of() : List.copyOf(compilerNotes);
        if (summary == null) summary = "";
    }

    /**
     * All verdicts in report order.
     */
    public List<Verdict> verdicts() {
        return sections.stream()
                .flatMap(section -> section.items().stream())
                .toList();
    }

    /**
     * Verdicts with status {@link VerdictStatus#FAIL}.
     */
    public List<Verdict> criticalIssues() {
        return verdicts().stream()
                .filter(v -> v.status() == VerdictStatus.FAIL)
                .toList();
    }

    /**
     * Recommendations of all non-passing verdicts, in report order.
     */
    public List<String> recommendations() {
        return verdicts().stream()
                .map(Verdict::recommendation)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Compares every field except {@code generatedAt}.
     */
    public boolean sameContentAs(ComplianceReport other) {
        if (other == null) return false;
        return reportId.equals(other.reportId)
                && Objects.equals(companyName, other.companyName)
                && Objects.equals(checklistName, other.checklistName)
                && Objects.equals(checklistVersion, other.checklistVersion)
                && overallScore == other.overallScore
                && status == other.status
                && sections.equals(other.sections)
                && summary.equals(other.summary)
                && compilerNotes.equals(other.compilerNotes);
    }
}
