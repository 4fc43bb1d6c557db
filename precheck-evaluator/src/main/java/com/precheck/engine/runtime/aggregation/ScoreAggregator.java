/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.runtime.aggregation;

import com.precheck.engine.api.model.ComplianceStatus;
import com.precheck.engine.api.model.ScoreSummary;
import com.precheck.engine.api.model.SectionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Combines section results into the overall score, status and summary.
 *
 * <p>Thresholds are constants so that scores stay comparable between runs:
 * <ul>
 *   <li>{@code score >= 80}: COMPLIANT</li>
 *   <li>{@code 50 <= score < 80}: NEEDS_REVIEW</li>
 *   <li>{@code score < 50}: NON_COMPLIANT</li>
 * </ul>
 *
 * <p>The status is decided on the gating score, in which failing
 * informational rules count as passed.
 */
public final class ScoreAggregator {

    public static final int COMPLIANT_THRESHOLD = 80;
    public static final int NEEDS_REVIEW_THRESHOLD = 50;

    /** Sections earning less than this share of their weight are named in the summary. */
    public static final double SUMMARY_RATIO_THRESHOLD = 0.6;
    public static final int MAX_SUMMARY_SECTIONS = 3;

    static final String FULL_COMPLIANCE_SUMMARY = "All sections meet the compliance requirements.";

    public ScoreSummary aggregate(List<SectionResult> sections) {
        Objects.requireNonNull(sections, "sections must not be null");

        double total = 0.0;
        double gatingTotal = 0.0;
        for (SectionResult section : sections) {
            total += section.sectionScore();
            gatingTotal += section.gatingScore();
        }

        int overallScore = roundScore(total);
        ComplianceStatus status = statusFor(roundScore(gatingTotal));
        return new ScoreSummary(overallScore, status, summarize(sections));
    }

    public static ComplianceStatus statusFor(int score) {
        if (score >= COMPLIANT_THRESHOLD) {
            return ComplianceStatus.COMPLIANT;
        }
        if (score >= NEEDS_REVIEW_THRESHOLD) {
            return ComplianceStatus.NEEDS_REVIEW;
        }
        return ComplianceStatus.NON_COMPLIANT;
    }

    /**
     * One sentence naming up to three weakest sections below the ratio threshold,
     * lowest ratio first. Sections without weight are never named.
     */
    static String summarize(List<SectionResult> sections) {
        List<SectionResult> weak = new ArrayList<>();
        for (SectionResult section : sections) {
            if (section.sectionWeight() > 0 && section.ratio() < SUMMARY_RATIO_THRESHOLD) {
                weak.add(section);
            }
        }
        if (weak.isEmpty()) {
            return FULL_COMPLIANCE_SUMMARY;
        }

        // List.sort is stable, so equal ratios keep section order
        weak.sort(Comparator.comparingDouble(SectionResult::ratio));

        StringJoiner joiner = new StringJoiner(", ", "Needs attention: ", ".");
        for (SectionResult section : weak.subList(0, Math.min(MAX_SUMMARY_SECTIONS, weak.size()))) {
            joiner.add(section.sectionName() + " (" + Math.round(section.ratio() * 100) + "%)");
        }
        return joiner.toString();
    }

    private static int roundScore(double total) {
        return (int) Math.max(0, Math.min(100, Math.round(total)));
    }
}
