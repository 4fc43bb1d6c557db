/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.runtime.report;

import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.ScoreSummary;
import com.precheck.engine.api.model.SectionResult;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.config.EngineConfig.ReportIdStrategy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Produces {@code rpt_} + 12 hex character report ids.
 *
 * <p>With {@link ReportIdStrategy#CONTENT_HASH} the id is the prefix of a
 * SHA-256 over everything the report carries except its id and timestamp,
 * so re-evaluating the same inputs gives the same id and reports that differ
 * in any field get different ids.
 */
public final class ReportIdGenerator {

    public static final String PREFIX = "rpt_";
    static final int ID_HEX_LENGTH = 12;

    private static final char FIELD_SEPARATOR = '\u001f';
    private static final char RECORD_SEPARATOR = '\u001e';

    private final ReportIdStrategy strategy;

    public ReportIdGenerator(ReportIdStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
    }

    public String generate(Checklist checklist, String companyName, List<SectionResult> sections, ScoreSummary score) {
        if (strategy == ReportIdStrategy.RANDOM) {
            return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, ID_HEX_LENGTH);
        }
        return PREFIX + contentHash(checklist, companyName, sections, score).substring(0, ID_HEX_LENGTH);
    }

    static String contentHash(Checklist checklist, String companyName, List<SectionResult> sections, ScoreSummary score) {
        StringBuilder content = new StringBuilder(256);
        content.append(checklist.name()).append(FIELD_SEPARATOR)
                .append(checklist.version()).append(FIELD_SEPARATOR)
                .append(companyName).append(RECORD_SEPARATOR);
        for (String warning : checklist.warnings()) {
            content.append(warning).append(FIELD_SEPARATOR);
        }
        content.append(RECORD_SEPARATOR);
        for (SectionResult section : sections) {
            content.append(section.sectionName()).append(FIELD_SEPARATOR)
                    .append(section.sectionScore()).append(RECORD_SEPARATOR);
            for (Verdict verdict : section.items()) {
                content.append(verdict.ruleId()).append(FIELD_SEPARATOR)
                        .append(verdict.status()).append(FIELD_SEPARATOR)
                        .append(verdict.foundValue()).append(FIELD_SEPARATOR)
                        .append(verdict.recommendation()).append(RECORD_SEPARATOR);
            }
        }
        content.append(score.overallScore()).append(FIELD_SEPARATOR)
                .append(score.status()).append(FIELD_SEPARATOR)
                .append(score.summary());

        return HexFormat.of().formatHex(sha256().digest(content.toString().getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
