/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.runtime;

import com.precheck.engine.api.IChecklistCompiler;
import com.precheck.engine.api.IComplianceEvaluator;
import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.ComplianceReport;
import com.precheck.engine.api.model.FactStore;
import com.precheck.engine.api.model.RawRule;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.api.model.ScoreSummary;
import com.precheck.engine.api.model.SectionResult;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.compiler.ChecklistCompiler;
import com.precheck.engine.config.EngineConfig;
import com.precheck.engine.runtime.aggregation.ScoreAggregator;
import com.precheck.engine.runtime.aggregation.SectionAggregator;
import com.precheck.engine.runtime.evaluation.RuleEvaluator;
import com.precheck.engine.runtime.report.ReportIdGenerator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the full pipeline for one site:
 * checklist, then one verdict per rule, then section scores, then overall score and report.
 *
 * <h2>Determinism</h2>
 * <p>Apart from {@code generatedAt} (taken from the injected {@link Clock}) and a
 * random report id when {@link EngineConfig.ReportIdStrategy#RANDOM} is configured,
 * the report is a pure function of the checklist and the fact store.
 *
 * <h2>Thread Safety</h2>
 * <p>All collaborators are stateless or immutable apart from {@link EngineMetrics},
 * whose counters never feed back into results. One instance serves all threads.
 */
public final class ComplianceEngine implements IComplianceEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ComplianceEngine.class);

    static final String COMPANY_NAME_KEY = "company_name";
    static final String UNKNOWN_COMPANY = "Unknown";

    private final IChecklistCompiler compiler;
    private final Tracer tracer;
    private final Clock clock;
    private final RuleEvaluator ruleEvaluator = new RuleEvaluator();
    private final SectionAggregator sectionAggregator = new SectionAggregator();
    private final ScoreAggregator scoreAggregator = new ScoreAggregator();
    private final ReportIdGenerator reportIdGenerator;
    private final EngineMetrics metrics = new EngineMetrics();

    /**
     * Creates an engine with full configuration.
     *
     * @param compiler checklist compiler used for built-in and custom rule sets
     * @param config   engine configuration
     * @param tracer   OpenTelemetry tracer
     * @param clock    source of {@code generatedAt}
     */
    public ComplianceEngine(IChecklistCompiler compiler, EngineConfig config, Tracer tracer, Clock clock) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reportIdGenerator = new ReportIdGenerator(
                Objects.requireNonNull(config, "config must not be null").reportIdStrategy());
    }

    public ComplianceEngine(EngineConfig config, Tracer tracer) {
        this(new ChecklistCompiler(config, tracer), config, tracer, Clock.systemUTC());
    }

    public ComplianceEngine() {
        this(EngineConfig.loadDefault(), OpenTelemetry.noop().getTracer("precheck-evaluator"));
    }

    @Override
    public ComplianceReport evaluate(FactStore facts) {
        return evaluate(compiler.compileBuiltIn(), facts);
    }

    @Override
    public ComplianceReport evaluate(List<RawRule> customRules, FactStore facts) {
        Checklist checklist;
        try {
            checklist = compiler.compile(customRules);
        } catch (InvalidChecklistException e) {
            metrics.recordRejectedChecklist();
            throw e;
        }
        return evaluate(checklist, facts);
    }

    @Override
    public ComplianceReport evaluate(Checklist checklist, FactStore facts) {
        Objects.requireNonNull(checklist, "checklist must not be null");
        Objects.requireNonNull(facts, "facts must not be null");

        Span span = tracer.spanBuilder("evaluate-compliance").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("checklistName", checklist.name());
            span.setAttribute("ruleCount", checklist.size());
            span.setAttribute("factCount", facts.size());

            List<Verdict> verdicts = new ArrayList<>(checklist.size());
            int downgraded = 0;
            for (Rule rule : checklist.rules()) {
                verdicts.add(ruleEvaluator.evaluate(rule, facts));
                if (rule.isDowngraded()) {
                    downgraded++;
                }
            }

            List<SectionResult> sections = sectionAggregator.aggregateAll(checklist, verdicts);
            ScoreSummary score = scoreAggregator.aggregate(sections);
            String companyName = facts.text(COMPANY_NAME_KEY).orElse(UNKNOWN_COMPANY);
            String reportId = reportIdGenerator.generate(checklist, companyName, sections, score);

            ComplianceReport report = new ComplianceReport(
                    reportId,
                    companyName,
                    checklist.name(),
                    checklist.version(),
                    score.overallScore(),
                    score.status(),
                    sections,
                    score.summary(),
                    checklist.warnings(),
                    clock.instant());

            long evaluationTime = System.nanoTime() - startTime;
            metrics.recordEvaluation(evaluationTime, verdicts, score.status(), downgraded);

            span.setAttribute("reportId", reportId);
            span.setAttribute("overallScore", score.overallScore());
            span.setAttribute("status", score.status().name());
            logger.debug("Report {} for '{}': {} {} ({} rules, {} us)", reportId, companyName,
                    score.overallScore(), score.status(), verdicts.size(), evaluationTime / 1_000);
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }
}
