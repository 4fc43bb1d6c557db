package com.precheck.engine.runtime;

import com.precheck.engine.api.model.ComplianceStatus;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.api.model.VerdictStatus;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for the compliance engine.
 *
 * Counters are observational only: nothing in the evaluation path reads them.
 */
public final class EngineMetrics {

    private final LongAdder totalEvaluations = new LongAdder();
    private final LongAdder totalEvaluationTimeNanos = new LongAdder();
    private final LongAdder totalVerdicts = new LongAdder();
    private final LongAdder rejectedChecklists = new LongAdder();
    private final LongAdder downgradedRules = new LongAdder();
    private final Map<VerdictStatus, LongAdder> verdictsByStatus = new EnumMap<>(VerdictStatus.class);
    private final Map<ComplianceStatus, LongAdder> reportsByStatus = new EnumMap<>(ComplianceStatus.class);

    public EngineMetrics() {
        for (VerdictStatus status : VerdictStatus.values()) {
            verdictsByStatus.put(status, new LongAdder());
        }
        for (ComplianceStatus status : ComplianceStatus.values()) {
            reportsByStatus.put(status, new LongAdder());
        }
    }

    /**
     * Record a finished evaluation. Thread-safe, lock-free.
     */
    public void recordEvaluation(long evaluationTimeNanos, List<Verdict> verdicts, ComplianceStatus status,
                                 int downgraded) {
        totalEvaluations.increment();
        totalEvaluationTimeNanos.add(evaluationTimeNanos);
        totalVerdicts.add(verdicts.size());
        downgradedRules.add(downgraded);
        for (Verdict verdict : verdicts) {
            verdictsByStatus.get(verdict.status()).increment();
        }
        reportsByStatus.get(status).increment();
    }

    public void recordRejectedChecklist() {
        rejectedChecklists.increment();
    }

    public long getTotalEvaluations() {
        return totalEvaluations.sum();
    }

    public long getVerdictCount(VerdictStatus status) {
        return verdictsByStatus.get(status).sum();
    }

    public long getReportCount(ComplianceStatus status) {
        return reportsByStatus.get(status).sum();
    }

    public long getRejectedChecklists() {
        return rejectedChecklists.sum();
    }

    /**
     * Point-in-time copy of all counters.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long evals = totalEvaluations.sum();
        long totalTime = totalEvaluationTimeNanos.sum();

        snapshot.put("totalEvaluations", evals);
        snapshot.put("avgEvaluationTimeNanos", evals > 0 ? totalTime / evals : 0);
        snapshot.put("totalVerdicts", totalVerdicts.sum());
        verdictsByStatus.forEach((status, count) ->
                snapshot.put("verdicts." + status.name().toLowerCase(Locale.ROOT), count.sum()));
        reportsByStatus.forEach((status, count) ->
                snapshot.put("reports." + status.name().toLowerCase(Locale.ROOT), count.sum()));
        snapshot.put("downgradedRules", downgradedRules.sum());
        snapshot.put("rejectedChecklists", rejectedChecklists.sum());

        return snapshot;
    }
}
