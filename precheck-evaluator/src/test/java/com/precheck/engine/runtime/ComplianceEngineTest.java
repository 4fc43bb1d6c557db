package com.precheck.engine.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.json.JsonMappers;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.ComplianceReport;
import com.precheck.engine.api.model.ComplianceStatus;
import com.precheck.engine.api.model.FactStore;
import com.precheck.engine.api.model.RawRule;
import com.precheck.engine.api.model.SectionResult;
import com.precheck.engine.api.model.Verdict;
import com.precheck.engine.api.model.VerdictStatus;
import com.precheck.engine.compiler.BuiltInChecklist;
import com.precheck.engine.compiler.ChecklistCompiler;
import com.precheck.engine.config.EngineConfig;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ComplianceEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    private InMemorySpanExporter spanExporter;
    private Tracer tracer;
    private ComplianceEngine engine;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        tracer = tracerProvider.get("test-tracer");
        engine = engineAt(EngineConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ComplianceEngine engineAt(EngineConfig config, Clock clock) {
        return new ComplianceEngine(new ChecklistCompiler(config, tracer), config, tracer, clock);
    }

    private static Map<String, Object> compliantFacts() throws IOException {
        try (InputStream in = ComplianceEngineTest.class.getResourceAsStream("/facts/compliant-site.json")) {
            assertThat(in).as("compliant-site.json on the test classpath").isNotNull();
            return JsonMappers.create().readValue(in, new TypeReference<Map<String, Object>>() {
            });
        }
    }

    @Nested
    class BuiltInChecklistScenarios {

        @Test
        @DisplayName("Should rate a site satisfying every automated rule as fully compliant")
        void shouldRateCompliantSite() throws IOException {
            ComplianceReport report = engine.evaluate(FactStore.of(compliantFacts()));

            assertThat(report.overallScore()).isEqualTo(100);
            assertThat(report.status()).isEqualTo(ComplianceStatus.COMPLIANT);
            assertThat(report.summary()).isEqualTo("All sections meet the compliance requirements.");
            assertThat(report.companyName()).isEqualTo("Demo Company Ltd");
            assertThat(report.criticalIssues()).isEmpty();
            assertThat(report.verdicts())
                    .filteredOn(verdict -> verdict.status() != VerdictStatus.PASS)
                    .extracting(Verdict::status)
                    .containsOnly(VerdictStatus.MANUAL_REVIEW);
        }

        @Test
        @DisplayName("Should rate an empty fact store as non-compliant and keep manual checks for review")
        void shouldRateEmptyFacts() {
            ComplianceReport report = engine.evaluate(FactStore.empty());

            assertThat(report.overallScore()).isEqualTo(21);
            assertThat(report.status()).isEqualTo(ComplianceStatus.NON_COMPLIANT);
            assertThat(report.companyName()).isEqualTo("Unknown");
            assertThat(report.summary())
                    .startsWith("Needs attention: Mobile Compliance (13%)")
                    .isEqualTo("Needs attention: Mobile Compliance (13%), Checkout (17%), Company Information (17%).");
            assertThat(report.verdicts()).hasSize(BuiltInChecklist.standard().size());
            assertThat(report.verdicts())
                    .filteredOn(verdict -> verdict.ruleId().startsWith("RCP-") || verdict.ruleId().startsWith("UPD-"))
                    .isNotEmpty()
                    .allSatisfy(verdict -> assertThat(verdict.status()).isEqualTo(VerdictStatus.MANUAL_REVIEW));
            assertThat(report.verdicts())
                    .allSatisfy(verdict -> assertThat(verdict.foundValue()).isEqualTo(FactStore.NOT_FOUND));
            assertThat(report.recommendations()).hasSize(report.verdicts().size());
        }

        @Test
        @DisplayName("Should warn about the refund period when it is missing or shorter than 14 days")
        void shouldWarnAboutMissingOrShortRefundPeriod() throws IOException {
            Map<String, Object> facts = compliantFacts();
            facts.remove("refund_period_days");
            assertThat(refundPeriodStatus(facts)).isEqualTo(VerdictStatus.WARNING);

            facts.put("refund_period_days", "7");
            assertThat(refundPeriodStatus(facts)).isEqualTo(VerdictStatus.WARNING);

            facts.put("refund_period_days", 13);
            assertThat(refundPeriodStatus(facts)).isEqualTo(VerdictStatus.WARNING);

            facts.put("refund_period_days", 14);
            assertThat(refundPeriodStatus(facts)).isEqualTo(VerdictStatus.PASS);

            facts.put("refund_period_days", "30 days");
            assertThat(refundPeriodStatus(facts)).isEqualTo(VerdictStatus.PASS);
        }

        private VerdictStatus refundPeriodStatus(Map<String, Object> facts) {
            return engine.evaluate(FactStore.of(facts)).verdicts().stream()
                    .filter(verdict -> verdict.ruleId().equals("POL-010"))
                    .map(Verdict::status)
                    .findFirst()
                    .orElseThrow();
        }

        @Test
        @DisplayName("Should keep sections in checklist order with scores within their weights")
        void shouldKeepSectionInvariants() throws IOException {
            Map<String, Object> facts = compliantFacts();
            facts.remove("vat_number");
            facts.put("site_url", "http://insecure.example.com");

            ComplianceReport report = engine.evaluate(FactStore.of(facts));

            Checklist checklist = BuiltInChecklist.standard();
            assertThat(report.sections()).extracting(SectionResult::sectionName)
                    .containsExactlyElementsOf(checklist.sections());
            assertThat(report.sections()).allSatisfy(section ->
                    assertThat(section.sectionScore()).isBetween(0.0, section.sectionWeight()));
            assertThat(report.sections().stream().mapToDouble(SectionResult::sectionWeight).sum())
                    .isCloseTo(100.0, within(1e-9));
            assertThat(report.criticalIssues()).extracting(Verdict::ruleId).containsExactly("MOB-003");
            assertThat(report.overallScore()).isLessThan(100);
        }

        @Test
        @DisplayName("Should never lower the score when a failing fact is fixed")
        void shouldBeMonotonicInFacts() throws IOException {
            Map<String, Object> facts = new HashMap<>(compliantFacts());
            facts.keySet().removeIf(key -> key.startsWith("has_"));
            int before = engine.evaluate(FactStore.of(facts)).overallScore();

            facts.put("has_privacy_policy", true);
            int after = engine.evaluate(FactStore.of(facts)).overallScore();

            assertThat(after).isGreaterThanOrEqualTo(before);
        }
    }

    @Nested
    class CustomChecklistScenarios {

        @Test
        @DisplayName("Should evaluate a single-rule custom checklist")
        void shouldEvaluateCustomChecklist() {
            RawRule rule = RawRule.of("SEC-01", "Security", "site_url", Map.of("kind", "matches", "value", "^https://"));

            ComplianceReport report = engine.evaluate(List.of(rule),
                    FactStore.of(Map.of("site_url", "https://example.com")));

            assertThat(report.verdicts()).singleElement().satisfies(verdict -> {
                assertThat(verdict.ruleId()).isEqualTo("SEC-01");
                assertThat(verdict.status()).isEqualTo(VerdictStatus.PASS);
            });
            assertThat(report.overallScore()).isEqualTo(100);
            assertThat(report.checklistName()).isEqualTo(ChecklistCompiler.CUSTOM_CHECKLIST_NAME);
        }

        @Test
        @DisplayName("Should evaluate a downgraded rule and surface the compiler note")
        void shouldEvaluateDowngradedRule() {
            RawRule rule = RawRule.of("AI-01", "Content", "site_summary", Map.of("kind", "fuzzy_llm_check"));

            ComplianceReport passing = engine.evaluate(List.of(rule),
                    FactStore.of(Map.of("site_summary", "We sell shoes.")));
            ComplianceReport failing = engine.evaluate(List.of(rule), FactStore.empty());

            assertThat(passing.verdicts().get(0).status()).isEqualTo(VerdictStatus.PASS);
            assertThat(failing.verdicts().get(0).status()).isEqualTo(VerdictStatus.FAIL);
            assertThat(passing.compilerNotes()).singleElement()
                    .satisfies(note -> assertThat(note).contains("fuzzy_llm_check"));
            assertThat(engine.getMetrics().getSnapshot()).containsEntry("downgradedRules", 2L);
        }

        @Test
        @DisplayName("Should use the built-in checklist for null custom rules")
        void shouldUseBuiltInForNullRules() {
            ComplianceReport report = engine.evaluate((List<RawRule>) null, FactStore.empty());

            assertThat(report.checklistName()).isEqualTo(BuiltInChecklist.standard().name());
            assertThat(report.overallScore()).isEqualTo(21);
        }

        @Test
        @DisplayName("Should reject an empty custom rule list and count the rejection")
        void shouldRejectEmptyRules() {
            assertThatThrownBy(() -> engine.evaluate(List.of(), FactStore.empty()))
                    .isInstanceOf(InvalidChecklistException.class);

            assertThat(engine.getMetrics().getRejectedChecklists()).isEqualTo(1);
            assertThat(engine.getMetrics().getTotalEvaluations()).isZero();
        }

        @Test
        @DisplayName("Should reject custom rules sharing an id")
        void shouldRejectDuplicateIds() {
            List<RawRule> rules = List.of(
                    RawRule.of("R1", "A", "a", "not_empty"),
                    RawRule.of("R1", "B", "b", "not_empty"));

            assertThatThrownBy(() -> engine.evaluate(rules, FactStore.empty()))
                    .isInstanceOf(InvalidChecklistException.class)
                    .hasMessageContaining("Duplicate rule_id: R1");
        }
    }

    @Nested
    class Determinism {

        @Test
        @DisplayName("Should produce identical reports for identical inputs")
        void shouldBeIdempotent() throws IOException {
            FactStore facts = FactStore.of(compliantFacts());

            ComplianceReport first = engine.evaluate(facts);
            ComplianceReport second = engine.evaluate(facts);

            assertThat(second).isEqualTo(first);
            assertThat(first.reportId()).startsWith("rpt_").hasSize(16);
            assertThat(first.generatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should differ only in the timestamp across clocks")
        void shouldDifferOnlyInTimestamp() {
            ComplianceEngine later = engineAt(EngineConfig.defaults(),
                    Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));

            ComplianceReport first = engine.evaluate(FactStore.empty());
            ComplianceReport second = later.evaluate(FactStore.empty());

            assertThat(second).isNotEqualTo(first);
            assertThat(second.sameContentAs(first)).isTrue();
        }

        @Test
        @DisplayName("Should change the report id when the facts change")
        void shouldChangeIdWithFacts() {
            ComplianceReport empty = engine.evaluate(FactStore.empty());
            ComplianceReport named = engine.evaluate(FactStore.of(Map.of("company_name", "Acme")));

            assertThat(named.reportId()).isNotEqualTo(empty.reportId());
        }

        @Test
        @DisplayName("Should issue random report ids when configured")
        void shouldIssueRandomIds() {
            ComplianceEngine randomIds = engineAt(
                    EngineConfig.builder().reportIdStrategy(EngineConfig.ReportIdStrategy.RANDOM).build(),
                    Clock.fixed(NOW, ZoneOffset.UTC));

            ComplianceReport first = randomIds.evaluate(FactStore.empty());
            ComplianceReport second = randomIds.evaluate(FactStore.empty());

            assertThat(first.reportId()).startsWith("rpt_").hasSize(16);
            assertThat(second.reportId()).isNotEqualTo(first.reportId());
            assertThat(second.overallScore()).isEqualTo(first.overallScore());
        }

        @Test
        @DisplayName("Should produce the same reports from concurrent evaluations")
        void shouldEvaluateConcurrently() throws Exception {
            FactStore compliant = FactStore.of(compliantFacts());
            ComplianceReport expectedCompliant = engine.evaluate(compliant);
            ComplianceReport expectedEmpty = engine.evaluate(FactStore.empty());

            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<ComplianceReport>> tasks = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    FactStore facts = i % 2 == 0 ? compliant : FactStore.empty();
                    tasks.add(() -> engine.evaluate(facts));
                }
                List<Future<ComplianceReport>> futures = executor.invokeAll(tasks);
                for (int i = 0; i < futures.size(); i++) {
                    ComplianceReport expected = i % 2 == 0 ? expectedCompliant : expectedEmpty;
                    assertThat(futures.get(i).get()).isEqualTo(expected);
                }
            } finally {
                executor.shutdown();
                assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            }

            assertThat(engine.getMetrics().getTotalEvaluations()).isEqualTo(66);
        }

        @Test
        @DisplayName("Should evaluate batches in input order")
        void shouldEvaluateBatchInOrder() throws IOException {
            List<ComplianceReport> reports = engine.evaluateBatch(BuiltInChecklist.standard(),
                    List.of(FactStore.empty(), FactStore.of(compliantFacts())));

            assertThat(reports).extracting(ComplianceReport::overallScore).containsExactly(21, 100);
        }
    }

    @Nested
    class Observability {

        @Test
        @DisplayName("Should record an evaluation span with the outcome")
        void shouldRecordEvaluationSpan() {
            ComplianceReport report = engine.evaluate(FactStore.empty());

            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).filteredOn(span -> span.getName().equals("evaluate-compliance"))
                    .singleElement()
                    .satisfies(span -> {
                        assertThat(span.getAttributes().get(AttributeKey.stringKey("reportId")))
                                .isEqualTo(report.reportId());
                        assertThat(span.getAttributes().get(AttributeKey.longKey("overallScore"))).isEqualTo(21L);
                        assertThat(span.getAttributes().get(AttributeKey.stringKey("status")))
                                .isEqualTo("NON_COMPLIANT");
                        assertThat(span.getAttributes().get(AttributeKey.longKey("ruleCount")))
                                .isEqualTo((long) BuiltInChecklist.standard().size());
                    });
        }

        @Test
        @DisplayName("Should count verdicts and reports by status")
        void shouldCountOutcomes() {
            engine.evaluate(FactStore.empty());
            engine.evaluate(FactStore.empty());

            EngineMetrics metrics = engine.getMetrics();
            assertThat(metrics.getTotalEvaluations()).isEqualTo(2);
            assertThat(metrics.getReportCount(ComplianceStatus.NON_COMPLIANT)).isEqualTo(2);
            assertThat(metrics.getVerdictCount(VerdictStatus.PASS)).isZero();
            assertThat(metrics.getVerdictCount(VerdictStatus.MANUAL_REVIEW)).isEqualTo(8);
            assertThat(metrics.getSnapshot())
                    .containsEntry("totalEvaluations", 2L)
                    .containsEntry("reports.non_compliant", 2L)
                    .containsKey("avgEvaluationTimeNanos");
        }
    }
}
