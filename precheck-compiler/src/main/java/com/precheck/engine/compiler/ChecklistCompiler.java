/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.precheck.engine.api.IChecklistCompiler;
import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.json.JsonMappers;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.RawChecklist;
import com.precheck.engine.api.model.RawRule;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Assembles the active checklist of an evaluation run.
 *
 * <p>Without custom rules the process-wide built-in checklist is returned as is.
 * Custom rules go through a validation pass that defaults missing fields,
 * generates {@code GEN-<n>} ids, parses pass conditions and gives every section
 * an equal share of the 100 points.
 *
 * <pre>{@code
 * ChecklistCompiler compiler = new ChecklistCompiler(tracer);
 * Checklist builtIn = compiler.compile((List<RawRule>) null);
 * Checklist custom  = compiler.compile(Path.of("uploaded-checklist.json"));
 * }</pre>
 */
public class ChecklistCompiler implements IChecklistCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ChecklistCompiler.class);

    public static final String CUSTOM_CHECKLIST_NAME = "Custom checklist";
    public static final String CUSTOM_CHECKLIST_VERSION = "custom";

    private final ObjectMapper objectMapper = JsonMappers.create();
    private final EngineConfig config;
    private final Tracer tracer;
    private final ChecklistAssembler assembler;

    public ChecklistCompiler(EngineConfig config, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.assembler = new ChecklistAssembler(config.strictConditions());
    }

    public ChecklistCompiler(Tracer tracer) {
        this(EngineConfig.loadDefault(), tracer);
    }

    public ChecklistCompiler() {
        this(OpenTelemetry.noop().getTracer("precheck-compiler"));
    }

    @Override
    public Checklist compile(List<RawRule> customRules) {
        if (customRules == null) {
            return builtInChecklist();
        }
        return compileCustom(CUSTOM_CHECKLIST_NAME, customRules);
    }

    @Override
    public Checklist compile(RawChecklist checklist) {
        Objects.requireNonNull(checklist, "checklist must not be null");
        String name = checklist.name() == null || checklist.name().isBlank()
                ? CUSTOM_CHECKLIST_NAME
                : checklist.name().trim();
        return compileCustom(name, checklist.rules());
    }

    @Override
    public Checklist compile(Path checklistPath) throws IOException {
        Span span = tracer.spanBuilder("load-checklist").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("checklistPath", checklistPath.toString());
            return compileJson(Files.readString(checklistPath));
        } catch (IOException | InvalidChecklistException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Compiles a custom checklist from JSON text: either an array of rules or
     * an object {@code {"name": ..., "rules": [...]}}.
     *
     * @throws InvalidChecklistException if the text is not a valid checklist document
     */
    public Checklist compileJson(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root != null && root.isArray()) {
                List<RawRule> rules = objectMapper.convertValue(root,
                        objectMapper.getTypeFactory().constructCollectionType(List.class, RawRule.class));
                return compile(rules);
            }
            if (root != null && root.isObject() && root.has("rules")) {
                return compile(objectMapper.treeToValue(root, RawChecklist.class));
            }
            throw new InvalidChecklistException("Checklist JSON must be an array of rules or an object with 'rules'");
        } catch (JsonProcessingException e) {
            throw new InvalidChecklistException("Checklist JSON is malformed: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            // convertValue wraps mapping problems
            throw new InvalidChecklistException("Checklist JSON has an invalid rule: " + e.getMessage(), e);
        }
    }

    /**
     * The configured built-in checklist, shared by every caller.
     */
    public Checklist builtInChecklist() {
        return BuiltInChecklist.forResource(config.builtInChecklistResource());
    }

    private Checklist compileCustom(String name, List<RawRule> rules) {
        Span span = tracer.spanBuilder("compile-checklist").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("checklistName", name);
            span.setAttribute("rawRuleCount", rules == null ? 0 : rules.size());
            span.setAttribute("strictConditions", config.strictConditions());

            Checklist checklist = assembler.assemble(name, CUSTOM_CHECKLIST_VERSION, rules, null);

            long downgraded = checklist.rules().stream().filter(Rule::isDowngraded).count();
            span.setAttribute("ruleCount", checklist.size());
            span.setAttribute("sectionCount", checklist.sectionWeights().size());
            span.setAttribute("downgradedCount", downgraded);

            logger.info("Compiled custom checklist '{}': {} rules in {} sections, {} downgraded",
                    name, checklist.size(), checklist.sectionWeights().size(), downgraded);
            return checklist;
        } catch (InvalidChecklistException e) {
            span.recordException(e);
            logger.warn("Rejected custom checklist '{}': {}", name, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
