/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.compiler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.json.JsonMappers;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.RawRule;
import com.precheck.engine.api.model.Rule;
import com.precheck.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The built-in merchant-site checklist.
 *
 * <p>The definition lives in {@code /checklists/builtin-checklist.json}, is
 * compiled once per process on first use and is shared read-only afterwards.
 * It is compiled strictly: a malformed built-in definition fails loudly
 * instead of being downgraded.
 */
public final class BuiltInChecklist {

    private static final Logger logger = LoggerFactory.getLogger(BuiltInChecklist.class);

    private static final Map<String, Checklist> ALTERNATES = new ConcurrentHashMap<>();

    private BuiltInChecklist() {
    }

    private static final class Holder {
        private static final Checklist STANDARD = load(EngineConfig.DEFAULT_BUILTIN_CHECKLIST);
    }

    /**
     * The standard checklist: 8 sections, weights summing to 100.
     */
    public static Checklist standard() {
        return Holder.STANDARD;
    }

    /**
     * The checklist at {@code resource}, compiled once and cached.
     * The default resource resolves to {@link #standard()}.
     */
    public static Checklist forResource(String resource) {
        if (EngineConfig.DEFAULT_BUILTIN_CHECKLIST.equals(resource)) {
            return standard();
        }
        return ALTERNATES.computeIfAbsent(resource, BuiltInChecklist::load);
    }

    /**
     * Extraction keys of the automated rules of the standard checklist, in rule order.
     * This is the vocabulary upstream extraction fills the fact store with.
     */
    public static Set<String> extractionKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Rule rule : standard().rules()) {
            if (!rule.isManual()) {
                keys.add(rule.extractionKey());
            }
        }
        return keys;
    }

    /**
     * Reads and strictly compiles a checklist definition from the classpath.
     *
     * @throws InvalidChecklistException if the resource is missing, unreadable or invalid
     */
    static Checklist load(String resource) {
        ObjectMapper mapper = JsonMappers.create();
        try (InputStream in = BuiltInChecklist.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new InvalidChecklistException("Built-in checklist resource not found: " + resource);
            }
            Definition definition = mapper.readValue(in, Definition.class);
            Checklist checklist = compile(definition);
            logger.info("Loaded built-in checklist '{}' v{}: {} rules in {} sections",
                    checklist.name(), checklist.version(), checklist.size(), checklist.sectionWeights().size());
            return checklist;
        } catch (IOException e) {
            throw new InvalidChecklistException("Failed to read built-in checklist " + resource, e);
        }
    }

    static Checklist compile(Definition definition) {
        if (definition.sections() == null || definition.sections().isEmpty()) {
            throw new InvalidChecklistException("Built-in checklist defines no sections");
        }
        List<RawRule> rules = new ArrayList<>();
        Map<String, Double> sectionWeights = new LinkedHashMap<>();
        for (SectionDefinition section : definition.sections()) {
            if (sectionWeights.containsKey(section.name())) {
                throw new InvalidChecklistException("Duplicate section: " + section.name());
            }
            sectionWeights.put(section.name(), section.weight());
            if (section.rules() != null) {
                for (RawRule rule : section.rules()) {
                    rules.add(rule.withSection(section.name()));
                }
            }
        }
        String name = definition.name() != null ? definition.name() : "Built-in checklist";
        String version = definition.version() != null ? definition.version() : "1";
        return new ChecklistAssembler(true).assemble(name, version, rules, sectionWeights);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Definition(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("sections") List<SectionDefinition> sections
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SectionDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("weight") Double weight,
            @JsonProperty("rules") List<RawRule> rules
    ) {
    }
}
