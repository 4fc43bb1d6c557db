/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine configuration.
 *
 * <p>Scoring thresholds and partial credit are deliberately <b>not</b> part of
 * this class: they are fixed constants so scores stay comparable across runs.
 * What can be configured is how untrusted checklists are treated and how
 * reports are identified.
 *
 * <p><b>Resolution order</b> (later wins):
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code precheck.properties} on the classpath</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <p>Environment variables:
 * <pre>
 * PRECHECK_STRICT_CONDITIONS=true
 * PRECHECK_REPORT_ID_STRATEGY=RANDOM
 * PRECHECK_BUILTIN_CHECKLIST=/checklists/builtin-checklist.json
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig strict = EngineConfig.builder()
 *     .strictConditions(true)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_BUILTIN_CHECKLIST = "/checklists/builtin-checklist.json";
    public static final String DEFAULT_PROPERTIES = "precheck.properties";

    static final String ENV_STRICT_CONDITIONS = "PRECHECK_STRICT_CONDITIONS";
    static final String ENV_REPORT_ID_STRATEGY = "PRECHECK_REPORT_ID_STRATEGY";
    static final String ENV_BUILTIN_CHECKLIST = "PRECHECK_BUILTIN_CHECKLIST";

    static final String PROP_STRICT_CONDITIONS = "precheck.strict.conditions";
    static final String PROP_REPORT_ID_STRATEGY = "precheck.report.id.strategy";
    static final String PROP_BUILTIN_CHECKLIST = "precheck.builtin.checklist";

    /**
     * How report ids are produced.
     */
    public enum ReportIdStrategy {
        /** Derived from the report content; identical inputs give identical ids. */
        CONTENT_HASH,

        /** Random token per run. */
        RANDOM
    }

    private final boolean strictConditions;
    private final ReportIdStrategy reportIdStrategy;
    private final String builtInChecklistResource;

    private EngineConfig(Builder builder) {
        this.strictConditions = builder.strictConditions;
        this.reportIdStrategy = Objects.requireNonNull(builder.reportIdStrategy, "reportIdStrategy must not be null");
        this.builtInChecklistResource = Objects.requireNonNull(builder.builtInChecklistResource,
                "builtInChecklistResource must not be null");
        if (builtInChecklistResource.isBlank()) {
            throw new IllegalArgumentException("builtInChecklistResource must not be blank");
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults only; ignores properties files and the environment.
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} from the classpath (if present) and
     * applies environment overrides.
     */
    public static EngineConfig loadDefault() {
        return load(DEFAULT_PROPERTIES, System.getenv());
    }

    /**
     * Applies only the given environment map over the defaults.
     */
    public static EngineConfig fromEnvironment(Map<String, String> environment) {
        return builder().applyEnvironment(environment).build();
    }

    static EngineConfig load(String propertiesResource, Map<String, String> environment) {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesResource)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} engine properties from classpath: {}", props.size(), propertiesResource);
            }
        } catch (IOException e) {
            logger.warn("Could not read {} from classpath, using defaults: {}", propertiesResource, e.getMessage());
        }
        return builder()
                .applyProperties(props)
                .applyEnvironment(environment)
                .build();
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /**
     * When true, unknown or malformed pass conditions reject the checklist
     * instead of being downgraded to {@code not_empty}.
     */
    public boolean strictConditions() {
        return strictConditions;
    }

    public ReportIdStrategy reportIdStrategy() {
        return reportIdStrategy;
    }

    /**
     * Classpath location of the built-in checklist definition.
     */
    public String builtInChecklistResource() {
        return builtInChecklistResource;
    }

    public boolean usesDefaultBuiltInChecklist() {
        return DEFAULT_BUILTIN_CHECKLIST.equals(builtInChecklistResource);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .strictConditions(strictConditions)
                .reportIdStrategy(reportIdStrategy)
                .builtInChecklistResource(builtInChecklistResource);
    }

    public static final class Builder {
        private boolean strictConditions = false;
        private ReportIdStrategy reportIdStrategy = ReportIdStrategy.CONTENT_HASH;
        private String builtInChecklistResource = DEFAULT_BUILTIN_CHECKLIST;

        private Builder() {
        }

        public Builder strictConditions(boolean strictConditions) {
            this.strictConditions = strictConditions;
            return this;
        }

        public Builder reportIdStrategy(ReportIdStrategy reportIdStrategy) {
            this.reportIdStrategy = reportIdStrategy;
            return this;
        }

        public Builder builtInChecklistResource(String builtInChecklistResource) {
            this.builtInChecklistResource = builtInChecklistResource;
            return this;
        }

        Builder applyProperties(Properties props) {
            apply(props.getProperty(PROP_STRICT_CONDITIONS), props.getProperty(PROP_REPORT_ID_STRATEGY),
                    props.getProperty(PROP_BUILTIN_CHECKLIST), "properties");
            return this;
        }

        Builder applyEnvironment(Map<String, String> environment) {
            if (environment != null) {
                apply(environment.get(ENV_STRICT_CONDITIONS), environment.get(ENV_REPORT_ID_STRATEGY),
                        environment.get(ENV_BUILTIN_CHECKLIST), "environment");
            }
            return this;
        }

        private void apply(String strict, String idStrategy, String checklist, String source) {
            if (strict != null && !strict.isBlank()) {
                this.strictConditions = Boolean.parseBoolean(strict.trim());
            }
            if (idStrategy != null && !idStrategy.isBlank()) {
                try {
                    this.reportIdStrategy = ReportIdStrategy.valueOf(idStrategy.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warn("Invalid report id strategy '{}' in {}, keeping {}", idStrategy, source, reportIdStrategy);
                }
            }
            if (checklist != null && !checklist.isBlank()) {
                this.builtInChecklistResource = checklist.trim();
            }
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{strictConditions=" + strictConditions
                + ", reportIdStrategy=" + reportIdStrategy
                + ", builtInChecklistResource=" + builtInChecklistResource + "}";
    }
}
