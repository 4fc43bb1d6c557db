/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api;

import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.model.Checklist;
import com.precheck.engine.api.model.RawChecklist;
import com.precheck.engine.api.model.RawRule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Contract for assembling the active rule set of an evaluation run.
 */
public interface IChecklistCompiler {

    /**
     * Compiles custom rules, or returns the built-in checklist when {@code customRules} is null.
     *
     * @param customRules raw rules from the checklist parser, or null
     * @return compiled checklist
     * @throws InvalidChecklistException if the rules are empty, unsectioned or collide
     */
    Checklist compile(List<RawRule> customRules);

    /**
     * Compiles a named custom checklist.
     *
     * @throws InvalidChecklistException if the checklist is structurally invalid
     */
    Checklist compile(RawChecklist checklist);

    /**
     * Compiles a custom checklist from a JSON file holding either an array of
     * rules or an object {@code {"name": ..., "rules": [...]}}.
     *
     * @throws IOException if the file cannot be read
     * @throws InvalidChecklistException if the file is not a valid checklist
     */
    Checklist compile(Path checklistPath) throws IOException;

    /**
     * Returns the process-wide built-in checklist.
     */
    default Checklist compileBuiltIn() {
        return compile((List<RawRule>) null);
    }
}
