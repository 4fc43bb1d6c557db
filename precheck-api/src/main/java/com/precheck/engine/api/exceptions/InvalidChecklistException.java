package com.precheck.engine.api.exceptions;

/**
 * Thrown when a checklist is structurally invalid: empty, containing a rule
 * without a section, or containing colliding rule ids.
 *
 * The compiler never falls back to the built-in checklist when it throws.
 */
public class InvalidChecklistException extends RuntimeException {

    private final int ruleIndex;

    public InvalidChecklistException(String message) {
        this(message, -1);
    }

    public InvalidChecklistException(String message, int ruleIndex) {
        super(message);
        this.ruleIndex = ruleIndex;
    }

    public InvalidChecklistException(String message, Throwable cause) {
        super(message, cause);
        this.ruleIndex = -1;
    }

    /**
     * Zero-based index of the offending raw rule, or -1 when the problem is not tied to one rule.
     */
    public int getRuleIndex() {
        return ruleIndex;
    }
}
