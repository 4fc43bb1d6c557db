/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The closed set of conditions a rule can apply to an extracted value.
 *
 * <p>Every variant is total: {@link #test(String)} receives the textual form of a
 * present fact (never {@code null}, never the "Not found" sentinel) and answers
 * without throwing. Absent facts are rejected by the evaluator before any
 * condition runs.
 *
 * <p>{@link Manual} is the one variant that never decides: the evaluator turns it
 * into a manual-review verdict regardless of the fact.
 */
public sealed interface PassCondition {

    /**
     * Wire names of the condition kinds, as they appear in checklist JSON.
     */
    enum Kind {
        NOT_EMPTY("not_empty"),
        EQUALS("equals"),
        MATCHES("matches"),
        ONE_OF("one_of"),
        MIN_LENGTH("min_length"),
        BOOLEAN_TRUE("boolean_true"),
        MANUAL("manual");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /**
         * Resolves a kind name, including the aliases upstream checklist parsers emit.
         *
         * @param text the kind name
         * @return the kind, or null if not recognized
         */
        public static Kind fromString(String text) {
            if (text == null) return null;
            return switch (text.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_')) {
                case "not_empty", "notempty", "present", "exists" -> NOT_EMPTY;
                case "equals", "equal", "equal_to", "equals_to", "eq" -> EQUALS;
                case "matches", "match", "regex", "pattern" -> MATCHES;
                case "one_of", "oneof", "in", "any_of" -> ONE_OF;
                case "min_length", "minlength", "min_len" -> MIN_LENGTH;
                case "boolean_true", "true", "boolean", "is_true" -> BOOLEAN_TRUE;
                case "manual", "manual_review" -> MANUAL;
                default -> null;
            };
        }
    }

    /**
     * Tokens accepted as {@code true} by {@link BooleanTrue}.
     */
    Set<String> TRUTHY_TOKENS = Set.of("true", "yes", "1", "present");

    Kind kind();

    /**
     * Applies the condition to a present fact.
     *
     * @param text textual form of the fact
     * @return true if the condition holds
     */
    boolean test(String text);

    /**
     * Human-readable form, used in compiler notes and logs.
     */
    String describe();

    default boolean requiresManualReview() {
        return false;
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    record NotEmpty() implements PassCondition {
        @Override
        public Kind kind() {
            return Kind.NOT_EMPTY;
        }

        @Override
        public boolean test(String text) {
            return !FactStore.isAbsent(text);
        }

        @Override
        public String describe() {
            return "not_empty";
        }
    }

    /**
     * Case-insensitive, trimmed equality. The expected value is stored normalized.
     */
    record EqualsValue(String expected) implements PassCondition {
        public EqualsValue {
            Objects.requireNonNull(expected, "expected must not be null");
            expected = normalize(expected);
        }

        @Override
        public Kind kind() {
            return Kind.EQUALS;
        }

        @Override
        public boolean test(String text) {
            return normalize(text).equals(expected);
        }

        @Override
        public String describe() {
            return "equals '" + expected + "'";
        }
    }

    /**
     * Regex search anywhere in the text (not a full match).
     * Equality is on the pattern source, {@link Pattern} itself has none.
     * A search that backtracks past its read budget counts as no match.
     */
    record Matches(String regex, Pattern pattern) implements PassCondition {
        public Matches {
            Objects.requireNonNull(regex, "regex must not be null");
            if (pattern == null || !pattern.pattern().equals(regex)) {
                pattern = Pattern.compile(regex);
            }
        }

        /**
         * @throws java.util.regex.PatternSyntaxException if the regex is invalid
         */
        public Matches(String regex) {
            this(regex, null);
        }

        @Override
        public Kind kind() {
            return Kind.MATCHES;
        }

        @Override
        public boolean test(String text) {
            return RegexGuard.find(pattern, text);
        }

        @Override
        public String describe() {
            return "matches /" + regex + "/";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Matches other && regex.equals(other.regex);
        }

        @Override
        public int hashCode() {
            return regex.hashCode();
        }

        @Override
        public String toString() {
            return "Matches[regex=" + regex + "]";
        }
    }

    /**
     * Normalized membership. Allowed values are stored normalized, in declaration order.
     */
    record OneOf(Set<String> allowed) implements PassCondition {
        public OneOf {
            Objects.requireNonNull(allowed, "allowed must not be null");
            Set<String> normalized = new LinkedHashSet<>();
            for (String value : allowed) {
                if (value != null) {
                    normalized.add(normalize(value));
                }
            }
            allowed = Collections.unmodifiableSet(normalized);
        }

        public static OneOf of(Collection<String> values) {
            return new OneOf(new LinkedHashSet<>(values));
        }

        @Override
        public Kind kind() {
            return Kind.ONE_OF;
        }

        @Override
        public boolean test(String text) {
            return allowed.contains(normalize(text));
        }

        @Override
        public String describe() {
            return "one_of " + allowed;
        }
    }

    /**
     * Trimmed textual length of at least {@code minLength}.
     */
    record MinLength(int minLength) implements PassCondition {
        public MinLength {
            if (minLength < 0) {
                throw new IllegalArgumentException("minLength must be >= 0, got " + minLength);
            }
        }

        @Override
        public Kind kind() {
            return Kind.MIN_LENGTH;
        }

        @Override
        public boolean test(String text) {
            return text.trim().length() >= minLength;
        }

        @Override
        public String describe() {
            return "min_length " + minLength;
        }
    }

    record BooleanTrue() implements PassCondition {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN_TRUE;
        }

        @Override
        public boolean test(String text) {
            return TRUTHY_TOKENS.contains(normalize(text));
        }

        @Override
        public String describe() {
            return "boolean_true";
        }
    }

    /**
     * Checks the business has decided cannot be automated.
     */
    record Manual() implements PassCondition {
        @Override
        public Kind kind() {
            return Kind.MANUAL;
        }

        @Override
        public boolean test(String text) {
            return false;
        }

        @Override
        public boolean requiresManualReview() {
            return true;
        }

        @Override
        public String describe() {
            return "manual";
        }
    }
}
