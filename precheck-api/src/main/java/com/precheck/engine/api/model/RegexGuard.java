/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Runs regex searches from untrusted checklists under a character-read budget.
 *
 * <p>The matcher reads its input through a {@link CharSequence} that counts
 * {@code charAt} calls. A search exceeding {@code BASE_BUDGET + PER_CHAR_BUDGET * length}
 * reads is abandoned and reported as no match. The budget counts reads rather
 * than time, so the outcome is the same on every run.
 */
final class RegexGuard {
    private static final Logger logger = LoggerFactory.getLogger(RegexGuard.class);

    static final long BASE_BUDGET = 1_000_000L;
    static final long PER_CHAR_BUDGET = 100L;

    private RegexGuard() {
    }

    enum Outcome { MATCH, NO_MATCH, ABANDONED }

    static boolean find(Pattern pattern, String text) {
        long budget = budgetFor(text.length());
        Outcome outcome = search(pattern, text, budget);
        if (outcome == Outcome.ABANDONED) {
            logger.warn("Regex /{}/ abandoned after {} character reads on a value of length {}",
                    pattern.pattern(), budget, text.length());
        }
        return outcome == Outcome.MATCH;
    }

    static Outcome search(Pattern pattern, String text, long budget) {
        try {
            return pattern.matcher(new BudgetedSequence(text, budget)).find() ? Outcome.MATCH : Outcome.NO_MATCH;
        } catch (BudgetExceededException e) {
            return Outcome.ABANDONED;
        }
    }

    static long budgetFor(int length) {
        return BASE_BUDGET + PER_CHAR_BUDGET * length;
    }

    private static final class BudgetExceededException extends RuntimeException {
        BudgetExceededException() {
            super(null, null, false, false);
        }
    }

    private static final class BudgetedSequence implements CharSequence {
        private final String text;
        private final long budget;
        private long reads;

        BudgetedSequence(String text, long budget) {
            this.text = text;
            this.budget = budget;
        }

        @Override
        public char charAt(int index) {
            if (++reads > budget) {
                throw new BudgetExceededException();
            }
            return text.charAt(index);
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return text.subSequence(start, end);
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
