/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.api.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Immutable bag of facts extracted from a merchant site.
 *
 * <p>Keys are the extraction keys referenced by {@link Rule#extractionKey()}.
 * Values are whatever the extraction layer produced: strings, booleans,
 * numbers, lists, nested maps, {@code null} or the literal {@value #NOT_FOUND}.
 *
 * <p>Lookups never fail. A key that is missing, mapped to {@code null}, blank,
 * or mapped to the sentinel (any casing) is <i>absent</i>.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FactStore facts = FactStore.of(Map.of(
 *     "company_name", "Demo Company Ltd",
 *     "has_privacy_policy", true,
 *     "payment_methods_mentioned", List.of("Visa", "Mastercard")
 * ));
 *
 * facts.text("payment_methods_mentioned"); // Optional["Visa, Mastercard"]
 * }</pre>
 */
public final class FactStore {

    /**
     * Sentinel the extraction layer writes when a field could not be found.
     */
    public static final String NOT_FOUND = "Not found";

    private static final FactStore EMPTY = new FactStore(Map.of());

    private final Map<String, Object> facts;

    private FactStore(Map<String, ?> facts) {
        // LinkedHashMap tolerates null values, Map.copyOf does not
        this.facts = Collections.unmodifiableMap(new LinkedHashMap<>(facts));
    }

    public static FactStore of(Map<String, ?> facts) {
        Objects.requireNonNull(facts, "facts must not be null");
        return facts.isEmpty() ? EMPTY : new FactStore(facts);
    }

    public static FactStore empty() {
        return EMPTY;
    }

    /**
     * Resolves a key. An exact top-level match wins; otherwise a dotted key
     * ({@code "company.vat_number"}) is walked through nested maps.
     *
     * @param key extraction key
     * @return the raw value, empty when missing or mapped to {@code null}
     */
    public Optional<Object> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }
        if (facts.containsKey(key)) {
            return Optional.ofNullable(facts.get(key));
        }
        if (key.indexOf('.') < 0) {
            return Optional.empty();
        }

        Object current = facts;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Returns the textual form of a fact, empty when the fact is absent.
     */
    public Optional<String> text(String key) {
        String text = toText(lookup(key).orElse(null));
        return isAbsent(text) ? Optional.empty() : Optional.of(text);
    }

    public boolean contains(String key) {
        return lookup(key).isPresent();
    }

    public int size() {
        return facts.size();
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }

    public Map<String, Object> asMap() {
        return facts;
    }

    /**
     * Coerces any fact value to text.
     *
     * <ul>
     *   <li>{@code null} stays {@code null}</li>
     *   <li>booleans become {@code "true"} / {@code "false"}</li>
     *   <li>integral numbers print without a fraction ({@code 14.0 -> "14"})</li>
     *   <li>collections and arrays are joined with {@code ", "}, null elements skipped</li>
     *   <li>maps print as {@code {key: value, ...}}</li>
     * </ul>
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Number n) {
            return numberToText(n);
        }
        if (value instanceof Collection<?> collection) {
            return join(collection);
        }
        if (value instanceof Object[] array) {
            return join(Arrays.asList(array));
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            map.forEach((k, v) -> joiner.add(k + ": " + toText(v)));
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    /**
     * True for {@code null}, blank text, and the {@value #NOT_FOUND} sentinel in any casing.
     */
    public static boolean isAbsent(String text) {
        if (text == null) {
            return true;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() || trimmed.toLowerCase(Locale.ROOT).equals(NOT_FOUND.toLowerCase(Locale.ROOT));
    }

    private static String join(Collection<?> values) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Object element : values) {
            String text = toText(element);
            if (text != null) {
                joiner.add(text);
            }
        }
        return joiner.toString();
    }

    private static String numberToText(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger) {
            return n.toString();
        }
        if (n instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        double d = n.doubleValue();
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return n.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactStore other)) return false;
        return facts.equals(other.facts);
    }

    @Override
    public int hashCode() {
        return facts.hashCode();
    }

    @Override
    public String toString() {
        return "FactStore" + facts.keySet();
    }
}
