/*
 * Copyright (c) 2025 Precheck Compliance Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.precheck.engine.compiler;

import com.precheck.engine.api.exceptions.InvalidChecklistException;
import com.precheck.engine.api.model.PassCondition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the untrusted {@code pass_condition} of a raw rule into a {@link PassCondition}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>a kind name: {@code "not_empty"}, {@code "true"}, {@code "manual"}</li>
 *   <li>a kind with an inline parameter: {@code "matches:^https://"}, {@code "min_length:10"}</li>
 *   <li>an object: {@code {"kind": "one_of", "value": ["en", "de"]}} ({@code type} is accepted for {@code kind})</li>
 * </ul>
 *
 * <p>Unknown kinds and unusable parameters are downgraded to {@code not_empty}
 * with a note, or rejected when parsing strictly.
 */
final class PassConditionParser {

    private static final PassCondition NOT_EMPTY = new PassCondition.NotEmpty();

    /**
     * Outcome of parsing one condition.
     *
     * @param condition the condition to use
     * @param note      downgrade note, or null when the condition was used as written
     */
    record Parsed(PassCondition condition, String note) {
        boolean downgraded() {
            return note != null;
        }
    }

    private PassConditionParser() {
    }

    /**
     * @param ruleId rule the condition belongs to, for messages
     * @param index  position of the rule in the raw list, for messages
     * @param raw    condition as deserialized (String, Map, or null)
     * @param strict reject instead of downgrading
     * @throws InvalidChecklistException in strict mode when the condition is unusable
     */
    static Parsed parse(String ruleId, int index, Object raw, boolean strict) {
        if (raw == null) {
            return new Parsed(NOT_EMPTY, null);
        }

        String kindText;
        Object parameter;
        if (raw instanceof Map<?, ?> map) {
            Object kind = map.containsKey("kind") ? map.get("kind") : map.get("type");
            kindText = kind == null ? null : kind.toString();
            parameter = map.containsKey("value") ? map.get("value") : map.get("values");
        } else if (raw instanceof String text) {
            int colon = text.indexOf(':');
            if (colon > 0 && PassCondition.Kind.fromString(text.substring(0, colon)) != null) {
                kindText = text.substring(0, colon);
                parameter = text.substring(colon + 1);
            } else {
                kindText = text;
                parameter = null;
            }
        } else if (raw instanceof Boolean flag && flag) {
            kindText = PassCondition.Kind.BOOLEAN_TRUE.wireName();
            parameter = null;
        } else {
            return reject(ruleId, index, "unsupported pass_condition " + raw, strict);
        }

        PassCondition.Kind kind = PassCondition.Kind.fromString(kindText);
        if (kind == null) {
            return reject(ruleId, index, "unknown pass_condition '" + kindText + "'", strict);
        }

        return switch (kind) {
            case NOT_EMPTY -> new Parsed(NOT_EMPTY, null);
            case BOOLEAN_TRUE -> new Parsed(new PassCondition.BooleanTrue(), null);
            case MANUAL -> new Parsed(new PassCondition.Manual(), null);
            case EQUALS -> parseEquals(ruleId, index, parameter, strict);
            case MATCHES -> parseMatches(ruleId, index, parameter, strict);
            case ONE_OF -> parseOneOf(ruleId, index, parameter, strict);
            case MIN_LENGTH -> parseMinLength(ruleId, index, parameter, strict);
        };
    }

    private static Parsed parseEquals(String ruleId, int index, Object parameter, boolean strict) {
        if (parameter == null || parameter instanceof Collection<?> || parameter instanceof Map<?, ?>) {
            return reject(ruleId, index, "equals requires a scalar value", strict);
        }
        return new Parsed(new PassCondition.EqualsValue(parameter.toString()), null);
    }

    private static Parsed parseMatches(String ruleId, int index, Object parameter, boolean strict) {
        if (!(parameter instanceof String regex) || regex.isEmpty()) {
            return reject(ruleId, index, "matches requires a regex string", strict);
        }
        try {
            return new Parsed(new PassCondition.Matches(regex), null);
        } catch (PatternSyntaxException e) {
            return reject(ruleId, index, "invalid regex pattern: " + e.getDescription(), strict);
        }
    }

    private static Parsed parseOneOf(String ruleId, int index, Object parameter, boolean strict) {
        List<String> values = new ArrayList<>();
        if (parameter instanceof Collection<?> collection) {
            for (Object value : collection) {
                if (value != null) {
                    values.add(value.toString());
                }
            }
        } else if (parameter instanceof String text) {
            // "one_of:en,de" inline form
            for (String value : text.split(",")) {
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
        }
        if (values.isEmpty()) {
            return reject(ruleId, index, "one_of requires a non-empty list of values", strict);
        }
        return new Parsed(PassCondition.OneOf.of(values), null);
    }

    private static Parsed parseMinLength(String ruleId, int index, Object parameter, boolean strict) {
        Integer length = null;
        if (parameter instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            if (number.doubleValue() > Integer.MAX_VALUE) {
                return reject(ruleId, index, "out-of-range min_length " + parameter, strict);
            }
            length = number.intValue();
        } else if (parameter instanceof String text) {
            try {
                length = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return reject(ruleId, index, "min_length requires an integer, got '" + text + "'", strict);
            }
        }
        if (length == null || length < 0) {
            return reject(ruleId, index, "min_length requires a non-negative integer, got " + parameter, strict);
        }
        return new Parsed(new PassCondition.MinLength(length), null);
    }

    private static Parsed reject(String ruleId, int index, String problem, boolean strict) {
        String message = "Rule '" + ruleId + "' has " + problem;
        if (strict) {
            throw new InvalidChecklistException(message, index);
        }
        return new Parsed(NOT_EMPTY, message + "; downgraded to not_empty");
    }
}
