package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Predicate over a workflow context value addressed by a dot path
 * (e.g. {@code negotiation_required} or {@code response_data.time_selection}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepCondition(
        @JsonProperty("field") String field,
        @JsonProperty("operator") Operator operator,
        @JsonProperty("value") Object value
) {

    public enum Operator { EQUALS, NOT_EQUALS, CONTAINS, EXISTS }

    public static StepCondition equalTo(String field, Object value) {
        return new StepCondition(field, Operator.EQUALS, value);
    }

    public void validate() {
        StepConfig.require(field, "only_if.field");
        if (operator == null) {
            throw new IllegalArgumentException("'only_if.operator' is required");
        }
    }

    public boolean test(Map<String, Object> context) {
        Object actual = lookup(context, field);
        return switch (operator) {
            case EXISTS     -> actual != null;
            case EQUALS     -> sameValue(actual, value);
            case NOT_EQUALS -> !sameValue(actual, value);
            case CONTAINS   -> contains(actual, value);
        };
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (actual == null || expected == null) return actual == expected;
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return Objects.equals(actual.toString(), expected.toString());
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) return false;
        if (actual instanceof Collection<?> c) {
            return c.stream().anyMatch(item -> sameValue(item, expected));
        }
        return actual.toString().toLowerCase().contains(expected.toString().toLowerCase());
    }

    private static Object lookup(Map<String, Object> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) return null;
            current = map.get(segment);
        }
        return current;
    }
}
