package com.proflow.proflow_backend.model.step;

/**
 * Typed configuration of one step. Persisted as JSON in {@code workflow_steps.config}
 * and materialized again by {@code StepConfigMapper} before execution.
 */
public interface StepConfig {

    /**
     * Checks required fields.
     *
     * @throws IllegalArgumentException naming the first missing or invalid field
     */
    void validate();

    static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
    }
}
