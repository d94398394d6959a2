package com.proflow.proflow_backend.template;

import com.proflow.proflow_backend.model.step.StepDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Blueprint of one workflow type. Implementations are deterministic and side-effect
 * free: the same input always yields the same steps.
 */
public interface WorkflowTemplate {

    /** Lower-case type key, e.g. {@code schedule_appointment}. */
    String type();

    String defaultName(Map<String, Object> input);

    String description();

    List<StepDescriptor> steps(Map<String, Object> input);

    static String text(Map<String, Object> input, String key, String fallback) {
        Object value = input != null ? input.get(key) : null;
        return value != null && !value.toString().isBlank() ? value.toString() : fallback;
    }
}
