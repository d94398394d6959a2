package com.proflow.proflow_backend.model.step;

import java.time.Instant;
import java.util.Map;

/**
 * Result of running one step. A failure carries only the error; a success may
 * ask the driver to suspend the workflow until {@code resumeDeadline}.
 */
public record StepOutcome(
        boolean success,
        Map<String, Object> output,
        String error,
        boolean suspend,
        Instant resumeDeadline,
        Map<String, Object> contextUpdates
) {

    public static StepOutcome success(Map<String, Object> output, Map<String, Object> contextUpdates) {
        return new StepOutcome(true, output, null, false, null, contextUpdates != null ? contextUpdates : Map.of());
    }

    public static StepOutcome suspend(Map<String, Object> output, Instant resumeDeadline, Map<String, Object> contextUpdates) {
        return new StepOutcome(true, output, null, true, resumeDeadline, contextUpdates != null ? contextUpdates : Map.of());
    }

    public static StepOutcome failure(String error) {
        return new StepOutcome(false, null, error, false, null, Map.of());
    }
}
