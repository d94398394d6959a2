package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.WorkflowStep;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the workflow handed to an executor: the step being run, the
 * caller's input, the current context and the completed steps in order.
 */
public record StepExecutionContext(
        UUID workflowId,
        String userId,
        WorkflowStep step,
        Map<String, Object> inputData,
        Map<String, Object> context,
        List<WorkflowStep> completedSteps
) {

    public StepExecutionContext {
        inputData = inputData != null ? Collections.unmodifiableMap(new HashMap<>(inputData)) : Map.of();
        context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
    }

    public Optional<WorkflowStep> completedStep(int stepNumber) {
        return completedSteps.stream().filter(s -> s.getStepNumber() == stepNumber).findFirst();
    }

    /** {@code input_data.user_request}, the free-text request the workflow was started with. */
    public String userRequest() {
        Object request = inputData.get("user_request");
        return request != null ? request.toString() : null;
    }
}
