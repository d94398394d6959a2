package com.proflow.proflow_backend.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * One live progress event of a workflow, as delivered to {@code /topic/workflow/{id}}.
 * {@code type} is {@code "step"} or {@code "workflow"}; step fields are null for workflow events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowEvent(
        UUID workflowId,
        String type,
        Integer stepNumber,
        String stepName,
        String status,
        String message,
        String occurredAt
) {

    public static final String TOPIC_PREFIX = "/topic/workflow/";

    static WorkflowEvent step(UUID workflowId, int stepNumber, String stepName, String status, String error, String at) {
        return new WorkflowEvent(workflowId, "step", stepNumber, stepName, status, error, at);
    }

    static WorkflowEvent workflow(UUID workflowId, String status, String message, String at) {
        return new WorkflowEvent(workflowId, "workflow", null, null, status, message, at);
    }

    @JsonIgnore
    public String destination() {
        return TOPIC_PREFIX + workflowId;
    }
}
