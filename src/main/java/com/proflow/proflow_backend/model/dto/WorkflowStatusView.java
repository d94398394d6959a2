package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Full status of one workflow: its row plus every step ordered by step number. */
public record WorkflowStatusView(
        @JsonProperty("id") UUID id,
        @JsonProperty("workflow_type") String workflowType,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("status") String status,
        @JsonProperty("current_step") Integer currentStep,
        @JsonProperty("total_steps") int totalSteps,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("timeout_at") Instant timeoutAt,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("steps") List<StepSummary> steps
) {}
