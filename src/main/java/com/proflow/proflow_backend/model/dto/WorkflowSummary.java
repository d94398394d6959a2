package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record WorkflowSummary(
        @JsonProperty("id") UUID id,
        @JsonProperty("workflow_type") String workflowType,
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("error_message") String errorMessage
) {}
