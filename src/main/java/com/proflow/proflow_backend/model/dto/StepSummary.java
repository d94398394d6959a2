package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record StepSummary(
        @JsonProperty("step_number") int stepNumber,
        @JsonProperty("name") String name,
        @JsonProperty("step_type") String stepType,
        @JsonProperty("status") String status,
        @JsonProperty("output_data") Map<String, Object> outputData,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt
) {}
