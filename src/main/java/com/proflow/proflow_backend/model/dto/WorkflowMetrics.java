package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record WorkflowMetrics(
        @JsonProperty("status_counts") Map<String, Long> statusCounts,
        @JsonProperty("created_last_24h") long createdLast24h,
        @JsonProperty("completed_last_24h") long completedLast24h,
        @JsonProperty("timestamp") Instant timestamp
) {}
