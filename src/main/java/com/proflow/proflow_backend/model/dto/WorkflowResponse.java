package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowResponse(
        @JsonProperty("workflow_id") UUID workflowId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("result") Map<String, Object> result
) {}
