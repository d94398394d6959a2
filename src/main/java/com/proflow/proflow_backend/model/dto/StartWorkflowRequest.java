package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/** Body of POST /api/workflows. Unknown workflow types fall back to the generic template. */
public record StartWorkflowRequest(
        @NotBlank @JsonProperty("workflow_type") String workflowType,
        @JsonProperty("input_data") Map<String, Object> inputData,
        @JsonProperty("name") String name
) {}
