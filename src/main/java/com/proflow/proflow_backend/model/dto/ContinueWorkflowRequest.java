package com.proflow.proflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ContinueWorkflowRequest(
        @JsonProperty("response_data") Map<String, Object> responseData
) {}
