package com.proflow.proflow_backend.integration;

import java.util.Map;

/** A tool invocation requested by the decision engine. */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments != null ? arguments : Map.of();
    }
}
