package com.proflow.proflow_backend.integration;

import java.util.Map;

/** A tool offered to the decision engine; {@code parameters} is a JSON schema object. */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {
}
