package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/*
 * {
 *   "tool_name":   "search_contacts",
 *   "arguments":   { "query": "{{input.contact_name}}", "limit": 5 },
 *   "context_key": "contact_search"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCallConfig(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("context_key") String contextKey
) implements StepConfig {

    public ToolCallConfig {
        arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
    }

    public static ToolCallConfig of(String toolName, Map<String, Object> arguments, String contextKey) {
        return new ToolCallConfig(toolName, arguments, contextKey);
    }

    @Override
    public void validate() {
        StepConfig.require(toolName, "tool_name");
    }
}
