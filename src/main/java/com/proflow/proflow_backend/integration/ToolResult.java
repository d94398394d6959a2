package com.proflow.proflow_backend.integration;

import java.util.LinkedHashMap;
import java.util.Map;

/** A requested tool call paired with what the tool returned. */
public record ToolResult(ToolCall call, ToolExecutionResult result) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tool_name", call.name());
        map.put("arguments", call.arguments());
        map.putAll(result.toMap());
        return map;
    }
}
