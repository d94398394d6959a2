package com.proflow.proflow_backend.integration;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of one tool invocation: either a result or an error, never both. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecutionResult(boolean success, Object result, String error) {

    public static ToolExecutionResult ok(Object result) {
        return new ToolExecutionResult(true, result, null);
    }

    public static ToolExecutionResult failed(String error) {
        return new ToolExecutionResult(false, null, error != null ? error : "unknown error");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        if (success) {
            map.put("result", result);
        } else {
            map.put("error", error);
        }
        return map;
    }
}
