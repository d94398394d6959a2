package com.proflow.proflow_backend.integration;

import java.util.Map;

/**
 * Runs a named tool (search_contacts, send_email, create_calendar_event, ...) on behalf of a user.
 * Invocations are at-least-once: a step that is re-executed after a crash calls the tool again.
 */
public interface ToolExecutionService {

    ToolExecutionResult execute(String toolName, Map<String, Object> arguments, String userId);
}
