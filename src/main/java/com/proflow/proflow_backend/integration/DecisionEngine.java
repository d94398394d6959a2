package com.proflow.proflow_backend.integration;

import java.util.List;

/**
 * Reasoning engine behind {@code ai_decision} steps. Implementations never throw for
 * provider-side problems; they return {@link Decision#error(String)} instead.
 */
public interface DecisionEngine {

    Decision decide(String prompt, RetrievedContext context, List<ToolDefinition> tools);

    /** Feeds tool results back into the conversation of an earlier decision. */
    Decision continueDecision(List<ConversationMessage> history, List<ToolResult> toolResults,
                              RetrievedContext context, List<ToolDefinition> tools);
}
