package com.proflow.proflow_backend.integration;

import java.util.List;

/**
 * Reply of the decision engine. {@code history} is the full conversation including
 * the assistant's reply, so it can be handed back to
 * {@link DecisionEngine#continueDecision} together with the tool results.
 */
public record Decision(
        boolean success,
        String narrative,
        List<ToolCall> toolCalls,
        List<ConversationMessage> history,
        String error
) {

    public Decision {
        narrative = narrative != null ? narrative : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static Decision ok(String narrative, List<ToolCall> toolCalls, List<ConversationMessage> history) {
        return new Decision(true, narrative, toolCalls, history, null);
    }

    public static Decision error(String error) {
        return new Decision(false, null, null, null, error);
    }

    public boolean requestsTools() {
        return !toolCalls.isEmpty();
    }
}
