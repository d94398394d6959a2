package com.proflow.proflow_backend.integration;

/** One chat message exchanged with the decision engine ("system", "user" or "assistant"). */
public record ConversationMessage(String role, String content) {

    public static ConversationMessage system(String content) {
        return new ConversationMessage("system", content);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage("user", content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage("assistant", content);
    }
}
