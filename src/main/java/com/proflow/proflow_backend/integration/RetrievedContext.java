package com.proflow.proflow_backend.integration;

/** Background facts about the user's contacts, mail and calendar relevant to a request. */
public record RetrievedContext(String contextText, int sourceCount) {

    public static RetrievedContext empty() {
        return new RetrievedContext("", 0);
    }

    public boolean isEmpty() {
        return contextText == null || contextText.isBlank();
    }
}
