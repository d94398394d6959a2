package com.proflow.proflow_backend.model.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum WorkflowStatus {
    PENDING,
    RUNNING,
    WAITING,   // suspended on a wait_for_response step until resumed or timed out
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<WorkflowStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Lower-case name used in API payloads ("waiting", "completed", ...). */
    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkflowStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Workflow status must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown workflow status: '" + value + "'");
        }
    }
}
