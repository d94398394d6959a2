package com.proflow.proflow_backend.model.domain;

import java.util.Locale;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
