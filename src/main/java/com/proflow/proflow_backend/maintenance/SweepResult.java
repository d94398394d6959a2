package com.proflow.proflow_backend.maintenance;

/** Counts of one timeout monitor pass. */
public record SweepResult(int reminded, int failed, int skipped) {
}
