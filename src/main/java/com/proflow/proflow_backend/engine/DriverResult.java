package com.proflow.proflow_backend.engine;

import com.proflow.proflow_backend.model.domain.WorkflowStatus;

import java.util.UUID;

/**
 * What one driver invocation achieved. {@code claimed == false} means the trigger
 * was a no-op: the workflow was not in a claimable state or another pass owns it.
 */
public record DriverResult(UUID workflowId, WorkflowStatus status, boolean claimed) {

    static DriverResult notClaimed(UUID workflowId, WorkflowStatus current) {
        return new DriverResult(workflowId, current, false);
    }
}
