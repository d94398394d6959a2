package com.proflow.proflow_backend.exception;

import java.util.UUID;

/** Unknown workflow id, or a workflow owned by another user. */
public class WorkflowNotFoundException extends RuntimeException {

    public WorkflowNotFoundException(UUID workflowId) {
        super("Workflow not found: " + workflowId);
    }
}
