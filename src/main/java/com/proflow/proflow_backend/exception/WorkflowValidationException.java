package com.proflow.proflow_backend.exception;

/**
 * Thrown when a generated step list is malformed: gaps in step numbers,
 * a config record that does not match its step type, or a missing required field.
 */
public class WorkflowValidationException extends RuntimeException {

    public WorkflowValidationException(String message) {
        super(message);
    }

    public WorkflowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
