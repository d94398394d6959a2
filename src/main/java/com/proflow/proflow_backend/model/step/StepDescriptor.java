package com.proflow.proflow_backend.model.step;

import com.proflow.proflow_backend.model.domain.StepType;

/** One step as produced by a workflow template, before it is persisted. */
public record StepDescriptor(int stepNumber, String name, StepType stepType, StepConfig config) {
}
