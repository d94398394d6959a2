package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.StepOutcome;

/**
 * Runs one kind of step. Domain problems are reported as
 * {@link StepOutcome#failure(String)}; an exception is treated the same way by the driver.
 */
public interface StepExecutor {

    StepType supportedType();

    StepOutcome execute(StepExecutionContext ctx);
}
