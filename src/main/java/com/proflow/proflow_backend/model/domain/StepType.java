package com.proflow.proflow_backend.model.domain;

import com.proflow.proflow_backend.model.step.AiDecisionConfig;
import com.proflow.proflow_backend.model.step.ScheduleMeetingConfig;
import com.proflow.proflow_backend.model.step.SendEmailConfig;
import com.proflow.proflow_backend.model.step.StepConfig;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;

import java.util.Locale;

/**
 * Closed set of step kinds. Every constant has exactly one executor
 * (checked by StepExecutorRegistry at start-up) and one config record.
 */
public enum StepType {
    TOOL_CALL(ToolCallConfig.class),
    AI_DECISION(AiDecisionConfig.class),
    WAIT_FOR_RESPONSE(WaitForResponseConfig.class),
    SEND_EMAIL(SendEmailConfig.class),
    SCHEDULE_MEETING(ScheduleMeetingConfig.class);

    private final Class<? extends StepConfig> configType;

    StepType(Class<? extends StepConfig> configType) {
        this.configType = configType;
    }

    public Class<? extends StepConfig> getConfigType() {
        return configType;
    }

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
