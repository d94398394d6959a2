package com.proflow.proflow_backend.template;

import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.AiDecisionConfig;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

// Fallback for any type without a dedicated template
@Component
public class GenericRequestTemplate implements WorkflowTemplate {

    public static final String TYPE = "generic";

    private static final int NAME_LENGTH = 60;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String defaultName(Map<String, Object> input) {
        String request = WorkflowTemplate.text(input, "user_request", null);
        if (request == null) return "Custom workflow";
        return request.length() > NAME_LENGTH ? request.substring(0, NAME_LENGTH) + "..." : request;
    }

    @Override
    public String description() {
        return "Handles a free-form request in a single decision with full tool access";
    }

    @Override
    public List<StepDescriptor> steps(Map<String, Object> input) {
        return List.of(new StepDescriptor(1, "Handle request", StepType.AI_DECISION,
                AiDecisionConfig.of(
                        "Carry out the original request using the available tools for every lookup or action, "
                        + "then summarize what was done.",
                        "result")));
    }
}
