package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.integration.ToolExecutionService;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.store.StepConfigMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ToolCallExecutor extends ToolStepExecutor {

    public ToolCallExecutor(ToolExecutionService toolExecutionService,
                            ContextResolver resolver,
                            StepConfigMapper configMapper) {
        super(toolExecutionService, resolver, configMapper);
    }

    @Override
    public StepType supportedType() {
        return StepType.TOOL_CALL;
    }

    @Override
    public StepOutcome execute(StepExecutionContext ctx) {
        ToolCallConfig cfg = configMapper.read(ctx.step(), ToolCallConfig.class);
        return invoke(ctx, cfg.toolName(), cfg.arguments(), cfg.contextKey());
    }

    // Sends made through a generic tool_call still feed the reminder routing
    @Override
    protected Map<String, Object> extraContext(String toolName, Map<String, Object> arguments) {
        return SendEmailExecutor.TOOL.equals(toolName) ? SendEmailExecutor.emailFacts(arguments) : Map.of();
    }
}
