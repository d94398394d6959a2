package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.integration.ToolExecutionResult;
import com.proflow.proflow_backend.integration.ToolExecutionService;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.store.StepConfigMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared mechanics of steps that invoke exactly one tool: resolve the arguments,
 * add {@code user_id}, call the tool, and store the result under a context key.
 */
public abstract class ToolStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolStepExecutor.class);

    protected final ToolExecutionService toolExecutionService;
    protected final ContextResolver resolver;
    protected final StepConfigMapper configMapper;

    protected ToolStepExecutor(ToolExecutionService toolExecutionService,
                               ContextResolver resolver,
                               StepConfigMapper configMapper) {
        this.toolExecutionService = toolExecutionService;
        this.resolver = resolver;
        this.configMapper = configMapper;
    }

    protected StepOutcome invoke(StepExecutionContext ctx, String toolName,
                                 Map<String, Object> rawArguments, String contextKey) {
        Map<String, Object> arguments = resolver.resolveMap(rawArguments, ctx);
        arguments.put("user_id", ctx.userId());

        ToolExecutionResult result = toolExecutionService.execute(toolName, arguments, ctx.userId());
        if (!result.success()) {
            return StepOutcome.failure("Tool '" + toolName + "' failed: " + result.error());
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("tool_name", toolName);
        output.put("arguments", arguments);
        output.put("result", result.result());

        Map<String, Object> contextUpdates = new LinkedHashMap<>();
        contextUpdates.put(contextKeyFor(ctx, contextKey), result.result());
        contextUpdates.putAll(extraContext(toolName, arguments));

        log.info("[ToolStep] '{}' ran {} for workflow {}", ctx.step().getName(), toolName, ctx.workflowId());
        return StepOutcome.success(output, contextUpdates);
    }

    /** Additional context facts derived from the resolved arguments of a successful call. */
    protected Map<String, Object> extraContext(String toolName, Map<String, Object> arguments) {
        return Map.of();
    }

    static String contextKeyFor(StepExecutionContext ctx, String contextKey) {
        return contextKey != null && !contextKey.isBlank()
                ? contextKey
                : "step_" + ctx.step().getStepNumber() + "_result";
    }
}
