package com.proflow.proflow_backend.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proflow.proflow_backend.integration.ContextRetrievalService;
import com.proflow.proflow_backend.integration.Decision;
import com.proflow.proflow_backend.integration.DecisionEngine;
import com.proflow.proflow_backend.integration.RetrievedContext;
import com.proflow.proflow_backend.integration.ToolCall;
import com.proflow.proflow_backend.integration.ToolCatalogue;
import com.proflow.proflow_backend.integration.ToolDefinition;
import com.proflow.proflow_backend.integration.ToolExecutionResult;
import com.proflow.proflow_backend.integration.ToolExecutionService;
import com.proflow.proflow_backend.integration.ToolResult;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.step.AiDecisionConfig;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.store.StepConfigMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the decision engine what to do next. Tool calls it requests are executed
 * right away and fed back for one follow-up answer; that answer is the step's narrative.
 */
@Component
public class AiDecisionExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(AiDecisionExecutor.class);
    private static final int MAX_PROMPT_SECTION_CHARS = 6_000;

    private final DecisionEngine decisionEngine;
    private final ContextRetrievalService contextRetrieval;
    private final ToolExecutionService toolExecutionService;
    private final ToolCatalogue toolCatalogue;
    private final ContextResolver resolver;
    private final StepConfigMapper configMapper;
    private final ObjectMapper mapper;
    private final Clock clock;

    public AiDecisionExecutor(DecisionEngine decisionEngine,
                              ContextRetrievalService contextRetrieval,
                              ToolExecutionService toolExecutionService,
                              ToolCatalogue toolCatalogue,
                              ContextResolver resolver,
                              StepConfigMapper configMapper,
                              ObjectMapper mapper,
                              Clock clock) {
        this.decisionEngine = decisionEngine;
        this.contextRetrieval = contextRetrieval;
        this.toolExecutionService = toolExecutionService;
        this.toolCatalogue = toolCatalogue;
        this.resolver = resolver;
        this.configMapper = configMapper;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public StepType supportedType() {
        return StepType.AI_DECISION;
    }

    @Override
    public StepOutcome execute(StepExecutionContext ctx) {
        AiDecisionConfig cfg = configMapper.read(ctx.step(), AiDecisionConfig.class);
        String instruction = resolver.resolve(cfg.instruction(), ctx);
        String prompt = buildPrompt(instruction, cfg, ctx);

        String query = ctx.userRequest() != null ? ctx.userRequest() : instruction;
        RetrievedContext retrieved = contextRetrieval.contextFor(query, ctx.userId());
        List<ToolDefinition> tools = Boolean.TRUE.equals(cfg.toolAccess()) ? toolCatalogue.all() : List.of();

        Decision decision = decisionEngine.decide(prompt, retrieved, tools);
        if (!decision.success()) {
            return failure(ctx, "Decision engine failed: " + decision.error());
        }

        List<ToolResult> toolResults = new ArrayList<>();
        String narrative = decision.narrative();
        if (decision.requestsTools()) {
            Set<String> offered = tools.stream().map(ToolDefinition::name).collect(Collectors.toSet());
            for (ToolCall call : decision.toolCalls()) {
                toolResults.add(runTool(call, offered, ctx));
            }
            Decision followUp = decisionEngine.continueDecision(decision.history(), toolResults, retrieved, tools);
            if (!followUp.success()) {
                return failure(ctx, "Decision engine failed after tool execution: " + followUp.error());
            }
            if (followUp.requestsTools()) {
                log.warn("[AiDecision] '{}' requested {} more tool call(s) after the follow-up; ignoring them",
                        ctx.step().getName(), followUp.toolCalls().size());
            }
            narrative = followUp.narrative();
        }

        if (cfg.failOn() != null && containsKeyword(narrative, cfg.failOn())) {
            return failure(ctx, "Decision reported " + cfg.failOn() + ": " + truncate(narrative, 300));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("narrative", narrative);
        output.put("tool_results", toolResults.stream().map(ToolResult::toMap).toList());
        output.put("source_count", retrieved.sourceCount());

        Object structured = null;
        if (cfg.expectsJson()) {
            structured = extractJson(narrative);
            if (structured == null) {
                return failure(ctx, "Decision did not contain a JSON object. Raw: " + truncate(narrative, 300));
            }
            output.put("structured", structured);
        }

        Map<String, Object> contextUpdates = new LinkedHashMap<>();
        Map<String, Object> decisionEntry = new LinkedHashMap<>();
        decisionEntry.put("decision", narrative);
        decisionEntry.put("timestamp", clock.instant().toString());
        if (structured != null) {
            decisionEntry.put("structured", structured);
        }
        contextUpdates.put(contextKeyFor(cfg, ctx.step()), decisionEntry);
        String finalNarrative = narrative;
        cfg.signals().forEach((flag, keyword) -> contextUpdates.put(flag, containsKeyword(finalNarrative, keyword)));
        for (ToolResult tr : toolResults) {
            if (SendEmailExecutor.TOOL.equals(tr.call().name()) && tr.result().success()) {
                contextUpdates.putAll(SendEmailExecutor.emailFacts(tr.call().arguments()));
            }
        }

        log.info("[AiDecision] '{}' completed for workflow {}. Tools run: {}",
                ctx.step().getName(), ctx.workflowId(), toolResults.size());
        return StepOutcome.success(output, contextUpdates);
    }

    // ── Prompt ───────────────────────────────────────────────────────────────

    private String buildPrompt(String instruction, AiDecisionConfig cfg, StepExecutionContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("TASK:\n").append(instruction).append("\n\n");

        sb.append("ORIGINAL REQUEST:\n")
          .append(ctx.userRequest() != null ? ctx.userRequest() : toJson(ctx.inputData()))
          .append("\n\n");

        sb.append("COMPLETED STEPS:\n");
        if (ctx.completedSteps().isEmpty()) {
            sb.append("(none)\n");
        }
        for (WorkflowStep step : ctx.completedSteps()) {
            sb.append("Step ").append(step.getStepNumber()).append(" - ").append(step.getName())
              .append(" (").append(step.getStepType().apiValue()).append("): ")
              .append(truncate(toJson(step.getOutputData()), MAX_PROMPT_SECTION_CHARS)).append('\n');
        }
        sb.append('\n');

        sb.append("WORKFLOW CONTEXT:\n").append(truncate(toJson(ctx.context()), MAX_PROMPT_SECTION_CHARS)).append("\n\n");

        if (!cfg.signals().isEmpty()) {
            sb.append("KEYWORDS:\n");
            cfg.signals().forEach((flag, keyword) ->
                    sb.append("- Include the word ").append(keyword).append(" if ").append(flag.replace('_', ' ')).append(".\n"));
        }
        if (cfg.failOn() != null) {
            sb.append("If the task cannot be completed, include the word ").append(cfg.failOn())
              .append(" and explain why.\n");
        }
        if (cfg.expectsJson()) {
            sb.append("Respond with a single JSON object only. No markdown, no explanation.\n");
        }
        return sb.toString();
    }

    // ── Tools ────────────────────────────────────────────────────────────────

    private ToolResult runTool(ToolCall call, Set<String> offered, StepExecutionContext ctx) {
        if (!offered.contains(call.name())) {
            log.warn("[AiDecision] Tool {} was not offered to '{}'", call.name(), ctx.step().getName());
            return new ToolResult(call, ToolExecutionResult.failed("Tool not available: " + call.name()));
        }
        Map<String, Object> arguments = new LinkedHashMap<>(call.arguments());
        arguments.put("user_id", ctx.userId());
        ToolCall withUser = new ToolCall(call.id(), call.name(), arguments);
        ToolExecutionResult result = toolExecutionService.execute(call.name(), arguments, ctx.userId());
        if (!result.success()) {
            // fed back to the engine, not fatal for the step
            log.warn("[AiDecision] Tool {} failed: {}", call.name(), result.error());
        }
        return new ToolResult(withUser, result);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String contextKeyFor(AiDecisionConfig cfg, WorkflowStep step) {
        if (cfg.contextKey() != null && !cfg.contextKey().isBlank()) return cfg.contextKey();
        String slug = step.getName() == null ? "" : step.getName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return "ai_decision_" + (slug.isBlank() ? step.getStepNumber() : slug);
    }

    private static boolean containsKeyword(String narrative, String keyword) {
        return narrative != null && keyword != null
                && narrative.toUpperCase(Locale.ROOT).contains(keyword.toUpperCase(Locale.ROOT));
    }

    Object extractJson(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String cleaned = raw.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.replaceAll("^```[a-zA-Z]*\\n?", "").replaceAll("```$", "").trim();
        }
        int start = -1;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c == '{' || c == '[') { start = i; break; }
        }
        if (start == -1) return null;
        int end = Math.max(cleaned.lastIndexOf('}'), cleaned.lastIndexOf(']'));
        if (end < start) return null;
        try {
            return mapper.readValue(cleaned.substring(start, end + 1), Object.class);
        } catch (JsonProcessingException e) {
            log.debug("[AiDecision] JSON parse failed: {}", e.getMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private StepOutcome failure(StepExecutionContext ctx, String message) {
        log.error("[AiDecision] '{}' FAILURE: {}", ctx.step().getName(), message);
        return StepOutcome.failure(message);
    }

    private static String truncate(String s, int max) {
        if (s == null) return "null";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
