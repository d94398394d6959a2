package com.proflow.proflow_backend.integration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decision engine backed by an OpenAI-compatible chat completions endpoint with
 * function calling. Tool results are fed back as system messages.
 */
@Component
public class OpenAiDecisionEngine implements DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(OpenAiDecisionEngine.class);

    static final String DECIDE_SYSTEM_PROMPT = """
            You are an assistant that carries out multi-step business tasks for a user: finding contacts,
            emailing them, proposing and booking meetings, and keeping CRM notes up to date.
            Use the available tools whenever an action or a lookup is needed instead of describing it.
            Answer concisely and state the outcome of each action you took.""";

    static final String CONTINUE_SYSTEM_PROMPT = """
            You are continuing a workflow step. Review the tool execution results and:
            1. If they succeeded, state the outcome and what it means for the next step.
            2. If something failed, say what failed and what should be done instead.
            Keep to the facts returned by the tools.""";

    static final String FOLLOW_UP_PROMPT =
            "Based on the tool execution results above, continue with the workflow. "
            + "If all steps are complete, provide a summary.";

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private final String apiKey;
    private final String endpoint;
    private final String model;
    private final int maxTokens;
    private final double temperature;

    public OpenAiDecisionEngine(@Value("${proflow.decision.api-key:}") String apiKey,
                                @Value("${proflow.decision.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
                                @Value("${proflow.decision.model:gpt-4o-mini}") String model,
                                @Value("${proflow.decision.max-tokens:1500}") int maxTokens,
                                @Value("${proflow.decision.temperature:0.2}") double temperature) {
        this.apiKey = apiKey;
        this.endpoint = endpoint;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public Decision decide(String prompt, RetrievedContext context, List<ToolDefinition> tools) {
        List<ConversationMessage> history = new ArrayList<>();
        history.add(ConversationMessage.user(prompt));
        return complete(DECIDE_SYSTEM_PROMPT, history, context, tools);
    }

    @Override
    public Decision continueDecision(List<ConversationMessage> history, List<ToolResult> toolResults,
                                     RetrievedContext context, List<ToolDefinition> tools) {
        List<ConversationMessage> messages = new ArrayList<>(history);
        for (ToolResult tr : toolResults) {
            if (tr.result().success()) {
                messages.add(ConversationMessage.system("Tool execution result: " + tr.call().name()
                        + " completed successfully. Result: " + toJson(tr.result().result())));
            } else {
                messages.add(ConversationMessage.system("Tool execution failed: " + tr.call().name()
                        + " - Error: " + tr.result().error()));
            }
        }
        messages.add(ConversationMessage.system(FOLLOW_UP_PROMPT));
        return complete(CONTINUE_SYSTEM_PROMPT, messages, context, tools);
    }

    // ── Chat completion ──────────────────────────────────────────────────────

    private Decision complete(String systemPrompt, List<ConversationMessage> history,
                              RetrievedContext context, List<ToolDefinition> tools) {
        if (apiKey == null || apiKey.isBlank()) {
            return Decision.error("Decision engine is not configured: set proflow.decision.api-key");
        }
        try {
            List<Map<String, Object>> messages = new ArrayList<>();
            messages.add(Map.of("role", "system", "content", systemPrompt));
            if (context != null && !context.isEmpty()) {
                messages.add(Map.of("role", "system", "content", "Relevant context:\n" + context.contextText()));
            }
            history.forEach(m -> messages.add(Map.of("role", m.role(), "content", m.content())));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", maxTokens);
            body.put("temperature", temperature);
            if (tools != null && !tools.isEmpty()) {
                body.put("tools", tools.stream().map(OpenAiDecisionEngine::toFunction).toList());
                body.put("tool_choice", "auto");
            }

            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofSeconds(60))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[Decision] HTTP {}", httpResp.statusCode());
                return Decision.error("Decision engine error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            return parse(httpResp.body(), history);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Decision.error("Decision engine call interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("[Decision] Exception calling API", e);
            return Decision.error("Decision engine client exception: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    Decision parse(String rawBody, List<ConversationMessage> history) throws IOException {
        Map<String, Object> resp = mapper.readValue(rawBody, new TypeReference<Map<String, Object>>() {});
        List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
        if (choices == null || choices.isEmpty()) {
            return Decision.error("Decision engine returned no choices");
        }
        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message.get("content") instanceof String s ? s : "";

        List<ToolCall> toolCalls = new ArrayList<>();
        Object rawCalls = message.get("tool_calls");
        if (rawCalls instanceof List<?> calls) {
            for (Object c : calls) {
                Map<String, Object> call = (Map<String, Object>) c;
                Map<String, Object> function = (Map<String, Object>) call.get("function");
                if (function == null) continue;
                toolCalls.add(new ToolCall((String) call.get("id"), (String) function.get("name"),
                        parseArguments(function.get("arguments"))));
            }
        }

        List<ConversationMessage> nextHistory = new ArrayList<>(history);
        nextHistory.add(ConversationMessage.assistant(!content.isBlank() ? content
                : "Requested tools: " + toolCalls.stream().map(ToolCall::name).collect(Collectors.joining(", "))));
        return Decision.ok(content, toolCalls, nextHistory);
    }

    private Map<String, Object> parseArguments(Object raw) {
        if (!(raw instanceof String json) || json.isBlank()) return Map.of();
        try {
            return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            log.warn("[Decision] Unparseable tool arguments, using none: {}", e.getMessage());
            return Map.of();
        }
    }

    private static Map<String, Object> toFunction(ToolDefinition def) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", def.name());
        function.put("description", def.description());
        function.put("parameters", def.parameters() != null ? def.parameters() : Map.of("type", "object"));
        return Map.of("type", "function", "function", function);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (IOException e) {
            return String.valueOf(value);
        }
    }

    private String extractError(String body) {
        try {
            Map<String, Object> parsed = mapper.readValue(body, new TypeReference<Map<String, Object>>() {});
            if (parsed.get("error") instanceof Map<?, ?> err && err.get("message") != null) {
                return err.get("message").toString();
            }
        } catch (IOException e) {
            log.debug("[Decision] Error body is not JSON: {}", e.getMessage());
        }
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
