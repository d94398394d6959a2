package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Config of an {@code ai_decision} step.
 *
 * <pre>
 * {
 *   "instruction":     "Pick the contact that best matches ...",
 *   "context_key":     "selected_contact",
 *   "response_format": "text",
 *   "signals":         { "negotiation_required": "CONFLICT" },
 *   "fail_on":         "NO_CONTACT_FOUND",
 *   "tool_access":     true
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiDecisionConfig(
        @JsonProperty("instruction") String instruction,
        @JsonProperty("context_key") String contextKey,
        /* "text" or "json"; json requires a parseable object in the narrative */
        @JsonProperty("response_format") String responseFormat,
        /* context flag name -> keyword; the flag is true when the narrative contains the keyword */
        @JsonProperty("signals") Map<String, String> signals,
        /* keyword that turns the decision into a step failure */
        @JsonProperty("fail_on") String failOn,
        @JsonProperty("tool_access") Boolean toolAccess
) implements StepConfig {

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";

    public AiDecisionConfig {
        responseFormat = responseFormat != null ? responseFormat : FORMAT_TEXT;
        signals = signals != null ? new LinkedHashMap<>(signals) : new LinkedHashMap<>();
        toolAccess = toolAccess != null ? toolAccess : Boolean.TRUE;
    }

    public static AiDecisionConfig of(String instruction, String contextKey) {
        return new AiDecisionConfig(instruction, contextKey, FORMAT_TEXT, null, null, true);
    }

    public AiDecisionConfig withFailOn(String keyword) {
        return new AiDecisionConfig(instruction, contextKey, responseFormat, signals, keyword, toolAccess);
    }

    public AiDecisionConfig withSignal(String flag, String keyword) {
        Map<String, String> next = new LinkedHashMap<>(signals);
        next.put(flag, keyword);
        return new AiDecisionConfig(instruction, contextKey, responseFormat, next, failOn, toolAccess);
    }

    public AiDecisionConfig asJson() {
        return new AiDecisionConfig(instruction, contextKey, FORMAT_JSON, signals, failOn, toolAccess);
    }

    public AiDecisionConfig withoutTools() {
        return new AiDecisionConfig(instruction, contextKey, responseFormat, signals, failOn, false);
    }

    public boolean expectsJson() {
        return FORMAT_JSON.equalsIgnoreCase(responseFormat);
    }

    @Override
    public void validate() {
        StepConfig.require(instruction, "instruction");
        if (!FORMAT_TEXT.equalsIgnoreCase(responseFormat) && !FORMAT_JSON.equalsIgnoreCase(responseFormat)) {
            throw new IllegalArgumentException("'response_format' must be 'text' or 'json', got '" + responseFormat + "'");
        }
        signals.forEach((flag, keyword) -> {
            StepConfig.require(flag, "signals.<name>");
            StepConfig.require(keyword, "signals." + flag);
        });
    }
}
