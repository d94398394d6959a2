package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WaitForResponseConfig(
        @JsonProperty("timeout_hours") Integer timeoutHours,
        @JsonProperty("expects") List<String> expects,
        @JsonProperty("waiting_for") String waitingFor,
        // Suspends only when the condition holds; absent means always
        @JsonProperty("only_if") StepCondition onlyIf
) implements StepConfig {

    public static final int DEFAULT_TIMEOUT_HOURS = 24;
    public static final String DEFAULT_WAITING_FOR = "email_response";

    public WaitForResponseConfig {
        timeoutHours = timeoutHours != null ? timeoutHours : DEFAULT_TIMEOUT_HOURS;
        expects = expects != null ? List.copyOf(expects) : List.of();
        waitingFor = waitingFor != null && !waitingFor.isBlank() ? waitingFor : DEFAULT_WAITING_FOR;
    }

    public static WaitForResponseConfig of(int timeoutHours, List<String> expects) {
        return new WaitForResponseConfig(timeoutHours, expects, null, null);
    }

    public WaitForResponseConfig onlyIf(StepCondition condition) {
        return new WaitForResponseConfig(timeoutHours, expects, waitingFor, condition);
    }

    @Override
    public void validate() {
        if (timeoutHours <= 0) {
            throw new IllegalArgumentException("'timeout_hours' must be positive, got " + timeoutHours);
        }
        if (onlyIf != null) {
            onlyIf.validate();
        }
    }
}
