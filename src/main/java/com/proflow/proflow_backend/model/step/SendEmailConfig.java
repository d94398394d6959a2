package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendEmailConfig(
        @JsonProperty("recipient_email") String recipientEmail,
        @JsonProperty("subject") String subject,
        @JsonProperty("body") String body,
        @JsonProperty("context_key") String contextKey
) implements StepConfig {

    @Override
    public void validate() {
        StepConfig.require(recipientEmail, "recipient_email");
        StepConfig.require(subject, "subject");
        StepConfig.require(body, "body");
    }
}
