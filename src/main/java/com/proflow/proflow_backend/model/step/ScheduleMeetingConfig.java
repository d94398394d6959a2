package com.proflow.proflow_backend.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleMeetingConfig(
        @JsonProperty("title") String title,
        @JsonProperty("start_datetime") String startDatetime,
        @JsonProperty("end_datetime") String endDatetime,
        @JsonProperty("attendee_email") String attendeeEmail,
        @JsonProperty("description") String description,
        @JsonProperty("context_key") String contextKey
) implements StepConfig {

    @Override
    public void validate() {
        StepConfig.require(title, "title");
        StepConfig.require(startDatetime, "start_datetime");
        StepConfig.require(endDatetime, "end_datetime");
        StepConfig.require(attendeeEmail, "attendee_email");
    }
}
