package com.proflow.proflow_backend.template;

import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.AiDecisionConfig;
import com.proflow.proflow_backend.model.step.StepCondition;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Find the contact, offer times by email, wait for the reply, check the chosen slot,
 * negotiate once if it conflicts, then book it.
 *
 * Input: user_request, contact_name, preferred_date, duration (minutes), message
 */
@Component
public class ScheduleAppointmentTemplate implements WorkflowTemplate {

    public static final String TYPE = "schedule_appointment";

    static final String NEGOTIATION_FLAG = "negotiation_required";
    static final String CONFLICT = "CONFLICT";
    static final String NO_CONTACT = "NO_CONTACT_FOUND";
    static final String UNRESOLVED = "UNRESOLVED_CONFLICT";
    static final int REPLY_TIMEOUT_HOURS = 24;
    static final int DEFAULT_DURATION_MINUTES = 60;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String defaultName(Map<String, Object> input) {
        return "Appointment with " + WorkflowTemplate.text(input, "contact_name", "contact");
    }

    @Override
    public String description() {
        return "Finds the contact, proposes available times by email, waits for the reply and books the meeting";
    }

    @Override
    public List<StepDescriptor> steps(Map<String, Object> input) {
        Map<String, Object> searchArgs = new LinkedHashMap<>();
        searchArgs.put("query", "{{input.contact_name}}");
        searchArgs.put("limit", 5);

        Map<String, Object> availabilityArgs = new LinkedHashMap<>();
        availabilityArgs.put("duration_minutes", durationOf(input));
        availabilityArgs.put("next_24_hours", true);
        if (input != null && input.get("preferred_date") != null) {
            availabilityArgs.put("preferred_date", "{{input.preferred_date}}");
        }

        List<String> expects = List.of("email_reply", "time_selection");

        return List.of(
                new StepDescriptor(1, "Search contacts", StepType.TOOL_CALL,
                        ToolCallConfig.of("search_contacts", searchArgs, "contact_search")),

                new StepDescriptor(2, "Select contact", StepType.AI_DECISION,
                        AiDecisionConfig.of(
                                "From the contact search results pick the contact that best matches "
                                + "'{{input.contact_name}}'. State their full name, email address and contact id. "
                                + "If nobody matches, reply " + NO_CONTACT + ".",
                                "selected_contact")
                                .withFailOn(NO_CONTACT)),

                new StepDescriptor(3, "Get available times", StepType.TOOL_CALL,
                        ToolCallConfig.of("get_time_suggestions", availabilityArgs, "availability")),

                new StepDescriptor(4, "Email available times", StepType.AI_DECISION,
                        AiDecisionConfig.of(
                                "Write to the selected contact proposing the available times from the workflow context "
                                + "and send it with the send_email tool. Ask them to reply with the time that suits them. "
                                + "Personal note from the user, if any: {{input.message}}",
                                "availability_email")),

                new StepDescriptor(5, "Wait for reply", StepType.WAIT_FOR_RESPONSE,
                        WaitForResponseConfig.of(REPLY_TIMEOUT_HOURS, expects)),

                new StepDescriptor(6, "Evaluate reply", StepType.AI_DECISION,
                        AiDecisionConfig.of(
                                "Read the contact's reply in response_data and determine the time they chose. "
                                + "Check that slot with get_calendar_availability. If it is free, state the agreed start "
                                + "and end in ISO-8601. If it conflicts, email the contact two alternative slots with "
                                + "send_email.",
                                "reply_evaluation")
                                .withSignal(NEGOTIATION_FLAG, CONFLICT)),

                // One negotiation round; skipped when the first reply was bookable
                new StepDescriptor(7, "Wait for rescheduling reply", StepType.WAIT_FOR_RESPONSE,
                        WaitForResponseConfig.of(REPLY_TIMEOUT_HOURS, expects)
                                .onlyIf(StepCondition.equalTo(NEGOTIATION_FLAG, true))),

                new StepDescriptor(8, "Book meeting", StepType.AI_DECISION,
                        AiDecisionConfig.of(
                                "Book the agreed time: create the event with create_calendar_event inviting the contact, "
                                + "add a note to the contact with add_hubspot_note, and send a confirmation with "
                                + "send_email. If the latest reply still does not give a time that is free, reply "
                                + UNRESOLVED + " (negotiation round limit reached without an agreed time).",
                                "booking")
                                .withFailOn(UNRESOLVED))
        );
    }

    private static Object durationOf(Map<String, Object> input) {
        Object duration = input != null ? input.get("duration") : null;
        if (duration instanceof Number n && n.intValue() > 0) return n.intValue();
        if (duration != null && duration.toString().matches("\\d+")) return Integer.parseInt(duration.toString());
        return DEFAULT_DURATION_MINUTES;
    }
}
