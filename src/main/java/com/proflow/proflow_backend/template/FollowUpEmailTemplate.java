package com.proflow.proflow_backend.template;

import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.AiDecisionConfig;
import com.proflow.proflow_backend.model.step.SendEmailConfig;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Input: user_request, contact_email, context, custom_message
 */
@Component
public class FollowUpEmailTemplate implements WorkflowTemplate {

    public static final String TYPE = "follow_up_email";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String defaultName(Map<String, Object> input) {
        return "Follow-up to " + WorkflowTemplate.text(input, "contact_email", "contact");
    }

    @Override
    public String description() {
        return "Reviews the email history with a contact, sends a follow-up and records it in the CRM";
    }

    @Override
    public List<StepDescriptor> steps(Map<String, Object> input) {
        Map<String, Object> historyArgs = new LinkedHashMap<>();
        historyArgs.put("contact_email", "{{input.contact_email}}");
        historyArgs.put("limit", 10);

        Map<String, Object> noteArgs = new LinkedHashMap<>();
        noteArgs.put("contact_email", "{{input.contact_email}}");
        noteArgs.put("note_content", "Follow-up email sent: {{steps.2.structured.subject}}");

        return List.of(
                new StepDescriptor(1, "Search email history", StepType.TOOL_CALL,
                        ToolCallConfig.of("search_email_history", historyArgs, "email_history")),

                new StepDescriptor(2, "Draft follow-up", StepType.AI_DECISION,
                        AiDecisionConfig.of(
                                "Draft a follow-up email to {{input.contact_email}} about: {{input.context}}. "
                                + "Take the earlier conversation into account. Include this note from the user if "
                                + "present: {{input.custom_message}}. "
                                + "Reply with a JSON object {\"subject\": \"...\", \"body\": \"...\"}.",
                                "follow_up_draft")
                                .asJson()
                                .withoutTools()),

                new StepDescriptor(3, "Send follow-up", StepType.SEND_EMAIL,
                        new SendEmailConfig("{{input.contact_email}}",
                                "{{steps.2.structured.subject}}",
                                "{{steps.2.structured.body}}",
                                "follow_up_sent")),

                new StepDescriptor(4, "Record CRM note", StepType.TOOL_CALL,
                        ToolCallConfig.of("add_hubspot_note", noteArgs, "crm_note"))
        );
    }
}
