package com.proflow.proflow_backend.integration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Routes a reminder by what the workflow is waiting for: an awaited email reply gets
 * a reminder email through the send_email tool; anything else is only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolReminderDispatcher implements ReminderDispatcher {

    static final String DEFAULT_SUBJECT = "Previous Message";

    static final String REMINDER_BODY = """
            Hi,

            I wanted to follow up on my previous message regarding scheduling an appointment.

            I understand you might be busy, but I'd appreciate if you could let me know about your availability when you have a moment.

            If none of the times I suggested work for you, please feel free to suggest alternative times that would be better.

            Thank you for your time.

            Best regards
            """;

    private final ToolExecutionService toolExecutionService;

    @Override
    public void dispatch(UUID workflowId, Map<String, Object> context) {
        if (Boolean.TRUE.equals(context.get("waiting_for_email_response"))) {
            sendEmailReminder(workflowId, context);
        } else if (Boolean.TRUE.equals(context.get("waiting_for_calendar_response"))) {
            log.info("[Reminder] Calendar reminder for workflow {} (attempt {})", workflowId, context.get("reminder_attempt"));
        } else {
            log.info("[Reminder] Generic reminder for workflow {} (attempt {})", workflowId, context.get("reminder_attempt"));
        }
    }

    private void sendEmailReminder(UUID workflowId, Map<String, Object> context) {
        Object recipient = context.get("email_sent_to");
        if (recipient == null || recipient.toString().isBlank()) {
            log.warn("[Reminder] No email address found in context for workflow {}", workflowId);
            return;
        }
        Object original = context.get("original_email_subject");
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("recipient_email", recipient.toString());
        arguments.put("subject", "Reminder: " + (original != null ? original : DEFAULT_SUBJECT));
        arguments.put("body", REMINDER_BODY);

        String userId = context.get("user_id") != null ? context.get("user_id").toString() : null;
        ToolExecutionResult result = toolExecutionService.execute("send_email", arguments, userId);
        if (result.success()) {
            log.info("[Reminder] Email reminder sent to {} for workflow {}", recipient, workflowId);
        } else {
            log.warn("[Reminder] Email reminder for workflow {} failed: {}", workflowId, result.error());
        }
    }
}
