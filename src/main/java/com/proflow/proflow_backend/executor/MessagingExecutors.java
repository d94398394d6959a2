package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.integration.ToolExecutionService;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.ScheduleMeetingConfig;
import com.proflow.proflow_backend.model.step.SendEmailConfig;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.store.StepConfigMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/*
 * send_email and schedule_meeting are tool calls with a fixed tool and typed arguments:
 * {
 *   "recipient_email": "{{context.selected_contact.email}}",
 *   "subject":         "{{steps.2.structured.subject}}",
 *   "body":            "{{steps.2.structured.body}}"
 * }
 */
@Component
class SendEmailExecutor extends ToolStepExecutor {

    static final String TOOL = "send_email";

    SendEmailExecutor(ToolExecutionService toolExecutionService, ContextResolver resolver, StepConfigMapper configMapper) {
        super(toolExecutionService, resolver, configMapper);
    }

    @Override public StepType supportedType() { return StepType.SEND_EMAIL; }

    @Override
    public StepOutcome execute(StepExecutionContext ctx) {
        SendEmailConfig cfg = configMapper.read(ctx.step(), SendEmailConfig.class);
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("recipient_email", cfg.recipientEmail());
        arguments.put("subject", cfg.subject());
        arguments.put("body", cfg.body());
        return invoke(ctx, TOOL, arguments, cfg.contextKey());
    }

    @Override
    protected Map<String, Object> extraContext(String toolName, Map<String, Object> arguments) {
        return emailFacts(arguments);
    }

    // Remembered so a reminder can be sent to the same recipient later
    static Map<String, Object> emailFacts(Map<String, Object> arguments) {
        Object recipient = arguments.get("recipient_email");
        if (recipient == null || recipient.toString().isBlank()) return Map.of();
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("email_sent_to", recipient.toString());
        if (arguments.get("subject") != null) {
            facts.put("original_email_subject", arguments.get("subject").toString());
        }
        return facts;
    }
}

@Component
class ScheduleMeetingExecutor extends ToolStepExecutor {

    static final String TOOL = "create_calendar_event";

    ScheduleMeetingExecutor(ToolExecutionService toolExecutionService, ContextResolver resolver, StepConfigMapper configMapper) {
        super(toolExecutionService, resolver, configMapper);
    }

    @Override public StepType supportedType() { return StepType.SCHEDULE_MEETING; }

    @Override
    public StepOutcome execute(StepExecutionContext ctx) {
        ScheduleMeetingConfig cfg = configMapper.read(ctx.step(), ScheduleMeetingConfig.class);
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("title", cfg.title());
        arguments.put("start_datetime", cfg.startDatetime());
        arguments.put("end_datetime", cfg.endDatetime());
        arguments.put("attendee_email", cfg.attendeeEmail());
        if (cfg.description() != null) {
            arguments.put("description", cfg.description());
        }
        return invoke(ctx, TOOL, arguments, cfg.contextKey());
    }
}
