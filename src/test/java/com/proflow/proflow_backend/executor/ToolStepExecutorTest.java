package com.proflow.proflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proflow.proflow_backend.integration.ToolExecutionResult;
import com.proflow.proflow_backend.integration.ToolExecutionService;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.step.ScheduleMeetingConfig;
import com.proflow.proflow_backend.model.step.SendEmailConfig;
import com.proflow.proflow_backend.model.step.StepConfig;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.store.StepConfigMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolStepExecutorTest {

    @Mock
    private ToolExecutionService toolExecutionService;

    private final StepConfigMapper mapper = new StepConfigMapper(new ObjectMapper());
    private final ContextResolver resolver = new ContextResolver();

    private StepExecutionContext contextFor(StepType type, StepConfig config) {
        WorkflowStep step = new WorkflowStep();
        step.setStepNumber(3);
        step.setName("Tool step");
        step.setStepType(type);
        step.setConfig(mapper.toMap(config));
        return new StepExecutionContext(UUID.randomUUID(), "user-1", step,
                Map.of("contact_email", "ann@example.com"), Map.of(), List.of());
    }

    @Nested
    @DisplayName("tool_call")
    class ToolCallStep {

        private ToolCallExecutor executor;

        @BeforeEach
        void setUp() {
            executor = new ToolCallExecutor(toolExecutionService, resolver, mapper);
        }

        @Test
        @DisplayName("resolves arguments, adds user_id and stores the result under the context key")
        void storesResult() {
            when(toolExecutionService.execute(eq("search_email_history"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.ok(List.of(Map.of("subject", "Proposal"))));

            StepOutcome outcome = executor.execute(contextFor(StepType.TOOL_CALL,
                    ToolCallConfig.of("search_email_history", Map.of("contact_email", "{{input.contact_email}}"), "history")));

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.contextUpdates()).containsEntry("history", List.of(Map.of("subject", "Proposal")));
            @SuppressWarnings("unchecked")
            Map<String, Object> arguments = (Map<String, Object>) outcome.output().get("arguments");
            assertThat(arguments)
                    .containsEntry("contact_email", "ann@example.com")
                    .containsEntry("user_id", "user-1");
            assertThat(outcome.output()).containsEntry("tool_name", "search_email_history");
        }

        @Test
        @DisplayName("defaults the context key to step_<n>_result")
        void defaultContextKey() {
            when(toolExecutionService.execute(eq("search_contacts"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.ok("found"));

            StepOutcome outcome = executor.execute(contextFor(StepType.TOOL_CALL,
                    ToolCallConfig.of("search_contacts", Map.of(), null)));

            assertThat(outcome.contextUpdates()).containsEntry("step_3_result", "found");
        }

        @Test
        @DisplayName("a failed tool result is a step failure naming the tool")
        void failedTool() {
            when(toolExecutionService.execute(eq("search_contacts"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.failed("HTTP 503"));

            StepOutcome outcome = executor.execute(contextFor(StepType.TOOL_CALL,
                    ToolCallConfig.of("search_contacts", Map.of(), null)));

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).isEqualTo("Tool 'search_contacts' failed: HTTP 503");
        }

        @Test
        @DisplayName("a send_email tool call remembers the recipient for reminders")
        void sendEmailFacts() {
            when(toolExecutionService.execute(eq("send_email"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.ok(Map.of()));

            StepOutcome outcome = executor.execute(contextFor(StepType.TOOL_CALL,
                    ToolCallConfig.of("send_email", Map.of("recipient_email", "{{input.contact_email}}", "subject", "Hi"), "sent")));

            assertThat(outcome.contextUpdates())
                    .containsEntry("email_sent_to", "ann@example.com")
                    .containsEntry("original_email_subject", "Hi");
        }
    }

    @Nested
    @DisplayName("send_email and schedule_meeting")
    class TypedSteps {

        @Test
        @DisplayName("send_email calls the send_email tool with the typed fields")
        void sendEmail() {
            SendEmailExecutor executor = new SendEmailExecutor(toolExecutionService, resolver, mapper);
            when(toolExecutionService.execute(eq("send_email"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.ok(Map.of("id", "m-1")));

            StepOutcome outcome = executor.execute(contextFor(StepType.SEND_EMAIL,
                    new SendEmailConfig("{{input.contact_email}}", "Update", "Body", null)));

            assertThat(outcome.success()).isTrue();
            verify(toolExecutionService).execute(eq("send_email"),
                    argThat(m -> "ann@example.com".equals(m.get("recipient_email")) && "Update".equals(m.get("subject"))),
                    eq("user-1"));
            assertThat(outcome.contextUpdates()).containsEntry("email_sent_to", "ann@example.com");
        }

        @Test
        @DisplayName("schedule_meeting creates a calendar event")
        void scheduleMeeting() {
            ScheduleMeetingExecutor executor = new ScheduleMeetingExecutor(toolExecutionService, resolver, mapper);
            when(toolExecutionService.execute(eq("create_calendar_event"), anyMap(), eq("user-1")))
                    .thenReturn(ToolExecutionResult.ok(Map.of("event_id", "e-1")));

            StepOutcome outcome = executor.execute(contextFor(StepType.SCHEDULE_MEETING,
                    new ScheduleMeetingConfig("Intro", "2026-03-03T10:00:00Z", "2026-03-03T10:30:00Z",
                            "{{input.contact_email}}", null, "meeting")));

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.contextUpdates()).containsEntry("meeting", Map.of("event_id", "e-1"));
            verify(toolExecutionService).execute(eq("create_calendar_event"),
                    argThat(m -> "ann@example.com".equals(m.get("attendee_email")) && !m.containsKey("description")),
                    eq("user-1"));
        }
    }
}
