package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ContextResolverTest {

    private static final UUID WORKFLOW_ID = UUID.fromString("00000000-0000-0000-0000-000000000007");

    private final ContextResolver resolver = new ContextResolver();

    private static WorkflowStep step(int number, Map<String, Object> output) {
        WorkflowStep step = new WorkflowStep();
        step.setWorkflowId(WORKFLOW_ID);
        step.setStepNumber(number);
        step.setName("Step " + number);
        step.setStepType(StepType.TOOL_CALL);
        step.setStatus(output != null ? StepStatus.COMPLETED : StepStatus.RUNNING);
        step.setOutputData(output);
        return step;
    }

    private final StepExecutionContext ctx = new StepExecutionContext(
            WORKFLOW_ID,
            "user-9",
            step(3, null),
            Map.of("contact_name", "Bob Smith", "duration", 30),
            Map.of("selected_contact", Map.of("email", "bob@acme.com"),
                   "contact_search", Map.of("results", List.of(Map.of("email", "first@acme.com")))),
            List.of(step(2, Map.of("structured", Map.of("subject", "Hello", "body", "Hi Bob")))));

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("substitutes references from every root")
        void substitutesAllRoots() {
            String text = resolver.resolve(
                    "{{input.contact_name}} <{{context.selected_contact.email}}>: {{steps.2.structured.subject}} "
                    + "({{meta.userId}} step {{meta.stepNumber}})", ctx);

            assertThat(text).isEqualTo("Bob Smith <bob@acme.com>: Hello (user-9 step 3)");
        }

        @Test
        @DisplayName("unresolved references become empty text")
        void unresolvedBecomesEmpty() {
            assertThat(resolver.resolve("Note: {{input.custom_message}}.", ctx)).isEqualTo("Note: .");
            assertThat(resolver.resolve("{{steps.9.subject}}", ctx)).isEmpty();
        }

        @Test
        @DisplayName("text without references is returned unchanged")
        void plainText() {
            assertThat(resolver.resolve("no refs here", ctx)).isEqualTo("no refs here");
            assertThat(resolver.resolve(null, ctx)).isNull();
        }
    }

    @Nested
    @DisplayName("resolveValue")
    class ResolveValue {

        @Test
        @DisplayName("a lone reference keeps the referenced type")
        void loneReferenceKeepsType() {
            assertThat(resolver.resolveValue("{{input.duration}}", ctx)).isEqualTo(30);
            assertThat(resolver.resolveValue("{{context.selected_contact}}", ctx))
                    .isEqualTo(Map.of("email", "bob@acme.com"));
        }

        @Test
        @DisplayName("list indexes and the output prefix address nested values")
        void listIndexesAndOutputPrefix() {
            assertThat(resolver.resolveValue("{{context.contact_search.results.0.email}}", ctx)).isEqualTo("first@acme.com");
            assertThat(resolver.resolveValue("{{steps.2.output.structured.body}}", ctx)).isEqualTo("Hi Bob");
            assertThat(resolver.resolveValue("{{context.contact_search.results.5.email}}", ctx)).isNull();
        }

        @Test
        @DisplayName("maps and lists are resolved recursively")
        void recursive() {
            Map<String, Object> resolved = resolver.resolveMap(Map.of(
                    "to", List.of("{{context.selected_contact.email}}"),
                    "meta", Map.of("workflow", "{{meta.workflowId}}"),
                    "limit", 5), ctx);

            assertThat(resolved)
                    .containsEntry("to", List.of("bob@acme.com"))
                    .containsEntry("meta", Map.of("workflow", WORKFLOW_ID.toString()))
                    .containsEntry("limit", 5);
        }
    }
}
