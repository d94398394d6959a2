package com.proflow.proflow_backend.store;

import com.proflow.proflow_backend.engine.WorkflowEventPublisher;
import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.dto.WorkflowMetrics;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;
import com.proflow.proflow_backend.support.TestClock;
import com.proflow.proflow_backend.support.WorkflowEngineTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Conditional transitions of {@link WorkflowStore} against H2.
 */
@DataJpaTest
@Import(WorkflowEngineTestConfig.class)
class WorkflowStoreTest {

    private static final String USER = "user-1";

    @Autowired
    private WorkflowStore store;

    @Autowired
    private TestClock clock;

    @MockBean
    private WorkflowEventPublisher eventPublisher;

    @BeforeEach
    void resetClock() {
        clock.set(TestClock.START);
    }

    private Workflow newWorkflow(int maxRetries) {
        Workflow workflow = new Workflow();
        workflow.setUserId(USER);
        workflow.setWorkflowType("test");
        workflow.setName("Test workflow");
        workflow.setInputData(Map.of("user_request", "do it"));
        workflow.setMaxRetries(maxRetries);
        return store.create(workflow, List.of(
                new StepDescriptor(1, "Lookup", StepType.TOOL_CALL, ToolCallConfig.of("search_contacts", Map.of(), null)),
                new StepDescriptor(2, "Wait", StepType.WAIT_FOR_RESPONSE, WaitForResponseConfig.of(24, List.of("email_reply")))));
    }

    /** Puts the workflow into WAITING with the given deadline. */
    private UUID waitingWorkflow(int maxRetries, Instant deadline) {
        UUID id = newWorkflow(maxRetries).getId();
        UUID token = store.claimForRun(id).orElseThrow();
        assertThat(store.suspendWorkflow(id, token, deadline)).isTrue();
        return id;
    }

    private Workflow reload(UUID id) {
        return store.find(id).orElseThrow();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("persists the workflow and every step as PENDING in order")
        void persistsStepsInOrder() {
            Workflow workflow = newWorkflow(3);

            List<WorkflowStep> steps = store.steps(workflow.getId());
            assertThat(reload(workflow.getId()).getStatus()).isEqualTo(WorkflowStatus.PENDING);
            assertThat(steps).extracting(WorkflowStep::getStepNumber).containsExactly(1, 2);
            assertThat(steps).allMatch(s -> s.getStatus() == StepStatus.PENDING);
            assertThat(steps.get(0).getConfig()).containsEntry("tool_name", "search_contacts");
        }
    }

    @Nested
    @DisplayName("claims")
    class Claims {

        @Test
        @DisplayName("only the first run claim on a PENDING workflow succeeds")
        void secondRunClaimFails() {
            UUID id = newWorkflow(3).getId();

            Optional<UUID> first = store.claimForRun(id);
            Optional<UUID> second = store.claimForRun(id);

            assertThat(first).isPresent();
            assertThat(second).isEmpty();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(reload(id).getRunToken()).isEqualTo(first.get());
        }

        @Test
        @DisplayName("a RUNNING workflow whose lease lapsed can be taken over")
        void expiredLeaseCanBeTakenOver() {
            UUID id = newWorkflow(3).getId();
            UUID first = store.claimForRun(id).orElseThrow();

            clock.advance(Duration.ofMinutes(6));
            UUID second = store.claimForRun(id).orElseThrow();

            assertThat(second).isNotEqualTo(first);
            assertThat(store.renewLease(id, first)).isFalse();
            assertThat(store.renewLease(id, second)).isTrue();
        }

        @Test
        @DisplayName("released lease lets the next claim in immediately")
        void releasedLeaseIsClaimable() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();

            store.releaseLease(id, token);
            clock.advance(Duration.ofSeconds(1));

            assertThat(store.claimForRun(id)).isPresent();
        }

        @Test
        @DisplayName("resume of a workflow that is not WAITING is refused")
        void resumeRequiresWaiting() {
            UUID id = newWorkflow(3).getId();

            assertThat(store.claimForResume(id, Map.of("reply", "yes"))).isEmpty();
            assertThat(reload(id).getContext()).doesNotContainKey(WorkflowStore.RESPONSE_DATA);
        }

        @Test
        @DisplayName("resume records the response, clears waiting flags and the deadline")
        @SuppressWarnings("unchecked")
        void resumeMergesResponse() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();
            WorkflowStep first = store.nextRunnableStep(id).orElseThrow();
            store.completeStep(id, token, first.getId(), Map.of(), Map.of("waiting_for_email_response", true));
            store.suspendWorkflow(id, token, clock.instant().plus(Duration.ofHours(24)));

            Optional<UUID> resumed = store.claimForResume(id, Map.of("time_selection", "Tuesday 10:00"));
            Optional<UUID> duplicate = store.claimForResume(id, Map.of("time_selection", "Tuesday 10:00"));

            assertThat(resumed).isPresent();
            assertThat(duplicate).isEmpty();
            Workflow workflow = reload(id);
            assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(workflow.getTimeoutAt()).isNull();
            assertThat(workflow.getContext())
                    .containsEntry("waiting_for_email_response", false)
                    .containsEntry(WorkflowStore.RESPONSE_DATA, Map.of("time_selection", "Tuesday 10:00"))
                    .containsEntry(WorkflowStore.RESPONSE_RECEIVED_AT, TestClock.START.toString());
            assertThat((List<Object>) workflow.getContext().get(WorkflowStore.RESPONSE_HISTORY)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("steps")
    class Steps {

        @Test
        @DisplayName("a pass that lost its lease cannot complete a step")
        void completeStepRequiresOwnership() {
            UUID id = newWorkflow(3).getId();
            store.claimForRun(id).orElseThrow();
            WorkflowStep step = store.startStep(store.nextRunnableStep(id).orElseThrow().getId());

            boolean completed = store.completeStep(id, UUID.randomUUID(), step.getId(), Map.of("x", 1), Map.of("k", "v"));

            assertThat(completed).isFalse();
            assertThat(store.steps(id).get(0).getStatus()).isEqualTo(StepStatus.RUNNING);
            assertThat(reload(id).getContext()).doesNotContainKey("k");
        }

        @Test
        @DisplayName("a step finishing after a cancellation is recorded but its context is not merged")
        void completeStepAfterCancel() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();
            WorkflowStep step = store.startStep(store.nextRunnableStep(id).orElseThrow().getId());
            store.cancel(id);

            boolean owned = store.completeStep(id, token, step.getId(), Map.of("contacts", 2), Map.of("k", "v"));

            assertThat(owned).isFalse();
            WorkflowStep recorded = store.steps(id).get(0);
            assertThat(recorded.getStatus()).isEqualTo(StepStatus.COMPLETED);
            assertThat(recorded.getOutputData()).containsEntry("contacts", 2);
            assertThat(recorded.getCompletedAt()).isEqualTo(TestClock.START);
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(reload(id).getContext()).doesNotContainKey("k");
        }

        @Test
        @DisplayName("a pass whose workflow was taken over cannot overwrite the step or fail the workflow")
        void failStepAfterTakeover() {
            UUID id = newWorkflow(3).getId();
            UUID stale = store.claimForRun(id).orElseThrow();
            UUID stepId = store.startStep(store.nextRunnableStep(id).orElseThrow().getId()).getId();
            clock.advance(Duration.ofMinutes(6));
            UUID current = store.claimForRun(id).orElseThrow();
            store.startStep(stepId);
            store.completeStep(id, current, stepId, Map.of("contacts", 1), Map.of());

            boolean failed = store.failStep(id, stale, stepId, "late timeout");

            assertThat(failed).isFalse();
            WorkflowStep step = store.steps(id).get(0);
            assertThat(step.getStatus()).isEqualTo(StepStatus.COMPLETED);
            assertThat(step.getErrorMessage()).isNull();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(reload(id).getRunToken()).isEqualTo(current);
        }

        @Test
        @DisplayName("a failed step fails the workflow with a message naming the step")
        void failStepFailsWorkflow() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();
            WorkflowStep step = store.startStep(store.nextRunnableStep(id).orElseThrow().getId());

            assertThat(store.failStep(id, token, step.getId(), "gateway down")).isTrue();

            Workflow workflow = reload(id);
            assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(workflow.getErrorMessage()).isEqualTo("Step 1 (Lookup) failed: gateway down");
            assertThat(workflow.getCompletedAt()).isEqualTo(TestClock.START);
            assertThat(store.steps(id).get(0).getErrorMessage()).isEqualTo("gateway down");
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("cancels an active workflow once and keeps it terminal")
        void cancelIsTerminal() {
            UUID id = newWorkflow(3).getId();

            assertThat(store.cancel(id)).isTrue();
            assertThat(store.cancel(id)).isFalse();
            assertThat(store.claimForRun(id)).isEmpty();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
        }

        @Test
        @DisplayName("a cancelled workflow stops the running pass at its next lease renewal")
        void cancelRevokesLease() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();

            store.cancel(id);

            assertThat(store.renewLease(id, token)).isFalse();
            assertThat(store.completeWorkflow(id, token)).isFalse();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.CANCELLED);
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        @DisplayName("extendTimeout spends one reminder and moves the deadline")
        void extendTimeoutSpendsReminder() {
            UUID id = waitingWorkflow(3, TestClock.START.plus(Duration.ofHours(1)));
            clock.advance(Duration.ofHours(2));
            Instant newDeadline = clock.instant().plus(Duration.ofHours(24));

            assertThat(store.findTimedOut(clock.instant())).extracting(Workflow::getId).containsExactly(id);
            assertThat(store.extendTimeout(id, clock.instant(), newDeadline)).isTrue();
            assertThat(store.extendTimeout(id, clock.instant(), newDeadline)).isFalse();

            Workflow workflow = reload(id);
            assertThat(workflow.getRetryCount()).isEqualTo(1);
            assertThat(workflow.getTimeoutAt()).isEqualTo(newDeadline);
            assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.WAITING);
        }

        @Test
        @DisplayName("failTimedOut only applies once the reminder budget is spent")
        void failTimedOutRequiresSpentBudget() {
            UUID withBudget = waitingWorkflow(1, TestClock.START.plus(Duration.ofHours(1)));
            UUID spent = waitingWorkflow(0, TestClock.START.plus(Duration.ofHours(1)));
            clock.advance(Duration.ofHours(2));

            assertThat(store.failTimedOut(withBudget, clock.instant(), "timed out")).isFalse();
            assertThat(store.failTimedOut(spent, clock.instant(), "timed out")).isTrue();

            assertThat(reload(withBudget).getStatus()).isEqualTo(WorkflowStatus.WAITING);
            Workflow failed = reload(spent);
            assertThat(failed.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(failed.getErrorMessage()).isEqualTo("timed out");
            assertThat(failed.getTimeoutAt()).isNull();
        }

        @Test
        @DisplayName("a workflow that is not yet due is left alone")
        void notDueIsUntouched() {
            UUID id = waitingWorkflow(0, TestClock.START.plus(Duration.ofHours(24)));

            assertThat(store.findTimedOut(clock.instant())).isEmpty();
            assertThat(store.failTimedOut(id, clock.instant(), "timed out")).isFalse();
        }
    }

    @Nested
    @DisplayName("retention and recovery")
    class RetentionAndRecovery {

        @Test
        @DisplayName("purges terminal workflows with their steps and never active ones")
        void purgeOnlyTerminal() {
            UUID done = newWorkflow(3).getId();
            store.cancel(done);
            UUID active = newWorkflow(3).getId();

            clock.advance(Duration.ofDays(31));
            List<UUID> expired = store.findExpired(clock.instant().minus(Duration.ofDays(30)));

            assertThat(expired).containsExactly(done);
            assertThat(store.purge(done)).isTrue();
            assertThat(store.purge(active)).isFalse();
            assertThat(store.find(done)).isEmpty();
            assertThat(store.steps(done)).isEmpty();
            assertThat(store.find(active)).isPresent();
        }

        @Test
        @DisplayName("finds RUNNING rows with a lapsed lease and PENDING rows never dispatched")
        void findsStaleWorkflows() {
            UUID pending = newWorkflow(3).getId();
            UUID running = newWorkflow(3).getId();
            store.claimForRun(running).orElseThrow();
            UUID waiting = waitingWorkflow(3, TestClock.START.plus(Duration.ofHours(24)));

            assertThat(store.findStale(clock.instant())).isEmpty();

            clock.advance(Duration.ofMinutes(10));
            assertThat(store.findStale(clock.instant())).containsExactlyInAnyOrder(pending, running);
            assertThat(store.findStale(clock.instant())).doesNotContain(waiting);
        }

        @Test
        @DisplayName("abandon leaves a RUNNING workflow with a live lease alone")
        void abandonRespectsLiveLease() {
            UUID id = newWorkflow(3).getId();
            UUID token = store.claimForRun(id).orElseThrow();

            assertThat(store.abandon(id, "Workflow execution failed: db down")).isFalse();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.RUNNING);

            clock.advance(Duration.ofMinutes(6));
            assertThat(store.renewLease(id, token)).isTrue();
            assertThat(store.abandon(id, "Workflow execution failed: db down")).isFalse();

            clock.advance(Duration.ofMinutes(6));
            assertThat(store.abandon(id, "Workflow execution failed: db down")).isTrue();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.FAILED);
        }

        @Test
        @DisplayName("abandon fails a workflow that could not be run at all")
        void abandonFailsClaimable() {
            UUID id = newWorkflow(3).getId();

            assertThat(store.abandon(id, "Workflow execution failed: db down")).isTrue();
            assertThat(reload(id).getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(store.abandon(id, "again")).isFalse();
        }
    }

    @Test
    @DisplayName("metrics counts workflows by status")
    void metricsCountsByStatus() {
        newWorkflow(3);
        UUID cancelled = newWorkflow(3).getId();
        store.cancel(cancelled);

        WorkflowMetrics metrics = store.metrics();

        assertThat(metrics.statusCounts()).containsEntry("pending", 1L).containsEntry("cancelled", 1L);
        assertThat(metrics.createdLast24h()).isEqualTo(2L);
        assertThat(metrics.completedLast24h()).isEqualTo(1L);
    }
}
