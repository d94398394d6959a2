package com.proflow.proflow_backend.engine;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.executor.StepExecutionContext;
import com.proflow.proflow_backend.executor.StepExecutorRegistry;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a workflow through its steps in order until it completes, fails, or suspends
 * on a wait step. All state is re-read from the store before each step; nothing
 * about a workflow is kept in memory between passes.
 */
@Slf4j
@Service
public class WorkflowExecutionEngine {

    private final WorkflowStore store;
    private final StepExecutorRegistry executorRegistry;
    private final WorkflowEventPublisher eventPublisher;
    private final ProflowProperties properties;

    public WorkflowExecutionEngine(WorkflowStore store,
                                   StepExecutorRegistry executorRegistry,
                                   WorkflowEventPublisher eventPublisher,
                                   ProflowProperties properties) {
        this.store = store;
        this.executorRegistry = executorRegistry;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /** Starts a PENDING workflow, or takes over a RUNNING one whose pass died. */
    public DriverResult runWorkflow(UUID workflowId) {
        Optional<UUID> token = store.claimForRun(workflowId);
        if (token.isEmpty()) {
            log.info("[Driver] Workflow {} not claimable for run ({}); skipping", workflowId, currentStatus(workflowId));
            return DriverResult.notClaimed(workflowId, currentStatus(workflowId));
        }
        log.info("[Driver] Workflow {} claimed for run", workflowId);
        eventPublisher.workflowStatus(workflowId, WorkflowStatus.RUNNING, "Workflow started");
        return drive(workflowId, token.get());
    }

    /**
     * Continues a WAITING workflow with the external response. Only the first of several
     * concurrent or repeated resumes wins; the rest are no-ops.
     */
    public DriverResult resumeWorkflow(UUID workflowId, Map<String, Object> responseData) {
        Optional<UUID> token = store.claimForResume(workflowId, responseData);
        if (token.isEmpty()) {
            log.info("[Driver] Workflow {} not waiting ({}); resume ignored", workflowId, currentStatus(workflowId));
            return DriverResult.notClaimed(workflowId, currentStatus(workflowId));
        }
        log.info("[Driver] Workflow {} resumed with response", workflowId);
        eventPublisher.workflowStatus(workflowId, WorkflowStatus.RUNNING, "Workflow resumed");
        return drive(workflowId, token.get());
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    private DriverResult drive(UUID workflowId, UUID token) {
        int maxIterations = properties.getWorkflow().getMaxIterationsPerPass();
        try {
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                // Cancellation and lost leases are observed here, before every step
                if (!store.renewLease(workflowId, token)) {
                    WorkflowStatus status = currentStatus(workflowId);
                    log.info("[Driver] Workflow {} no longer owned by this pass ({}); stopping", workflowId, status);
                    return new DriverResult(workflowId, status, true);
                }
                Workflow workflow = store.find(workflowId)
                        .orElseThrow(() -> new IllegalStateException("Workflow disappeared during run: " + workflowId));

                Optional<WorkflowStep> next = store.nextRunnableStep(workflowId);
                if (next.isEmpty()) {
                    return complete(workflowId, token);
                }

                WorkflowStep step = store.startStep(next.get().getId());
                eventPublisher.stepStarted(workflowId, step.getStepNumber(), step.getName());
                StepOutcome outcome = runStep(workflow, step);

                if (!outcome.success()) {
                    return fail(workflowId, token, step, outcome.error());
                }
                if (outcome.suspend() && outcome.resumeDeadline() == null) {
                    return fail(workflowId, token, step, "Suspending step did not provide a resume deadline");
                }
                boolean stillOwned = store.completeStep(workflowId, token, step.getId(),
                        outcome.output(), outcome.contextUpdates());
                eventPublisher.stepCompleted(workflowId, step.getStepNumber(), step.getName());
                if (!stillOwned) {
                    WorkflowStatus status = currentStatus(workflowId);
                    log.info("[Driver] Workflow {} changed to {} while step {} ran; stopping after it",
                            workflowId, status, step.getStepNumber());
                    return new DriverResult(workflowId, status, true);
                }

                if (outcome.suspend()) {
                    return suspend(workflowId, token, step, outcome);
                }
            }

            String error = "Workflow exceeded maximum of " + maxIterations + " steps in one pass";
            log.warn("[Driver] {}: {}", workflowId, error);
            store.failWorkflow(workflowId, token, error);
            eventPublisher.workflowStatus(workflowId, WorkflowStatus.FAILED, error);
            return new DriverResult(workflowId, currentStatus(workflowId), true);

        } catch (RuntimeException ex) {
            // Infrastructure failure: hand the workflow back so a retry can claim it at once
            log.error("[Driver] Workflow {} pass aborted: {}", workflowId, ex.getMessage());
            releaseQuietly(workflowId, token);
            throw ex;
        }
    }

    private StepOutcome runStep(Workflow workflow, WorkflowStep step) {
        StepExecutionContext ctx = new StepExecutionContext(
                workflow.getId(),
                workflow.getUserId(),
                step,
                workflow.getInputData(),
                workflow.getContext(),
                store.completedSteps(workflow.getId()));
        try {
            StepOutcome outcome = executorRegistry.get(step.getStepType()).execute(ctx);
            return outcome != null ? outcome : StepOutcome.failure("Executor returned no outcome");
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Step {} ({}) of workflow {} threw: {}", step.getStepNumber(), step.getStepType(), workflow.getId(), msg, ex);
            return StepOutcome.failure(msg);
        }
    }

    private DriverResult complete(UUID workflowId, UUID token) {
        if (store.completeWorkflow(workflowId, token)) {
            log.info("[Driver] Workflow {} completed", workflowId);
            eventPublisher.workflowStatus(workflowId, WorkflowStatus.COMPLETED, "Workflow completed");
        }
        return new DriverResult(workflowId, currentStatus(workflowId), true);
    }

    private DriverResult fail(UUID workflowId, UUID token, WorkflowStep step, String error) {
        log.warn("[Driver] Workflow {} step {} ({}) failed: {}", workflowId, step.getStepNumber(), step.getName(), error);
        boolean workflowFailed = store.failStep(workflowId, token, step.getId(), error);
        eventPublisher.stepFailed(workflowId, step.getStepNumber(), step.getName(), error);
        if (workflowFailed) {
            eventPublisher.workflowStatus(workflowId, WorkflowStatus.FAILED, error);
        }
        return new DriverResult(workflowId, currentStatus(workflowId), true);
    }

    private DriverResult suspend(UUID workflowId, UUID token, WorkflowStep step, StepOutcome outcome) {
        if (store.suspendWorkflow(workflowId, token, outcome.resumeDeadline())) {
            log.info("[Driver] Workflow {} waiting after step {} until {}", workflowId, step.getStepNumber(), outcome.resumeDeadline());
            eventPublisher.workflowStatus(workflowId, WorkflowStatus.WAITING, "Waiting for response");
        }
        return new DriverResult(workflowId, currentStatus(workflowId), true);
    }

    private void releaseQuietly(UUID workflowId, UUID token) {
        try {
            store.releaseLease(workflowId, token);
        } catch (RuntimeException releaseError) {
            log.warn("[Driver] Could not release lease of workflow {}: {}", workflowId, releaseError.getMessage());
        }
    }

    private WorkflowStatus currentStatus(UUID workflowId) {
        return store.find(workflowId).map(Workflow::getStatus).orElse(null);
    }
}
