package com.proflow.proflow_backend.store;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.dto.WorkflowMetrics;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.repository.WorkflowRepository;
import com.proflow.proflow_backend.repository.WorkflowStepRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable state of workflows and their steps. This is the only component that
 * writes either table; every status change goes through a conditional update so
 * concurrent passes, resumes, monitors and cancellations cannot overwrite each other.
 */
@Slf4j
@Component
public class WorkflowStore {

    public static final String RESPONSE_DATA = "response_data";
    public static final String RESPONSE_RECEIVED_AT = "response_received_at";
    public static final String RESPONSE_HISTORY = "response_history";
    public static final String WAITING_FLAG_PREFIX = "waiting_for_";

    private static final EnumSet<StepStatus> RUNNABLE_STEPS = EnumSet.of(StepStatus.PENDING, StepStatus.RUNNING);
    private static final EnumSet<WorkflowStatus> ACTIVE = EnumSet.of(
            WorkflowStatus.PENDING, WorkflowStatus.RUNNING, WorkflowStatus.WAITING);

    private final WorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;
    private final StepConfigMapper configMapper;
    private final ProflowProperties properties;
    private final Clock clock;

    public WorkflowStore(WorkflowRepository workflowRepository,
                         WorkflowStepRepository stepRepository,
                         StepConfigMapper configMapper,
                         ProflowProperties properties,
                         Clock clock) {
        this.workflowRepository = workflowRepository;
        this.stepRepository = stepRepository;
        this.configMapper = configMapper;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Creation & reads ──────────────────────────────────────────────────────

    /** Persists the workflow and all of its steps in PENDING, atomically. */
    @Transactional
    public Workflow create(Workflow workflow, List<StepDescriptor> steps) {
        Instant now = clock.instant();
        workflow.setStatus(WorkflowStatus.PENDING);
        workflow.setCreatedAt(now);
        workflow.setUpdatedAt(now);
        Workflow saved = workflowRepository.save(workflow);

        List<WorkflowStep> rows = new ArrayList<>(steps.size());
        for (StepDescriptor descriptor : steps) {
            WorkflowStep step = new WorkflowStep();
            step.setWorkflowId(saved.getId());
            step.setStepNumber(descriptor.stepNumber());
            step.setName(descriptor.name());
            step.setStepType(descriptor.stepType());
            step.setConfig(configMapper.toMap(descriptor.config()));
            step.setStatus(StepStatus.PENDING);
            rows.add(step);
        }
        stepRepository.saveAll(rows);
        log.info("[Store] Created workflow {} ({}) with {} steps for user {}",
                saved.getId(), saved.getWorkflowType(), rows.size(), saved.getUserId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Workflow> find(UUID workflowId) {
        return workflowRepository.findById(workflowId);
    }

    @Transactional(readOnly = true)
    public Optional<Workflow> findOwned(UUID workflowId, String userId) {
        return workflowRepository.findByIdAndUserId(workflowId, userId);
    }

    @Transactional(readOnly = true)
    public List<WorkflowStep> steps(UUID workflowId) {
        return stepRepository.findByWorkflowIdOrderByStepNumberAsc(workflowId);
    }

    @Transactional(readOnly = true)
    public List<WorkflowStep> completedSteps(UUID workflowId) {
        return stepRepository.findByWorkflowIdAndStatusOrderByStepNumberAsc(workflowId, StepStatus.COMPLETED);
    }

    @Transactional(readOnly = true)
    public List<Workflow> list(String userId, WorkflowStatus status, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        return status == null
                ? workflowRepository.findByUserIdOrderByCreatedAtDesc(userId, page)
                : workflowRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, page);
    }

    // ── Claims ────────────────────────────────────────────────────────────────

    /**
     * PENDING → RUNNING, or takes over a RUNNING row whose lease has lapsed.
     *
     * @return the run token of the new pass, empty when another pass owns the row
     *         or the workflow is in any other state
     */
    @Transactional
    public Optional<UUID> claimForRun(UUID workflowId) {
        Instant now = clock.instant();
        UUID token = UUID.randomUUID();
        int updated = workflowRepository.claimForRun(workflowId, token, leaseFrom(now), now,
                WorkflowStatus.PENDING, WorkflowStatus.RUNNING);
        return updated == 1 ? Optional.of(token) : Optional.empty();
    }

    /**
     * WAITING → RUNNING, clearing timeout_at and recording the response in the
     * context within the same transaction.
     */
    @Transactional
    public Optional<UUID> claimForResume(UUID workflowId, Map<String, Object> responseData) {
        Instant now = clock.instant();
        UUID token = UUID.randomUUID();
        int updated = workflowRepository.claimForResume(workflowId, token, leaseFrom(now), now,
                WorkflowStatus.WAITING, WorkflowStatus.RUNNING);
        if (updated != 1) {
            return Optional.empty();
        }
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> new IllegalStateException("Workflow vanished while resuming: " + workflowId));
        Map<String, Object> context = new HashMap<>(workflow.getContext() != null ? workflow.getContext() : Map.of());
        Map<String, Object> data = responseData != null ? responseData : Map.of();

        context.replaceAll((key, value) -> key.startsWith(WAITING_FLAG_PREFIX) ? Boolean.FALSE : value);
        context.put(RESPONSE_DATA, data);
        context.put(RESPONSE_RECEIVED_AT, now.toString());
        List<Object> history = new ArrayList<>();
        if (context.get(RESPONSE_HISTORY) instanceof List<?> previous) {
            history.addAll(previous);
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("data", data);
        entry.put("received_at", now.toString());
        history.add(entry);
        context.put(RESPONSE_HISTORY, history);

        workflow.setContext(context);
        workflowRepository.saveAndFlush(workflow);
        return Optional.of(token);
    }

    /**
     * Extends the pass's lease. False means the pass no longer owns the workflow:
     * it was cancelled, or its lease lapsed and another pass took over.
     */
    @Transactional
    public boolean renewLease(UUID workflowId, UUID token) {
        return workflowRepository.renewLease(workflowId, token, leaseFrom(clock.instant()), WorkflowStatus.RUNNING) == 1;
    }

    @Transactional
    public void releaseLease(UUID workflowId, UUID token) {
        workflowRepository.releaseLease(workflowId, token, clock.instant(), WorkflowStatus.RUNNING);
    }

    // ── Steps ─────────────────────────────────────────────────────────────────

    /** Lowest-numbered PENDING step, or a RUNNING one abandoned by a crashed pass. */
    @Transactional(readOnly = true)
    public Optional<WorkflowStep> nextRunnableStep(UUID workflowId) {
        return stepRepository.findFirstByWorkflowIdAndStatusInOrderByStepNumberAsc(workflowId, RUNNABLE_STEPS);
    }

    @Transactional
    public WorkflowStep startStep(UUID stepId) {
        WorkflowStep step = loadStep(stepId);
        if (step.getStatus() == StepStatus.RUNNING) {
            log.warn("[Store] Step {} ({}) was left RUNNING by an earlier pass; executing it again",
                    step.getStepNumber(), step.getName());
        }
        step.setStatus(StepStatus.RUNNING);
        step.setStartedAt(clock.instant());
        step.setErrorMessage(null);
        return stepRepository.save(step);
    }

    /**
     * Records the finished step and, while the pass still owns the workflow, merges its
     * context updates. The step row is written even when the workflow was cancelled
     * while the step ran; it is left alone once another pass has taken the workflow over.
     *
     * @return false when the pass no longer owns the workflow and must stop
     */
    @Transactional
    public boolean completeStep(UUID workflowId, UUID token, UUID stepId,
                                Map<String, Object> output, Map<String, Object> contextUpdates) {
        Workflow workflow = workflowRepository.findById(workflowId).orElse(null);
        WorkflowStep step = loadStep(stepId);
        if (mayRecord(workflow, token, step)) {
            step.setStatus(StepStatus.COMPLETED);
            step.setOutputData(output != null ? output : Map.of());
            step.setCompletedAt(clock.instant());
            stepRepository.save(step);
        } else {
            log.warn("[Store] Step {} ({}) of workflow {} was taken over by another pass; result not recorded",
                    step.getStepNumber(), step.getName(), workflowId);
        }
        if (!ownedBy(workflow, token)) {
            return false;
        }
        if (contextUpdates != null && !contextUpdates.isEmpty()) {
            Map<String, Object> context = new HashMap<>(workflow.getContext() != null ? workflow.getContext() : Map.of());
            context.putAll(contextUpdates);
            workflow.setContext(context);
            workflowRepository.saveAndFlush(workflow);
        }
        return true;
    }

    /**
     * Marks the step FAILED and, while the pass still owns it, the workflow FAILED with a
     * message naming the step. The step row follows the same rule as {@link #completeStep}.
     */
    @Transactional
    public boolean failStep(UUID workflowId, UUID token, UUID stepId, String error) {
        Workflow workflow = workflowRepository.findById(workflowId).orElse(null);
        WorkflowStep step = loadStep(stepId);
        if (mayRecord(workflow, token, step)) {
            step.setStatus(StepStatus.FAILED);
            step.setErrorMessage(error);
            step.setCompletedAt(clock.instant());
            stepRepository.saveAndFlush(step);
        } else {
            log.warn("[Store] Step {} ({}) of workflow {} was taken over by another pass; failure not recorded",
                    step.getStepNumber(), step.getName(), workflowId);
        }
        if (!ownedBy(workflow, token)) {
            return false;
        }
        String message = "Step " + step.getStepNumber() + " (" + step.getName() + ") failed: " + error;
        return finish(workflowId, token, WorkflowStatus.FAILED, message);
    }

    // ── Workflow transitions owned by a pass ──────────────────────────────────

    @Transactional
    public boolean completeWorkflow(UUID workflowId, UUID token) {
        return finish(workflowId, token, WorkflowStatus.COMPLETED, null);
    }

    @Transactional
    public boolean failWorkflow(UUID workflowId, UUID token, String error) {
        return finish(workflowId, token, WorkflowStatus.FAILED, error);
    }

    @Transactional
    public boolean suspendWorkflow(UUID workflowId, UUID token, Instant timeoutAt) {
        return workflowRepository.suspend(workflowId, token, timeoutAt, clock.instant(),
                WorkflowStatus.RUNNING, WorkflowStatus.WAITING) == 1;
    }

    // ── Transitions from outside a pass ───────────────────────────────────────

    /** Any non-terminal state → CANCELLED. A running pass notices before its next step. */
    @Transactional
    public boolean cancel(UUID workflowId) {
        return workflowRepository.cancel(workflowId, clock.instant(), WorkflowStatus.CANCELLED, ACTIVE) == 1;
    }

    /**
     * → FAILED when every attempt to run the workflow broke down. Only a row that
     * {@link #claimForRun} could take is affected: PENDING, or RUNNING without a live lease.
     */
    @Transactional
    public boolean abandon(UUID workflowId, String error) {
        return workflowRepository.abandon(workflowId, error, clock.instant(), WorkflowStatus.FAILED,
                WorkflowStatus.PENDING, WorkflowStatus.RUNNING) == 1;
    }

    @Transactional(readOnly = true)
    public List<Workflow> findTimedOut(Instant now) {
        return workflowRepository.findByStatusAndTimeoutAtBefore(WorkflowStatus.WAITING, now);
    }

    /** Spends one reminder: retry_count + 1 and a new deadline. Guarded by the timed-out predicate. */
    @Transactional
    public boolean extendTimeout(UUID workflowId, Instant now, Instant newTimeout) {
        return workflowRepository.extendTimeout(workflowId, newTimeout, now, WorkflowStatus.WAITING) == 1;
    }

    /** WAITING → FAILED once the reminder budget is spent. Step rows are left as they are. */
    @Transactional
    public boolean failTimedOut(UUID workflowId, Instant now, String error) {
        return workflowRepository.failTimedOut(workflowId, error, now,
                WorkflowStatus.WAITING, WorkflowStatus.FAILED) == 1;
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpired(Instant cutoff) {
        return workflowRepository.findIdsCompletedBefore(WorkflowStatus.TERMINAL, cutoff);
    }

    /** Deletes a terminal workflow and its steps. Non-terminal rows are never touched. */
    @Transactional
    public boolean purge(UUID workflowId) {
        Optional<Workflow> workflow = workflowRepository.findById(workflowId);
        if (workflow.isEmpty() || !workflow.get().getStatus().isTerminal()) {
            return false;
        }
        int steps = stepRepository.deleteByWorkflowId(workflowId);
        int rows = workflowRepository.deleteTerminal(workflowId, WorkflowStatus.TERMINAL);
        log.debug("[Store] Purged workflow {} ({} steps)", workflowId, steps);
        return rows == 1;
    }

    @Transactional(readOnly = true)
    public List<UUID> findStale(Instant now) {
        Instant pendingCutoff = now.minus(properties.getWorkflow().getLeaseDuration());
        return workflowRepository.findStaleIds(WorkflowStatus.RUNNING, WorkflowStatus.PENDING, now, pendingCutoff);
    }

    @Transactional(readOnly = true)
    public WorkflowMetrics metrics() {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(24));
        Map<String, Long> counts = new LinkedHashMap<>();
        for (WorkflowStatus status : WorkflowStatus.values()) {
            counts.put(status.apiValue(), workflowRepository.countByStatus(status));
        }
        return new WorkflowMetrics(counts,
                workflowRepository.countByCreatedAtAfter(since),
                workflowRepository.countByCompletedAtAfter(since),
                now);
    }

    // ─────────────────────────────────────────────────────────────────────────

    private boolean finish(UUID workflowId, UUID token, WorkflowStatus target, String error) {
        return workflowRepository.finish(workflowId, token, target, error, clock.instant(), WorkflowStatus.RUNNING) == 1;
    }

    private static boolean ownedBy(Workflow workflow, UUID token) {
        return workflow != null
                && workflow.getStatus() == WorkflowStatus.RUNNING
                && token.equals(workflow.getRunToken());
    }

    // The step is still the one this pass started, and no other pass has claimed the workflow since
    private static boolean mayRecord(Workflow workflow, UUID token, WorkflowStep step) {
        if (step.getStatus() != StepStatus.RUNNING) {
            return false;
        }
        return workflow == null
                || workflow.getStatus() != WorkflowStatus.RUNNING
                || token.equals(workflow.getRunToken());
    }

    private WorkflowStep loadStep(UUID stepId) {
        return stepRepository.findById(stepId)
                .orElseThrow(() -> new IllegalStateException("Workflow step not found: " + stepId));
    }

    private Instant leaseFrom(Instant now) {
        return now.plus(properties.getWorkflow().getLeaseDuration());
    }
}
