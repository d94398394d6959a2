package com.proflow.proflow_backend.dispatch;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.engine.DriverResult;
import com.proflow.proflow_backend.engine.WorkflowExecutionEngine;
import com.proflow.proflow_backend.integration.ReminderDispatcher;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Hands driver invocations and reminders to the workflow task pool. A whole invocation
 * is retried with exponential backoff when it fails on a transient infrastructure error;
 * completed steps are never re-run because the driver resumes from the store.
 */
@Slf4j
@Component
public class WorkflowTaskDispatcher {

    private final TaskExecutor taskExecutor;
    private final WorkflowExecutionEngine engine;
    private final WorkflowStore store;
    private final ReminderDispatcher reminderDispatcher;
    private final ProflowProperties properties;

    public WorkflowTaskDispatcher(@Qualifier("workflowTaskExecutor") TaskExecutor taskExecutor,
                                  WorkflowExecutionEngine engine,
                                  WorkflowStore store,
                                  ReminderDispatcher reminderDispatcher,
                                  ProflowProperties properties) {
        this.taskExecutor = taskExecutor;
        this.engine = engine;
        this.store = store;
        this.reminderDispatcher = reminderDispatcher;
        this.properties = properties;
    }

    // ── Fire-and-forget ──────────────────────────────────────────────────────

    public void dispatchRun(UUID workflowId) {
        submit("run", workflowId, () -> runNow(workflowId));
    }

    public void dispatchResume(UUID workflowId, Map<String, Object> responseData) {
        submit("resume", workflowId, () -> {
            try {
                resumeNow(workflowId, responseData);
            } catch (RuntimeException ex) {
                log.error("[Dispatch] Resume of workflow {} failed: {}", workflowId, ex.getMessage(), ex);
            }
        });
    }

    public void enqueueReminder(UUID workflowId, Map<String, Object> context) {
        submit("reminder", workflowId, () -> {
            try {
                reminderDispatcher.dispatch(workflowId, context);
            } catch (RuntimeException ex) {
                log.error("[Dispatch] Reminder for workflow {} failed: {}", workflowId, ex.getMessage(), ex);
            }
        });
    }

    // ── In the caller's thread ───────────────────────────────────────────────

    /**
     * Runs the workflow with retries. Once the retries are spent the workflow is failed
     * with the cause instead of being left RUNNING.
     */
    public DriverResult runNow(UUID workflowId) {
        ProflowProperties.DispatchConfig cfg = properties.getDispatch();
        try {
            return withRetry("run", workflowId, cfg.getRunRetries(), cfg.getRunInitialBackoff(),
                    () -> engine.runWorkflow(workflowId));
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[Dispatch] Workflow {} run failed permanently: {}", workflowId, msg, ex);
            store.abandon(workflowId, "Workflow execution failed: " + msg);
            return new DriverResult(workflowId, currentStatus(workflowId), false);
        }
    }

    /**
     * Resumes the workflow with retries. A retry that finds the workflow RUNNING continues
     * it through the run claim: the failed attempt had already recorded the response and
     * handed its lease back.
     */
    public DriverResult resumeNow(UUID workflowId, Map<String, Object> responseData) {
        ProflowProperties.DispatchConfig cfg = properties.getDispatch();
        AtomicInteger attempts = new AtomicInteger();
        return withRetry("resume", workflowId, cfg.getResumeRetries(), cfg.getResumeInitialBackoff(), () -> {
            if (attempts.getAndIncrement() > 0 && currentStatus(workflowId) == WorkflowStatus.RUNNING) {
                log.info("[Dispatch] Workflow {} already holds the response; continuing it as a run", workflowId);
                return engine.runWorkflow(workflowId);
            }
            return engine.resumeWorkflow(workflowId, responseData);
        });
    }

    // ─────────────────────────────────────────────────────────────────────────

    <T> T withRetry(String action, UUID workflowId, int maxRetries, Duration initialBackoff, Supplier<T> call) {
        long delayMs = Math.max(0L, initialBackoff.toMillis());
        double multiplier = properties.getDispatch().getBackoffMultiplier();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (RuntimeException ex) {
                if (!isTransient(ex) || attempt > maxRetries) {
                    throw ex;
                }
                log.warn("[Dispatch] {} of workflow {} failed on attempt {}/{}: {}. Retrying in {} ms",
                        action, workflowId, attempt, maxRetries + 1, ex.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[Dispatch] Retry sleep interrupted for workflow {}; aborting further retries", workflowId);
                    throw ex;
                }
                delayMs = (long) (delayMs * multiplier);
            }
        }
    }

    static boolean isTransient(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof CannotCreateTransactionException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    private WorkflowStatus currentStatus(UUID workflowId) {
        return store.find(workflowId).map(Workflow::getStatus).orElse(null);
    }

    private void submit(String action, UUID workflowId, Runnable task) {
        try {
            taskExecutor.execute(task);
        } catch (TaskRejectedException ex) {
            // stranded runs are re-dispatched by WorkflowRecoveryService
            log.error("[Dispatch] Task pool rejected {} of workflow {}: {}", action, workflowId, ex.getMessage());
        }
    }
}
