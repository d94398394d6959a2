package com.proflow.proflow_backend.maintenance;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.dispatch.WorkflowTaskDispatcher;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces deadlines of waiting workflows: a timed-out workflow with reminder budget
 * left gets a reminder and a later deadline, otherwise it fails. Both transitions are
 * conditional, so a workflow resumed in the meantime is simply skipped.
 */
@Slf4j
@Component
public class WorkflowTimeoutMonitor {

    public static final String TIMEOUT_ERROR = "Workflow timed out waiting for response";

    private final WorkflowStore store;
    private final WorkflowTaskDispatcher dispatcher;
    private final ProflowProperties properties;
    private final Clock clock;

    public WorkflowTimeoutMonitor(WorkflowStore store,
                                  WorkflowTaskDispatcher dispatcher,
                                  ProflowProperties properties,
                                  Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${proflow.workflow.timeout-check-interval:PT5M}",
               initialDelayString = "${proflow.workflow.timeout-check-initial-delay:PT1M}")
    public void scheduledCheck() {
        try {
            SweepResult result = checkTimeouts();
            if (result.reminded() + result.failed() > 0) {
                log.info("[TimeoutMonitor] reminded={}, failed={}, skipped={}",
                        result.reminded(), result.failed(), result.skipped());
            }
        } catch (DataAccessException e) {
            log.error("[TimeoutMonitor] Timeout check aborted: {}", e.getMessage(), e);
        }
    }

    public SweepResult checkTimeouts() {
        Instant now = clock.instant();
        List<Workflow> timedOut = store.findTimedOut(now);
        int reminded = 0;
        int failed = 0;
        int skipped = 0;

        for (Workflow workflow : timedOut) {
            if (workflow.getRetryCount() < workflow.getMaxRetries()) {
                Instant newTimeout = now.plus(properties.getWorkflow().getReminderExtension());
                if (store.extendTimeout(workflow.getId(), now, newTimeout)) {
                    dispatcher.enqueueReminder(workflow.getId(), reminderContext(workflow));
                    log.info("[TimeoutMonitor] Workflow {} reminder {}/{} sent; new deadline {}",
                            workflow.getId(), workflow.getRetryCount() + 1, workflow.getMaxRetries(), newTimeout);
                    reminded++;
                } else {
                    skipped++;
                }
            } else if (store.failTimedOut(workflow.getId(), now, TIMEOUT_ERROR)) {
                log.warn("[TimeoutMonitor] Workflow {} failed after {} reminders", workflow.getId(), workflow.getRetryCount());
                failed++;
            } else {
                skipped++;
            }
        }
        return new SweepResult(reminded, failed, skipped);
    }

    private static Map<String, Object> reminderContext(Workflow workflow) {
        Map<String, Object> context = new HashMap<>(workflow.getContext() != null ? workflow.getContext() : Map.of());
        context.put("user_id", workflow.getUserId());
        context.put("reminder_attempt", workflow.getRetryCount() + 1);
        return context;
    }
}
