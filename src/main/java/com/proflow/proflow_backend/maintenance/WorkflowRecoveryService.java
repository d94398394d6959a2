package com.proflow.proflow_backend.maintenance;

import com.proflow.proflow_backend.dispatch.WorkflowTaskDispatcher;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Re-dispatches workflows nobody is driving: RUNNING rows whose pass died (lease
 * lapsed) and PENDING rows whose initial dispatch was lost. The claim in the driver
 * makes a duplicate dispatch harmless.
 */
@Slf4j
@Component
public class WorkflowRecoveryService {

    private final WorkflowStore store;
    private final WorkflowTaskDispatcher dispatcher;
    private final Clock clock;

    public WorkflowRecoveryService(WorkflowStore store, WorkflowTaskDispatcher dispatcher, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        log.info("Starting workflow recovery scan");
        scheduledRecovery();
    }

    @Scheduled(fixedDelayString = "${proflow.workflow.recovery-interval:PT5M}",
               initialDelayString = "${proflow.workflow.recovery-interval:PT5M}")
    public void scheduledRecovery() {
        try {
            int recovered = recoverStale();
            if (recovered > 0) {
                log.info("Workflow recovery complete: re-dispatched={}", recovered);
            }
        } catch (DataAccessException e) {
            log.error("Workflow recovery scan failed: {}", e.getMessage(), e);
        }
    }

    public int recoverStale() {
        List<UUID> stale = store.findStale(clock.instant());
        for (UUID workflowId : stale) {
            log.info("Recovering stale workflow {}", workflowId);
            dispatcher.dispatchRun(workflowId);
        }
        return stale.size();
    }
}
