package com.proflow.proflow_backend.maintenance;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Deletes terminal workflows, and their steps, once they are older than the retention window. */
@Slf4j
@Component
public class WorkflowRetentionSweeper {

    private final WorkflowStore store;
    private final ProflowProperties properties;
    private final Clock clock;

    public WorkflowRetentionSweeper(WorkflowStore store, ProflowProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${proflow.workflow.retention-cron:0 0 3 * * *}")
    public void scheduledSweep() {
        int purged = sweep();
        log.info("[Retention] Purged {} workflows older than {}", purged, properties.getWorkflow().getRetention());
    }

    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getWorkflow().getRetention());
        List<UUID> expired = store.findExpired(cutoff);
        int purged = 0;
        for (UUID workflowId : expired) {
            try {
                if (store.purge(workflowId)) {
                    purged++;
                }
            } catch (DataAccessException e) {
                // left for the next sweep
                log.error("[Retention] Could not purge workflow {}: {}", workflowId, e.getMessage());
            }
        }
        return purged;
    }
}
