package com.proflow.proflow_backend.maintenance;

import com.proflow.proflow_backend.model.dto.WorkflowMetrics;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowMetricsCollector {

    private final WorkflowStore store;

    public WorkflowMetrics snapshot() {
        return store.metrics();
    }

    @Scheduled(fixedDelayString = "${proflow.workflow.metrics-interval:PT1H}",
               initialDelayString = "${proflow.workflow.metrics-interval:PT1H}")
    public void logSnapshot() {
        try {
            WorkflowMetrics metrics = snapshot();
            log.info("[Metrics] status={}, created24h={}, completed24h={}",
                    metrics.statusCounts(), metrics.createdLast24h(), metrics.completedLast24h());
        } catch (DataAccessException e) {
            log.warn("[Metrics] Could not collect workflow metrics: {}", e.getMessage());
        }
    }
}
