package com.proflow.proflow_backend.service;

import com.proflow.proflow_backend.config.ProflowProperties;
import com.proflow.proflow_backend.dispatch.WorkflowTaskDispatcher;
import com.proflow.proflow_backend.engine.DriverResult;
import com.proflow.proflow_backend.exception.WorkflowNotFoundException;
import com.proflow.proflow_backend.maintenance.WorkflowMetricsCollector;
import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.dto.StepSummary;
import com.proflow.proflow_backend.model.dto.WorkflowMetrics;
import com.proflow.proflow_backend.model.dto.WorkflowResponse;
import com.proflow.proflow_backend.model.dto.WorkflowStatusView;
import com.proflow.proflow_backend.model.dto.WorkflowSummary;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.store.WorkflowStore;
import com.proflow.proflow_backend.template.WorkflowTemplate;
import com.proflow.proflow_backend.template.WorkflowTemplateGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    static final int DEFAULT_LIST_LIMIT = 20;
    static final int MAX_LIST_LIMIT = 100;

    private final WorkflowTemplateGenerator templateGenerator;
    private final WorkflowStore store;
    private final WorkflowTaskDispatcher dispatcher;
    private final WorkflowMetricsCollector metricsCollector;
    private final ProflowProperties properties;

    /**
     * Creates the workflow with all of its steps and hands it to the task pool.
     * Returns as soon as the rows are persisted.
     */
    public WorkflowResponse start(String workflowType, String userId, Map<String, Object> inputData, String name) {
        requireUser(userId);
        Map<String, Object> input = inputData != null ? new HashMap<>(inputData) : new HashMap<>();
        WorkflowTemplate template = templateGenerator.templateFor(workflowType);
        List<StepDescriptor> steps = templateGenerator.generate(workflowType, input);

        Workflow workflow = new Workflow();
        workflow.setUserId(userId);
        workflow.setWorkflowType(workflowType != null && !workflowType.isBlank()
                ? workflowType.trim().toLowerCase(Locale.ROOT) : template.type());
        workflow.setName(name != null && !name.isBlank() ? name : template.defaultName(input));
        workflow.setDescription(template.description());
        workflow.setInputData(input);
        workflow.setMaxRetries(properties.getWorkflow().getDefaultMaxRetries());

        Workflow saved = store.create(workflow, steps);
        dispatcher.dispatchRun(saved.getId());
        log.info("Workflow {} '{}' started for user {}", saved.getId(), saved.getName(), userId);
        return new WorkflowResponse(saved.getId(), WorkflowStatus.PENDING.apiValue(),
                "Workflow '" + saved.getName() + "' started with " + steps.size() + " steps", null);
    }

    /**
     * Delivers an external response to a waiting workflow and drives it until it next
     * stops. Calling this for a workflow that is not waiting changes nothing.
     */
    public WorkflowResponse continueFromResponse(UUID workflowId, String userId, Map<String, Object> responseData) {
        Workflow workflow = owned(workflowId, userId);
        if (workflow.getStatus() != WorkflowStatus.WAITING) {
            return new WorkflowResponse(workflowId, workflow.getStatus().apiValue(),
                    "Workflow is not waiting for a response", null);
        }
        DriverResult result = dispatcher.resumeNow(workflowId, responseData != null ? responseData : Map.of());
        if (!result.claimed()) {
            String message = result.status() == WorkflowStatus.RUNNING
                    ? "Response recorded; workflow is still running"
                    : "Workflow is not waiting for a response";
            return new WorkflowResponse(workflowId, statusOf(result), message, null);
        }
        Workflow after = store.find(workflowId).orElse(workflow);
        return new WorkflowResponse(workflowId, statusOf(result), messageFor(after), resultOf(after));
    }

    public WorkflowStatusView getStatus(UUID workflowId, String userId) {
        Workflow workflow = owned(workflowId, userId);
        List<WorkflowStep> steps = store.steps(workflowId);
        Integer current = steps.stream()
                .filter(s -> s.getStatus() != StepStatus.COMPLETED)
                .map(WorkflowStep::getStepNumber)
                .findFirst()
                .orElse(null);
        return new WorkflowStatusView(
                workflow.getId(),
                workflow.getWorkflowType(),
                workflow.getName(),
                workflow.getDescription(),
                workflow.getStatus().apiValue(),
                current,
                steps.size(),
                workflow.getRetryCount(),
                workflow.getMaxRetries(),
                workflow.getTimeoutAt(),
                workflow.getErrorMessage(),
                workflow.getContext(),
                workflow.getCreatedAt(),
                workflow.getCompletedAt(),
                steps.stream().map(WorkflowService::toSummary).toList());
    }

    public List<WorkflowSummary> list(String userId, String statusFilter, Integer limit) {
        requireUser(userId);
        WorkflowStatus status = statusFilter != null && !statusFilter.isBlank() ? WorkflowStatus.fromValue(statusFilter) : null;
        int size = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return store.list(userId, status, size).stream()
                .map(w -> new WorkflowSummary(w.getId(), w.getWorkflowType(), w.getName(), w.getStatus().apiValue(),
                        w.getCreatedAt(), w.getCompletedAt(), w.getErrorMessage()))
                .toList();
    }

    public WorkflowResponse cancel(UUID workflowId, String userId) {
        Workflow workflow = owned(workflowId, userId);
        if (store.cancel(workflowId)) {
            log.info("Workflow {} cancelled by user {}", workflowId, userId);
            return new WorkflowResponse(workflowId, WorkflowStatus.CANCELLED.apiValue(), "Workflow cancelled", null);
        }
        WorkflowStatus current = store.find(workflowId).map(Workflow::getStatus).orElse(workflow.getStatus());
        return new WorkflowResponse(workflowId, current.apiValue(), "Workflow already finished", null);
    }

    public WorkflowMetrics metrics() {
        return metricsCollector.snapshot();
    }

    private Workflow owned(UUID workflowId, String userId) {
        requireUser(userId);
        return store.findOwned(workflowId, userId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
    }

    private static String statusOf(DriverResult result) {
        return result.status() != null ? result.status().apiValue() : null;
    }

    private static String messageFor(Workflow workflow) {
        return switch (workflow.getStatus()) {
            case COMPLETED -> "Workflow completed";
            case WAITING   -> "Workflow is waiting for another response";
            case FAILED    -> "Workflow failed: " + workflow.getErrorMessage();
            case CANCELLED -> "Workflow was cancelled";
            default        -> "Workflow resumed";
        };
    }

    private static Map<String, Object> resultOf(Workflow workflow) {
        return workflow.getStatus() == WorkflowStatus.COMPLETED ? workflow.getContext() : null;
    }

    private static StepSummary toSummary(WorkflowStep step) {
        return new StepSummary(
                step.getStepNumber(),
                step.getName(),
                step.getStepType().apiValue(),
                step.getStatus().apiValue(),
                step.getOutputData(),
                step.getErrorMessage(),
                step.getStartedAt(),
                step.getCompletedAt());
    }
}
