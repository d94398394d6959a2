package com.proflow.proflow_backend.controller;

import com.proflow.proflow_backend.model.dto.ContinueWorkflowRequest;
import com.proflow.proflow_backend.model.dto.StartWorkflowRequest;
import com.proflow.proflow_backend.model.dto.WorkflowMetrics;
import com.proflow.proflow_backend.model.dto.WorkflowResponse;
import com.proflow.proflow_backend.model.dto.WorkflowStatusView;
import com.proflow.proflow_backend.model.dto.WorkflowSummary;
import com.proflow.proflow_backend.service.WorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    public static final String USER_HEADER = "X-User-Id";

    private final WorkflowService workflowService;

    // POST /api/workflows: create and dispatch; the run happens on the task pool
    @PostMapping
    public ResponseEntity<WorkflowResponse> start(@RequestHeader(USER_HEADER) String userId,
                                                  @Valid @RequestBody StartWorkflowRequest request) {
        WorkflowResponse response = workflowService.start(
                request.workflowType(), userId, request.inputData(), request.name());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    // POST /api/workflows/{id}/continue: deliver the awaited response
    @PostMapping("/{id}/continue")
    public WorkflowResponse continueWorkflow(@RequestHeader(USER_HEADER) String userId,
                                             @PathVariable UUID id,
                                             @RequestBody(required = false) ContinueWorkflowRequest request) {
        return workflowService.continueFromResponse(id, userId, request != null ? request.responseData() : null);
    }

    @GetMapping("/{id}")
    public WorkflowStatusView getStatus(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return workflowService.getStatus(id, userId);
    }

    // GET /api/workflows?status=waiting&limit=20: newest first
    @GetMapping
    public List<WorkflowSummary> list(@RequestHeader(USER_HEADER) String userId,
                                      @RequestParam(required = false) String status,
                                      @RequestParam(required = false) Integer limit) {
        return workflowService.list(userId, status, limit);
    }

    @PostMapping("/{id}/cancel")
    public WorkflowResponse cancel(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return workflowService.cancel(id, userId);
    }

    @GetMapping("/metrics")
    public WorkflowMetrics metrics() {
        return workflowService.metrics();
    }
}
