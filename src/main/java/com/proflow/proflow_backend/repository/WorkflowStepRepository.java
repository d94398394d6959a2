package com.proflow.proflow_backend.repository;

import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowStepRepository extends JpaRepository<WorkflowStep, UUID> {

    List<WorkflowStep> findByWorkflowIdOrderByStepNumberAsc(UUID workflowId);

    List<WorkflowStep> findByWorkflowIdAndStatusOrderByStepNumberAsc(UUID workflowId, StepStatus status);

    // Lowest-numbered step that still has to run
    Optional<WorkflowStep> findFirstByWorkflowIdAndStatusInOrderByStepNumberAsc(UUID workflowId, Collection<StepStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM WorkflowStep s WHERE s.workflowId = :workflowId")
    int deleteByWorkflowId(@Param("workflowId") UUID workflowId);
}
