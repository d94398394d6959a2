package com.proflow.proflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_steps", uniqueConstraints = {
        @UniqueConstraint(name = "uk_workflow_steps_number", columnNames = {"workflow_id", "step_number"})
})
@Data
public class WorkflowStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    // 1-based, contiguous
    @Column(name = "step_number", nullable = false, updatable = false)
    private int stepNumber;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false, updatable = false)
    private StepType stepType;

    // Serialized StepConfig record of the matching type
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", updatable = false)
    private Map<String, Object> config = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_data")
    private Map<String, Object> outputData;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
