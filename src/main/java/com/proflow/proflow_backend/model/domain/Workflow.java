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
@Table(name = "workflows", indexes = {
        @Index(name = "idx_workflows_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_workflows_status_timeout", columnList = "status, timeout_at")
})
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "workflow_type", nullable = false)
    private String workflowType;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.PENDING;

    // Caller's request, frozen at creation
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_data", updatable = false)
    private Map<String, Object> inputData = new HashMap<>();

    // Cross-step facts; keys are added or replaced, never removed
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context")
    private Map<String, Object> context = new HashMap<>();

    @Column(name = "timeout_at")
    private Instant timeoutAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = 3;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Lease of the driver pass currently allowed to advance this workflow
    @Column(name = "run_token")
    private UUID runToken;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
