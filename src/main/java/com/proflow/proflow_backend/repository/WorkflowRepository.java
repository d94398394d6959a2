package com.proflow.proflow_backend.repository;

import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every status transition is a conditional UPDATE returning the affected row count:
 * 1 means this caller won the transition, 0 means the row was no longer in the
 * expected state.
 */
public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    Optional<Workflow> findByIdAndUserId(UUID id, String userId);

    // Newest first: used by the list endpoint
    List<Workflow> findByUserIdOrderByCreatedAtDesc(String userId, Pageable page);

    List<Workflow> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, WorkflowStatus status, Pageable page);

    // Timeout monitor candidates
    List<Workflow> findByStatusAndTimeoutAtBefore(WorkflowStatus status, Instant now);

    @Query("SELECT w.id FROM Workflow w WHERE w.status IN :statuses AND w.completedAt < :cutoff")
    List<UUID> findIdsCompletedBefore(@Param("statuses") Collection<WorkflowStatus> statuses,
                                      @Param("cutoff") Instant cutoff);

    // Crashed passes (lease ran out) and rows whose initial dispatch never happened
    @Query("SELECT w.id FROM Workflow w WHERE (w.status = :running AND (w.leaseExpiresAt IS NULL OR w.leaseExpiresAt < :now)) " +
           "OR (w.status = :pending AND w.createdAt < :pendingCutoff)")
    List<UUID> findStaleIds(@Param("running") WorkflowStatus running,
                            @Param("pending") WorkflowStatus pending,
                            @Param("now") Instant now,
                            @Param("pendingCutoff") Instant pendingCutoff);

    long countByStatus(WorkflowStatus status);

    long countByCreatedAtAfter(Instant since);

    long countByCompletedAtAfter(Instant since);

    // ── Claims ────────────────────────────────────────────────────────────────

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :running, w.runToken = :token, w.leaseExpiresAt = :leaseUntil, " +
           "w.updatedAt = :now, w.version = w.version + 1 " +
           "WHERE w.id = :id AND (w.status = :pending " +
           "OR (w.status = :running AND (w.leaseExpiresAt IS NULL OR w.leaseExpiresAt < :now)))")
    int claimForRun(@Param("id") UUID id,
                    @Param("token") UUID token,
                    @Param("leaseUntil") Instant leaseUntil,
                    @Param("now") Instant now,
                    @Param("pending") WorkflowStatus pending,
                    @Param("running") WorkflowStatus running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :running, w.runToken = :token, w.leaseExpiresAt = :leaseUntil, " +
           "w.timeoutAt = NULL, w.updatedAt = :now, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :waiting")
    int claimForResume(@Param("id") UUID id,
                       @Param("token") UUID token,
                       @Param("leaseUntil") Instant leaseUntil,
                       @Param("now") Instant now,
                       @Param("waiting") WorkflowStatus waiting,
                       @Param("running") WorkflowStatus running);

    // ── Transitions guarded by the pass's run token ───────────────────────────

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.leaseExpiresAt = :leaseUntil, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :running AND w.runToken = :token")
    int renewLease(@Param("id") UUID id,
                   @Param("token") UUID token,
                   @Param("leaseUntil") Instant leaseUntil,
                   @Param("running") WorkflowStatus running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :target, w.completedAt = :now, w.updatedAt = :now, w.errorMessage = :error, " +
           "w.timeoutAt = NULL, w.runToken = NULL, w.leaseExpiresAt = NULL, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :running AND w.runToken = :token")
    int finish(@Param("id") UUID id,
               @Param("token") UUID token,
               @Param("target") WorkflowStatus target,
               @Param("error") String error,
               @Param("now") Instant now,
               @Param("running") WorkflowStatus running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :waiting, w.timeoutAt = :timeoutAt, w.updatedAt = :now, " +
           "w.runToken = NULL, w.leaseExpiresAt = NULL, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :running AND w.runToken = :token")
    int suspend(@Param("id") UUID id,
                @Param("token") UUID token,
                @Param("timeoutAt") Instant timeoutAt,
                @Param("now") Instant now,
                @Param("running") WorkflowStatus running,
                @Param("waiting") WorkflowStatus waiting);

    // Lets a dispatcher retry re-claim immediately instead of waiting for the lease to lapse
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.leaseExpiresAt = NULL, w.updatedAt = :now, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :running AND w.runToken = :token")
    int releaseLease(@Param("id") UUID id,
                     @Param("token") UUID token,
                     @Param("now") Instant now,
                     @Param("running") WorkflowStatus running);

    // ── Transitions from outside a pass ───────────────────────────────────────

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :cancelled, w.completedAt = :now, w.updatedAt = :now, " +
           "w.timeoutAt = NULL, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status IN :active")
    int cancel(@Param("id") UUID id,
               @Param("now") Instant now,
               @Param("cancelled") WorkflowStatus cancelled,
               @Param("active") Collection<WorkflowStatus> active);

    // Gives up on a workflow whose run could not be carried out at all; same predicate as claimForRun
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :failed, w.errorMessage = :error, w.completedAt = :now, w.updatedAt = :now, " +
           "w.runToken = NULL, w.leaseExpiresAt = NULL, w.version = w.version + 1 " +
           "WHERE w.id = :id AND (w.status = :pending " +
           "OR (w.status = :running AND (w.leaseExpiresAt IS NULL OR w.leaseExpiresAt < :now)))")
    int abandon(@Param("id") UUID id,
                @Param("error") String error,
                @Param("now") Instant now,
                @Param("failed") WorkflowStatus failed,
                @Param("pending") WorkflowStatus pending,
                @Param("running") WorkflowStatus running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.retryCount = w.retryCount + 1, w.timeoutAt = :newTimeout, w.updatedAt = :now, " +
           "w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :waiting AND w.timeoutAt < :now AND w.retryCount < w.maxRetries")
    int extendTimeout(@Param("id") UUID id,
                      @Param("newTimeout") Instant newTimeout,
                      @Param("now") Instant now,
                      @Param("waiting") WorkflowStatus waiting);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :failed, w.errorMessage = :error, w.completedAt = :now, w.updatedAt = :now, " +
           "w.timeoutAt = NULL, w.version = w.version + 1 " +
           "WHERE w.id = :id AND w.status = :waiting AND w.timeoutAt < :now AND w.retryCount >= w.maxRetries")
    int failTimedOut(@Param("id") UUID id,
                     @Param("error") String error,
                     @Param("now") Instant now,
                     @Param("waiting") WorkflowStatus waiting,
                     @Param("failed") WorkflowStatus failed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Workflow w WHERE w.id = :id AND w.status IN :terminal")
    int deleteTerminal(@Param("id") UUID id, @Param("terminal") Collection<WorkflowStatus> terminal);
}
