package com.proflow.proflow_backend.engine;

import com.proflow.proflow_backend.integration.ToolExecutionResult;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.Workflow;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import com.proflow.proflow_backend.model.step.ToolCallConfig;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;
import com.proflow.proflow_backend.store.WorkflowStore;
import com.proflow.proflow_backend.support.RecordingToolExecutionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Several passes racing for the same workflow, each in its own transaction as in production.
 * Exactly one may claim it, so every step's side effect happens once.
 */
@SpringBootTest
class ConcurrentClaimTest {

    private static final int PASSES = 8;
    private static final String USER = "user-race";

    @TestConfiguration
    static class RecordingToolsConfig {

        @Bean
        @Primary
        RecordingToolExecutionService recordingToolExecutionService() {
            return new RecordingToolExecutionService();
        }
    }

    @Autowired private WorkflowExecutionEngine engine;
    @Autowired private WorkflowStore store;
    @Autowired private RecordingToolExecutionService tools;

    private final List<UUID> created = new ArrayList<>();
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        tools.reset();
        // keeps the winning pass inside its step while the others try to claim
        tools.on("search_contacts", args -> {
            pause();
            return ToolExecutionResult.ok(Map.of("contacts", List.of(Map.of("email", "ann@example.com"))));
        });
        pool = Executors.newFixedThreadPool(PASSES);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(10, TimeUnit.SECONDS);
        for (UUID id : created) {
            store.cancel(id);
            store.purge(id);
        }
        created.clear();
    }

    private UUID create(List<StepDescriptor> steps) {
        Workflow workflow = new Workflow();
        workflow.setUserId(USER);
        workflow.setWorkflowType("race");
        workflow.setName("Race");
        workflow.setInputData(Map.of("user_request", "find Ann"));
        workflow.setMaxRetries(1);
        UUID id = store.create(workflow, steps).getId();
        created.add(id);
        return id;
    }

    /** Runs the task on every thread at once; a pass that lost on a lock counts as not claimed. */
    private List<DriverResult> race(Callable<DriverResult> task) throws Exception {
        CountDownLatch ready = new CountDownLatch(PASSES);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<DriverResult>> futures = new ArrayList<>();
        for (int i = 0; i < PASSES; i++) {
            futures.add(pool.submit(() -> {
                ready.countDown();
                go.await();
                return task.call();
            }));
        }
        assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
        go.countDown();

        List<DriverResult> results = new ArrayList<>();
        for (Future<DriverResult> future : futures) {
            try {
                results.add(future.get(30, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(DataAccessException.class);
            }
        }
        return results;
    }

    private static void pause() {
        try {
            Thread.sleep(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("concurrent runs of a PENDING workflow: one claim, one tool call")
    void concurrentRuns() throws Exception {
        UUID id = create(List.of(
                new StepDescriptor(1, "Search contacts", StepType.TOOL_CALL,
                        ToolCallConfig.of("search_contacts", Map.of("query", "Ann"), "contacts"))));

        List<DriverResult> results = race(() -> engine.runWorkflow(id));

        assertThat(results).filteredOn(DriverResult::claimed).hasSize(1)
                .allSatisfy(r -> assertThat(r.status()).isEqualTo(WorkflowStatus.COMPLETED));
        assertThat(tools.invocationsOf("search_contacts")).hasSize(1);
        assertThat(store.find(id).orElseThrow().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
    }

    @Test
    @DisplayName("concurrent resumes of a WAITING workflow: one claim, the next step runs once")
    void concurrentResumes() throws Exception {
        UUID id = create(List.of(
                new StepDescriptor(1, "Wait for reply", StepType.WAIT_FOR_RESPONSE,
                        WaitForResponseConfig.of(24, List.of("email_reply"))),
                new StepDescriptor(2, "Search contacts", StepType.TOOL_CALL,
                        ToolCallConfig.of("search_contacts", Map.of("query", "Ann"), "contacts"))));
        assertThat(engine.runWorkflow(id).status()).isEqualTo(WorkflowStatus.WAITING);

        List<DriverResult> results = race(() -> engine.resumeWorkflow(id, Map.of("email_reply", "Yes")));

        assertThat(results).filteredOn(DriverResult::claimed).hasSize(1);
        assertThat(tools.invocationsOf("search_contacts")).hasSize(1);
        assertThat(store.find(id).orElseThrow().getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
    }
}
