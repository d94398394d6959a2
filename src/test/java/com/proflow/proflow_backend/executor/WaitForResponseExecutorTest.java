package com.proflow.proflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.step.StepCondition;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;
import com.proflow.proflow_backend.store.StepConfigMapper;
import com.proflow.proflow_backend.support.TestClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WaitForResponseExecutorTest {

    private final StepConfigMapper mapper = new StepConfigMapper(new ObjectMapper());
    private final WaitForResponseExecutor executor = new WaitForResponseExecutor(mapper, new TestClock());

    private StepExecutionContext contextFor(WaitForResponseConfig config, Map<String, Object> workflowContext) {
        WorkflowStep step = new WorkflowStep();
        step.setStepNumber(5);
        step.setName("Wait for reply");
        step.setStepType(StepType.WAIT_FOR_RESPONSE);
        step.setConfig(mapper.toMap(config));
        return new StepExecutionContext(UUID.randomUUID(), "user-1", step, Map.of(), workflowContext, List.of());
    }

    @Test
    @DisplayName("suspends with a deadline timeout_hours from now and raises the waiting flag")
    void suspendsWithDeadline() {
        StepOutcome outcome = executor.execute(contextFor(WaitForResponseConfig.of(48, List.of("email_reply")), Map.of()));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.suspend()).isTrue();
        assertThat(outcome.resumeDeadline()).isEqualTo(TestClock.START.plus(Duration.ofHours(48)));
        assertThat(outcome.contextUpdates()).containsEntry("waiting_for_email_response", true);
        assertThat(outcome.output())
                .containsEntry("waited", true)
                .containsEntry("expects", List.of("email_reply"));
    }

    @Test
    @DisplayName("completes without suspending when its condition does not hold")
    void conditionFalseDoesNotSuspend() {
        WaitForResponseConfig config = WaitForResponseConfig.of(24, List.of())
                .onlyIf(StepCondition.equalTo("negotiation_required", true));

        StepOutcome outcome = executor.execute(contextFor(config, Map.of("negotiation_required", false)));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.suspend()).isFalse();
        assertThat(outcome.output()).containsEntry("waited", false);
        assertThat(outcome.contextUpdates()).isEmpty();
    }

    @Test
    @DisplayName("suspends when its condition holds")
    void conditionTrueSuspends() {
        WaitForResponseConfig config = WaitForResponseConfig.of(24, List.of())
                .onlyIf(StepCondition.equalTo("negotiation_required", true));

        StepOutcome outcome = executor.execute(contextFor(config, Map.of("negotiation_required", true)));

        assertThat(outcome.suspend()).isTrue();
    }
}
