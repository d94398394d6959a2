package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.step.StepOutcome;
import com.proflow.proflow_backend.model.step.WaitForResponseConfig;
import com.proflow.proflow_backend.store.StepConfigMapper;
import com.proflow.proflow_backend.store.WorkflowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Suspends the workflow until an external response arrives or the deadline passes.
 * Does no polling itself; the response arrives through resume, the deadline is
 * enforced by the timeout monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WaitForResponseExecutor implements StepExecutor {

    private final StepConfigMapper configMapper;
    private final Clock clock;

    @Override
    public StepType supportedType() {
        return StepType.WAIT_FOR_RESPONSE;
    }

    @Override
    public StepOutcome execute(StepExecutionContext ctx) {
        WaitForResponseConfig cfg = configMapper.read(ctx.step(), WaitForResponseConfig.class);

        if (cfg.onlyIf() != null && !cfg.onlyIf().test(ctx.context())) {
            log.info("[Wait] '{}' not needed for workflow {} ({} is not {} {})", ctx.step().getName(), ctx.workflowId(),
                    cfg.onlyIf().field(), cfg.onlyIf().operator(), cfg.onlyIf().value());
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("waited", false);
            output.put("waiting_for", cfg.waitingFor());
            return StepOutcome.success(output, Map.of());
        }

        Instant deadline = clock.instant().plus(Duration.ofHours(cfg.timeoutHours()));
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("waited", true);
        output.put("waiting_for", cfg.waitingFor());
        output.put("expects", cfg.expects());
        output.put("timeout_at", deadline.toString());

        Map<String, Object> contextUpdates = Map.of(WorkflowStore.WAITING_FLAG_PREFIX + cfg.waitingFor(), Boolean.TRUE);
        log.info("[Wait] Workflow {} waiting for {} until {}", ctx.workflowId(), cfg.waitingFor(), deadline);
        return StepOutcome.suspend(output, deadline, contextUpdates);
    }
}
