package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.StepType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class StepExecutorRegistry {

    private final List<StepExecutor> executors;
    private final Map<StepType, StepExecutor> registry = new EnumMap<>(StepType.class);

    // Refuses to start unless every StepType has exactly one executor
    @PostConstruct
    public void init() {
        for (StepExecutor executor : executors) {
            StepExecutor previous = registry.put(executor.supportedType(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors registered for step type " + executor.supportedType()
                        + ": " + previous.getClass().getSimpleName() + " and " + executor.getClass().getSimpleName());
            }
        }
        Set<StepType> missing = EnumSet.allOf(StepType.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No executor registered for step types: " + missing);
        }
    }

    public StepExecutor get(StepType type) {
        StepExecutor executor = registry.get(type);
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for step type: " + type);
        }
        return executor;
    }
}
