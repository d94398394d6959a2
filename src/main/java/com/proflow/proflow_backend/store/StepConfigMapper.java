package com.proflow.proflow_backend.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStep;
import com.proflow.proflow_backend.model.step.StepConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Converts step config records to the JSON map stored on the row, and back. */
@Component
@RequiredArgsConstructor
public class StepConfigMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Map<String, Object> toMap(StepConfig config) {
        return objectMapper.convertValue(config, MAP_TYPE);
    }

    public StepConfig fromMap(StepType type, Map<String, Object> raw) {
        try {
            return objectMapper.convertValue(raw != null ? raw : Map.of(), type.getConfigType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed " + type.apiValue() + " config: " + e.getMessage(), e);
        }
    }

    public <T extends StepConfig> T read(WorkflowStep step, Class<T> expected) {
        StepConfig config = fromMap(step.getStepType(), step.getConfig());
        if (!expected.isInstance(config)) {
            throw new IllegalStateException("Step " + step.getStepNumber() + " is " + step.getStepType()
                    + ", expected config " + expected.getSimpleName());
        }
        return expected.cast(config);
    }
}
