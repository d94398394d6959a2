package com.proflow.proflow_backend.template;

import com.proflow.proflow_backend.exception.WorkflowValidationException;
import com.proflow.proflow_backend.model.step.StepDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a workflow type and its input into the ordered step list. Unknown types
 * get the generic template; a malformed template is a programming error and
 * raises {@link WorkflowValidationException}.
 */
@Slf4j
@Component
public class WorkflowTemplateGenerator {

    private final Map<String, WorkflowTemplate> templates = new HashMap<>();
    private final WorkflowTemplate fallback;

    public WorkflowTemplateGenerator(List<WorkflowTemplate> all) {
        all.forEach(t -> templates.put(t.type().toLowerCase(Locale.ROOT), t));
        this.fallback = templates.get(GenericRequestTemplate.TYPE);
        if (fallback == null) {
            throw new IllegalStateException("No '" + GenericRequestTemplate.TYPE + "' fallback template registered");
        }
    }

    public WorkflowTemplate templateFor(String workflowType) {
        if (workflowType == null || workflowType.isBlank()) return fallback;
        WorkflowTemplate template = templates.get(workflowType.trim().toLowerCase(Locale.ROOT));
        if (template == null) {
            log.info("No template for workflow type '{}', using {}", workflowType, GenericRequestTemplate.TYPE);
            return fallback;
        }
        return template;
    }

    public List<StepDescriptor> generate(String workflowType, Map<String, Object> input) {
        WorkflowTemplate template = templateFor(workflowType);
        List<StepDescriptor> steps = template.steps(input != null ? input : Map.of());
        validate(template.type(), steps);
        return steps;
    }

    void validate(String type, List<StepDescriptor> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("Template '" + type + "' produced no steps");
        }
        for (int i = 0; i < steps.size(); i++) {
            StepDescriptor step = steps.get(i);
            if (step.stepNumber() != i + 1) {
                throw new WorkflowValidationException("Template '" + type + "': expected step number " + (i + 1)
                        + " but found " + step.stepNumber());
            }
            if (step.stepType() == null || step.config() == null) {
                throw new WorkflowValidationException("Template '" + type + "' step " + step.stepNumber()
                        + " has no type or config");
            }
            if (!step.stepType().getConfigType().isInstance(step.config())) {
                throw new WorkflowValidationException("Template '" + type + "' step " + step.stepNumber() + " is "
                        + step.stepType() + " but carries " + step.config().getClass().getSimpleName());
            }
            try {
                step.config().validate();
            } catch (IllegalArgumentException e) {
                throw new WorkflowValidationException("Template '" + type + "' step " + step.stepNumber()
                        + " (" + step.name() + "): " + e.getMessage(), e);
            }
        }
    }
}
