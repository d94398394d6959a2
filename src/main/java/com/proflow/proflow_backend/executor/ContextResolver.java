package com.proflow.proflow_backend.executor;

import com.proflow.proflow_backend.model.domain.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {{...}} references in step config values:
 * <ul>
 *   <li>{@code {{input.contact_name}}}: the workflow's input_data</li>
 *   <li>{@code {{context.selected_contact.decision}}}: the workflow context</li>
 *   <li>{@code {{steps.2.structured.subject}}}: output_data of completed step 2</li>
 *   <li>{@code {{meta.workflowId}}}, {@code {{meta.userId}}}, {@code {{meta.stepNumber}}}</li>
 * </ul>
 */
@Component
public class ContextResolver {

    private static final Logger log = LoggerFactory.getLogger(ContextResolver.class);

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");

    // Renders every {{ref}} in the string as text; unresolved references become "".
    public String resolve(String template, StepExecutionContext ctx) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            Object value = resolvePath(path, ctx);
            if (value == null) {
                log.debug("Reference {{{}}} resolved to nothing in workflow {}", path, ctx.workflowId());
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value.toString() : ""));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves a config value of any shape. A string that is exactly one reference keeps
     * the referenced object's type (map, list, number); maps and lists are walked recursively.
     */
    public Object resolveValue(Object value, StepExecutionContext ctx) {
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.length() >= 5 && trimmed.startsWith("{{") && trimmed.endsWith("}}")
                    && trimmed.indexOf("{{", 2) < 0) {
                return resolvePath(trimmed.substring(2, trimmed.length() - 2).trim(), ctx);
            }
            return resolve(s, ctx);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolveValue(v, ctx)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(resolveValue(item, ctx)));
            return resolved;
        }
        return value;
    }

    public Map<String, Object> resolveMap(Map<String, Object> config, StepExecutionContext ctx) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (config == null) return resolved;
        config.forEach((key, value) -> resolved.put(key, resolveValue(value, ctx)));
        return resolved;
    }

    Object resolvePath(String path, StepExecutionContext ctx) {
        if (path == null || path.isBlank()) return null;
        int dot = path.indexOf('.');
        String root = dot < 0 ? path : path.substring(0, dot);
        String rest = dot < 0 ? "" : path.substring(dot + 1);

        return switch (root) {
            case "input"   -> rest.isEmpty() ? ctx.inputData() : resolveNestedPath(ctx.inputData(), rest);
            case "context" -> rest.isEmpty() ? ctx.context() : resolveNestedPath(ctx.context(), rest);
            case "steps"   -> resolveStepPath(rest, ctx);
            case "meta"    -> resolveMetaField(rest, ctx);
            default        -> null;
        };
    }

    private Object resolveStepPath(String path, StepExecutionContext ctx) {
        int dot = path.indexOf('.');
        String number = dot < 0 ? path : path.substring(0, dot);
        if (!number.matches("\\d+")) return null;
        Map<String, Object> output = ctx.completedStep(Integer.parseInt(number))
                .map(WorkflowStep::getOutputData)
                .orElse(null);
        if (output == null) return null;
        String rest = dot < 0 ? "" : path.substring(dot + 1);
        // "steps.2.output.x" and "steps.2.x" both address the step's output_data
        if (rest.equals("output")) return output;
        if (rest.startsWith("output.")) rest = rest.substring("output.".length());
        return rest.isEmpty() ? output : resolveNestedPath(output, rest);
    }

    private Object resolveMetaField(String field, StepExecutionContext ctx) {
        return switch (field) {
            case "workflowId" -> ctx.workflowId() != null ? ctx.workflowId().toString() : null;
            case "userId"     -> ctx.userId();
            case "stepNumber" -> ctx.step() != null ? ctx.step().getStepNumber() : null;
            default           -> null;
        };
    }

    /** Walk a map/list tree by dot path (e.g. "contact_search.results.0.email"). Null if any segment is missing. */
    private Object resolveNestedPath(Object root, String path) {
        Object current = root;
        for (String raw : path.split("\\.")) {
            if (current == null) return null;
            String seg = raw.trim();
            if (seg.isEmpty()) return null;
            if (current instanceof Map<?, ?> map) {
                current = map.get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }
}
