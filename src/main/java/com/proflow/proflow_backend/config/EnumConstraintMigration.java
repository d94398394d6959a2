package com.proflow.proflow_backend.config;

import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.StepType;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Refreshes the enum check constraints Hibernate generated on an earlier schema so that
 * statuses and step types added since then can be stored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnumConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateConstraints() {
        replace("workflows", "status", WorkflowStatus.values());
        replace("workflow_steps", "status", StepStatus.values());
        replace("workflow_steps", "step_type", StepType.values());
    }

    private void replace(String table, String column, Enum<?>[] values) {
        String constraint = table + "_" + column + "_check";
        String allowed = String.join("', '", Arrays.stream(values).map(Enum::name).toList());
        try {
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD CONSTRAINT " + constraint
                    + " CHECK (" + column + " IN ('" + allowed + "'))");
            log.debug("Updated {} to allow all {} values", constraint, values[0].getDeclaringClass().getSimpleName());
        } catch (DataAccessException e) {
            log.warn("Could not update {} (constraint may already be correct): {}", constraint, e.getMessage());
        }
    }
}
