package com.proflow.proflow_backend.integration;

import java.util.Map;
import java.util.UUID;

/**
 * Out-of-band nudge sent when a waiting workflow passes its deadline with reminder
 * budget left. The context is a copy of the workflow context plus {@code user_id}
 * and {@code reminder_attempt}.
 */
public interface ReminderDispatcher {

    void dispatch(UUID workflowId, Map<String, Object> context);
}
