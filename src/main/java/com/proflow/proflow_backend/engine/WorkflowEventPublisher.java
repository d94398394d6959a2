package com.proflow.proflow_backend.engine;

import com.proflow.proflow_backend.model.domain.StepStatus;
import com.proflow.proflow_backend.model.domain.WorkflowStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Live progress for UIs. Delivery is best effort: a failed publish is logged and
 * never affects the workflow.
 */
@Slf4j
@Component
public class WorkflowEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWorkflowEventRelay> relayProvider;
    private final Clock clock;

    public WorkflowEventPublisher(SimpMessagingTemplate messagingTemplate,
                                  ObjectProvider<RedisWorkflowEventRelay> relayProvider,
                                  Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.relayProvider = relayProvider;
        this.clock = clock;
    }

    public void stepStarted(UUID workflowId, int stepNumber, String stepName) {
        publish(WorkflowEvent.step(workflowId, stepNumber, stepName, StepStatus.RUNNING.apiValue(), null, now()));
    }

    public void stepCompleted(UUID workflowId, int stepNumber, String stepName) {
        publish(WorkflowEvent.step(workflowId, stepNumber, stepName, StepStatus.COMPLETED.apiValue(), null, now()));
    }

    public void stepFailed(UUID workflowId, int stepNumber, String stepName, String error) {
        publish(WorkflowEvent.step(workflowId, stepNumber, stepName, StepStatus.FAILED.apiValue(), error, now()));
    }

    public void workflowStatus(UUID workflowId, WorkflowStatus status, String message) {
        publish(WorkflowEvent.workflow(workflowId, status.apiValue(), message, now()));
    }

    private void publish(WorkflowEvent event) {
        RedisWorkflowEventRelay relay = relayProvider.getIfAvailable();
        try {
            if (relay != null) {
                relay.publish(event);
            } else {
                messagingTemplate.convertAndSend(event.destination(), event);
            }
        } catch (MessagingException e) {
            log.warn("Could not publish event to {}: {}", event.destination(), e.getMessage());
        }
    }

    private String now() {
        return clock.instant().toString();
    }
}
