package com.proflow.proflow_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RedisWorkflowEventRelayTest {

    private static final UUID WORKFLOW_ID = UUID.fromString("3f1c2a5e-0000-4000-8000-000000000007");

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private SimpMessagingTemplate messagingTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisWorkflowEventRelay relay;

    @BeforeEach
    void setUp() {
        relay = new RedisWorkflowEventRelay(redisTemplate, messagingTemplate, objectMapper);
    }

    private static DefaultMessage redisMessage(String body) {
        return new DefaultMessage(RedisWorkflowEventRelay.CHANNEL.getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("sends the event as JSON on the relay channel")
        void sendsToChannel() throws Exception {
            WorkflowEvent event = WorkflowEvent.step(WORKFLOW_ID, 3, "Send email", "completed", null, "2026-03-02T09:00:00Z");

            relay.publish(event);

            ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
            verify(redisTemplate).convertAndSend(eq(RedisWorkflowEventRelay.CHANNEL), json.capture());
            assertThat(objectMapper.readValue(json.getValue(), WorkflowEvent.class)).isEqualTo(event);
            assertThat(json.getValue()).doesNotContain("\"message\"").doesNotContain("destination");
            verifyNoInteractions(messagingTemplate);
        }

        @Test
        @DisplayName("delivers locally while Redis is unreachable")
        void fallsBackToLocalBroker() {
            doThrow(new RedisConnectionFailureException("connection refused"))
                    .when(redisTemplate).convertAndSend(anyString(), any());
            WorkflowEvent event = WorkflowEvent.workflow(WORKFLOW_ID, "waiting", "Waiting for response", "2026-03-02T09:00:00Z");

            relay.publish(event);

            verify(messagingTemplate).convertAndSend("/topic/workflow/" + WORKFLOW_ID, event);
        }
    }

    @Nested
    @DisplayName("onMessage")
    class OnMessage {

        @Test
        @DisplayName("forwards a relayed event to the workflow's topic")
        void forwardsToTopic() {
            String body = "{\"workflowId\":\"" + WORKFLOW_ID + "\",\"type\":\"workflow\",\"status\":\"completed\","
                    + "\"message\":\"Workflow completed\",\"occurredAt\":\"2026-03-02T09:00:00Z\"}";

            relay.onMessage(redisMessage(body), null);

            verify(messagingTemplate).convertAndSend("/topic/workflow/" + WORKFLOW_ID,
                    new WorkflowEvent(WORKFLOW_ID, "workflow", null, null, "completed",
                            "Workflow completed", "2026-03-02T09:00:00Z"));
        }

        @Test
        @DisplayName("drops unreadable payloads and events without a workflow id")
        void dropsBadPayloads() {
            relay.onMessage(redisMessage("not json"), null);
            relay.onMessage(redisMessage("{\"type\":\"workflow\",\"status\":\"failed\"}"), null);

            verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
        }
    }
}
