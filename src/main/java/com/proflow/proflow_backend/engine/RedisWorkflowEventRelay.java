package com.proflow.proflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Carries workflow events between instances over a Redis channel. Every instance,
 * the publishing one included, receives the event from Redis and hands it to its
 * own STOMP broker, so a client sees a workflow driven on any instance.
 * Registered by {@code RedisEventRelayConfig} when {@code proflow.events.redis-enabled=true}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWorkflowEventRelay implements MessageListener {

    public static final String CHANNEL = "proflow:workflow-events";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    /** Sends the event to Redis; while Redis is unreachable, delivers it to local subscribers only. */
    public void publish(WorkflowEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[Events] Could not serialize event for workflow {}", event.workflowId(), e);
            return;
        }
        try {
            redisTemplate.convertAndSend(CHANNEL, json);
        } catch (DataAccessException e) {
            log.warn("[Events] Redis unavailable ({}); delivering event of workflow {} locally",
                    e.getMessage(), event.workflowId());
            messagingTemplate.convertAndSend(event.destination(), event);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            WorkflowEvent event = objectMapper.readValue(body, WorkflowEvent.class);
            if (event.workflowId() == null) {
                log.warn("[Events] Dropping relayed event without workflow id: {}", body);
                return;
            }
            messagingTemplate.convertAndSend(event.destination(), event);
        } catch (JsonProcessingException e) {
            log.warn("[Events] Dropping unreadable relayed event: {}", e.getOriginalMessage());
        } catch (MessagingException e) {
            log.error("[Events] Could not deliver relayed event to local subscribers", e);
        }
    }
}
