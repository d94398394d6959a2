package com.proflow.proflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proflow.proflow_backend.engine.RedisWorkflowEventRelay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

// Multi-instance deployments only; a single instance delivers through its in-process broker
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "proflow.events", name = "redis-enabled", havingValue = "true")
public class RedisEventRelayConfig {

    @Bean
    public RedisWorkflowEventRelay redisWorkflowEventRelay(StringRedisTemplate redisTemplate,
                                                           SimpMessagingTemplate messagingTemplate,
                                                           ObjectMapper objectMapper) {
        log.info("Workflow events are relayed through Redis channel {}", RedisWorkflowEventRelay.CHANNEL);
        return new RedisWorkflowEventRelay(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer workflowEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       RedisWorkflowEventRelay relay) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relay, new ChannelTopic(RedisWorkflowEventRelay.CHANNEL));
        return container;
    }
}
