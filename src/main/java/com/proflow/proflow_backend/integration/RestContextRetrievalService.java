package com.proflow.proflow_backend.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collection;
import java.util.Map;

/**
 * Asks the retrieval service for context: {@code POST {base-url}/context} with
 * {@code {"query", "user_id"}}, answered by {@code {"context": "...", "sources": [...]}}.
 */
@Component
public class RestContextRetrievalService implements ContextRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RestContextRetrievalService.class);
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestContextRetrievalService(RestTemplate restTemplate,
                                       @Value("${proflow.context.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public RetrievedContext contextFor(String query, String userId) {
        if (baseUrl == null || baseUrl.isBlank() || query == null || query.isBlank()) {
            return RetrievedContext.empty();
        }
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    baseUrl + "/context", HttpMethod.POST,
                    new HttpEntity<>(Map.of("query", query, "user_id", userId)), MAP_TYPE);
            Map<String, Object> body = response.getBody();
            if (body == null) {
                return RetrievedContext.empty();
            }
            Object text = body.get("context");
            int sources = body.get("sources") instanceof Collection<?> c ? c.size() : 0;
            return new RetrievedContext(text != null ? text.toString() : "", sources);
        } catch (RestClientException e) {
            log.warn("[Context] Retrieval failed for user {}, continuing without context: {}", userId, e.getMessage());
            return RetrievedContext.empty();
        }
    }
}
