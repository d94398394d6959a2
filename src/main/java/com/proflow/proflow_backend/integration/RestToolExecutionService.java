package com.proflow.proflow_backend.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the tool gateway: {@code POST {base-url}/tools/{name}} with
 * {@code {"arguments": {...}, "user_id": "..."}}, expecting
 * {@code {"success": true, "result": ...}} or {@code {"success": false, "error": "..."}}.
 */
@Component
public class RestToolExecutionService implements ToolExecutionService {

    private static final Logger log = LoggerFactory.getLogger(RestToolExecutionService.class);
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ToolCatalogue catalogue;
    private final String baseUrl;

    public RestToolExecutionService(RestTemplate restTemplate,
                                    ToolCatalogue catalogue,
                                    @Value("${proflow.tools.base-url:http://localhost:8090}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.catalogue = catalogue;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public ToolExecutionResult execute(String toolName, Map<String, Object> arguments, String userId) {
        if (!catalogue.contains(toolName)) {
            return ToolExecutionResult.failed("Unknown tool: " + toolName);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("arguments", arguments != null ? arguments : Map.of());
        body.put("user_id", userId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-User-Id", userId);

        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    baseUrl + "/tools/" + toolName, HttpMethod.POST, new HttpEntity<>(body, headers), MAP_TYPE);
            Map<String, Object> payload = response.getBody() != null ? response.getBody() : Map.of();
            if (Boolean.FALSE.equals(payload.get("success")) || payload.containsKey("error")) {
                Object error = payload.get("error");
                log.warn("[Tool] {} returned error for user {}: {}", toolName, userId, error);
                return ToolExecutionResult.failed(error != null ? error.toString() : "tool reported failure");
            }
            log.info("[Tool] {} completed for user {}", toolName, userId);
            return ToolExecutionResult.ok(payload.get("result"));

        } catch (HttpStatusCodeException e) {
            log.warn("[Tool] {} HTTP {}", toolName, e.getStatusCode().value());
            return ToolExecutionResult.failed("HTTP " + e.getStatusCode().value() + ": " + truncate(e.getResponseBodyAsString()));
        } catch (RestClientException e) {
            log.error("[Tool] {} request failed: {}", toolName, e.getMessage());
            return ToolExecutionResult.failed("Tool gateway unreachable: " + e.getMessage());
        }
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
