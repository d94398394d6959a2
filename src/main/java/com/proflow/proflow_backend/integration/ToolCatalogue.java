package com.proflow.proflow_backend.integration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Tool definitions the decision engine may call, loaded once from the classpath. */
@Slf4j
@Component
public class ToolCatalogue {

    private final ObjectMapper objectMapper;
    private final String location;
    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

    public ToolCatalogue(ObjectMapper objectMapper,
                         @Value("${proflow.tools.catalogue:tool-catalogue.json}") String location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @PostConstruct
    public void load() {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            List<ToolDefinition> definitions = objectMapper.readValue(in, new TypeReference<List<ToolDefinition>>() {});
            definitions.forEach(def -> tools.put(def.name(), def));
            log.info("Loaded {} tool definitions from {}", tools.size(), location);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load tool catalogue from classpath:" + location, e);
        }
    }

    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }
}
