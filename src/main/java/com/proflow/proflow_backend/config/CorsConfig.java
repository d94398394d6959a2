package com.proflow.proflow_backend.config;

import com.proflow.proflow_backend.controller.WorkflowController;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

@Configuration
public class CorsConfig {

    private final ProflowProperties properties;

    public CorsConfig(ProflowProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration api = new CorsConfiguration();
        properties.getCors().getAllowedOrigins().forEach(api::addAllowedOriginPattern);
        // The API only starts, continues, cancels and reads workflows
        api.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        api.setAllowedHeaders(List.of("Content-Type", WorkflowController.USER_HEADER));
        api.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", api);
        return new CorsFilter(source);
    }
}
