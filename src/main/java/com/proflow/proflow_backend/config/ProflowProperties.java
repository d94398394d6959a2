package com.proflow.proflow_backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from {@code proflow.*}. Adapter endpoints (tool gateway,
 * decision engine, context retrieval) are read with {@code @Value} where they are used.
 */
@ConfigurationProperties(prefix = "proflow")
@Validated
@Data
public class ProflowProperties {

    @Valid
    @NotNull
    private WorkflowConfig workflow = new WorkflowConfig();

    @Valid
    @NotNull
    private DispatchConfig dispatch = new DispatchConfig();

    @Valid
    @NotNull
    private EventConfig events = new EventConfig();

    @Valid
    @NotNull
    private CorsSettings cors = new CorsSettings();

    @Data
    public static class WorkflowConfig {

        /**
         * How long a driver pass owns a workflow before another pass may take it over.
         * Renewed before every step.
         */
        @NotNull
        private Duration leaseDuration = Duration.ofMinutes(5);

        /**
         * Upper bound on steps executed in one pass. Exceeding it fails the workflow.
         */
        @Min(1)
        private int maxIterationsPerPass = 100;

        /**
         * Reminder budget given to new workflows.
         */
        @Min(0)
        private int defaultMaxRetries = 3;

        /**
         * How far a reminder pushes timeout_at.
         */
        @NotNull
        private Duration reminderExtension = Duration.ofHours(24);

        /**
         * Terminal workflows older than this are purged.
         */
        @NotNull
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class DispatchConfig {

        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 500;

        /**
         * Retries of a whole run invocation after a transient infrastructure failure.
         */
        @Min(0)
        private int runRetries = 3;

        @NotNull
        private Duration runInitialBackoff = Duration.ofSeconds(1);

        @Min(0)
        private int resumeRetries = 2;

        @NotNull
        private Duration resumeInitialBackoff = Duration.ofSeconds(5);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0d;
    }

    @Data
    public static class EventConfig {

        /**
         * Fan workflow events out through Redis pub/sub so every instance's
         * WebSocket clients receive them.
         */
        private boolean redisEnabled = false;
    }

    @Data
    public static class CorsSettings {

        /** Origin patterns allowed to call the API and open the WebSocket; comma-separated in the environment. */
        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
