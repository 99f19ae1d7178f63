package dev.mars.syncore.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;

/**
 * Configuration management for the coordination core.
 *
 * <p>Properties are layered: {@code /syncore-default.properties}, then
 * {@code /syncore-<profile>.properties}, then {@code SYNCORE_*} environment variables, then
 * {@code syncore.*} system properties, then any programmatic overrides.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class SyncoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SyncoreConfiguration.class);

    private final Properties properties;
    private final String profile;

    public SyncoreConfiguration() {
        this(getActiveProfile());
    }

    public SyncoreConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Constructor for programmatic configuration. Overrides win over every other source and
     * avoid polluting system properties when several coordinators run in one JVM.
     *
     * @param profile   the configuration profile to use
     * @param overrides property overrides keyed by full property name
     */
    public SyncoreConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.info("Loaded syncore configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("syncore.profile",
               System.getenv("SYNCORE_PROFILE") != null ? System.getenv("SYNCORE_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/syncore-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/syncore-" + profile + ".properties");
        }

        // Env first, system properties after so -D wins
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("SYNCORE_")) {
                String propKey = key.toLowerCase().replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("syncore.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateSchedulerConfig(errors);
        validateRoutingConfig(errors);
        validateStrategyConfig(errors);
        validateHealthConfig(errors);
        validateCoordinatorConfig(errors);
        validateMetricsConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateSchedulerConfig(List<String> errors) {
        Duration agingInterval = getDuration("syncore.scheduler.aging-interval", Duration.ofSeconds(10));
        if (agingInterval.toMillis() < 1) {
            errors.add("Scheduler aging interval must be at least 1ms");
        }

        double agingFactor = getDouble("syncore.scheduler.aging-factor", 0.1);
        if (agingFactor <= 0.0 || agingFactor > 4.0) {
            errors.add("Scheduler aging factor must be greater than 0 and at most 4");
        }
    }

    private void validateRoutingConfig(List<String> errors) {
        int hubThreshold = getInt("syncore.routing.hub-health-threshold", 50);
        if (hubThreshold < 0 || hubThreshold > 100) {
            errors.add("Hub health threshold must be between 0 and 100");
        }

        if (getInt("syncore.routing.direct-queue-limit", 100) < 1) {
            errors.add("Direct queue limit must be at least 1");
        }

        if (getInt("syncore.routing.history-size", 500) < 1) {
            errors.add("Routing history size must be at least 1");
        }
    }

    private void validateStrategyConfig(List<String> errors) {
        if (getInt("syncore.strategy.distributed-threshold", 4) < 2) {
            errors.add("Distributed threshold must be at least 2");
        }

        if (getInt("syncore.strategy.max-active-operations", 100) < 1) {
            errors.add("Max active operations must be at least 1");
        }

        if (getDouble("syncore.strategy.queue-load-threshold", 50.0) < 0.0) {
            errors.add("Queue load threshold must be non-negative");
        }
    }

    private void validateHealthConfig(List<String> errors) {
        Duration interval = getDuration("syncore.health.check-interval", Duration.ofSeconds(30));
        if (interval.toMillis() < 10) {
            errors.add("Health check interval must be at least 10ms");
        }

        double componentWeight = getDouble("syncore.health.component-weight", 0.8);
        if (componentWeight < 0.0 || componentWeight > 1.0) {
            errors.add("Health component weight must be between 0 and 1");
        }
    }

    private void validateCoordinatorConfig(List<String> errors) {
        Duration timeout = getDuration("syncore.coordinator.operation-timeout", Duration.ofMinutes(5));
        if (timeout.toMillis() < 1) {
            errors.add("Operation timeout must be positive");
        }

        int queueCapacity = getInt("syncore.coordinator.message-queue-capacity", 1000);
        int directLimit = getInt("syncore.routing.direct-queue-limit", 100);
        if (queueCapacity < 1) {
            errors.add("Message queue capacity must be at least 1");
        } else if (queueCapacity < directLimit) {
            errors.add("Message queue capacity must not be smaller than the direct queue limit");
        }

        if (getInt("syncore.coordinator.dispatch-batch-size", 10) < 1) {
            errors.add("Dispatch batch size must be at least 1");
        }

        if (getInt("syncore.coordinator.event-buffer-size", 1000) < 1) {
            errors.add("Event buffer size must be at least 1");
        }
    }

    private void validateMetricsConfig(List<String> errors) {
        boolean metricsEnabled = getBoolean("syncore.metrics.enabled", true);
        if (metricsEnabled) {
            Duration exportInterval = getDuration("syncore.metrics.export-interval", Duration.ofMinutes(5));
            if (exportInterval.toMillis() < 10) {
                errors.add("Metrics export interval must be at least 10ms");
            }
        }
    }

    // Configuration getters with defaults and validation
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders
    public SchedulerConfig getSchedulerConfig() {
        return new SchedulerConfig(
            getDuration("syncore.scheduler.aging-interval", Duration.ofSeconds(10)),
            getDouble("syncore.scheduler.aging-factor", 0.1),
            getBoolean("syncore.scheduler.quota-enabled", true),
            getBoolean("syncore.scheduler.fairness-enabled", true)
        );
    }

    public RoutingConfig getRoutingConfig() {
        return new RoutingConfig(
            getInt("syncore.routing.hub-health-threshold", 50),
            getInt("syncore.routing.direct-queue-limit", 100),
            getDouble("syncore.routing.direct-connection-load-threshold", 40.0),
            getInt("syncore.routing.history-size", 500),
            getDouble("syncore.routing.baseline.hub-latency-ms", 100.0),
            getDouble("syncore.routing.baseline.direct-latency-ms", 40.0)
        );
    }

    public StrategyConfig getStrategyConfig() {
        return new StrategyConfig(
            getInt("syncore.strategy.distributed-threshold", 4),
            getDouble("syncore.strategy.queue-load-threshold", 50.0),
            getInt("syncore.strategy.max-active-operations", 100)
        );
    }

    public HealthConfig getHealthConfig() {
        return new HealthConfig(
            getBoolean("syncore.health.enabled", true),
            getDuration("syncore.health.check-interval", Duration.ofSeconds(30)),
            getDouble("syncore.health.component-weight", 0.8)
        );
    }

    public CoordinatorConfig getCoordinatorConfig() {
        return new CoordinatorConfig(
            getDuration("syncore.coordinator.operation-timeout", Duration.ofMinutes(5)),
            getDuration("syncore.coordinator.dispatch-interval", Duration.ofSeconds(1)),
            getInt("syncore.coordinator.dispatch-batch-size", 10),
            getInt("syncore.coordinator.message-queue-capacity", 1000),
            getInt("syncore.coordinator.event-buffer-size", 1000)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("syncore.metrics.enabled", true),
            getDuration("syncore.metrics.export-interval", Duration.ofMinutes(5)),
            getString("syncore.metrics.instance-id", "syncore-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes
    public static class SchedulerConfig {
        private final Duration agingInterval;
        private final double agingFactor;
        private final boolean quotaEnabled;
        private final boolean fairnessEnabled;

        public SchedulerConfig(Duration agingInterval, double agingFactor, boolean quotaEnabled, boolean fairnessEnabled) {
            this.agingInterval = agingInterval;
            this.agingFactor = agingFactor;
            this.quotaEnabled = quotaEnabled;
            this.fairnessEnabled = fairnessEnabled;
        }

        public static SchedulerConfig defaults() {
            return new SchedulerConfig(Duration.ofSeconds(10), 0.1, true, true);
        }

        public Duration getAgingInterval() { return agingInterval; }
        public double getAgingFactor() { return agingFactor; }
        public boolean isQuotaEnabled() { return quotaEnabled; }
        public boolean isFairnessEnabled() { return fairnessEnabled; }
    }

    public static class RoutingConfig {
        private final int hubHealthThreshold;
        private final int directQueueLimit;
        private final double directConnectionLoadThreshold;
        private final int historySize;
        private final double baselineHubLatencyMs;
        private final double baselineDirectLatencyMs;

        public RoutingConfig(int hubHealthThreshold, int directQueueLimit, double directConnectionLoadThreshold,
                             int historySize, double baselineHubLatencyMs, double baselineDirectLatencyMs) {
            this.hubHealthThreshold = hubHealthThreshold;
            this.directQueueLimit = directQueueLimit;
            this.directConnectionLoadThreshold = directConnectionLoadThreshold;
            this.historySize = historySize;
            this.baselineHubLatencyMs = baselineHubLatencyMs;
            this.baselineDirectLatencyMs = baselineDirectLatencyMs;
        }

        public static RoutingConfig defaults() {
            return new RoutingConfig(50, 100, 40.0, 500, 100.0, 40.0);
        }

        public int getHubHealthThreshold() { return hubHealthThreshold; }
        public int getDirectQueueLimit() { return directQueueLimit; }
        public double getDirectConnectionLoadThreshold() { return directConnectionLoadThreshold; }
        public int getHistorySize() { return historySize; }
        public double getBaselineHubLatencyMs() { return baselineHubLatencyMs; }
        public double getBaselineDirectLatencyMs() { return baselineDirectLatencyMs; }
    }

    public static class StrategyConfig {
        private final int distributedThreshold;
        private final double queueLoadThreshold;
        private final int maxActiveOperations;

        public StrategyConfig(int distributedThreshold, double queueLoadThreshold, int maxActiveOperations) {
            this.distributedThreshold = distributedThreshold;
            this.queueLoadThreshold = queueLoadThreshold;
            this.maxActiveOperations = maxActiveOperations;
        }

        public static StrategyConfig defaults() {
            return new StrategyConfig(4, 50.0, 100);
        }

        public int getDistributedThreshold() { return distributedThreshold; }
        public double getQueueLoadThreshold() { return queueLoadThreshold; }
        public int getMaxActiveOperations() { return maxActiveOperations; }
    }

    public static class HealthConfig {
        private final boolean enabled;
        private final Duration checkInterval;
        private final double componentWeight;

        public HealthConfig(boolean enabled, Duration checkInterval, double componentWeight) {
            this.enabled = enabled;
            this.checkInterval = checkInterval;
            this.componentWeight = componentWeight;
        }

        public static HealthConfig defaults() {
            return new HealthConfig(true, Duration.ofSeconds(30), 0.8);
        }

        public boolean isEnabled() { return enabled; }
        public Duration getCheckInterval() { return checkInterval; }
        public double getComponentWeight() { return componentWeight; }
    }

    public static class CoordinatorConfig {
        private final Duration operationTimeout;
        private final Duration dispatchInterval;
        private final int dispatchBatchSize;
        private final int messageQueueCapacity;
        private final int eventBufferSize;

        public CoordinatorConfig(Duration operationTimeout, Duration dispatchInterval, int dispatchBatchSize,
                                 int messageQueueCapacity, int eventBufferSize) {
            this.operationTimeout = operationTimeout;
            this.dispatchInterval = dispatchInterval;
            this.dispatchBatchSize = dispatchBatchSize;
            this.messageQueueCapacity = messageQueueCapacity;
            this.eventBufferSize = eventBufferSize;
        }

        public Duration getOperationTimeout() { return operationTimeout; }
        public Duration getDispatchInterval() { return dispatchInterval; }
        public int getDispatchBatchSize() { return dispatchBatchSize; }
        public int getMessageQueueCapacity() { return messageQueueCapacity; }
        public int getEventBufferSize() { return eventBufferSize; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final Duration exportInterval;
        private final String instanceId;

        public MetricsConfig(boolean enabled, Duration exportInterval, String instanceId) {
            this.enabled = enabled;
            this.exportInterval = exportInterval;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public Duration getExportInterval() { return exportInterval; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() { return new Properties(properties); }
}
