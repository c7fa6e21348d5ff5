package dev.mars.pagelift.config;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the upload engine.
 *
 * <p>Values are layered: built-in defaults, then the first readable
 * {@code pagelift.properties} file from the working directory, {@code config/},
 * {@code ~/.pagelift/} or {@code /etc/pagelift/}, then a {@code pagelift.properties}
 * classpath resource, then system properties starting with {@code pagelift.}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PageliftConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PageliftConfiguration.class);

    public static final String PARALLELISM = "pagelift.transfer.parallelism";
    public static final String QUEUE_CAPACITY = "pagelift.transfer.queue.capacity";
    public static final String CHUNK_QUEUE_CAPACITY = "pagelift.transfer.chunk.queue.capacity";
    public static final String MAX_RETRIES = "pagelift.transfer.max.retries";
    public static final String RETRY_DELAY_MS = "pagelift.transfer.retry.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "pagelift.transfer.retry.max.delay.ms";
    public static final String PAGE_SIZE = "pagelift.page.size";
    public static final String CHUNK_SIZE = "pagelift.chunk.size";
    public static final String PROGRESS_TICK_MS = "pagelift.progress.tick.ms";
    public static final String PROGRESS_WINDOW_SIZE = "pagelift.progress.window.size";
    public static final String CHECKSUM_ALGORITHM = "pagelift.checksum.algorithm";
    public static final String METRICS_ENABLED = "pagelift.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_QUEUE_CAPACITY = 0;
    private static final int DEFAULT_CHUNK_QUEUE_CAPACITY = 0;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 30000;
    private static final long DEFAULT_PAGE_SIZE = 512;
    private static final long DEFAULT_CHUNK_SIZE = 4L * 1024 * 1024; // largest single page write
    private static final long DEFAULT_PROGRESS_TICK_MS = 1000;
    private static final int DEFAULT_PROGRESS_WINDOW_SIZE = 60;
    private static final String DEFAULT_CHECKSUM_ALGORITHM = "MD5";

    private final Properties properties;

    public PageliftConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public PageliftConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Transfer configuration
    public int getParallelism() {
        return getIntProperty(PARALLELISM, defaultParallelism(), 1);
    }

    /**
     * Capacity of the request queue between the dispatch loop and the workers;
     * zero means every request is handed over directly to a waiting worker.
     */
    public int getQueueCapacity() {
        return getIntProperty(QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY, 0);
    }

    public int getChunkQueueCapacity() {
        return getIntProperty(CHUNK_QUEUE_CAPACITY, DEFAULT_CHUNK_QUEUE_CAPACITY, 0);
    }

    /**
     * Retries allowed after the first failed attempt of a request; negative means unbounded.
     */
    public int getMaxRetries() {
        return getIntProperty(MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS, 0);
    }

    public long getRetryMaxDelayMs() {
        return getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS, 0);
    }

    // Layout configuration
    public long getPageSize() {
        return getLongProperty(PAGE_SIZE, DEFAULT_PAGE_SIZE, 1);
    }

    public long getChunkSize() {
        return getLongProperty(CHUNK_SIZE, DEFAULT_CHUNK_SIZE, 1);
    }

    // Progress configuration
    public Duration getProgressTickInterval() {
        return Duration.ofMillis(getLongProperty(PROGRESS_TICK_MS, DEFAULT_PROGRESS_TICK_MS, 1));
    }

    /**
     * Number of samples in the throughput window; at least two.
     */
    public int getProgressWindowSize() {
        return getIntProperty(PROGRESS_WINDOW_SIZE, DEFAULT_PROGRESS_WINDOW_SIZE, 2);
    }

    public String getChecksumAlgorithm() {
        return getStringProperty(CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    static int defaultParallelism() {
        return 8 * Runtime.getRuntime().availableProcessors();
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private int getIntProperty(String key, int defaultValue, int minimum) {
        int value = getIntProperty(key, defaultValue);
        if (value < minimum) {
            logger.warn("Value {} for property {} is below the minimum of {}. Using default: {}",
                    value, key, minimum, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private long getLongProperty(String key, long defaultValue, long minimum) {
        long value = getLongProperty(key, defaultValue);
        if (value < minimum) {
            logger.warn("Value {} for property {} is below the minimum of {}. Using default: {}",
                    value, key, minimum, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        // Parallelism is left unset so that it tracks the processor count of the running host
        properties.setProperty(QUEUE_CAPACITY, String.valueOf(DEFAULT_QUEUE_CAPACITY));
        properties.setProperty(CHUNK_QUEUE_CAPACITY, String.valueOf(DEFAULT_CHUNK_QUEUE_CAPACITY));
        properties.setProperty(MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY_MS));
        properties.setProperty(PAGE_SIZE, String.valueOf(DEFAULT_PAGE_SIZE));
        properties.setProperty(CHUNK_SIZE, String.valueOf(DEFAULT_CHUNK_SIZE));
        properties.setProperty(PROGRESS_TICK_MS, String.valueOf(DEFAULT_PROGRESS_TICK_MS));
        properties.setProperty(PROGRESS_WINDOW_SIZE, String.valueOf(DEFAULT_PROGRESS_WINDOW_SIZE));
        properties.setProperty(CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "pagelift.properties",
                "config/pagelift.properties",
                System.getProperty("user.home") + "/.pagelift/pagelift.properties",
                "/etc/pagelift/pagelift.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("pagelift.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("pagelift."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "PageliftConfiguration{" +
                "parallelism=" + getParallelism() +
                ", queueCapacity=" + getQueueCapacity() +
                ", maxRetries=" + getMaxRetries() +
                ", pageSize=" + getPageSize() +
                ", chunkSize=" + getChunkSize() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
