/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.filekv.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for {@link FileKeyValueStore}.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dfilekv.baseDir=/path})</li>
 *   <li>Environment variables (e.g., {@code FILEKV_BASE_DIR})</li>
 *   <li>Properties file ({@code filekv.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>baseDir</td><td>filekv.baseDir</td><td>FILEKV_BASE_DIR</td><td>data</td></tr>
 *   <tr><td>syncEnabled</td><td>filekv.syncEnabled</td><td>FILEKV_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>renameMaxAttempts</td><td>filekv.renameMaxAttempts</td><td>FILEKV_RENAME_MAX_ATTEMPTS</td><td>5</td></tr>
 *   <tr><td>renameRetryDelayMs</td><td>filekv.renameRetryDelayMs</td><td>FILEKV_RENAME_RETRY_DELAY_MS</td><td>10</td></tr>
 *   <tr><td>staleTempThresholdMinutes</td><td>filekv.staleTempThresholdMinutes</td><td>FILEKV_STALE_TEMP_THRESHOLD_MINUTES</td><td>60</td></tr>
 *   <tr><td>cleanupOnStartup</td><td>filekv.cleanupOnStartup</td><td>FILEKV_CLEANUP_ON_STARTUP</td><td>true</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # filekv.properties
 * filekv.baseDir=/var/lib/notify/data
 * filekv.syncEnabled=true
 * filekv.renameMaxAttempts=5
 * filekv.renameRetryDelayMs=10
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StoreConfig config = StoreConfig.builder()
 *     .baseDir(Path.of("/var/lib/notify/data"))
 *     .syncEnabled(true)
 *     .build();
 *
 * KeyValueStore store = new FileKeyValueStore(config);
 * </pre>
 */
public final class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    private static final String PROPERTIES_FILE = "filekv.properties";

    // Property keys
    private static final String PROP_BASE_DIR = "filekv.baseDir";
    private static final String PROP_SYNC_ENABLED = "filekv.syncEnabled";
    private static final String PROP_RENAME_MAX_ATTEMPTS = "filekv.renameMaxAttempts";
    private static final String PROP_RENAME_RETRY_DELAY_MS = "filekv.renameRetryDelayMs";
    private static final String PROP_STALE_TEMP_THRESHOLD_MINUTES = "filekv.staleTempThresholdMinutes";
    private static final String PROP_CLEANUP_ON_STARTUP = "filekv.cleanupOnStartup";

    // Environment variable keys
    private static final String ENV_BASE_DIR = "FILEKV_BASE_DIR";
    private static final String ENV_SYNC_ENABLED = "FILEKV_SYNC_ENABLED";
    private static final String ENV_RENAME_MAX_ATTEMPTS = "FILEKV_RENAME_MAX_ATTEMPTS";
    private static final String ENV_RENAME_RETRY_DELAY_MS = "FILEKV_RENAME_RETRY_DELAY_MS";
    private static final String ENV_STALE_TEMP_THRESHOLD_MINUTES = "FILEKV_STALE_TEMP_THRESHOLD_MINUTES";
    private static final String ENV_CLEANUP_ON_STARTUP = "FILEKV_CLEANUP_ON_STARTUP";

    // Defaults
    static final String DEFAULT_BASE_DIR = "data";
    static final boolean DEFAULT_SYNC_ENABLED = true;
    static final int DEFAULT_RENAME_MAX_ATTEMPTS = 5;
    static final long DEFAULT_RENAME_RETRY_DELAY_MS = 10;
    static final long DEFAULT_STALE_TEMP_THRESHOLD_MINUTES = 60;
    static final boolean DEFAULT_CLEANUP_ON_STARTUP = true;

    private final Path baseDir;
    private final boolean syncEnabled;
    private final int renameMaxAttempts;
    private final Duration renameRetryDelay;
    private final Duration staleTempThreshold;
    private final boolean cleanupOnStartup;

    private StoreConfig(Builder builder) {
        this.baseDir = builder.baseDir;
        this.syncEnabled = builder.syncEnabled;
        this.renameMaxAttempts = builder.renameMaxAttempts;
        this.renameRetryDelay = builder.renameRetryDelay;
        this.staleTempThreshold = builder.staleTempThreshold;
        this.cleanupOnStartup = builder.cleanupOnStartup;
    }

    /** Directory holding record files, as configured (possibly relative). */
    public Path baseDir() {
        return baseDir;
    }

    /** Whether file and directory fsync is performed (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** How many times a save tries to rename its staging file before failing. */
    public int renameMaxAttempts() {
        return renameMaxAttempts;
    }

    /** Pause between rename attempts. */
    public Duration renameRetryDelay() {
        return renameRetryDelay;
    }

    /** Staging files at least this old are removed by the startup cleanup. */
    public Duration staleTempThreshold() {
        return staleTempThreshold;
    }

    /** Whether construction launches the background stale staging file cleanup. */
    public boolean cleanupOnStartup() {
        return cleanupOnStartup;
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "baseDir=" + baseDir +
                ", syncEnabled=" + syncEnabled +
                ", renameMaxAttempts=" + renameMaxAttempts +
                ", renameRetryDelay=" + renameRetryDelay.toMillis() + "ms" +
                ", staleTempThreshold=" + staleTempThreshold.toMinutes() + "min" +
                ", cleanupOnStartup=" + cleanupOnStartup +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StoreConfig.builder().build()}.
     */
    public static StoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path baseDir;
        private Boolean syncEnabled;
        private Integer renameMaxAttempts;
        private Duration renameRetryDelay;
        private Duration staleTempThreshold;
        private Boolean cleanupOnStartup;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the base directory. */
        public Builder baseDir(Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        /** Sets the base directory from a string path; blank means the default {@code data}. */
        public Builder baseDir(String baseDir) {
            this.baseDir = baseDir == null || baseDir.isBlank() ? null : Path.of(baseDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the number of rename attempts per save (default: 5). */
        public Builder renameMaxAttempts(int renameMaxAttempts) {
            this.renameMaxAttempts = renameMaxAttempts;
            return this;
        }

        /** Sets the pause between rename attempts (default: 10 ms). */
        public Builder renameRetryDelay(Duration renameRetryDelay) {
            this.renameRetryDelay = renameRetryDelay;
            return this;
        }

        /** Sets the age beyond which staging files count as abandoned (default: 1 hour). */
        public Builder staleTempThreshold(Duration staleTempThreshold) {
            this.staleTempThreshold = staleTempThreshold;
            return this;
        }

        /** Enables or disables the background cleanup at construction (default: true). */
        public Builder cleanupOnStartup(boolean cleanupOnStartup) {
            this.cleanupOnStartup = cleanupOnStartup;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public StoreConfig build() {
            if (baseDir == null) {
                baseDir = Path.of(resolve(PROP_BASE_DIR, ENV_BASE_DIR, DEFAULT_BASE_DIR));
            }
            if (syncEnabled == null) {
                syncEnabled = Boolean.parseBoolean(
                        resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, String.valueOf(DEFAULT_SYNC_ENABLED)));
            }
            if (renameMaxAttempts == null) {
                renameMaxAttempts = (int) resolveLong(PROP_RENAME_MAX_ATTEMPTS, ENV_RENAME_MAX_ATTEMPTS,
                        DEFAULT_RENAME_MAX_ATTEMPTS);
            }
            if (renameRetryDelay == null) {
                renameRetryDelay = Duration.ofMillis(resolveLong(PROP_RENAME_RETRY_DELAY_MS,
                        ENV_RENAME_RETRY_DELAY_MS, DEFAULT_RENAME_RETRY_DELAY_MS));
            }
            if (staleTempThreshold == null) {
                staleTempThreshold = Duration.ofMinutes(resolveLong(PROP_STALE_TEMP_THRESHOLD_MINUTES,
                        ENV_STALE_TEMP_THRESHOLD_MINUTES, DEFAULT_STALE_TEMP_THRESHOLD_MINUTES));
            }
            if (cleanupOnStartup == null) {
                cleanupOnStartup = Boolean.parseBoolean(resolve(PROP_CLEANUP_ON_STARTUP,
                        ENV_CLEANUP_ON_STARTUP, String.valueOf(DEFAULT_CLEANUP_ON_STARTUP)));
            }

            if (renameMaxAttempts < 1) {
                throw new IllegalArgumentException("renameMaxAttempts must be >= 1: " + renameMaxAttempts);
            }
            if (renameRetryDelay.isNegative()) {
                throw new IllegalArgumentException("renameRetryDelay must not be negative: " + renameRetryDelay);
            }
            if (staleTempThreshold.isNegative()) {
                throw new IllegalArgumentException("staleTempThreshold must not be negative: " + staleTempThreshold);
            }

            return new StoreConfig(this);
        }

        private String resolve(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            // 4. Default
            return defaultValue;
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            String value = resolve(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric {}={}, using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}, using other sources: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
