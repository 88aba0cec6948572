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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StoreConfig resolution: builder values, system properties and defaults.
 */
class StoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("filekv.baseDir");
        System.clearProperty("filekv.syncEnabled");
        System.clearProperty("filekv.renameMaxAttempts");
        System.clearProperty("filekv.renameRetryDelayMs");
        System.clearProperty("filekv.staleTempThresholdMinutes");
        System.clearProperty("filekv.cleanupOnStartup");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Unset values fall back to defaults")
        void testDefaults() {
            StoreConfig config = StoreConfig.builder().build();

            assertEquals(Path.of(StoreConfig.DEFAULT_BASE_DIR), config.baseDir());
            assertTrue(config.syncEnabled());
            assertEquals(5, config.renameMaxAttempts());
            assertEquals(Duration.ofMillis(10), config.renameRetryDelay());
            assertEquals(Duration.ofHours(1), config.staleTempThreshold());
            assertTrue(config.cleanupOnStartup());
        }

        @Test
        @DisplayName("Blank base dir means the default directory")
        void testBlankBaseDir_UsesDefault() {
            assertEquals(Path.of("data"), StoreConfig.builder().baseDir("").build().baseDir());
            assertEquals(Path.of("data"), StoreConfig.builder().baseDir("   ").build().baseDir());
        }

        @Test
        @DisplayName("load() is the same as builder().build()")
        void testLoad() {
            assertEquals(StoreConfig.builder().build().toString(), StoreConfig.load().toString());
        }
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property baseDir is respected")
        void testBaseDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("filekv.baseDir", customDir.toString());

            assertEquals(customDir, StoreConfig.builder().build().baseDir());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemPropertyFalse() {
            System.setProperty("filekv.syncEnabled", "false");

            assertFalse(StoreConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("Numeric system properties are respected")
        void testNumericSystemProperties() {
            System.setProperty("filekv.renameMaxAttempts", "9");
            System.setProperty("filekv.renameRetryDelayMs", "25");
            System.setProperty("filekv.staleTempThresholdMinutes", "5");

            StoreConfig config = StoreConfig.builder().build();

            assertEquals(9, config.renameMaxAttempts());
            assertEquals(Duration.ofMillis(25), config.renameRetryDelay());
            assertEquals(Duration.ofMinutes(5), config.staleTempThreshold());
        }

        @Test
        @DisplayName("System property cleanupOnStartup=false is respected")
        void testCleanupOnStartupSystemProperty() {
            System.setProperty("filekv.cleanupOnStartup", "false");

            assertFalse(StoreConfig.builder().build().cleanupOnStartup());
        }

        @Test
        @DisplayName("Unparsable number falls back to the default")
        void testInvalidNumber_UsesDefault() {
            System.setProperty("filekv.renameMaxAttempts", "lots");

            assertEquals(5, StoreConfig.builder().build().renameMaxAttempts());
        }

        @Test
        @DisplayName("Builder values override system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("filekv.syncEnabled", "false");
            System.setProperty("filekv.baseDir", tempDir.resolve("from-property").toString());

            StoreConfig config = StoreConfig.builder()
                    .baseDir(tempDir.resolve("from-builder"))
                    .syncEnabled(true)
                    .build();

            assertEquals(tempDir.resolve("from-builder"), config.baseDir());
            assertTrue(config.syncEnabled());
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("renameMaxAttempts below 1 is rejected")
        void testRenameMaxAttempts_Zero_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().renameMaxAttempts(0).build());
        }

        @Test
        @DisplayName("Negative durations are rejected")
        void testNegativeDurations_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().renameRetryDelay(Duration.ofMillis(-1)).build());
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().staleTempThreshold(Duration.ofMinutes(-1)).build());
        }

        @Test
        @DisplayName("toString shows every setting")
        void testToString() {
            String text = StoreConfig.builder()
                    .baseDir(tempDir)
                    .syncEnabled(false)
                    .renameRetryDelay(Duration.ofMillis(7))
                    .build()
                    .toString();

            assertTrue(text.contains("syncEnabled=false"), text);
            assertTrue(text.contains("renameRetryDelay=7ms"), text);
            assertTrue(text.contains(tempDir.toString()), text);
        }
    }
}
