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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecordFilenames}: sanitizing, truncation, hashing and the
 * staging-file pattern.
 */
class RecordFilenamesTest {

    private static final Pattern RECORD_NAME =
            Pattern.compile("^task-[a-z0-9\\-]+-[a-z0-9\\-]+-[0-9a-f]{16}\\.json$");

    // ========================================================================
    // Sanitize
    // ========================================================================

    @Nested
    @DisplayName("Sanitize")
    class SanitizeTests {

        static Stream<Arguments> sanitizeCases() {
            return Stream.of(
                    Arguments.of("MyTask", "my-task"),
                    Arguments.of("task_name_v1", "task-name-v-1"),
                    Arguments.of("JSONData", "json-data"),
                    Arguments.of("  Spaced  ", "spaced"),
                    Arguments.of("C:\\Windows\\System32", "c--windows-system-32"),
                    Arguments.of("../secretdir", "---secretdir"),
                    Arguments.of("Cool<File>:Name\"|?*", "cool-file--name----"),
                    Arguments.of("Null\u0000Char", "null-char"),
                    Arguments.of("Line\nTab\tReturn\r", "line-tab-return"),
                    Arguments.of("테스트_작업", "------"),
                    Arguments.of("Go🚀", "go--"),
                    Arguments.of("__Init__ !@# Process..", "--init---!@#-process--")
            );
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("sanitizeCases")
        @DisplayName("Produces the readable kebab-case form")
        void testSanitize(String input, String expected) {
            assertEquals(expected, RecordFilenames.sanitize(input));
        }

        @ParameterizedTest
        @ValueSource(strings = {"..", "../..", "a/b", "a\\b", "x:y", "<>", "\"q\"", "what?", "star*", "p|q",
                "\u0001ctrl\u007f", "...."})
        @DisplayName("Never contains traversal, separators, reserved or control characters")
        void testSanitize_NoHostileCharacters(String input) {
            String result = RecordFilenames.sanitize(input);

            assertFalse(result.contains(".."), result);
            for (char c : "/\\|<>:\"?*".toCharArray()) {
                assertEquals(-1, result.indexOf(c), "Found '" + c + "' in " + result);
            }
            for (char c : result.toCharArray()) {
                assertTrue(c >= 0x20 && c != 0x7F, "Control character in " + result);
            }
        }
    }

    // ========================================================================
    // Non-ASCII Keys
    // ========================================================================

    @Nested
    @DisplayName("Non-ASCII keys")
    class NonAsciiTests {

        @ParameterizedTest
        @ValueSource(strings = {"테스트_작업", "Task🚀Launch", "bad\uD800key", "\uDC00", "caf\u00e9", "\u007f\u0080\u00ff"})
        @DisplayName("Filenames are printable ASCII whatever the key")
        void testFilenameFor_AlwaysPrintableAscii(String part) {
            String name = RecordFilenames.filenameFor(part, part, "json");

            for (char c : name.toCharArray()) {
                assertTrue(c >= 0x20 && c < 0x7F, "Non-ASCII char U+" + Integer.toHexString(c) + " in " + name);
            }
            assertTrue(RECORD_NAME.matcher(name).matches(), name);
        }

        @Test
        @DisplayName("Distinct unpaired surrogates hash differently")
        void testKeyHash_LoneSurrogatesDistinct() {
            assertNotEquals(RecordFilenames.keyHash("\uD800", "c"), RecordFilenames.keyHash("\uD801", "c"));
            assertNotEquals(RecordFilenames.keyHash("\uDC00", "c"), RecordFilenames.keyHash("?", "c"));
            assertNotEquals(RecordFilenames.filenameFor("a\uD800", "c", "json"),
                    RecordFilenames.filenameFor("a\uD801", "c", "json"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "ascii", "한글", "Go🚀", "caf\u00e9"})
        @DisplayName("Hash bytes equal UTF-8 for well-formed text")
        void testHashBytes_MatchUtf8(String text) {
            assertArrayEquals(text.getBytes(StandardCharsets.UTF_8), RecordFilenames.hashBytes(text));
        }

        @Test
        @DisplayName("Unpaired surrogate is written as its own three bytes")
        void testHashBytes_LoneSurrogate() {
            assertArrayEquals(new byte[]{'a', (byte) 0xED, (byte) 0xA0, (byte) 0x80},
                    RecordFilenames.hashBytes("a\uD800"));
        }
    }

    // ========================================================================
    // Truncate
    // ========================================================================

    @Nested
    @DisplayName("Truncate")
    class TruncateTests {

        static Stream<Arguments> truncateCases() {
            return Stream.of(
                    Arguments.of("hello", 10, "hello"),
                    Arguments.of("hello", 3, "hel"),
                    Arguments.of("한글", 5, "한"),
                    Arguments.of("한글", 2, ""),
                    Arguments.of("한글", 6, "한글"),
                    Arguments.of("Go🚀", 5, "Go"),
                    Arguments.of("Go🚀", 6, "Go🚀"),
                    Arguments.of("", 5, "")
            );
        }

        @ParameterizedTest(name = "[{index}] \"{0}\" to {1} bytes")
        @MethodSource("truncateCases")
        @DisplayName("Cuts on code point boundaries")
        void testTruncateUtf8(String input, int limit, String expected) {
            String result = RecordFilenames.truncateUtf8(input, limit);

            assertEquals(expected, result);
            assertTrue(result.getBytes(StandardCharsets.UTF_8).length <= limit);
        }
    }

    // ========================================================================
    // Filename
    // ========================================================================

    @Nested
    @DisplayName("Filename")
    class FilenameTests {

        @Test
        @DisplayName("Has the task-<p1>-<p2>-<hash>.<ext> shape")
        void testFilenameFor_Shape() {
            String name = RecordFilenames.filenameFor("NaverShopping", "WatchPrice", "json");

            assertTrue(name.startsWith("task-naver-shopping-watch-price-"), name);
            assertTrue(RECORD_NAME.matcher(name).matches(), name);
        }

        @Test
        @DisplayName("Is deterministic")
        void testFilenameFor_Deterministic() {
            assertEquals(RecordFilenames.filenameFor("a", "b", "json"),
                    RecordFilenames.filenameFor("a", "b", "json"));
        }

        @Test
        @DisplayName("Keys with the same readable form get different names")
        void testFilenameFor_SanitizeCollision() {
            String underscore = RecordFilenames.filenameFor("Task_A", "cmd", "json");
            String hyphen = RecordFilenames.filenameFor("Task-A", "cmd", "json");
            String upper = RecordFilenames.filenameFor("TASK-A", "cmd", "json");

            assertNotEquals(underscore, hyphen);
            assertNotEquals(hyphen, upper);
            assertNotEquals(underscore, upper);
        }

        @Test
        @DisplayName("Moving characters across the part boundary changes the hash")
        void testFilenameFor_DelimiterInjection() {
            assertNotEquals(RecordFilenames.keyHash("ab", "c"), RecordFilenames.keyHash("a", "bc"));
            assertNotEquals(RecordFilenames.keyHash("a|1:b", "c"), RecordFilenames.keyHash("a", "b|1:c"));
        }

        @Test
        @DisplayName("Very long parts keep the name within 128 bytes")
        void testFilenameFor_ExtremeLength() {
            String longId = "A".repeat(160);

            String name = RecordFilenames.filenameFor(longId, longId, "json");

            assertTrue(name.getBytes(StandardCharsets.UTF_8).length <= 128, name);
            assertTrue(RECORD_NAME.matcher(name).matches(), name);
        }

        @Test
        @DisplayName("Long parts differing only past the cut still differ")
        void testFilenameFor_LongPartsDiffer() {
            String prefix = "x".repeat(100);

            assertNotEquals(RecordFilenames.filenameFor(prefix + "1", "op", "json"),
                    RecordFilenames.filenameFor(prefix + "2", "op", "json"));
        }

        @Test
        @DisplayName("Hash matches 64-bit FNV-1a of the framed key")
        void testKeyHash_KnownValue() {
            // FNV-1a 64 of the empty input is the offset basis; "1:a|1:b" is the framing of ("a", "b")
            long expected = 0xcbf29ce484222325L;
            for (byte b : "1:a|1:b".getBytes(StandardCharsets.UTF_8)) {
                expected ^= (b & 0xFF);
                expected *= 0x100000001b3L;
            }

            assertEquals(expected, RecordFilenames.keyHash("a", "b"));
        }

        @Test
        @DisplayName("Framing uses UTF-8 byte lengths")
        void testKeyHash_UsesByteLength() {
            long expected = 0xcbf29ce484222325L;
            for (byte b : "6:한글|1:x".getBytes(StandardCharsets.UTF_8)) {
                expected ^= (b & 0xFF);
                expected *= 0x100000001b3L;
            }

            assertEquals(expected, RecordFilenames.keyHash("한글", "x"));
        }
    }

    // ========================================================================
    // Staging File Pattern
    // ========================================================================

    @Nested
    @DisplayName("Staging file pattern")
    class TempFileNameTests {

        @ParameterizedTest
        @ValueSource(strings = {"task-result-123.tmp", "task-result-abc-def.tmp", "task-result-.tmp"})
        @DisplayName("Matches staging names")
        void testIsTempFileName_Matches(String name) {
            assertTrue(RecordFilenames.isTempFileName(name));
        }

        @ParameterizedTest
        @ValueSource(strings = {"task-a-b-0123456789abcdef.json", "task-result-1.tmp.bak", "other-result-1.tmp",
                "task-result.tmp", "TASK-RESULT-1.TMP", ""})
        @DisplayName("Rejects everything else")
        void testIsTempFileName_Rejects(String name) {
            assertFalse(RecordFilenames.isTempFileName(name));
        }
    }
}
