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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Maps a two-part key to the name of its record file.
 * <p>
 * <b>Format:</b> {@code task-<part1>-<part2>-<hash>.<ext>}
 * <ul>
 *   <li>Each part is sanitized to a readable kebab-case form with every
 *       filesystem-hostile sequence replaced, then cut to {@value #MAX_PART_BYTES}
 *       UTF-8 bytes on a code-point boundary.</li>
 *   <li>The hash is 64-bit FNV-1a over the <em>unsanitized</em> parts, length-prefixed
 *       as {@code "<len1>:<part1>|<len2>:<part2>"}, written as 16 hex digits.
 *       Keys that sanitize to the same readable text, or whose concatenations
 *       match ({@code ("ab","c")} vs {@code ("a","bc")}), still get distinct names.</li>
 * </ul>
 * <p>
 * Staging files written during a save are named {@code task-result-*.tmp}.
 */
public final class RecordFilenames {

    /** Fixed prefix of every record file. */
    public static final String RECORD_PREFIX = "task";

    /** Prefix of staging files created during a save. */
    public static final String TEMP_PREFIX = "task-result-";

    /** Suffix of staging files created during a save. */
    public static final String TEMP_SUFFIX = ".tmp";

    /** Byte budget of each sanitized key part. */
    public static final int MAX_PART_BYTES = 50;

    private static final long FNV64_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV64_PRIME = 0x100000001b3L;

    private static final String[][] HOSTILE_SEQUENCES = {
            {"..", "--"},
            {"/", "-"},
            {"\\", "-"},
            {"|", "-"},
            {"<", "-"},
            {">", "-"},
            {":", "-"},
            {"\"", "-"},
            {"?", "-"},
            {"*", "-"},
    };

    private RecordFilenames() {
    }

    /**
     * Returns the record filename for a key.
     *
     * @param extension file extension without the leading dot
     */
    public static String filenameFor(String part1, String part2, String extension) {
        String name1 = truncateUtf8(sanitize(part1), MAX_PART_BYTES);
        String name2 = truncateUtf8(sanitize(part2), MAX_PART_BYTES);
        return String.format("%s-%s-%s-%016x.%s", RECORD_PREFIX, name1, name2, keyHash(part1, part2), extension);
    }

    /**
     * True for names produced by the staging-file pattern {@code task-result-*.tmp}.
     */
    public static boolean isTempFileName(String name) {
        return name.length() >= TEMP_PREFIX.length() + TEMP_SUFFIX.length()
                && name.startsWith(TEMP_PREFIX)
                && name.endsWith(TEMP_SUFFIX);
    }

    /**
     * Converts a key part into text that is safe as part of a filename.
     * <p>
     * The result is printable ASCII and never contains {@code ..}, a path
     * separator or a Windows-reserved character. Every other character becomes
     * {@code -}; the hash keeps such keys apart.
     */
    static String sanitize(String part) {
        String kebab = toKebab(part);

        // Printable ASCII only: paths must be encodable under any sun.jnu.encoding,
        // and a lone surrogate is not encodable under any of them.
        StringBuilder cleaned = new StringBuilder(kebab.length());
        for (int i = 0; i < kebab.length(); i++) {
            char c = kebab.charAt(i);
            cleaned.append(c < 0x20 || c >= 0x7F ? '-' : c);
        }

        String result = cleaned.toString();
        for (String[] replacement : HOSTILE_SEQUENCES) {
            result = result.replace(replacement[0], replacement[1]);
        }
        return result;
    }

    /**
     * Lowercase-hyphen form: surrounding whitespace trimmed, ASCII letters
     * lowercased, a hyphen at lower/upper, letter/digit and acronym/word
     * boundaries, and space, underscore, hyphen and dot turned into a hyphen.
     * Characters outside ASCII pass through unchanged here; {@link #sanitize} replaces them.
     */
    static String toKebab(String text) {
        String s = text.strip();
        StringBuilder out = new StringBuilder(s.length() + 2);

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean upper = isAsciiUpper(c);
            boolean lower = isAsciiLower(c);
            boolean digit = isAsciiDigit(c);
            char lowered = upper ? (char) (c + ('a' - 'A')) : c;

            if (i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                boolean nextUpper = isAsciiUpper(next);
                boolean nextLower = isAsciiLower(next);
                boolean nextDigit = isAsciiDigit(next);

                if ((upper && (nextLower || nextDigit))
                        || (lower && (nextUpper || nextDigit))
                        || (digit && (nextUpper || nextLower))) {
                    // "JSONData": the last capital of an acronym starts the next word
                    if (upper && nextLower && i > 0 && isAsciiUpper(s.charAt(i - 1))) {
                        out.append('-');
                    }
                    out.append(lowered);
                    if (lower || digit || nextDigit) {
                        out.append('-');
                    }
                    continue;
                }
            }

            if (c == ' ' || c == '_' || c == '-' || c == '.') {
                out.append('-');
            } else {
                out.append(lowered);
            }
        }
        return out.toString();
    }

    /**
     * Cuts {@code text} to at most {@code limit} UTF-8 bytes without splitting a character.
     */
    static String truncateUtf8(String text, int limit) {
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int size = utf8Length(codePoint);
            if (bytes + size > limit) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end);
    }

    /**
     * 64-bit FNV-1a of the length-prefixed key parts. Lengths are UTF-8 byte counts.
     * <p>
     * Parts are encoded by {@link #hashBytes}, which equals UTF-8 for well-formed
     * text and keeps unpaired surrogates distinct instead of mapping them all to
     * {@code ?}.
     */
    static long keyHash(String part1, String part2) {
        byte[] bytes1 = hashBytes(part1);
        byte[] bytes2 = hashBytes(part2);

        ByteArrayOutputStream framed = new ByteArrayOutputStream(bytes1.length + bytes2.length + 24);
        framed.writeBytes((bytes1.length + ":").getBytes(StandardCharsets.US_ASCII));
        framed.writeBytes(bytes1);
        framed.writeBytes(("|" + bytes2.length + ":").getBytes(StandardCharsets.US_ASCII));
        framed.writeBytes(bytes2);

        long hash = FNV64_OFFSET_BASIS;
        for (byte b : framed.toByteArray()) {
            hash ^= (b & 0xFF);
            hash *= FNV64_PRIME;
        }
        return hash;
    }

    /**
     * UTF-8 bytes of {@code text}, with each unpaired surrogate written as its own
     * three-byte sequence (the generalized UTF-8 form).
     */
    static byte[] hashBytes(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() * 3);
        int i = 0;
        while (i < text.length()) {
            // codePointAt yields the surrogate itself when it is unpaired
            int cp = text.codePointAt(i);
            if (cp < 0x80) {
                out.write(cp);
            } else if (cp < 0x800) {
                out.write(0xC0 | (cp >> 6));
                out.write(0x80 | (cp & 0x3F));
            } else if (cp < 0x10000) {
                out.write(0xE0 | (cp >> 12));
                out.write(0x80 | ((cp >> 6) & 0x3F));
                out.write(0x80 | (cp & 0x3F));
            } else {
                out.write(0xF0 | (cp >> 18));
                out.write(0x80 | ((cp >> 12) & 0x3F));
                out.write(0x80 | ((cp >> 6) & 0x3F));
                out.write(0x80 | (cp & 0x3F));
            }
            i += Character.charCount(cp);
        }
        return out.toByteArray();
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    private static boolean isAsciiUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isAsciiLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
