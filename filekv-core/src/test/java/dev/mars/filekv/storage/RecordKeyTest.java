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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecordKeyTest {

    @Test
    void testOf_KeepsPartsVerbatim() {
        RecordKey key = RecordKey.of("  Task A ", "cmd");

        assertEquals("  Task A ", key.part1());
        assertEquals("cmd", key.part2());
        assertEquals("  Task A /cmd", key.toString());
    }

    @Test
    void testNullParts_Rejected() {
        assertThrows(NullPointerException.class, () -> RecordKey.of(null, "cmd"));
        assertThrows(NullPointerException.class, () -> RecordKey.of("task", null));
    }

    @Test
    void testBlankParts_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> RecordKey.of("", "cmd"));
        assertThrows(IllegalArgumentException.class, () -> RecordKey.of("task", "   "));
    }

    @Test
    void testEquality() {
        assertEquals(RecordKey.of("a", "b"), RecordKey.of("a", "b"));
        assertNotEquals(RecordKey.of("a", "b"), RecordKey.of("b", "a"));
    }
}
