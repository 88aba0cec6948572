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

import java.util.Objects;

/**
 * Two-part logical key as seen by callers of the store.
 * <p>
 * The store itself accepts any strings; this type adds the check that both
 * parts are non-blank, which is where callers are expected to validate their
 * identifiers. Parts are kept exactly as given (not trimmed), since the stored
 * filename hash covers the exact text.
 *
 * @param part1 the category, e.g. a task id
 * @param part2 the operation within the category, e.g. a command id
 */
public record RecordKey(String part1, String part2) {

    public RecordKey {
        Objects.requireNonNull(part1, "part1");
        Objects.requireNonNull(part2, "part2");
        if (part1.isBlank()) {
            throw new IllegalArgumentException("part1 must not be blank");
        }
        if (part2.isBlank()) {
            throw new IllegalArgumentException("part2 must not be blank");
        }
    }

    public static RecordKey of(String part1, String part2) {
        return new RecordKey(part1, part2);
    }

    @Override
    public String toString() {
        return part1 + "/" + part2;
    }
}
