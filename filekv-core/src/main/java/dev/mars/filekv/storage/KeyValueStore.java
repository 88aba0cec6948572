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

import java.lang.reflect.Type;

/**
 * Durable store holding one opaque value per two-part key.
 * <p>
 * Each key holds exactly one current value, replaced wholesale on every save.
 * <p>
 * <b>Critical Contract:</b>
 * <ul>
 *   <li>A load observes either no value or the complete value of some finished
 *       save, never a partial write, even if the process dies mid-save.</li>
 *   <li>Operations on the same key are totally ordered; operations on different
 *       keys do not contend.</li>
 * </ul>
 *
 * @see FileKeyValueStore
 */
public interface KeyValueStore {

    /**
     * Persists {@code value} for the key, replacing any previous value.
     * When this returns, the value is durable.
     *
     * @throws InvalidInputException if a key part is null
     * @throws StoreException        if the value cannot be encoded or written
     */
    void save(String part1, String part2, Object value);

    /**
     * Loads the value last saved for the key.
     * <p>
     * Use this form for generic values, passing a parameterized type such as
     * {@code new TypeReference<List<Price>>() {}.getType()}.
     *
     * @param type the type to decode into; must not be null
     * @return the decoded value
     * @throws InvalidInputException    if {@code type} or a key part is null
     * @throws RecordNotFoundException  if nothing was ever saved for the key
     * @throws StoreException           if the record cannot be read or decoded
     */
    <T> T load(String part1, String part2, Type type);

    /**
     * Loads the value last saved for the key as a non-generic class.
     *
     * @see #load(String, String, Type)
     */
    default <T> T load(String part1, String part2, Class<T> type) {
        return load(part1, part2, (Type) type);
    }

    default void save(RecordKey key, Object value) {
        save(key.part1(), key.part2(), value);
    }

    default <T> T load(RecordKey key, Class<T> type) {
        return load(key.part1(), key.part2(), type);
    }

    default <T> T load(RecordKey key, Type type) {
        return load(key.part1(), key.part2(), type);
    }
}
