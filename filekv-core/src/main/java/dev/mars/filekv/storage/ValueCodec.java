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

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * Converts record values to and from their on-disk bytes.
 * <p>
 * Implementations must be thread-safe. The store calls them outside any per-key
 * lock, so slow encoding never extends lock hold time.
 *
 * @see JacksonValueCodec
 */
public interface ValueCodec {

    /**
     * Serializes a value into a complete, self-contained document.
     */
    byte[] encode(Object value) throws IOException;

    /**
     * Deserializes bytes previously produced by {@link #encode}.
     * <p>
     * {@code type} may be parameterized (e.g. the {@code Type} of a
     * {@code List<Price>}), in which case element types are rebuilt as well.
     */
    <T> T decode(byte[] data, Type type) throws IOException;

    default <T> T decode(byte[] data, Class<T> type) throws IOException {
        return decode(data, (Type) type);
    }

    /**
     * File extension for record files, without the leading dot.
     */
    String fileExtension();
}
