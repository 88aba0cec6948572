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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.lang.reflect.Type;

/**
 * Default {@link ValueCodec}: indented JSON via Jackson.
 * <p>
 * Unknown properties are ignored on read so that records written by a newer
 * version of a value class still load. {@code java.time} values are written
 * as ISO-8601 strings.
 */
public final class JacksonValueCodec implements ValueCodec {

    private final ObjectMapper objectMapper;

    public JacksonValueCodec() {
        this(defaultObjectMapper());
    }

    /**
     * Uses a caller-configured mapper. The mapper must not be reconfigured afterwards.
     */
    public JacksonValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] encode(Object value) throws IOException {
        return objectMapper.writeValueAsBytes(value);
    }

    @Override
    public <T> T decode(byte[] data, Type type) throws IOException {
        return objectMapper.readValue(data, objectMapper.getTypeFactory().constructType(type));
    }

    @Override
    public String fileExtension() {
        return "json";
    }
}
