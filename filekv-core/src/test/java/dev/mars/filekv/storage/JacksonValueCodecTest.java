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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JacksonValueCodec}.
 */
class JacksonValueCodecTest {

    public record Snapshot(String name, int count, Instant at) {
    }

    public record SnapshotV1(String name) {
    }

    private final JacksonValueCodec codec = new JacksonValueCodec();

    @Test
    void testEncode_WritesIndentedJsonWithIsoInstants() throws IOException {
        Snapshot value = new Snapshot("watch", 3, Instant.parse("2026-01-02T03:04:05Z"));

        String json = new String(codec.encode(value), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"2026-01-02T03:04:05Z\""), json);
        assertTrue(json.contains(System.lineSeparator()) || json.contains("\n"), "Expected indented output: " + json);
    }

    @Test
    void testDecode_RecordWithInstant() throws IOException {
        Snapshot value = new Snapshot("watch", 3, Instant.parse("2026-01-02T03:04:05Z"));

        Snapshot decoded = codec.decode(codec.encode(value), Snapshot.class);

        assertEquals(value, decoded);
    }

    @Test
    void testDecode_IgnoresUnknownProperties() throws IOException {
        byte[] newer = codec.encode(new Snapshot("watch", 3, Instant.EPOCH));

        SnapshotV1 older = codec.decode(newer, SnapshotV1.class);

        assertEquals("watch", older.name());
    }

    @Test
    void testDecode_Map() throws IOException {
        @SuppressWarnings("unchecked")
        Map<String, Object> decoded = codec.decode(codec.encode(Map.of("k", List.of(1, 2))), Map.class);

        assertEquals(List.of(1, 2), decoded.get("k"));
    }

    @Test
    void testDecode_ParameterizedType_RebuildsElements() throws IOException {
        List<Snapshot> values = List.of(new Snapshot("watch", 3, Instant.EPOCH));
        Type listOfSnapshot = new TypeReference<List<Snapshot>>() {}.getType();

        List<Snapshot> decoded = codec.decode(codec.encode(values), listOfSnapshot);

        assertEquals(values, decoded);
        assertInstanceOf(Snapshot.class, decoded.get(0));
    }

    @Test
    void testDecode_MalformedInput_Throws() {
        byte[] garbage = "{\"name\": \"trunc".getBytes(StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> codec.decode(garbage, Snapshot.class));
    }

    @Test
    void testCustomMapper_IsUsed() throws IOException {
        JacksonValueCodec compact = new JacksonValueCodec(new ObjectMapper());

        String json = new String(compact.encode(Map.of("a", 1)), StandardCharsets.UTF_8);

        assertEquals("{\"a\":1}", json);
        assertEquals("json", compact.fileExtension());
    }
}
