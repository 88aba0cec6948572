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
package dev.mars.filekv;

import dev.mars.filekv.storage.FileKeyValueStore;
import dev.mars.filekv.storage.KeyValueStore;
import dev.mars.filekv.storage.RecordNotFoundException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Demo entry point for the file-per-key store.
 * <p>
 * This demonstrates basic store operations:
 * <ul>
 *   <li>Opening the store</li>
 *   <li>Handling the first-use "not found" case</li>
 *   <li>Saving a value</li>
 *   <li>Loading it back on the next run</li>
 * </ul>
 */
public class Main {

    /** Value persisted by the demo. */
    public record RunHistory(List<Instant> runs) {
    }

    public static void main(String[] args) {
        System.out.println("filekv Demo");
        System.out.println("===========\n");

        Path baseDir = Path.of("data/filekv");
        KeyValueStore store = new FileKeyValueStore(baseDir);
        System.out.println("✓ Store opened at: " + baseDir.toAbsolutePath());

        List<Instant> runs;
        try {
            runs = new ArrayList<>(store.load("demo", "history", RunHistory.class).runs());
            System.out.println("✓ Loaded history: " + runs.size() + " previous runs");
        } catch (RecordNotFoundException e) {
            runs = new ArrayList<>();
            System.out.println("✓ No history yet (first run)");
        }

        runs.add(Instant.now());
        store.save("demo", "history", new RunHistory(runs));
        System.out.println("✓ Saved history with " + runs.size() + " runs");

        System.out.println("\n✓ Demo complete!");
    }
}
