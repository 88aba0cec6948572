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
package dev.mars.filekv.demo;

import dev.mars.filekv.storage.FileKeyValueStore;
import dev.mars.filekv.storage.RecordFilenames;
import dev.mars.filekv.storage.RecordKey;
import dev.mars.filekv.storage.RecordNotFoundException;
import dev.mars.filekv.storage.StoreConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Demo entry point for the file-per-key store.
 * <p>
 * Plays the part of a price-watching task that keeps its last result between
 * runs:
 * <ul>
 *   <li>Loading the previous snapshot (or starting empty on first run)</li>
 *   <li>Comparing it against freshly "observed" prices</li>
 *   <li>Saving the new snapshot atomically</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (base directory only)</li>
 *   <li>System properties: {@code -Dfilekv.baseDir=/path -Dfilekv.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code FILEKV_BASE_DIR, FILEKV_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code filekv.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl filekv-demo -am
 *
 * # Run with default configuration
 * java -cp "filekv-demo/target/filekv-demo-1.0-SNAPSHOT.jar:..." dev.mars.filekv.demo.StoreDemo
 *
 * # Run with CLI base directory override
 * java ... dev.mars.filekv.demo.StoreDemo /path/to/data
 * </pre>
 *
 * @see StoreConfig
 */
public class StoreDemo {

    private static final RecordKey KEY = RecordKey.of("NaverShopping", "WatchPrice");

    /** Result persisted between runs of the watch task. */
    public record PriceSnapshot(Instant observedAt, Map<String, Integer> prices) {
    }

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|           filekv Store Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        StoreConfig config = args.length > 0 && !args[0].isBlank()
                ? StoreConfig.builder().baseDir(args[0]).build()
                : StoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        FileKeyValueStore store = new FileKeyValueStore(config);
        System.out.println("[OK] Store opened at: " + store.baseDir());
        System.out.println("[OK] Record file: "
                + RecordFilenames.filenameFor(KEY.part1(), KEY.part2(), "json"));

        PriceSnapshot previous;
        try {
            previous = store.load(KEY, PriceSnapshot.class);
            System.out.println("[OK] Loaded snapshot from " + previous.observedAt()
                    + " with " + previous.prices().size() + " products");
        } catch (RecordNotFoundException e) {
            previous = null;
            System.out.println("[OK] No previous snapshot (first run)");
        }

        PriceSnapshot current = observePrices();
        List<String> changes = diff(previous, current);

        if (changes.isEmpty()) {
            System.out.println("\n  No price changes.");
        } else {
            System.out.println("\n  Price changes:");
            for (String change : changes) {
                System.out.println("    " + change);
            }
        }

        store.save(KEY, current);
        System.out.println("\n[OK] Saved snapshot with " + current.prices().size() + " products");

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Store demo complete!                 |");
        System.out.println("|  Run again to see changes detected.   |");
        System.out.println("+---------------------------------------+");
    }

    private static PriceSnapshot observePrices() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        Map<String, Integer> prices = new LinkedHashMap<>();
        for (String product : List.of("keyboard", "monitor", "headset")) {
            prices.put(product, 10_000 + random.nextInt(5) * 1_000);
        }
        return new PriceSnapshot(Instant.now(), prices);
    }

    private static List<String> diff(PriceSnapshot previous, PriceSnapshot current) {
        List<String> changes = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : current.prices().entrySet()) {
            Integer before = previous == null ? null : previous.prices().get(entry.getKey());
            if (before == null) {
                changes.add(entry.getKey() + ": new at " + entry.getValue());
            } else if (!before.equals(entry.getValue())) {
                changes.add(entry.getKey() + ": " + before + " -> " + entry.getValue());
            }
        }
        return changes;
    }
}
