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

import dev.mars.filekv.lock.KeyedLockTable;
import dev.mars.filekv.storage.FileKeyValueStore;
import dev.mars.filekv.storage.RecordFilenames;
import dev.mars.filekv.storage.RecordNotFoundException;
import dev.mars.filekv.storage.StoreConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Chaos testing for the file-per-key store.
 * <p>
 * This class throws nasty scenarios at the store to verify its guarantees:
 * <ul>
 *   <li>Same-key writer/reader storms (no torn or mixed values)</li>
 *   <li>Many-key storms (independent keys, lock table drains)</li>
 *   <li>Crash simulation (orphaned and truncated staging files)</li>
 *   <li>Hostile keys (traversal, reserved characters, huge keys)</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl filekv-demo -am
 *
 * # Run all chaos tests
 * java -cp ... dev.mars.filekv.demo.StoreChaos
 *
 * # Run specific group
 * java -cp ... dev.mars.filekv.demo.StoreChaos concurrent
 * java -cp ... dev.mars.filekv.demo.StoreChaos crash
 * java -cp ... dev.mars.filekv.demo.StoreChaos keys
 * </pre>
 *
 * @see FileKeyValueStore
 */
public class StoreChaos {

    private static final int FILL_LENGTH = 256;

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    /**
     * Value whose every {@code fill} element equals {@code sequence}; any torn or
     * mixed write shows up as a mismatch.
     */
    public record Stamp(int writer, int sequence, int[] fill) {

        static Stamp of(int writer, int sequence) {
            int[] fill = new int[FILL_LENGTH];
            Arrays.fill(fill, sequence);
            return new Stamp(writer, sequence, fill);
        }

        void verify() {
            if (fill == null || fill.length != FILL_LENGTH) {
                throw new AssertionError("Stamp has wrong fill length: " + (fill == null ? "null" : fill.length));
            }
            for (int value : fill) {
                if (value != sequence) {
                    throw new AssertionError("Mixed stamp: sequence " + sequence + " contains " + value);
                }
            }
        }
    }

    public StoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              STORE CHAOS TESTING SUITE                        ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("filekv-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        StoreChaos chaos = new StoreChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "crash" -> chaos.runCrashTests();
                case "keys" -> chaos.runHostileKeyTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCrashTests();
                    chaos.runHostileKeyTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, crash, keys, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Same-Key Storm (50 threads × 1000 ops)", this::sameKeyStorm);
        chaosTest("Many-Key Storm (32 threads × 64 keys)", this::manyKeyStorm);
        chaosTest("Lock Table Drains After Contention", this::lockTableDrains);
    }

    private void sameKeyStorm() throws Exception {
        FileKeyValueStore store = openStore("same-key-storm");
        store.save("storm", "shared", Stamp.of(-1, 0));

        int numThreads = 50;
        int opsPerThread = 1000;
        AtomicReference<Throwable> failure = new AtomicReference<>();

        runConcurrently(numThreads, threadId -> {
            ThreadLocalRandom random = ThreadLocalRandom.current();
            for (int i = 0; i < opsPerThread; i++) {
                if (random.nextBoolean()) {
                    store.save("storm", "shared", Stamp.of(threadId, i));
                } else {
                    store.load("storm", "shared", Stamp.class).verify();
                }
            }
        }, failure);

        rethrow(failure);
        store.load("storm", "shared", Stamp.class).verify();
        assertNoTempFiles(store.baseDir());
    }

    private void manyKeyStorm() throws Exception {
        FileKeyValueStore store = openStore("many-key-storm");
        int numThreads = 32;
        int numKeys = 64;
        int rounds = 50;
        AtomicReference<Throwable> failure = new AtomicReference<>();

        runConcurrently(numThreads, threadId -> {
            for (int round = 0; round < rounds; round++) {
                String key = "key-" + ((threadId + round) % numKeys);
                store.save("many", key, Stamp.of(threadId, round));
                store.load("many", key, Stamp.class).verify();
            }
        }, failure);

        rethrow(failure);
        try (Stream<Path> files = Files.list(store.baseDir())) {
            long records = files.filter(p -> p.getFileName().toString().endsWith(".json")).count();
            long expected = Math.min(numKeys, numThreads + rounds - 1);
            if (records != expected) {
                throw new AssertionError("Expected " + expected + " record files, found " + records);
            }
        }
    }

    private void lockTableDrains() throws Exception {
        KeyedLockTable<String> locks = new KeyedLockTable<>();
        int numThreads = 16;
        int pairsPerThread = 2_000;
        AtomicInteger[] counters = new AtomicInteger[8];
        int[] unsafeCounters = new int[counters.length];
        for (int i = 0; i < counters.length; i++) {
            counters[i] = new AtomicInteger();
        }
        AtomicReference<Throwable> failure = new AtomicReference<>();

        runConcurrently(numThreads, threadId -> {
            for (int i = 0; i < pairsPerThread; i++) {
                int k = (threadId * 31 + i) % counters.length;
                locks.lock("k" + k);
                try {
                    unsafeCounters[k]++;
                    counters[k].incrementAndGet();
                } finally {
                    locks.unlock("k" + k);
                }
            }
        }, failure);

        rethrow(failure);
        for (int k = 0; k < counters.length; k++) {
            if (unsafeCounters[k] != counters[k].get()) {
                throw new AssertionError("Lost update on k" + k + ": " + unsafeCounters[k] + " != " + counters[k].get());
            }
        }
        if (locks.size() != 0) {
            throw new AssertionError("Lock table not empty: " + locks.size() + " entries");
        }
    }

    // =========================================================================
    // CRASH SIMULATION
    // =========================================================================

    private void runCrashTests() {
        printSection("CRASH SIMULATION");

        chaosTest("Truncated Staging File Leaves Record Intact", this::truncatedStagingFile);
        chaosTest("Stale Staging Files Removed On Restart", this::staleStagingFilesRemoved);
        chaosTest("Fresh Staging Files Survive Restart", this::freshStagingFilesSurvive);
    }

    private void truncatedStagingFile() throws Exception {
        FileKeyValueStore store = openStore("truncated-staging");
        store.save("crash", "record", Stamp.of(1, 7));

        // What a save killed mid-write leaves behind
        Path orphan = writeOrphan(store.baseDir(), "{\"writer\":1,\"sequence\":8,\"fi");

        Stamp loaded = store.load("crash", "record", Stamp.class);
        loaded.verify();
        if (loaded.sequence() != 7) {
            throw new AssertionError("Record changed by orphaned staging file: sequence " + loaded.sequence());
        }
        if (!Files.exists(orphan)) {
            throw new AssertionError("Orphan should remain until it is stale");
        }
    }

    private void staleStagingFilesRemoved() throws Exception {
        Path dir = createTestDir("stale-staging");
        Path orphan = writeOrphan(dir, "partial");
        Files.setLastModifiedTime(orphan, FileTime.from(Instant.now().minus(Duration.ofHours(2))));
        Files.createDirectories(dir.resolve(RecordFilenames.TEMP_PREFIX + "dir" + RecordFilenames.TEMP_SUFFIX));

        FileKeyValueStore store = new FileKeyValueStore(config(dir));
        int removed = store.startupCleanup().get(10, TimeUnit.SECONDS);

        if (removed != 1 || Files.exists(orphan)) {
            throw new AssertionError("Expected the stale orphan to be removed, removed=" + removed);
        }
        if (!Files.isDirectory(dir.resolve(RecordFilenames.TEMP_PREFIX + "dir" + RecordFilenames.TEMP_SUFFIX))) {
            throw new AssertionError("Cleanup must never delete directories");
        }
    }

    private void freshStagingFilesSurvive() throws Exception {
        Path dir = createTestDir("fresh-staging");
        Path inFlight = writeOrphan(dir, "in-flight");

        FileKeyValueStore store = new FileKeyValueStore(config(dir));
        store.startupCleanup().get(10, TimeUnit.SECONDS);

        if (!Files.exists(inFlight)) {
            throw new AssertionError("A recent staging file may belong to a running save and must survive");
        }
    }

    // =========================================================================
    // HOSTILE KEYS
    // =========================================================================

    private void runHostileKeyTests() {
        printSection("HOSTILE KEYS");

        chaosTest("Path Traversal Keys Stay Inside Base Dir", this::traversalKeys);
        chaosTest("Reserved And Control Characters", this::reservedCharacters);
        chaosTest("Readable-Name Collisions Stay Distinct", this::readableCollisions);
        chaosTest("Very Long Keys", this::veryLongKeys);
    }

    private void traversalKeys() throws Exception {
        FileKeyValueStore store = openStore("traversal");
        List<String> hostile = List.of("../../secret", "..\\..\\secret", "/etc/passwd", "C:\\Windows", "..", ".");

        for (String key : hostile) {
            store.save(key, key, Stamp.of(0, key.length()));
            Stamp loaded = store.load(key, key, Stamp.class);
            if (loaded.sequence() != key.length()) {
                throw new AssertionError("Round trip failed for " + key);
            }
        }

        // Every test owns a subdirectory of the chaos root; a stray file here escaped its store
        try (Stream<Path> siblings = Files.list(store.baseDir().getParent())) {
            siblings.filter(p -> !Files.isDirectory(p))
                    .findAny()
                    .ifPresent(p -> {
                        throw new AssertionError("File written outside store directory: " + p);
                    });
        }
        try (Stream<Path> files = Files.list(store.baseDir())) {
            if (files.anyMatch(Files::isDirectory)) {
                throw new AssertionError("Hostile key created a subdirectory");
            }
        }
    }

    private void reservedCharacters() throws Exception {
        FileKeyValueStore store = openStore("reserved");
        String key = "Cool<File>:Name\"|?*\u0000\u001f\u007f";

        store.save(key, "cmd", Stamp.of(0, 42));
        if (store.load(key, "cmd", Stamp.class).sequence() != 42) {
            throw new AssertionError("Round trip failed for reserved characters");
        }
    }

    private void readableCollisions() throws Exception {
        FileKeyValueStore store = openStore("collisions");
        store.save("Task_A", "cmd", Stamp.of(0, 1));
        store.save("Task-A", "cmd", Stamp.of(0, 2));
        store.save("TASK-A", "cmd", Stamp.of(0, 3));

        if (store.load("Task_A", "cmd", Stamp.class).sequence() != 1
                || store.load("Task-A", "cmd", Stamp.class).sequence() != 2
                || store.load("TASK-A", "cmd", Stamp.class).sequence() != 3) {
            throw new AssertionError("Keys with the same readable name overwrote each other");
        }
    }

    private void veryLongKeys() throws Exception {
        FileKeyValueStore store = openStore("long-keys");
        String longKey = "한글".repeat(200) + "VeryLong".repeat(100);

        store.save(longKey, longKey, Stamp.of(0, 5));
        if (store.load(longKey, longKey, Stamp.class).sequence() != 5) {
            throw new AssertionError("Round trip failed for long key");
        }
        boolean sharedRecord;
        try {
            store.load(longKey, longKey + "x", Stamp.class);
            sharedRecord = true;
        } catch (RecordNotFoundException e) {
            sharedRecord = false;
        }
        if (sharedRecord) {
            throw new AssertionError("Different long keys with the same readable prefix share a record");
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private FileKeyValueStore openStore(String name) throws IOException {
        return new FileKeyValueStore(config(createTestDir(name)));
    }

    private static StoreConfig config(Path dir) {
        return StoreConfig.builder()
                .baseDir(dir)
                .syncEnabled(false) // Speed up test
                .build();
    }

    private static Path writeOrphan(Path dir, String content) throws IOException {
        Path orphan = Files.createTempFile(dir, RecordFilenames.TEMP_PREFIX, RecordFilenames.TEMP_SUFFIX);
        Files.write(orphan, content.getBytes(StandardCharsets.UTF_8));
        return orphan;
    }

    private static void runConcurrently(int numThreads, ThreadBody body, AtomicReference<Throwable> failure)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await(); // All threads start together
                    body.run(threadId);
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown(); // GO!
        boolean finished = doneLatch.await(120, TimeUnit.SECONDS);
        executor.shutdownNow();
        if (!finished) {
            failure.compareAndSet(null, new AssertionError("Timed out waiting for worker threads"));
        }
    }

    private static void rethrow(AtomicReference<Throwable> failure) throws Exception {
        Throwable t = failure.get();
        if (t instanceof Exception e) {
            throw e;
        }
        if (t instanceof Error e) {
            throw e;
        }
    }

    private static void assertNoTempFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> RecordFilenames.isTempFileName(p.getFileName().toString()))
                    .findAny()
                    .ifPresent(p -> {
                        throw new AssertionError("Leftover staging file: " + p);
                    });
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(StoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not delete " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }

    @FunctionalInterface
    interface ThreadBody {
        void run(int threadId) throws Exception;
    }
}
