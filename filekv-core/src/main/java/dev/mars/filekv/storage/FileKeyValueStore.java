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

import dev.mars.filekv.lock.KeyedLockTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;

/**
 * File-based implementation of {@link KeyValueStore}.
 * <p>
 * Every key maps to one record file in a fixed base directory. Files are named
 * by {@link RecordFilenames}, encoded by a pluggable {@link ValueCodec} (JSON by
 * default) and replaced atomically on every save.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ task-{part1}-{part2}-{hash}.json   // one record per key (atomic replace)
 *  └─ task-result-*.tmp                  // staging file, lives for one save
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Saves and loads of the same key are serialized through a {@link KeyedLockTable}
 * keyed by the lowercased record path, so case-insensitive filesystems see the
 * same ordering. Encoding and decoding happen outside the lock; only file I/O is
 * done while holding it. Different keys never wait for each other.
 * <p>
 * <b>Durability:</b>
 * Save writes a staging file in the base directory, fsyncs and closes it, renames
 * it over the record file (retrying a few times on transient failures) and then
 * fsyncs the directory. A crash at any point leaves either the old or the new
 * record, plus at most an orphaned staging file.
 * <p>
 * <b>Startup Cleanup:</b>
 * Construction launches one background pass that deletes staging files at least
 * {@link StoreConfig#staleTempThreshold()} old. Newer ones may belong to a
 * running save in another process and are left alone.
 *
 * @see KeyValueStore
 */
public final class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileKeyValueStore.class);

    private static final String CLEANUP_THREAD_NAME = "filekv-temp-cleanup";

    private final StoreConfig config;
    private final ValueCodec codec;
    private final Path baseDir;
    private final KeyedLockTable<String> locks = new KeyedLockTable<>();
    private final CompletableFuture<Integer> startupCleanup;

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see StoreConfig
     */
    public FileKeyValueStore() {
        this(StoreConfig.load());
    }

    /**
     * Creates a store in {@code baseDir}, other settings resolved as in {@link StoreConfig}.
     */
    public FileKeyValueStore(Path baseDir) {
        this(StoreConfig.builder().baseDir(baseDir).build());
    }

    public FileKeyValueStore(StoreConfig config) {
        this(config, new JacksonValueCodec());
    }

    /**
     * Creates the base directory if needed and starts the stale staging file cleanup.
     * <p>
     * A relative base directory is resolved against the current working directory
     * here, once; later working-directory changes do not move the store.
     *
     * @throws StoreException if the base directory cannot be created
     */
    public FileKeyValueStore(StoreConfig config, ValueCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.baseDir = config.baseDir().toAbsolutePath().normalize();

        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            LOG.error("Failed to create store directory {}: {}", baseDir, e.getMessage(), e);
            throw new StoreException("Failed to create store directory " + baseDir, e);
        }

        LOG.info("FileKeyValueStore opened: baseDir={}, syncEnabled={}, renameMaxAttempts={}, staleTempThreshold={} min",
                baseDir, config.syncEnabled(), config.renameMaxAttempts(), config.staleTempThreshold().toMinutes());
        if (!config.syncEnabled()) {
            LOG.warn("FileKeyValueStore created with fsync DISABLED. Do NOT use in production!");
        }

        this.startupCleanup = config.cleanupOnStartup()
                ? launchStartupCleanup()
                : CompletableFuture.completedFuture(0);
    }

    /** Absolute, normalized directory holding the record files. */
    public Path baseDir() {
        return baseDir;
    }

    public StoreConfig config() {
        return config;
    }

    /**
     * The background cleanup launched at construction; completes with the number
     * of staging files removed (0 if cleanup was disabled).
     */
    public CompletableFuture<Integer> startupCleanup() {
        return startupCleanup;
    }

    KeyedLockTable<String> lockTable() {
        return locks;
    }

    // ========================================================================
    // Save / Load
    // ========================================================================

    @Override
    public void save(String part1, String part2, Object value) {
        requireKey(part1, part2);
        Path path = resolveSafePath(part1, part2);
        byte[] data = encode(value, path);

        LOG.debug("Saving record ({}, {}): {} bytes -> {}", part1, part2, data.length, path);
        locks.withLock(lockKey(path), () -> {
            writeAtomic(path, data);
            return null;
        });
        LOG.trace("Saved record ({}, {})", part1, part2);
    }

    @Override
    public <T> T load(String part1, String part2, Type type) {
        if (type == null) {
            throw new InvalidInputException("load requires a non-null destination type");
        }
        requireKey(part1, part2);
        Path path = resolveSafePath(part1, part2);

        byte[] data;
        try {
            data = locks.withLock(lockKey(path), () -> Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            LOG.debug("No record for ({}, {}) at {}", part1, part2, path);
            throw new RecordNotFoundException(part1, part2);
        } catch (IOException e) {
            LOG.error("Failed to read record {}: {}", path, e.getMessage(), e);
            throw new StoreException("Failed to read record " + path, e);
        }

        try {
            T value = codec.decode(data, type);
            LOG.trace("Loaded record ({}, {}): {} bytes from {}", part1, part2, data.length, path);
            return value;
        } catch (IOException e) {
            throw new StoreException("Failed to decode record " + path + " as " + type.getTypeName(), e);
        }
    }

    // ========================================================================
    // Path Resolution
    // ========================================================================

    /**
     * Returns the record path for a key, verified to lie inside the base directory.
     *
     * @throws PathEscapeException if the normalized path leaves the base directory
     */
    Path resolveSafePath(String part1, String part2) {
        String filename = RecordFilenames.filenameFor(part1, part2, codec.fileExtension());

        Path path;
        Path relative;
        try {
            path = baseDir.resolve(filename).normalize();
            relative = baseDir.relativize(path);
        } catch (IllegalArgumentException e) {
            // InvalidPathException, or relativize across different roots
            throw new StoreException("Cannot resolve record path for " + filename + " in " + baseDir, e);
        }

        if (relative.toString().isEmpty() || relative.startsWith("..")) {
            LOG.error("Blocked record path outside base directory: part1={}, part2={}, filename={}, baseDir={}, path={}",
                    part1, part2, filename, baseDir, path);
            throw new PathEscapeException(baseDir, path);
        }
        return path;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private static void requireKey(String part1, String part2) {
        if (part1 == null || part2 == null) {
            throw new InvalidInputException("key parts must not be null: (" + part1 + ", " + part2 + ")");
        }
    }

    // Case-insensitive filesystems map differently-cased names to one file.
    private static String lockKey(Path path) {
        return path.toString().toLowerCase(Locale.ROOT);
    }

    private byte[] encode(Object value, Path path) {
        byte[] data;
        try {
            data = codec.encode(value);
        } catch (IOException e) {
            throw new StoreException("Failed to encode value for " + path, e);
        }
        if (data == null) {
            throw new StoreException("Codec produced no output for " + path);
        }
        return data;
    }

    /**
     * Replaces {@code target} with {@code data}: staging file, fsync, close, rename,
     * directory fsync. The staging file is removed if any step before the rename fails.
     * Must be called while holding the key's lock.
     */
    private void writeAtomic(Path target, byte[] data) {
        Path dir = target.getParent();

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Failed to create directory " + dir, e);
        }

        // Same directory as the target, so the rename never crosses filesystems.
        Path tmpPath;
        try {
            tmpPath = Files.createTempFile(dir, RecordFilenames.TEMP_PREFIX, RecordFilenames.TEMP_SUFFIX);
        } catch (IOException e) {
            throw new StoreException("Failed to create temp file in " + dir, e);
        }

        try {
            writeFully(tmpPath, data);
            renameWithRetry(tmpPath, target);
        } catch (RuntimeException e) {
            discardTempFile(tmpPath, e);
            throw e;
        }

        if (config.syncEnabled()) {
            syncDirectory(dir);
        }
    }

    /**
     * Writes and fsyncs the staging file; the channel is closed before returning
     * because some platforms refuse to rename open files.
     */
    private void writeFully(Path tmpPath, byte[] data) {
        try (FileChannel ch = FileChannel.open(tmpPath,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(data);
            try {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
            } catch (IOException e) {
                throw new StoreException("Failed to write temp file " + tmpPath, e);
            }

            if (config.syncEnabled()) {
                try {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                } catch (IOException e) {
                    throw new StoreException("Failed to sync temp file " + tmpPath, e);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to open or close temp file " + tmpPath, e);
        }
    }

    /**
     * Renames the staging file over the record file.
     * <p>
     * Virus scanners and indexers can briefly hold a file open, which makes the
     * rename fail on some platforms. A bounded number of retries with a short
     * pause rides this out; it is a mitigation, not a guarantee.
     */
    private void renameWithRetry(Path source, Path target) {
        int maxAttempts = config.renameMaxAttempts();
        long delayMs = config.renameRetryDelay().toMillis();

        IOException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Files.move(source, target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
                LOG.trace("Atomic rename: {} -> {} (attempt {})", source, target, attempt);
                return;
            } catch (IOException e) {
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }
                LOG.warn("Rename {} -> {} failed (attempt {}/{}), retrying in {} ms: {}",
                        source, target, attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    StoreException interrupted =
                            new StoreException("Interrupted while retrying rename of " + source, ie);
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
            }
        }

        LOG.error("Rename {} -> {} failed after {} attempts: {}",
                source, target, maxAttempts, lastError.getMessage());
        throw new StoreException("Failed to rename " + source + " to " + target
                + " after " + maxAttempts + " attempts", lastError);
    }

    private static void discardTempFile(Path tmpPath, RuntimeException cause) {
        try {
            Files.deleteIfExists(tmpPath);
            LOG.debug("Removed temp file {} after failed save", tmpPath);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmpPath, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Fsyncs a directory so that a completed rename survives power loss.
     * <p>
     * Best effort: on Windows this is skipped, and failures elsewhere are logged
     * without failing the save, since the record itself is already complete.
     */
    private static void syncDirectory(Path dir) {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    // ========================================================================
    // Stale Temp File Cleanup
    // ========================================================================

    private CompletableFuture<Integer> launchStartupCleanup() {
        return runInBackground(this::cleanupStaleTempFiles, baseDir);
    }

    /**
     * Runs {@code task} once on a daemon thread. Any failure, {@link Error}s
     * included, is logged and completes the future exceptionally, so neither the
     * host process nor a caller waiting on the future is left hanging.
     */
    static CompletableFuture<Integer> runInBackground(IntSupplier task, Path dir) {
        CompletableFuture<Integer> result = new CompletableFuture<>();
        Thread cleaner = new Thread(() -> {
            try {
                result.complete(task.getAsInt());
            } catch (Throwable t) {
                LOG.error("Stale temp file cleanup aborted in {}: {}", dir, t.getMessage(), t);
                result.completeExceptionally(t);
            }
        }, CLEANUP_THREAD_NAME);
        cleaner.setDaemon(true);
        cleaner.start();
        return result;
    }

    /**
     * Deletes staging files in the base directory whose last modification is
     * not after {@code now - staleTempThreshold}. Directories, non-matching names
     * and recent staging files are left alone. Individual failures are logged
     * and skipped.
     *
     * @return the number of files removed
     */
    public int cleanupStaleTempFiles() {
        return cleanupStaleTempFiles(Instant.now());
    }

    int cleanupStaleTempFiles(Instant now) {
        Instant threshold = now.minus(config.staleTempThreshold());
        int removed = 0;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(baseDir)) {
            for (Path file : files) {
                if (!RecordFilenames.isTempFileName(file.getFileName().toString())) {
                    continue;
                }

                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    LOG.debug("Skipping {}: cannot read attributes: {}", file, e.getMessage());
                    continue;
                }
                if (!attrs.isRegularFile()) {
                    continue;
                }
                if (attrs.lastModifiedTime().toInstant().isAfter(threshold)) {
                    // Possibly an in-flight save from another process.
                    continue;
                }

                try {
                    Files.delete(file);
                    removed++;
                    LOG.info("Removed stale temp file left by an earlier run: {}", file);
                } catch (NoSuchFileException e) {
                    LOG.debug("Stale temp file already gone: {}", file);
                } catch (IOException e) {
                    LOG.warn("Could not delete stale temp file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.warn("Stale temp file cleanup skipped: cannot list {}: {}", baseDir, e.getMessage());
        }

        LOG.debug("Stale temp file cleanup finished in {}: {} removed", baseDir, removed);
        return removed;
    }
}
