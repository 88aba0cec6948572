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
package dev.mars.filekv.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutual exclusion with reference-counted, pooled lock entries.
 * <p>
 * Two callers using different keys never block each other; two callers using
 * the same key are fully serialized. The table itself is guarded by a single
 * short-held lock that is used only for bookkeeping and is never held while a
 * caller waits for a key or runs its critical section.
 * <p>
 * <b>Entry lifecycle:</b>
 * <ul>
 *   <li>An entry is created (or taken from the free list) on the first
 *       {@link #lock} / {@link #tryLock} for a key.</li>
 *   <li>Every caller that holds or waits for the key contributes one reference.</li>
 *   <li>When the last reference is released the entry leaves the table and is
 *       returned to the free list, up to {@link #DEFAULT_MAX_POOLED_ENTRIES}.</li>
 * </ul>
 * <p>
 * The per-key mutex is a one-permit {@link Semaphore}: it is not reentrant, so a
 * thread that already holds a key gets {@code false} from {@link #tryLock} and
 * would deadlock on {@link #lock}. Keys must have stable {@code equals} and
 * {@code hashCode}.
 *
 * @param <K> the key type
 */
public final class KeyedLockTable<K> {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedLockTable.class);

    /** Upper bound on recycled entries kept in the free list. */
    public static final int DEFAULT_MAX_POOLED_ENTRIES = 64;

    /**
     * A mutex plus the number of callers currently holding or waiting for it.
     * Only read or written under {@link #tableLock}, except for the mutex itself.
     */
    private static final class Entry {
        private final Semaphore mutex = new Semaphore(1);
        private int refs;
    }

    private final ReentrantLock tableLock = new ReentrantLock();
    private final Map<K, Entry> entries = new HashMap<>();
    private final Deque<Entry> freeList = new ArrayDeque<>();
    private final int maxPooledEntries;

    public KeyedLockTable() {
        this(DEFAULT_MAX_POOLED_ENTRIES);
    }

    /**
     * @param maxPooledEntries how many released entries to keep for reuse (0 disables pooling)
     */
    public KeyedLockTable(int maxPooledEntries) {
        if (maxPooledEntries < 0) {
            throw new IllegalArgumentException("maxPooledEntries must be >= 0: " + maxPooledEntries);
        }
        this.maxPooledEntries = maxPooledEntries;
    }

    /**
     * Blocks until the calling thread holds {@code key}.
     * <p>
     * The wait happens outside the table lock, so it never delays callers of other keys.
     * The wait is uninterruptible, like acquiring an intrinsic monitor.
     */
    public void lock(K key) {
        Entry entry;
        tableLock.lock();
        try {
            entry = entries.get(key);
            if (entry == null) {
                entry = obtainEntry();
                entries.put(key, entry);
            }
            entry.refs++;
        } finally {
            tableLock.unlock();
        }

        entry.mutex.acquireUninterruptibly();
    }

    /**
     * Acquires {@code key} only if no other holder exists, without blocking.
     *
     * @return true if the key is now held by the caller
     */
    public boolean tryLock(K key) {
        tableLock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                // Take the mutex before the entry becomes visible to other callers.
                entry = obtainEntry();
                entry.mutex.acquireUninterruptibly();
                entry.refs = 1;
                entries.put(key, entry);
                return true;
            }
            if (!entry.mutex.tryAcquire()) {
                return false;
            }
            entry.refs++;
            return true;
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Releases {@code key}.
     *
     * @throws IllegalStateException if the key is not locked; this is a caller bug
     */
    public void unlock(K key) {
        tableLock.lock();
        try {
            Entry entry = entries.get(key);
            // An entry with a free permit only has waiters, nobody holds it.
            if (entry == null || entry.mutex.availablePermits() > 0) {
                LOG.error("unlock called for key that is not locked: {}", key);
                throw new IllegalStateException("unlock of unlocked key: " + key);
            }

            entry.mutex.release();
            entry.refs--;
            if (entry.refs <= 0) {
                entries.remove(key);
                recycle(entry);
            }
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Runs {@code section} while holding {@code key}. The key is released even if
     * the section throws, and the section's exception propagates unchanged.
     */
    public <T, E extends Exception> T withLock(K key, CriticalSection<T, E> section) throws E {
        lock(key);
        try {
            return section.run();
        } finally {
            unlock(key);
        }
    }

    /** Number of keys currently held or waited for. */
    public int size() {
        tableLock.lock();
        try {
            return entries.size();
        } finally {
            tableLock.unlock();
        }
    }

    /** Number of released entries waiting in the free list. */
    public int pooledEntries() {
        tableLock.lock();
        try {
            return freeList.size();
        } finally {
            tableLock.unlock();
        }
    }

    // Caller holds tableLock.
    private Entry obtainEntry() {
        Entry entry = freeList.pollFirst();
        return entry != null ? entry : new Entry();
    }

    // Caller holds tableLock. A released entry has refs == 0 and one free permit.
    private void recycle(Entry entry) {
        entry.refs = 0;
        if (freeList.size() < maxPooledEntries) {
            freeList.addFirst(entry);
        }
    }
}
