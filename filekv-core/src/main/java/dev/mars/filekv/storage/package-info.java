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
/**
 * Durable file-per-key storage.
 * <p>
 * This package provides the persistence layer:
 * <ul>
 *   <li>{@link dev.mars.filekv.storage.KeyValueStore} - The storage interface</li>
 *   <li>{@link dev.mars.filekv.storage.FileKeyValueStore} - File-based implementation</li>
 *   <li>{@link dev.mars.filekv.storage.RecordFilenames} - Key to filename mapping</li>
 *   <li>{@link dev.mars.filekv.storage.ValueCodec} - Pluggable value encoding, JSON by default</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>No partial records:</b> A record is replaced by atomic rename of a fully synced staging file</li>
 *   <li><b>Per-key ordering:</b> Saves and loads of one key are serialized; different keys never contend</li>
 *   <li><b>Contained paths:</b> No key can produce a path outside the base directory</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ task-{part1}-{part2}-{hash}.json   // one record per key
 *  └─ task-result-*.tmp                  // staging files, removed after each save
 * </pre>
 *
 * @see dev.mars.filekv.storage.KeyValueStore
 */
package dev.mars.filekv.storage;
