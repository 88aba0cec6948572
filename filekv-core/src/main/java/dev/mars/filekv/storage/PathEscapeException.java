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

import java.nio.file.Path;

/**
 * A resolved record path fell outside the store's base directory.
 * <p>
 * Filename sanitization should make this unreachable; seeing it means the
 * sanitizer has regressed.
 */
public class PathEscapeException extends StoreException {

    private final Path path;

    public PathEscapeException(Path baseDir, Path path) {
        super("Resolved path " + path + " escapes base directory " + baseDir);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
