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

/**
 * No record has been saved for the requested key yet.
 * <p>
 * Expected on first use; callers usually treat it as "start from empty".
 */
public class RecordNotFoundException extends StoreException {

    private final String part1;
    private final String part2;

    public RecordNotFoundException(String part1, String part2) {
        super("No record stored for key (" + part1 + ", " + part2 + ")");
        this.part1 = part1;
        this.part2 = part2;
    }

    public String part1() {
        return part1;
    }

    public String part2() {
        return part2;
    }
}
