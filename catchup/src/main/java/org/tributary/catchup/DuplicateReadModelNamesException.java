/*
 * Copyright 2024 The Tributary Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.catchup;

import java.util.List;

/**
 * Thrown when a catchup is configured with several projectors sharing the same name.
 */
public class DuplicateReadModelNamesException extends IllegalArgumentException {
    public final List<String> duplicateNames;

    public DuplicateReadModelNamesException(List<String> duplicateNames) {
        super("Duplicate read model names:\n" + String.join("\n", duplicateNames));
        this.duplicateNames = List.copyOf(duplicateNames);
    }
}
