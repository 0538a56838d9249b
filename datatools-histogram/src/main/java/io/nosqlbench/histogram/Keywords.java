package io.nosqlbench.histogram;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

final class Keywords {

    private Keywords() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String keyword) {
        if (keyword == null) {
            throw new HistogramValidationException("Unknown snap keyword: null");
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.name().toLowerCase(Locale.ROOT).equals(keyword)) {
                return constant;
            }
        }
        String known = Arrays.stream(type.getEnumConstants())
            .map(e -> e.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
        throw new HistogramValidationException(
            "Unknown snap keyword: " + keyword + " (expected one of " + known + ")");
    }
}
