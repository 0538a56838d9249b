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

/// Thrown when histogram or axis input is malformed: edges that are not strictly
/// increasing, degenerate ranges, mismatched axes or shapes, unknown snap keywords,
/// or an axis index that does not exist.
public class HistogramValidationException extends IllegalArgumentException {

    public HistogramValidationException(String message) {
        super(message);
    }

    public HistogramValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
