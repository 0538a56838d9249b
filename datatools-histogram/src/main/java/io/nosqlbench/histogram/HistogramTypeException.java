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

/// Thrown when an argument is of the wrong kind for the requested operation, for
/// example a bin count given without a range, or an in-place division of an
/// integer-valued histogram by another histogram, which would silently truncate.
public class HistogramTypeException extends IllegalArgumentException {

    public HistogramTypeException(String message) {
        super(message);
    }
}
