package io.nosqlbench.histogram.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for histogram JSON.
///
/// ```java
/// Gson gson = HistogramGsonConfig.gson();
/// String json = gson.toJson(histogram);
/// Histogram restored = gson.fromJson(json, Histogram.class);
/// ```
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | enabled, except for [#compactGson()] |
/// | HTML escaping | disabled |
/// | NaN and Infinity | written |
/// | Histogram adapter | registered |
///
/// The shared [Gson] instance is thread-safe.
///
/// @see HistogramTypeAdapterFactory
public final class HistogramGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private HistogramGsonConfig() {
    }

    /// @return the shared pretty-printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// A new builder with the histogram defaults, for callers that register
    /// their own adapters alongside.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(HistogramTypeAdapterFactory.create());
    }

    /// Single-line output, one histogram per line.
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(HistogramTypeAdapterFactory.create())
            .create();
    }
}
