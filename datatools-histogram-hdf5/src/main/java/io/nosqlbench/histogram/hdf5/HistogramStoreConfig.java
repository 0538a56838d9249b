package io.nosqlbench.histogram.hdf5;

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
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/// Where histogram files live and whether existing files may be replaced.
///
/// ```json
/// {
///   "histogram_dir": "/data/histograms",
///   "overwrite": false
/// }
/// ```
///
/// A missing `histogram_dir` means the current working directory.
public final class HistogramStoreConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private static final String TEMP_SUFFIX = ".tmp";

    @SerializedName("histogram_dir")
    private String histogramDir;

    @SerializedName("overwrite")
    private boolean overwrite;

    /// Current directory, no overwriting.
    public HistogramStoreConfig() {
    }

    public HistogramStoreConfig(Path histogramDir, boolean overwrite) {
        this.histogramDir = histogramDir == null ? null : histogramDir.toString();
        this.overwrite = overwrite;
    }

    public Path getHistogramDir() {
        return Path.of(histogramDir == null || histogramDir.isEmpty() ? "." : histogramDir);
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public HistogramStoreConfig withOverwrite(boolean overwrite) {
        return new HistogramStoreConfig(getHistogramDir(), overwrite);
    }

    public HistogramStoreConfig withHistogramDir(Path dir) {
        return new HistogramStoreConfig(dir, overwrite);
    }

    /// Resolves `filename` against [#getHistogramDir()]. Absolute names are kept.
    public Path resolve(String filename) {
        Objects.requireNonNull(filename, "filename");
        Path path = Path.of(filename);
        return path.isAbsolute() ? path : getHistogramDir().resolve(path);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static HistogramStoreConfig fromJson(String json) {
        return fromJson(GSON.fromJson(json, HistogramStoreConfig.class), json);
    }

    public static HistogramStoreConfig fromJson(Reader reader) {
        return fromJson(GSON.fromJson(reader, HistogramStoreConfig.class), "<reader>");
    }

    private static HistogramStoreConfig fromJson(HistogramStoreConfig parsed, String source) {
        if (parsed == null) {
            throw new JsonParseException("empty store configuration: " + source);
        }
        return parsed;
    }

    public static HistogramStoreConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /// Writes this configuration through a temporary sibling file and a rename.
    public void saveToFile(Path path) throws IOException {
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(toJson());
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HistogramStoreConfig that)) {
            return false;
        }
        return overwrite == that.overwrite && getHistogramDir().equals(that.getHistogramDir());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getHistogramDir(), overwrite);
    }

    @Override
    public String toString() {
        return "HistogramStoreConfig{histogram_dir=" + getHistogramDir() + ", overwrite=" + overwrite + "}";
    }
}
