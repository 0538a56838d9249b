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

import io.nosqlbench.histogram.Histogram;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Saves and loads histograms as HDF5 files under the directory named by a
/// [HistogramStoreConfig].
///
/// ```java
/// HistogramHdf5Store store = new HistogramHdf5Store(
///     new HistogramStoreConfig(Path.of("/data/histograms"), false));
/// store.save(h, "run1.hdf5");
/// Histogram back = store.load("run1.hdf5");
/// ```
///
/// Existing files are only replaced when the configuration allows it; otherwise
/// a save logs a warning and returns `false`.
public class HistogramHdf5Store {

    private static final Logger logger = LogManager.getLogger(HistogramHdf5Store.class);

    private final HistogramStoreConfig config;

    public HistogramHdf5Store(HistogramStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public HistogramStoreConfig getConfig() {
        return config;
    }

    public Path resolve(String filename) {
        return config.resolve(filename);
    }

    /// Saves `histogram` at the root of `filename`.
    ///
    /// @return false when the file exists and overwriting is not configured
    public boolean save(Histogram histogram, String filename) throws IOException {
        Path path = resolve(filename);
        if (refuseOverwrite(path)) {
            return false;
        }
        try (Hdf5HistogramWriter writer = new Hdf5HistogramWriter(path)) {
            writer.write(histogram);
        }
        return true;
    }

    /// Saves each histogram of `histograms` as a group named by its key.
    ///
    /// @return false when the file exists and overwriting is not configured
    public boolean saveAll(Map<String, Histogram> histograms, String filename) throws IOException {
        if (histograms.isEmpty()) {
            throw new IllegalArgumentException("no histograms to save to " + filename);
        }
        Path path = resolve(filename);
        if (refuseOverwrite(path)) {
            return false;
        }
        try (Hdf5HistogramWriter writer = new Hdf5HistogramWriter(path)) {
            for (Map.Entry<String, Histogram> entry : histograms.entrySet()) {
                writer.write(entry.getKey(), entry.getValue());
            }
        }
        return true;
    }

    /// Loads the histogram at the root of `filename`.
    ///
    /// @throws NoSuchFileException when the file does not exist
    public Histogram load(String filename) throws IOException {
        Path path = requireExisting(filename);
        try (Hdf5HistogramReader reader = new Hdf5HistogramReader(path)) {
            return reader.read();
        }
    }

    /// Loads the histogram stored as group `name` in `filename`.
    public Histogram load(String filename, String name) throws IOException {
        Path path = requireExisting(filename);
        try (Hdf5HistogramReader reader = new Hdf5HistogramReader(path)) {
            return reader.read(name);
        }
    }

    /// Loads every named histogram in `filename`, in name order.
    ///
    /// @throws NoSuchFileException when the file does not exist
    public Map<String, Histogram> loadAll(String filename) throws IOException {
        Path path = requireExisting(filename);
        try (Hdf5HistogramReader reader = new Hdf5HistogramReader(path)) {
            return reader.readAll();
        }
    }

    private Path requireExisting(String filename) throws NoSuchFileException {
        Path path = resolve(filename);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return path;
    }

    private boolean refuseOverwrite(Path path) {
        if (Files.exists(path) && !config.isOverwrite()) {
            logger.warn("not overwriting existing histogram file {}; set overwrite to replace it", path);
            return true;
        }
        return false;
    }
}
