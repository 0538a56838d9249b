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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableDataset;
import io.jhdf.api.WritableGroup;
import io.nosqlbench.histogram.BinType;
import io.nosqlbench.histogram.Histogram;
import io.nosqlbench.histogram.HistogramAxis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/// Writes histograms to an HDF5 file.
///
/// ```text
/// <group>                 attributes: label, title (when set)
///   data      N-dim long or double, shaped like the histogram
///   uncert    N-dim double, only when uncertainty is tracked
///   edges0    double[], attribute: label (when set)
///   ...
///   edgesN-1
/// ```
///
/// One histogram may be written at the file root with [#write(Histogram)], and
/// any number as named groups with [#write(String, Histogram)]. The file is
/// assembled in a temporary sibling and moved into place on [#close()].
public class Hdf5HistogramWriter implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Hdf5HistogramWriter.class);

    static final String DATA = "data";
    static final String UNCERT = "uncert";
    static final String EDGES = "edges";
    static final String LABEL = "label";
    static final String TITLE = "title";

    private final Path target;
    private final Path tempFile;
    private final WritableHdfFile writable;
    private int written;
    private boolean closed;

    /// @param target the file to produce; replaced on close if it exists
    public Hdf5HistogramWriter(Path target) throws IOException {
        this.target = target.toAbsolutePath();
        Path dir = this.target.getParent();
        Files.createDirectories(dir);
        this.tempFile = Files.createTempFile(dir, ".hdf5buffer", ".hdf5");
        this.writable = HdfFile.write(tempFile);
    }

    /// Writes `histogram` at the root of the file.
    public void write(Histogram histogram) {
        writeInto(writable, histogram);
        logger.debug("wrote root histogram {} to {}", histogram, target);
    }

    /// Writes `histogram` as the group `name`.
    public void write(String name, Histogram histogram) {
        if (name == null || name.isEmpty() || name.contains("/")) {
            throw new IllegalArgumentException("histogram group name must be non-empty without '/': " + name);
        }
        writeInto(writable.putGroup(name), histogram);
        logger.debug("wrote histogram '{}' to {}", name, target);
    }

    private void writeInto(WritableGroup group, Histogram histogram) {
        int[] shape = histogram.shape();
        boolean integral = histogram.getType() == BinType.LONG;
        group.putDataset(DATA, toNested(histogram.getData(), shape, integral));
        if (histogram.hasUncert()) {
            group.putDataset(UNCERT, toNested(histogram.getUncert(), shape, false));
        }
        List<HistogramAxis> axes = histogram.getAxes();
        for (int k = 0; k < axes.size(); k++) {
            WritableDataset edges = group.putDataset(EDGES + k, axes.get(k).getEdges());
            if (axes.get(k).getLabel() != null) {
                edges.putAttribute(LABEL, axes.get(k).getLabel());
            }
        }
        if (histogram.getLabel() != null) {
            group.putAttribute(LABEL, histogram.getLabel());
        }
        if (histogram.getTitle() != null) {
            group.putAttribute(TITLE, histogram.getTitle());
        }
        written++;
    }

    /// Reshapes row-major `flat` into a `long` or `double` array nested `shape.length` deep.
    static Object toNested(double[] flat, int[] shape, boolean integral) {
        Class<?> component = integral ? long.class : double.class;
        Object nested = Array.newInstance(component, shape);
        int[] index = new int[shape.length];
        for (int i = 0; i < flat.length; i++) {
            Object row = nested;
            for (int k = 0; k < shape.length - 1; k++) {
                row = Array.get(row, index[k]);
            }
            int last = index[shape.length - 1];
            if (integral) {
                ((long[]) row)[last] = (long) flat[i];
            } else {
                ((double[]) row)[last] = flat[i];
            }
            for (int k = shape.length - 1; k >= 0; k--) {
                if (++index[k] < shape[k]) {
                    break;
                }
                index[k] = 0;
            }
        }
        return nested;
    }

    /// Flushes the file and moves it into place. Nothing is moved when nothing
    /// was written.
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writable.close();
        } catch (RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
        if (written == 0) {
            logger.warn("no histograms were written, discarding {}", target);
            Files.deleteIfExists(tempFile);
            return;
        }
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("wrote {} histogram(s) to {}", written, target);
    }
}
