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
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.nosqlbench.histogram.BinType;
import io.nosqlbench.histogram.Histogram;
import io.nosqlbench.histogram.HistogramValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static io.nosqlbench.histogram.hdf5.Hdf5HistogramWriter.DATA;
import static io.nosqlbench.histogram.hdf5.Hdf5HistogramWriter.EDGES;
import static io.nosqlbench.histogram.hdf5.Hdf5HistogramWriter.LABEL;
import static io.nosqlbench.histogram.hdf5.Hdf5HistogramWriter.TITLE;
import static io.nosqlbench.histogram.hdf5.Hdf5HistogramWriter.UNCERT;

/// Reads histograms in the layout produced by [Hdf5HistogramWriter].
///
/// Integer `data` datasets come back as [BinType#LONG], anything else as
/// [BinType#DOUBLE].
public class Hdf5HistogramReader implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Hdf5HistogramReader.class);

    private final Path path;
    private final HdfFile file;

    public Hdf5HistogramReader(Path path) {
        this.path = path;
        this.file = new HdfFile(path);
    }

    /// True when a histogram is stored at the file root.
    public boolean hasRootHistogram() {
        return file.getChild(DATA) instanceof Dataset;
    }

    /// The histogram at the file root.
    public Histogram read() {
        return readGroup(file, "/");
    }

    /// The histogram stored as group `name`.
    public Histogram read(String name) {
        Node node = file.getChild(name);
        if (!(node instanceof Group group)) {
            throw new HistogramValidationException("no histogram group '" + name + "' in " + path);
        }
        return readGroup(group, name);
    }

    /// Names of the groups that hold a histogram, sorted.
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        for (Map.Entry<String, Node> child : file.getChildren().entrySet()) {
            if (child.getValue() instanceof Group group && group.getChild(DATA) instanceof Dataset) {
                names.add(child.getKey());
            }
        }
        return names;
    }

    /// Every named histogram, in name order.
    public Map<String, Histogram> readAll() {
        Map<String, Histogram> result = new LinkedHashMap<>();
        for (String name : names()) {
            result.put(name, read(name));
        }
        logger.debug("read {} histogram(s) from {}", result.size(), path);
        return result;
    }

    private Histogram readGroup(Group group, String where) {
        if (!(group.getChild(DATA) instanceof Dataset dataset)) {
            throw new HistogramValidationException("no '" + DATA + "' dataset at " + where + " in " + path);
        }
        int[] shape = dataset.getDimensions();
        Flat data = flatten(dataset.getData());
        if (data.values().length != product(shape)) {
            throw new HistogramValidationException(
                "'" + DATA + "' at " + where + " has " + data.values().length + " values for shape "
                    + Arrays.toString(shape));
        }

        List<double[]> edges = new ArrayList<>(shape.length);
        List<String> axisLabels = new ArrayList<>(shape.length);
        for (int k = 0; k < shape.length; k++) {
            if (!(group.getChild(EDGES + k) instanceof Dataset edgeSet)) {
                throw new HistogramValidationException("missing '" + EDGES + k + "' at " + where + " in " + path);
            }
            edges.add(flatten(edgeSet.getData()).values());
            axisLabels.add(stringAttribute(edgeSet, LABEL));
        }

        double[] uncert = null;
        if (group.getChild(UNCERT) instanceof Dataset uncertSet) {
            uncert = flatten(uncertSet.getData()).values();
        }
        return Histogram.fromParts(edges, axisLabels, data.values(), data.type(), uncert,
            stringAttribute(group, LABEL), stringAttribute(group, TITLE));
    }

    private static int product(int[] shape) {
        int size = 1;
        for (int extent : shape) {
            size *= extent;
        }
        return size;
    }

    private static String stringAttribute(Node node, String name) {
        Attribute attribute = node.getAttribute(name);
        if (attribute == null) {
            return null;
        }
        Object value = attribute.getData();
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof String[] values && values.length > 0) {
            return values[0];
        }
        return value == null ? null : value.toString();
    }

    record Flat(double[] values, BinType type) {
    }

    /// Flattens a nested primitive array row-major. The innermost component type
    /// decides the bin type.
    static Flat flatten(Object nested) {
        List<Object> leaves = new ArrayList<>();
        collectLeaves(nested, leaves);
        int total = 0;
        for (Object leaf : leaves) {
            total += Array.getLength(leaf);
        }
        double[] values = new double[total];
        BinType type = BinType.DOUBLE;
        int pos = 0;
        for (Object leaf : leaves) {
            if (leaf instanceof long[] longs) {
                type = BinType.LONG;
                for (long v : longs) {
                    values[pos++] = v;
                }
            } else if (leaf instanceof int[] ints) {
                type = BinType.LONG;
                for (int v : ints) {
                    values[pos++] = v;
                }
            } else if (leaf instanceof double[] doubles) {
                System.arraycopy(doubles, 0, values, pos, doubles.length);
                pos += doubles.length;
            } else if (leaf instanceof float[] floats) {
                for (float v : floats) {
                    values[pos++] = v;
                }
            } else {
                throw new HistogramValidationException(
                    "unsupported dataset element type " + leaf.getClass().getComponentType());
            }
        }
        return new Flat(values, type);
    }

    private static void collectLeaves(Object array, List<Object> leaves) {
        if (array == null || !array.getClass().isArray()) {
            throw new HistogramValidationException("expected an array dataset, got " + array);
        }
        if (array.getClass().getComponentType().isPrimitive()) {
            leaves.add(array);
            return;
        }
        int n = Array.getLength(array);
        for (int i = 0; i < n; i++) {
            collectLeaves(Array.get(array, i), leaves);
        }
    }

    @Override
    public void close() {
        file.close();
    }
}
