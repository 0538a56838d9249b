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
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.histogram.BinType;
import io.nosqlbench.histogram.Histogram;
import io.nosqlbench.histogram.HistogramAxis;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/// Gson [TypeAdapterFactory] for [Histogram] and [HistogramAxis].
///
/// ## Format
///
/// ```json
/// {
///   "label": "counts",
///   "title": "Random Data",
///   "type": "long",
///   "shape": [3, 2],
///   "axes": [
///     {"edges": [0.0, 1.0, 2.0, 3.0], "label": "x"},
///     {"edges": [0.0, 0.5, 1.0]}
///   ],
///   "data": [1, 2, 3, 4, 5, 6],
///   "uncert": [1.0, 1.4, 1.7, 2.0, 2.2, 2.4]
/// }
/// ```
///
/// `data` and `uncert` are flattened row-major. Absent labels, titles and
/// uncertainties are omitted. `long` data is written as integers. NaN and infinite
/// values are written leniently, matching [HistogramGsonConfig].
///
/// On read, `shape` is checked against the axes when present.
public final class HistogramTypeAdapterFactory implements TypeAdapterFactory {

    private static final String LABEL = "label";
    private static final String TITLE = "title";
    private static final String TYPE = "type";
    private static final String SHAPE = "shape";
    private static final String AXES = "axes";
    private static final String EDGES = "edges";
    private static final String DATA = "data";
    private static final String UNCERT = "uncert";

    private HistogramTypeAdapterFactory() {
    }

    public static HistogramTypeAdapterFactory create() {
        return new HistogramTypeAdapterFactory();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        if (raw == Histogram.class) {
            return (TypeAdapter<T>) new HistogramAdapter();
        }
        if (raw == HistogramAxis.class) {
            return (TypeAdapter<T>) new AxisAdapter();
        }
        return null;
    }

    private static final class AxisAdapter extends TypeAdapter<HistogramAxis> {
        @Override
        public void write(JsonWriter out, HistogramAxis axis) throws IOException {
            if (axis == null) {
                out.nullValue();
                return;
            }
            withLenient(out, () -> writeAxis(out, axis));
        }

        @Override
        public HistogramAxis read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return readAxis(in);
        }
    }

    private static final class HistogramAdapter extends TypeAdapter<Histogram> {
        @Override
        public void write(JsonWriter out, Histogram histogram) throws IOException {
            if (histogram == null) {
                out.nullValue();
                return;
            }
            withLenient(out, () -> writeHistogram(out, histogram));
        }

        @Override
        public Histogram read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            boolean wasLenient = in.isLenient();
            in.setLenient(true);
            try {
                return readHistogram(in);
            } finally {
                in.setLenient(wasLenient);
            }
        }
    }

    private interface IOAction {
        void run() throws IOException;
    }

    private static void withLenient(JsonWriter out, IOAction action) throws IOException {
        boolean wasLenient = out.isLenient();
        out.setLenient(true);
        try {
            action.run();
        } finally {
            out.setLenient(wasLenient);
        }
    }

    private static void writeAxis(JsonWriter out, HistogramAxis axis) throws IOException {
        out.beginObject();
        out.name(EDGES);
        writeDoubles(out, axis.getEdges());
        if (axis.getLabel() != null) {
            out.name(LABEL).value(axis.getLabel());
        }
        out.endObject();
    }

    private static void writeHistogram(JsonWriter out, Histogram h) throws IOException {
        out.beginObject();
        if (h.getLabel() != null) {
            out.name(LABEL).value(h.getLabel());
        }
        if (h.getTitle() != null) {
            out.name(TITLE).value(h.getTitle());
        }
        out.name(TYPE).value(h.getType().name().toLowerCase(Locale.ROOT));
        out.name(SHAPE);
        out.beginArray();
        for (int extent : h.shape()) {
            out.value(extent);
        }
        out.endArray();
        out.name(AXES);
        out.beginArray();
        for (HistogramAxis axis : h.getAxes()) {
            writeAxis(out, axis);
        }
        out.endArray();
        out.name(DATA);
        if (h.getType() == BinType.LONG) {
            out.beginArray();
            for (double v : h.getData()) {
                out.value((long) v);
            }
            out.endArray();
        } else {
            writeDoubles(out, h.getData());
        }
        if (h.hasUncert()) {
            out.name(UNCERT);
            writeDoubles(out, h.getUncert());
        }
        out.endObject();
    }

    private static void writeDoubles(JsonWriter out, double[] values) throws IOException {
        out.beginArray();
        for (double v : values) {
            out.value(v);
        }
        out.endArray();
    }

    private static HistogramAxis readAxis(JsonReader in) throws IOException {
        double[] edges = null;
        String label = null;
        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            switch (name) {
                case EDGES -> edges = readDoubles(in);
                case LABEL -> label = readString(in);
                default -> in.skipValue();
            }
        }
        in.endObject();
        if (edges == null) {
            throw new JsonParseException("axis has no '" + EDGES + "' field");
        }
        return new HistogramAxis(edges, label);
    }

    private static Histogram readHistogram(JsonReader in) throws IOException {
        String label = null;
        String title = null;
        BinType type = BinType.LONG;
        int[] shape = null;
        List<HistogramAxis> axes = null;
        double[] data = null;
        double[] uncert = null;

        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            switch (name) {
                case LABEL -> label = readString(in);
                case TITLE -> title = readString(in);
                case TYPE -> type = parseType(in.nextString());
                case SHAPE -> {
                    double[] raw = readDoubles(in);
                    shape = new int[raw.length];
                    for (int i = 0; i < raw.length; i++) {
                        shape[i] = (int) raw[i];
                    }
                }
                case AXES -> {
                    axes = new ArrayList<>();
                    in.beginArray();
                    while (in.hasNext()) {
                        axes.add(readAxis(in));
                    }
                    in.endArray();
                }
                case DATA -> data = readDoubles(in);
                case UNCERT -> uncert = in.peek() == JsonToken.NULL ? skipNull(in) : readDoubles(in);
                default -> in.skipValue();
            }
        }
        in.endObject();

        if (axes == null || axes.isEmpty()) {
            throw new JsonParseException("histogram has no '" + AXES + "'");
        }
        if (shape != null) {
            int[] expected = new int[axes.size()];
            for (int k = 0; k < expected.length; k++) {
                expected[k] = axes.get(k).nbins();
            }
            if (!Arrays.equals(shape, expected)) {
                throw new JsonParseException(
                    "shape " + Arrays.toString(shape) + " does not match axes " + Arrays.toString(expected));
            }
        }
        List<double[]> edges = new ArrayList<>(axes.size());
        List<String> axisLabels = new ArrayList<>(axes.size());
        for (HistogramAxis axis : axes) {
            edges.add(axis.getEdges());
            axisLabels.add(axis.getLabel());
        }
        return Histogram.fromParts(edges, axisLabels, data, type, uncert, label, title);
    }

    private static BinType parseType(String name) {
        try {
            return BinType.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("unknown bin type '" + name + "', expected one of "
                + Arrays.toString(BinType.values()), e);
        }
    }

    private static double[] skipNull(JsonReader in) throws IOException {
        in.nextNull();
        return null;
    }

    private static String readString(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        return in.nextString();
    }

    /// Reads a numeric array; the lenient reader accepts NaN and Infinity.
    private static double[] readDoubles(JsonReader in) throws IOException {
        List<Double> values = new ArrayList<>();
        in.beginArray();
        while (in.hasNext()) {
            values.add(in.nextDouble());
        }
        in.endArray();
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
