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

import io.nosqlbench.histogram.BinType;
import io.nosqlbench.histogram.Histogram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class HistogramHdf5StoreTest {

    @TempDir
    Path tempDir;

    private HistogramHdf5Store store(boolean overwrite) {
        return new HistogramHdf5Store(new HistogramStoreConfig(tempDir, overwrite));
    }

    private static Histogram counts() {
        Histogram h = Histogram.builder()
            .axis(3, 0, 3, "x")
            .axis(new double[] {0, 1, 4})
            .label("counts")
            .title("Random Data")
            .build();
        h.fill(new double[] {0.5, 0.5, 2.5, 1.5}, new double[] {0.5, 0.5, 3.0, 2.0});
        return h;
    }

    @Test
    void rootHistogramRoundTrip() throws IOException {
        Histogram h = counts();
        assertTrue(store(false).save(h, "counts.hdf5"));
        assertTrue(Files.isRegularFile(tempDir.resolve("counts.hdf5")));

        Histogram back = store(false).load("counts.hdf5");
        assertTrue(back.isIdentical(h), () -> "restored " + back + " differs from " + h);
        assertEquals(BinType.LONG, back.getType());
        assertFalse(back.hasUncert());
        assertEquals("x", back.axis(0).getLabel());
        assertNull(back.axis(1).getLabel());
        assertEquals("Random Data", back.getTitle());
    }

    @Test
    void doubleDataAndUncertaintySurvive() throws IOException {
        Histogram h = Histogram.builder()
            .axis(4, -1, 1)
            .data(new double[] {0.25, 1.5, -2, 0})
            .uncert(new double[] {0.5, 1, 1.5, 0})
            .build();
        store(false).save(h, "weighted.hdf5");
        Histogram back = store(false).load("weighted.hdf5");
        assertEquals(BinType.DOUBLE, back.getType());
        assertArrayEquals(h.getData(), back.getData());
        assertArrayEquals(h.getUncert(), back.getUncert());
        assertNull(back.getLabel());
    }

    @Test
    void namedHistogramsRoundTrip() throws IOException {
        Map<String, Histogram> named = new LinkedHashMap<>();
        named.put("b", counts());
        named.put("a", counts().times(2L));
        assertTrue(store(false).saveAll(named, "many.hdf5"));

        Map<String, Histogram> back = store(false).loadAll("many.hdf5");
        assertThat(back.keySet()).containsExactly("a", "b");
        assertTrue(back.get("a").isIdentical(named.get("a")));
        assertTrue(store(false).load("many.hdf5", "b").isIdentical(named.get("b")));
    }

    @Test
    void existingFilesAreKeptUnlessOverwriteIsSet() throws IOException {
        Histogram first = counts();
        Histogram second = counts().plus(1L);
        assertTrue(store(false).save(first, "keep.hdf5"));
        assertFalse(store(false).save(second, "keep.hdf5"));
        assertTrue(store(false).load("keep.hdf5").isIdentical(first));

        assertTrue(store(true).save(second, "keep.hdf5"));
        assertTrue(store(true).load("keep.hdf5").isIdentical(second));
    }

    @Test
    void missingFilesAreReported() {
        assertThrows(NoSuchFileException.class, () -> store(false).loadAll("absent.hdf5"));
        assertThrows(NoSuchFileException.class, () -> store(false).load("absent.hdf5"));
    }

    @Test
    void absolutePathsBypassTheDirectory() throws IOException {
        Path elsewhere = tempDir.resolve("nested").resolve("abs.hdf5");
        HistogramHdf5Store store = new HistogramHdf5Store(new HistogramStoreConfig(Path.of("unused"), false));
        assertTrue(store.save(counts(), elsewhere.toString()));
        assertTrue(Files.isRegularFile(elsewhere));
    }
}
