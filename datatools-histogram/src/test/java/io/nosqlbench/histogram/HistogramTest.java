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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class HistogramTest {

    private static final double TOLERANCE = 1e-9;

    private static Histogram tenBins() {
        return new Histogram(new HistogramAxis(10, 0, 10));
    }

    private static Histogram threeBins(long... values) {
        return Histogram.builder().axis(3, 0, 3).data(values).build();
    }

    /// Two rows (axis 0) by three columns (axis 1), values 0..5.
    private static Histogram twoByThree() {
        return Histogram.builder()
            .axis(2, 0, 2, "row")
            .axis(3, 0, 3, "col")
            .data(new long[] {0, 1, 2, 3, 4, 5})
            .label("cells")
            .build();
    }

    @Test
    void newHistogramIsZeroFilledLong() {
        Histogram h = Histogram.builder().axis(4, 0, 1).axis(new double[] {0, 1, 3}).build();
        assertEquals(2, h.dim());
        assertArrayEquals(new int[] {4, 2}, h.shape());
        assertEquals(8, h.size());
        assertEquals(BinType.LONG, h.getType());
        assertArrayEquals(new double[8], h.getData());
        assertFalse(h.hasUncert());
        assertNull(h.getUncert());
    }

    @Test
    void zeroAxesIsATypeError() {
        assertThrows(HistogramTypeException.class, () -> new Histogram());
        assertThrows(HistogramTypeException.class, () -> new Histogram(new ArrayList<AxisSpec>()));
    }

    @Test
    void constructionFromSpecs() {
        Histogram h = new Histogram(List.of(AxisSpec.uniform(5, 0, 5, "x"), AxisSpec.edges(new double[] {0, 2, 4})));
        assertArrayEquals(new int[] {5, 2}, h.shape());
        assertEquals("x", h.axis(0).getLabel());
    }

    @Test
    void axesAreCopiedAtConstruction() {
        HistogramAxis axis = new HistogramAxis(3, 0, 3);
        Histogram h = new Histogram(axis);
        axis.setEdges(new double[] {0, 10});
        assertEquals(3, h.axis(0).nbins());
    }

    @Test
    void mismatchedInitialDataIsRejected() {
        assertThrows(HistogramValidationException.class,
            () -> Histogram.builder().axis(3, 0, 3).data(new long[] {1, 2}).build());
        assertThrows(HistogramValidationException.class,
            () -> Histogram.builder().axis(3, 0, 3).uncert(new double[] {1}).build());
    }

    @Test
    void integerDataBeyondExactRangeIsRejected() {
        long limit = BinType.MAX_EXACT_LONG;
        Histogram h = Histogram.builder().axis(2, 0, 2).data(new long[] {limit, -limit}).build();
        assertEquals((double) limit, h.getValue(0));

        assertThrows(HistogramValidationException.class,
            () -> Histogram.builder().axis(1, 0, 1).data(new long[] {limit + 1}).build());
        assertThrows(HistogramValidationException.class, () -> h.setData(new long[] {0, Long.MIN_VALUE}));
        assertArrayEquals(new double[] {limit, -limit}, h.getData());
    }

    @Test
    void fillDropsOutOfRangeSamples() {
        Histogram h = tenBins();
        h.fill(new double[] {1.5, 1.5, 2.5, 20, -1, 10.0, Double.NaN});
        assertEquals(2, h.getValue(1));
        assertEquals(1, h.getValue(2));
        assertEquals(3, h.sum().value(), TOLERANCE);
        assertEquals(BinType.LONG, h.getType());
    }

    @Test
    void fractionalWeightsPromoteStorage() {
        Histogram h = tenBins();
        h.fillWeighted(new double[][] {{1.5, 1.5}}, new double[] {0.5, 0.25});
        assertEquals(BinType.DOUBLE, h.getType());
        assertEquals(0.75, h.getValue(1), TOLERANCE);
    }

    @Test
    void fillTracksWeightVariance() {
        Histogram h = tenBins();
        h.set(0, 0);
        h.fillWeighted(new double[][] {{1.5, 1.5}}, new double[] {2, 2});
        assertEquals(4, h.getValue(1), TOLERANCE);
        assertEquals(Math.sqrt(8), h.getUncertValue(1), TOLERANCE);

        h.fillWeighted(new double[][] {{3.5}}, new double[] {1}, new double[] {0.5});
        assertEquals(0.5, h.getUncertValue(3), TOLERANCE);
    }

    @Test
    void fillChecksCoordinateArity() {
        Histogram h = twoByThree();
        assertThrows(HistogramValidationException.class, () -> h.fill(new double[] {1}));
        assertThrows(HistogramValidationException.class,
            () -> h.fill(new double[] {1, 2}, new double[] {1}));
    }

    @Test
    void fillFromSampleRows() {
        Histogram h = new Histogram(new HistogramAxis(2, 0, 2), new HistogramAxis(3, 0, 3));
        h.fillFromSample(new double[][] {{0.5, 2.5}, {1.5, 0.5}, {1.5, 0.5}, {5, 5}});
        assertEquals(1, h.getValue(0, 2));
        assertEquals(2, h.getValue(1, 0));
        h.fillOne(new double[] {0.1, 0.1}, 3);
        assertEquals(3, h.getValue(0, 0));
    }

    @Test
    void untrackedUncertaintyIsPoisson() {
        Histogram h = threeBins(4, 9, 0);
        assertArrayEquals(new double[] {2, 3, 0}, h.getEffectiveUncert(), TOLERANCE);
        assertFalse(h.hasUncert());
    }

    @Test
    void divisionByZeroCellsYieldsZero() {
        Histogram a = threeBins(2, 1, 0);
        Histogram b = threeBins(1, 2, 3);
        Histogram ab = a.dividedBy(b);
        Histogram ba = b.dividedBy(a);
        assertEquals(BinType.DOUBLE, ab.getType());
        assertArrayEquals(new double[] {2, 0.5, 0}, ab.getData(), TOLERANCE);
        assertArrayEquals(new double[] {0.5, 2, 0}, ba.getData(), TOLERANCE);
        assertEquals(BinType.LONG, a.getType());
    }

    @Test
    void scalarArithmeticKeepsIntegerStorage() {
        Histogram h = threeBins(1, 2, 3);
        Histogram sum = h.plus(2L);
        assertEquals(BinType.LONG, sum.getType());
        assertArrayEquals(new double[] {3, 4, 5}, sum.getData());
        assertEquals(BinType.DOUBLE, h.plus(0.5).getType());
        assertArrayEquals(new double[] {2, 4, 6}, h.times(new long[] {2, 2, 2}).getData());
        assertArrayEquals(new double[] {-1, -1, -1}, h.minus(h.plus(1L)).getData());
        assertArrayEquals(new double[] {9, 8, 7}, h.subtractFrom(10).getData(), TOLERANCE);
        assertArrayEquals(new double[] {6, 3, 2}, h.divideInto(6).getData(), TOLERANCE);
    }

    @Test
    void uncertaintyScalesExactlyWithScalars() {
        Histogram h = Histogram.builder().axis(3, 0, 3).data(new long[] {1, 2, 3}).uncert(new double[] {1, 2, 3}).build();
        assertArrayEquals(new double[] {2, 4, 6}, h.times(2L).getUncert(), TOLERANCE);
        assertArrayEquals(new double[] {0.5, 1, 1.5}, h.dividedBy(2).getUncert(), TOLERANCE);
        assertArrayEquals(new double[] {1, 2, 3}, h.plus(5L).getUncert(), TOLERANCE);
    }

    @Test
    void uncertaintyAddsInQuadrature() {
        Histogram tracked = Histogram.builder().axis(3, 0, 3)
            .data(new long[] {1, 1, 1}).uncert(new double[] {3, 0, 0}).build();
        Histogram poisson = threeBins(16, 0, 0);
        Histogram sum = tracked.plus(poisson);
        assertArrayEquals(new double[] {17, 1, 1}, sum.getData());
        assertArrayEquals(new double[] {5, 0, 0}, sum.getUncert(), TOLERANCE);
        assertNull(threeBins(1, 1, 1).plus(threeBins(1, 1, 1)).getUncert());
    }

    @Test
    void relativeUncertaintyForProducts() {
        Histogram a = Histogram.builder().axis(2, 0, 2)
            .data(new double[] {2, 0}).uncert(new double[] {0.2, 1}).build();
        Histogram b = Histogram.builder().axis(2, 0, 2)
            .data(new double[] {4, 3}).uncert(new double[] {0.4, 0.3}).build();
        Histogram p = a.times(b);
        assertArrayEquals(new double[] {8, 0}, p.getData(), TOLERANCE);
        assertEquals(8 * Math.sqrt(0.01 + 0.01), p.getUncert()[0], TOLERANCE);
        assertEquals(0, p.getUncert()[1], TOLERANCE);
        assertTrue(Double.isFinite(a.dividedBy(a).getUncert()[1]));
    }

    @Test
    void productUncertaintyFollowsRelativeQuadrature() {
        Histogram h1 = Histogram.builder().axis(3, 0, 10)
            .data(new long[] {1, 2, 3}).uncert(new double[] {1, 2, 3}).build();
        Histogram h2 = h1.times(2L);
        assertArrayEquals(new double[] {2, 4, 6}, h2.getUncert(), TOLERANCE);

        Histogram h3 = h1.times(h2);
        Histogram q = h1.dividedBy(h2);
        double[] u1 = h1.getUncert();
        double[] d1 = h1.getData();
        double[] u2 = h2.getUncert();
        double[] d2 = h2.getData();
        for (int i = 0; i < 3; i++) {
            double ratio = Math.sqrt(Math.pow(u1[i] / d1[i], 2) + Math.pow(u2[i] / d2[i], 2));
            assertEquals(ratio * h3.getData()[i], h3.getUncert()[i], TOLERANCE);
            assertEquals(ratio * q.getData()[i], q.getUncert()[i], TOLERANCE);
        }
    }

    @Test
    void additionAndMultiplicationCommuteAndAssociate() {
        Histogram a = threeBins(1, 5, 0);
        Histogram b = threeBins(2, 3, 7);
        Histogram c = threeBins(4, 0, 9);

        assertTrue(a.plus(b).isIdentical(b.plus(a)));
        assertTrue(a.times(b).isIdentical(b.times(a)));
        assertTrue(a.plus(b).plus(c).isIdentical(a.plus(b.plus(c))));
        assertTrue(a.times(b).times(c).isIdentical(a.times(b.times(c))));
    }

    @Test
    void reflectedAdditionMatchesForwardAddition() {
        Histogram h = threeBins(1, 2, 3);
        assertTrue(h.applyReflected(BinaryOp.ADD, Operand.of(3L)).isIdentical(h.plus(3L)));
        double[] values = {0.5, 1.5, 2.5};
        assertTrue(h.applyReflected(BinaryOp.ADD, Operand.of(values)).isIdentical(h.plus(values)));
        assertTrue(h.applyReflected(BinaryOp.MULTIPLY, Operand.of(2.0)).isIdentical(h.times(2.0)));
    }

    @Test
    void subtractionUndoesAddition() {
        Histogram h1 = Histogram.builder().axis(4, 0, 4).data(new double[] {0.1, 0.7, 2.3, -1.9}).build();
        Histogram h2 = Histogram.builder().axis(4, 0, 4).data(new double[] {3.3, 0.01, 5, 1e3}).build();
        assertTrue(h1.plus(h2).minus(h2).isIdentical(h1));
    }

    @Test
    void mismatchedOperandsAreRejected() {
        Histogram h = threeBins(1, 2, 3);
        assertThrows(HistogramValidationException.class, () -> h.plus(new Histogram(new HistogramAxis(4, 0, 3))));
        assertThrows(HistogramValidationException.class, () -> h.plus(new double[] {1, 2}));
    }

    @Test
    void inPlaceOperationsKeepAxesAndBuffers() {
        Histogram h = threeBins(1, 2, 3);
        HistogramAxis before = h.getAxes().get(0);
        h.addInPlace(1L).multiplyInPlace(2L);
        assertSame(before, h.getAxes().get(0));
        assertArrayEquals(new double[] {4, 6, 8}, h.getData());
        h.subtractInPlace(threeBins(1, 1, 1));
        assertArrayEquals(new double[] {3, 5, 7}, h.getData());
        assertEquals(BinType.LONG, h.getType());
    }

    @Test
    void inPlaceIntegerDivisionByHistogramIsRefused() {
        Histogram h = threeBins(2, 4, 6);
        assertThrows(HistogramTypeException.class, () -> h.divideInPlace(threeBins(1, 1, 1)));
        assertArrayEquals(new double[] {2, 4, 6}, h.getData());

        h.divideInPlace(4);
        assertEquals(BinType.DOUBLE, h.getType());
        assertArrayEquals(new double[] {0.5, 1, 1.5}, h.getData(), TOLERANCE);

        Histogram d = h.clone(BinType.DOUBLE);
        d.divideInPlace(threeBins(1, 2, 0));
        assertArrayEquals(new double[] {0.5, 0.5, 0}, d.getData(), TOLERANCE);
    }

    @Test
    void applyEntryPointMatchesSugar() {
        Histogram h = threeBins(1, 2, 3);
        assertTrue(h.apply(BinaryOp.MULTIPLY, Operand.of(3L)).isIdentical(h.times(3L)));
        assertTrue(h.applyReflected(BinaryOp.SUBTRACT, Operand.of(1.0)).isIdentical(h.subtractFrom(1.0)));
    }

    @Test
    void cutKeepsRetainedBins() {
        Histogram h = tenBins();
        h.setData(new long[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9});
        Histogram cut = h.cut(2.4, 7.6);
        assertArrayEquals(new double[] {2, 3, 4, 5, 6, 7}, cut.getData());
        assertArrayEquals(new double[] {2, 3, 4, 5, 6, 7, 8}, cut.axis(0).getEdges(), TOLERANCE);
    }

    @Test
    void clippedCutOnAnEdge() {
        Histogram h = tenBins();
        h.setData(new long[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9});
        Histogram cut = h.cut(2.0, 5.0, 0, CutSnap.CLIP);
        assertArrayEquals(new double[] {2, 3, 4}, cut.getData());
        assertArrayEquals(new double[] {2, 3, 4, 5}, cut.axis(0).getEdges(), TOLERANCE);
    }

    @Test
    void cutAlongSecondAxis() {
        Histogram h = twoByThree();
        h.setUncert(new double[] {1, 1, 1, 2, 2, 2});
        Histogram cut = h.cut(1.0, null, 1);
        assertArrayEquals(new int[] {2, 2}, cut.shape());
        assertArrayEquals(new double[] {1, 2, 4, 5}, cut.getData());
        assertArrayEquals(new double[] {1, 1, 2, 2}, cut.getUncert());
        assertEquals("cells", cut.getLabel());
        assertThrows(HistogramValidationException.class, () -> h.cut(0.0, 1.0, 2));
    }

    @Test
    void rebinSumsGroups() {
        Histogram h = tenBins();
        h.set(1, 1);
        Histogram r = h.rebin();
        assertArrayEquals(new double[] {2, 2, 2, 2, 2}, r.getData());
        assertArrayEquals(new double[] {0, 2, 4, 6, 8, 10}, r.axis(0).getEdges(), TOLERANCE);
        for (double u : r.getUncert()) {
            assertEquals(Math.sqrt(2), u, TOLERANCE);
        }
    }

    @Test
    void rebinClipsTrailingBins() {
        Histogram h = tenBins();
        h.setData(new long[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9});
        assertArrayEquals(new double[] {3, 12, 21}, h.rebin(3).getData());
        assertArrayEquals(new double[] {0, 6, 15, 24}, h.rebin(3, 0, MergeSnap.HIGH, false).getData());
        assertArrayEquals(new double[] {3, 12, 21, 9}, h.rebin(3, 0, MergeSnap.LOW, false).getData());
    }

    @Test
    void slicesAreRestartable() {
        Histogram h = twoByThree();
        List<double[]> rows = new ArrayList<>();
        for (Histogram slice : h.slices(0)) {
            assertEquals(1, slice.dim());
            assertEquals("col", slice.axis(0).getLabel());
            rows.add(slice.getData());
        }
        assertEquals(2, rows.size());
        assertArrayEquals(new double[] {0, 1, 2}, rows.get(0));
        assertArrayEquals(new double[] {3, 4, 5}, rows.get(1));

        Iterable<double[]> columns = h.slicesData(1);
        for (int pass = 0; pass < 2; pass++) {
            List<double[]> seen = new ArrayList<>();
            columns.forEach(seen::add);
            assertEquals(3, seen.size());
            assertArrayEquals(new double[] {1, 4}, seen.get(1));
        }
        double[] firstUncert = h.slicesUncert(0).iterator().next();
        assertArrayEquals(new double[] {0, 1, Math.sqrt(2)}, firstUncert, TOLERANCE);
    }

    @Test
    void slicesDefaultToFirstAxis() {
        Histogram h = twoByThree();
        List<double[]> defaults = new ArrayList<>();
        for (Histogram slice : h.slices()) {
            defaults.add(slice.getData());
        }
        List<double[]> explicit = new ArrayList<>();
        h.slicesData(0).forEach(explicit::add);
        assertEquals(explicit.size(), defaults.size());
        for (int i = 0; i < explicit.size(); i++) {
            assertArrayEquals(explicit.get(i), defaults.get(i));
        }
    }

    @Test
    void slicingOneDimensionIsRejected() {
        assertThrows(HistogramValidationException.class, () -> tenBins().slices(0));
    }

    @Test
    void projectionsAndSums() {
        Histogram h = twoByThree();
        assertArrayEquals(new double[] {3, 12}, h.projection(0).getData());
        assertArrayEquals(new double[] {3, 5, 7}, h.projection(1).getData());
        assertEquals("col", h.projection(1).axis(0).getLabel());
        assertTrue(h.sumOverAxes().isIdentical(h));
        assertThrows(HistogramValidationException.class, () -> h.sumOverAxes(0, 1));
        assertThrows(HistogramValidationException.class, () -> h.sumOverAxes(1, 1));
        assertEquals(15, h.sum().value(), TOLERANCE);
        assertEquals(Math.sqrt(15), h.sum().uncert(), TOLERANCE);
    }

    @Test
    void integralWeighsByBinVolume() {
        Histogram h = new Histogram(new HistogramAxis(5, 0, 10));
        h.set(1);
        assertEquals(10, h.integral().value(), TOLERANCE);
        assertArrayEquals(new double[] {2, 2, 2, 2, 2}, h.binvolumes(), TOLERANCE);
    }

    @Test
    void occupancyCountsBinValues() {
        Histogram h = tenBins();
        h.fill(new double[] {1, 1, 1, 2, 2, 2, 3});
        Histogram occ = h.occupancy(4, -0.5, 3.5);
        assertArrayEquals(new double[] {7, 1, 0, 2}, occ.getData());
        Histogram auto = h.occupancy(3);
        assertEquals(10, auto.sum().value(), TOLERANCE);
        assertEquals(0, auto.axis(0).min(), TOLERANCE);
    }

    @Test
    void steplineGeometry() {
        Histogram h = tenBins();
        h.setData(new long[] {1, 2, 3, 4, 5, 0, 7, 8, 9, 10});

        StepLine all = h.asline();
        assertEquals(20, all.size());
        assertEquals(0, all.x()[0]);
        assertEquals(10, all.x()[19]);

        StepLine from2 = h.asline(2.0, null);
        assertEquals(2, from2.x()[0]);
        assertEquals(3, from2.x()[1]);
        assertEquals(3, from2.x()[2]);
        assertEquals(10, from2.x()[from2.size() - 1]);
        assertArrayEquals(from2.x(), h.asline(1.9, null).x());

        StepLine middle = h.asline(2.9, 7.0);
        assertArrayEquals(new double[] {3, 4, 4, 5, 5, 6}, middle.x(), TOLERANCE);
        assertArrayEquals(new double[] {4, 4, 5, 5, 0, 0}, middle.y(), TOLERANCE);
        assertArrayEquals(new double[] {3, 6, 0, 5}, middle.extent(), TOLERANCE);

        assertThrows(HistogramValidationException.class, () -> h.asline(5.5, 6.0));
        assertThrows(HistogramValidationException.class, () -> twoByThree().asline());
    }

    @Test
    void polygonClosesToBaseline() {
        Histogram h = threeBins(2, 3, 1);
        StepLine poly = h.aspolygon();
        assertEquals(8, poly.size());
        assertEquals(0, poly.y()[0]);
        assertEquals(0, poly.y()[7]);
        assertEquals(poly.x()[0], poly.x()[1]);
        assertArrayEquals(new double[] {0, 3, 0, 3}, poly.extent(), TOLERANCE);
        assertEquals(-1, h.aspolygon(-1.0, null, null).extent()[2], TOLERANCE);
    }

    @Test
    void meanIsDataWeighted() {
        Histogram h = tenBins();
        h.fill(new double[] {3, 3, 3});
        assertEquals(3.5, h.mean()[0], TOLERANCE);
        h.fill(new double[] {1, 5});
        assertEquals(3.5, h.mean()[0], TOLERANCE);

        Histogram two = tenBins();
        two.fill(new double[] {2.5, 4.5});
        assertEquals(1.0, two.var()[0], TOLERANCE);
        assertEquals(1.0, two.std()[0], TOLERANCE);
    }

    @Test
    void pointQueries() {
        Histogram h = tenBins();
        h.setData(new long[] {10, 11, 12, 13, 14, 15, 16, 17, 18, 19});
        assertEquals(15, h.valueAt(5));
        assertEquals(0, h.valueAt(50));
        assertEquals(-1, h.valueAtOrDefault(new double[] {-3}, -1));

        Histogram two = Histogram.builder().axis(2, 0, 2).data(new double[] {0, 10}).build();
        assertEquals(5, two.interpolate(1.0), TOLERANCE);
        assertEquals(0, two.interpolate(-3), TOLERANCE);
        assertEquals(10, two.interpolate(5), TOLERANCE);
    }

    @Test
    void bilinearInterpolation() {
        Histogram h = Histogram.builder().axis(2, 0, 2).axis(2, 0, 2)
            .data(new double[] {0, 1, 2, 3}).build();
        assertEquals(1.5, h.interpolate(1.0, 1.0), TOLERANCE);
        assertEquals(0, h.interpolate(0.5, 0.5), TOLERANCE);
        assertEquals(2, h.interpolate(1.5, 0.5), TOLERANCE);
    }

    @Test
    void smoothingPreservesConstantData() {
        Histogram h = twoByThree();
        h.set(4, 1);
        Histogram s = h.smooth(1.0);
        assertEquals(BinType.DOUBLE, s.getType());
        for (double v : s.getData()) {
            assertEquals(4, v, 1e-9);
        }
        for (double u : s.getUncert()) {
            assertThat(u).isLessThan(1.0).isPositive();
        }
        assertThrows(HistogramValidationException.class, () -> h.smooth(0));
    }

    @Test
    void errorbarsForOneDimension() {
        Histogram h = threeBins(4, 0, 9);
        ErrorBars bars = h.errorbars(false);
        assertArrayEquals(new double[] {0.5, 1.5, 2.5}, bars.x(), TOLERANCE);
        assertArrayEquals(new double[] {0.5, 0.5, 0.5}, bars.xerr(), TOLERANCE);
        assertArrayEquals(new double[] {2, 0, 3}, bars.yerr(), TOLERANCE);
        assertArrayEquals(new double[] {0.5, 0, 1.0 / 3}, h.errorbars(true).yerr(), TOLERANCE);
    }

    @Test
    void extentAndBounds() {
        Histogram h = threeBins(4, 0, 9);
        assertEquals(0, h.min());
        assertEquals(9, h.max());
        assertEquals(12, h.max(true), TOLERANCE);
        assertArrayEquals(new double[] {0, 3, 0, 9}, h.extent(), TOLERANCE);
        assertArrayEquals(new double[] {-0.3, 3.3}, h.extent(1, false, 0.1), TOLERANCE);
    }

    @Test
    void geometryQueries() {
        Histogram h = twoByThree();
        double[][] grid = h.grid();
        assertArrayEquals(new double[] {0.5, 0.5, 0.5, 1.5, 1.5, 1.5}, grid[0], TOLERANCE);
        assertArrayEquals(new double[] {0.5, 1.5, 2.5, 0.5, 1.5, 2.5}, grid[1], TOLERANCE);
        assertEquals(2, h.edges().size());
        assertArrayEquals(new double[] {3, 4}, h.overflow(), TOLERANCE);
        assertTrue(h.isUniform());
        assertEquals(1, h.binwidth(0, 1), TOLERANCE);
        assertArrayEquals(new double[] {1, 1, 1}, h.binwidths(1), TOLERANCE);
    }

    @Test
    void cloneIsIndependent() {
        Histogram h = twoByThree();
        Histogram copy = h.clone();
        assertTrue(copy.isIdentical(h));
        copy.setValue(100, 0, 0);
        assertEquals(0, h.getValue(0, 0));
        copy.setTitle("other");
        assertFalse(copy.isIdentical(h));
        assertEquals(BinType.DOUBLE, h.clone(BinType.DOUBLE).getType());
    }

    @Test
    void settersPromoteAndReset() {
        Histogram h = threeBins(1, 2, 3);
        h.setValue(0.5, 1);
        assertEquals(BinType.DOUBLE, h.getType());
        assertEquals(0.5, h.getValue(1), TOLERANCE);

        h.setValue(Double.NaN, 2);
        h.clearNans(7);
        assertEquals(7, h.getValue(2), TOLERANCE);

        h.reset();
        assertArrayEquals(new double[3], h.getData());
        assertThrows(IndexOutOfBoundsException.class, () -> h.getValue(3));
        assertThrows(HistogramValidationException.class, () -> h.getValue(0, 0));
    }

    @Test
    void toStringShowsShapeAndValues() {
        assertThat(twoByThree().toString())
            .contains("shape=[2, 3]")
            .contains("label=cells")
            .contains("[0.0, 1.0, 2.0, 3.0, 4.0, 5.0]");
    }
}
