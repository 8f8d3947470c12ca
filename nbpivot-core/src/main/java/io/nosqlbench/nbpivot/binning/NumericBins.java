package io.nosqlbench.nbpivot.binning;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * The ordered bins of one numeric group-by column, computed once per load from the column's
 * observed values.
 *
 * <h2>Strategy</h2>
 *
 * <ul>
 *   <li><b>no values</b> - no bins</li>
 *   <li><b>zero width</b> (a single distinct value) - one bin {@code (min, max)}</li>
 *   <li><b>degenerate</b> - one point bin per distinct value, when an integral column has
 *       fewer whole numbers in its range than requested bins, or when bins would be exactly
 *       1 wide</li>
 *   <li><b>equal width</b> - {@code binCount} bins of width {@code (max - min) / binCount}</li>
 * </ul>
 *
 * <pre>{@code
 * NumericBins bins = NumericBins.compute(values, 5, false);
 * int index = bins.locate(7.5);
 * }</pre>
 */
public final class NumericBins {

    private static final NumericBins EMPTY = new NumericBins(List.of(), 0.0d, 0.0d, 0.0d, false, new double[0]);

    private final List<Bin> bins;
    private final double min;
    private final double max;
    private final double width;
    private final boolean degenerate;
    private final double[] points;

    private NumericBins(List<Bin> bins, double min, double max, double width, boolean degenerate, double[] points) {
        this.bins = bins;
        this.min = min;
        this.max = max;
        this.width = width;
        this.degenerate = degenerate;
        this.points = points;
    }

    /**
     * @param values        the observed numeric values, in any order, may be empty
     * @param requestedBins the number of bins to aim for, at least 1
     * @param integral      whether the column only holds whole numbers
     * @return the bins covering {@code [min(values), max(values)]}
     */
    public static NumericBins compute(List<Double> values, int requestedBins, boolean integral) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        if (requestedBins < 1) {
            throw new IllegalArgumentException("bin count must be at least 1, got " + requestedBins);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        double width = (max - min) / requestedBins;

        if (width == 0.0d) {
            return new NumericBins(List.of(new Bin(min, max)), min, max, 0.0d, false, new double[0]);
        }

        if ((integral && requestedBins > (max - min)) || width == 1.0d) {
            TreeSet<Double> distinct = new TreeSet<>(values);
            List<Bin> pointBins = new ArrayList<>(distinct.size());
            double[] points = new double[distinct.size()];
            int i = 0;
            for (double v : distinct) {
                pointBins.add(new Bin(v, v));
                points[i++] = v;
            }
            return new NumericBins(Collections.unmodifiableList(pointBins), min, max, width, true, points);
        }

        List<Bin> equalBins = new ArrayList<>(requestedBins);
        for (int i = 0; i < requestedBins; i++) {
            equalBins.add(new Bin(min + width * i, min + width * (i + 1)));
        }
        return new NumericBins(Collections.unmodifiableList(equalBins), min, max, width, false, new double[0]);
    }

    /**
     * Finds the bin for a value of the same column.
     *
     * <p>Equal-width lookup floors {@code (value - min) / width} and clamps the result, so the
     * maximum lands in the last bin and a value on an inner edge lands in the bin above it.
     *
     * @param value a value of the binned column
     * @return the index of the value's bin
     * @throws BinLookupException if there are no bins, the value is not finite, or a degenerate
     *                            binning has no point bin for the value
     */
    public int locate(double value) {
        if (bins.isEmpty()) {
            throw new BinLookupException(value, "no bins to place " + value + " in");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new BinLookupException(value, "cannot bin non-finite value " + value);
        }
        if (width == 0.0d) {
            return 0;
        }
        if (degenerate) {
            int index = Arrays.binarySearch(points, value);
            if (index < 0) {
                throw new BinLookupException(value, "value " + value + " has no bin among " + points.length + " point bins");
            }
            return index;
        }
        int index = (int) Math.floor((value - min) / width);
        return Math.max(0, Math.min(index, bins.size() - 1));
    }

    public List<Bin> bins() {
        return bins;
    }

    public Bin bin(int index) {
        return bins.get(index);
    }

    public int binCount() {
        return bins.size();
    }

    public boolean isEmpty() {
        return bins.isEmpty();
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * @return the equal-width bin width, 0 when all values are equal
     */
    public double width() {
        return width;
    }

    @Override
    public String toString() {
        return "NumericBins{" + bins.size() + " bins over [" + min + ", " + max + "]"
            + (degenerate ? ", degenerate" : "") + "}";
    }
}
