/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2024 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.xim.gamma;

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.SimpleMemoryModel;
import net.algart.arrays.UpdatablePArray;

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of {@link GammaIndex}: 2D grid of gamma values with the sizes of the reference.
 *
 * <p>All statistics ignore NaN elements (normally, the elements under the dose threshold)
 * and return NaN if there are no other elements.</p>
 */
public final class GammaMap {
    public static final double DEFAULT_PASS_LIMIT = 1.0;

    private final double[] values;
    private final int dimX;
    private final int dimY;

    GammaMap(double[] values, int dimX, int dimY) {
        this.values = Objects.requireNonNull(values, "Null values");
        assert (long) dimX * (long) dimY == values.length;
        this.dimX = dimX;
        this.dimY = dimY;
    }

    public int dimX() {
        return dimX;
    }

    public int dimY() {
        return dimY;
    }

    public double get(int x, int y) {
        if (x < 0 || x >= dimX || y < 0 || y >= dimY) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") is out of " + dimX + "x" + dimY);
        }
        return values[y * dimX + x];
    }

    /**
     * Returns a copy of the gamma values in row-major order.
     *
     * @return Java array of gamma values.
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Returns a view of the gamma values as 2-dimensional AlgART matrix of <code>double</code> elements.
     * Changes in the matrix are reflected in this object.
     *
     * @return gamma matrix.
     */
    public Matrix<UpdatablePArray> matrix() {
        return Matrices.matrix(SimpleMemoryModel.asUpdatableDoubleArray(values), dimX, dimY);
    }

    public int numberOfEvaluated() {
        int result = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                result++;
            }
        }
        return result;
    }

    public double mean() {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Returns the median of evaluated elements; for even count, it is the average of two middle values.
     *
     * @return median gamma.
     */
    public double median() {
        final double[] evaluated = evaluated();
        final int n = evaluated.length;
        if (n == 0) {
            return Double.NaN;
        }
        Arrays.sort(evaluated);
        return n % 2 == 1 ? evaluated[n / 2] : 0.5 * (evaluated[n / 2 - 1] + evaluated[n / 2]);
    }

    public double min() {
        double result = Double.NaN;
        for (double v : values) {
            if (!(v >= result) && !Double.isNaN(v)) {
                result = v;
            }
        }
        return result;
    }

    public double max() {
        double result = Double.NaN;
        for (double v : values) {
            if (!(v <= result) && !Double.isNaN(v)) {
                result = v;
            }
        }
        return result;
    }

    public double passRate() {
        return passRate(DEFAULT_PASS_LIMIT);
    }

    /**
     * Returns the percentage (0..100) of evaluated elements with gamma &le; <code>limit</code>.
     *
     * @param limit maximal passing gamma.
     * @return pass rate in percents.
     */
    public double passRate(double limit) {
        int passed = 0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                count++;
                if (v <= limit) {
                    passed++;
                }
            }
        }
        return count == 0 ? Double.NaN : 100.0 * passed / count;
    }

    @Override
    public String toString() {
        return "gamma map %dx%d, %d evaluated elements".formatted(dimX, dimY, numberOfEvaluated());
    }

    private double[] evaluated() {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }
}
