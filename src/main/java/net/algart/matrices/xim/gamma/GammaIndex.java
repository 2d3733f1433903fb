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

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * 2D gamma index of evaluation distribution against reference one
 * (D. Low, 2004: "Evaluation of the gamma dose distribution comparison method", table I).
 *
 * <p>For every reference element with dose &ge; threshold, the evaluation distribution is searched
 * at all offsets <code>(dx,&nbsp;dy)</code> with
 * <code>dx<sup>2</sup>+dy<sup>2</sup>&nbsp;&lt;&nbsp;(DTA+1)<sup>2</sup></code> around the same position,
 * where DTA is {@link #getDistanceToAgreement() distance to agreement} in elements
 * (so, DTA=1 includes the diagonal neighbours, but DTA=3 excludes the offset (3,3));
 * the result is the minimal
 * <code>&Gamma;&nbsp;=&nbsp;sqrt(distance<sup>2</sup>/DTA<sup>2</sup>&nbsp;+&nbsp;dose<sup>2</sup>/doseTA<sup>2</sup>)</code>,
 * limited by {@link #getGammaCapValue() cap value}. Outside the evaluation matrix, its values are
 * replicated from the nearest edge. Sizes and spatial resolutions are not checked:
 * the matrices are compared element by element.</p>
 *
 * <p>Instances of this class are not thread-safe, but {@link #compute} does not change the object
 * and can be called from several threads when the settings are not modified.</p>
 *
 * @author Daniel Alievsky
 */
public class GammaIndex {
    public static final double DEFAULT_DOSE_TO_AGREEMENT = 1.0;
    public static final int DEFAULT_DISTANCE_TO_AGREEMENT = 1;
    public static final double DEFAULT_GAMMA_CAP_VALUE = 2.0;
    public static final double DEFAULT_DOSE_THRESHOLD = 5.0;

    private static final System.Logger LOG = System.getLogger(GammaIndex.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private double doseToAgreement = DEFAULT_DOSE_TO_AGREEMENT;
    private int distanceToAgreement = DEFAULT_DISTANCE_TO_AGREEMENT;
    private double gammaCapValue = DEFAULT_GAMMA_CAP_VALUE;
    private boolean globalDose = true;
    private double doseThreshold = DEFAULT_DOSE_THRESHOLD;
    private double fillValue = Double.NaN;
    private boolean multithreading = false;

    public GammaIndex() {
    }

    public double getDoseToAgreement() {
        return doseToAgreement;
    }

    /**
     * Sets the dose to agreement in percents: 1 means 1% of the global maximum of the reference
     * (or 1% of the reference element in the {@link #setGlobalDose(boolean) local} mode).
     *
     * @param doseToAgreement dose to agreement, %.
     * @return a reference to this object.
     * @throws IllegalArgumentException if the argument is not positive.
     */
    public GammaIndex setDoseToAgreement(double doseToAgreement) {
        if (!(doseToAgreement > 0.0)) {
            throw new IllegalArgumentException("Dose to agreement must be positive, but it is " + doseToAgreement);
        }
        this.doseToAgreement = doseToAgreement;
        return this;
    }

    public int getDistanceToAgreement() {
        return distanceToAgreement;
    }

    /**
     * Sets the distance to agreement in <b>elements</b>.
     *
     * @param distanceToAgreement distance to agreement.
     * @return a reference to this object.
     * @throws IllegalArgumentException if the argument is not positive.
     */
    public GammaIndex setDistanceToAgreement(int distanceToAgreement) {
        if (distanceToAgreement <= 0) {
            throw new IllegalArgumentException("Distance to agreement must be positive, but it is "
                    + distanceToAgreement);
        }
        this.distanceToAgreement = distanceToAgreement;
        return this;
    }

    public double getGammaCapValue() {
        return gammaCapValue;
    }

    public GammaIndex setGammaCapValue(double gammaCapValue) {
        if (Double.isNaN(gammaCapValue)) {
            throw new IllegalArgumentException("Gamma cap value must not be NaN");
        }
        this.gammaCapValue = gammaCapValue;
        return this;
    }

    public boolean isGlobalDose() {
        return globalDose;
    }

    public GammaIndex setGlobalDose(boolean globalDose) {
        this.globalDose = globalDose;
        return this;
    }

    public double getDoseThreshold() {
        return doseThreshold;
    }

    /**
     * Sets the dose threshold: percent of the global reference maximum, under which
     * gamma is not calculated. It does not depend on {@link #setGlobalDose(boolean) global/local} mode.
     *
     * @param doseThreshold threshold in range 0..100.
     * @return a reference to this object.
     * @throws IllegalArgumentException if the argument is out of 0..100 range.
     */
    public GammaIndex setDoseThreshold(double doseThreshold) {
        if (!(doseThreshold >= 0.0 && doseThreshold <= 100.0)) {
            throw new IllegalArgumentException("Dose threshold must be in range 0..100, but it is "
                    + doseThreshold);
        }
        this.doseThreshold = doseThreshold;
        return this;
    }

    public double getFillValue() {
        return fillValue;
    }

    /**
     * Sets the value of elements, which were not calculated because they are below the threshold.
     * Default NaN value excludes them from {@link GammaMap} statistics.
     *
     * @param fillValue new fill value.
     * @return a reference to this object.
     */
    public GammaIndex setFillValue(double fillValue) {
        this.fillValue = fillValue;
        return this;
    }

    public boolean isMultithreading() {
        return multithreading;
    }

    public GammaIndex setMultithreading(boolean multithreading) {
        this.multithreading = multithreading;
        return this;
    }

    public GammaMap compute(Matrix<? extends PArray> reference, Matrix<? extends PArray> evaluation) {
        Objects.requireNonNull(reference, "Null reference");
        Objects.requireNonNull(evaluation, "Null evaluation");
        if (reference.dimCount() != 2 || evaluation.dimCount() != 2) {
            throw new IllegalDimensionalityException("Reference and evaluation matrices must be 2-dimensional, " +
                    "but reference is " + reference.dimCount() + "-dimensional and evaluation is " +
                    evaluation.dimCount() + "-dimensional",
                    reference.dimCount() != 2 ? reference.dimCount() : evaluation.dimCount());
        }
        if (!reference.dimEquals(evaluation)) {
            throw new IllegalArgumentException("Reference and evaluation matrices have different sizes: "
                    + reference + " and " + evaluation);
        }
        final long dimX = reference.dim(0);
        final long dimY = reference.dim(1);
        if (dimX * dimY > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large matrices for gamma: " + reference);
        }
        return compute(toDoubles(reference.array()), toDoubles(evaluation.array()), (int) dimX, (int) dimY);
    }

    /**
     * Computes gamma for two distributions, stored in row-major order.
     *
     * @param reference  reference distribution.
     * @param evaluation evaluation distribution.
     * @param dimX       number of columns.
     * @param dimY       number of rows.
     * @return gamma map with the same sizes.
     */
    public GammaMap compute(double[] reference, double[] evaluation, int dimX, int dimY) {
        Objects.requireNonNull(reference, "Null reference");
        Objects.requireNonNull(evaluation, "Null evaluation");
        if (dimX < 0 || dimY < 0) {
            throw new IllegalArgumentException("Negative dimX = " + dimX + " or dimY = " + dimY);
        }
        if ((long) dimX * (long) dimY != reference.length || evaluation.length != reference.length) {
            throw new IllegalArgumentException("Lengths of reference (" + reference.length +
                    ") and evaluation (" + evaluation.length + ") must be equal to " + dimX + "*" + dimY);
        }
        final long t1 = System.nanoTime();
        final double max = maxWithNaN(reference);
        final double threshold = max / 100.0 * doseThreshold;
        final double globalDoseTA = doseToAgreement / 100.0 * max;
        final Disk disk = new Disk(distanceToAgreement);
        final double[] result = new double[reference.length];
        final IntStream rows = IntStream.range(0, dimY);
        (multithreading ? rows.parallel() : rows).forEach(y -> {
            for (int x = 0, disp = y * dimX; x < dimX; x++, disp++) {
                final double ref = reference[disp];
                if (ref < threshold) {
                    result[disp] = fillValue;
                    continue;
                }
                // - note: NaN threshold fails this check, so all elements are searched and give NaN
                final double doseTA = globalDose ? globalDoseTA : doseToAgreement / 100.0 * ref;
                result[disp] = Math.min(disk.minGamma(evaluation, dimX, dimY, x, y, ref, doseTA), gammaCapValue);
            }
        });
        final long t2 = System.nanoTime();
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> "Gamma %dx%d, %s%%/%d elements, %s, threshold %s%%: %.3f ms"
                    .formatted(dimX, dimY, doseToAgreement, distanceToAgreement,
                            globalDose ? "global" : "local", doseThreshold, (t2 - t1) * 1e-6));
        }
        return new GammaMap(result, dimX, dimY);
    }

    @Override
    public String toString() {
        return "gamma index " + doseToAgreement + "%/" + distanceToAgreement + " elements, " +
                (globalDose ? "global" : "local") + " dose, threshold " + doseThreshold + "%, cap " +
                gammaCapValue + ", fill value " + fillValue;
    }

    private static double[] toDoubles(PArray array) {
        final double[] result = new double[(int) array.length()];
        for (int k = 0; k < result.length; k++) {
            result[k] = array.getDouble(k);
        }
        return result;
    }

    // Like numpy max: NaN if there is at least one NaN, -infinity for empty array.
    private static double maxWithNaN(double[] values) {
        double result = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isNaN(v)) {
                return Double.NaN;
            }
            if (v > result) {
                result = v;
            }
        }
        return result;
    }

    /**
     * Offsets (dx, dy) with <code>dx<sup>2</sup>+dy<sup>2</sup> &lt; (DTA+1)<sup>2</sup></code>.
     */
    private static final class Disk {
        private final int[] dx;
        private final int[] dy;
        private final double[] normalizedDistanceSqr;

        Disk(int distanceToAgreement) {
            final int r = distanceToAgreement;
            final long limit = (long) (r + 1) * (long) (r + 1);
            int count = 0;
            for (int j = -r; j <= r; j++) {
                for (int i = -r; i <= r; i++) {
                    if ((long) i * i + (long) j * j < limit) {
                        count++;
                    }
                }
            }
            this.dx = new int[count];
            this.dy = new int[count];
            this.normalizedDistanceSqr = new double[count];
            final double dtaSqr = (double) r * (double) r;
            int k = 0;
            for (int j = -r; j <= r; j++) {
                for (int i = -r; i <= r; i++) {
                    final long distanceSqr = (long) i * i + (long) j * j;
                    if (distanceSqr < limit) {
                        dx[k] = i;
                        dy[k] = j;
                        normalizedDistanceSqr[k] = (double) distanceSqr / dtaSqr;
                        k++;
                    }
                }
            }
        }

        // NaN only if all candidates are NaN (like numpy nanmin)
        double minGamma(double[] evaluation, int dimX, int dimY, int x, int y, double ref, double doseTA) {
            double result = Double.NaN;
            final double doseTASqr = doseTA * doseTA;
            for (int k = 0; k < dx.length; k++) {
                final int ex = clamp(x + dx[k], dimX);
                final int ey = clamp(y + dy[k], dimY);
                final double dose = evaluation[ey * dimX + ex] - ref;
                final double gamma = Math.sqrt(normalizedDistanceSqr[k] + dose * dose / doseTASqr);
                if (!Double.isNaN(gamma) && !(gamma >= result)) {
                    result = gamma;
                }
            }
            return result;
        }

        private static int clamp(int index, int dim) {
            return index < 0 ? 0 : Math.min(index, dim - 1);
        }
    }
}
