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

package net.algart.matrices.xim.data;

import java.util.Objects;

/**
 * Two-dimensional prediction, used by compressed XIM images.
 *
 * <p>The first row and the first element of the second row are stored as-is.
 * Every following pixel is predicted from its left, upper and upper-left neighbours,
 * and only the residual ("diff") is stored:</p>
 * <pre>
 *     pixel[i] = diff[i - (width + 1)] + pixel[i - 1] + pixel[i - width] - pixel[i - width - 1]
 * </pre>
 *
 * <p>Note that the prediction is applied to the linear row-major index: the "left" neighbour
 * of the first pixel in a row is the last pixel of the previous row.
 * All neighbours always have smaller indexes, so one linear pass is enough.
 * Arithmetic is 32-bit, with usual Java overflow, so the transformation is lossless for any data.</p>
 */
public class XimPrediction {
    private XimPrediction() {
    }

    /**
     * Returns the number of values, stored without prediction: <code>width+1</code>,
     * or less for degenerated images with one row or less.
     *
     * @param width  image width.
     * @param height image height.
     * @return number of raw values at the beginning of the image.
     */
    public static int numberOfInitialValues(int width, int height) {
        final long numberOfPixels = numberOfPixels(width, height);
        return (int) Math.min(width + 1L, numberOfPixels);
    }

    public static int numberOfDiffs(int width, int height) {
        final long numberOfPixels = numberOfPixels(width, height);
        return (int) Math.max(0, numberOfPixels - (width + 1L));
    }

    /**
     * Reconstructs all pixels of the image.
     *
     * @param initialValues first {@link #numberOfInitialValues(int, int)} pixels.
     * @param diffs         {@link #numberOfDiffs(int, int)} residuals.
     * @param width         image width.
     * @param height        image height.
     * @return all <code>width*height</code> pixels in row-major order.
     */
    public static int[] unsubtractPrediction(int[] initialValues, int[] diffs, int width, int height) {
        Objects.requireNonNull(initialValues, "Null initial values");
        Objects.requireNonNull(diffs, "Null diffs");
        final int numberOfInitialValues = numberOfInitialValues(width, height);
        final int numberOfDiffs = numberOfDiffs(width, height);
        if (initialValues.length != numberOfInitialValues) {
            throw new IllegalArgumentException("Number of initial values " + initialValues.length +
                    " does not match " + width + "x" + height + " image (" + numberOfInitialValues + " required)");
        }
        if (diffs.length != numberOfDiffs) {
            throw new IllegalArgumentException("Number of diffs " + diffs.length +
                    " does not match " + width + "x" + height + " image (" + numberOfDiffs + " required)");
        }
        final int[] result = new int[numberOfInitialValues + numberOfDiffs];
        System.arraycopy(initialValues, 0, result, 0, numberOfInitialValues);
        unsubtractPrediction(result, diffs, width);
        return result;
    }

    /**
     * Reconstructs pixels in-place: <code>pixels</code> must contain initial values at
     * the positions <code>0..width</code>, other elements are filled by this method.
     *
     * @param pixels all pixels.
     * @param diffs  residuals; <code>diffs.length</code> must be <code>pixels.length-(width+1)</code>.
     * @param width  image width.
     */
    public static void unsubtractPrediction(int[] pixels, int[] diffs, int width) {
        Objects.requireNonNull(pixels, "Null pixels");
        Objects.requireNonNull(diffs, "Null diffs");
        final int start = width + 1;
        // - cannot overflow: width < pixels.length (when there are diffs) and it is checked below
        if (diffs.length > 0 && (long) start + (long) diffs.length != pixels.length) {
            throw new IllegalArgumentException("Number of diffs " + diffs.length + " does not match " +
                    pixels.length + " pixels with width " + width);
        }
        for (int i = start, k = 0; k < diffs.length; i++, k++) {
            pixels[i] = diffs[k] + pixels[i - 1] + pixels[i - width] - pixels[i - start];
        }
    }

    /**
     * Inverse operation to {@link #unsubtractPrediction(int[], int[], int, int)}:
     * returns the residuals for all pixels after the first <code>width+1</code>.
     *
     * @param pixels all pixels in row-major order.
     * @param width  image width.
     * @param height image height.
     * @return diffs.
     */
    public static int[] subtractPrediction(int[] pixels, int width, int height) {
        Objects.requireNonNull(pixels, "Null pixels");
        if (numberOfPixels(width, height) != pixels.length) {
            throw new IllegalArgumentException("Number of pixels " + pixels.length +
                    " does not match " + width + "x" + height + " image");
        }
        final int start = width + 1;
        final int[] result = new int[numberOfDiffs(width, height)];
        for (int i = start, k = 0; k < result.length; i++, k++) {
            result[k] = pixels[i] - pixels[i - 1] - pixels[i - width] + pixels[i - start];
        }
        return result;
    }

    private static long numberOfPixels(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative image sizes " + width + "x" + height);
        }
        return (long) width * (long) height;
    }
}
