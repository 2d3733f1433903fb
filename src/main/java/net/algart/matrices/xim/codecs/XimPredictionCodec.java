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

package net.algart.matrices.xim.codecs;

import net.algart.matrices.xim.XimException;
import net.algart.matrices.xim.XimIO;
import net.algart.matrices.xim.XimTools;
import net.algart.matrices.xim.data.XimPrediction;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Codec for the compressed pixel buffer of XIM images: first <code>width+1</code> pixels
 * as 32-bit integers, then variable-width diffs of the {@link XimPrediction row predictor},
 * whose widths are described by {@link XimLookupTable}.
 */
public class XimPredictionCodec {
    /**
     * Result of compression: the lookup table and the compressed pixel buffer.
     *
     * @param lookupTable lookup table.
     * @param buffer      compressed pixel buffer.
     */
    public record Encoded(XimLookupTable lookupTable, byte[] buffer) {
        public Encoded {
            Objects.requireNonNull(lookupTable, "Null lookup table");
            Objects.requireNonNull(buffer, "Null buffer");
        }
    }

    private XimPredictionCodec() {
    }

    /**
     * Decodes the compressed pixel buffer from the current stream position.
     * After this method, the stream is positioned after the last diff of the image,
     * before the padding diffs (see {@link #numberOfPaddingBytes(XimLookupTable, int, int)}).
     *
     * @param lookupTable lookup table of the image.
     * @param in          input stream.
     * @param width       image width.
     * @param height      image height.
     * @return pixels in row-major order.
     * @throws XimException if the lookup table is too short or contains invalid selectors.
     * @throws IOException  in the case of any I/O errors, in particular
     *                      {@link net.algart.matrices.xim.TruncatedXimException}.
     */
    public static int[] decode(XimLookupTable lookupTable, DataHandle<?> in, int width, int height)
            throws IOException {
        Objects.requireNonNull(lookupTable, "Null lookup table");
        Objects.requireNonNull(in, "Null input stream");
        XimTools.checkSizes(width, height);
        final int numberOfInitialValues = XimPrediction.numberOfInitialValues(width, height);
        final int numberOfDiffs = XimPrediction.numberOfDiffs(width, height);
        if (lookupTable.numberOfSelectors() < numberOfDiffs) {
            throw new XimException("Invalid XIM: lookup table (" + lookupTable.length() +
                    " bytes) is too short for " + numberOfDiffs + " diffs of " + width + "x" + height + " image");
        }
        final int[] pixels = new int[numberOfInitialValues + numberOfDiffs];
        final byte[] initial = XimTools.readBytes(in, 4 * numberOfInitialValues, "uncompressed first row");
        ByteBuffer.wrap(initial).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer().get(pixels, 0, numberOfInitialValues);
        final int[] diffs = XimDiffs.readDiffs(lookupTable.selectors(), numberOfDiffs, in);
        XimPrediction.unsubtractPrediction(pixels, diffs, width);
        return pixels;
    }

    /**
     * Encodes pixels into the lookup table and the compressed pixel buffer.
     *
     * <p>The lookup table always contains a multiple of 4 selectors, and the buffer contains one diff
     * per selector except the last one. So, the table has at least <code>numberOfDiffs+1</code>
     * selectors; the diffs beyond {@link XimPrediction#numberOfDiffs(int, int)} are zero padding
     * (1 byte each), which is not read by {@link #decode decode}.</p>
     *
     * @param pixels pixels in row-major order.
     * @param width  image width.
     * @param height image height.
     * @return lookup table and compressed buffer.
     * @throws IOException in the case of any I/O errors.
     */
    public static Encoded encode(int[] pixels, int width, int height) throws IOException {
        Objects.requireNonNull(pixels, "Null pixels");
        final int[] diffs = XimPrediction.subtractPrediction(pixels, width, height);
        final int numberOfSelectors = numberOfStoredSelectors(diffs.length);
        final int[] storedDiffs = Arrays.copyOf(diffs, numberOfSelectors - 1);
        final byte[] selectors = Arrays.copyOf(XimDiffs.selectors(storedDiffs), numberOfSelectors);
        final int numberOfInitialValues = XimPrediction.numberOfInitialValues(width, height);
        try (DataHandle<Location> buffer = XimIO.getBytesHandle(new BytesLocation(0))) {
            for (int k = 0; k < numberOfInitialValues; k++) {
                buffer.writeInt(pixels[k]);
            }
            XimDiffs.writeDiffs(storedDiffs, selectors, buffer);
            return new Encoded(XimLookupTable.ofSelectors(selectors), XimIO.readAllBytes(buffer));
        }
    }

    /**
     * Returns the number of bytes occupied by the padding diffs: the diffs, described by the lookup table
     * after the last diff of the image, excluding the last selector of the table.
     *
     * @param lookupTable lookup table of the image.
     * @param width       image width.
     * @param height      image height.
     * @return number of padding bytes after the diffs of the image.
     * @throws XimException if some of the padding selectors is invalid.
     */
    public static long numberOfPaddingBytes(XimLookupTable lookupTable, int width, int height)
            throws XimException {
        Objects.requireNonNull(lookupTable, "Null lookup table");
        final int numberOfDiffs = XimPrediction.numberOfDiffs(width, height);
        long result = 0;
        for (int k = numberOfDiffs; k < lookupTable.numberOfSelectors() - 1; k++) {
            result += XimLookupTable.bytesPerElement(lookupTable.selector(k));
        }
        return result;
    }

    // smallest multiple of 4, greater than numberOfDiffs
    static int numberOfStoredSelectors(int numberOfDiffs) {
        return Math.toIntExact(4 * ((numberOfDiffs + 4L) / 4));
    }
}
