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

package net.algart.matrices.xim;

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.SimpleMemoryModel;
import net.algart.arrays.UpdatablePArray;

import java.util.Objects;

/**
 * Content of XIM file: header fields, pixels (if they were decoded), histogram and properties.
 *
 * <p>Pixels are stored as <code>int[]</code> array in row-major order (x changes fastest).
 * The array returned by {@link #pixels()} is not cloned: it can be modified in place.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class XimImage {
    public static final int DEFAULT_BITS_PER_PIXEL = 16;
    public static final int DEFAULT_BYTES_PER_PIXEL = 2;

    private final int width;
    private final int height;
    private int formatVersion = XimIO.DEFAULT_FORMAT_VERSION;
    private int bitsPerPixel = DEFAULT_BITS_PER_PIXEL;
    private int bytesPerPixel = DEFAULT_BYTES_PER_PIXEL;
    private boolean compressed = true;
    private int[] pixels = null;
    private int[] histogram = new int[0];
    private XimProperties properties = new XimProperties();

    /**
     * Creates new image without pixels.
     *
     * @param width  image width.
     * @param height image height.
     * @throws IllegalArgumentException if the sizes are negative or their product &ge;2<sup>31</sup>.
     */
    public XimImage(int width, int height) {
        numberOfPixels(width, height);
        this.width = width;
        this.height = height;
    }

    public static XimImage of(int[] pixels, int width, int height) {
        return new XimImage(width, height).setPixels(pixels);
    }

    /**
     * Creates new image with pixels, copied from the given 2-dimensional AlgART matrix.
     * Elements are converted to <code>int</code> by usual Java cast from <code>double</code>.
     *
     * @param matrix 2-dimensional matrix.
     * @return new image.
     */
    public static XimImage of(Matrix<? extends PArray> matrix) {
        Objects.requireNonNull(matrix, "Null matrix");
        if (matrix.dimCount() != 2) {
            throw new IllegalArgumentException("XIM image can be created only from 2-dimensional matrix, " +
                    "but it is " + matrix.dimCount() + "-dimensional: " + matrix);
        }
        final long dimX = matrix.dim(0);
        final long dimY = matrix.dim(1);
        if (dimX > Integer.MAX_VALUE || dimY > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large matrix for XIM: " + matrix);
        }
        final XimImage result = new XimImage((int) dimX, (int) dimY);
        final PArray array = matrix.array();
        final int[] pixels = new int[result.numberOfPixels()];
        for (int k = 0; k < pixels.length; k++) {
            pixels[k] = (int) array.getDouble(k);
        }
        return result.setPixels(pixels);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int numberOfPixels() {
        return width * height;
    }

    public int formatVersion() {
        return formatVersion;
    }

    public XimImage setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
        return this;
    }

    public int bitsPerPixel() {
        return bitsPerPixel;
    }

    public XimImage setBitsPerPixel(int bitsPerPixel) {
        if (bitsPerPixel < 0) {
            throw new IllegalArgumentException("Negative bitsPerPixel = " + bitsPerPixel);
        }
        this.bitsPerPixel = bitsPerPixel;
        return this;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public XimImage setBytesPerPixel(int bytesPerPixel) {
        if (bytesPerPixel < 0) {
            throw new IllegalArgumentException("Negative bytesPerPixel = " + bytesPerPixel);
        }
        this.bytesPerPixel = bytesPerPixel;
        return this;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public XimImage setCompressed(boolean compressed) {
        this.compressed = compressed;
        return this;
    }

    public boolean hasPixels() {
        return pixels != null;
    }

    /**
     * Returns the pixels.
     *
     * @return pixel array (not a copy).
     * @throws IllegalStateException if pixels were not read, for example,
     *                               when the file was read by {@link XimReader#read(boolean) read(false)}.
     */
    public int[] pixels() {
        if (pixels == null) {
            throw new IllegalStateException("Pixels of " + this + " were not read");
        }
        return pixels;
    }

    public int pixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is out of " + width + "x" + height);
        }
        return pixels()[y * width + x];
    }

    public XimImage setPixels(int[] pixels) {
        Objects.requireNonNull(pixels, "Null pixels");
        if (pixels.length != numberOfPixels()) {
            throw new IllegalArgumentException("Number of pixels " + pixels.length +
                    " does not match image sizes " + width + "x" + height);
        }
        this.pixels = pixels;
        return this;
    }

    public XimImage removePixels() {
        this.pixels = null;
        return this;
    }

    /**
     * Returns a view of the pixels as 2-dimensional AlgART matrix <code>int</code> elements,
     * <code>dimX=width</code>, <code>dimY=height</code>. Changes in the matrix are reflected in this image.
     *
     * @return matrix view of the pixels.
     * @throws IllegalStateException if pixels were not read.
     */
    public Matrix<UpdatablePArray> asMatrix() {
        final UpdatablePArray array = SimpleMemoryModel.asUpdatableIntArray(pixels());
        return Matrices.matrix(array, width, height);
    }

    public int[] histogram() {
        return histogram.clone();
    }

    public XimImage setHistogram(int[] histogram) {
        Objects.requireNonNull(histogram, "Null histogram");
        this.histogram = histogram.clone();
        return this;
    }

    public XimProperties properties() {
        return properties;
    }

    public XimImage setProperties(XimProperties properties) {
        this.properties = Objects.requireNonNull(properties, "Null properties");
        return this;
    }

    @Override
    public String toString() {
        return "XIM image %dx%d, version %d, %d bits/%d bytes per pixel, %s, %s, %d histogram bins, %d properties"
                .formatted(width, height, formatVersion, bitsPerPixel, bytesPerPixel,
                        compressed ? "compressed" : "uncompressed",
                        pixels != null ? "pixels loaded" : "no pixels",
                        histogram.length, properties.size());
    }

    static int numberOfPixels(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or height = " + height);
        }
        final long result = (long) width * (long) height;
        if (result > XimTools.MAX_BLOCK_LENGTH) {
            throw new IllegalArgumentException("Too large image " + width + "x" + height +
                    ": number of pixels >= 2^31 is not supported");
        }
        return (int) result;
    }
}
