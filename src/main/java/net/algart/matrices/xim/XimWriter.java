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

import net.algart.matrices.xim.codecs.XimPredictionCodec;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes {@link XimImage} into a stream in XIM format, compressed or uncompressed.
 *
 * <p>Compressed pixels use the lookup-table/row-predictor scheme; uncompressed pixels are stored
 * as little-endian integers of {@link XimImage#bytesPerPixel()} width.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @author Daniel Alievsky
 */
public non-sealed class XimWriter extends XimIO {
    private static final System.Logger LOG = System.getLogger(XimWriter.class.getName());

    private Boolean compressed = null;
    private boolean writeZeroPixelsIfAbsent = false;

    /**
     * Creates new writer to the given file. If the file exists, it is deleted.
     *
     * @param file output file.
     * @throws IOException if the existing file cannot be deleted.
     */
    public XimWriter(Path file) throws IOException {
        this(deleteAndCreateHandle(file));
    }

    public XimWriter(DataHandle<? extends Location> outputStream) {
        super(outputStream);
    }

    public static void writeImage(Path file, XimImage image) throws IOException {
        try (XimWriter writer = new XimWriter(file)) {
            writer.write(image);
        }
    }

    /**
     * Returns the full XIM content of the given image.
     *
     * @param image      image with pixels.
     * @param compressed whether the pixels should be compressed.
     * @return XIM bytes.
     * @throws IOException if the image cannot be written, for example, if its pixels
     *                     do not fit into <code>bytesPerPixel</code>.
     */
    public static byte[] toBytes(XimImage image, boolean compressed) throws IOException {
        try (XimWriter writer = new XimWriter(getBytesHandle(new BytesLocation(0)))) {
            writer.setCompressed(compressed).write(image);
            return readAllBytes(writer.stream());
        }
    }

    /**
     * Returns the compression mode: <code>null</code> means that the mode is taken from
     * {@link XimImage#isCompressed()} of every written image.
     *
     * @return compression mode.
     */
    public Boolean getCompressed() {
        return compressed;
    }

    public XimWriter setCompressed(Boolean compressed) {
        this.compressed = compressed;
        return this;
    }

    public boolean isWriteZeroPixelsIfAbsent() {
        return writeZeroPixelsIfAbsent;
    }

    /**
     * Sets the behaviour for images without pixels (read in metadata-only mode).
     * If <code>true</code>, such images are written with zero pixels;
     * if <code>false</code> (default), {@link #write(XimImage)} throws <code>IllegalArgumentException</code>.
     *
     * @param writeZeroPixelsIfAbsent whether zero pixels should be written for images without pixels.
     * @return a reference to this object.
     */
    public XimWriter setWriteZeroPixelsIfAbsent(boolean writeZeroPixelsIfAbsent) {
        this.writeZeroPixelsIfAbsent = writeZeroPixelsIfAbsent;
        return this;
    }

    public void write(XimImage image) throws IOException {
        Objects.requireNonNull(image, "Null image");
        final int[] pixels;
        if (image.hasPixels()) {
            pixels = image.pixels();
        } else if (writeZeroPixelsIfAbsent) {
            pixels = new int[image.numberOfPixels()];
        } else {
            throw new IllegalArgumentException("Cannot write " + image + ": it has no pixels");
        }
        final boolean compressed = this.compressed != null ? this.compressed : image.isCompressed();
        final long t1 = debugTime();
        stream.write(formatIdentifierBytes());
        stream.writeInt(image.formatVersion());
        stream.writeInt(image.width());
        stream.writeInt(image.height());
        stream.writeInt(image.bitsPerPixel());
        stream.writeInt(image.bytesPerPixel());
        stream.writeInt(compressed ? 1 : 0);
        final long t2 = debugTime();
        if (compressed) {
            final XimPredictionCodec.Encoded encoded = XimPredictionCodec.encode(
                    pixels, image.width(), image.height());
            final byte[] lookupTable = encoded.lookupTable().bytes();
            stream.writeInt(lookupTable.length);
            stream.write(lookupTable);
            stream.writeInt(encoded.buffer().length);
            stream.write(encoded.buffer());
            stream.writeInt(uncompressedBufferSize(image));
        } else {
            final byte[] buffer = encodeUncompressed(pixels, image.bytesPerPixel());
            stream.writeInt(buffer.length);
            stream.write(buffer);
        }
        final long t3 = debugTime();
        final int[] histogram = image.histogram();
        stream.writeInt(histogram.length);
        final ByteBuffer bb = ByteBuffer.allocate(4 * histogram.length).order(ByteOrder.LITTLE_ENDIAN);
        bb.asIntBuffer().put(histogram);
        stream.write(bb.array());
        image.properties().write(stream);
        final long t4 = debugTime();
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> "Written %s %s%s%s".formatted(
                    compressed ? "compressed" : "uncompressed",
                    image, prettyFileName(" to %s", stream),
                    BUILT_IN_TIMING ? ": %.3f ms (%.3f header + %.3f pixels + %.3f histogram/properties)"
                            .formatted((t4 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6, (t4 - t3) * 1e-6)
                            : ""));
        }
    }

    @Override
    public String toString() {
        return "XIM writer" + prettyFileName(" to %s", stream);
    }

    /**
     * Encodes pixels into uncompressed buffer: little-endian integers of <code>bytesPerPixel</code> width.
     *
     * @param pixels        pixels.
     * @param bytesPerPixel 1, 2 or 4.
     * @return uncompressed buffer.
     * @throws XimException if <code>bytesPerPixel</code> is not supported
     *                      or some pixel does not fit into the unsigned range of 1 or 2 bytes.
     */
    public static byte[] encodeUncompressed(int[] pixels, int bytesPerPixel) throws XimException {
        Objects.requireNonNull(pixels, "Null pixels");
        if (bytesPerPixel != 1 && bytesPerPixel != 2 && bytesPerPixel != 4) {
            throw new XimException("Cannot write uncompressed XIM with " + bytesPerPixel +
                    " bytes per pixel (only 1, 2 or 4 are allowed)");
        }
        if ((long) pixels.length * bytesPerPixel > XimTools.MAX_BLOCK_LENGTH) {
            throw new XimException("Too large uncompressed pixel buffer: " + pixels.length + " pixels");
        }
        final ByteBuffer bb = ByteBuffer.allocate(pixels.length * bytesPerPixel).order(ByteOrder.LITTLE_ENDIAN);
        if (bytesPerPixel == 4) {
            bb.asIntBuffer().put(pixels);
            return bb.array();
        }
        final int max = bytesPerPixel == 1 ? 0xFF : 0xFFFF;
        for (int k = 0; k < pixels.length; k++) {
            final int v = pixels[k];
            if (v < 0 || v > max) {
                throw new XimException("Pixel #" + k + " = " + v + " does not fit into " +
                        bytesPerPixel + " unsigned byte(s) of uncompressed XIM");
            }
            if (bytesPerPixel == 1) {
                bb.put((byte) v);
            } else {
                bb.putShort((short) v);
            }
        }
        return bb.array();
    }

    private static int uncompressedBufferSize(XimImage image) {
        final long result = (long) image.numberOfPixels() * image.bytesPerPixel();
        return (int) Math.min(result, Integer.MAX_VALUE);
    }

    private static DataHandle<Location> deleteAndCreateHandle(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Files.deleteIfExists(file);
        return getFileHandle(file);
    }
}
