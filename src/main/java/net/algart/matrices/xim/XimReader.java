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

import net.algart.matrices.xim.codecs.XimLookupTable;
import net.algart.matrices.xim.codecs.XimPredictionCodec;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.ReadBufferDataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a Varian XIM file in a single forward pass.
 *
 * <p>Typical usage:</p>
 * <pre>
 * try (XimReader reader = new XimReader(file)) {
 *     XimImage image = reader.read();
 *     ...
 * }
 * </pre>
 *
 * <p>Every reader can read only one image: it does not seek back to the beginning of the stream.
 * When pixels are not necessary (scanning metadata of many files),
 * use {@link #read(boolean) read(false)}: the compressed buffer is skipped without decoding.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @author Daniel Alievsky
 */
public non-sealed class XimReader extends XimIO {
    private static final System.Logger LOG = System.getLogger(XimReader.class.getName());

    private final boolean closeStreamAfterReading;
    private boolean used = false;
    private long uncompressedBufferSize = -1;

    /**
     * Creates new reader of the given file. The file is closed automatically
     * by {@link #close()}.
     *
     * @param file existing XIM file.
     * @throws IOException if the file does not exist or is not a regular file.
     */
    public XimReader(Path file) throws IOException {
        this(getExistingFileHandle(file), true);
    }

    /**
     * Creates new reader of the given stream.
     *
     * @param inputStream input stream; automatically replaced (wrapped) with {@link ReadBufferDataHandle},
     *                    if this stream is still not an instance of this class.
     */
    public XimReader(DataHandle<Location> inputStream) {
        this(inputStream, false);
    }

    private XimReader(DataHandle<Location> inputStream, boolean closeStreamAfterReading) {
        super(inputStream instanceof ReadBufferDataHandle ?
                inputStream :
                new ReadBufferDataHandle<>(Objects.requireNonNull(inputStream, "Null in stream")));
        this.closeStreamAfterReading = closeStreamAfterReading;
    }

    public static XimImage readImage(Path file) throws IOException {
        return readImage(file, true);
    }

    public static XimImage readImage(Path file, boolean decodePixels) throws IOException {
        try (XimReader reader = new XimReader(file)) {
            return reader.read(decodePixels);
        }
    }

    public boolean isCloseStreamAfterReading() {
        return closeStreamAfterReading;
    }

    /**
     * Returns the value of "uncompressed buffer size" field, stored after the compressed pixels,
     * or -1 if the image was not read yet or is not compressed.
     * This value is informational and is not used while decoding.
     *
     * @return size of uncompressed pixels, declared in the file.
     */
    public long uncompressedBufferSize() {
        return uncompressedBufferSize;
    }

    public XimImage read() throws IOException {
        return read(true);
    }

    /**
     * Reads the whole XIM structure: header, pixels, histogram and properties.
     *
     * @param decodePixels whether the pixels should be decoded; if <code>false</code>, the pixel buffer
     *                     is skipped and {@link XimImage#hasPixels()} of the result will be <code>false</code>.
     * @return the read image.
     * @throws XimException          if the stream is not a valid XIM.
     * @throws TruncatedXimException if the stream ends before the end of XIM structure.
     * @throws IOException           in the case of any other I/O errors.
     * @throws IllegalStateException if this method was already called for this reader.
     */
    public XimImage read(boolean decodePixels) throws IOException {
        if (used) {
            throw new IllegalStateException("XIM reader cannot be reused: " +
                    "the image" + prettyFileName(" %s", stream) + " was already read");
        }
        used = true;
        final long t1 = debugTime();
        final XimImage image = readHeader();
        final long t2 = debugTime();
        if (image.isCompressed()) {
            readCompressedPixels(image, decodePixels);
        } else {
            readUncompressedPixels(image, decodePixels);
        }
        final long t3 = debugTime();
        image.setHistogram(readHistogram());
        image.setProperties(XimProperties.read(stream));
        final long t4 = debugTime();
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> "Read %s%s%s".formatted(
                    image, prettyFileName(" from %s", stream),
                    BUILT_IN_TIMING ? ": %.3f ms (%.3f header + %.3f pixels + %.3f histogram/properties)"
                            .formatted((t4 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6, (t4 - t3) * 1e-6)
                            : ""));
        }
        return image;
    }

    @Override
    public void close() throws IOException {
        if (closeStreamAfterReading) {
            super.close();
        }
    }

    @Override
    public String toString() {
        return "XIM reader" + prettyFileName(" of %s", stream) + (used ? " (already used)" : "");
    }

    /**
     * Decodes uncompressed pixel buffer: little-endian integers of <code>bytesPerPixel</code> width,
     * 1 and 2 bytes are unsigned, 4 bytes are signed.
     *
     * @param buffer        raw pixel buffer.
     * @param numberOfPixels number of pixels.
     * @param bytesPerPixel 1, 2 or 4.
     * @return decoded pixels.
     * @throws XimException if <code>bytesPerPixel</code> is not supported or the buffer is too short.
     */
    public static int[] decodeUncompressed(byte[] buffer, int numberOfPixels, int bytesPerPixel)
            throws XimException {
        Objects.requireNonNull(buffer, "Null buffer");
        if (numberOfPixels < 0) {
            throw new IllegalArgumentException("Negative number of pixels " + numberOfPixels);
        }
        if (bytesPerPixel != 1 && bytesPerPixel != 2 && bytesPerPixel != 4) {
            throw new XimException("Unsupported XIM: uncompressed pixels with " + bytesPerPixel +
                    " bytes per pixel (only 1, 2 or 4 are allowed)");
        }
        final long required = (long) numberOfPixels * bytesPerPixel;
        if (buffer.length < required) {
            throw new XimException("Invalid XIM: uncompressed pixel buffer contains " + buffer.length +
                    " bytes, but " + required + " bytes are required for " + numberOfPixels + " pixels");
        }
        final int[] result = new int[numberOfPixels];
        final ByteBuffer bb = ByteBuffer.wrap(buffer).order(ByteOrder.LITTLE_ENDIAN);
        switch (bytesPerPixel) {
            case 1 -> {
                for (int k = 0; k < numberOfPixels; k++) {
                    result[k] = buffer[k] & 0xFF;
                }
            }
            case 2 -> {
                for (int k = 0; k < numberOfPixels; k++) {
                    result[k] = bb.getShort() & 0xFFFF;
                }
            }
            default -> bb.asIntBuffer().get(result);
        }
        return result;
    }

    private XimImage readHeader() throws IOException {
        final byte[] identifier = XimTools.readBytes(stream, FORMAT_IDENTIFIER_LENGTH, "format identifier");
        if (!isFormatIdentifier(identifier)) {
            throw new XimException("Invalid XIM" + prettyFileName(" %s", stream) +
                    ": file must start with \"" + FORMAT_IDENTIFIER + "\" identifier, but it starts with \"" +
                    printable(identifier) + "\"");
        }
        final int version = XimTools.readInt(stream, "format version");
        final int width = XimTools.readInt(stream, "image width");
        final int height = XimTools.readInt(stream, "image height");
        final int bitsPerPixel = XimTools.readInt(stream, "bits per pixel");
        final int bytesPerPixel = XimTools.readInt(stream, "bytes per pixel");
        final int compression = XimTools.readInt(stream, "compression indicator");
        XimTools.checkSizes(width, height);
        if (bitsPerPixel < 0 || bytesPerPixel < 0) {
            throw new XimException("Invalid XIM: negative bits per pixel (" + bitsPerPixel +
                    ") or bytes per pixel (" + bytesPerPixel + ")");
        }
        return new XimImage(width, height)
                .setFormatVersion(version)
                .setBitsPerPixel(bitsPerPixel)
                .setBytesPerPixel(bytesPerPixel)
                .setCompressed(compression != 0);
    }

    private void readUncompressedPixels(XimImage image, boolean decodePixels) throws IOException {
        final int bufferSize = XimTools.checkLength(
                XimTools.readInt(stream, "size of pixel buffer"), "pixel buffer");
        if (decodePixels) {
            final byte[] buffer = XimTools.readBytes(stream, bufferSize, "uncompressed pixel buffer");
            image.setPixels(decodeUncompressed(buffer, image.numberOfPixels(), image.bytesPerPixel()));
        } else {
            XimTools.skipBytes(stream, bufferSize, "uncompressed pixel buffer");
        }
    }

    private void readCompressedPixels(XimImage image, boolean decodePixels) throws IOException {
        final int lookupTableSize = XimTools.checkLength(
                XimTools.readInt(stream, "size of lookup table"), "lookup table");
        final XimLookupTable lookupTable = XimLookupTable.read(stream, lookupTableSize);
        final int compressedSize = XimTools.checkLength(
                XimTools.readInt(stream, "size of compressed pixel buffer"), "compressed pixel buffer");
        if (decodePixels) {
            final long start = stream.offset();
            final int[] pixels = XimPredictionCodec.decode(lookupTable, stream, image.width(), image.height());
            final long consumed = stream.offset() - start;
            if (consumed > compressedSize) {
                throw new XimException("Invalid XIM: compressed pixel buffer is declared as " +
                        compressedSize + " bytes, but decoding " + image.width() + "x" + image.height() +
                        " pixels required " + consumed + " bytes");
            }
            if (consumed < compressedSize) {
                final long remainder = compressedSize - consumed;
                if (remainder != XimPredictionCodec.numberOfPaddingBytes(
                        lookupTable, image.width(), image.height())) {
                    LOG.log(System.Logger.Level.WARNING, "XIM%s: %d extra bytes after compressed pixels skipped"
                            .formatted(prettyFileName(" %s", stream), remainder));
                }
                XimTools.skipBytes(stream, remainder, "end of compressed pixel buffer");
            }
            image.setPixels(pixels);
        } else {
            XimTools.skipBytes(stream, compressedSize, "compressed pixel buffer");
        }
        uncompressedBufferSize = XimTools.readInt(stream, "size of uncompressed pixel buffer");
    }

    private int[] readHistogram() throws IOException {
        final int numberOfBins = XimTools.readInt(stream, "number of histogram bins");
        if (numberOfBins < 0 || numberOfBins > XimTools.MAX_BLOCK_LENGTH / 4) {
            throw new XimException("Invalid XIM: illegal number of histogram bins " + numberOfBins);
        }
        final byte[] bytes = XimTools.readBytes(stream, 4 * numberOfBins, "histogram");
        final int[] result = new int[numberOfBins];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer().get(result);
        return result;
    }

    private static String printable(byte[] bytes) {
        final StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            final int c = b & 0xFF;
            sb.append(c >= 0x20 && c < 0x7F ?
                    String.valueOf((char) c) :
                    "\\x%02X".formatted(c));
        }
        return sb.toString();
    }
}
