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

import org.scijava.io.handle.BytesHandle;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.FileHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.FileLocation;
import org.scijava.io.location.Location;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Common base of {@link XimReader} and {@link XimWriter}.
 *
 * <p>XIM is a little-endian format; the stream passed to the constructor
 * is always switched to little-endian mode.</p>
 */
public sealed abstract class XimIO implements Closeable permits XimReader, XimWriter {
    /**
     * Format identifier, stored in the first 8 bytes of every XIM file (padded by zero bytes).
     */
    public static final String FORMAT_IDENTIFIER = "VMS.XI";
    public static final int FORMAT_IDENTIFIER_LENGTH = 8;
    public static final int DEFAULT_FORMAT_VERSION = 1;

    /**
     * The number of bytes in the fixed header: identifier and 6 int32 fields.
     */
    public static final int HEADER_LENGTH = FORMAT_IDENTIFIER_LENGTH + 6 * 4;

    static final System.Logger LOG = System.getLogger(XimIO.class.getName());
    static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    static final boolean BUILT_IN_TIMING = getBooleanProperty("net.algart.matrices.xim.timing");

    final DataHandle<? extends Location> stream;

    XimIO(DataHandle<? extends Location> stream) {
        this.stream = Objects.requireNonNull(stream, "Null data handle (input/output stream)");
        this.stream.setLittleEndian(true);
    }

    /**
     * Returns the input/output stream for operation with this XIM file.
     */
    public DataHandle<? extends Location> stream() {
        return stream;
    }

    public String streamName() {
        return prettyFileName("%s", stream);
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }

    public static byte[] formatIdentifierBytes() {
        return Arrays.copyOf(FORMAT_IDENTIFIER.getBytes(StandardCharsets.US_ASCII), FORMAT_IDENTIFIER_LENGTH);
    }

    public static boolean isFormatIdentifier(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null bytes");
        return Arrays.equals(bytes, formatIdentifierBytes());
    }

    public static DataHandle<Location> getExistingFileHandle(Path file) throws FileNotFoundException {
        Objects.requireNonNull(file, "Null file");
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("File " + file
                    + (Files.exists(file) ? " is not a regular file" : " does not exist"));
        }
        return getFileHandle(file);
    }

    /**
     * Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    public static DataHandle<Location> getFileHandle(Path file) {
        Objects.requireNonNull(file, "Null file");
        FileHandle fileHandle = new FileHandle(new FileLocation(file.toFile()));
        fileHandle.setLittleEndian(true);
        return (DataHandle) fileHandle;
    }

    /**
     * Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    public static DataHandle<Location> getBytesHandle(BytesLocation bytesLocation) {
        Objects.requireNonNull(bytesLocation, "Null bytesLocation");
        BytesHandle bytesHandle = new BytesHandle(bytesLocation);
        bytesHandle.setLittleEndian(true);
        return (DataHandle) bytesHandle;
    }

    public static DataHandle<Location> getBytesHandle(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null bytes");
        return getBytesHandle(new BytesLocation(bytes));
    }

    /**
     * Returns the full content of the given stream; the stream position is restored.
     *
     * @param handle some stream, usually an in-memory buffer.
     * @return all its bytes.
     * @throws IOException in the case of any I/O errors.
     */
    public static byte[] readAllBytes(DataHandle<?> handle) throws IOException {
        Objects.requireNonNull(handle, "Null handle");
        final long length = handle.length();
        if (length > XimTools.MAX_BLOCK_LENGTH) {
            throw new IOException("Too large stream for reading into byte[]: " + length + " bytes");
        }
        final long savedOffset = handle.offset();
        try {
            handle.seek(0);
            final byte[] result = new byte[(int) length];
            handle.readFully(result);
            return result;
        } finally {
            handle.seek(savedOffset);
        }
    }

    static long debugTime() {
        return BUILT_IN_TIMING && LOGGABLE_DEBUG ? System.nanoTime() : 0;
    }

    static String prettyFileName(String format, DataHandle<? extends Location> handle) {
        if (handle == null) {
            return "";
        }
        Location location = handle.get();
        if (location == null) {
            return "";
        }
        URI uri = location.getURI();
        if (uri == null) {
            return "";
        }
        return format.formatted(uri);
    }

    static boolean getBooleanProperty(String propertyName) {
        try {
            return Boolean.getBoolean(propertyName);
        } catch (Exception e) {
            return false;
        }
    }
}
