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
import net.algart.matrices.xim.XimTools;
import org.scijava.io.handle.DataHandle;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Reading and writing the stream of variable-width diff values of compressed XIM image.
 *
 * <p>Every diff occupies 1, 2 or 4 bytes (signed, little-endian) according to its selector
 * from {@link XimLookupTable}. Diffs with the same width, following one after another,
 * are read as a single block; the stream position moves only forward.</p>
 */
public class XimDiffs {
    private static final int MAX_BUFFER_SIZE = 1 << 16;

    private XimDiffs() {
    }

    /**
     * Reads <code>selectors.length-1</code> diffs: the last selector of the lookup table
     * has no corresponding diff.
     *
     * @param selectors unpacked lookup table.
     * @param in        input stream, positioned at the first diff.
     * @return read diffs.
     * @throws IOException in the case of any I/O errors, in particular {@link net.algart.matrices.xim.TruncatedXimException}.
     */
    public static int[] readDiffs(byte[] selectors, DataHandle<?> in) throws IOException {
        Objects.requireNonNull(selectors, "Null selectors");
        return readDiffs(selectors, Math.max(selectors.length - 1, 0), in);
    }

    public static int[] readDiffs(byte[] selectors, int numberOfDiffs, DataHandle<?> in) throws IOException {
        Objects.requireNonNull(selectors, "Null selectors");
        Objects.requireNonNull(in, "Null input stream");
        if (numberOfDiffs < 0) {
            throw new IllegalArgumentException("Negative number of diffs: " + numberOfDiffs);
        }
        if (numberOfDiffs > selectors.length) {
            throw new XimException("Invalid XIM: lookup table contains only " + selectors.length +
                    " selectors, but " + numberOfDiffs + " diffs are required");
        }
        final int[] result = new int[numberOfDiffs];
        final byte[] buffer = new byte[(int) Math.min(MAX_BUFFER_SIZE, 4L * numberOfDiffs)];
        for (int runStart = 0; runStart < numberOfDiffs; ) {
            final byte selector = selectors[runStart];
            int runEnd = runStart + 1;
            while (runEnd < numberOfDiffs && selectors[runEnd] == selector) {
                runEnd++;
            }
            final int bytesPerElement;
            try {
                bytesPerElement = XimLookupTable.bytesPerElement(selector);
            } catch (XimException e) {
                throw new XimException(e.getMessage() + " for diff #" + runStart, e);
            }
            readRun(in, result, runStart, runEnd - runStart, bytesPerElement, buffer);
            runStart = runEnd;
        }
        return result;
    }

    /**
     * Returns selectors of minimal widths for all diffs.
     *
     * @param diffs diff values.
     * @return selectors, one per diff.
     */
    public static byte[] selectors(int[] diffs) {
        Objects.requireNonNull(diffs, "Null diffs");
        final byte[] result = new byte[diffs.length];
        for (int k = 0; k < diffs.length; k++) {
            result[k] = (byte) XimLookupTable.selectorOf(diffs[k]);
        }
        return result;
    }

    /**
     * Writes diffs with the widths, specified by selectors.
     *
     * @param diffs     diff values.
     * @param selectors selectors; must contain at least <code>diffs.length</code> elements,
     *                  and every diff must fit into the width of its selector.
     * @param out       output stream.
     * @return number of written bytes.
     * @throws IOException in the case of any I/O errors.
     */
    public static long writeDiffs(int[] diffs, byte[] selectors, DataHandle<?> out) throws IOException {
        Objects.requireNonNull(diffs, "Null diffs");
        Objects.requireNonNull(selectors, "Null selectors");
        Objects.requireNonNull(out, "Null output stream");
        if (selectors.length < diffs.length) {
            throw new IllegalArgumentException("Too few selectors: " + selectors.length + " < " + diffs.length);
        }
        final ByteBuffer buffer = ByteBuffer.allocate(MAX_BUFFER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        long count = 0;
        for (int k = 0; k < diffs.length; k++) {
            final int diff = diffs[k];
            final int selector = selectors[k];
            if (XimLookupTable.selectorOf(diff) > selector) {
                throw new IllegalArgumentException("Diff #" + k + " = " + diff +
                        " does not fit into selector " + selector);
            }
            if (buffer.remaining() < 4) {
                count += flush(buffer, out);
            }
            switch (selector) {
                case XimLookupTable.SELECTOR_INT8 -> buffer.put((byte) diff);
                case XimLookupTable.SELECTOR_INT16 -> buffer.putShort((short) diff);
                case XimLookupTable.SELECTOR_INT32 -> buffer.putInt(diff);
                default -> throw new IllegalArgumentException("Illegal selector " + selector);
            }
        }
        count += flush(buffer, out);
        return count;
    }

    private static void readRun(
            DataHandle<?> in,
            int[] result,
            int offset,
            int count,
            int bytesPerElement,
            byte[] buffer)
            throws IOException {
        final int elementsPerBuffer = buffer.length / bytesPerElement;
        while (count > 0) {
            final int n = Math.min(count, elementsPerBuffer);
            final int length = n * bytesPerElement;
            XimTools.readFully(in, buffer, 0, length, "diffs #" + offset + ".." + (offset + n - 1));
            final ByteBuffer bb = ByteBuffer.wrap(buffer, 0, length).order(ByteOrder.LITTLE_ENDIAN);
            switch (bytesPerElement) {
                case 1 -> {
                    for (int k = 0; k < n; k++) {
                        result[offset + k] = buffer[k];
                    }
                }
                case 2 -> {
                    for (int k = 0; k < n; k++) {
                        result[offset + k] = bb.getShort();
                    }
                }
                case 4 -> {
                    for (int k = 0; k < n; k++) {
                        result[offset + k] = bb.getInt();
                    }
                }
                default -> throw new AssertionError("Must be checked in XimLookupTable.bytesPerElement");
            }
            offset += n;
            count -= n;
        }
    }

    private static int flush(ByteBuffer buffer, DataHandle<?> out) throws IOException {
        final int length = buffer.position();
        out.write(buffer.array(), 0, length);
        buffer.clear();
        return length;
    }
}
