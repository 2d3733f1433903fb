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

import net.algart.matrices.xim.TruncatedXimException;
import net.algart.matrices.xim.XimException;
import net.algart.matrices.xim.XimIO;
import org.junit.jupiter.api.Test;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class XimDiffsTest {
    @Test
    public void testSingleByteRunBetweenShortRuns() throws IOException {
        final byte[] selectors = {1, 1, 0, 1, 1};
        final ByteBuffer bb = ByteBuffer.allocate(9).order(ByteOrder.LITTLE_ENDIAN);
        bb.putShort((short) 300).putShort((short) -300).put((byte) 5).putShort((short) 1000).putShort((short) -2);
        final DataHandle<Location> in = XimIO.getBytesHandle(bb.array());
        final int[] diffs = XimDiffs.readDiffs(selectors, 5, in);
        assertArrayEquals(new int[]{300, -300, 5, 1000, -2}, diffs);
        assertEquals(9, in.offset());
    }

    @Test
    public void testLastSelectorHasNoDiff() throws IOException {
        final byte[] selectors = {0, 2, 0, 1};
        final ByteBuffer bb = ByteBuffer.allocate(6).order(ByteOrder.LITTLE_ENDIAN);
        bb.put((byte) -7).putInt(100_000).put((byte) 127);
        final DataHandle<Location> in = XimIO.getBytesHandle(bb.array());
        assertArrayEquals(new int[]{-7, 100_000, 127}, XimDiffs.readDiffs(selectors, in));
        assertEquals(6, in.offset());
    }

    @Test
    public void testTruncated() {
        final byte[] selectors = {2, 2};
        assertThrows(TruncatedXimException.class,
                () -> XimDiffs.readDiffs(selectors, 2, XimIO.getBytesHandle(new byte[7])));
    }

    @Test
    public void testIllegalSelector() {
        final byte[] selectors = {0, 3, 0};
        final XimException e = assertThrows(XimException.class,
                () -> XimDiffs.readDiffs(selectors, 3, XimIO.getBytesHandle(new byte[16])));
        assertTrue(e.getMessage().contains("#1"), e.getMessage());
    }

    @Test
    public void testTooFewSelectors() {
        assertThrows(XimException.class,
                () -> XimDiffs.readDiffs(new byte[2], 3, XimIO.getBytesHandle(new byte[16])));
    }

    @Test
    public void testWriteAndReadLongRuns() throws IOException {
        final Random random = new Random(157);
        final int[] diffs = new int[200_000];
        for (int k = 0; k < diffs.length; k++) {
            diffs[k] = switch ((k / 30_000) % 3) {
                case 0 -> random.nextInt(256) - 128;
                case 1 -> random.nextInt(60_000) - 30_000;
                default -> random.nextInt();
            };
        }
        final byte[] selectors = XimDiffs.selectors(diffs);
        try (DataHandle<Location> buffer = XimIO.getBytesHandle(new BytesLocation(0))) {
            final long length = XimDiffs.writeDiffs(diffs, selectors, buffer);
            assertEquals(buffer.length(), length);
            buffer.seek(0);
            assertArrayEquals(diffs, XimDiffs.readDiffs(selectors, diffs.length, buffer));
            assertEquals(length, buffer.offset());
        }
    }

    @Test
    public void testWriteChecksSelector() {
        assertThrows(IllegalArgumentException.class, () -> XimDiffs.writeDiffs(
                new int[]{1000}, new byte[]{0}, XimIO.getBytesHandle(new BytesLocation(0))));
    }
}
