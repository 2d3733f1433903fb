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
import org.junit.jupiter.api.Test;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class XimPredictionCodecTest {
    @Test
    public void testEncodeDecode() throws IOException {
        final int width = 97;
        final int height = 61;
        final Random random = new Random(11);
        final int[] pixels = new int[width * height];
        for (int y = 0, disp = 0; y < height; y++) {
            for (int x = 0; x < width; x++, disp++) {
                pixels[disp] = 1000 + x * 10 + y + (y > 40 ? random.nextInt(100_000) : random.nextInt(3));
            }
        }
        final XimPredictionCodec.Encoded encoded = XimPredictionCodec.encode(pixels, width, height);
        assertEquals((width * height - width - 1) / 4 + 1, encoded.lookupTable().length());
        final DataHandle<Location> in = XimIO.getBytesHandle(encoded.buffer());
        final int[] decoded = XimPredictionCodec.decode(encoded.lookupTable(), in, width, height);
        assertArrayEquals(pixels, decoded);
        assertEquals(encoded.buffer().length - XimPredictionCodec.numberOfPaddingBytes(
                encoded.lookupTable(), width, height), in.offset());
    }

    @Test
    public void testSmoothImageUsesOneByteDiffs() throws IOException {
        final int width = 20;
        final int height = 10;
        final int[] pixels = new int[width * height];
        for (int k = 0; k < pixels.length; k++) {
            pixels[k] = 50_000 + 100 * (k / width) + 3 * (k % width);
        }
        final XimPredictionCodec.Encoded encoded = XimPredictionCodec.encode(pixels, width, height);
        final int numberOfDiffs = width * height - (width + 1);
        assertEquals(4 * (width + 1) + encoded.lookupTable().numberOfSelectors() - 1, encoded.buffer().length);
        assertTrue(encoded.lookupTable().numberOfSelectors() - 1 >= numberOfDiffs);
    }

    @Test
    public void testLastSelectorHasNoDiff() throws IOException {
        final int width = 3;
        for (int height = 1; height <= 6; height++) {
            final int numberOfDiffs = Math.max(0, width * height - (width + 1));
            final int[] pixels = new int[width * height];
            for (int k = 0; k < pixels.length; k++) {
                pixels[k] = k % 2 == 0 ? 1000 * k : -k;
            }
            final XimPredictionCodec.Encoded encoded = XimPredictionCodec.encode(pixels, width, height);
            final XimLookupTable table = encoded.lookupTable();
            final int numberOfSelectors = table.numberOfSelectors();
            assertEquals(0, numberOfSelectors % 4, "height " + height);
            assertTrue(numberOfSelectors - 1 >= numberOfDiffs, "height " + height);
            assertTrue(numberOfSelectors - 1 < numberOfDiffs + 4, "height " + height);

            // reading all selectors but the last one must consume exactly the whole buffer
            final DataHandle<Location> in = XimIO.getBytesHandle(encoded.buffer());
            in.seek(4L * Math.min(width + 1, width * height));
            final int[] diffs = XimDiffs.readDiffs(table.selectors(), in);
            assertEquals(numberOfSelectors - 1, diffs.length);
            assertEquals(encoded.buffer().length, in.offset(), "height " + height);
            for (int k = numberOfDiffs; k < diffs.length; k++) {
                assertEquals(0, diffs[k]);
            }
            assertEquals(numberOfSelectors - 1 - numberOfDiffs,
                    XimPredictionCodec.numberOfPaddingBytes(table, width, height));
        }
    }

    @Test
    public void testDegenerateImages() throws IOException {
        for (int[] sizes : new int[][]{{0, 0}, {1, 1}, {5, 1}, {1, 5}, {3, 2}}) {
            final int[] pixels = new int[sizes[0] * sizes[1]];
            for (int k = 0; k < pixels.length; k++) {
                pixels[k] = k * k - 7;
            }
            final XimPredictionCodec.Encoded encoded = XimPredictionCodec.encode(pixels, sizes[0], sizes[1]);
            assertArrayEquals(pixels, XimPredictionCodec.decode(encoded.lookupTable(),
                    XimIO.getBytesHandle(encoded.buffer()), sizes[0], sizes[1]));
        }
    }

    @Test
    public void testTooShortLookupTable() {
        final XimLookupTable table = XimLookupTable.of(new byte[1]);
        assertThrows(XimException.class,
                () -> XimPredictionCodec.decode(table, XimIO.getBytesHandle(new byte[1000]), 4, 4));
    }
}
