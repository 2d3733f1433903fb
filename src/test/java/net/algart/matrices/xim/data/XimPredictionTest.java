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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class XimPredictionTest {
    private static final int[] PIXELS = {
            1, 2, 3,
            4, 5, 6,
            7, 8, 10};

    @Test
    public void testSubtractPrediction() {
        assertArrayEquals(new int[]{0, 0, 0, 0, 1}, XimPrediction.subtractPrediction(PIXELS, 3, 3));
    }

    @Test
    public void testUnsubtractPrediction() {
        final int[] result = XimPrediction.unsubtractPrediction(
                new int[]{1, 2, 3, 4}, new int[]{0, 0, 0, 0, 1}, 3, 3);
        assertArrayEquals(PIXELS, result);
    }

    @Test
    public void testOverflowWrapsConsistently() {
        final int[] pixels = {Integer.MAX_VALUE, Integer.MIN_VALUE, -1, Integer.MAX_VALUE, 0, 17};
        final int[] diffs = XimPrediction.subtractPrediction(pixels, 2, 3);
        final int[] initial = {pixels[0], pixels[1], pixels[2]};
        assertArrayEquals(pixels, XimPrediction.unsubtractPrediction(initial, diffs, 2, 3));
    }

    @Test
    public void testNumberOfValues() {
        assertEquals(4, XimPrediction.numberOfInitialValues(3, 3));
        assertEquals(5, XimPrediction.numberOfDiffs(3, 3));
        assertEquals(5, XimPrediction.numberOfInitialValues(5, 1));
        assertEquals(0, XimPrediction.numberOfDiffs(5, 1));
        assertEquals(1, XimPrediction.numberOfInitialValues(1, 1));
        assertEquals(0, XimPrediction.numberOfInitialValues(0, 10));
        assertEquals(2, XimPrediction.numberOfInitialValues(1, 5));
        assertEquals(3, XimPrediction.numberOfDiffs(1, 5));
        assertThrows(IllegalArgumentException.class, () -> XimPrediction.numberOfDiffs(-1, 5));
    }

    @Test
    public void testInvalidLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> XimPrediction.unsubtractPrediction(new int[]{1, 2, 3}, new int[5], 3, 3));
        assertThrows(IllegalArgumentException.class,
                () -> XimPrediction.unsubtractPrediction(new int[]{1, 2, 3, 4}, new int[4], 3, 3));
        assertThrows(IllegalArgumentException.class,
                () -> XimPrediction.subtractPrediction(new int[8], 3, 3));
    }
}
