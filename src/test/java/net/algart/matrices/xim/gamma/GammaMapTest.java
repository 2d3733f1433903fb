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

package net.algart.matrices.xim.gamma;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GammaMapTest {
    private static final double NaN = Double.NaN;

    @Test
    public void testStatisticsIgnoreNaN() {
        final GammaMap map = new GammaMap(new double[]{0.5, NaN, 1.5, 1.0, NaN, 0.2}, 3, 2);
        assertEquals(4, map.numberOfEvaluated());
        assertEquals(0.8, map.mean(), 1e-12);
        assertEquals(0.75, map.median(), 1e-12);
        assertEquals(0.2, map.min());
        assertEquals(1.5, map.max());
        assertEquals(75.0, map.passRate());
        assertEquals(25.0, map.passRate(0.4));
        assertEquals(1.5, map.get(2, 0));
        assertTrue(Double.isNaN(map.get(1, 1)));
    }

    @Test
    public void testOddMedian() {
        final GammaMap map = new GammaMap(new double[]{3.0, 1.0, 2.0}, 3, 1);
        assertEquals(2.0, map.median());
    }

    @Test
    public void testNothingEvaluated() {
        final GammaMap map = new GammaMap(new double[]{NaN, NaN}, 1, 2);
        assertEquals(0, map.numberOfEvaluated());
        assertTrue(Double.isNaN(map.mean()));
        assertTrue(Double.isNaN(map.median()));
        assertTrue(Double.isNaN(map.min()));
        assertTrue(Double.isNaN(map.max()));
        assertTrue(Double.isNaN(map.passRate()));
    }

    @Test
    public void testValuesAreCopied() {
        final GammaMap map = new GammaMap(new double[]{1.0, 2.0}, 2, 1);
        map.values()[0] = 100.0;
        assertEquals(1.0, map.get(0, 0));
        map.matrix().array().setDouble(0, 7.0);
        assertEquals(7.0, map.get(0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> map.get(0, 1));
    }
}
