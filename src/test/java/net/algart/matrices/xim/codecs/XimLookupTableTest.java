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
import net.algart.matrices.xim.TruncatedXimException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class XimLookupTableTest {
    @Test
    public void testLowBitPairFirst() {
        final byte[] selectors = XimLookupTable.unpackSelectors(new byte[]{(byte) 0b01110011});
        assertArrayEquals(new byte[]{3, 0, 3, 1}, selectors);
    }

    @Test
    public void testUnpackSeveralBytes() {
        final XimLookupTable table = XimLookupTable.of(new byte[]{(byte) 0b10010000, (byte) 0xFF, 0});
        assertEquals(3, table.length());
        assertEquals(12, table.numberOfSelectors());
        assertArrayEquals(new byte[]{0, 0, 1, 2, 3, 3, 3, 3, 0, 0, 0, 0}, table.selectors());
        assertEquals(2, table.selector(3));
    }

    @Test
    public void testPackIsInverseOfUnpack() {
        for (int b = 0; b < 256; b++) {
            final byte[] bytes = {(byte) b};
            assertArrayEquals(bytes, XimLookupTable.packSelectors(XimLookupTable.unpackSelectors(bytes)));
        }
    }

    @Test
    public void testPackPadsLastByte() {
        final byte[] packed = XimLookupTable.packSelectors(new byte[]{2, 1, 0, 1, 2});
        assertArrayEquals(new byte[]{(byte) 0b01000110, 0b10}, packed);
        assertThrows(IllegalArgumentException.class, () -> XimLookupTable.packSelectors(new byte[]{4}));
    }

    @Test
    public void testBytesPerElement() throws XimException {
        assertEquals(1, XimLookupTable.bytesPerElement(XimLookupTable.SELECTOR_INT8));
        assertEquals(2, XimLookupTable.bytesPerElement(XimLookupTable.SELECTOR_INT16));
        assertEquals(4, XimLookupTable.bytesPerElement(XimLookupTable.SELECTOR_INT32));
        assertThrows(XimException.class, () -> XimLookupTable.bytesPerElement(3));
    }

    @Test
    public void testSelectorOf() {
        assertEquals(0, XimLookupTable.selectorOf(127));
        assertEquals(0, XimLookupTable.selectorOf(-128));
        assertEquals(1, XimLookupTable.selectorOf(128));
        assertEquals(1, XimLookupTable.selectorOf(-129));
        assertEquals(1, XimLookupTable.selectorOf(32767));
        assertEquals(2, XimLookupTable.selectorOf(32768));
        assertEquals(2, XimLookupTable.selectorOf(Integer.MIN_VALUE));
    }

    @Test
    public void testRead() throws IOException {
        final XimLookupTable table = XimLookupTable.read(XimIO.getBytesHandle(new byte[]{0x04, 0x08}), 2);
        assertArrayEquals(new byte[]{0, 1, 0, 0, 0, 2, 0, 0}, table.selectors());
        assertThrows(TruncatedXimException.class,
                () -> XimLookupTable.read(XimIO.getBytesHandle(new byte[]{1}), 2));
    }
}
