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
import java.util.Objects;

/**
 * Lookup table of compressed XIM image: every byte packs four 2-bit selectors,
 * each selector specifies the number of bytes occupied by the corresponding diff value
 * in the compressed stream.
 *
 * <p>Selectors are unpacked starting from the low-order bit pair: byte <code>b</code> produces
 * <code>[b&amp;3, (b&gt;&gt;2)&amp;3, (b&gt;&gt;4)&amp;3, (b&gt;&gt;6)&amp;3]</code>.
 * For example, <code>0b01110011</code> is unpacked into <code>[3, 0, 3, 1]</code>.</p>
 *
 * <p>This class is immutable.</p>
 */
public final class XimLookupTable {
    public static final int SELECTORS_PER_BYTE = 4;

    public static final int SELECTOR_INT8 = 0;
    public static final int SELECTOR_INT16 = 1;
    public static final int SELECTOR_INT32 = 2;

    private final byte[] bytes;
    private final byte[] selectors;

    private XimLookupTable(byte[] bytes) {
        this.bytes = bytes;
        this.selectors = unpackSelectors(bytes);
    }

    public static XimLookupTable of(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null lookup table bytes");
        return new XimLookupTable(bytes.clone());
    }

    public static XimLookupTable ofSelectors(byte[] selectors) {
        return new XimLookupTable(packSelectors(selectors));
    }

    public static XimLookupTable read(DataHandle<?> in, int length) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        return new XimLookupTable(XimTools.readBytes(in, length, "lookup table"));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public byte[] selectors() {
        return selectors.clone();
    }

    public int numberOfSelectors() {
        return selectors.length;
    }

    public int selector(int index) {
        return selectors[index];
    }

    public static byte[] unpackSelectors(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null lookup table bytes");
        final byte[] result = new byte[SELECTORS_PER_BYTE * bytes.length];
        for (int k = 0, disp = 0; k < bytes.length; k++) {
            final int b = bytes[k];
            result[disp++] = (byte) (b & 3);
            result[disp++] = (byte) ((b >>> 2) & 3);
            result[disp++] = (byte) ((b >>> 4) & 3);
            result[disp++] = (byte) ((b >>> 6) & 3);
        }
        return result;
    }

    /**
     * Inverse operation to {@link #unpackSelectors(byte[])}.
     * If the number of selectors is not divisible by 4, the last byte is padded with zero selectors.
     *
     * @param selectors selectors 0..3.
     * @return packed bytes.
     */
    public static byte[] packSelectors(byte[] selectors) {
        Objects.requireNonNull(selectors, "Null selectors");
        final byte[] result = new byte[(selectors.length + SELECTORS_PER_BYTE - 1) / SELECTORS_PER_BYTE];
        for (int k = 0; k < selectors.length; k++) {
            final int selector = selectors[k];
            if (selector < 0 || selector > 3) {
                throw new IllegalArgumentException("Illegal selector " + selector + " at position " + k +
                        " (must be 0..3)");
            }
            result[k >>> 2] |= (byte) (selector << ((k & 3) << 1));
        }
        return result;
    }

    /**
     * Returns the number of bytes occupied by a diff value with the given selector.
     *
     * @param selector selector from the lookup table.
     * @return 1, 2 or 4.
     * @throws XimException if the selector is 3 (not used by XIM format).
     */
    public static int bytesPerElement(int selector) throws XimException {
        return switch (selector) {
            case SELECTOR_INT8 -> 1;
            case SELECTOR_INT16 -> 2;
            case SELECTOR_INT32 -> 4;
            default -> throw new XimException("Invalid XIM lookup table: illegal selector " + selector);
        };
    }

    /**
     * Returns the selector of the minimal width, enough for storing the given diff.
     *
     * @param diff some diff value.
     * @return {@link #SELECTOR_INT8}, {@link #SELECTOR_INT16} or {@link #SELECTOR_INT32}.
     */
    public static int selectorOf(int diff) {
        if (diff >= Byte.MIN_VALUE && diff <= Byte.MAX_VALUE) {
            return SELECTOR_INT8;
        }
        if (diff >= Short.MIN_VALUE && diff <= Short.MAX_VALUE) {
            return SELECTOR_INT16;
        }
        return SELECTOR_INT32;
    }

    @Override
    public String toString() {
        return "XIM lookup table: " + bytes.length + " bytes, " + selectors.length + " selectors";
    }
}
