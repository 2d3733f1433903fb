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

import org.scijava.io.handle.DataHandle;

import java.io.EOFException;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Utility methods for reading and writing XIM structures.
 *
 * <p>All reading methods convert the end of the stream into {@link TruncatedXimException},
 * so the caller always receives a typed failure.</p>
 *
 * @author Daniel Alievsky
 */
public class XimTools {
    /**
     * Maximal allowed length of any length-prefixed XIM structure (name, string, array, buffer).
     *
     * <p>This limit helps to detect "crazy" or corrupted XIM and also help to avoid arithmetic overflow.
     */
    public static final int MAX_BLOCK_LENGTH = Integer.MAX_VALUE - 16;

    private XimTools() {
    }

    public static int readInt(DataHandle<?> in, String what) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        checkAvailable(in, 4, what);
        try {
            return in.readInt();
        } catch (EOFException e) {
            throw truncated(in, what, e);
        }
    }

    public static double readDouble(DataHandle<?> in, String what) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        checkAvailable(in, 8, what);
        try {
            return in.readDouble();
        } catch (EOFException e) {
            throw truncated(in, what, e);
        }
    }

    public static byte[] readBytes(DataHandle<?> in, int length, String what) throws IOException {
        checkLength(length, what);
        final byte[] result = new byte[length];
        readFully(in, result, 0, length, what);
        return result;
    }

    public static void readFully(DataHandle<?> in, byte[] dest, int offset, int length, String what)
            throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        Objects.requireNonNull(dest, "Null destination array");
        checkAvailable(in, length, what);
        try {
            in.readFully(dest, offset, length);
        } catch (EOFException e) {
            throw truncated(in, what, e);
        }
    }

    /**
     * Skips the given number of bytes, checking that the stream really contains them.
     * The stream position only moves forward.
     *
     * @param in     input stream.
     * @param length number of bytes to skip.
     * @param what   description of skipped data for the error message.
     * @throws TruncatedXimException if the stream is shorter than necessary.
     * @throws IOException           in the case of any other I/O errors.
     */
    public static void skipBytes(DataHandle<?> in, long length, String what) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        if (length < 0) {
            throw new IllegalArgumentException("Negative number of skipped bytes: " + length);
        }
        final long offset = in.offset();
        checkAvailable(in, length, what);
        in.seek(offset + length);
    }

    public static int checkLength(int length, String what) throws XimException {
        if (length < 0 || length > MAX_BLOCK_LENGTH) {
            throw new XimException("Invalid XIM: illegal length of " + what + " = " + length);
        }
        return length;
    }

    /**
     * Checks image sizes and returns the number of pixels.
     *
     * @param width  image width.
     * @param height image height.
     * @return <code>width * height</code>.
     * @throws XimException if the sizes are negative or the number of pixels is &ge;2<sup>31</sup>.
     */
    public static int checkSizes(int width, int height) throws XimException {
        if (width < 0 || height < 0) {
            throw new XimException("Invalid XIM: negative image sizes " + width + "x" + height);
        }
        final long result = (long) width * (long) height;
        if (result > MAX_BLOCK_LENGTH) {
            throw new XimException("Too large XIM image " + width + "x" + height +
                    ": number of pixels >= 2^31 is not supported");
        }
        return (int) result;
    }

    public static String escapeJsonString(String s) {
        Objects.requireNonNull(s, "Null string");
        final StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0, n = s.length(); i < n; i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append("\\u%04x".formatted((int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Returns JSON number for the given double value in the same form as Python <code>json.dumps</code>:
     * positional notation with at least one fractional digit when the decimal exponent is in -4..15
     * (<code>10000000000.0</code>, <code>0.0001</code>), otherwise scientific notation with the signed
     * exponent of at least 2 digits (<code>1e+16</code>, <code>1.5e-05</code>).
     * NaN and infinities are returned as <code>NaN</code>, <code>Infinity</code>, <code>-Infinity</code>.
     *
     * @param value some double value.
     * @return its textual representation.
     */
    public static String formatJsonDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value == 0.0) {
            return String.valueOf(value);
        }
        final BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        final int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            final String plain = decimal.toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        final String digits = decimal.unscaledValue().abs().toString();
        final StringBuilder sb = new StringBuilder();
        if (value < 0.0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append(exponent < 0 ? "e-" : "e+");
        sb.append("%02d".formatted(Math.abs(exponent)));
        return sb.toString();
    }

    private static void checkAvailable(DataHandle<?> in, long length, String what) throws IOException {
        final long offset = in.offset();
        final long available = in.length() - offset;
        if (length > available) {
            throw new TruncatedXimException("Unexpected end of XIM stream while reading " + what +
                    ": " + length + " bytes required at position " + offset + ", but only " +
                    Math.max(available, 0) + " bytes are available");
        }
    }

    private static TruncatedXimException truncated(DataHandle<?> in, String what, EOFException cause) {
        String position;
        try {
            position = " at position " + in.offset();
        } catch (IOException e) {
            // - very improbable, the message is still informative without the position
            position = "";
        }
        return new TruncatedXimException("Unexpected end of XIM stream while reading " + what + position, cause);
    }
}
