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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Value of one record of the XIM property table.
 *
 * <p>Every variant knows how to read and write its own payload (the data following the type tag).
 * Strings are stored as a byte count and bytes, one byte per character (ISO-8859-1);
 * arrays are stored as a <b>byte</b> count followed by elements.</p>
 *
 * <p>Array values are immutable: the arrays are cloned on construction and in the accessors.</p>
 */
public sealed interface XimPropertyValue {
    XimPropertyType type();

    /**
     * Writes the payload of this value (without the name and type tag) at the current stream position.
     *
     * @param out output stream.
     * @throws IOException in the case of any I/O errors.
     */
    void writePayload(DataHandle<?> out) throws IOException;

    /**
     * Returns JSON representation of this value: a number, a quoted string or an array of numbers.
     *
     * @return JSON representation.
     */
    String toJson();

    /**
     * Returns textual representation, suitable for storing in textual metadata of other formats:
     * a string is returned as-is, other values in JSON.
     *
     * @return textual representation.
     */
    default String toText() {
        return toJson();
    }

    record IntValue(int value) implements XimPropertyValue {
        static IntValue read(DataHandle<?> in) throws IOException {
            return new IntValue(XimTools.readInt(in, "int property"));
        }

        @Override
        public XimPropertyType type() {
            return XimPropertyType.INT;
        }

        @Override
        public void writePayload(DataHandle<?> out) throws IOException {
            out.writeInt(value);
        }

        @Override
        public String toJson() {
            return String.valueOf(value);
        }
    }

    record DoubleValue(double value) implements XimPropertyValue {
        static DoubleValue read(DataHandle<?> in) throws IOException {
            return new DoubleValue(XimTools.readDouble(in, "double property"));
        }

        @Override
        public XimPropertyType type() {
            return XimPropertyType.DOUBLE;
        }

        @Override
        public void writePayload(DataHandle<?> out) throws IOException {
            out.writeDouble(value);
        }

        @Override
        public String toJson() {
            return XimTools.formatJsonDouble(value);
        }
    }

    record StringValue(String value) implements XimPropertyValue {
        public StringValue {
            Objects.requireNonNull(value, "Null string value");
            checkEncodable(value);
        }

        static StringValue read(DataHandle<?> in) throws IOException {
            final int length = XimTools.checkLength(XimTools.readInt(in, "string property length"),
                    "string property");
            return new StringValue(decodeString(XimTools.readBytes(in, length, "string property")));
        }

        @Override
        public XimPropertyType type() {
            return XimPropertyType.STRING;
        }

        @Override
        public void writePayload(DataHandle<?> out) throws IOException {
            final byte[] bytes = encodeString(value);
            out.writeInt(bytes.length);
            out.write(bytes);
        }

        @Override
        public String toJson() {
            return "\"" + XimTools.escapeJsonString(value) + "\"";
        }

        @Override
        public String toText() {
            return value;
        }
    }

    record DoubleArrayValue(double[] value) implements XimPropertyValue {
        public DoubleArrayValue {
            Objects.requireNonNull(value, "Null double[] value");
            value = value.clone();
        }

        @Override
        public double[] value() {
            return value.clone();
        }

        static DoubleArrayValue read(DataHandle<?> in) throws IOException {
            final int numberOfBytes = XimTools.checkLength(
                    XimTools.readInt(in, "double[] property length"), "double[] property");
            final double[] result = new double[numberOfBytes / 8];
            for (int k = 0; k < result.length; k++) {
                result[k] = XimTools.readDouble(in, "double[] property");
            }
            skipIncompleteElement(in, numberOfBytes % 8, "double[] property");
            return new DoubleArrayValue(result);
        }

        @Override
        public XimPropertyType type() {
            return XimPropertyType.DOUBLE_ARRAY;
        }

        @Override
        public void writePayload(DataHandle<?> out) throws IOException {
            out.writeInt(checkArrayLength(value.length, 8));
            for (double v : value) {
                out.writeDouble(v);
            }
        }

        @Override
        public String toJson() {
            return Arrays.stream(value).mapToObj(XimTools::formatJsonDouble)
                    .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DoubleArrayValue that && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "DoubleArrayValue[value=" + Arrays.toString(value) + "]";
        }
    }

    record IntArrayValue(int[] value) implements XimPropertyValue {
        public IntArrayValue {
            Objects.requireNonNull(value, "Null int[] value");
            value = value.clone();
        }

        @Override
        public int[] value() {
            return value.clone();
        }

        static IntArrayValue read(DataHandle<?> in) throws IOException {
            final int numberOfBytes = XimTools.checkLength(
                    XimTools.readInt(in, "int[] property length"), "int[] property");
            final int[] result = new int[numberOfBytes / 4];
            for (int k = 0; k < result.length; k++) {
                result[k] = XimTools.readInt(in, "int[] property");
            }
            skipIncompleteElement(in, numberOfBytes % 4, "int[] property");
            return new IntArrayValue(result);
        }

        @Override
        public XimPropertyType type() {
            return XimPropertyType.INT_ARRAY;
        }

        @Override
        public void writePayload(DataHandle<?> out) throws IOException {
            out.writeInt(checkArrayLength(value.length, 4));
            for (int v : value) {
                out.writeInt(v);
            }
        }

        @Override
        public String toJson() {
            return Arrays.stream(value).mapToObj(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntArrayValue that && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "IntArrayValue[value=" + Arrays.toString(value) + "]";
        }
    }

    /**
     * Decodes XIM string: one byte per character, trailing zero characters are removed.
     *
     * @param bytes string bytes from the file.
     * @return Java string.
     */
    static String decodeString(byte[] bytes) {
        int length = bytes.length;
        while (length > 0 && bytes[length - 1] == 0) {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
    }

    /**
     * Encodes XIM string: one byte per character.
     *
     * @param s Java string.
     * @return string bytes for the file.
     * @throws IllegalArgumentException if the string contains characters above <code>\u00FF</code>.
     */
    static byte[] encodeString(String s) {
        checkEncodable(s);
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static void checkEncodable(String s) {
        for (int i = 0, n = s.length(); i < n; i++) {
            final char c = s.charAt(i);
            if (c > 0xFF) {
                throw new IllegalArgumentException(("Character '%c' (code %d) at position %d cannot be stored " +
                        "in XIM string \"%s\"").formatted(c, (int) c, i, s));
            }
        }
    }

    private static void skipIncompleteElement(DataHandle<?> in, int remainder, String what) throws IOException {
        if (remainder != 0) {
            XimIO.LOG.log(System.Logger.Level.WARNING,
                    "Byte count of %s is not a multiple of the element size; skipping %d extra bytes"
                            .formatted(what, remainder));
            XimTools.skipBytes(in, remainder, what);
        }
    }

    private static int checkArrayLength(int length, int bytesPerElement) {
        if (length > XimTools.MAX_BLOCK_LENGTH / bytesPerElement) {
            throw new IllegalArgumentException("Too large array for XIM property: " + length + " elements");
        }
        return length * bytesPerElement;
    }
}
