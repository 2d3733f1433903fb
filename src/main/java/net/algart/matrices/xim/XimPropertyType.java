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
import java.util.Objects;
import java.util.Optional;

/**
 * Type tag of the record in the XIM property table.
 */
public enum XimPropertyType {
    INT(0, "int", XimPropertyValue.IntValue::read),
    DOUBLE(1, "double", XimPropertyValue.DoubleValue::read),
    STRING(2, "string", XimPropertyValue.StringValue::read),
    DOUBLE_ARRAY(4, "double[]", XimPropertyValue.DoubleArrayValue::read),
    INT_ARRAY(5, "int[]", XimPropertyValue.IntArrayValue::read);

    @FunctionalInterface
    interface PayloadReader {
        XimPropertyValue read(DataHandle<?> in) throws IOException;
    }

    private final int code;
    private final String prettyName;
    private final PayloadReader payloadReader;

    XimPropertyType(int code, String prettyName, PayloadReader payloadReader) {
        this.code = code;
        this.prettyName = prettyName;
        this.payloadReader = payloadReader;
    }

    /**
     * Returns the integer tag of this type, stored in the file before the payload.
     *
     * @return type code: 0, 1, 2, 4 or 5.
     */
    public int code() {
        return code;
    }

    public String prettyName() {
        return prettyName;
    }

    /**
     * Reads the payload of the property value of this type from the current stream position.
     *
     * @param in input stream, positioned after the type tag.
     * @return the read value.
     * @throws IOException in the case of any I/O errors or if the stream is truncated.
     */
    public XimPropertyValue readPayload(DataHandle<?> in) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        return payloadReader.read(in);
    }

    public static Optional<XimPropertyType> fromCode(int code) {
        for (XimPropertyType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
