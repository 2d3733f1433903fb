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
import java.util.*;

/**
 * Property table of XIM image: ordered map from property names to their values.
 *
 * <p>The order of properties is the order of their first appearance in the file.
 * If the same name occurs several times, the last value wins.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class XimProperties {
    /**
     * Property table with number of entries, greater than this limit, is not allowed:
     * it is mostly probable that it is a corrupted file.
     */
    public static final int MAX_NUMBER_OF_PROPERTIES = 1_000_000;

    public enum StringFormat {
        BRIEF,
        NORMAL,
        JSON;

        public boolean isJson() {
            return this == JSON;
        }
    }

    private static final System.Logger LOG = System.getLogger(XimProperties.class.getName());

    private final Map<String, XimPropertyValue> map = new LinkedHashMap<>();

    public XimProperties() {
    }

    public XimProperties(Map<String, ? extends XimPropertyValue> properties) {
        Objects.requireNonNull(properties, "Null properties");
        properties.forEach(this::put);
    }

    /**
     * Reads the property table from the current stream position: the number of records
     * and the records themselves.
     *
     * @param in input stream.
     * @return new property table.
     * @throws UnsupportedXimPropertyException if some record has an unknown type tag.
     * @throws TruncatedXimException           if the stream ends before the end of the table.
     * @throws XimException                    if the table is corrupted.
     * @throws IOException                     in the case of any other I/O errors.
     */
    public static XimProperties read(DataHandle<?> in) throws IOException {
        Objects.requireNonNull(in, "Null input stream");
        final int count = XimTools.readInt(in, "number of properties");
        if (count < 0 || count > MAX_NUMBER_OF_PROPERTIES) {
            throw new XimException("Invalid XIM: illegal number of properties " + count);
        }
        final XimProperties result = new XimProperties();
        for (int k = 0; k < count; k++) {
            final int index = k;
            final int nameLength = XimTools.checkLength(
                    XimTools.readInt(in, "property name length"), "property name");
            final String name = XimPropertyValue.decodeString(XimTools.readBytes(in, nameLength, "property name"));
            final int typeCode = XimTools.readInt(in, "type of property \"" + name + "\"");
            final XimPropertyType type = XimPropertyType.fromCode(typeCode).orElseThrow(
                    () -> new UnsupportedXimPropertyException("Unknown type " + typeCode +
                            " of XIM property \"" + name + "\" (property #" + index + ")", typeCode));
            final XimPropertyValue value = type.readPayload(in);
            LOG.log(System.Logger.Level.TRACE, () -> "Reading XIM property %s (%s): %s".formatted(
                    name, type.prettyName(), value.toJson()));
            if (result.map.containsKey(name)) {
                LOG.log(System.Logger.Level.DEBUG, () -> "Duplicate XIM property " + name + " is overwritten");
            }
            result.map.put(name, value);
        }
        return result;
    }

    /**
     * Writes the number of properties and all records at the current stream position.
     *
     * @param out output stream.
     * @throws IOException in the case of any I/O errors.
     */
    public void write(DataHandle<?> out) throws IOException {
        Objects.requireNonNull(out, "Null output stream");
        out.writeInt(map.size());
        for (Map.Entry<String, XimPropertyValue> e : map.entrySet()) {
            final byte[] name = XimPropertyValue.encodeString(e.getKey());
            final XimPropertyValue value = e.getValue();
            out.writeInt(name.length);
            out.write(name);
            out.writeInt(value.type().code());
            value.writePayload(out);
        }
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public boolean containsKey(String name) {
        return map.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(map.keySet());
    }

    public Map<String, XimPropertyValue> map() {
        return Collections.unmodifiableMap(map);
    }

    public Optional<XimPropertyValue> get(String name) {
        Objects.requireNonNull(name, "Null property name");
        return Optional.ofNullable(map.get(name));
    }

    public XimProperties put(String name, XimPropertyValue value) {
        Objects.requireNonNull(name, "Null property name");
        Objects.requireNonNull(value, "Null value of property " + name);
        map.put(name, value);
        return this;
    }

    public XimProperties putInt(String name, int value) {
        return put(name, new XimPropertyValue.IntValue(value));
    }

    public XimProperties putDouble(String name, double value) {
        return put(name, new XimPropertyValue.DoubleValue(value));
    }

    public XimProperties putString(String name, String value) {
        return put(name, new XimPropertyValue.StringValue(value));
    }

    public XimProperties putDoubles(String name, double... values) {
        return put(name, new XimPropertyValue.DoubleArrayValue(values.clone()));
    }

    public XimProperties putInts(String name, int... values) {
        return put(name, new XimPropertyValue.IntArrayValue(values.clone()));
    }

    public XimPropertyValue remove(String name) {
        Objects.requireNonNull(name, "Null property name");
        return map.remove(name);
    }

    public OptionalInt optInt(String name) {
        return get(name).filter(v -> v instanceof XimPropertyValue.IntValue)
                .map(v -> OptionalInt.of(((XimPropertyValue.IntValue) v).value()))
                .orElse(OptionalInt.empty());
    }

    /**
     * Returns the numeric value of the property: both {@link XimPropertyType#DOUBLE} and
     * {@link XimPropertyType#INT} properties are accepted.
     *
     * @param name property name.
     * @return its value or empty result if there is no such numeric property.
     */
    public OptionalDouble optDouble(String name) {
        final XimPropertyValue value = map.get(Objects.requireNonNull(name, "Null property name"));
        if (value instanceof XimPropertyValue.DoubleValue v) {
            return OptionalDouble.of(v.value());
        }
        if (value instanceof XimPropertyValue.IntValue v) {
            return OptionalDouble.of(v.value());
        }
        return OptionalDouble.empty();
    }

    public Optional<String> optString(String name) {
        return get(name).filter(v -> v instanceof XimPropertyValue.StringValue)
                .map(v -> ((XimPropertyValue.StringValue) v).value());
    }

    public int reqInt(String name) throws XimException {
        return optInt(name).orElseThrow(() -> missing(name, XimPropertyType.INT));
    }

    public double reqDouble(String name) throws XimException {
        return optDouble(name).orElseThrow(() -> missing(name, XimPropertyType.DOUBLE));
    }

    public String reqString(String name) throws XimException {
        return optString(name).orElseThrow(() -> missing(name, XimPropertyType.STRING));
    }

    @Override
    public String toString() {
        return toString(StringFormat.BRIEF);
    }

    public String toString(StringFormat format) {
        Objects.requireNonNull(format, "Null format");
        return switch (format) {
            case BRIEF -> "XIM properties (" + map.size() + " entries)";
            case NORMAL -> {
                final StringBuilder sb = new StringBuilder();
                sb.append("XIM properties (").append(map.size()).append(" entries):");
                map.forEach((name, value) -> sb.append("%n    %s [%s] = %s".formatted(
                        name, value.type().prettyName(), value.toText())));
                yield sb.toString();
            }
            case JSON -> {
                final StringBuilder sb = new StringBuilder("{");
                for (Iterator<Map.Entry<String, XimPropertyValue>> iterator = map.entrySet().iterator();
                     iterator.hasNext(); ) {
                    final Map.Entry<String, XimPropertyValue> entry = iterator.next();
                    sb.append("\n  \"").append(XimTools.escapeJsonString(entry.getKey())).append("\" : ");
                    sb.append(entry.getValue().toJson());
                    if (iterator.hasNext()) {
                        sb.append(",");
                    }
                }
                sb.append(map.isEmpty() ? "}" : "\n}");
                yield sb.toString();
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof XimProperties that && map.equals(that.map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    private XimException missing(String name, XimPropertyType type) {
        return new XimException("XIM property \"" + name + "\" of type " + type.prettyName() +
                (map.containsKey(name) ? " has another type " + map.get(name).type().prettyName() : " is missing"));
    }
}
