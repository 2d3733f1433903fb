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

import org.junit.jupiter.api.Test;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.Location;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XimPropertiesTest {
    static final class TableBuilder {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private int count = 0;

        TableBuilder name(String name, int type) {
            count++;
            final byte[] bytes = name.getBytes(StandardCharsets.ISO_8859_1);
            putInt(bytes.length);
            out.writeBytes(bytes);
            putInt(type);
            return this;
        }

        TableBuilder putInt(int value) {
            out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
            return this;
        }

        TableBuilder putDouble(double value) {
            out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putDouble(value).array());
            return this;
        }

        TableBuilder putBytes(byte[] bytes) {
            out.writeBytes(bytes);
            return this;
        }

        byte[] build() {
            final byte[] records = out.toByteArray();
            return ByteBuffer.allocate(4 + records.length).order(ByteOrder.LITTLE_ENDIAN)
                    .putInt(count).put(records).array();
        }
    }

    @Test
    public void testAllTypes() throws IOException {
        final byte[] bytes = new TableBuilder()
                .name("GantryRtn", 0).putInt(180)
                .name("KVSourceRtn", 1).putDouble(90.5)
                .name("PixelUnit", 2).putInt(5).putBytes("cGy\0\0".getBytes(StandardCharsets.ISO_8859_1))
                .name("MVCollimatorRtn", 4).putInt(16).putDouble(-1.5).putDouble(2.25)
                .name("Energies", 5).putInt(12).putInt(6).putInt(10).putInt(15)
                .build();
        final DataHandle<Location> in = XimIO.getBytesHandle(bytes);
        final XimProperties properties = XimProperties.read(in);
        assertEquals(bytes.length, in.offset());
        assertEquals(List.of("GantryRtn", "KVSourceRtn", "PixelUnit", "MVCollimatorRtn", "Energies"),
                List.copyOf(properties.names()));
        assertEquals(180, properties.reqInt("GantryRtn"));
        assertEquals(90.5, properties.reqDouble("KVSourceRtn"));
        assertEquals(180.0, properties.reqDouble("GantryRtn"));
        assertEquals("cGy", properties.reqString("PixelUnit"));
        assertEquals(new XimPropertyValue.DoubleArrayValue(new double[]{-1.5, 2.25}),
                properties.get("MVCollimatorRtn").orElseThrow());
        assertEquals(new XimPropertyValue.IntArrayValue(new int[]{6, 10, 15}),
                properties.get("Energies").orElseThrow());
        assertEquals(XimPropertyType.INT_ARRAY, properties.get("Energies").orElseThrow().type());
        assertTrue(properties.optInt("KVSourceRtn").isEmpty());
        assertThrows(XimException.class, () -> properties.reqString("GantryRtn"));
        assertThrows(XimException.class, () -> properties.reqInt("Missing"));
    }

    @Test
    public void testUnknownType() {
        final byte[] bytes = new TableBuilder()
                .name("A", 0).putInt(1)
                .name("Strange", 3).putInt(1)
                .build();
        final UnsupportedXimPropertyException e = assertThrows(UnsupportedXimPropertyException.class,
                () -> XimProperties.read(XimIO.getBytesHandle(bytes)));
        assertEquals(3, e.typeCode());
        assertTrue(e.getMessage().contains("Strange"), e.getMessage());
    }

    @Test
    public void testDuplicateNameLastWins() throws IOException {
        final byte[] bytes = new TableBuilder()
                .name("A", 0).putInt(1)
                .name("B", 0).putInt(2)
                .name("A", 1).putDouble(3.0)
                .build();
        final XimProperties properties = XimProperties.read(XimIO.getBytesHandle(bytes));
        assertEquals(2, properties.size());
        assertEquals(3.0, properties.reqDouble("A"));
        assertTrue(properties.optInt("A").isEmpty());
        assertEquals(List.of("A", "B"), List.copyOf(properties.names()));
    }

    @Test
    public void testIncompleteArrayElementIsSkipped() throws IOException {
        final byte[] bytes = new TableBuilder()
                .name("Ints", 5).putInt(6).putInt(77).putBytes(new byte[]{9, 9})
                .name("Next", 0).putInt(5)
                .build();
        final XimProperties properties = XimProperties.read(XimIO.getBytesHandle(bytes));
        assertEquals(new XimPropertyValue.IntArrayValue(new int[]{77}), properties.get("Ints").orElseThrow());
        assertEquals(5, properties.reqInt("Next"));
    }

    @Test
    public void testTruncated() {
        final byte[] bytes = new TableBuilder()
                .name("Doubles", 4).putInt(24).putDouble(1.0).putDouble(2.0)
                .build();
        assertThrows(TruncatedXimException.class, () -> XimProperties.read(XimIO.getBytesHandle(bytes)));
        assertThrows(TruncatedXimException.class, () -> XimProperties.read(XimIO.getBytesHandle(new byte[2])));
    }

    @Test
    public void testInvalidCount() {
        final byte[] withNegativeCount = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(-5).array();
        assertThrows(XimException.class, () -> XimProperties.read(XimIO.getBytesHandle(withNegativeCount)));
    }

    @Test
    public void testWriteAndRead() throws IOException {
        final XimProperties properties = new XimProperties()
                .putInt("I", -3)
                .putDouble("D", Math.PI)
                .putString("S", "Varian \"TrueBeam\"")
                .putDoubles("DA", 1.0, 2.0, 3.0)
                .putInts("IA")
                .putString("Empty", "");
        try (DataHandle<Location> buffer = XimIO.getBytesHandle(new BytesLocation(0))) {
            properties.write(buffer);
            buffer.seek(0);
            assertEquals(properties, XimProperties.read(buffer));
        }
    }

    @Test
    public void testStringFormats() {
        final XimProperties properties = new XimProperties()
                .putInt("I", 1)
                .putString("S", "a\"b")
                .putDoubles("DA", 0.5, 1.5);
        assertEquals("XIM properties (3 entries)", properties.toString());
        final String json = properties.toString(XimProperties.StringFormat.JSON);
        assertEquals("{\n  \"I\" : 1,\n  \"S\" : \"a\\\"b\",\n  \"DA\" : [0.5, 1.5]\n}", json);
        assertEquals("{}", new XimProperties().toString(XimProperties.StringFormat.JSON));
        assertTrue(properties.toString(XimProperties.StringFormat.NORMAL).contains("S [string] = a\"b"));
    }

    @Test
    public void testNonLatin1StringsAreRejected() throws IOException {
        assertEquals("caf\u00E9", new XimPropertyValue.StringValue("caf\u00E9").value());
        assertThrows(IllegalArgumentException.class, () -> new XimPropertyValue.StringValue("\u0416"));
        assertThrows(IllegalArgumentException.class, () -> new XimProperties().putString("S", "a\u20ACb"));
        final XimProperties properties = new XimProperties().putInt("\u03B1", 1);
        try (DataHandle<Location> out = XimIO.getBytesHandle(new BytesLocation(0))) {
            assertThrows(IllegalArgumentException.class, () -> properties.write(out));
        }
    }

    @Test
    public void testArrayValuesAreNotShared() {
        final double[] doubles = {1.0, 2.0};
        final XimPropertyValue.DoubleArrayValue doubleValue = new XimPropertyValue.DoubleArrayValue(doubles);
        doubles[0] = 100.0;
        doubleValue.value()[1] = 200.0;
        assertArrayEquals(new double[]{1.0, 2.0}, doubleValue.value());

        final int[] ints = {1, 2};
        final XimPropertyValue.IntArrayValue intValue = new XimPropertyValue.IntArrayValue(ints);
        ints[0] = 100;
        intValue.value()[1] = 200;
        assertArrayEquals(new int[]{1, 2}, intValue.value());
        assertEquals(new XimPropertyValue.IntArrayValue(new int[]{1, 2}), intValue);
    }

    @Test
    public void testDoubleJson() {
        assertEquals("10000000000.0", new XimPropertyValue.DoubleValue(1e10).toJson());
        assertEquals("[0.5, -1e+16, 1.5e-05]",
                new XimPropertyValue.DoubleArrayValue(new double[]{0.5, -1e16, 1.5e-5}).toJson());
        assertEquals("90.0", XimTools.formatJsonDouble(90.0));
        assertEquals("0.0001", XimTools.formatJsonDouble(0.0001));
        assertEquals("-2.5", XimTools.formatJsonDouble(-2.5));
        assertEquals("1000000000000000.0", XimTools.formatJsonDouble(1e15));
        assertEquals("1.2345e+20", XimTools.formatJsonDouble(1.2345e20));
        assertEquals("0.0", XimTools.formatJsonDouble(0.0));
        assertEquals("NaN", XimTools.formatJsonDouble(Double.NaN));
        assertEquals("-Infinity", XimTools.formatJsonDouble(Double.NEGATIVE_INFINITY));
    }
}
