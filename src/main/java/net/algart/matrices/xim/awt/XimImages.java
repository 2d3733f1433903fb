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

package net.algart.matrices.xim.awt;

import net.algart.matrices.xim.XimImage;
import net.algart.matrices.xim.XimPropertyValue;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferUShort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Conversion of XIM images into AWT <code>BufferedImage</code> and saving them in standard formats.
 */
public class XimImages {
    /**
     * Maximal length of PNG textual keyword.
     */
    public static final int MAX_PNG_KEYWORD_LENGTH = 79;

    private static final String STANDARD_METADATA_FORMAT = "javax_imageio_1.0";

    private static final System.Logger LOG = System.getLogger(XimImages.class.getName());

    private XimImages() {
    }

    /**
     * Returns 16-bit grayscale image with the pixels of the given XIM image;
     * pixel values are clamped to 0..65535 range.
     *
     * @param image XIM image with pixels.
     * @return new <code>BufferedImage</code> of <code>TYPE_USHORT_GRAY</code> type.
     * @throws IllegalStateException if the image has no pixels.
     */
    public static BufferedImage toBufferedImage(XimImage image) {
        Objects.requireNonNull(image, "Null image");
        final int[] pixels = image.pixels();
        if (image.width() == 0 || image.height() == 0) {
            throw new IllegalArgumentException("Cannot convert empty " + image + " into BufferedImage");
        }
        final BufferedImage result = new BufferedImage(
                image.width(), image.height(), BufferedImage.TYPE_USHORT_GRAY);
        final short[] data = ((DataBufferUShort) result.getRaster().getDataBuffer()).getData();
        for (int k = 0; k < pixels.length; k++) {
            final int v = pixels[k];
            data[k] = (short) (v < 0 ? 0 : Math.min(v, 0xFFFF));
        }
        return result;
    }

    /**
     * Saves the image in the given format via <code>ImageIO</code>.
     * For PNG format, this method is equivalent to {@link #writePng(XimImage, Path)};
     * other formats are written without metadata.
     *
     * @param image      XIM image with pixels.
     * @param file       result file.
     * @param formatName format name like "png" or "tiff".
     * @throws IOException in the case of I/O errors or if there is no writer for this format.
     */
    public static void write(XimImage image, Path file, String formatName) throws IOException {
        Objects.requireNonNull(image, "Null image");
        Objects.requireNonNull(file, "Null file");
        Objects.requireNonNull(formatName, "Null format name");
        if (formatName.toLowerCase(Locale.ROOT).equals("png")) {
            writePng(image, file);
            return;
        }
        final BufferedImage bufferedImage = toBufferedImage(image);
        Files.deleteIfExists(file);
        if (!ImageIO.write(bufferedImage, formatName, file.toFile())) {
            throw new IIOException("Cannot write " + file + ": no registered writer for format " + formatName);
        }
    }

    /**
     * Saves the image in PNG format. Every XIM property is stored as tEXt entry:
     * strings as-is, other values in JSON.
     *
     * @param image XIM image with pixels.
     * @param file  result file.
     * @throws IOException in the case of any I/O errors.
     */
    public static void writePng(XimImage image, Path file) throws IOException {
        Objects.requireNonNull(image, "Null image");
        Objects.requireNonNull(file, "Null file");
        final BufferedImage bufferedImage = toBufferedImage(image);
        final ImageWriter writer = getPngWriter();
        Files.deleteIfExists(file);
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(file.toFile())) {
            if (ios == null) {
                throw new IIOException("Cannot create output stream for " + file);
            }
            writer.setOutput(ios);
            final ImageWriteParam writeParam = writer.getDefaultWriteParam();
            final IIOMetadata metadata = writer.getDefaultImageMetadata(
                    new ImageTypeSpecifier(bufferedImage), writeParam);
            metadata.mergeTree(STANDARD_METADATA_FORMAT, textTree(image));
            writer.write(null, new IIOImage(bufferedImage, null, metadata), writeParam);
        } finally {
            writer.dispose();
        }
    }

    /**
     * Reads all textual entries (tEXt, zTXt, iTXt) from PNG file.
     *
     * @param file PNG file.
     * @return keyword/value pairs in the file order.
     * @throws IOException in the case of any I/O errors.
     */
    public static Map<String, String> readPngText(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        final Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("png");
        if (!readers.hasNext()) {
            throw new IIOException("Cannot read PNG: no registered reader");
        }
        final ImageReader reader = readers.next();
        try (ImageInputStream iis = ImageIO.createImageInputStream(file.toFile())) {
            if (iis == null) {
                throw new IIOException("Cannot create input stream for " + file);
            }
            reader.setInput(iis);
            final IIOMetadata metadata = reader.getImageMetadata(0);
            final Map<String, String> result = new LinkedHashMap<>();
            final Node tree = metadata.getAsTree(STANDARD_METADATA_FORMAT);
            final NodeList rootNodes = tree.getChildNodes();
            for (int k = 0, n = rootNodes.getLength(); k < n; k++) {
                final Node rootChild = rootNodes.item(k);
                if (!"Text".equals(rootChild.getNodeName())) {
                    continue;
                }
                final NodeList entries = rootChild.getChildNodes();
                for (int i = 0, m = entries.getLength(); i < m; i++) {
                    final IIOMetadataNode entry = (IIOMetadataNode) entries.item(i);
                    if ("TextEntry".equals(entry.getNodeName())) {
                        result.put(entry.getAttribute("keyword"), entry.getAttribute("value"));
                    }
                }
            }
            return result;
        } finally {
            reader.dispose();
        }
    }

    public static ImageWriter getPngWriter() throws IIOException {
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IIOException("Cannot write PNG: no registered writer");
        }
        return writers.next();
    }

    private static IIOMetadataNode textTree(XimImage image) {
        final IIOMetadataNode text = new IIOMetadataNode("Text");
        for (Map.Entry<String, XimPropertyValue> e : image.properties().map().entrySet()) {
            final IIOMetadataNode entry = new IIOMetadataNode("TextEntry");
            entry.setAttribute("keyword", pngKeyword(e.getKey()));
            entry.setAttribute("value", e.getValue().toText());
            entry.setAttribute("compression", "none");
            text.appendChild(entry);
        }
        final IIOMetadataNode root = new IIOMetadataNode(STANDARD_METADATA_FORMAT);
        root.appendChild(text);
        return root;
    }

    private static String pngKeyword(String name) {
        if (name.length() <= MAX_PNG_KEYWORD_LENGTH) {
            return name;
        }
        final String result = name.substring(0, MAX_PNG_KEYWORD_LENGTH);
        LOG.log(System.Logger.Level.WARNING, ("XIM property name \"%s\" is too long for PNG keyword, " +
                "truncated to \"%s\"").formatted(name, result));
        return result;
    }
}
