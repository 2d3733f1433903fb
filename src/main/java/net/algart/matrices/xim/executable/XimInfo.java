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

package net.algart.matrices.xim.executable;

import net.algart.matrices.xim.XimImage;
import net.algart.matrices.xim.XimProperties;
import net.algart.matrices.xim.XimReader;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

public class XimInfo {
    private XimProperties.StringFormat stringFormat = XimProperties.StringFormat.NORMAL;
    private boolean decodePixels = true;

    public static void main(String[] args) {
        final XimInfo info = new XimInfo();
        int startArgIndex = 0;
        if (args.length > startArgIndex && args[startArgIndex].equalsIgnoreCase("-json")) {
            info.stringFormat = XimProperties.StringFormat.JSON;
            startArgIndex++;
        }
        if (args.length > startArgIndex && args[startArgIndex].equalsIgnoreCase("-nopixels")) {
            info.decodePixels = false;
            startArgIndex++;
        }
        if (args.length < startArgIndex + 1) {
            System.out.println("Usage:");
            System.out.println("    " + XimInfo.class.getName() + " [-json] [-nopixels] some_file.xim|folder");
            return;
        }
        final Path path = Paths.get(args[startArgIndex]);
        if (Files.isDirectory(path)) {
            final File[] files = path.toFile().listFiles(XimInfo::isPossiblyXim);
            if (files == null) {
                System.err.printf("Cannot list folder %s%n", path);
                return;
            }
            Arrays.sort(files);
            System.out.printf("Testing %d files%n", files.length);
            for (File f : files) {
                info.showXimInfoAndPrintException(f.toPath());
            }
        } else {
            info.showXimInfoAndPrintException(path);
        }
    }

    public XimProperties.StringFormat getStringFormat() {
        return stringFormat;
    }

    public XimInfo setStringFormat(XimProperties.StringFormat stringFormat) {
        this.stringFormat = stringFormat;
        return this;
    }

    public boolean isDecodePixels() {
        return decodePixels;
    }

    public XimInfo setDecodePixels(boolean decodePixels) {
        this.decodePixels = decodePixels;
        return this;
    }

    public String ximInformation(Path ximFile) throws IOException {
        final long t1 = System.nanoTime();
        final XimImage image = XimReader.readImage(ximFile, decodePixels);
        final long t2 = System.nanoTime();
        final StringBuilder sb = new StringBuilder();
        sb.append("File %s: %dx%d, version %d, %d bits per pixel, %d bytes per pixel, %s%n".formatted(
                ximFile, image.width(), image.height(), image.formatVersion(),
                image.bitsPerPixel(), image.bytesPerPixel(),
                image.isCompressed() ? "compressed" : "uncompressed"));
        if (image.hasPixels()) {
            sb.append(pixelsInformation(image.pixels())).append("%n".formatted());
        }
        sb.append("Histogram: %d bins%n".formatted(image.histogram().length));
        sb.append("Properties (%d):%s%s%n".formatted(
                image.properties().size(),
                stringFormat.isJson() ? "%n".formatted() : " ",
                image.properties().toString(stringFormat)));
        sb.append(String.format(Locale.US, "Read in %.3f ms", (t2 - t1) * 1e-6));
        return sb.toString();
    }

    private void showXimInfoAndPrintException(Path ximFile) {
        try {
            System.out.println(ximInformation(ximFile));
            System.out.println();
        } catch (IOException e) {
            System.err.printf("%nFile %s is invalid:%n  %s%n", ximFile, e.getMessage());
        }
    }

    private static String pixelsInformation(int[] pixels) {
        if (pixels.length == 0) {
            return "No pixels";
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        double sum = 0.0;
        for (int v : pixels) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        return String.format(Locale.US, "Pixels: min %d, max %d, mean %.3f", min, max, sum / pixels.length);
    }

    private static boolean isPossiblyXim(File file) {
        return file.isFile() && file.getName().toLowerCase(Locale.ROOT).endsWith(".xim");
    }
}
