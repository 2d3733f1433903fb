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
import net.algart.matrices.xim.XimReader;
import net.algart.matrices.xim.gamma.GammaIndex;
import net.algart.matrices.xim.gamma.GammaMap;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class XimGamma {
    public static void main(String[] args) throws IOException {
        doMain(args, true);
    }

    static boolean doMain(String[] args, boolean printUsage) throws IOException {
        final GammaIndex gammaIndex = new GammaIndex();
        int startArgIndex = 0;
        while (args.length > startArgIndex && args[startArgIndex].startsWith("-")) {
            final String option = args[startArgIndex].toLowerCase(Locale.ROOT);
            if (option.equals("-local")) {
                gammaIndex.setGlobalDose(false);
            } else if (option.equals("-parallel")) {
                gammaIndex.setMultithreading(true);
            } else if (option.startsWith("-dose=")) {
                gammaIndex.setDoseToAgreement(Double.parseDouble(valueOf(option)));
            } else if (option.startsWith("-distance=")) {
                gammaIndex.setDistanceToAgreement(Integer.parseInt(valueOf(option)));
            } else if (option.startsWith("-threshold=")) {
                gammaIndex.setDoseThreshold(Double.parseDouble(valueOf(option)));
            } else if (option.startsWith("-cap=")) {
                gammaIndex.setGammaCapValue(Double.parseDouble(valueOf(option)));
            } else {
                throw new IllegalArgumentException("Unknown option " + args[startArgIndex]);
            }
            startArgIndex++;
        }
        if (args.length < startArgIndex + 2) {
            if (printUsage) {
                System.out.println("Usage:");
                System.out.printf("    %s [-dose=1] [-distance=1] [-threshold=5] [-cap=2] [-local] [-parallel] " +
                        "reference.xim evaluation.xim%n", XimGamma.class.getName());
            }
            return false;
        }
        final Path referenceFile = Paths.get(args[startArgIndex]);
        final Path evaluationFile = Paths.get(args[startArgIndex + 1]);

        long t1 = System.nanoTime();
        final XimImage reference = XimReader.readImage(referenceFile);
        final XimImage evaluation = XimReader.readImage(evaluationFile);
        long t2 = System.nanoTime();
        final GammaMap gamma = gammaIndex.compute(reference.asMatrix(), evaluation.asMatrix());
        long t3 = System.nanoTime();

        System.out.printf("%s%n%s%n", gammaIndex, gamma);
        System.out.printf(Locale.US, "Mean gamma: %.5f%n", gamma.mean());
        System.out.printf(Locale.US, "Median gamma: %.5f%n", gamma.median());
        System.out.printf(Locale.US, "Max gamma: %.5f%n", gamma.max());
        System.out.printf(Locale.US, "Pass rate: %.3f%%%n", gamma.passRate());
        System.out.printf(Locale.US, "%.3f seconds reading XIM, %.3f seconds calculating gamma%n",
                (t2 - t1) * 1e-9, (t3 - t2) * 1e-9);
        return true;
    }

    private static String valueOf(String option) {
        return option.substring(option.indexOf('=') + 1);
    }
}
