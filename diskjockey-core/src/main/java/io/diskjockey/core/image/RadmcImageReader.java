package io.diskjockey.core.image;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringTokenizer;

/// Reads the RADMC-3D `image.out` format (format number 1).
///
/// ```text
/// 1                        format number
/// nx ny                    pixel counts
/// nlam                     number of wavelengths
/// pixsize_x pixsize_y      pixel size in cm
/// lam_1 ... lam_nlam       wavelengths in microns
/// I(1,1,1) I(2,1,1) ...    intensities, x fastest, then y, then wavelength
/// ```
///
/// Any failure to read the file, whether missing, truncated or malformed, is
/// reported as an [ImageException].
public final class RadmcImageReader {

    /// File name the simulator writes into its working directory.
    public static final String IMAGE_FILE = "image.out";

    private static final int FORMAT = 1;

    private RadmcImageReader() {
    }

    /// Reads `image.out` from a simulator working directory.
    public static SynthesizedImage readFrom(Path directory) throws ImageException {
        return read(directory.resolve(IMAGE_FILE));
    }

    /// Reads `image.out` from a simulator working directory, requiring a
    /// square `npix` image with `channels` wavelengths.
    public static SynthesizedImage readFrom(Path directory, int npix, int channels) throws ImageException {
        return read(directory.resolve(IMAGE_FILE), npix, channels);
    }

    /// Reads an image file.
    ///
    /// @param path the image file
    /// @return the parsed image
    /// @throws ImageException if the file cannot be read or is incomplete
    public static SynthesizedImage read(Path path) throws ImageException {
        return read(path, 0, 0);
    }

    /// Reads an image file whose header must declare `npix` x `npix` pixels
    /// and `channels` wavelengths. The header is checked before any pixel
    /// storage is allocated. A non-positive expectation is not checked.
    ///
    /// @throws ImageException if the file cannot be read, is incomplete or
    ///     has other dimensions
    public static SynthesizedImage read(Path path, int npix, int channels) throws ImageException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII)) {
            Tokens tokens = new Tokens(reader);
            int format = tokens.nextInt();
            if (format != FORMAT) {
                throw new ImageException("Unsupported image format " + format + " in " + path);
            }
            int nx = tokens.nextInt();
            int ny = tokens.nextInt();
            int nlam = tokens.nextInt();
            if (nx <= 0 || ny <= 0 || nlam <= 0) {
                throw new ImageException("Invalid image dimensions " + nx + "x" + ny + "x" + nlam + " in " + path);
            }
            if ((npix > 0 && (nx != npix || ny != npix)) || (channels > 0 && nlam != channels)) {
                throw new ImageException("Synthesized image " + path + " is " + nlam + "x" + ny + "x" + nx
                    + ", expected " + channels + " channels of " + npix + "x" + npix + " pixels");
            }
            double pixsizeX = tokens.nextDouble();
            double pixsizeY = tokens.nextDouble();
            double[] lams = new double[nlam];
            for (int k = 0; k < nlam; k++) {
                lams[k] = tokens.nextDouble();
            }
            double[][][] data = new double[nlam][ny][nx];
            for (int k = 0; k < nlam; k++) {
                for (int j = 0; j < ny; j++) {
                    for (int i = 0; i < nx; i++) {
                        data[k][j][i] = tokens.nextDouble();
                    }
                }
            }
            return new SynthesizedImage(data, pixsizeX, pixsizeY, lams);
        } catch (IOException | NumberFormatException e) {
            throw new ImageException("Failed to read synthesized image " + path + ": " + e, e);
        }
    }

    private static final class Tokens {
        private final BufferedReader reader;
        private StringTokenizer current;

        Tokens(BufferedReader reader) {
            this.reader = reader;
        }

        String next() throws IOException {
            while (current == null || !current.hasMoreTokens()) {
                String line = reader.readLine();
                if (line == null) {
                    throw new IOException("unexpected end of file");
                }
                current = new StringTokenizer(line);
            }
            return current.nextToken();
        }

        int nextInt() throws IOException {
            return Integer.parseInt(next());
        }

        double nextDouble() throws IOException {
            return Double.parseDouble(next());
        }
    }
}
