/*
 * Image-Batch - Batch Image Processing
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.image.batch;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Random;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build small image trees under a temporary directory. */
public abstract class ImageTestBase {
    @TempDir protected Path tempDir;

    // ── Directory helpers ───────────────────────────────────────────

    /** Returns {tempDir}/{name}/, creating it if needed. */
    protected final Path dir(String name) {
        Path dir = tempDir.resolve(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test dir: " + dir, e);
        }
        return dir;
    }

    // ── Image creation ──────────────────────────────────────────────

    /** Solid-color RGB image. */
    protected static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    /** Image with the red channel set per pixel by {@code redAt}, green and blue at 128. */
    protected static BufferedImage withRed(int width, int height, RedChannel redAt) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int red = redAt.valueAt(x, y) & 0xFF;
                image.setRGB(x, y, (red << 16) | (128 << 8) | 128);
            }
        }
        return image;
    }

    @FunctionalInterface
    protected interface RedChannel {
        int valueAt(int x, int y);
    }

    /** Noisy image, so PNG output sizes depend strongly on the deflate level. */
    protected static BufferedImage pattern(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(42);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int v = (x / 4 + y / 4) % 2 == 0 ? 40 : 200;
                image.setRGB(x, y, (v << 16) | ((v + random.nextInt(3)) << 8) | v);
            }
        }
        return image;
    }

    /** Writes a PNG with deflate disabled, so recompressing it always saves space. */
    protected static Path writeUncompressedPng(Path file, BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(1.0f);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (ImageOutputStream out = ImageIO.createImageOutputStream(buffer)) {
                writer.setOutput(out);
                writer.write(null, new IIOImage(image, null, null), param);
            }
            Files.write(file, buffer.toByteArray());
        } finally {
            writer.dispose();
        }
        return file;
    }

    /** Writes {@code image} with the default ImageIO writer for {@code formatName}. */
    protected static Path writeImage(Path file, BufferedImage image, String formatName)
            throws IOException {
        if (!ImageIO.write(image, formatName, file.toFile())) {
            throw new IOException("No ImageIO writer for " + formatName);
        }
        return file;
    }

    protected static Path writePng(Path file, BufferedImage image) throws IOException {
        return writeImage(file, image, "png");
    }

    /** Writes an uncompressed 24-bit true-color TGA with a top-left origin. */
    protected static Path writeTga(Path file, BufferedImage image) throws IOException {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] data = new byte[18 + width * height * 3];
        data[2] = 2; // uncompressed true-color
        data[12] = (byte) (width & 0xFF);
        data[13] = (byte) (width >> 8);
        data[14] = (byte) (height & 0xFF);
        data[15] = (byte) (height >> 8);
        data[16] = 24;
        data[17] = 0x20; // top-left origin
        int i = 18;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                data[i++] = (byte) (rgb & 0xFF);
                data[i++] = (byte) ((rgb >> 8) & 0xFF);
                data[i++] = (byte) ((rgb >> 16) & 0xFF);
            }
        }
        Files.write(file, data);
        return file;
    }

    /** Writes bytes that no image reader accepts. */
    protected static Path writeCorrupt(Path file) throws IOException {
        Files.writeString(file, "this is not an image");
        return file;
    }
}
