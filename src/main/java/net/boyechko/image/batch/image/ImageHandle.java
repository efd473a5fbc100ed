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
package net.boyechko.image.batch.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive, mutable view of one image file while its actions run.
 *
 * <p>A handle is opened by the batch for a single file and handed to each action in turn. It is
 * never shared between files or threads. When an action rewrites the file through {@link
 * #replaceContent(byte[])}, the decoded raster is dropped and re-read from the new bytes, so the
 * next action sees what was written.
 */
public final class ImageHandle {
    private static final Logger logger = LoggerFactory.getLogger(ImageHandle.class);

    private final Path path;
    private final ImageFormat format;
    private byte[] bytes;
    private BufferedImage image;
    private int revision;

    private ImageHandle(Path path, ImageFormat format, byte[] bytes, BufferedImage image) {
        this.path = path;
        this.format = format;
        this.bytes = bytes;
        this.image = image;
    }

    /**
     * Reads and decodes the file at {@code path}.
     *
     * @throws ImageOpenException if the file is missing, unreadable, of an unknown format, or
     *     cannot be decoded by any registered ImageIO reader
     */
    public static ImageHandle open(Path path) throws ImageOpenException {
        Objects.requireNonNull(path, "path");
        ImageFormat format =
                ImageFormat.fromPath(path)
                        .orElseThrow(
                                () ->
                                        new ImageOpenException(
                                                path,
                                                "Unsupported image format: "
                                                        + ImageFormat.extensionOf(path)));
        if (!Files.isRegularFile(path)) {
            throw new ImageOpenException(path, "File not found: " + path);
        }

        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageOpenException(path, "Failed to read " + path + ": " + e.getMessage(), e);
        }

        BufferedImage decoded = decode(path, data);
        logger.debug(
                "Opened {} ({}, {}x{}, {} bytes)",
                path,
                format,
                decoded.getWidth(),
                decoded.getHeight(),
                data.length);
        return new ImageHandle(path, format, data, decoded);
    }

    private static BufferedImage decode(Path path, byte[] data) throws ImageOpenException {
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(data));
            if (decoded == null) {
                throw new ImageOpenException(path, "No image reader could decode " + path);
            }
            return decoded;
        } catch (IOException | RuntimeException e) {
            throw new ImageOpenException(
                    path, "Failed to decode " + path + ": " + e.getMessage(), e);
        }
    }

    public Path path() {
        return path;
    }

    public ImageFormat format() {
        return format;
    }

    /** Returns a copy of the current file content. */
    public byte[] bytes() {
        return bytes.clone();
    }

    public long size() {
        return bytes.length;
    }

    /** Number of times the file has been rewritten through this handle. */
    public int revision() {
        return revision;
    }

    public boolean isModified() {
        return revision > 0;
    }

    /** Returns the decoded raster of the current content. */
    public BufferedImage image() throws IOException {
        if (image == null) {
            try {
                image = decode(path, bytes);
            } catch (ImageOpenException e) {
                throw new IOException(e.getMessage(), e);
            }
        }
        return image;
    }

    public int width() throws IOException {
        return image().getWidth();
    }

    public int height() throws IOException {
        return image().getHeight();
    }

    /** Returns true if the file on disk may be rewritten. */
    public boolean isWritable() {
        return Files.isWritable(path);
    }

    /**
     * Rewrites the file with {@code newContent}. The content is written next to the file first and
     * then moved over it, so a failed write leaves the original untouched.
     *
     * @throws IOException if the file is read-only or the write fails
     */
    public void replaceContent(byte[] newContent) throws IOException {
        Objects.requireNonNull(newContent, "newContent");
        if (!isWritable()) {
            throw new IOException("File is read-only: " + path);
        }

        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(temp, newContent);
        try {
            Files.move(
                    temp,
                    path,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }

        logger.debug("Rewrote {} ({} -> {} bytes)", path, bytes.length, newContent.length);
        bytes = newContent.clone();
        image = null;
        revision++;
    }

    @Override
    public String toString() {
        return "ImageHandle[" + path + ", " + format + ", rev " + revision + "]";
    }
}
