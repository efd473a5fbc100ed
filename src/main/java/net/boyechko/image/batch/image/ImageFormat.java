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

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Image file formats the batch knows how to open. */
public enum ImageFormat {
    PNG("png", List.of("png")),
    JPEG("jpeg", List.of("jpg", "jpeg")),
    TGA("tga", List.of("tga")),
    BMP("bmp", List.of("bmp"));

    private final String imageIoName;
    private final List<String> extensions;

    ImageFormat(String imageIoName, List<String> extensions) {
        this.imageIoName = imageIoName;
        this.extensions = extensions;
    }

    /** Format name understood by {@link javax.imageio.ImageIO} writers. */
    public String imageIoName() {
        return imageIoName;
    }

    /** Lower-case file extensions, without the dot. */
    public List<String> extensions() {
        return extensions;
    }

    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (ImageFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static Optional<ImageFormat> fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    /** Returns the extension of the file name without the dot, or an empty string. */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
