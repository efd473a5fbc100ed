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
package net.boyechko.image.batch.discovery;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.image.batch.image.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the selected directories and collects the image files whose extension is on the
 * allow-list.
 *
 * <p>Missing or unreadable directories are reported as {@link DiscoveryWarning}s and do not stop
 * the other directories from being searched. Symbolic links are followed; directory cycles are
 * detected by the walker and reported rather than followed, and depth is capped at {@link
 * #MAX_DEPTH}. Results are sorted by path string with duplicates removed, so overlapping
 * selections and repeated runs give identical file lists.
 */
public class FileDiscoverer {
    private static final Logger logger = LoggerFactory.getLogger(FileDiscoverer.class);

    public static final List<String> DEFAULT_EXTENSIONS = List.of("bmp", "png", "tga");
    public static final int MAX_DEPTH = 64;

    private static final Comparator<Path> BY_PATH_STRING = Comparator.comparing(Path::toString);

    private final Set<String> extensions;

    public FileDiscoverer() {
        this(DEFAULT_EXTENSIONS);
    }

    /**
     * @param extensions allow-list of file extensions, without dots; case-insensitive
     * @throws IllegalArgumentException if an extension is not a supported image format
     */
    public FileDiscoverer(Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension is required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String ext : extensions) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) {
                e = e.substring(1);
            }
            if (ImageFormat.fromExtension(e).isEmpty()) {
                throw new IllegalArgumentException("Unsupported image extension: " + ext);
            }
            normalized.add(e);
        }
        this.extensions = Set.copyOf(normalized);
    }

    public Set<String> extensions() {
        return extensions;
    }

    public boolean isCandidate(Path file) {
        return extensions.contains(ImageFormat.extensionOf(file));
    }

    /**
     * Finds the candidate files under {@code directories}.
     *
     * @param recursive when false, only the direct children of each directory are considered
     */
    public DiscoveryResult discover(Collection<Path> directories, boolean recursive) {
        TreeSet<Path> found = new TreeSet<>(BY_PATH_STRING);
        List<DiscoveryWarning> warnings = new ArrayList<>();

        for (Path directory : directories) {
            Path dir = directory.toAbsolutePath().normalize();
            if (!Files.isDirectory(dir)) {
                warn(warnings, dir, "Directory does not exist or is not a directory");
                continue;
            }
            if (!Files.isReadable(dir)) {
                warn(warnings, dir, "Directory is not readable");
                continue;
            }

            int before = found.size();
            if (recursive) {
                walk(dir, found, warnings);
            } else {
                list(dir, found, warnings);
            }
            logger.debug("Found {} candidate files in {}", found.size() - before, dir);
        }

        logger.info(
                "Discovered {} image files in {} directories ({} warnings)",
                found.size(),
                directories.size(),
                warnings.size());
        return new DiscoveryResult(new ArrayList<>(found), warnings);
    }

    private void list(Path dir, Set<Path> found, List<DiscoveryWarning> warnings) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry) && isCandidate(entry)) {
                    found.add(entry.normalize());
                }
            }
        } catch (IOException e) {
            warn(warnings, dir, "Failed to list directory: " + e.getMessage());
        }
    }

    private void walk(Path dir, Set<Path> found, List<DiscoveryWarning> warnings) {
        try {
            Files.walkFileTree(
                    dir,
                    EnumSet.of(FileVisitOption.FOLLOW_LINKS),
                    MAX_DEPTH,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && isCandidate(file)) {
                                found.add(file.normalize());
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException e) {
                            if (e instanceof FileSystemLoopException) {
                                warn(warnings, file, "Symbolic link cycle skipped");
                            } else {
                                warn(warnings, file, "Cannot read: " + e.getMessage());
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(Path subdir, IOException e) {
                            if (e != null) {
                                warn(warnings, subdir, "Cannot list: " + e.getMessage());
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            warn(warnings, dir, "Failed to walk directory: " + e.getMessage());
        }
    }

    private static void warn(List<DiscoveryWarning> warnings, Path path, String message) {
        logger.warn("{}: {}", path, message);
        warnings.add(new DiscoveryWarning(path, message));
    }
}
