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

import java.nio.file.Path;
import java.util.List;

/**
 * Candidate files found by {@link FileDiscoverer}, sorted by path, along with any warnings.
 *
 * <p>Both lists are immutable copies.
 */
public record DiscoveryResult(List<Path> files, List<DiscoveryWarning> warnings) {

    public DiscoveryResult {
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
