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
package net.boyechko.image.batch.core;

import java.nio.file.Path;
import java.util.List;
import net.boyechko.image.batch.discovery.FileDiscoverer;

/**
 * What to process.
 *
 * @param directories directories to search
 * @param recursive whether to descend into subdirectories
 * @param extensions file extension allow-list
 * @param actionIds action ids in execution order; empty selects the registry's defaults
 */
public record BatchRequest(
        List<Path> directories,
        boolean recursive,
        List<String> extensions,
        List<String> actionIds) {

    public BatchRequest {
        if (directories == null || directories.isEmpty()) {
            throw new IllegalArgumentException("At least one directory is required");
        }
        directories = List.copyOf(directories);
        extensions =
                extensions == null || extensions.isEmpty()
                        ? FileDiscoverer.DEFAULT_EXTENSIONS
                        : List.copyOf(extensions);
        actionIds = actionIds == null ? List.of() : List.copyOf(actionIds);
    }

    public static BatchRequest of(List<Path> directories, List<String> actionIds) {
        return new BatchRequest(directories, false, List.of(), actionIds);
    }

    public boolean usesDefaultActions() {
        return actionIds.isEmpty();
    }
}
