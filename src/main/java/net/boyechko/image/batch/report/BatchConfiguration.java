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
package net.boyechko.image.batch.report;

import java.nio.file.Path;
import java.util.List;

/**
 * Snapshot of what a batch was asked to do.
 *
 * @param directories selected directories, as given
 * @param recursive whether subdirectories were searched
 * @param extensions file extension allow-list
 * @param actionIds selected action ids, in execution order
 */
public record BatchConfiguration(
        List<Path> directories,
        boolean recursive,
        List<String> extensions,
        List<String> actionIds) {

    public BatchConfiguration {
        directories = List.copyOf(directories);
        extensions = List.copyOf(extensions);
        actionIds = List.copyOf(actionIds);
    }

    /** Configuration for a run over an explicit file list. */
    public static BatchConfiguration forActions(List<String> actionIds) {
        return new BatchConfiguration(List.of(), false, List.of(), actionIds);
    }
}
