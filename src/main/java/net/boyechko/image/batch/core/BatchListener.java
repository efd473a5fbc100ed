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
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.FileReport;

/**
 * Interface for reporting progress and results of a batch.
 *
 * <p>{@link BatchService} serializes its calls, so implementations need not be thread-safe even
 * when files are processed in parallel. With more than one worker, events of different files may
 * interleave.
 */
public interface BatchListener {
    void onBatchStart(BatchConfiguration configuration, int fileCount);

    void onFileComplete(FileReport report);

    void onBatchComplete(BatchReport report);

    default void onDiscoveryWarning(DiscoveryWarning warning) {}

    default void onFileStart(Path file, int index, int total) {}

    default void onActionStart(Path file, ActionDescriptor action) {}

    default void onActionComplete(Path file, ActionOutcome outcome) {}

    default void onCancelled() {}

    static BatchListener noOp() {
        return new BatchListener() {
            @Override
            public void onBatchStart(BatchConfiguration configuration, int fileCount) {}

            @Override
            public void onFileComplete(FileReport report) {}

            @Override
            public void onBatchComplete(BatchReport report) {}
        };
    }
}
