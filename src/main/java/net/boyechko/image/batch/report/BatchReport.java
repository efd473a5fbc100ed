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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.boyechko.image.batch.discovery.DiscoveryWarning;

/**
 * Result of one batch: configuration, per-file reports in discovery order, and warnings.
 *
 * <p>The summary is computed from the file reports every time it is requested.
 *
 * @param configuration what the batch was asked to do
 * @param files one report per discovered file, in discovery order
 * @param warnings problems met during discovery
 * @param startedAt when the batch started
 * @param finishedAt when the last file was sealed
 * @param cancelled whether the batch was cancelled
 */
public record BatchReport(
        BatchConfiguration configuration,
        List<FileReport> files,
        List<DiscoveryWarning> warnings,
        Instant startedAt,
        Instant finishedAt,
        boolean cancelled) {

    public BatchReport {
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
    }

    public BatchSummary summary() {
        return BatchSummary.of(files);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Optional<FileReport> fileReport(Path path) {
        return files.stream().filter(f -> f.path().equals(path)).findFirst();
    }

    public boolean hasFailures() {
        return files.stream().anyMatch(FileReport::hasFailures);
    }
}
