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

import java.time.Instant;
import java.util.List;
import net.boyechko.image.batch.discovery.DiscoveryWarning;

/**
 * Builds {@link BatchReport}s from file reports. Pure: the input order is kept and nothing is
 * written or printed.
 */
public final class ResultAggregator {

    private ResultAggregator() {}

    public static BatchReport aggregate(List<FileReport> fileReports) {
        Instant now = Instant.now();
        List<String> actionIds =
                fileReports.stream()
                        .flatMap(f -> f.outcomes().stream())
                        .map(o -> o.actionId())
                        .filter(id -> !FileReport.OPEN_ACTION_ID.equals(id))
                        .filter(id -> !FileReport.PROCESS_ACTION_ID.equals(id))
                        .distinct()
                        .toList();
        return aggregate(
                BatchConfiguration.forActions(actionIds), fileReports, List.of(), now, now, false);
    }

    public static BatchReport aggregate(
            BatchConfiguration configuration,
            List<FileReport> fileReports,
            List<DiscoveryWarning> warnings,
            Instant startedAt,
            Instant finishedAt,
            boolean cancelled) {
        for (FileReport report : fileReports) {
            if (!report.isSealed()) {
                throw new IllegalArgumentException(
                        "File report for " + report.path() + " is not sealed");
            }
        }
        return new BatchReport(
                configuration, fileReports, warnings, startedAt, finishedAt, cancelled);
    }
}
