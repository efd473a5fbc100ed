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

import static net.boyechko.image.batch.report.SampleReports.file;
import static net.boyechko.image.batch.report.SampleReports.outcome;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import net.boyechko.image.batch.action.ActionStatus;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {

    @Test
    void summaryMatchesPerFileTotals() {
        BatchReport report = SampleReports.mixed();
        BatchSummary summary = report.summary();

        assertEquals(3, summary.filesProcessed());
        assertEquals(2, summary.filesWithFailures());
        assertEquals(1, summary.filesShortCircuited());
        assertEquals(0, summary.filesCancelled());
        assertEquals(2, summary.passCount());
        assertEquals(1, summary.warnCount());
        assertEquals(2, summary.failCount());
        assertEquals(
                report.files().stream().mapToInt(f -> f.outcomes().size()).sum(),
                summary.totalOutcomes());
        assertTrue(report.hasFailures());
        assertEquals(Duration.ofSeconds(5), report.elapsed());
    }

    @Test
    void emptyBatchHasZeroSummary() {
        BatchReport report = ResultAggregator.aggregate(List.of());

        assertEquals(new BatchSummary(0, 0, 0, 0, 0, 0, 0), report.summary());
        assertFalse(report.hasFailures());
    }

    @Test
    void actionIdsAreCollectedFromOutcomes() {
        BatchReport report =
                ResultAggregator.aggregate(
                        List.of(
                                file(
                                        "a.png",
                                        FileState.COMPLETED,
                                        outcome("x", ActionStatus.PASS, ""),
                                        outcome("y", ActionStatus.WARN, "")),
                                FileReport.openFailed(Path.of("b.png"), "corrupt")));

        assertEquals(List.of("x", "y"), report.configuration().actionIds());
    }

    @Test
    void unsealedReportIsRejected() {
        FileReport open = new FileReport(Path.of("a.png"));

        assertThrows(
                IllegalArgumentException.class, () -> ResultAggregator.aggregate(List.of(open)));
    }

    @Test
    void fileReportLookupByPath() {
        BatchReport report = SampleReports.mixed();

        assertTrue(report.fileReport(Path.of("tex/b.png")).isPresent());
        assertTrue(report.fileReport(Path.of("tex/zzz.png")).isEmpty());
    }

    @Test
    void sealedFileReportIsReadOnly() {
        FileReport report = file("a.png", FileState.COMPLETED);

        assertThrows(
                IllegalStateException.class,
                () -> report.append(outcome("late", ActionStatus.PASS, "")));
        assertThrows(IllegalStateException.class, () -> report.seal(FileState.CANCELLED));
    }
}
