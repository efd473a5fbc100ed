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
package net.boyechko.image.batch.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.core.VerbosityLevel;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.FileReport;
import net.boyechko.image.batch.report.FileState;
import net.boyechko.image.batch.report.ResultAggregator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

public class BatchReporterTest {
    private static final BatchConfiguration CONFIG =
            new BatchConfiguration(
                    List.of(Path.of("textures")),
                    false,
                    List.of("png"),
                    List.of("compress_png", "check_power_of_2"));

    private static FileReport report(String path, ActionOutcome... outcomes) {
        FileReport report = new FileReport(Path.of(path));
        for (ActionOutcome outcome : outcomes) {
            report.append(outcome);
        }
        report.seal(FileState.COMPLETED);
        return report;
    }

    private String replay(VerbosityLevel verbosity) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        BatchReporter reporter = new BatchReporter(new PrintStream(buffer), verbosity);

        FileReport clean =
                report(
                        "textures/a.png",
                        new ActionOutcome(
                                "compress_png",
                                ActionStatus.PASS,
                                "Compression saved 2.00 KB on disk",
                                true),
                        new ActionOutcome(
                                "check_power_of_2",
                                ActionStatus.PASS,
                                "Width:64 and Height:64 are both a proper power of 2",
                                false));
        FileReport failing =
                report(
                        "textures/b.png",
                        new ActionOutcome(
                                "compress_png",
                                ActionStatus.WARN,
                                "Compression did not save any space on disk",
                                false),
                        new ActionOutcome(
                                "check_power_of_2",
                                ActionStatus.FAIL,
                                "Either Width:100 or Height:64 is NOT a proper power of 2",
                                false));

        reporter.onDiscoveryWarning(
                new DiscoveryWarning(Path.of("missing"), "Directory does not exist"));
        reporter.onBatchStart(CONFIG, 2);
        reporter.onActionStart(
                clean.path(),
                new ActionDescriptor(
                        "compress_png",
                        "Compress PNGs",
                        "Compressing",
                        true,
                        h -> ActionResult.pass("")));
        reporter.onFileComplete(clean);
        reporter.onFileComplete(failing);
        BatchReport batch =
                ResultAggregator.aggregate(
                        CONFIG,
                        List.of(clean, failing),
                        List.of(),
                        Instant.EPOCH,
                        Instant.EPOCH.plusSeconds(2),
                        false);
        reporter.onBatchComplete(batch);
        reporter.onSuccess("Report saved to out.xml");
        return buffer.toString().replace("\r\n", "\n");
    }

    @Test
    void normalShowsFilesWarningsAndFailures() {
        String out = replay(VerbosityLevel.NORMAL);

        assertTrue(out.contains("┌─ Processing 2 files "), out);
        assertTrue(out.contains("[1/2] textures/a.png"), out);
        assertTrue(out.contains("compress_png: Compression did not save any space on disk"), out);
        assertTrue(out.contains("check_power_of_2: Either Width:100"), out);
        assertFalse(out.contains("Compressing a.png"), out);
        assertFalse(out.contains("are both a proper power of 2"), out);
        assertTrue(out.contains("Failed: 1 in 1 file"), out);
        assertTrue(out.contains("Report saved to out.xml"), out);
    }

    @Test
    void verboseShowsProgressAndPassingOutcomes() {
        String out = replay(VerbosityLevel.VERBOSE);

        assertTrue(out.contains("Compressing a.png"), out);
        assertTrue(out.contains("are both a proper power of 2"), out);
    }

    @Test
    void quietShowsOnlyFailuresAndSummary() {
        String out = replay(VerbosityLevel.QUIET);

        assertFalse(out.contains("textures/a.png"), out);
        assertTrue(out.contains("textures/b.png"), out);
        assertTrue(out.contains("NOT a proper power of 2"), out);
        assertFalse(out.contains("did not save any space"), out);
        assertTrue(out.contains("Summary"), out);
        assertTrue(out.contains("missing: Directory does not exist"), out);
    }

    @Test
    void wordWrapKeepsLinesWithinWidth() {
        List<String> lines =
                BatchReporter.wordWrap(
                        "one two three four five six seven eight nine ten eleven twelve", 20);

        assertTrue(lines.size() > 1);
        for (String line : lines) {
            assertTrue(line.length() <= 20, line);
        }
        assertEquals(List.of(), BatchReporter.wordWrap("", 20));
    }

    @Test
    @Tag("visual")
    void rendersVisualTranscript() {
        String rendered = replay(VerbosityLevel.NORMAL);

        System.out.println("--- Visual Transcript Preview ---");
        System.out.print(rendered);
        System.out.println("--- End Preview ---");
    }
}
