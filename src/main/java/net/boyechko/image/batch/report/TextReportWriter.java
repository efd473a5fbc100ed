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

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.discovery.DiscoveryWarning;

/**
 * Writes a plain-text report suitable for CI logs: a summary, then every file that needs
 * attention, then the complete per-file results.
 */
public class TextReportWriter implements ReportWriter {
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    @Override
    public void write(BatchReport report, OutputStream out) throws IOException {
        PrintWriter writer =
                new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), false);
        writeHeader(writer, report);
        writeSummary(writer, report.summary());
        writeWarnings(writer, report.warnings());

        List<FileReport> attention =
                report.files().stream()
                        .filter(
                                f ->
                                        f.outcomes().stream()
                                                .anyMatch(o -> o.status() != ActionStatus.PASS))
                        .toList();
        if (!attention.isEmpty()) {
            writeSection(writer, "Needs Attention", attention, true);
        }
        writeSection(writer, "Complete Results", report.files(), false);
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed to write text report");
        }
    }

    private static void writeHeader(PrintWriter out, BatchReport report) {
        BatchConfiguration config = report.configuration();
        out.println("Batch Image Processor Report");
        out.println("============================");
        for (var dir : config.directories()) {
            out.println("Directory:  " + dir);
        }
        if (!config.extensions().isEmpty()) {
            out.println("Extensions: " + String.join(", ", config.extensions()));
        }
        out.println("Actions:    " + String.join(", ", config.actionIds()));
        out.println("Started:    " + TIMESTAMP.format(report.startedAt()));
        out.println("Finished:   " + TIMESTAMP.format(report.finishedAt()));
        if (report.cancelled()) {
            out.println("Status:     CANCELLED");
        }
        out.println();
    }

    private static void writeSummary(PrintWriter out, BatchSummary summary) {
        out.println("Summary");
        out.println("-------");
        out.println("Files processed:     " + summary.filesProcessed());
        out.println("Files with failures: " + summary.filesWithFailures());
        if (summary.filesShortCircuited() > 0) {
            out.println("Files short-circuited: " + summary.filesShortCircuited());
        }
        if (summary.filesCancelled() > 0) {
            out.println("Files cancelled:     " + summary.filesCancelled());
        }
        out.println("Passed:   " + summary.passCount());
        out.println("Warnings: " + summary.warnCount());
        out.println("Failed:   " + summary.failCount());
        out.println();
    }

    private static void writeWarnings(PrintWriter out, List<DiscoveryWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        out.println("Discovery Warnings");
        out.println("------------------");
        for (DiscoveryWarning warning : warnings) {
            out.println("  - " + warning);
        }
        out.println();
    }

    private static void writeSection(
            PrintWriter out, String heading, List<FileReport> files, boolean onlyNonPassing) {
        out.println(heading);
        out.println("-".repeat(heading.length()));
        for (FileReport file : files) {
            out.println(file.path() + stateSuffix(file.state()));
            for (ActionOutcome outcome : file.outcomes()) {
                if (onlyNonPassing && outcome.status() == ActionStatus.PASS) {
                    continue;
                }
                out.println(
                        "  ["
                                + outcome.status()
                                + "] "
                                + outcome.actionId()
                                + (outcome.mutated() ? " (rewritten)" : "")
                                + ": "
                                + outcome.message());
            }
        }
        out.println();
    }

    private static String stateSuffix(FileState state) {
        return switch (state) {
            case COMPLETED -> "";
            case SHORT_CIRCUITED -> " (short-circuited)";
            case CANCELLED -> " (cancelled)";
        };
    }
}
