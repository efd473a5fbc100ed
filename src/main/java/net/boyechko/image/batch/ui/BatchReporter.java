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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.core.BatchListener;
import net.boyechko.image.batch.core.VerbosityLevel;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.BatchSummary;
import net.boyechko.image.batch.report.FileReport;
import net.boyechko.image.batch.report.FileState;
import org.slf4j.LoggerFactory;

/** Console transcript of a batch: a boxed section per phase, one line per file, a summary. */
public class BatchReporter implements BatchListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";
    private static final String CANCELLED = "⊘";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private int filesDone = 0;
    private int fileCount = 0;
    private final ListAppender<ILoggingEvent> logBuffer;

    public BatchReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.image.batch");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onBatchStart(BatchConfiguration configuration, int fileCount) {
        this.fileCount = fileCount;
        this.filesDone = 0;
        openPhase("Processing " + fileCount + " file" + (fileCount == 1 ? "" : "s"));
        printLine("Actions: " + String.join(", ", configuration.actionIds()), INFO);
    }

    @Override
    public void onDiscoveryWarning(DiscoveryWarning warning) {
        if (!phaseOpen) {
            openPhase("Discovery");
        }
        printLine(warning.toString(), WARNING, VerbosityLevel.QUIET);
    }

    @Override
    public void onActionStart(Path file, ActionDescriptor action) {
        printLine(
                action.statusMessage() + " " + file.getFileName(), INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onFileComplete(FileReport report) {
        filesDone++;
        String progress = progressPrefix();
        String icon = iconFor(report);
        VerbosityLevel level = report.hasFailures() ? VerbosityLevel.QUIET : VerbosityLevel.NORMAL;
        printLine(progress + report.path() + stateNote(report.state()), icon, level);

        for (ActionOutcome outcome : report.outcomes()) {
            VerbosityLevel required =
                    switch (outcome.status()) {
                        case FAIL -> VerbosityLevel.QUIET;
                        case WARN -> VerbosityLevel.NORMAL;
                        case PASS -> VerbosityLevel.VERBOSE;
                    };
            printLine(
                    "  " + outcome.actionId() + ": " + outcome.message(),
                    iconFor(outcome.status()),
                    required);
        }
    }

    @Override
    public void onCancelled() {
        printLine("Batch cancelled; remaining files were not processed", CANCELLED,
                VerbosityLevel.QUIET);
    }

    @Override
    public void onBatchComplete(BatchReport report) {
        closePhaseIfOpen();
        BatchSummary summary = report.summary();

        printBoxHeader("Summary");
        if (summary.filesProcessed() == 0) {
            printLine("No image files found", INFO, VerbosityLevel.QUIET);
        } else {
            printLine("Files processed: " + summary.filesProcessed(), INFO, VerbosityLevel.QUIET);
            printLine("Passed: " + summary.passCount(), SUCCESS, VerbosityLevel.QUIET);
            if (summary.warnCount() > 0) {
                printLine("Warnings: " + summary.warnCount(), WARNING, VerbosityLevel.QUIET);
            }
            if (summary.failCount() > 0) {
                printLine(
                        "Failed: "
                                + summary.failCount()
                                + " in "
                                + summary.filesWithFailures()
                                + " file"
                                + (summary.filesWithFailures() == 1 ? "" : "s"),
                        ERROR,
                        VerbosityLevel.QUIET);
            }
            if (summary.filesCancelled() > 0) {
                printLine(
                        "Cancelled: " + summary.filesCancelled(), CANCELLED, VerbosityLevel.QUIET);
            }
        }
        if (!report.warnings().isEmpty()) {
            printLine(
                    "Discovery warnings: " + report.warnings().size(),
                    WARNING,
                    VerbosityLevel.QUIET);
        }
        printLine(
                String.format("Elapsed: %.1f s", report.elapsed().toMillis() / 1000.0),
                INFO,
                VerbosityLevel.NORMAL);
        printBoxFooter();
    }

    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    private String progressPrefix() {
        if (fileCount <= 1) {
            return "";
        }
        return "[" + filesDone + "/" + fileCount + "] ";
    }

    private static String stateNote(FileState state) {
        return switch (state) {
            case COMPLETED -> "";
            case SHORT_CIRCUITED -> " (skipped remaining actions)";
            case CANCELLED -> " (cancelled)";
        };
    }

    private static String iconFor(FileReport report) {
        if (report.state() == FileState.CANCELLED) {
            return CANCELLED;
        }
        if (report.hasFailures()) {
            return ERROR;
        }
        if (report.count(ActionStatus.WARN) > 0) {
            return WARNING;
        }
        return SUCCESS;
    }

    private static String iconFor(ActionStatus status) {
        return switch (status) {
            case PASS -> SUCCESS;
            case WARN -> WARNING;
            case FAIL -> ERROR;
        };
    }

    private void openPhase(String title) {
        closePhaseIfOpen();
        printBoxHeader(title);
        phaseOpen = true;
    }

    private void closePhaseIfOpen() {
        if (phaseOpen) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        if (verbosity.shouldShow(VerbosityLevel.QUIET)) {
            output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
            output.println("│");
        }
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Flushes log events captured since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        if (!verbosity.shouldShow(VerbosityLevel.VERBOSE)) {
            return;
        }
        printLine("", null, VerbosityLevel.VERBOSE);
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            printLine(
                    "[" + event.getLevel() + "] " + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.VERBOSE);
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    /**
     * Prints an indented line with the given icon, word-wrapping long messages to stay within the
     * box. Continuation lines align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        if (icon == null) {
            output.println(INDENT + message);
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    /** Word-wraps text at spaces to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
