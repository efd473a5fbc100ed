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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.nio.file.Path;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.core.BatchListener;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.BatchSummary;
import net.boyechko.image.batch.report.FileReport;
import org.slf4j.LoggerFactory;

/** A {@link BatchListener} that routes all events through SLF4J. */
public class LoggingListener implements BatchListener {

    private static final String CONSOLE_APPENDER_NAME = "IMAGEBATCH_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.image.batch.processing");

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stdout. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-20logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onBatchStart(BatchConfiguration configuration, int fileCount) {
        logger.info(
                "BATCH files={} actions={} recursive={}",
                fileCount,
                configuration.actionIds(),
                configuration.recursive());
    }

    @Override
    public void onDiscoveryWarning(DiscoveryWarning warning) {
        logger.warn("DISCOVERY {}", warning);
    }

    @Override
    public void onFileStart(Path file, int index, int total) {
        logger.debug("FILE {}/{} {}", index + 1, total, file);
    }

    @Override
    public void onActionStart(Path file, ActionDescriptor action) {
        logger.debug("{} {}", action.statusMessage(), file.getFileName());
    }

    @Override
    public void onActionComplete(Path file, ActionOutcome outcome) {
        switch (outcome.status()) {
            case PASS -> logger.info("PASS {} {}: {}", outcome.actionId(), file, outcome.message());
            case WARN -> logger.warn("WARN {} {}: {}", outcome.actionId(), file, outcome.message());
            case FAIL -> logger.error(
                    "FAIL {} {}: {}", outcome.actionId(), file, outcome.message());
        }
    }

    @Override
    public void onFileComplete(FileReport report) {
        logger.info("DONE {} state={}", report.path(), report.state());
    }

    @Override
    public void onCancelled() {
        logger.warn("CANCELLED");
    }

    @Override
    public void onBatchComplete(BatchReport report) {
        BatchSummary summary = report.summary();
        logger.info(
                "SUMMARY files={} pass={} warn={} fail={} cancelled={}",
                summary.filesProcessed(),
                summary.passCount(),
                summary.warnCount(),
                summary.failCount(),
                summary.filesCancelled());
    }
}
