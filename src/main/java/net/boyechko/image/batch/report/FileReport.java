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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionStatus;

/**
 * Outcomes of every action run on one file, in execution order.
 *
 * <p>Outcomes are appended while the file is processed; once {@link #seal(FileState)} is called
 * the report is read-only.
 */
public final class FileReport {
    /** Action id of the synthetic outcome recorded when a file cannot be opened. */
    public static final String OPEN_ACTION_ID = "open_image";

    /** Action id of the synthetic outcome recorded when processing of a file breaks down. */
    public static final String PROCESS_ACTION_ID = "process_file";

    private final Path path;
    private final List<ActionOutcome> outcomes = new ArrayList<>();
    private FileState state;

    public FileReport(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    /** Report for a file that could not be opened: one FAIL outcome, already sealed. */
    public static FileReport openFailed(Path path, String message) {
        FileReport report = new FileReport(path);
        report.append(ActionOutcome.failed(OPEN_ACTION_ID, message));
        report.seal(FileState.SHORT_CIRCUITED);
        return report;
    }

    /** Report for a file whose processing broke down outside any single action. */
    public static FileReport aborted(Path path, String message) {
        FileReport report = new FileReport(path);
        report.append(ActionOutcome.failed(PROCESS_ACTION_ID, message));
        report.seal(FileState.SHORT_CIRCUITED);
        return report;
    }

    /** Report for a file that was never started because the batch was cancelled. */
    public static FileReport cancelled(Path path) {
        FileReport report = new FileReport(path);
        report.seal(FileState.CANCELLED);
        return report;
    }

    public synchronized void append(ActionOutcome outcome) {
        if (state != null) {
            throw new IllegalStateException("Report for " + path + " is sealed");
        }
        outcomes.add(Objects.requireNonNull(outcome, "outcome"));
    }

    public synchronized void seal(FileState finalState) {
        if (state != null) {
            throw new IllegalStateException("Report for " + path + " is already sealed");
        }
        this.state = Objects.requireNonNull(finalState, "finalState");
    }

    public Path path() {
        return path;
    }

    public synchronized List<ActionOutcome> outcomes() {
        return Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    /** Final state, or null while the file is still being processed. */
    public synchronized FileState state() {
        return state;
    }

    public synchronized boolean isSealed() {
        return state != null;
    }

    public synchronized long count(ActionStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public synchronized boolean hasFailures() {
        return outcomes.stream().anyMatch(ActionOutcome::isFailure);
    }

    public synchronized boolean wasMutated() {
        return outcomes.stream().anyMatch(ActionOutcome::mutated);
    }

    @Override
    public synchronized String toString() {
        return "FileReport[" + path + ", " + state + ", " + outcomes + "]";
    }
}
