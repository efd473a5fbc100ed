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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.FileReport;

/** Records every event as a short string, for asserting on event order. */
public class RecordingBatchListener implements BatchListener {
    public final List<String> events = Collections.synchronizedList(new ArrayList<>());
    public BatchReport completed;

    @Override
    public void onBatchStart(BatchConfiguration configuration, int fileCount) {
        events.add("batchStart:" + fileCount);
    }

    @Override
    public void onDiscoveryWarning(DiscoveryWarning warning) {
        events.add("warning:" + warning.path().getFileName());
    }

    @Override
    public void onFileStart(Path file, int index, int total) {
        events.add("fileStart:" + file.getFileName());
    }

    @Override
    public void onActionStart(Path file, ActionDescriptor action) {
        events.add("actionStart:" + file.getFileName() + ":" + action.id());
    }

    @Override
    public void onActionComplete(Path file, ActionOutcome outcome) {
        events.add(
                "actionComplete:" + file.getFileName() + ":" + outcome.actionId() + ":"
                        + outcome.status());
    }

    @Override
    public void onFileComplete(FileReport report) {
        events.add("fileComplete:" + report.path().getFileName() + ":" + report.state());
    }

    @Override
    public void onCancelled() {
        events.add("cancelled");
    }

    @Override
    public void onBatchComplete(BatchReport report) {
        completed = report;
        events.add("batchComplete");
    }
}
