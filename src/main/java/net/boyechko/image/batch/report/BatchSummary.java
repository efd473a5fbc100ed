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

import java.util.List;
import net.boyechko.image.batch.action.ActionOutcome;

/**
 * Totals over a list of file reports.
 *
 * @param filesProcessed number of file reports
 * @param filesWithFailures files with at least one FAIL outcome
 * @param filesShortCircuited files that could not be opened or stopped at a failure
 * @param filesCancelled files cut short by cancellation
 * @param passCount PASS outcomes
 * @param warnCount WARN outcomes
 * @param failCount FAIL outcomes
 */
public record BatchSummary(
        int filesProcessed,
        int filesWithFailures,
        int filesShortCircuited,
        int filesCancelled,
        int passCount,
        int warnCount,
        int failCount) {

    public static BatchSummary of(List<FileReport> files) {
        int withFailures = 0;
        int shortCircuited = 0;
        int cancelled = 0;
        int pass = 0;
        int warn = 0;
        int fail = 0;
        for (FileReport file : files) {
            boolean failed = false;
            for (ActionOutcome outcome : file.outcomes()) {
                switch (outcome.status()) {
                    case PASS -> pass++;
                    case WARN -> warn++;
                    case FAIL -> {
                        fail++;
                        failed = true;
                    }
                }
            }
            if (failed) {
                withFailures++;
            }
            if (file.state() == FileState.SHORT_CIRCUITED) {
                shortCircuited++;
            } else if (file.state() == FileState.CANCELLED) {
                cancelled++;
            }
        }
        return new BatchSummary(
                files.size(), withFailures, shortCircuited, cancelled, pass, warn, fail);
    }

    public int totalOutcomes() {
        return passCount + warnCount + failCount;
    }

    public boolean hasFailures() {
        return failCount > 0;
    }
}
