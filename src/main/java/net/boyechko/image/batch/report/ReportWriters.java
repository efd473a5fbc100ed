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
import java.util.Locale;

/** Picks a {@link ReportWriter} from a report file name. */
public final class ReportWriters {
    public static final String DEFAULT_REPORT_NAME = "Batch_Image_Processor_Report.xml";

    private ReportWriters() {}

    /** JSON for {@code .json}, plain text for {@code .txt}, XML otherwise. */
    public static ReportWriter forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return new JsonReportWriter();
        }
        if (name.endsWith(".txt")) {
            return new TextReportWriter();
        }
        return new XmlReportWriter();
    }
}
