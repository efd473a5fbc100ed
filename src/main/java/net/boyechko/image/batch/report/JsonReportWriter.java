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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.discovery.DiscoveryWarning;

/** Writes a {@link BatchReport} as an indented JSON document. */
public class JsonReportWriter implements ReportWriter {
    private final ObjectMapper mapper =
            new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void write(BatchReport report, OutputStream out) throws IOException {
        mapper.writeValue(out, toJson(report));
    }

    public ObjectNode toJson(BatchReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("startedAt", report.startedAt().toString());
        root.put("finishedAt", report.finishedAt().toString());
        root.put("cancelled", report.cancelled());

        BatchConfiguration config = report.configuration();
        ObjectNode configuration = root.putObject("configuration");
        ArrayNode dirs = configuration.putArray("directories");
        for (Path dir : config.directories()) {
            dirs.add(dir.toString());
        }
        configuration.put("recursive", config.recursive());
        ArrayNode exts = configuration.putArray("extensions");
        config.extensions().forEach(exts::add);
        ArrayNode actions = configuration.putArray("actionIds");
        config.actionIds().forEach(actions::add);

        BatchSummary summary = report.summary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("filesProcessed", summary.filesProcessed());
        summaryNode.put("filesWithFailures", summary.filesWithFailures());
        summaryNode.put("filesShortCircuited", summary.filesShortCircuited());
        summaryNode.put("filesCancelled", summary.filesCancelled());
        summaryNode.put("pass", summary.passCount());
        summaryNode.put("warn", summary.warnCount());
        summaryNode.put("fail", summary.failCount());

        ArrayNode warnings = root.putArray("warnings");
        for (DiscoveryWarning warning : report.warnings()) {
            ObjectNode w = warnings.addObject();
            w.put("path", warning.path().toString());
            w.put("message", warning.message());
        }

        ArrayNode files = root.putArray("files");
        for (FileReport file : report.files()) {
            ObjectNode f = files.addObject();
            f.put("path", file.path().toString());
            f.put("state", file.state().name());
            ArrayNode outcomes = f.putArray("outcomes");
            for (ActionOutcome outcome : file.outcomes()) {
                ObjectNode o = outcomes.addObject();
                o.put("actionId", outcome.actionId());
                o.put("status", outcome.status().name());
                o.put("message", outcome.message());
                o.put("mutated", outcome.mutated());
            }
        }
        return root;
    }
}
