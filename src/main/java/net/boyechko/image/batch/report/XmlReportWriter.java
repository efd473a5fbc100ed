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
import java.util.Locale;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.discovery.DiscoveryWarning;

/**
 * Writes the batch log as XML.
 *
 * <p>Layout: {@code <root>} holds a {@code <failed>} section listing every non-passing action per
 * file, followed by {@code <complete_results>} with every action that ran. Each {@code <action>}
 * carries {@code name}, {@code status}, {@code passed} and {@code report} attributes.
 */
public class XmlReportWriter implements ReportWriter {
    private static final String INDENT = "\t";

    @Override
    public void write(BatchReport report, OutputStream out) throws IOException {
        try {
            XMLStreamWriter xml =
                    XMLOutputFactory.newFactory().createXMLStreamWriter(out, "UTF-8");
            try {
                writeDocument(xml, report);
            } finally {
                xml.close();
            }
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write XML report: " + e.getMessage(), e);
        }
    }

    private void writeDocument(XMLStreamWriter xml, BatchReport report)
            throws XMLStreamException {
        BatchSummary summary = report.summary();

        xml.writeStartDocument("UTF-8", "1.0");
        newline(xml, 0);
        xml.writeStartElement("root");
        xml.writeAttribute("started", report.startedAt().toString());
        xml.writeAttribute("finished", report.finishedAt().toString());
        xml.writeAttribute("completed", String.valueOf(!report.cancelled()));

        newline(xml, 1);
        xml.writeEmptyElement("summary");
        xml.writeAttribute("files", String.valueOf(summary.filesProcessed()));
        xml.writeAttribute("files_failed", String.valueOf(summary.filesWithFailures()));
        xml.writeAttribute("pass", String.valueOf(summary.passCount()));
        xml.writeAttribute("warn", String.valueOf(summary.warnCount()));
        xml.writeAttribute("fail", String.valueOf(summary.failCount()));

        if (!report.warnings().isEmpty()) {
            newline(xml, 1);
            xml.writeStartElement("warnings");
            for (DiscoveryWarning warning : report.warnings()) {
                newline(xml, 2);
                xml.writeEmptyElement("warning");
                xml.writeAttribute("path", warning.path().toString());
                xml.writeAttribute("report", warning.message());
            }
            newline(xml, 1);
            xml.writeEndElement();
        }

        newline(xml, 1);
        xml.writeStartElement("failed");
        for (FileReport file : report.files()) {
            if (file.outcomes().stream().allMatch(o -> o.status() == ActionStatus.PASS)) {
                continue;
            }
            writeFile(xml, file, true);
        }
        newline(xml, 1);
        xml.writeEndElement();

        newline(xml, 1);
        xml.writeStartElement("complete_results");
        for (FileReport file : report.files()) {
            writeFile(xml, file, false);
        }
        newline(xml, 1);
        xml.writeEndElement();

        newline(xml, 0);
        xml.writeEndElement();
        newline(xml, 0);
        xml.writeEndDocument();
    }

    private void writeFile(XMLStreamWriter xml, FileReport file, boolean onlyNonPassing)
            throws XMLStreamException {
        newline(xml, 2);
        xml.writeStartElement("file");
        xml.writeAttribute("filename", file.path().toString());
        xml.writeAttribute("state", file.state().name().toLowerCase(Locale.ROOT));
        for (ActionOutcome outcome : file.outcomes()) {
            if (onlyNonPassing && outcome.status() == ActionStatus.PASS) {
                continue;
            }
            newline(xml, 3);
            xml.writeEmptyElement("action");
            xml.writeAttribute("name", outcome.actionId());
            xml.writeAttribute("status", outcome.status().name());
            xml.writeAttribute("passed", outcome.status() == ActionStatus.PASS ? "True" : "False");
            xml.writeAttribute("mutated", String.valueOf(outcome.mutated()));
            xml.writeAttribute("report", outcome.message());
        }
        newline(xml, 2);
        xml.writeEndElement();
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + INDENT.repeat(depth));
    }
}
