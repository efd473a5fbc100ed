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
package net.boyechko.image.batch.actions;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.image.batch.actions.PbrConventions.ChannelRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PbrConventionsTest {
    @TempDir Path tempDir;

    @Test
    void bundledConventionsLoad() {
        PbrConventions conventions = PbrConventions.fromResource(PbrConventions.DEFAULT_RESOURCE);

        assertEquals(2, conventions.conventions.size());
        assertEquals(1, conventions.matching("floor_mra.png").size());
        assertEquals(1, conventions.matching("floor_bc.png").size());
        assertTrue(conventions.matching("floor_normal.png").isEmpty());
        assertTrue(conventions.validate().isEmpty());
    }

    @Test
    void binaryRuleAcceptsOnlyExtremes() {
        ChannelRule rule = new ChannelRule();
        rule.channel = "red";
        rule.binary = true;

        assertTrue(rule.accepts(0));
        assertTrue(rule.accepts(255));
        assertFalse(rule.accepts(1));
        assertFalse(rule.accepts(254));
        assertEquals(16, rule.shift());
        assertEquals("RED", rule.displayLabel());
    }

    @Test
    void rangeRuleIsInclusive() {
        ChannelRule rule = new ChannelRule();
        rule.channel = "green";
        rule.min = 30;
        rule.max = 240;

        assertTrue(rule.accepts(30));
        assertTrue(rule.accepts(240));
        assertFalse(rule.accepts(29));
        assertFalse(rule.accepts(241));
    }

    @Test
    void conventionsLoadFromFile() throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(
                file,
                """
                conventions:
                  - suffix: _rough.png
                    channels:
                      - channel: green
                        label: ROUGHNESS
                        min: 10
                        severity: warn
                """);

        PbrConventions conventions = PbrConventions.fromFile(file);

        assertEquals(1, conventions.matching("a_rough.png").size());
        ChannelRule rule = conventions.conventions.get(0).channels.get(0);
        assertTrue(rule.isWarning());
        assertEquals("ROUGHNESS", rule.displayLabel());
    }

    @Test
    void invalidChannelIsRejected() throws Exception {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(
                file,
                """
                conventions:
                  - suffix: _x.png
                    channels:
                      - channel: purple
                        binary: true
                """);

        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> PbrConventions.fromFile(file));
        assertTrue(e.getMessage().contains("unknown channel purple"), e.getMessage());
    }

    @Test
    void ruleWithoutConstraintIsRejected() throws Exception {
        Path file = tempDir.resolve("empty_rule.yaml");
        Files.writeString(
                file,
                """
                conventions:
                  - suffix: _x.png
                    channels:
                      - channel: red
                """);

        assertThrows(IllegalArgumentException.class, () -> PbrConventions.fromFile(file));
    }
}
