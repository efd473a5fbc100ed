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

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.image.batch.ImageTestBase;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.core.DefaultActions;
import net.boyechko.image.batch.image.ImageHandle;
import org.junit.jupiter.api.Test;

class VerifyPbrValuesActionTest extends ImageTestBase {
    private final VerifyPbrValuesAction action =
            new VerifyPbrValuesAction(PbrConventions.fromResource(PbrConventions.DEFAULT_RESOURCE));

    @Test
    void binaryMetalMaskPasses() throws Exception {
        Path file =
                writePng(
                        tempDir.resolve("rock_mra.png"),
                        withRed(16, 16, (x, y) -> x < 8 ? 0 : 255));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.PASS, result.status());
        assertEquals("Passed all PBR validation tests", result.message());
    }

    @Test
    void greyMetalValuesFailWithPercentage() throws Exception {
        Path file =
                writePng(
                        tempDir.resolve("rock_mra.png"),
                        withRed(16, 16, (x, y) -> y < 4 ? 128 : 255));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.FAIL, result.status());
        assertEquals(
                "25% of the pixels in the red channel are not valid METAL values",
                result.message());
    }

    @Test
    void singleBadPixelIsReportedAsLessThanOnePercent() throws Exception {
        Path file =
                writePng(
                        tempDir.resolve("tiny_mra.png"),
                        withRed(128, 128, (x, y) -> x == 5 && y == 7 ? 77 : 0));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.FAIL, result.status());
        assertTrue(result.message().startsWith("less than 1% of the pixels"), result.message());
    }

    @Test
    void suffixMatchIsCaseInsensitive() throws Exception {
        Path file = writePng(tempDir.resolve("ROCK_MRA.PNG"), withRed(4, 4, (x, y) -> 128));

        assertEquals(ActionStatus.FAIL, action.execute(ImageHandle.open(file)).status());
    }

    @Test
    void baseColorOutOfRangeIsOnlyAWarning() throws Exception {
        Path file = writePng(tempDir.resolve("wall_bc.png"), withRed(8, 8, (x, y) -> 10));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.WARN, result.status());
        assertEquals(
                "100% of the pixels in the red channel are not valid ALBEDO values",
                result.message());
    }

    @Test
    void fileWithoutConventionPasses() throws Exception {
        Path file = writePng(tempDir.resolve("plain.png"), withRed(4, 4, (x, y) -> 128));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.PASS, result.status());
        assertEquals("No PBR convention applies to plain.png", result.message());
    }

    @Test
    void grayscaleSamplesAreCheckedWithoutColorConversion() throws Exception {
        Path dark = writePng(tempDir.resolve("dark_bc.png"), gray(8, 8, 20));
        Path light = writePng(tempDir.resolve("light_bc.png"), gray(8, 8, 230));

        ActionResult darkResult = action.execute(ImageHandle.open(dark));
        ActionResult lightResult = action.execute(ImageHandle.open(light));

        assertEquals(ActionStatus.WARN, darkResult.status());
        assertTrue(
                darkResult
                        .message()
                        .startsWith(
                                "100% of the pixels in the red channel are not valid ALBEDO"
                                        + " values"),
                darkResult.message());
        assertEquals(ActionStatus.PASS, lightResult.status(), lightResult.message());
    }

    @Test
    void grayscaleBinaryMaskPasses() throws Exception {
        BufferedImage mask = gray(8, 8, 0);
        for (int y = 0; y < 8; y++) {
            mask.getRaster().setSample(7, y, 0, 255);
        }
        Path file = writePng(tempDir.resolve("plate_mra.png"), mask);

        assertEquals(ActionStatus.PASS, action.execute(ImageHandle.open(file)).status());
    }

    @Test
    void brokenConventionsFileFailsChecksInsteadOfConstruction() throws Exception {
        Path conventions = tempDir.resolve("conventions.yaml");
        Files.writeString(
                conventions,
                "conventions:\n  - suffix: _mra.png\n    channels:\n      - channel: purple\n");
        Path file = writePng(tempDir.resolve("rock_mra.png"), withRed(4, 4, (x, y) -> 0));

        VerifyPbrValuesAction lazy;
        System.setProperty(PbrConventions.OVERRIDE_PROPERTY, conventions.toString());
        try {
            lazy = assertDoesNotThrow(() -> new VerifyPbrValuesAction());
            assertDoesNotThrow(DefaultActions::newRegistry);
            IllegalArgumentException e =
                    assertThrows(
                            IllegalArgumentException.class,
                            () -> lazy.execute(ImageHandle.open(file)));
            assertTrue(e.getMessage().contains("unknown channel purple"), e.getMessage());
        } finally {
            System.clearProperty(PbrConventions.OVERRIDE_PROPERTY);
        }

        assertEquals(ActionStatus.PASS, lazy.execute(ImageHandle.open(file)).status());
    }

    @Test
    void percentageRounding() {
        assertEquals("50%", VerifyPbrValuesAction.percentage(1, 2));
        assertEquals("1%", VerifyPbrValuesAction.percentage(1, 100));
        assertEquals("less than 1%", VerifyPbrValuesAction.percentage(1, 1000));
        assertEquals("100%", VerifyPbrValuesAction.percentage(7, 7));
    }

    private static BufferedImage gray(int width, int height, int value) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.getRaster().setSample(x, y, 0, value);
            }
        }
        return image;
    }
}
