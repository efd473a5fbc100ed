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

import java.awt.Color;
import java.nio.file.Path;
import net.boyechko.image.batch.ImageTestBase;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.image.ImageHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PowerOfTwoCheckActionTest extends ImageTestBase {
    private final PowerOfTwoCheckAction action = new PowerOfTwoCheckAction();

    @Test
    void squarePowerOfTwoPasses() throws Exception {
        Path file = writePng(tempDir.resolve("ok.png"), solid(256, 256, Color.GRAY));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.PASS, result.status());
        assertEquals("Width:256 and Height:256 are both a proper power of 2", result.message());
        assertFalse(result.mutated());
    }

    @Test
    void nonSquarePowerOfTwoPasses() throws Exception {
        Path file = writePng(tempDir.resolve("wide.png"), solid(64, 8, Color.GRAY));

        assertEquals(ActionStatus.PASS, action.execute(ImageHandle.open(file)).status());
    }

    @Test
    void oneBadDimensionFails() throws Exception {
        Path file = writePng(tempDir.resolve("bad.png"), solid(100, 64, Color.GRAY));

        ActionResult result = action.execute(ImageHandle.open(file));

        assertEquals(ActionStatus.FAIL, result.status());
        assertEquals("Either Width:100 or Height:64 is NOT a proper power of 2", result.message());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 512, 1024, 1 << 30})
    void recognizesPowersOfTwo(int n) {
        assertTrue(PowerOfTwoCheckAction.isPowerOfTwo(n));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -2, 3, 6, 100, 1023})
    void rejectsOtherNumbers(int n) {
        assertFalse(PowerOfTwoCheckAction.isPowerOfTwo(n));
    }
}
