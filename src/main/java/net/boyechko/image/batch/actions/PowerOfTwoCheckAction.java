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

import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ImageAction;
import net.boyechko.image.batch.image.ImageHandle;

/** Checks that both image dimensions are powers of two. */
public class PowerOfTwoCheckAction implements ImageAction {
    public static final String ID = "check_power_of_2";

    @Override
    public ActionResult execute(ImageHandle handle) throws Exception {
        int width = handle.width();
        int height = handle.height();

        if (isPowerOfTwo(width) && isPowerOfTwo(height)) {
            return ActionResult.pass(
                    "Width:" + width + " and Height:" + height + " are both a proper power of 2");
        }
        return ActionResult.fail(
                "Either Width:" + width + " or Height:" + height + " is NOT a proper power of 2");
    }

    static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }
}
