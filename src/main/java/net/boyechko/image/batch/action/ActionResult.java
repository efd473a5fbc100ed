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
package net.boyechko.image.batch.action;

import java.util.Objects;

/**
 * What an {@link ImageAction} reports back to the batch.
 *
 * @param status outcome status
 * @param message human-readable detail
 * @param mutated true if the action rewrote the file
 */
public record ActionResult(ActionStatus status, String message, boolean mutated) {
    public ActionResult {
        Objects.requireNonNull(status, "status");
        message = message != null ? message : "";
    }

    public static ActionResult pass(String message) {
        return new ActionResult(ActionStatus.PASS, message, false);
    }

    public static ActionResult passMutated(String message) {
        return new ActionResult(ActionStatus.PASS, message, true);
    }

    public static ActionResult warn(String message) {
        return new ActionResult(ActionStatus.WARN, message, false);
    }

    public static ActionResult fail(String message) {
        return new ActionResult(ActionStatus.FAIL, message, false);
    }
}
