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
 * Immutable record of one action's run on one file.
 *
 * @param actionId id of the action that produced the outcome
 * @param status PASS, WARN or FAIL
 * @param message detail shown in reports
 * @param mutated true if the action rewrote the file
 */
public record ActionOutcome(String actionId, ActionStatus status, String message, boolean mutated) {
    public ActionOutcome {
        Objects.requireNonNull(actionId, "actionId");
        Objects.requireNonNull(status, "status");
        message = message != null ? message : "";
    }

    public static ActionOutcome of(String actionId, ActionResult result) {
        return new ActionOutcome(actionId, result.status(), result.message(), result.mutated());
    }

    public static ActionOutcome failed(String actionId, String message) {
        return new ActionOutcome(actionId, ActionStatus.FAIL, message, false);
    }

    public boolean isFailure() {
        return status == ActionStatus.FAIL;
    }
}
