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
 * Catalog entry for an {@link ImageAction}.
 *
 * <p>Two descriptors are equal when their ids are equal.
 *
 * @param id unique id, stable across runs (used on the command line and in reports)
 * @param displayName name shown to users
 * @param statusMessage progress verb shown while the action runs, e.g. "Compressing"
 * @param defaultSelected true if the action runs when the caller selects none
 * @param action the work itself
 */
public record ActionDescriptor(
        String id,
        String displayName,
        String statusMessage,
        boolean defaultSelected,
        ImageAction action) {

    public ActionDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Action id is required");
        }
        Objects.requireNonNull(action, "action");
        displayName = displayName != null ? displayName : id;
        statusMessage = statusMessage != null ? statusMessage : "Running " + displayName + " on";
    }

    public ActionDescriptor(String id, String displayName, ImageAction action) {
        this(id, displayName, null, false, action);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ActionDescriptor other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
