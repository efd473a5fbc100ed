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

import net.boyechko.image.batch.image.ImageHandle;

/**
 * A unit of work performed on one image file.
 *
 * <p>Implementations keep no state between files. They may rewrite the file through {@link
 * ImageHandle#replaceContent(byte[])}, in which case the returned result must say so. Any
 * exception thrown is recorded as a failed outcome for this file and action only.
 */
@FunctionalInterface
public interface ImageAction {
    ActionResult execute(ImageHandle handle) throws Exception;
}
