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
package net.boyechko.image.batch.core;

/**
 * Verbosity levels for console output.
 *
 * <ul>
 *   <li>QUIET - only failures and the final summary
 *   <li>NORMAL - one line per file plus warnings and failures (default)
 *   <li>VERBOSE - every action outcome and progress messages
 *   <li>DEBUG - everything, including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0),
    NORMAL(1),
    VERBOSE(2),
    DEBUG(3);

    private final int level;

    VerbosityLevel(int level) {
        this.level = level;
    }

    /** True if output that requires {@code requiredLevel} should be shown at this level. */
    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }

    /** Logback level name matching this verbosity. */
    public String logLevel() {
        return switch (this) {
            case QUIET -> "ERROR";
            case NORMAL -> "WARN";
            case VERBOSE -> "INFO";
            case DEBUG -> "DEBUG";
        };
    }
}
