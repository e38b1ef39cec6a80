/*
 * Docx2Tex - Office Open XML to LaTeX Conversion
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
package net.boyechko.docx2tex.core;

/**
 * Defines the verbosity levels for output control, from least to most verbose. Each level also
 * fixes the threshold of the diagnostic log.
 */
public enum VerbosityLevel {
    /** Only errors and final status */
    QUIET(0, "ERROR"),

    /** Summary information (default) */
    NORMAL(1, "WARN"),

    /** Phases and per-issue details */
    VERBOSE(2, "INFO"),

    /** Everything, including per-event tracing */
    DEBUG(3, "DEBUG");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    /** Name of the Logback level that matches this verbosity. */
    public String logLevel() {
        return logLevel;
    }

    /** True if this level is at least as verbose as {@code other}. */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
