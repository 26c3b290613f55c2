/*
 * PDF-Auto-Redact - PDF Structure Analysis and Redaction
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
package net.boyechko.pdf.autoredact.core;

/**
 * How much the command line reports, from least to most.
 *
 * <ul>
 *   <li>QUIET - errors only
 *   <li>NORMAL - the category report and redaction totals (default)
 *   <li>VERBOSE - per-page progress and skipped indices
 *   <li>DEBUG - extraction and classification detail
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, "error"),
    NORMAL(1, "warn"),
    VERBOSE(2, "info"),
    DEBUG(3, "debug");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    public int getLevel() {
        return level;
    }

    /** Logback level name for the application logger at this verbosity. */
    public String logLevel() {
        return logLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }

    /** True when output requiring {@code requiredLevel} should be shown. */
    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }
}
