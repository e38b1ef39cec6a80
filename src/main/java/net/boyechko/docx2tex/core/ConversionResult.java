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

import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.issue.IssueType;

/** Outcome of converting one document body. */
public record ConversionResult(IssueList issues, boolean completed) {

    /** True if reading the markup failed and the output stops at the failure point. */
    public boolean hasReadError() {
        return !issues.ofType(IssueType.READ_ERROR).isEmpty();
    }

    public boolean isClean() {
        return completed && issues.isEmpty();
    }
}
