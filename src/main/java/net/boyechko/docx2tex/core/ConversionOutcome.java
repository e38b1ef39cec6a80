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

import java.nio.file.Path;
import java.util.List;
import net.boyechko.docx2tex.issue.IssueList;

/** Files produced by {@link ConversionService} and everything that went wrong on the way. */
public record ConversionOutcome(
        Path texFile, List<Path> mediaFiles, ConversionResult conversion, IssueList packageIssues) {

    public IssueList allIssues() {
        IssueList all = new IssueList(packageIssues);
        all.addAll(conversion.issues());
        return all;
    }
}
