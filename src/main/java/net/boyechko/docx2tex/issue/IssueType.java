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
package net.boyechko.docx2tex.issue;

/** Represents the type of a problem found while converting a document. */
public enum IssueType {
    // Input issues
    MISSING_ATTRIBUTES("tags missing required attributes"),
    MISSING_BOOKMARK_NAME("bookmarks without a name"),
    MALFORMED_RELATIONSHIP("malformed relationship entries"),
    READ_ERROR("unreadable document markup"),

    // Reference issues
    UNRESOLVED_HYPERLINK("hyperlinks to unknown relationships"),
    UNRESOLVED_IMAGE("images referencing unknown relationships"),

    // Math issues
    MATH_MODE_VIOLATION("unbalanced math paragraphs"),
    NARY_VIOLATION("malformed n-ary operators");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
