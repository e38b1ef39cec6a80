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
package net.boyechko.docx2tex.match;

import net.boyechko.docx2tex.tag.Link;

/** Payload extracted by a successful structural pattern. */
public sealed interface StructuralMatch
        permits StructuralMatch.Drawing,
                StructuralMatch.HyperlinkText,
                StructuralMatch.WordText,
                StructuralMatch.MathText {

    /** Picture embedded through a drawing; the id still has to be resolved. */
    record Drawing(String relationshipId) implements StructuralMatch {}

    record HyperlinkText(Link link, String content) implements StructuralMatch {}

    record WordText(String content) implements StructuralMatch {}

    record MathText(String content) implements StructuralMatch {}
}
