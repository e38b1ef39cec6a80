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
package net.boyechko.docx2tex.tag;

/**
 * A classified element of the document body. Payload-free structural tags are the constants of
 * {@link Element}; the records below carry the data needed to emit LaTeX.
 */
public sealed interface Tag
        permits Element,
                Tag.Hyperlink,
                Tag.BookmarkStart,
                Tag.ImageReference,
                Tag.MathOperator,
                Tag.Content,
                Tag.Unknown {

    /** {@code w:hyperlink} */
    record Hyperlink(Link link) implements Tag {}

    /** {@code w:bookmarkStart}; the anchor is empty when the markup names none. */
    record BookmarkStart(String anchor) implements Tag {}

    /** {@code a:blip}, the embedded picture's relationship id. */
    record ImageReference(String relationshipId) implements Tag {}

    /** {@code m:chr}, the operator glyph of an n-ary construct. */
    record MathOperator(String glyph) implements Tag {}

    /** Character data, already escaped for LaTeX. Never has children. */
    record Content(String text) implements Tag {}

    /** Any element outside the known set, kept for diagnostics only. */
    record Unknown(String qualifiedName) implements Tag {}

    default boolean is(Element element) {
        return this == element;
    }
}
