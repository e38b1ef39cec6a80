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

import java.util.Optional;
import net.boyechko.docx2tex.stack.PeekCursor;
import net.boyechko.docx2tex.tag.Element;
import net.boyechko.docx2tex.tag.Link;
import net.boyechko.docx2tex.tag.Tag;

/**
 * Recognizes multi-tag shapes at the top of the context stack. Every pattern resets the cursor and
 * then walks down a fixed number of frames; a single mismatch discards the whole match.
 */
public final class StructuralPatterns {

    private StructuralPatterns() {}

    /**
     * Tries the patterns from most to least specific and returns the first match. Order matters:
     * hyperlinked text is also plain word text.
     */
    public static Optional<StructuralMatch> firstMatch(PeekCursor<Tag> cursor) {
        Optional<StructuralMatch> match = drawing(cursor).map(StructuralMatch.Drawing::new);
        if (match.isEmpty()) {
            match = hyperlink(cursor);
        }
        if (match.isEmpty()) {
            match = wordText(cursor).map(StructuralMatch.WordText::new);
        }
        if (match.isEmpty()) {
            match = mathText(cursor).map(StructuralMatch.MathText::new);
        }
        return match;
    }

    /**
     * {@code w:drawing > (wp:inline | wp:anchor) > a:graphic > a:graphicData > pic:pic >
     * pic:blipFill > a:blip}
     */
    public static Optional<String> drawing(PeekCursor<Tag> cursor) {
        cursor.reset();
        Optional<Tag.ImageReference> blip = peekAs(cursor, Tag.ImageReference.class);
        if (blip.isEmpty()
                || !expect(cursor, Element.PICTURE_FILL)
                || !expect(cursor, Element.PICTURE)
                || !expect(cursor, Element.GRAPHIC_DATA)
                || !expect(cursor, Element.GRAPHIC)
                || !expect(cursor, Element.INLINE, Element.ANCHOR)
                || !expect(cursor, Element.DRAWING)) {
            return Optional.empty();
        }
        return Optional.of(blip.get().relationshipId());
    }

    /** {@code w:hyperlink > w:r > w:t > content} */
    public static Optional<StructuralMatch> hyperlink(PeekCursor<Tag> cursor) {
        cursor.reset();
        Optional<Tag.Content> content = peekAs(cursor, Tag.Content.class);
        if (content.isEmpty()
                || !expect(cursor, Element.WORD_TEXT)
                || !expect(cursor, Element.WORD_RUN)) {
            return Optional.empty();
        }
        Optional<Link> link = peekAs(cursor, Tag.Hyperlink.class).map(Tag.Hyperlink::link);
        return link.map(l -> new StructuralMatch.HyperlinkText(l, content.get().text()));
    }

    /** {@code w:r > w:t > content} */
    public static Optional<String> wordText(PeekCursor<Tag> cursor) {
        return runText(cursor, Element.WORD_TEXT, Element.WORD_RUN);
    }

    /** {@code m:r > m:t > content} */
    public static Optional<String> mathText(PeekCursor<Tag> cursor) {
        return runText(cursor, Element.MATH_TEXT, Element.MATH_RUN);
    }

    private static Optional<String> runText(PeekCursor<Tag> cursor, Element text, Element run) {
        cursor.reset();
        Optional<Tag.Content> content = peekAs(cursor, Tag.Content.class);
        if (content.isEmpty() || !expect(cursor, text) || !expect(cursor, run)) {
            return Optional.empty();
        }
        return Optional.of(content.get().text());
    }

    /** Peeks once and succeeds if the frame is one of {@code accepted}. */
    private static boolean expect(PeekCursor<Tag> cursor, Element... accepted) {
        Optional<Tag> frame = cursor.peek();
        if (frame.isEmpty()) {
            return false;
        }
        for (Element element : accepted) {
            if (frame.get().is(element)) {
                return true;
            }
        }
        return false;
    }

    private static <R extends Tag> Optional<R> peekAs(PeekCursor<Tag> cursor, Class<R> type) {
        return cursor.peek().filter(type::isInstance).map(type::cast);
    }
}
