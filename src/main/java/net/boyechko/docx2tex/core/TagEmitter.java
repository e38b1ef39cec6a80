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

import java.io.IOException;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import net.boyechko.docx2tex.latex.LatexWriter;
import net.boyechko.docx2tex.latex.NaryOperators;
import net.boyechko.docx2tex.match.StructuralMatch;
import net.boyechko.docx2tex.rels.RelationshipMap;
import net.boyechko.docx2tex.tag.Element;
import net.boyechko.docx2tex.tag.Link;
import net.boyechko.docx2tex.tag.MissingAttributesException;
import net.boyechko.docx2tex.tag.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes the LaTeX for tag-open, pattern-match and tag-close events. */
class TagEmitter {
    private static final Logger logger = LoggerFactory.getLogger(TagEmitter.class);

    private static final String MATH_CHAR = "m:chr";

    private final LatexWriter out;
    private final RelationshipMap rels;
    private final ConversionProfile profile;
    private final ConversionState state;

    TagEmitter(
            LatexWriter out,
            RelationshipMap rels,
            ConversionProfile profile,
            ConversionState state) {
        this.out = out;
        this.rels = rels;
        this.profile = profile;
        this.state = state;
    }

    /** Called before the tag is pushed. */
    void open(Tag tag) throws IOException {
        if (tag instanceof Element element) {
            openElement(element);
        } else if (tag instanceof Tag.MathOperator operator) {
            if (!NaryOperators.isKnown(operator.glyph())) {
                logger.warn("No LaTeX macro for n-ary operator '{}'", operator.glyph());
            }
            out.macro(NaryOperators.macroFor(operator.glyph()));
            state.operatorSeen();
        } else if (tag instanceof Tag.BookmarkStart bookmark && bookmark.anchor().isEmpty()) {
            state.report(
                    IssueType.MISSING_BOOKMARK_NAME,
                    IssueSev.WARNING,
                    "Tag \"w:bookmarkStart\" is missing attribute \"w:name\"");
        }
    }

    private void openElement(Element element) throws IOException {
        switch (element) {
            case MATH_PARAGRAPH -> {
                out.write("$$");
                state.enterMathParagraph();
            }
            case DELIMITER -> out.write("(");
            case RADICAL -> out.macro("sqrt");
            case DEGREE -> out.write("[");
            case SUBSCRIPT -> out.write("_{");
            case SUPERSCRIPT -> out.write("^{");
            case FRACTION -> out.macro("frac");
            case NUMERATOR, DENOMINATOR -> out.write("{");
            case NARY_PROPERTIES -> state.enterNaryProperties();
            default -> {}
        }
    }

    /** Called for a tag that could not be classified and will not be pushed. */
    void rejected(MissingAttributesException e) {
        state.report(IssueType.MISSING_ATTRIBUTES, IssueSev.ERROR, e.getMessage());
        if (MATH_CHAR.equals(e.tagId()) && state.isInNary()) {
            // the operator is still there, only its glyph is unknown
            state.operatorSeen();
        }
    }

    void structural(StructuralMatch match) throws IOException {
        if (match instanceof StructuralMatch.Drawing drawing) {
            drawing(drawing.relationshipId());
        } else if (match instanceof StructuralMatch.HyperlinkText text) {
            hyperlink(text.link(), text.content());
        } else if (match instanceof StructuralMatch.WordText text) {
            out.write(text.content());
        } else if (match instanceof StructuralMatch.MathText text) {
            out.write(text.content());
        }
    }

    private void drawing(String relationshipId) throws IOException {
        var target = rels.resolve(relationshipId);
        if (target.isEmpty()) {
            state.report(
                    IssueType.UNRESOLVED_IMAGE,
                    IssueSev.ERROR,
                    "Drawing relies on a missing relationship \"" + relationshipId + "\"");
            return;
        }
        String stem =
                LatexWriter.fileStem(target.get())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Relationship \""
                                                        + relationshipId
                                                        + "\" does not point to an image file: "
                                                        + target.get()));
        out.includeGraphics(profile.graphicsOptions(), stem);
    }

    private void hyperlink(Link link, String content) throws IOException {
        if (link instanceof Link.Anchor anchor) {
            out.hyperlink(anchor.name(), content);
        } else if (link instanceof Link.Relationship relationship) {
            var url = rels.resolve(relationship.id());
            if (url.isPresent()) {
                out.href(url.get(), content);
            } else {
                state.report(
                        IssueType.UNRESOLVED_HYPERLINK,
                        IssueSev.WARNING,
                        "Hyperlink relies on a missing relationship \"" + relationship.id() + "\"");
                out.write(content);
            }
        }
    }

    /** Single-tag rules, used when no structural pattern matched. Called before the tag is popped. */
    void close(Tag tag) throws IOException {
        if (tag instanceof Element element) {
            closeElement(element);
        } else if (tag instanceof Tag.BookmarkStart bookmark) {
            out.hypertarget(bookmark.anchor());
        }
    }

    private void closeElement(Element element) throws IOException {
        switch (element) {
            case PARAGRAPH -> {
                out.newline();
                out.newline();
            }
            case DELIMITER -> out.write(")");
            case MATH_PARAGRAPH -> {
                out.write("$$");
                out.newline();
                state.exitMathParagraph();
            }
            case DEGREE -> out.write("]{");
            case SUBSCRIPT, SUPERSCRIPT, NUMERATOR, DENOMINATOR, RADICAL, BOOKMARK_END -> out.write(
                    "}");
            case NARY_PROPERTIES -> {
                if (state.exitNaryProperties()) {
                    out.macro(NaryOperators.DEFAULT_MACRO);
                }
            }
            default -> {}
        }
    }
}
