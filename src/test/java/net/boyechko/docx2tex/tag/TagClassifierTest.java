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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TagClassifierTest {

    private static Tag classify(String name, Attribute... attributes)
            throws MissingAttributesException {
        return TagClassifier.classify(QualifiedName.parse(name), List.of(attributes));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "w:document", "w:p", "w:r", "w:t", "w:bookmarkEnd", "w:drawing", "wp:inline",
                "wp:anchor", "a:graphic", "a:graphicData", "pic:pic", "pic:blipFill",
                "m:oMathPara", "m:oMath", "m:r", "m:t", "m:d", "m:rad", "m:deg", "m:sub",
                "m:sup", "m:f", "m:num", "m:den", "m:nary", "m:naryPr", "m:func", "m:fName"
            })
    void structuralElementsNeedNoAttributes(String name) throws Exception {
        Tag tag = classify(name);
        assertInstanceOf(Element.class, tag);
        assertEquals(name, ((Element) tag).qualifiedName());
    }

    @Test
    void hyperlinkPrefersRelationshipIdOverAnchor() throws Exception {
        Tag tag =
                classify(
                        "w:hyperlink",
                        Attribute.of("w:anchor", "Sec1"),
                        Attribute.of("r:id", "rId1"));
        assertEquals(new Tag.Hyperlink(new Link.Relationship("rId1")), tag);
    }

    @Test
    void hyperlinkFallsBackToAnchor() throws Exception {
        Tag tag = classify("w:hyperlink", Attribute.of("w:anchor", "Sec1"));
        assertEquals(new Tag.Hyperlink(new Link.Anchor("Sec1")), tag);
    }

    @Test
    void hyperlinkWithoutTargetListsBothAttributes() {
        MissingAttributesException e =
                assertThrows(
                        MissingAttributesException.class,
                        () -> classify("w:hyperlink", Attribute.of("w:history", "1")));
        assertEquals("w:hyperlink", e.tagId());
        assertEquals(List.of("r:id", "w:anchor"), e.missing());
        assertEquals(
                "Tag \"w:hyperlink\" is missing attributes \"r:id\", \"w:anchor\"", e.getMessage());
    }

    @Test
    void blipRequiresEmbed() throws Exception {
        assertEquals(
                new Tag.ImageReference("rId5"), classify("a:blip", Attribute.of("r:embed", "rId5")));

        MissingAttributesException e =
                assertThrows(MissingAttributesException.class, () -> classify("a:blip"));
        assertEquals(List.of("r:embed"), e.missing());
        assertEquals("Tag \"a:blip\" is missing attribute \"r:embed\"", e.getMessage());
    }

    @Test
    void mathCharacterRequiresValue() throws Exception {
        assertEquals(new Tag.MathOperator("∑"), classify("m:chr", Attribute.of("m:val", "∑")));

        MissingAttributesException e =
                assertThrows(MissingAttributesException.class, () -> classify("m:chr"));
        assertEquals("m:chr", e.tagId());
        assertEquals(List.of("m:val"), e.missing());
    }

    @Test
    void bookmarkStartReadsNameThenAnchor() throws Exception {
        assertEquals(
                new Tag.BookmarkStart("Sec1"),
                classify("w:bookmarkStart", Attribute.of("w:id", "0"), Attribute.of("w:name", "Sec1")));
        assertEquals(
                new Tag.BookmarkStart("Sec2"),
                classify("w:bookmarkStart", Attribute.of("w:anchor", "Sec2")));
    }

    @Test
    void bookmarkStartPrefersNameWhenBothArePresent() throws Exception {
        Tag tag =
                classify(
                        "w:bookmarkStart",
                        Attribute.of("w:anchor", "Legacy"),
                        Attribute.of("w:name", "Sec1"));
        assertEquals(new Tag.BookmarkStart("Sec1"), tag);
    }

    @Test
    void bookmarkStartWithoutNameIsNotAnError() throws Exception {
        assertEquals(new Tag.BookmarkStart(""), classify("w:bookmarkStart"));
    }

    @Test
    void unknownNamesKeepTheirQualifiedName() throws Exception {
        assertEquals(new Tag.Unknown("w:body"), classify("w:body"));
        assertEquals(new Tag.Unknown(":p"), classify("p"));
    }

    @Test
    void classificationIgnoresNamespaceUris() throws Exception {
        QualifiedName strict = QualifiedName.fromQName(new QName("urn:strict", "p", "w"));
        QualifiedName transitional =
                QualifiedName.fromQName(
                        new QName("http://schemas.openxmlformats.org/wordprocessingml/2006/main", "p", "w"));
        assertEquals(
                TagClassifier.classify(strict, List.of()),
                TagClassifier.classify(transitional, List.of()));
        assertSame(Element.PARAGRAPH, TagClassifier.classify(strict, List.of()));
    }

    @Test
    void attributeNamesAreMatchedByPrefixAndLocalName() throws Exception {
        // an unprefixed "id" is not "r:id"
        Tag tag =
                classify("w:hyperlink", Attribute.of("id", "rId1"), Attribute.of("w:anchor", "A"));
        assertEquals(new Tag.Hyperlink(new Link.Anchor("A")), tag);
    }
}
