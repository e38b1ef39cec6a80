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

import java.util.List;
import java.util.Optional;

/**
 * Maps an opening tag to its {@link Tag}. Classification depends only on the name and the
 * attributes, never on where the tag appears.
 */
public final class TagClassifier {
    static final String HYPERLINK = "w:hyperlink";
    static final String BOOKMARK_START = "w:bookmarkStart";
    static final String BLIP = "a:blip";
    static final String MATH_CHAR = "m:chr";

    static final String RELATIONSHIP_ID = "r:id";
    static final String EMBED = "r:embed";
    static final String ANCHOR = "w:anchor";
    static final String NAME = "w:name";
    static final String MATH_VALUE = "m:val";

    private TagClassifier() {}

    public static Tag classify(QualifiedName name, List<Attribute> attributes)
            throws MissingAttributesException {
        String id = name.normalized();

        Optional<Element> element = Element.forName(id);
        if (element.isPresent()) {
            return element.get();
        }

        switch (id) {
            case HYPERLINK -> {
                Optional<String> relId = find(attributes, RELATIONSHIP_ID);
                if (relId.isPresent()) {
                    return new Tag.Hyperlink(new Link.Relationship(relId.get()));
                }
                Optional<String> anchor = find(attributes, ANCHOR);
                if (anchor.isPresent()) {
                    return new Tag.Hyperlink(new Link.Anchor(anchor.get()));
                }
                throw new MissingAttributesException(id, List.of(RELATIONSHIP_ID, ANCHOR));
            }
            case BOOKMARK_START -> {
                // w:name is what Word writes; w:anchor is accepted as well
                String anchor = find(attributes, NAME).or(() -> find(attributes, ANCHOR)).orElse("");
                return new Tag.BookmarkStart(anchor);
            }
            case BLIP -> {
                return new Tag.ImageReference(require(id, attributes, EMBED));
            }
            case MATH_CHAR -> {
                return new Tag.MathOperator(require(id, attributes, MATH_VALUE));
            }
            default -> {
                return new Tag.Unknown(id);
            }
        }
    }

    private static String require(String id, List<Attribute> attributes, String attribute)
            throws MissingAttributesException {
        Optional<String> value = find(attributes, attribute);
        if (value.isEmpty()) {
            throw new MissingAttributesException(id, List.of(attribute));
        }
        return value.get();
    }

    private static Optional<String> find(List<Attribute> attributes, String normalizedName) {
        for (Attribute attribute : attributes) {
            if (attribute.hasName(normalizedName)) {
                return Optional.ofNullable(attribute.value());
            }
        }
        return Optional.empty();
    }
}
