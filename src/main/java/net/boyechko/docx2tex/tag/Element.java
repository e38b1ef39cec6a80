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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Semantic tags that carry no payload, keyed by their normalized qualified name. */
public enum Element implements Tag {
    // WordprocessingML
    DOCUMENT("w:document"),
    PARAGRAPH("w:p"),
    WORD_RUN("w:r"),
    WORD_TEXT("w:t"),
    BOOKMARK_END("w:bookmarkEnd"),
    DRAWING("w:drawing"),

    // DrawingML
    INLINE("wp:inline"),
    ANCHOR("wp:anchor"),
    GRAPHIC("a:graphic"),
    GRAPHIC_DATA("a:graphicData"),
    PICTURE("pic:pic"),
    PICTURE_FILL("pic:blipFill"),

    // Office MathML
    MATH_PARAGRAPH("m:oMathPara"),
    MATH("m:oMath"),
    MATH_RUN("m:r"),
    MATH_TEXT("m:t"),
    DELIMITER("m:d"),
    RADICAL("m:rad"),
    DEGREE("m:deg"),
    SUBSCRIPT("m:sub"),
    SUPERSCRIPT("m:sup"),
    FRACTION("m:f"),
    NUMERATOR("m:num"),
    DENOMINATOR("m:den"),
    NARY("m:nary"),
    NARY_PROPERTIES("m:naryPr"),
    FUNCTION("m:func"),
    FUNCTION_NAME("m:fName");

    private static final Map<String, Element> BY_NAME =
            Arrays.stream(values())
                    .collect(Collectors.toUnmodifiableMap(Element::qualifiedName, Function.identity()));

    private final String qualifiedName;

    Element(String qualifiedName) {
        this.qualifiedName = qualifiedName;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public static Optional<Element> forName(String normalizedName) {
        return Optional.ofNullable(BY_NAME.get(normalizedName));
    }
}
