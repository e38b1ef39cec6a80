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
package net.boyechko.docx2tex.latex;

/**
 * Makes decoded document text safe for LaTeX. Each character is handled on its own; replacements
 * that end in a control word carry a trailing space so the next letter cannot extend it.
 */
public final class LatexEscaper {

    private LatexEscaper() {}

    public static String escape(String text, boolean mathMode) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        text.codePoints().forEach(cp -> sb.append(escape(cp, mathMode)));
        return sb.toString();
    }

    static String escape(int codePoint, boolean mathMode) {
        return switch (codePoint) {
            case '∞' -> "\\infty ";
            case 'π' -> "\\pi ";
            case '&' -> "\\& ";
            case '%' -> "\\% ";
            case '$' -> "\\$ ";
            case '{' -> "\\{ ";
            case '#' -> "\\# ";
            case '}' -> "\\} ";
            case '~' -> "\\~{} ";
            case '_' -> "\\_ ";
            case '±' -> "\\pm ";
            case '∓' -> "\\mp ";
            case '<' -> mathMode ? "<" : "\\textless ";
            case '>' -> mathMode ? ">" : "\\textgreater ";
            default -> new String(Character.toChars(codePoint));
        };
    }
}
