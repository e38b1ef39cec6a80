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

import java.util.Map;

/** Maps n-ary operator glyphs to the LaTeX macro that typesets them. */
public final class NaryOperators {
    /** Used by {@code m:naryPr} when no operator glyph is given. */
    public static final String DEFAULT_MACRO = "int";

    private static final Map<String, String> MACROS =
            Map.of(
                    "⋀", "bigwedge",
                    "⋁", "bigvee",
                    "⋂", "bigcap",
                    "⋃", "bigcup",
                    "∐", "coprod",
                    "∏", "prod",
                    "∑", "sum",
                    "∮", "oint");

    private NaryOperators() {}

    /** Returns the macro name without backslash, or an empty string for unknown glyphs. */
    public static String macroFor(String glyph) {
        return MACROS.getOrDefault(glyph, "");
    }

    public static boolean isKnown(String glyph) {
        return MACROS.containsKey(glyph);
    }
}
