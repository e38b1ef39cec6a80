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

import javax.xml.stream.Location;

/** Position in the document markup where an issue was observed. */
public record IssueLoc(Integer line, Integer column) {
    private static final IssueLoc NONE = new IssueLoc(null, null);

    public static IssueLoc none() {
        return NONE;
    }

    /** Converts a StAX location, treating negative values as unknown. */
    public static IssueLoc fromLocation(Location location) {
        if (location == null) {
            return NONE;
        }
        Integer line = location.getLineNumber() >= 0 ? location.getLineNumber() : null;
        Integer column = location.getColumnNumber() >= 0 ? location.getColumnNumber() : null;
        return new IssueLoc(line, column);
    }

    public boolean isKnown() {
        return line != null;
    }

    @Override
    public String toString() {
        if (line == null) {
            return "";
        }
        return column != null ? "line " + line + ", column " + column : "line " + line;
    }
}
