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
import java.util.stream.Collectors;

/** Thrown when a tag lacks the attributes needed to classify it. */
public class MissingAttributesException extends Exception {
    private final String tagId;
    private final List<String> missing;

    public MissingAttributesException(String tagId, List<String> missing) {
        super(buildMessage(tagId, missing));
        this.tagId = tagId;
        this.missing = List.copyOf(missing);
    }

    public String tagId() {
        return tagId;
    }

    public List<String> missing() {
        return missing;
    }

    private static String buildMessage(String tagId, List<String> missing) {
        String names = missing.stream().map(n -> "\"" + n + "\"").collect(Collectors.joining(", "));
        String noun = missing.size() == 1 ? "attribute" : "attributes";
        return "Tag \"" + tagId + "\" is missing " + noun + " " + names;
    }
}
