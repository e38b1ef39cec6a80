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

import javax.xml.namespace.QName;

/**
 * Element or attribute name as written in the markup. Namespace URIs are not part of
 * the identity: {@code w:p} classifies the same way whatever namespace {@code w} is bound to.
 */
public record QualifiedName(String prefix, String localName) {

    public QualifiedName {
        prefix = prefix != null ? prefix : "";
        if (localName == null) {
            throw new IllegalArgumentException("Local name is required");
        }
    }

    public static QualifiedName of(String prefix, String localName) {
        return new QualifiedName(prefix, localName);
    }

    /** Parses {@code prefix:local}; a name without a colon has an empty prefix. */
    public static QualifiedName parse(String name) {
        int colon = name.indexOf(':');
        if (colon < 0) {
            return new QualifiedName("", name);
        }
        return new QualifiedName(name.substring(0, colon), name.substring(colon + 1));
    }

    public static QualifiedName fromQName(QName name) {
        return new QualifiedName(name.getPrefix(), name.getLocalPart());
    }

    /**
     * Returns {@code prefix:localName}. An empty prefix yields a leading colon, so an unprefixed
     * {@code p} never collides with {@code w:p}.
     */
    public String normalized() {
        return prefix + ":" + localName;
    }

    @Override
    public String toString() {
        return normalized();
    }
}
