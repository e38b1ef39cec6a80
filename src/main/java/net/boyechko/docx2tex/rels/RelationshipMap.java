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
package net.boyechko.docx2tex.rels;

import java.util.Map;
import java.util.Optional;

/**
 * Relationship id to target (URL or package path). Immutable, so one map may be read by several
 * conversions at once.
 */
public final class RelationshipMap {
    private static final RelationshipMap EMPTY = new RelationshipMap(Map.of());

    private final Map<String, String> targets;

    private RelationshipMap(Map<String, String> targets) {
        this.targets = Map.copyOf(targets);
    }

    public static RelationshipMap of(Map<String, String> targets) {
        return new RelationshipMap(targets);
    }

    public static RelationshipMap empty() {
        return EMPTY;
    }

    public Optional<String> resolve(String id) {
        return Optional.ofNullable(targets.get(id));
    }

    public boolean contains(String id) {
        return targets.containsKey(id);
    }

    public int size() {
        return targets.size();
    }

    public Map<String, String> asMap() {
        return targets;
    }

    @Override
    public String toString() {
        return "RelationshipMap" + targets;
    }
}
