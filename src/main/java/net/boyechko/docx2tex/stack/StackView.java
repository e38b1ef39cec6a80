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
package net.boyechko.docx2tex.stack;

import java.util.Optional;

/** Read-only access to a stack, indexed from the bottom. */
public interface StackView<T> {

    int size();

    /** Returns the element at {@code index} counted from the bottom (0 = oldest). */
    T get(int index);

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Returns the most recently pushed element, if any. */
    default Optional<T> last() {
        return isEmpty() ? Optional.empty() : Optional.of(get(size() - 1));
    }
}
