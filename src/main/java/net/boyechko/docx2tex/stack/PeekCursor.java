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

/**
 * Looks backwards from the top of a stack, one level deeper on every {@link #peek()} call. The
 * cursor owns only its depth counter; it cannot modify the stack it reads.
 */
public final class PeekCursor<T> {
    private final StackView<T> stack;
    private int depth;

    public PeekCursor(StackView<T> stack) {
        this.stack = stack;
    }

    /**
     * Returns the element {@code depth} positions below the top and advances the depth. Once the
     * depth reaches the stack size every further call returns empty.
     */
    public Optional<T> peek() {
        int peeked = depth;
        if (depth < Integer.MAX_VALUE) {
            depth++;
        }
        if (peeked >= stack.size()) {
            return Optional.empty();
        }
        return Optional.of(stack.get(stack.size() - peeked - 1));
    }

    /** Moves the cursor back to the top without touching the stack. */
    public void reset() {
        depth = 0;
    }

    public int depth() {
        return depth;
    }

    public Optional<T> last() {
        return stack.last();
    }
}
