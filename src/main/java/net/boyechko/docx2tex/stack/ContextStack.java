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

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Ordered path of currently open tags, root first. Only the owner pushes and pops; pattern
 * matchers get the {@link #cursor()}.
 */
public class ContextStack<T> implements StackView<T> {
    private final List<T> elements;
    private final PeekCursor<T> cursor;

    public ContextStack() {
        this(new ArrayList<>());
    }

    private ContextStack(List<T> elements) {
        this.elements = elements;
        this.cursor = new PeekCursor<>(this);
    }

    /** Builds a stack whose bottom is the first element of {@code elements}. */
    public static <T> ContextStack<T> of(List<T> elements) {
        return new ContextStack<>(new ArrayList<>(elements));
    }

    public void push(T element) {
        elements.add(element);
    }

    public T pop() {
        if (elements.isEmpty()) {
            throw new NoSuchElementException("Pop from empty context stack");
        }
        return elements.remove(elements.size() - 1);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public T get(int index) {
        return elements.get(index);
    }

    public PeekCursor<T> cursor() {
        return cursor;
    }

    public Optional<T> peek() {
        return cursor.peek();
    }

    public void reset() {
        cursor.reset();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
