/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Primer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.primer.containers;

import java.util.Arrays;

/**
 * LIFO stack over a growable array. The top of the stack is the last occupied slot.
 *
 * @author hal.hildebrand
 */
public final class ArrayStack<T> {

    private static final int DEFAULT_CAPACITY = 10;

    private Object[] array;
    private int      size;

    public ArrayStack() {
        this(DEFAULT_CAPACITY);
    }

    public ArrayStack(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity cannot be negative: " + initialCapacity);
        }
        array = new Object[initialCapacity];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @throws EmptyCollectionException if the stack is empty
     */
    public T peek() {
        if (size == 0) {
            throw new EmptyCollectionException("peek on empty stack");
        }
        return elementAt(size - 1);
    }

    /**
     * @throws EmptyCollectionException if the stack is empty
     */
    public T pop() {
        if (size == 0) {
            throw new EmptyCollectionException("pop from empty stack");
        }
        T value = elementAt(--size);
        array[size] = null;
        return value;
    }

    public void push(T value) {
        if (size == array.length) {
            // Resize to 1.5x the size
            array = Arrays.copyOf(array, ((size * 3) / 2) + 1);
        }
        array[size++] = value;
    }

    public int size() {
        return size;
    }

    @Override
    public String toString() {
        var buf = new StringBuilder("ArrayStack(top→[");
        for (int i = size - 1; i >= 0; i--) {
            buf.append(array[i]);
            if (i > 0) {
                buf.append(", ");
            }
        }
        return buf.append("])").toString();
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int index) {
        return (T) array[index];
    }
}
