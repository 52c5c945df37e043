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

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed capacity array with explicit O(n) insert and delete. Elements occupy [0, size) contiguously; every slot at or
 * beyond size is null.
 *
 * @author hal.hildebrand
 */
public final class BoundedArray<T> {

    /** The backing store, never resized. */
    private final Object[] array;
    private       int      size;

    public BoundedArray(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        array = new Object[capacity];
    }

    public T access(int index) {
        ensureIndexInRange(index);
        return elementAt(index);
    }

    public int capacity() {
        return array.length;
    }

    /**
     * Remove the element at index, shifting the tail left by one.
     *
     * @return the removed element
     * @throws IndexOutOfRangeException if index is not in [0, size)
     */
    public T delete(int index) {
        ensureIndexInRange(index);
        T value = elementAt(index);
        if (index < size - 1) {
            System.arraycopy(array, index + 1, array, index, size - index - 1);
        }
        array[--size] = null;
        return value;
    }

    /**
     * Insert value at index, shifting the tail right by one to make room.
     *
     * @throws CapacityExceededException if the array is full
     * @throws IndexOutOfRangeException  if index is not in [0, size]
     */
    public void insert(int index, T value) {
        if (size == array.length) {
            throw new CapacityExceededException(array.length);
        }
        if (index < 0 || index > size) {
            throw new IndexOutOfRangeException(index, size);
        }
        System.arraycopy(array, index, array, index + 1, size - index);
        array[index] = value;
        size++;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == array.length;
    }

    /**
     * Replace the element at index.
     *
     * @return the previous element
     */
    public T set(int index, T value) {
        ensureIndexInRange(index);
        T previous = elementAt(index);
        array[index] = value;
        return previous;
    }

    public int size() {
        return size;
    }

    public List<T> toList() {
        var list = new ArrayList<T>(size);
        for (int i = 0; i < size; i++) {
            list.add(elementAt(i));
        }
        return list;
    }

    @Override
    public String toString() {
        return "BoundedArray" + toList();
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int index) {
        return (T) array[index];
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfRangeException(index, size);
        }
    }
}
