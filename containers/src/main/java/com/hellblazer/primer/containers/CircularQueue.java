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

import java.util.StringJoiner;

/**
 * Fixed capacity FIFO queue over a circular buffer. Elements are dequeued at head and enqueued at tail, both indices
 * advancing modulo the capacity. A dequeued slot is cleared immediately.
 *
 * @author hal.hildebrand
 */
public final class CircularQueue<T> {

    private final Object[] buffer;
    private       int      head;
    private       int      tail;
    private       int      size;

    public CircularQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        buffer = new Object[capacity];
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * @throws EmptyCollectionException if the queue is empty
     */
    public T dequeue() {
        if (size == 0) {
            throw new EmptyCollectionException("dequeue from empty queue");
        }
        T value = slot(head);
        buffer[head] = null;
        head = (head + 1) % buffer.length;
        size--;
        return value;
    }

    /**
     * @throws CapacityExceededException if the queue is full
     */
    public void enqueue(T value) {
        if (size == buffer.length) {
            throw new CapacityExceededException(buffer.length);
        }
        buffer[tail] = value;
        tail = (tail + 1) % buffer.length;
        size++;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == buffer.length;
    }

    public int size() {
        return size;
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "CircularQueue[", "]");
        for (int i = 0; i < size; i++) {
            joiner.add(String.valueOf(buffer[(head + i) % buffer.length]));
        }
        return joiner.toString();
    }

    int headIndex() {
        return head;
    }

    /** Raw buffer slot, regardless of whether it is occupied. */
    @SuppressWarnings("unchecked")
    T slot(int index) {
        return (T) buffer[index];
    }
}
