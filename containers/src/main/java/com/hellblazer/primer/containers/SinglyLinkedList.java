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

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Singly linked list. Insert and delete are O(1) at the head and O(pos) elsewhere. The list owns its chain of nodes
 * exclusively; nodes never escape.
 *
 * @author hal.hildebrand
 */
public final class SinglyLinkedList<T> implements Iterable<T> {

    private static final class Node<T> {
        private final T       value;
        private       Node<T> next;

        private Node(T value, Node<T> next) {
            this.value = value;
            this.next = next;
        }
    }

    private class Cursor implements Iterator<T> {
        private final int     expectedModCount = modCount;
        private       Node<T> next             = head;

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (next == null) {
                throw new NoSuchElementException();
            }
            T value = next.value;
            next = next.next;
            return value;
        }
    }

    private Node<T> head;
    private int     size;
    private int     modCount;

    /**
     * Remove the element at pos.
     *
     * @return the removed element
     * @throws IndexOutOfRangeException if the list is empty or pos is not in [0, size)
     */
    public T delete(int pos) {
        if (head == null) {
            throw new IndexOutOfRangeException("delete from empty list");
        }
        if (pos < 0 || pos >= size) {
            throw new IndexOutOfRangeException(pos, size);
        }
        T value;
        if (pos == 0) {
            value = head.value;
            head = head.next;
        } else {
            var prev = nodeAt(pos - 1);
            value = prev.next.value;
            prev.next = prev.next.next;
        }
        size--;
        modCount++;
        return value;
    }

    /**
     * Insert value so that it occupies pos. Position 0 prepends.
     *
     * @throws IndexOutOfRangeException if pos is not in [0, size]
     */
    public void insert(int pos, T value) {
        if (pos < 0 || pos > size) {
            throw new IndexOutOfRangeException(pos, size);
        }
        if (pos == 0) {
            head = new Node<>(value, head);
        } else {
            var prev = nodeAt(pos - 1);
            prev.next = new Node<>(value, prev.next);
        }
        size++;
        modCount++;
    }

    public boolean isEmpty() {
        return head == null;
    }

    /**
     * Fail fast cursor over the list in order, starting from the current head.
     */
    @Override
    public Iterator<T> iterator() {
        return new Cursor();
    }

    public int size() {
        return size;
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), size, Spliterator.ORDERED);
    }

    @Override
    public String toString() {
        return traverse().map(String::valueOf).collect(Collectors.joining(", ", "SinglyLinkedList[", "]"));
    }

    /**
     * @return a lazy stream of the values in list order. The cursor and size bind when the terminal operation starts,
     * so changes made between creating the stream and consuming it are seen.
     */
    public Stream<T> traverse() {
        return StreamSupport.stream(this::spliterator, Spliterator.ORDERED | Spliterator.SIZED | Spliterator.SUBSIZED,
                                    false);
    }

    private Node<T> nodeAt(int pos) {
        var current = head;
        for (int i = 0; i < pos; i++) {
            current = current.next;
        }
        return current;
    }
}
