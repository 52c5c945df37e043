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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArrayStack Tests")
class ArrayStackTest {

    @Test
    @DisplayName("Pop returns the last pushed, peek the one beneath")
    void testPopThenPeek() {
        var stack = new ArrayStack<Character>();
        for (char c : "abcd".toCharArray()) {
            stack.push(c);
        }
        assertEquals("ArrayStack(top→[d, c, b, a])", stack.toString());

        assertEquals('d', stack.pop());
        assertEquals('c', stack.peek());
        assertEquals(3, stack.size());
    }

    @Test
    @DisplayName("Pop and peek on empty stack fail")
    void testEmpty() {
        var stack = new ArrayStack<String>();
        assertTrue(stack.isEmpty());
        assertThrows(EmptyCollectionException.class, stack::pop);
        assertThrows(EmptyCollectionException.class, stack::peek);

        stack.push("x");
        stack.pop();
        assertThrows(EmptyCollectionException.class, stack::pop);
    }

    @Test
    @DisplayName("Stack grows past its initial capacity")
    void testGrowth() {
        var stack = new ArrayStack<Integer>(0);
        for (int i = 0; i < 1000; i++) {
            stack.push(i);
        }
        assertEquals(1000, stack.size());
        for (int i = 999; i >= 0; i--) {
            assertEquals(i, stack.pop());
        }
        assertTrue(stack.isEmpty());
    }
}
