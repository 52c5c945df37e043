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
package com.hellblazer.primer.demo;

import com.hellblazer.primer.containers.*;

import java.io.PrintStream;
import java.util.stream.Collectors;

/**
 * Walks each container through a short script, printing its state after every step.
 *
 * @author hal.hildebrand
 */
public class ContainerDemo {

    private final PrintStream out;

    public ContainerDemo(PrintStream out) {
        this.out = out;
    }

    public static int run(PrintStream out) {
        new ContainerDemo(out).execute();
        return 0;
    }

    public void execute() {
        array();
        matrix();
        stack();
        queue();
        linkedList();
        tree();
    }

    private void array() {
        out.println("Array:");
        var array = new BoundedArray<Integer>(5);
        for (int i = 0; i < 3; i++) {
            array.insert(i, i * 10);
        }
        out.println(array);
        array.delete(1);
        out.println("after delete: " + array);
        out.println();
    }

    private void linkedList() {
        out.println("LinkedList:");
        var list = new SinglyLinkedList<Integer>();
        for (int i = 0; i < 5; i++) {
            list.insert(i, i);
        }
        out.println(list);
        list.delete(2);
        out.println("after delete pos2: " + list);
        out.println();
    }

    private void matrix() {
        out.println("Matrix:");
        var matrix = Matrix.zeros(3, 3);
        for (int i = 0; i < 3; i++) {
            matrix.set(i, i, 1);
        }
        out.println(matrix);
        out.println();
    }

    private void queue() {
        out.println("Queue:");
        var queue = new CircularQueue<Integer>(4);
        for (int i = 0; i < 3; i++) {
            queue.enqueue(i);
        }
        out.println(queue);
        var head = queue.dequeue();
        out.println("dequeue-> " + head + " " + queue);
        queue.enqueue(99);
        out.println("after enqueue 99: " + queue);
        out.println();
    }

    private void stack() {
        out.println("Stack:");
        var stack = new ArrayStack<Character>();
        for (char c : "abcd".toCharArray()) {
            stack.push(c);
        }
        out.println(stack);
        var popped = stack.pop();
        out.println("pop-> " + popped + " peek-> " + stack.peek());
        out.println();
    }

    private void tree() {
        out.println("Tree demo (DFS):");
        var root = new TreeNode<>("root");
        var a = root.addChild("A");
        var b = root.addChild("B");
        a.addChild("A1");
        b.addChild("B1");
        b.addChild("B2");
        out.println("DFS traversal: " + root.dfs().collect(Collectors.toList()));
    }
}
