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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Node of an n-ary tree. A node owns its children in insertion order, and each node has at most one parent, so the
 * structure is always a tree.
 *
 * @author hal.hildebrand
 */
public final class TreeNode<T> {

    /**
     * Pre-order walk driven by an explicit stack, so deep trees do not consume call stack.
     */
    private static class PreOrder<T> implements Iterator<T> {
        private final Deque<TreeNode<T>> pending = new ArrayDeque<>();

        private PreOrder(TreeNode<T> root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public T next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            var node = pending.pop();
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
            return node.value;
        }
    }

    private final T                 value;
    private final List<TreeNode<T>> children = new ArrayList<>();
    private       TreeNode<T>       parent;

    public TreeNode(T value) {
        this.value = value;
    }

    /**
     * Append child as the last child of this node.
     *
     * @return the child
     * @throws IllegalArgumentException if child already has a parent or is an ancestor of this node
     */
    public TreeNode<T> addChild(TreeNode<T> child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) {
            throw new IllegalArgumentException("Node already has a parent: " + child);
        }
        for (var ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Adding " + child + " under " + this + " would create a cycle");
            }
        }
        child.parent = this;
        children.add(child);
        return child;
    }

    public TreeNode<T> addChild(T value) {
        return addChild(new TreeNode<>(value));
    }

    public List<TreeNode<T>> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return a lazy pre-order stream of the values in this subtree: this node first, then each child's subtree in
     * child order
     */
    public Stream<T> dfs() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new PreOrder<>(this), Spliterator.ORDERED),
                                    false);
    }

    @Override
    public String toString() {
        return "TreeNode(" + value + ")";
    }

    public T value() {
        return value;
    }
}
