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
package com.hellblazer.primer.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Selects the k<sup>th</sup> smallest element of a list by repeated partitioning. Each step asks the
 * {@link PivotStrategy} for a pivot, partitions the live range around it, and narrows the range to the side holding k
 * until the pivot lands on k or the range shrinks to one element.
 * <p>
 * Selection reorders the list in place; pass a copy to keep the original order. Lists should be
 * {@link java.util.RandomAccess}.
 *
 * @author hal.hildebrand
 */
public class QuickSelector {
    private static final Logger log = LoggerFactory.getLogger(QuickSelector.class);

    private final PivotStrategy pivotStrategy;

    public QuickSelector(PivotStrategy pivotStrategy) {
        this.pivotStrategy = Objects.requireNonNull(pivotStrategy, "pivotStrategy");
    }

    private static void checkArgs(int left, int right, int size, int k) {
        if (size == 0) {
            throw new IllegalArgumentException("Cannot select from an empty list");
        }
        if (left < 0 || right >= size || left > right) {
            throw new IllegalArgumentException(
            "Invalid range [" + left + ", " + right + "] for list of size " + size);
        }
        if (k < left || k > right) {
            throw new IllegalArgumentException("k must be in [" + left + ", " + right + "]: " + k);
        }
    }

    /**
     * @return the k<sup>th</sup> smallest element of list under natural ordering
     * @throws IllegalArgumentException if list is empty or k is not in [0, size)
     */
    public <T extends Comparable<? super T>> T select(List<T> list, int k) {
        return select(list, k, Comparator.naturalOrder());
    }

    /**
     * @return the k<sup>th</sup> smallest element of list under cmp
     * @throws IllegalArgumentException if list is empty or k is not in [0, size)
     */
    public <T> T select(List<T> list, int k, Comparator<? super T> cmp) {
        Objects.requireNonNull(list, "list");
        return select(list, 0, list.size() - 1, k, cmp);
    }

    /**
     * Select within list[left..right] only. On return list[k] holds the selected element, everything in [left, k) is
     * no greater and everything in (k, right] no less.
     *
     * @throws IllegalArgumentException if the range is not within the list or k is not in [left, right]
     */
    public <T> T select(List<T> list, int left, int right, int k, Comparator<? super T> cmp) {
        Objects.requireNonNull(list, "list");
        Objects.requireNonNull(cmp, "cmp");
        checkArgs(left, right, list.size(), k);
        for (;;) {
            if (left == right) {
                return list.get(left);
            }
            int pivot = pivotStrategy.pivotIndex(list, left, right, cmp);
            pivot = Partition.lomuto(list, left, right, pivot, cmp);
            if (log.isDebugEnabled()) {
                log.debug("{} pivot landed at {} in [{}, {}], k={}", pivotStrategy, pivot, left, right, k);
            }
            if (k == pivot) {
                return list.get(k);
            } else if (k < pivot) {
                right = pivot - 1;
            } else {
                left = pivot + 1;
            }
        }
    }

    /**
     * Select from an array, reordering it in place.
     */
    public <T> T select(T[] array, int k, Comparator<? super T> cmp) {
        Objects.requireNonNull(array, "array");
        return select(Arrays.asList(array), k, cmp);
    }
}
