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

import java.util.Comparator;
import java.util.List;

/**
 * Lomuto partitioning, the primitive shared by every selector.
 *
 * @author hal.hildebrand
 */
public final class Partition {

    /**
     * Partition list[low..high] around the element at pivot. On return every element in [low, p) compares strictly
     * less than list[p] and every element in (p, high] compares greater than or equal to it, where p is the returned
     * index. Elements that compare equal are not kept in their original order.
     *
     * @param low   inclusive lower bound
     * @param high  inclusive upper bound
     * @param pivot index of the pivot element, low &lt;= pivot &lt;= high
     * @return the final index of the pivot element
     */
    public static <T> int lomuto(List<T> list, int low, int high, int pivot, Comparator<? super T> cmp) {
        swap(list, pivot, high);
        T pivotValue = list.get(high);
        int store = low;
        for (int i = low; i < high; ++i) {
            if (cmp.compare(list.get(i), pivotValue) < 0) {
                swap(list, store, i);
                ++store;
            }
        }
        swap(list, high, store);
        return store;
    }

    static <T> void swap(List<T> list, int i, int j) {
        if (i == j) {
            return;
        }
        T value = list.get(i);
        list.set(i, list.get(j));
        list.set(j, value);
    }

    private Partition() {
    }
}
