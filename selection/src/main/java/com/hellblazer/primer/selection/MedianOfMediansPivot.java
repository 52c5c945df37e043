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

import java.util.Comparator;
import java.util.List;

/**
 * Median of medians pivoting. The candidate set starts as every index in the range and is repeatedly replaced by the
 * medians of its consecutive groups of five until at most five remain; the median of those is the pivot. At least
 * roughly 30% of the range lies on either side of the result, which bounds selection to linear time in the worst
 * case.
 * <p>
 * The reduction is iterative. Only indices move; the list itself is never touched.
 *
 * @author hal.hildebrand
 */
public final class MedianOfMediansPivot implements PivotStrategy {
    static final int GROUP_SIZE = 5;

    private static final Logger log = LoggerFactory.getLogger(MedianOfMediansPivot.class);

    /**
     * Stable insertion sort of indices[from, to) by the values they reference.
     */
    private static <T> void sortByValue(List<T> list, int[] indices, int from, int to, Comparator<? super T> cmp) {
        for (int i = from + 1; i < to; i++) {
            int index = indices[i];
            T value = list.get(index);
            int j = i - 1;
            while (j >= from && cmp.compare(list.get(indices[j]), value) > 0) {
                indices[j + 1] = indices[j];
                j--;
            }
            indices[j + 1] = index;
        }
    }

    @Override
    public <T> int pivotIndex(List<T> list, int low, int high, Comparator<? super T> cmp) {
        int count = high - low + 1;
        int[] indices = new int[count];
        for (int i = 0; i < count; i++) {
            indices[i] = low + i;
        }

        while (count > GROUP_SIZE) {
            int medians = 0;
            for (int start = 0; start < count; start += GROUP_SIZE) {
                int end = Math.min(start + GROUP_SIZE, count);
                sortByValue(list, indices, start, end, cmp);
                // medians <= start, so this never overwrites an unread group
                indices[medians++] = indices[start + (end - start) / 2];
            }
            if (log.isDebugEnabled()) {
                log.debug("reduced {} candidates to {} in [{}, {}]", count, medians, low, high);
            }
            count = medians;
        }

        sortByValue(list, indices, 0, count, cmp);
        return indices[count / 2];
    }

    @Override
    public String toString() {
        return "median-of-medians";
    }
}
