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
 * Order statistics with the two stock strategies. Both reorder the list in place.
 *
 * @author hal.hildebrand
 */
public final class Selection {

    private static final QuickSelector DETERMINISTIC = new QuickSelector(new MedianOfMediansPivot());
    private static final QuickSelector RANDOMIZED    = new QuickSelector(new RandomPivot());

    /**
     * Worst case linear selection using median of medians pivots.
     */
    public static <T extends Comparable<? super T>> T deterministic(List<T> list, int k) {
        return DETERMINISTIC.select(list, k);
    }

    public static <T> T deterministic(List<T> list, int k, Comparator<? super T> cmp) {
        return DETERMINISTIC.select(list, k, cmp);
    }

    /**
     * Expected linear selection using uniformly random pivots.
     */
    public static <T extends Comparable<? super T>> T randomized(List<T> list, int k) {
        return RANDOMIZED.select(list, k);
    }

    public static <T> T randomized(List<T> list, int k, Comparator<? super T> cmp) {
        return RANDOMIZED.select(list, k, cmp);
    }

    private Selection() {
    }
}
