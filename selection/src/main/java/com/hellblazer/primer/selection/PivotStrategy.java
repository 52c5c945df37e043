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
 * Chooses the pivot for one partitioning step of a {@link QuickSelector}.
 *
 * @author hal.hildebrand
 */
public interface PivotStrategy {

    /**
     * Find the index of the pivot to partition list[low..high] around. Implementations may read but must not modify
     * the list.
     *
     * @param low  inclusive lower bound
     * @param high inclusive upper bound
     * @return an index in [low, high]
     */
    <T> int pivotIndex(List<T> list, int low, int high, Comparator<? super T> cmp);
}
