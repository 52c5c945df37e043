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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MedianOfMediansPivot Tests")
class MedianOfMediansPivotTest extends TestBase {

    private final MedianOfMediansPivot strategy = new MedianOfMediansPivot();

    @Test
    @DisplayName("Five or fewer candidates yield the true median")
    void testSmallRanges() {
        var list = List.of(40, 10, 50, 30, 20);
        assertEquals(30, list.get(strategy.pivotIndex(list, 0, 4, Comparator.naturalOrder())));
        assertEquals(3, strategy.pivotIndex(list, 1, 3, Comparator.naturalOrder()));
        assertEquals(2, strategy.pivotIndex(list, 2, 2, Comparator.naturalOrder()));
        // even count takes the upper median
        assertEquals(40, list.get(strategy.pivotIndex(list, 0, 3, Comparator.naturalOrder())));
    }

    @Test
    @DisplayName("Reduction over groups of five")
    void testReduction() {
        // groups [0..4] and [5..9] have medians 2 and 7; the upper of the two wins
        var list = new ArrayList<Integer>();
        for (int i = 0; i < 10; i++) {
            list.add(i);
        }
        assertEquals(7, strategy.pivotIndex(list, 0, 9, Comparator.naturalOrder()));
    }

    @Test
    @DisplayName("The list is never modified")
    void testReadOnly() {
        var list = shuffled(1_000);
        var copy = List.copyOf(list);
        strategy.pivotIndex(list, 0, list.size() - 1, Comparator.naturalOrder());
        assertEquals(copy, list);
    }

    @Test
    @DisplayName("Result always lies within the range")
    void testWithinRange() {
        for (int trial = 0; trial < 200; trial++) {
            var n = 1 + random.nextInt(300);
            var list = randomInts(n, 50);
            var low = random.nextInt(n);
            var high = low + random.nextInt(n - low);
            var index = strategy.pivotIndex(list, low, high, Comparator.naturalOrder());
            assertTrue(index >= low && index <= high, "index " + index + " outside [" + low + ", " + high + "]");
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 500, 1_000, 5_000 })
    @DisplayName("Pivot splits random inputs roughly 30/70 or better")
    void testPivotQuality(int n) {
        var trials = 200;
        var balanced = 0;
        var sum = 0.0;
        for (int trial = 0; trial < trials; trial++) {
            var list = shuffled(n);
            var pivot = strategy.pivotIndex(list, 0, n - 1, Comparator.naturalOrder());
            var p = Partition.lomuto(list, 0, n - 1, pivot, Comparator.naturalOrder());
            var fraction = (double) p / n;
            assertTrue(fraction > 0.1 && fraction < 0.9, "badly unbalanced pivot: " + fraction);
            if (p >= Math.ceil(0.3 * n) && p <= Math.floor(0.7 * n)) {
                balanced++;
            }
            sum += fraction;
        }
        assertTrue(balanced >= trials * 0.95, "only " + balanced + " of " + trials + " pivots were balanced");
        var mean = sum / trials;
        assertTrue(mean > 0.4 && mean < 0.6, "mean pivot rank fraction " + mean);
    }
}
