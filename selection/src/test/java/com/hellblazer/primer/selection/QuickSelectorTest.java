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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QuickSelector Tests")
class QuickSelectorTest extends TestBase {

    static Stream<Arguments> selectors() {
        return Stream.of(Arguments.of(new QuickSelector(new MedianOfMediansPivot())),
                         Arguments.of(new QuickSelector(new RandomPivot(new Random(7)))));
    }

    /**
     * Heap's algorithm, visiting every permutation of values.
     */
    private static void permutations(int[] values, int n, Consumer<int[]> visitor) {
        if (n == 1) {
            visitor.accept(values);
            return;
        }
        for (int i = 0; i < n - 1; i++) {
            permutations(values, n - 1, visitor);
            int j = (n % 2 == 0) ? i : 0;
            int t = values[j];
            values[j] = values[n - 1];
            values[n - 1] = t;
        }
        permutations(values, n - 1, visitor);
    }

    private static List<Integer> boxed(int[] values) {
        var list = new ArrayList<Integer>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return list;
    }

    @ParameterizedTest
    @MethodSource("selectors")
    @DisplayName("Every k of every permutation of a multiset matches sorting")
    void testAllPermutations(QuickSelector selector) {
        var multiset = new int[] { 3, 1, 4, 1, 5, 9, 2 };
        var sorted = multiset.clone();
        Arrays.sort(sorted);
        var visited = new int[1];

        permutations(multiset, multiset.length, permutation -> {
            visited[0]++;
            for (int k = 0; k < permutation.length; k++) {
                assertEquals(sorted[k], selector.select(boxed(permutation), k));
            }
        });
        assertEquals(5040, visited[0]);
    }

    @ParameterizedTest
    @MethodSource("selectors")
    @DisplayName("Random inputs with duplicates match sorting")
    void testRandomInputs(QuickSelector selector) {
        for (int trial = 0; trial < 100; trial++) {
            var n = 1 + random.nextInt(2_000);
            var input = randomInts(n, 1 + random.nextInt(n));
            var sorted = new ArrayList<>(input);
            Collections.sort(sorted);
            var k = random.nextInt(n);

            assertEquals(sorted.get(k), selector.select(new ArrayList<>(input), k));
        }
    }

    @ParameterizedTest
    @MethodSource("selectors")
    @DisplayName("Sorted, reversed and constant inputs")
    void testStructuredInputs(QuickSelector selector) {
        var n = 1_000;
        var ascending = new ArrayList<Integer>();
        for (int i = 0; i < n; i++) {
            ascending.add(i);
        }
        var descending = new ArrayList<>(ascending);
        Collections.reverse(descending);
        var constant = new ArrayList<>(Collections.nCopies(500, 42));

        for (int k : new int[] { 0, 1, n / 2, n - 2, n - 1 }) {
            assertEquals(k, selector.select(new ArrayList<>(ascending), k));
            assertEquals(k, selector.select(new ArrayList<>(descending), k));
        }
        assertEquals(42, selector.select(constant, 499));
    }

    @ParameterizedTest
    @MethodSource("selectors")
    @DisplayName("Selection leaves the list partitioned around k")
    void testPartitionedAroundK(QuickSelector selector) {
        var list = shuffled(300);
        var k = 123;
        assertEquals(k, selector.select(list, k));
        assertEquals(k, list.get(k));
        for (int i = 0; i < k; i++) {
            assertTrue(list.get(i) < k);
        }
        for (int i = k + 1; i < list.size(); i++) {
            assertTrue(list.get(i) > k);
        }
    }

    @Test
    @DisplayName("Custom comparator, sub range and array input")
    void testVariants() {
        var selector = new QuickSelector(new MedianOfMediansPivot());

        var words = new ArrayList<>(List.of("pear", "fig", "banana", "kiwi", "apple"));
        assertEquals("banana", selector.select(words, 0, Comparator.comparingInt(String::length).reversed()));

        var list = new ArrayList<>(List.of(9, 8, 7, 3, 1, 2, 0));
        assertEquals(2, selector.select(list, 3, 5, 4, Comparator.naturalOrder()));
        assertEquals(List.of(9, 8, 7), list.subList(0, 3));
        assertEquals(0, list.get(6));

        var array = new Integer[] { 5, 4, 3, 2, 1 };
        assertEquals(2, selector.select(array, 1, Comparator.naturalOrder()));
        assertEquals(2, array[1]);
    }

    @ParameterizedTest
    @MethodSource("selectors")
    @DisplayName("k outside the list is rejected before any work")
    void testInvalidK(QuickSelector selector) {
        var list = new ArrayList<>(List.of(3, 1, 2));

        var e = assertThrows(IllegalArgumentException.class, () -> selector.select(list, 3));
        assertEquals("k must be in [0, 2]: 3", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> selector.select(list, -1));
        assertThrows(IllegalArgumentException.class, () -> selector.select(new ArrayList<Integer>(), 0));
        assertThrows(IllegalArgumentException.class, () -> selector.select(list, 0, 3, 1, Comparator.naturalOrder()));
        assertThrows(IllegalArgumentException.class, () -> selector.select(list, 1, 2, 0, Comparator.naturalOrder()));
        assertThrows(NullPointerException.class, () -> selector.select((List<Integer>) null, 0));
        assertEquals(List.of(3, 1, 2), list);
    }

    @Test
    @DisplayName("Facade selects with both strategies")
    void testFacade() {
        var input = shuffled(1_001);
        assertEquals(500, Selection.deterministic(new ArrayList<>(input), 500));
        assertEquals(500, Selection.randomized(new ArrayList<>(input), 500));
        assertEquals(1_000, Selection.deterministic(new ArrayList<>(input), 0, Comparator.reverseOrder()));
        assertEquals(0, Selection.randomized(new ArrayList<>(input), 1_000, Comparator.reverseOrder()));
        assertThrows(NullPointerException.class, () -> new QuickSelector(null));
    }

    @Test
    @DisplayName("Narrowing and pivot reductions are logged at DEBUG")
    void testDebugLogging() {
        var selectorLog = (Logger) LoggerFactory.getLogger(QuickSelector.class);
        var pivotLog = (Logger) LoggerFactory.getLogger(MedianOfMediansPivot.class);
        var previous = new Level[] { selectorLog.getLevel(), pivotLog.getLevel() };
        var events = new ListAppender<ILoggingEvent>();
        events.start();
        selectorLog.addAppender(events);
        pivotLog.addAppender(events);
        selectorLog.setLevel(Level.DEBUG);
        pivotLog.setLevel(Level.DEBUG);
        try {
            Selection.deterministic(shuffled(100), 50);
        } finally {
            selectorLog.detachAppender(events);
            pivotLog.detachAppender(events);
            selectorLog.setLevel(previous[0]);
            pivotLog.setLevel(previous[1]);
        }

        assertFalse(events.list.isEmpty());
        assertTrue(events.list.stream().allMatch(e -> e.getLevel() == Level.DEBUG));
        assertTrue(events.list.stream().anyMatch(e -> e.getLoggerName().equals(QuickSelector.class.getName())));
        assertTrue(events.list.stream().anyMatch(e -> e.getLoggerName().equals(MedianOfMediansPivot.class.getName())));
    }
}
