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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Input orderings the selection benchmark is run against.
 *
 * @author hal.hildebrand
 */
public enum InputDistribution {
    /** Integers drawn uniformly from [0, n]. */
    RANDOM("random", "uniform integers") {
        @Override
        public List<Integer> generate(int n, Random random) {
            var list = new ArrayList<Integer>(n);
            for (int i = 0; i < n; i++) {
                list.add(random.nextInt(n + 1));
            }
            return list;
        }
    },
    /** 0, 1, ..., n-1 */
    ASCENDING("ascending", "already sorted") {
        @Override
        public List<Integer> generate(int n, Random random) {
            var list = new ArrayList<Integer>(n);
            for (int i = 0; i < n; i++) {
                list.add(i);
            }
            return list;
        }
    },
    /** n, n-1, ..., 1 */
    DESCENDING("descending", "sorted in reverse") {
        @Override
        public List<Integer> generate(int n, Random random) {
            var list = new ArrayList<Integer>(n);
            for (int i = n; i > 0; i--) {
                list.add(i);
            }
            return list;
        }
    };

    private final String label;
    private final String description;

    InputDistribution(String label, String description) {
        this.label = label;
        this.description = description;
    }

    /**
     * @return the distribution with the given name, accepting "sorted" and "rev_sorted" as aliases, or null if
     * there is none
     */
    public static InputDistribution fromString(String s) {
        for (var distribution : values()) {
            if (distribution.label.equalsIgnoreCase(s)) {
                return distribution;
            }
        }
        if ("sorted".equalsIgnoreCase(s)) {
            return ASCENDING;
        }
        if ("rev_sorted".equalsIgnoreCase(s) || "reversed".equalsIgnoreCase(s)) {
            return DESCENDING;
        }
        return null;
    }

    /**
     * @return a fresh, mutable list of n integers in this distribution
     */
    public abstract List<Integer> generate(int n, Random random);

    public String getDescription() {
        return description;
    }

    public String getLabel() {
        return label;
    }
}
