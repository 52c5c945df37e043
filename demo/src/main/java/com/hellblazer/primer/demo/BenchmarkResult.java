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

/**
 * Mean selection times for one input size and distribution.
 *
 * @param deterministicMillis mean milliseconds per median of medians selection
 * @param randomizedMillis    mean milliseconds per randomized selection
 */
public record BenchmarkResult(int size, InputDistribution distribution, int trials, double deterministicMillis,
                              double randomizedMillis) {

    public String format() {
        return String.format("%6d | %-10s | deterministic median of medians = %8.3f ms | randomized quickselect = %8.3f ms",
                             size, distribution.getLabel(), deterministicMillis, randomizedMillis);
    }
}
