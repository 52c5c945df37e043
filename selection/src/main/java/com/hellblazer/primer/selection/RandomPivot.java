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

import java.security.SecureRandom;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Uniformly random pivoting. Expected linear selection time, quadratic only with vanishing probability provided the
 * random source cannot be predicted by whoever supplies the input. The default source is a {@link SecureRandom}; a
 * seeded {@link Random} gives reproducible runs for benchmarks and tests.
 *
 * @author hal.hildebrand
 */
public final class RandomPivot implements PivotStrategy {

    private final Random random;

    public RandomPivot() {
        this(new SecureRandom());
    }

    public RandomPivot(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public <T> int pivotIndex(List<T> list, int low, int high, Comparator<? super T> cmp) {
        return low + random.nextInt(high - low + 1);
    }

    @Override
    public String toString() {
        return "random";
    }
}
