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
package com.hellblazer.primer.containers;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Row major matrix whose rows are {@link BoundedArray}s of identical capacity. All reads and writes go through the
 * row's bounds checked accessors.
 *
 * @author hal.hildebrand
 */
public final class Matrix<T> {

    private final List<BoundedArray<T>> rows;
    private final int                   cols;

    public Matrix(int rows, int cols, T fill) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Dimensions cannot be negative: " + rows + "x" + cols);
        }
        this.cols = cols;
        this.rows = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            var row = new BoundedArray<T>(cols);
            for (int c = 0; c < cols; c++) {
                row.insert(c, fill);
            }
            this.rows.add(row);
        }
    }

    public static Matrix<Integer> zeros(int rows, int cols) {
        return new Matrix<>(rows, cols, 0);
    }

    public int cols() {
        return cols;
    }

    public T get(int r, int c) {
        return row(r).access(c);
    }

    public int rows() {
        return rows.size();
    }

    /**
     * @return the value previously stored at (r, c)
     */
    public T set(int r, int c, T value) {
        return row(r).set(c, value);
    }

    @Override
    public String toString() {
        return rows.stream().map(BoundedArray::toString).collect(Collectors.joining("\n"));
    }

    private BoundedArray<T> row(int r) {
        if (r < 0 || r >= rows.size()) {
            throw new IndexOutOfRangeException("Row:" + r + ", Rows:" + rows.size());
        }
        return rows.get(r);
    }
}
