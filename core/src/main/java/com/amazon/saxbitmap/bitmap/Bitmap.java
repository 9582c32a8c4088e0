/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.saxbitmap.bitmap;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An immutable square matrix of normalized subword frequencies.
 */
public class Bitmap {

    private final int side;

    // row major
    private final double[] cells;

    /**
     * @param side  the number of rows (and columns)
     * @param cells the cells in row-major order, copied
     */
    public Bitmap(int side, double[] cells) {
        checkArgument(side > 0, "side must be positive");
        checkNotNull(cells, "cells must not be null");
        checkArgument(cells.length == side * side, "expected " + side * side + " cells");
        this.side = side;
        this.cells = Arrays.copyOf(cells, cells.length);
    }

    public Bitmap(double[][] rows) {
        checkNotNull(rows, "rows must not be null");
        checkArgument(rows.length > 0, "a bitmap needs at least one row");
        this.side = rows.length;
        this.cells = new double[side * side];
        for (int i = 0; i < side; i++) {
            checkArgument(rows[i].length == side, "a bitmap must be square");
            System.arraycopy(rows[i], 0, cells, i * side, side);
        }
    }

    public int getSide() {
        return side;
    }

    public double get(int row, int column) {
        checkArgument(row >= 0 && row < side && column >= 0 && column < side, "incorrect cell");
        return cells[row * side + column];
    }

    public double[] getCells() {
        return Arrays.copyOf(cells, cells.length);
    }

    public double[][] toArray() {
        double[][] answer = new double[side][];
        for (int i = 0; i < side; i++) {
            answer[i] = Arrays.copyOfRange(cells, i * side, (i + 1) * side);
        }
        return answer;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Bitmap)) {
            return false;
        }
        Bitmap bitmap = (Bitmap) other;
        return side == bitmap.side && Arrays.equals(cells, bitmap.cells);
    }

    @Override
    public int hashCode() {
        return 31 * side + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(toArray());
    }
}
