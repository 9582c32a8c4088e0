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
import static com.amazon.saxbitmap.CommonUtils.exactSquareRoot;

import com.amazon.saxbitmap.frequency.FrequencyTable;

/**
 * Lays a frequency table out as a square bitmap.
 */
public class BitmapBuilder {

    private BitmapBuilder() {}

    /**
     * Normalizes the table by its largest count and fills the bitmap row by row
     * in key order. The table keys are already sorted.
     *
     * @param table a table whose size is a perfect square
     * @return a bitmap with cells in [0,1]
     */
    public static Bitmap build(FrequencyTable table) {
        checkNotNull(table, "table must not be null");
        int side = exactSquareRoot(table.size());
        checkArgument(side > 0, "a table with " + table.size() + " entries cannot be laid out as a square");
        FrequencyTable normalized = table.normalize();
        double[] cells = new double[normalized.size()];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = normalized.getCount(i);
        }
        return new Bitmap(side, cells);
    }
}
