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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.saxbitmap.frequency.CombinationGenerator;
import com.amazon.saxbitmap.frequency.FrequencyCounter;
import com.amazon.saxbitmap.frequency.FrequencyTable;
import com.amazon.saxbitmap.sax.Alphabet;

public class BitmapBuilderTest {

    private final List<String> keys = CombinationGenerator.generate(new Alphabet(4), 2);

    @Test
    void rowMajorLayout() {
        double[] counts = new double[16];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = i;
        }
        Bitmap bitmap = BitmapBuilder.build(new FrequencyTable(keys, counts));
        assertEquals(4, bitmap.getSide());
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                assertEquals((4 * row + column) / 15.0, bitmap.get(row, column), 1e-12);
            }
        }
    }

    @Test
    void singleSubword() {
        FrequencyTable table = new FrequencyCounter(new Alphabet(4), 2).count(Arrays.asList("ad", "ad"));
        Bitmap bitmap = BitmapBuilder.build(table);
        double[][] expected = new double[4][4];
        expected[0][3] = 1.0;
        assertArrayEquals(expected[0], bitmap.toArray()[0]);
        assertEquals(new Bitmap(expected), bitmap);
    }

    @Test
    void emptyTable() {
        Bitmap bitmap = BitmapBuilder.build(new FrequencyTable(keys, new double[16]));
        assertArrayEquals(new double[16], bitmap.getCells());
    }

    @Test
    void cellsWithinUnitInterval() {
        Random random = new Random(5);
        for (int trial = 0; trial < 50; trial++) {
            double[] counts = random.ints(16, 0, 1000).asDoubleStream().toArray();
            double[] cells = BitmapBuilder.build(new FrequencyTable(keys, counts)).getCells();
            double max = 0;
            for (double cell : cells) {
                assertTrue(cell >= 0 && cell <= 1);
                max = Math.max(max, cell);
            }
            assertTrue(max == 0 || max == 1.0);
        }
    }

    @Test
    void nonSquareTable() {
        List<String> triples = CombinationGenerator.generate(new Alphabet(2), 3);
        assertThrows(IllegalArgumentException.class, () -> BitmapBuilder.build(new FrequencyTable(triples,
                new double[8])));
        assertThrows(NullPointerException.class, () -> BitmapBuilder.build(null));
    }

    @Test
    void largerBitmap() {
        FrequencyTable table = new FrequencyCounter(new Alphabet(3), 2).count(Arrays.asList("abc", "cca"));
        Bitmap bitmap = BitmapBuilder.build(table);
        assertEquals(3, bitmap.getSide());
        // keys: aa ab ac / ba bb bc / ca cb cc
        assertEquals(1.0, bitmap.get(0, 1));
        assertEquals(1.0, bitmap.get(1, 2));
        assertEquals(1.0, bitmap.get(2, 2));
        assertEquals(1.0, bitmap.get(2, 0));
        assertEquals(0.0, bitmap.get(0, 0));
    }
}
