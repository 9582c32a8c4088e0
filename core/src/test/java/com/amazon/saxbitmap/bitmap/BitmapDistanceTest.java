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

import static com.amazon.saxbitmap.bitmap.BitmapDistance.squaredEuclidean;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class BitmapDistanceTest {

    private Bitmap randomBitmap(Random random, int side) {
        return new Bitmap(side, random.doubles(side * side, 0, 1).toArray());
    }

    @Test
    void identityAndSymmetry() {
        Random random = new Random(3);
        for (int trial = 0; trial < 100; trial++) {
            int side = 1 + random.nextInt(6);
            Bitmap first = randomBitmap(random, side);
            Bitmap second = randomBitmap(random, side);
            assertEquals(0.0, squaredEuclidean(first, first));
            assertEquals(0.0, squaredEuclidean(first, new Bitmap(first.toArray())));
            assertEquals(squaredEuclidean(first, second), squaredEuclidean(second, first));
            assertTrue(squaredEuclidean(first, second) > 0);
            assertTrue(squaredEuclidean(first, second) <= side * side);
        }
    }

    @Test
    void knownValue() {
        Bitmap first = new Bitmap(new double[][] { { 1, 0 }, { 0.5, 0 } });
        Bitmap second = new Bitmap(new double[][] { { 0, 0 }, { 0, 1 } });
        assertEquals(1 + 0.25 + 1, squaredEuclidean(first, second), 1e-12);
    }

    @Test
    void shapeMismatch() {
        Random random = new Random(0);
        assertThrows(IllegalArgumentException.class,
                () -> squaredEuclidean(randomBitmap(random, 2), randomBitmap(random, 3)));
        assertThrows(NullPointerException.class, () -> squaredEuclidean(null, randomBitmap(random, 3)));
    }
}
