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

package com.amazon.saxbitmap.window;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class SlidingWindowTest {

    @Test
    void fillAndEvict() {
        SlidingWindow window = new SlidingWindow(3);
        assertTrue(window.isEmpty());
        assertFalse(window.add(1).isPresent());
        assertFalse(window.add(2).isPresent());
        assertFalse(window.isFull());
        assertFalse(window.add(3).isPresent());
        assertTrue(window.isFull());
        assertArrayEquals(new double[] { 1, 2, 3 }, window.toArray());

        OptionalDouble evicted = window.add(4);
        assertEquals(1, evicted.getAsDouble());
        assertEquals(3, window.size());
        assertArrayEquals(new double[] { 2, 3, 4 }, window.toArray());
        assertEquals(2, window.add(5).getAsDouble());
        assertArrayEquals(new double[] { 3, 4, 5 }, window.toArray());
    }

    @Test
    void removeOldest() {
        SlidingWindow window = new SlidingWindow(2);
        assertThrows(IllegalStateException.class, window::removeOldest);
        window.add(1);
        window.add(2);
        window.add(3);
        assertEquals(2, window.removeOldest());
        assertEquals(1, window.size());
        window.add(4);
        assertArrayEquals(new double[] { 3, 4 }, window.toArray());
        assertEquals(3, window.removeOldest());
        assertEquals(4, window.removeOldest());
        assertTrue(window.isEmpty());
    }

    @Test
    void agreesWithBoundedDeque() {
        Random random = new Random(42);
        int capacity = 7;
        SlidingWindow window = new SlidingWindow(capacity);
        Deque<Double> deque = new ArrayDeque<>();
        for (int i = 0; i < 1000; i++) {
            if (random.nextInt(5) == 0 && !deque.isEmpty()) {
                assertEquals(deque.removeFirst(), window.removeOldest());
            } else {
                double value = random.nextDouble();
                OptionalDouble evicted = window.add(value);
                if (deque.size() == capacity) {
                    assertEquals(deque.removeFirst(), evicted.getAsDouble());
                } else {
                    assertFalse(evicted.isPresent());
                }
                deque.addLast(value);
            }
            assertTrue(window.size() <= capacity);
            assertArrayEquals(deque.stream().mapToDouble(Double::doubleValue).toArray(), window.toArray());
        }
    }

    @Test
    void restoreAndClear() {
        SlidingWindow window = new SlidingWindow(4, new double[] { 1, 2, 3 });
        assertEquals(3, window.size());
        assertEquals(4, window.getCapacity());
        window.add(4);
        assertEquals(1, window.add(5).getAsDouble());
        window.clear();
        assertTrue(window.isEmpty());
        assertArrayEquals(new double[0], window.toArray());
        window.add(6);
        assertArrayEquals(new double[] { 6 }, window.toArray());
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(0));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(2, new double[3]));
        assertThrows(NullPointerException.class, () -> new SlidingWindow(2, null));
    }
}
