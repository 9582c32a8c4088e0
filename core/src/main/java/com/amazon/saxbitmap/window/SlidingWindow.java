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

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;
import static com.amazon.saxbitmap.CommonUtils.checkState;

import java.util.OptionalDouble;

import lombok.Getter;

/**
 * A bounded first-in first-out sequence of samples backed by a circular array.
 * Adding to a full window evicts its oldest sample.
 */
public class SlidingWindow {

    @Getter
    private final int capacity;

    private final double[] buffer;

    // position of the oldest sample
    private int head;

    private int size;

    public SlidingWindow(int capacity) {
        checkArgument(capacity > 0, "capacity must be positive");
        this.capacity = capacity;
        this.buffer = new double[capacity];
        this.head = 0;
        this.size = 0;
    }

    /**
     * Creates a window holding the given samples.
     *
     * @param capacity the capacity of the window
     * @param values   samples, oldest first, at most capacity of them
     */
    public SlidingWindow(int capacity, double[] values) {
        this(capacity);
        checkNotNull(values, "values must not be null");
        checkArgument(values.length <= capacity, "too many values for a window of capacity " + capacity);
        System.arraycopy(values, 0, buffer, 0, values.length);
        size = values.length;
    }

    /**
     * @param value the newest sample
     * @return the sample evicted to make room, if the window was full
     */
    public OptionalDouble add(double value) {
        if (size == capacity) {
            double evicted = buffer[head];
            buffer[head] = value;
            head = (head + 1) % capacity;
            return OptionalDouble.of(evicted);
        }
        buffer[(head + size) % capacity] = value;
        ++size;
        return OptionalDouble.empty();
    }

    public double removeOldest() {
        checkState(size > 0, "window is empty");
        double answer = buffer[head];
        head = (head + 1) % capacity;
        --size;
        return answer;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == capacity;
    }

    /**
     * @return the samples, oldest first
     */
    public double[] toArray() {
        double[] answer = new double[size];
        for (int i = 0; i < size; i++) {
            answer[i] = buffer[(head + i) % capacity];
        }
        return answer;
    }

    public void clear() {
        head = 0;
        size = 0;
    }
}
