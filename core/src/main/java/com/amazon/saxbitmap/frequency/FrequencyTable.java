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

package com.amazon.saxbitmap.frequency;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dense table of subword frequencies. Every combination of the alphabet has
 * an entry, including those that were never observed, so that two tables built
 * with the same parameters can be compared entry by entry. Keys are kept in
 * lexicographic order.
 */
public class FrequencyTable {

    private final List<String> keys;

    private final double[] counts;

    /**
     * @param keys   sorted combinations
     * @param counts the count of every key, copied
     */
    public FrequencyTable(List<String> keys, double[] counts) {
        checkNotNull(keys, "keys must not be null");
        checkNotNull(counts, "counts must not be null");
        checkArgument(keys.size() == counts.length, "keys and counts must have the same length");
        checkArgument(!keys.isEmpty(), "a frequency table needs at least one key");
        this.keys = Collections.unmodifiableList(keys);
        this.counts = Arrays.copyOf(counts, counts.length);
    }

    public int size() {
        return counts.length;
    }

    public List<String> keys() {
        return keys;
    }

    public String getKey(int index) {
        return keys.get(index);
    }

    public double getCount(int index) {
        checkArgument(index >= 0 && index < counts.length, "incorrect index");
        return counts[index];
    }

    /**
     * @param key a combination
     * @return the count of the key
     * @throws IllegalArgumentException if key is not part of the table
     */
    public double get(String key) {
        int index = Collections.binarySearch(keys, key);
        checkArgument(index >= 0, "unknown key " + key);
        return counts[index];
    }

    public double max() {
        double answer = counts[0];
        for (int i = 1; i < counts.length; i++) {
            answer = Math.max(answer, counts[i]);
        }
        return answer;
    }

    public double total() {
        double answer = 0;
        for (double count : counts) {
            answer += count;
        }
        return answer;
    }

    /**
     * @return a table with every count divided by the largest one; all entries are
     *         zero when the largest count is zero
     */
    public FrequencyTable normalize() {
        double max = max();
        double[] normalized = new double[counts.length];
        if (max != 0) {
            for (int i = 0; i < counts.length; i++) {
                normalized[i] = counts[i] / max;
            }
        }
        return new FrequencyTable(keys, normalized);
    }

    public Map<String, Double> asMap() {
        Map<String, Double> answer = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            answer.put(keys.get(i), counts[i]);
        }
        return answer;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
