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
import static com.amazon.saxbitmap.CommonUtils.checkedPow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.saxbitmap.sax.Alphabet;

/**
 * Enumerates every string of a fixed length over an alphabet.
 */
public class CombinationGenerator {

    private CombinationGenerator() {}

    /**
     * Starts from the single symbols and prepends every symbol to every
     * combination until the requested length is reached. Since the previous
     * combinations are sorted and the symbols are visited in order, the output
     * stays sorted at every step.
     *
     * @param alphabet the symbols
     * @param length   the length of the combinations, at least 1
     * @return all {@code alphabet.size()^length} combinations in lexicographic
     *         order, as an unmodifiable list
     */
    public static List<String> generate(Alphabet alphabet, int length) {
        checkNotNull(alphabet, "alphabet must not be null");
        checkArgument(length > 0, "combination length must be positive");
        checkedPow(alphabet.size(), length);

        char[] symbols = alphabet.symbols();
        List<String> combinations = new ArrayList<>(symbols.length);
        for (char symbol : symbols) {
            combinations.add(String.valueOf(symbol));
        }
        for (int current = 1; current < length; current++) {
            List<String> extended = new ArrayList<>(combinations.size() * symbols.length);
            for (char symbol : symbols) {
                for (String combination : combinations) {
                    extended.add(symbol + combination);
                }
            }
            combinations = extended;
        }
        return Collections.unmodifiableList(combinations);
    }
}
