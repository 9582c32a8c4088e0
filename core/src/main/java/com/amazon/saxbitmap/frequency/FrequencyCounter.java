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

import java.util.List;

import lombok.Getter;

import com.amazon.saxbitmap.sax.Alphabet;

/**
 * Counts the occurrences of every subword of a fixed length in a list of words.
 * Occurrences may overlap: {@code aa} occurs three times in {@code aaaa}.
 */
@Getter
public class FrequencyCounter {

    private final Alphabet alphabet;

    private final int subwordLength;

    // computed once; the position of a combination is its rank as a number
    // written in base alphabet.size()
    private final List<String> combinations;

    public FrequencyCounter(Alphabet alphabet, int subwordLength) {
        this.alphabet = checkNotNull(alphabet, "alphabet must not be null");
        checkArgument(subwordLength > 0, "subword length must be positive");
        this.subwordLength = subwordLength;
        this.combinations = CombinationGenerator.generate(alphabet, subwordLength);
    }

    public FrequencyTable count(List<String> words) {
        checkNotNull(words, "words must not be null");
        double[] counts = new double[combinations.size()];
        for (String word : words) {
            checkNotNull(word, "words must not contain null");
            for (int start = 0; start + subwordLength <= word.length(); start++) {
                int rank = rank(word, start);
                if (rank >= 0) {
                    counts[rank] += 1;
                }
            }
        }
        return new FrequencyTable(combinations, counts);
    }

    /**
     * @return the position of {@code word[start, start + subwordLength)} among the
     *         sorted combinations, -1 if it contains a symbol outside the alphabet
     */
    int rank(String word, int start) {
        int answer = 0;
        for (int i = start; i < start + subwordLength; i++) {
            int index = alphabet.indexOf(word.charAt(i));
            if (index < 0) {
                return -1;
            }
            answer = answer * alphabet.size() + index;
        }
        return answer;
    }
}
