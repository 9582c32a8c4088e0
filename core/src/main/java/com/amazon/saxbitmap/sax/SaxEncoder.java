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

package com.amazon.saxbitmap.sax;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import com.amazon.saxbitmap.config.ZeroVarianceStrategy;

/**
 * Symbolic Aggregate approXimation of a numeric subsequence. The subsequence is
 * standardized, cut into {@code wordSize} contiguous pieces and the mean of
 * every piece is replaced by the symbol of the equiprobable interval of the
 * standard normal distribution that contains it.
 */
@Getter
public class SaxEncoder {

    private final Alphabet alphabet;

    private final int wordSize;

    private final ZeroVarianceStrategy zeroVarianceStrategy;

    // alphabet.size() - 1 cut points in increasing order, followed by +infinity
    private final double[] breakpoints;

    public SaxEncoder(Alphabet alphabet, int wordSize, ZeroVarianceStrategy zeroVarianceStrategy) {
        this.alphabet = checkNotNull(alphabet, "alphabet must not be null");
        checkArgument(wordSize > 0, "word size must be positive");
        this.wordSize = wordSize;
        this.zeroVarianceStrategy = checkNotNull(zeroVarianceStrategy, "zero variance strategy must not be null");
        this.breakpoints = computeBreakpoints(alphabet.size());
    }

    public SaxEncoder(Alphabet alphabet, int wordSize) {
        this(alphabet, wordSize, ZeroVarianceStrategy.FAIL);
    }

    /**
     * The cut points are the standard normal quantiles of {@code size - 1} values
     * evenly spaced over {@code [1/size, 1 - 1/size]}, both ends included.
     *
     * @param size the number of symbols
     * @return the breakpoints, terminated by positive infinity
     */
    static double[] computeBreakpoints(int size) {
        NormalDistribution normal = new NormalDistribution();
        int cuts = size - 1;
        double start = 1.0 / size;
        double stop = 1.0 - 1.0 / size;
        double step = (cuts > 1) ? (stop - start) / (cuts - 1) : 0;
        double[] answer = new double[size];
        for (int i = 0; i < cuts; i++) {
            answer[i] = normal.inverseCumulativeProbability(start + i * step);
        }
        answer[cuts] = Double.POSITIVE_INFINITY;
        return answer;
    }

    public double[] getBreakpoints() {
        return Arrays.copyOf(breakpoints, breakpoints.length);
    }

    public String encode(double[] data) {
        checkNotNull(data, "data must not be null");
        return encode(data, 0, data.length);
    }

    /**
     * SAX encodes {@code data[from, to)}.
     *
     * @param data the samples
     * @param from first index, inclusive
     * @param to   last index, exclusive
     * @return a word of exactly {@code wordSize} symbols
     */
    public String encode(double[] data, int from, int to) {
        checkNotNull(data, "data must not be null");
        checkArgument(from >= 0 && to <= data.length && from <= to, "incorrect range");
        int length = to - from;
        checkArgument(length >= wordSize, "subsequence of length " + length + " is shorter than the word size");
        for (int i = from; i < to; i++) {
            checkArgument(Double.isFinite(data[i]), "subsequence contains a value that is not finite");
        }

        double mean = new Mean().evaluate(data, from, length);
        double deviation = new StandardDeviation(false).evaluate(data, from, length);
        double scale;
        if (deviation > 0) {
            scale = 1.0 / deviation;
        } else if (zeroVarianceStrategy == ZeroVarianceStrategy.CENTER) {
            scale = 0;
        } else {
            throw new DegenerateWindowException(
                    "cannot standardize a subsequence of length " + length + " with zero standard deviation");
        }

        // pieces follow numpy.array_split: the first (length % wordSize) pieces
        // hold one extra sample
        int base = length / wordSize;
        int extra = length % wordSize;
        char[] word = new char[wordSize];
        int start = from;
        for (int piece = 0; piece < wordSize; piece++) {
            int pieceLength = (piece < extra) ? base + 1 : base;
            double sum = 0;
            for (int i = start; i < start + pieceLength; i++) {
                sum += (data[i] - mean) * scale;
            }
            word[piece] = alphabet.symbol(locate(sum / pieceLength));
            start += pieceLength;
        }
        return new String(word);
    }

    /**
     * @param value a standardized piece mean
     * @return index of the first breakpoint strictly greater than value
     */
    int locate(double value) {
        int index = 0;
        while (breakpoints[index] <= value) {
            ++index;
        }
        return index;
    }
}
