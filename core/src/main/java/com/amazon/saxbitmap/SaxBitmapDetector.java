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

package com.amazon.saxbitmap;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkFinite;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;
import static com.amazon.saxbitmap.CommonUtils.checkedPow;
import static com.amazon.saxbitmap.CommonUtils.checkedProduct;
import static com.amazon.saxbitmap.CommonUtils.exactSquareRoot;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.saxbitmap.bitmap.Bitmap;
import com.amazon.saxbitmap.bitmap.BitmapBuilder;
import com.amazon.saxbitmap.bitmap.BitmapDistance;
import com.amazon.saxbitmap.config.ZeroVarianceStrategy;
import com.amazon.saxbitmap.frequency.FrequencyCounter;
import com.amazon.saxbitmap.returntypes.Analysis;
import com.amazon.saxbitmap.sax.Alphabet;
import com.amazon.saxbitmap.sax.SaxEncoder;
import com.amazon.saxbitmap.sax.WordExtractor;
import com.amazon.saxbitmap.window.SlidingWindow;

/**
 * A streaming, assumption free anomaly detector for a single time series,
 * following Wei et al., "Assumption-Free Anomaly Detection in Time Series",
 * SSDBM 2005.
 *
 * The detector keeps the most recent samples in a lead window and the samples
 * just before them in a lag window. Once both windows are full, every new
 * sample triggers a comparison: each window is cut into features of
 * {@code windowSize} samples, every feature is SAX encoded into a word, the
 * frequencies of all subwords of length {@code recursionLevel} are counted and
 * laid out as a normalized square bitmap, and the score is the squared
 * distance between the two bitmaps.
 *
 * An instance is not thread safe and is meant to follow exactly one signal.
 */
@Getter
public class SaxBitmapDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SaxBitmapDetector.class);

    public static final int DEFAULT_WORD_SIZE = 10;

    public static final int DEFAULT_WINDOW_FACTOR = 100;

    public static final int DEFAULT_LEAD_WINDOW_FACTOR = 3;

    public static final int DEFAULT_LAG_WINDOW_FACTOR = 30;

    public static final int DEFAULT_RECURSION_LEVEL = 2;

    public static final int DEFAULT_ALPHABET_SIZE = 4;

    public static final ZeroVarianceStrategy DEFAULT_ZERO_VARIANCE_STRATEGY = ZeroVarianceStrategy.FAIL;

    public static final long INITIAL_TIMESTAMP = Long.MIN_VALUE;

    // number of symbols in a SAX word
    private final int wordSize;

    private final int windowFactor;

    private final int leadWindowFactor;

    private final int lagWindowFactor;

    // length of the subwords whose frequencies are counted
    private final int recursionLevel;

    // used both for SAX encoding and for counting
    private final int alphabetSize;

    private final ZeroVarianceStrategy zeroVarianceStrategy;

    // number of samples summarized by one word, wordSize * windowFactor
    private final int windowSize;

    private final int leadWindowSize;

    private final int lagWindowSize;

    private final int bitmapSide;

    @Getter(AccessLevel.NONE)
    private final SlidingWindow leadWindow;

    @Getter(AccessLevel.NONE)
    private final SlidingWindow lagWindow;

    @Getter(AccessLevel.NONE)
    private final WordExtractor wordExtractor;

    @Getter(AccessLevel.NONE)
    private final FrequencyCounter frequencyCounter;

    // the timestamp of the last batch, not of the last sample
    private long lastTimestamp;

    private long totalUpdates;

    public SaxBitmapDetector(Builder<?> builder) {
        checkNotNull(builder, "builder must not be null").validate();
        wordSize = builder.wordSize;
        windowFactor = builder.windowFactor;
        leadWindowFactor = builder.leadWindowFactor;
        lagWindowFactor = builder.lagWindowFactor;
        recursionLevel = builder.recursionLevel;
        alphabetSize = builder.alphabetSize;
        zeroVarianceStrategy = builder.zeroVarianceStrategy;
        windowSize = checkedProduct(wordSize, windowFactor, "window size");
        leadWindowSize = checkedProduct(leadWindowFactor, windowSize, "lead window size");
        lagWindowSize = checkedProduct(lagWindowFactor, windowSize, "lag window size");
        checkArgument((long) leadWindowSize + lagWindowSize <= Integer.MAX_VALUE, "universe size is too large");
        bitmapSide = exactSquareRoot(checkedPow(alphabetSize, recursionLevel));

        Alphabet alphabet = new Alphabet(alphabetSize);
        wordExtractor = new WordExtractor(new SaxEncoder(alphabet, wordSize, zeroVarianceStrategy));
        frequencyCounter = new FrequencyCounter(alphabet, recursionLevel);
        leadWindow = new SlidingWindow(leadWindowSize);
        lagWindow = new SlidingWindow(lagWindowSize);
        lastTimestamp = INITIAL_TIMESTAMP;
        totalUpdates = 0;

        if (recursionLevel > wordSize) {
            LOG.warn("subwords of length {} never fit in words of length {}, all bitmaps will be empty",
                    recursionLevel, wordSize);
        }
        LOG.debug("created detector with word size {}, lead window {}, lag window {}, {}x{} bitmaps", wordSize,
                leadWindowSize, lagWindowSize, bitmapSide, bitmapSide);
    }

    // for mappers
    public SaxBitmapDetector(Builder<?> builder, double[] leadValues, double[] lagValues, long lastTimestamp,
            long totalUpdates) {
        this(builder);
        checkNotNull(leadValues, "lead values must not be null");
        checkNotNull(lagValues, "lag values must not be null");
        checkArgument(leadValues.length <= leadWindowSize, "too many values for the lead window");
        checkArgument(lagValues.length <= lagWindowSize, "too many values for the lag window");
        checkArgument(lagValues.length == 0 || leadValues.length == leadWindowSize,
                "the lag window can only hold values once the lead window is full");
        checkArgument(totalUpdates >= leadValues.length + lagValues.length,
                "total updates cannot be smaller than the number of values held");
        for (double value : leadValues) {
            leadWindow.add(value);
        }
        for (double value : lagValues) {
            lagWindow.add(value);
        }
        this.lastTimestamp = lastTimestamp;
        this.totalUpdates = totalUpdates;
    }

    /**
     * Ingests a batch of samples in order. The timestamp is recorded once for the
     * whole batch.
     *
     * @param samples   the new samples, oldest first
     * @param timestamp the timestamp of the batch
     * @return one analysis for every sample that arrived while both windows were
     *         full, in the order of the samples
     * @throws com.amazon.saxbitmap.sax.WindowAlignmentException  if a window cannot
     *                                                            be cut into whole
     *                                                            features
     * @throws com.amazon.saxbitmap.sax.DegenerateWindowException if a feature has
     *                                                            zero variance and
     *                                                            the strategy is
     *                                                            FAIL
     */
    public List<Analysis> detect(double[] samples, long timestamp) {
        checkFinite(samples, "samples must be finite numbers");
        lastTimestamp = timestamp;
        List<Analysis> answer = new ArrayList<>();
        for (double sample : samples) {
            leadWindow.add(sample).ifPresent(lagWindow::add);
            ++totalUpdates;
            if (isReady()) {
                answer.add(analyze());
            }
        }
        return answer;
    }

    public List<Analysis> detect(List<Double> samples, long timestamp) {
        checkNotNull(samples, "samples must not be null");
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = samples.get(i);
            checkArgument(value != null, "samples must not contain null");
            values[i] = value;
        }
        return detect(values, timestamp);
    }

    Analysis analyze() {
        Bitmap leadBitmap = toBitmap(leadWindow.toArray());
        Bitmap lagBitmap = toBitmap(lagWindow.toArray());
        double score = BitmapDistance.squaredEuclidean(leadBitmap, lagBitmap);
        return new Analysis(score, leadBitmap, lagBitmap, lastTimestamp, totalUpdates);
    }

    Bitmap toBitmap(double[] window) {
        return BitmapBuilder.build(frequencyCounter.count(wordExtractor.extract(window, windowSize)));
    }

    /**
     * @return true if both windows are full, i.e., the next sample produces an
     *         analysis
     */
    public boolean isReady() {
        return leadWindow.isFull() && lagWindow.isFull();
    }

    public int getUniverseSize() {
        return leadWindowSize + lagWindowSize;
    }

    public double[] getLeadWindowValues() {
        return leadWindow.toArray();
    }

    public double[] getLagWindowValues() {
        return lagWindow.toArray();
    }

    public void reset() {
        leadWindow.clear();
        lagWindow.clear();
        lastTimestamp = INITIAL_TIMESTAMP;
        totalUpdates = 0;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected int wordSize = DEFAULT_WORD_SIZE;
        protected int windowFactor = DEFAULT_WINDOW_FACTOR;
        protected int leadWindowFactor = DEFAULT_LEAD_WINDOW_FACTOR;
        protected int lagWindowFactor = DEFAULT_LAG_WINDOW_FACTOR;
        protected int recursionLevel = DEFAULT_RECURSION_LEVEL;
        protected int alphabetSize = DEFAULT_ALPHABET_SIZE;
        protected ZeroVarianceStrategy zeroVarianceStrategy = DEFAULT_ZERO_VARIANCE_STRATEGY;

        void validate() {
            checkArgument(wordSize > 0, "word size must be positive");
            checkArgument(windowFactor > 0, "window factor must be positive");
            checkArgument(leadWindowFactor > 0, "lead window factor must be positive");
            checkArgument(lagWindowFactor > 0, "lag window factor must be positive");
            checkArgument(recursionLevel > 0, "recursion level must be positive");
            checkArgument(alphabetSize >= Alphabet.MIN_SIZE && alphabetSize <= Alphabet.MAX_SIZE,
                    "alphabet size must be between " + Alphabet.MIN_SIZE + " and " + Alphabet.MAX_SIZE);
            checkNotNull(zeroVarianceStrategy, "zero variance strategy must not be null");
            int combinations = checkedPow(alphabetSize, recursionLevel);
            checkArgument(exactSquareRoot(combinations) > 0,
                    "alphabet size " + alphabetSize + " and recursion level " + recursionLevel + " give "
                            + combinations + " subwords, which is not a perfect square");
        }

        public T wordSize(int wordSize) {
            this.wordSize = wordSize;
            return (T) this;
        }

        public T windowFactor(int windowFactor) {
            this.windowFactor = windowFactor;
            return (T) this;
        }

        public T leadWindowFactor(int leadWindowFactor) {
            this.leadWindowFactor = leadWindowFactor;
            return (T) this;
        }

        public T lagWindowFactor(int lagWindowFactor) {
            this.lagWindowFactor = lagWindowFactor;
            return (T) this;
        }

        public T recursionLevel(int recursionLevel) {
            this.recursionLevel = recursionLevel;
            return (T) this;
        }

        public T alphabetSize(int alphabetSize) {
            this.alphabetSize = alphabetSize;
            return (T) this;
        }

        public T zeroVarianceStrategy(ZeroVarianceStrategy zeroVarianceStrategy) {
            this.zeroVarianceStrategy = zeroVarianceStrategy;
            return (T) this;
        }

        public SaxBitmapDetector build() {
            return new SaxBitmapDetector(this);
        }
    }
}
