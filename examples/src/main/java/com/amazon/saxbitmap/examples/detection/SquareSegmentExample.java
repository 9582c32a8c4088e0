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

package com.amazon.saxbitmap.examples.detection;

import java.util.List;

import com.amazon.saxbitmap.SaxBitmapDetector;
import com.amazon.saxbitmap.examples.Example;
import com.amazon.saxbitmap.returntypes.Analysis;
import com.amazon.saxbitmap.testutils.SignalDataSets;
import com.amazon.saxbitmap.testutils.SignalWithKey;

/**
 * Streams a noisy sine wave with a square wave segment through a detector, in
 * small batches as a live feed would deliver them, and reports where the score
 * peaks.
 */
public class SquareSegmentExample implements Example {

    public static void main(String[] args) throws Exception {
        new SquareSegmentExample().run();
    }

    @Override
    public String command() {
        return "square_segment";
    }

    @Override
    public String description() {
        return "detect a square wave segment inside a sine wave";
    }

    @Override
    public void run() throws Exception {
        int wordSize = 5;
        int windowFactor = 8;
        int period = wordSize * windowFactor;

        SaxBitmapDetector detector = SaxBitmapDetector.builder().wordSize(wordSize).windowFactor(windowFactor)
                .leadWindowFactor(2).lagWindowFactor(10).build();

        int length = 10 * detector.getUniverseSize();
        int anomalyStart = length / 2;
        SignalWithKey signal = SignalDataSets.sineWithSquareSegment(length, period, 10.0, 0.5, anomalyStart,
                detector.getLeadWindowSize(), 42L);

        int batchSize = 25;
        double maxScore = 0;
        long maxAt = -1;
        long timestamp = 0;
        for (int from = 0; from < length; from += batchSize) {
            List<Analysis> results = detector.detect(signal.slice(from, Math.min(length, from + batchSize)),
                    timestamp++);
            for (Analysis analysis : results) {
                if (analysis.getScore() > maxScore) {
                    maxScore = analysis.getScore();
                    maxAt = analysis.getTotalUpdates();
                }
            }
        }

        System.out.printf("window size = %d, lead = %d, lag = %d%n", detector.getWindowSize(),
                detector.getLeadWindowSize(), detector.getLagWindowSize());
        System.out.printf("square segment starts at sample %d%n", anomalyStart);
        System.out.printf("highest score %.4f after sample %d%n", maxScore, maxAt);
    }
}
