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
 * Feeds a sine wave whose period halves midway and prints a coarse profile of
 * the scores.
 */
public class PeriodChangeExample implements Example {

    public static void main(String[] args) throws Exception {
        new PeriodChangeExample().run();
    }

    @Override
    public String command() {
        return "period_change";
    }

    @Override
    public String description() {
        return "detect a change in the period of a sine wave";
    }

    @Override
    public void run() throws Exception {
        int wordSize = 4;
        int windowFactor = 10;
        int period = wordSize * windowFactor;

        SaxBitmapDetector detector = SaxBitmapDetector.builder().wordSize(wordSize).windowFactor(windowFactor)
                .leadWindowFactor(3).lagWindowFactor(12).build();

        int length = 6 * detector.getUniverseSize();
        int changeIndex = length / 2;
        SignalWithKey signal = SignalDataSets.periodChange(length, period, period / 2, 5.0, changeIndex, 7L);

        List<Analysis> results = detector.detect(signal.data, 0L);

        // average score per block of one window size
        int block = detector.getWindowSize();
        System.out.printf("period changes from %d to %d at sample %d%n", period, period / 2, changeIndex);
        for (int i = 0; i < results.size(); i += block) {
            double sum = 0;
            int end = Math.min(results.size(), i + block);
            for (int j = i; j < end; j++) {
                sum += results.get(j).getScore();
            }
            System.out.printf("samples %6d - %6d : %.4f%n", results.get(i).getTotalUpdates(),
                    results.get(end - 1).getTotalUpdates(), sum / (end - i));
        }
    }
}
