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

package com.amazon.saxbitmap.testutils;

import static java.lang.Math.PI;
import static java.lang.Math.sin;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic univariate signals. Each generator can plant an anomaly: a segment
 * where the shape of the signal changes while its scale stays comparable, which
 * is the kind of change a detector that compares symbol frequencies picks up.
 */
public class SignalDataSets {

    private SignalDataSets() {}

    /**
     * @param length    number of samples
     * @param period    samples per cycle
     * @param amplitude peak value
     * @param noise     standard deviation of additive gaussian noise, 0 for a
     *                  clean signal
     * @param seed      seed of the noise
     * @return a sine wave
     */
    public static double[] sine(int length, int period, double amplitude, double noise, long seed) {
        Random random = new Random(seed);
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            data[i] = amplitude * sin(2 * PI * i / period) + noise * random.nextGaussian();
        }
        return data;
    }

    public static double[] ramp(int length, double start, double step) {
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            data[i] = start + i * step;
        }
        return data;
    }

    public static double[] constant(int length, double value) {
        double[] data = new double[length];
        Arrays.fill(data, value);
        return data;
    }

    public static double[] gaussian(int length, double mu, double sigma, long seed) {
        Random random = new Random(seed);
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            data[i] = mu + sigma * random.nextGaussian();
        }
        return data;
    }

    /**
     * A sine wave in which the samples {@code [anomalyStart, anomalyStart +
     * anomalyLength)} are replaced by a square wave of the same period and
     * amplitude.
     *
     * @return the signal with the position of the change
     */
    public static SignalWithKey sineWithSquareSegment(int length, int period, double amplitude, double noise,
            int anomalyStart, int anomalyLength, long seed) {
        double[] data = sine(length, period, amplitude, noise, seed);
        Random random = new Random(seed + 1);
        int end = Math.min(length, anomalyStart + anomalyLength);
        for (int i = anomalyStart; i < end; i++) {
            double phase = sin(2 * PI * i / period);
            data[i] = ((phase >= 0) ? amplitude : -amplitude) + noise * random.nextGaussian();
        }
        return new SignalWithKey(data, new int[] { anomalyStart });
    }

    /**
     * @return two sine waves of different periods glued together at changeIndex
     */
    public static SignalWithKey periodChange(int length, int period, int newPeriod, double amplitude,
            int changeIndex, long seed) {
        Random random = new Random(seed);
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            int p = (i < changeIndex) ? period : newPeriod;
            data[i] = amplitude * sin(2 * PI * i / p) + 0.01 * amplitude * random.nextGaussian();
        }
        return new SignalWithKey(data, new int[] { changeIndex });
    }
}
