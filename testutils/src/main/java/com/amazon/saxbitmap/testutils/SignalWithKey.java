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

import java.util.Arrays;

/**
 * A signal together with the indices where its behavior changes.
 */
public class SignalWithKey {

    public final double[] data;

    public final int[] changeIndices;

    public SignalWithKey(double[] data, int[] changeIndices) {
        this.data = data;
        this.changeIndices = changeIndices;
    }

    /**
     * @param from first index, inclusive
     * @param to   last index, exclusive
     * @return a copy of the samples in the range
     */
    public double[] slice(int from, int to) {
        return Arrays.copyOfRange(data, from, to);
    }
}
