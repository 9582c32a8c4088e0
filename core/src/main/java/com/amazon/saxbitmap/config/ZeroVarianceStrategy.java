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

package com.amazon.saxbitmap.config;

/**
 * Options for encoding a subsequence whose standard deviation is zero, which
 * cannot be standardized.
 */
public enum ZeroVarianceStrategy {

    /**
     * Raise a {@link com.amazon.saxbitmap.sax.DegenerateWindowException}. The
     * detection cycle that saw the subsequence fails.
     */
    FAIL,

    /**
     * Subtract the mean and skip the scaling; every partition then has mean 0 and
     * is mapped to the symbol whose interval contains 0.
     */
    CENTER;
}
