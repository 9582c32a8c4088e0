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

import lombok.Getter;

/**
 * Thrown when a window cannot be cut into whole features.
 */
@Getter
public class WindowAlignmentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int windowLength;

    private final int featureSize;

    public WindowAlignmentException(int windowLength, int featureSize) {
        super("window of length " + windowLength + " is not a multiple of the feature size " + featureSize);
        this.windowLength = windowLength;
        this.featureSize = featureSize;
    }
}
