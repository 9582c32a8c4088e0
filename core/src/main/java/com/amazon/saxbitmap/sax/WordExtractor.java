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

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Cuts a window into consecutive, non-overlapping features and SAX encodes each
 * of them.
 */
@Getter
public class WordExtractor {

    private final SaxEncoder encoder;

    public WordExtractor(SaxEncoder encoder) {
        this.encoder = checkNotNull(encoder, "encoder must not be null");
    }

    /**
     * @param window      samples in arrival order
     * @param featureSize number of samples summarized by one word
     * @return the words of the features, in arrival order
     * @throws WindowAlignmentException if the window length is not a multiple of
     *                                  featureSize
     */
    public List<String> extract(double[] window, int featureSize) {
        checkNotNull(window, "window must not be null");
        checkArgument(featureSize > 0, "feature size must be positive");
        if (window.length % featureSize != 0) {
            throw new WindowAlignmentException(window.length, featureSize);
        }
        int features = window.length / featureSize;
        List<String> words = new ArrayList<>(features);
        for (int i = 0; i < features; i++) {
            words.add(encoder.encode(window, i * featureSize, (i + 1) * featureSize));
        }
        return words;
    }
}
