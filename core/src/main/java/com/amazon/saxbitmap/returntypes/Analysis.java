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

package com.amazon.saxbitmap.returntypes;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.saxbitmap.bitmap.Bitmap;

/**
 * The outcome of one detection cycle: how far the bitmap of the lead window is
 * from the bitmap of the lag window.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Analysis {

    // squared distance between the two bitmaps, larger values suggest an anomaly
    private final double score;

    private final Bitmap leadBitmap;

    private final Bitmap lagBitmap;

    // the timestamp passed with the batch that contained the triggering sample
    private final long timestamp;

    // 1-based position of the triggering sample in the stream
    private final long totalUpdates;

    public Analysis(double score, Bitmap leadBitmap, Bitmap lagBitmap, long timestamp, long totalUpdates) {
        checkArgument(score >= 0, "score must be non-negative");
        this.score = score;
        this.leadBitmap = checkNotNull(leadBitmap, "lead bitmap must not be null");
        this.lagBitmap = checkNotNull(lagBitmap, "lag bitmap must not be null");
        this.timestamp = timestamp;
        this.totalUpdates = totalUpdates;
    }
}
