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

package com.amazon.saxbitmap.bitmap;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;

public class BitmapDistance {

    private BitmapDistance() {}

    /**
     * @param first  a bitmap
     * @param second a bitmap of the same side
     * @return the sum over all cells of the squared difference
     */
    public static double squaredEuclidean(Bitmap first, Bitmap second) {
        checkNotNull(first, "bitmaps must not be null");
        checkNotNull(second, "bitmaps must not be null");
        checkArgument(first.getSide() == second.getSide(), "bitmaps must have the same shape");
        double answer = 0;
        for (int i = 0; i < first.getSide(); i++) {
            for (int j = 0; j < first.getSide(); j++) {
                double difference = first.get(i, j) - second.get(i, j);
                answer += difference * difference;
            }
        }
        return answer;
    }
}
