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

package com.amazon.saxbitmap.state;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;
import static com.amazon.saxbitmap.CommonUtils.checkNotNull;
import static com.amazon.saxbitmap.CommonUtils.checkState;

import com.amazon.saxbitmap.SaxBitmapDetector;
import com.amazon.saxbitmap.config.ZeroVarianceStrategy;

public class SaxBitmapDetectorMapper implements IStateMapper<SaxBitmapDetector, SaxBitmapDetectorState> {

    @Override
    public SaxBitmapDetectorState toState(SaxBitmapDetector model) {
        checkNotNull(model, "model must not be null");
        SaxBitmapDetectorState state = new SaxBitmapDetectorState();
        state.setVersion(Version.CURRENT);
        state.setWordSize(model.getWordSize());
        state.setWindowFactor(model.getWindowFactor());
        state.setLeadWindowFactor(model.getLeadWindowFactor());
        state.setLagWindowFactor(model.getLagWindowFactor());
        state.setRecursionLevel(model.getRecursionLevel());
        state.setAlphabetSize(model.getAlphabetSize());
        state.setZeroVarianceStrategy(model.getZeroVarianceStrategy().name());
        state.setLeadWindow(model.getLeadWindowValues());
        state.setLagWindow(model.getLagWindowValues());
        state.setLastTimestamp(model.getLastTimestamp());
        state.setTotalUpdates(model.getTotalUpdates());
        return state;
    }

    @Override
    public SaxBitmapDetector toModel(SaxBitmapDetectorState state) {
        checkNotNull(state, "state must not be null");
        checkState(Version.V1_0.equals(state.getVersion()), "unknown state version " + state.getVersion());
        checkArgument(state.getZeroVarianceStrategy() != null, "zero variance strategy is missing");

        SaxBitmapDetector.Builder<?> builder = SaxBitmapDetector.builder().wordSize(state.getWordSize())
                .windowFactor(state.getWindowFactor()).leadWindowFactor(state.getLeadWindowFactor())
                .lagWindowFactor(state.getLagWindowFactor()).recursionLevel(state.getRecursionLevel())
                .alphabetSize(state.getAlphabetSize())
                .zeroVarianceStrategy(ZeroVarianceStrategy.valueOf(state.getZeroVarianceStrategy()));
        double[] lead = (state.getLeadWindow() == null) ? new double[0] : state.getLeadWindow();
        double[] lag = (state.getLagWindow() == null) ? new double[0] : state.getLagWindow();
        return new SaxBitmapDetector(builder, lead, lag, state.getLastTimestamp(), state.getTotalUpdates());
    }
}
