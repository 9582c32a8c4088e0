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

package com.amazon.saxbitmap.examples.serialization;

import java.util.List;

import com.amazon.saxbitmap.SaxBitmapDetector;
import com.amazon.saxbitmap.examples.Example;
import com.amazon.saxbitmap.returntypes.Analysis;
import com.amazon.saxbitmap.state.SaxBitmapDetectorMapper;
import com.amazon.saxbitmap.state.SaxBitmapDetectorState;
import com.amazon.saxbitmap.testutils.SignalDataSets;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a SAX bitmap detector using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {

    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a SAX bitmap detector with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a detector with the default configuration

        SaxBitmapDetector detector = SaxBitmapDetector.builder().build();
        detector.detect(SignalDataSets.sine(detector.getUniverseSize() + 500, 1000, 1.0, 0.1, 0L), 1L);

        // Convert to an array of bytes and print the size

        SaxBitmapDetectorMapper mapper = new SaxBitmapDetectorMapper();

        Schema<SaxBitmapDetectorState> schema = RuntimeSchema.getSchema(SaxBitmapDetectorState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            SaxBitmapDetectorState state = mapper.toState(detector);
            bytes = ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }

        System.out.printf("universe size = %d samples%n", detector.getUniverseSize());
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore from the bytes and compare the analyses of the two detectors

        SaxBitmapDetectorState state2 = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state2, schema);
        SaxBitmapDetector detector2 = mapper.toModel(state2);

        double[] next = SignalDataSets.sine(50, 1000, 1.0, 0.1, 1L);
        List<Analysis> results = detector.detect(next, 2L);
        List<Analysis> results2 = detector2.detect(next, 2L);

        if (!results.equals(results2)) {
            throw new IllegalStateException("restored detector does not agree with original detector");
        }

        System.out.println("Looks good!");
    }
}
