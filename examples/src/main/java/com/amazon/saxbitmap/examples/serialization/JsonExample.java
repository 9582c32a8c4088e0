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

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.amazon.saxbitmap.SaxBitmapDetector;
import com.amazon.saxbitmap.examples.Example;
import com.amazon.saxbitmap.returntypes.Analysis;
import com.amazon.saxbitmap.state.SaxBitmapDetectorMapper;
import com.amazon.saxbitmap.state.SaxBitmapDetectorState;
import com.amazon.saxbitmap.testutils.SignalDataSets;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize a SAX bitmap detector to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a SAX bitmap detector as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a detector

        SaxBitmapDetector detector = SaxBitmapDetector.builder().wordSize(4).windowFactor(10).leadWindowFactor(2)
                .lagWindowFactor(8).build();
        detector.detect(SignalDataSets.sine(2 * detector.getUniverseSize(), 40, 1.0, 0.1, 0L), 1L);

        // Convert to JSON and print the number of bytes

        SaxBitmapDetectorMapper mapper = new SaxBitmapDetectorMapper();
        ObjectMapper jsonMapper = new ObjectMapper();

        String json = jsonMapper.writeValueAsString(mapper.toState(detector));

        System.out.printf("window size = %d, lead = %d, lag = %d%n", detector.getWindowSize(),
                detector.getLeadWindowSize(), detector.getLagWindowSize());
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        // Restore from JSON and compare the analyses of the two detectors

        SaxBitmapDetector detector2 = mapper.toModel(jsonMapper.readValue(json, SaxBitmapDetectorState.class));

        double[] next = SignalDataSets.gaussian(200, 0, 1, 1L);
        List<Analysis> results = detector.detect(next, 2L);
        List<Analysis> results2 = detector2.detect(next, 2L);

        if (!results.equals(results2)) {
            throw new IllegalStateException("restored detector does not agree with original detector");
        }

        System.out.println("Looks good!");
    }
}
