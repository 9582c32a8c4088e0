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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.saxbitmap.SaxBitmapDetector;
import com.amazon.saxbitmap.config.ZeroVarianceStrategy;
import com.amazon.saxbitmap.returntypes.Analysis;
import com.amazon.saxbitmap.testutils.SignalDataSets;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

public class SaxBitmapDetectorMapperTest {

    private SaxBitmapDetectorMapper mapper;

    @BeforeEach
    public void setUp() {
        mapper = new SaxBitmapDetectorMapper();
    }

    private static SaxBitmapDetector newDetector() {
        return SaxBitmapDetector.builder().wordSize(3).windowFactor(2).leadWindowFactor(2).lagWindowFactor(3)
                .alphabetSize(2).recursionLevel(2).zeroVarianceStrategy(ZeroVarianceStrategy.CENTER).build();
    }

    // detectors stopped before the lead window fills, before the lag window
    // fills, and after both are full
    static Stream<Arguments> detectorProvider() {
        return Stream.of(0, 5, 12, 20, 29, 30, 75).map(count -> {
            SaxBitmapDetector detector = newDetector();
            detector.detect(SignalDataSets.gaussian(count, 0, 1, count), 100L + count);
            return Arguments.of(detector);
        });
    }

    private static void assertSameBehavior(SaxBitmapDetector expected, SaxBitmapDetector actual) {
        assertEquals(expected.getWordSize(), actual.getWordSize());
        assertEquals(expected.getWindowSize(), actual.getWindowSize());
        assertEquals(expected.getLeadWindowSize(), actual.getLeadWindowSize());
        assertEquals(expected.getLagWindowSize(), actual.getLagWindowSize());
        assertEquals(expected.getRecursionLevel(), actual.getRecursionLevel());
        assertEquals(expected.getAlphabetSize(), actual.getAlphabetSize());
        assertEquals(expected.getZeroVarianceStrategy(), actual.getZeroVarianceStrategy());
        assertEquals(expected.getLastTimestamp(), actual.getLastTimestamp());
        assertEquals(expected.getTotalUpdates(), actual.getTotalUpdates());
        assertArrayEquals(expected.getLeadWindowValues(), actual.getLeadWindowValues());
        assertArrayEquals(expected.getLagWindowValues(), actual.getLagWindowValues());

        double[] next = SignalDataSets.sine(40, 7, 3.0, 0.2, 99L);
        List<Analysis> expectedResults = expected.detect(next, 500L);
        List<Analysis> actualResults = actual.detect(next, 500L);
        assertEquals(expectedResults, actualResults);
    }

    @ParameterizedTest
    @MethodSource("detectorProvider")
    public void testRoundTrip(SaxBitmapDetector detector) {
        SaxBitmapDetector copy = mapper.toModel(mapper.toState(detector));
        assertSameBehavior(detector, copy);
    }

    @ParameterizedTest
    @MethodSource("detectorProvider")
    public void testRoundTripWithJackson(SaxBitmapDetector detector) throws Exception {
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(detector));
        SaxBitmapDetectorState state = jsonMapper.readValue(json, SaxBitmapDetectorState.class);
        assertSameBehavior(detector, mapper.toModel(state));
    }

    @ParameterizedTest
    @MethodSource("detectorProvider")
    public void testRoundTripWithProtostuff(SaxBitmapDetector detector) {
        Schema<SaxBitmapDetectorState> schema = RuntimeSchema.getSchema(SaxBitmapDetectorState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            bytes = ProtostuffIOUtil.toByteArray(mapper.toState(detector), schema, buffer);
        } finally {
            buffer.clear();
        }
        SaxBitmapDetectorState state = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        assertSameBehavior(detector, mapper.toModel(state));
    }

    @Test
    public void testStateFields() {
        SaxBitmapDetector detector = newDetector();
        detector.detect(SignalDataSets.ramp(14, 0, 1), 3L);
        SaxBitmapDetectorState state = mapper.toState(detector);
        assertEquals(Version.CURRENT, state.getVersion());
        assertEquals(3, state.getWordSize());
        assertEquals(2, state.getWindowFactor());
        assertEquals(2, state.getLeadWindowFactor());
        assertEquals(3, state.getLagWindowFactor());
        assertEquals(2, state.getRecursionLevel());
        assertEquals(2, state.getAlphabetSize());
        assertEquals("CENTER", state.getZeroVarianceStrategy());
        assertArrayEquals(SignalDataSets.ramp(12, 2, 1), state.getLeadWindow());
        assertArrayEquals(new double[] { 0, 1 }, state.getLagWindow());
        assertEquals(3L, state.getLastTimestamp());
        assertEquals(14L, state.getTotalUpdates());
    }

    @Test
    public void testMissingWindowsAreEmpty() {
        SaxBitmapDetectorState state = mapper.toState(newDetector());
        state.setLeadWindow(null);
        state.setLagWindow(null);
        SaxBitmapDetector detector = mapper.toModel(state);
        assertEquals(0, detector.getLeadWindowValues().length);
        assertEquals(0, detector.getTotalUpdates());
    }

    @Test
    public void testInvalidStates() {
        assertThrows(NullPointerException.class, () -> mapper.toState(null));
        assertThrows(NullPointerException.class, () -> mapper.toModel(null));

        SaxBitmapDetectorState unknownVersion = mapper.toState(newDetector());
        unknownVersion.setVersion("0.1");
        assertThrows(IllegalStateException.class, () -> mapper.toModel(unknownVersion));

        SaxBitmapDetectorState noStrategy = mapper.toState(newDetector());
        noStrategy.setZeroVarianceStrategy(null);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(noStrategy));

        SaxBitmapDetectorState oversized = mapper.toState(newDetector());
        oversized.setLeadWindow(new double[13]);
        oversized.setTotalUpdates(13);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(oversized));

        SaxBitmapDetectorState badConfiguration = mapper.toState(newDetector());
        badConfiguration.setRecursionLevel(3);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(badConfiguration));
    }
}
