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

package com.gnssanomaly.benchmark;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class SensitivityCsvWriterTest {

    @Test
    public void testWriteCurve() throws IOException {
        List<SensitivityPoint> curve = Arrays.asList(new SensitivityPoint(0.5, 41.25, 18.333),
                new SensitivityPoint(2.5, 86.75, 96.666));
        StringWriter writer = new StringWriter();

        new SensitivityCsvWriter().writeCurve(curve, 90.0, writer);

        String[] lines = writer.toString().split("\\R");
        assertEquals(3, lines.length);
        assertEquals("slope,recall_percent,ramp_recall_percent,reference_percent,reaches_reference", lines[0]);
        assertEquals("0.5,41.3,18.3,90.0,false", lines[1]);
        assertEquals("2.5,86.8,96.7,90.0,true", lines[2]);
    }

    @Test
    public void testWriteTrial() throws IOException {
        SyntheticTrial trial = new SyntheticTrial(new double[] { 1.5, -2.0, 30.0 }, new int[] { 0, 0, 1 },
                Collections.singletonList(new InjectedFault(FaultType.STEP, 2, 1, 30.0)));
        StringWriter writer = new StringWriter();

        new SensitivityCsvWriter().writeTrial(new TrialResult(trial, new boolean[] { false, true, true }), writer);

        String[] lines = writer.toString().split("\\R");
        assertEquals(4, lines.length);
        assertEquals("day,signal,ground_truth,detected", lines[0]);
        assertEquals("0,1.5,0,0", lines[1]);
        assertEquals("1,-2.0,0,1", lines[2]);
        assertEquals("2,30.0,1,1", lines[3]);
    }
}
