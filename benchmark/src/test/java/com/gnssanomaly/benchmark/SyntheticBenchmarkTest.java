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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class SyntheticBenchmarkTest {

    @Test
    public void testDefaults() {
        SyntheticBenchmark benchmark = SyntheticBenchmark.builder().build();

        assertEquals(1460, benchmark.getGenerator().getDays());
        assertEquals(6.0, benchmark.getGenerator().getSeasonalAmplitude());
        assertEquals(2.0, benchmark.getGenerator().getNoiseLevel());
        assertEquals(0.05, benchmark.getScorer().getContamination());
        assertEquals(200, benchmark.getScorer().getNumberOfTrees());
        assertEquals(EnumSet.allOf(FaultType.class), benchmark.getFaults());
        assertThrows(IllegalArgumentException.class,
                () -> SyntheticBenchmark.builder().faults(Collections.emptySet()).build());
    }

    @Test
    public void testTrialsAreReproducible() {
        SyntheticBenchmark benchmark = SyntheticBenchmark.builder().build();

        SyntheticTrial first = benchmark.generateTrial(1.0);
        SyntheticTrial second = benchmark.generateTrial(1.0);

        assertArrayEquals(first.getSignal(), second.getSignal());
        assertArrayEquals(first.getGroundTruth(), second.getGroundTruth());
        assertEquals(83, first.getPositiveCount());
        assertArrayEquals(benchmark.evaluate(first).getDetected(), benchmark.evaluate(second).getDetected());
    }

    @Test
    public void testContaminationBoundsDetections() {
        TrialResult result = SyntheticBenchmark.builder().build().run(1.0);

        assertThat(result.getDetectedCount(), greaterThan(0));
        assertThat(74, greaterThanOrEqualTo(result.getDetectedCount()));
    }

    @Test
    public void testStepOnsetIsDetected() {
        SyntheticBenchmark benchmark = SyntheticBenchmark.builder().faults(EnumSet.of(FaultType.STEP)).build();

        TrialResult result = benchmark.run(0.0);

        assertEquals(3, result.getTrial().getPositiveCount());
        assertThat(result.getRecallPercent(), greaterThan(0.0));
        assertEquals(Optional.of(result.getRecallPercent()), result.getRecallPercent(FaultType.STEP));
        assertEquals(Optional.empty(), result.getRecallPercent(FaultType.RAMP));
    }

    @Test
    public void testFastRampIsDetected() {
        SyntheticBenchmark benchmark = SyntheticBenchmark.builder().faults(EnumSet.of(FaultType.RAMP)).build();

        TrialResult result = benchmark.run(2.5);

        assertEquals(730, result.getTrial().getFault(FaultType.RAMP).get().getOnset());
        assertEquals(60, result.getTrial().getPositiveCount());
        assertThat(result.getRecallPercent(), greaterThanOrEqualTo(SyntheticBenchmark.HIGH_EFFECTIVENESS_RECALL));
    }

    @Test
    public void testSensitivityCurve() {
        List<SensitivityPoint> curve = SyntheticBenchmark.builder().build().sweep(SyntheticBenchmark.DEFAULT_SLOPES);

        assertEquals(SyntheticBenchmark.DEFAULT_SLOPES.size(), curve.size());
        for (int i = 0; i < curve.size(); i++) {
            assertEquals(SyntheticBenchmark.DEFAULT_SLOPES.get(i), curve.get(i).getSlope());
        }
        SensitivityPoint slowest = curve.get(0);
        SensitivityPoint fastest = curve.get(curve.size() - 1);
        assertThat(fastest.getRampRecallPercent(), greaterThanOrEqualTo(slowest.getRampRecallPercent() + 20.0));
        for (int i = 1; i < curve.size(); i++) {
            if (curve.get(i).getSlope() >= 1.0) {
                assertThat(curve.get(i).getRampRecallPercent(),
                        greaterThanOrEqualTo(curve.get(i - 1).getRampRecallPercent() - 10.0));
            }
        }
    }

    @Test
    public void testRecall() {
        int[] groundTruth = { 0, 1, 1, 1, 1, 0 };
        boolean[] detected = { true, true, false, true, false, false };

        assertEquals(50.0, SyntheticBenchmark.recallPercent(groundTruth, detected));
        assertEquals(0.0, SyntheticBenchmark.recallPercent(new int[2], new boolean[] { true, true }));
        assertEquals(100.0,
                SyntheticBenchmark.recallPercent(new InjectedFault(FaultType.NOISE_BURST, 3, 1, 8.0), detected));
        assertThrows(IllegalArgumentException.class,
                () -> SyntheticBenchmark.recallPercent(new int[1], new boolean[2]));
    }

    @Test
    public void testDetectableThreshold() {
        List<SensitivityPoint> curve = Arrays.asList(new SensitivityPoint(0.5, 40.0, 20.0),
                new SensitivityPoint(1.0, 70.0, 85.0), new SensitivityPoint(2.0, 80.0, 95.0),
                new SensitivityPoint(3.0, 85.0, 100.0));

        assertEquals(Optional.of(2.0), SyntheticBenchmark.detectableThreshold(curve, 90.0));
        assertEquals(Optional.empty(), SyntheticBenchmark.detectableThreshold(curve.subList(0, 2), 90.0));
    }

    @Test
    public void testStandardizeColumns() {
        double[][] standardized = SyntheticBenchmark
                .standardizeColumns(new double[][] { { 1.0, 5.0 }, { 3.0, 5.0 } });

        assertArrayEquals(new double[] { -1.0, 0.0 }, standardized[0], 1e-12);
        assertArrayEquals(new double[] { 1.0, 0.0 }, standardized[1], 1e-12);
    }
}
