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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.EnumSet;

import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FaultInjectorTest {

    private FaultInjector injector;
    private RandomGenerator random;

    @BeforeEach
    public void setUp() {
        injector = FaultInjector.builder().build();
        random = mock(RandomGenerator.class);
        when(random.nextGaussian()).thenReturn(1.0);
    }

    @Test
    public void testOnsets() {
        assertEquals(365, FaultInjector.onset(FaultType.STEP, 1460));
        assertEquals(730, FaultInjector.onset(FaultType.RAMP, 1460));
        assertEquals(1095, FaultInjector.onset(FaultType.NOISE_BURST, 1460));
    }

    @Test
    public void testStepPersistsButOnlyItsOnsetIsAnomalous() {
        SyntheticTrial trial = injector.inject(new double[100], EnumSet.of(FaultType.STEP), 0.0, random);

        double[] signal = trial.getSignal();
        int[] groundTruth = trial.getGroundTruth();
        assertEquals(0.0, signal[24]);
        assertEquals(15.0, signal[25]);
        assertEquals(15.0, signal[99]);
        assertEquals(3, trial.getPositiveCount());
        assertEquals(1, groundTruth[27]);
        assertEquals(0, groundTruth[28]);
        assertEquals(FaultType.STEP, trial.getFaults().get(0).getType());
        verify(random, never()).nextGaussian();
    }

    @Test
    public void testRampIsClippedToTheSeries() {
        SyntheticTrial trial = injector.inject(new double[100], EnumSet.of(FaultType.RAMP), 0.5, random);

        double[] signal = trial.getSignal();
        assertEquals(0.0, signal[50]);
        assertEquals(0.5, signal[51]);
        assertEquals(24.5, signal[99]);
        assertEquals(50, trial.getPositiveCount());
        InjectedFault ramp = trial.getFault(FaultType.RAMP).get();
        assertEquals(50, ramp.getOnset());
        assertEquals(60, ramp.getLength());
        assertEquals(0.5, ramp.getSeverity());
        assertTrue(ramp.covers(109));
        assertFalse(ramp.covers(110));
    }

    @Test
    public void testNoiseBurst() {
        FaultInjector scaled = FaultInjector.builder().baselineNoise(2.0).noiseMultiplier(4.0).build();

        SyntheticTrial trial = scaled.inject(new double[200], EnumSet.of(FaultType.NOISE_BURST), 0.0, random);

        double[] signal = trial.getSignal();
        assertEquals(0.0, signal[149]);
        assertEquals(8.0, signal[150]);
        assertEquals(8.0, signal[169]);
        assertEquals(0.0, signal[170]);
        assertEquals(20, trial.getPositiveCount());
        assertEquals(8.0, trial.getFault(FaultType.NOISE_BURST).get().getSeverity());
        verify(random, times(20)).nextGaussian();
    }

    @Test
    public void testAllFaults() {
        SyntheticTrial trial = injector.inject(new double[1460], 2.5, random);

        assertEquals(3 + 60 + 20, trial.getPositiveCount());
        assertEquals(3, trial.getFaults().size());
        assertEquals(15.0 + 59 * 2.5, trial.getSignal()[789], 1e-12);
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> FaultInjector.builder().rampDuration(0).build());
        assertThrows(IllegalArgumentException.class, () -> injector.inject(new double[0], 1.0, random));
    }
}
