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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Injects the fault archetypes into a clean series at fixed fractional
 * positions: the step at a quarter, the ramp at half and the noise burst at
 * three quarters of the series.
 */
public class FaultInjector {

    public static final double DEFAULT_STEP_MAGNITUDE = 15.0;

    public static final int DEFAULT_STEP_FLAGGED_DAYS = 3;

    public static final int DEFAULT_RAMP_DURATION = 60;

    public static final int DEFAULT_NOISE_DURATION = 20;

    public static final double DEFAULT_NOISE_MULTIPLIER = 4.0;

    public static final double STEP_POSITION = 0.25;

    public static final double RAMP_POSITION = 0.5;

    public static final double NOISE_POSITION = 0.75;

    private final double stepMagnitude;
    private final int stepFlaggedDays;
    private final int rampDuration;
    private final int noiseDuration;
    private final double noiseMultiplier;
    private final double baselineNoise;

    protected FaultInjector(Builder builder) {
        checkArgument(builder.stepFlaggedDays > 0, "stepFlaggedDays must be greater than 0");
        checkArgument(builder.rampDuration > 0, "rampDuration must be greater than 0");
        checkArgument(builder.noiseDuration > 0, "noiseDuration must be greater than 0");
        checkArgument(builder.noiseMultiplier >= 0, "noiseMultiplier must be non-negative");
        checkArgument(builder.baselineNoise >= 0, "baselineNoise must be non-negative");
        stepMagnitude = builder.stepMagnitude;
        stepFlaggedDays = builder.stepFlaggedDays;
        rampDuration = builder.rampDuration;
        noiseDuration = builder.noiseDuration;
        noiseMultiplier = builder.noiseMultiplier;
        baselineNoise = builder.baselineNoise;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param type   a fault archetype
     * @param length the length of the series
     * @return the day the fault starts on
     */
    public static int onset(FaultType type, int length) {
        switch (type) {
        case STEP:
            return (int) (length * STEP_POSITION);
        case RAMP:
            return (int) (length * RAMP_POSITION);
        default:
            return (int) (length * NOISE_POSITION);
        }
    }

    /**
     * Injects every fault archetype.
     *
     * @see #inject(double[], Set, double, RandomGenerator)
     */
    public SyntheticTrial inject(double[] clean, double rampSlope, RandomGenerator random) {
        return inject(clean, EnumSet.allOf(FaultType.class), rampSlope, random);
    }

    /**
     * @param clean     the clean series, not modified
     * @param faults    the archetypes to inject
     * @param rampSlope the drift per day of the ramp in millimetres
     * @param random    the source of the burst noise
     * @return the faulty series with its ground truth
     */
    public SyntheticTrial inject(double[] clean, Set<FaultType> faults, double rampSlope, RandomGenerator random) {
        checkNotNull(clean, "clean must not be null");
        checkArgument(clean.length > 0, "clean must not be empty");
        double[] signal = Arrays.copyOf(clean, clean.length);
        int[] groundTruth = new int[signal.length];
        List<InjectedFault> injected = new ArrayList<>();

        if (faults.contains(FaultType.STEP)) {
            int onset = onset(FaultType.STEP, signal.length);
            for (int t = onset; t < signal.length; t++) {
                signal[t] += stepMagnitude;
            }
            injected.add(mark(groundTruth, new InjectedFault(FaultType.STEP, onset, stepFlaggedDays, stepMagnitude)));
        }
        if (faults.contains(FaultType.RAMP)) {
            int onset = onset(FaultType.RAMP, signal.length);
            for (int k = 0; k < rampDuration && onset + k < signal.length; k++) {
                signal[onset + k] += k * rampSlope;
            }
            injected.add(mark(groundTruth, new InjectedFault(FaultType.RAMP, onset, rampDuration, rampSlope)));
        }
        if (faults.contains(FaultType.NOISE_BURST)) {
            int onset = onset(FaultType.NOISE_BURST, signal.length);
            double deviation = baselineNoise * noiseMultiplier;
            for (int k = 0; k < noiseDuration && onset + k < signal.length; k++) {
                signal[onset + k] += deviation * random.nextGaussian();
            }
            injected.add(mark(groundTruth, new InjectedFault(FaultType.NOISE_BURST, onset, noiseDuration, deviation)));
        }
        return new SyntheticTrial(signal, groundTruth, injected);
    }

    private static InjectedFault mark(int[] groundTruth, InjectedFault fault) {
        for (int t = fault.getOnset(); t < Math.min(groundTruth.length, fault.getOnset() + fault.getLength()); t++) {
            groundTruth[t] = 1;
        }
        return fault;
    }

    public double getStepMagnitude() {
        return stepMagnitude;
    }

    public int getRampDuration() {
        return rampDuration;
    }

    public int getNoiseDuration() {
        return noiseDuration;
    }

    public double getNoiseMultiplier() {
        return noiseMultiplier;
    }

    public static class Builder {
        private double stepMagnitude = DEFAULT_STEP_MAGNITUDE;
        private int stepFlaggedDays = DEFAULT_STEP_FLAGGED_DAYS;
        private int rampDuration = DEFAULT_RAMP_DURATION;
        private int noiseDuration = DEFAULT_NOISE_DURATION;
        private double noiseMultiplier = DEFAULT_NOISE_MULTIPLIER;
        private double baselineNoise = SyntheticBenchmark.DEFAULT_NOISE_LEVEL;

        public Builder stepMagnitude(double stepMagnitude) {
            this.stepMagnitude = stepMagnitude;
            return this;
        }

        public Builder stepFlaggedDays(int stepFlaggedDays) {
            this.stepFlaggedDays = stepFlaggedDays;
            return this;
        }

        public Builder rampDuration(int rampDuration) {
            this.rampDuration = rampDuration;
            return this;
        }

        public Builder noiseDuration(int noiseDuration) {
            this.noiseDuration = noiseDuration;
            return this;
        }

        public Builder noiseMultiplier(double noiseMultiplier) {
            this.noiseMultiplier = noiseMultiplier;
            return this;
        }

        public Builder baselineNoise(double baselineNoise) {
            this.baselineNoise = baselineNoise;
            return this;
        }

        public FaultInjector build() {
            return new FaultInjector(this);
        }
    }
}
