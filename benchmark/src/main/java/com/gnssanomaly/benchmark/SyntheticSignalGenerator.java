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

import org.apache.commons.math3.random.RandomGenerator;

public class SyntheticSignalGenerator {

    public static final double DAYS_PER_YEAR = 365.25;

    private final int days;
    private final double seasonalAmplitude;
    private final double noiseLevel;

    /**
     * @param days              the length of the series
     * @param seasonalAmplitude the amplitude of the annual sinusoid in millimetres
     * @param noiseLevel        the standard deviation of the Gaussian noise in
     *                          millimetres
     */
    public SyntheticSignalGenerator(int days, double seasonalAmplitude, double noiseLevel) {
        checkArgument(days > 0, "days must be greater than 0");
        checkArgument(noiseLevel >= 0, "noiseLevel must be non-negative");
        this.days = days;
        this.seasonalAmplitude = seasonalAmplitude;
        this.noiseLevel = noiseLevel;
    }

    /**
     * @param random the noise source
     * @return {@code A sin(2 pi t / 365.25) + N(0, noise)} for every day
     */
    public double[] generate(RandomGenerator random) {
        double[] signal = new double[days];
        for (int t = 0; t < days; t++) {
            signal[t] = seasonalAmplitude * Math.sin(2 * Math.PI * t / DAYS_PER_YEAR)
                    + noiseLevel * random.nextGaussian();
        }
        return signal;
    }

    public int getDays() {
        return days;
    }

    public double getSeasonalAmplitude() {
        return seasonalAmplitude;
    }

    public double getNoiseLevel() {
        return noiseLevel;
    }
}
