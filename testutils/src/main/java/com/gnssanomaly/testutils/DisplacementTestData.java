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

package com.gnssanomaly.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples daily station displacements in meters: an annual sinusoid,
 * an optional linear drift and independent normal noise on each of the east,
 * north and up axes. Rows are days, columns are the three axes. Generators with
 * the same parameters and seed produce the same data.
 */
public class DisplacementTestData {

    public static final double DAYS_PER_YEAR = 365.25;

    private final double amplitude;
    private final double noise;
    private final double driftPerDay;

    public DisplacementTestData(double amplitude, double noise, double driftPerDay) {
        this.amplitude = amplitude;
        this.noise = noise;
        this.driftPerDay = driftPerDay;
    }

    /**
     * Millimetre-scale motion: 3 mm annual amplitude, 1 mm noise and 10 mm of
     * drift per year.
     */
    public DisplacementTestData() {
        this(0.003, 0.001, 0.01 / DAYS_PER_YEAR);
    }

    public double[][] generateTestData(int numberOfDays, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] result = new double[numberOfDays][3];
        for (int t = 0; t < numberOfDays; t++) {
            for (int axis = 0; axis < 3; axis++) {
                double phase = 2 * Math.PI * t / DAYS_PER_YEAR + axis;
                result[t][axis] = amplitude * Math.sin(phase) + driftPerDay * t + dist.nextDouble(0.0, noise);
            }
        }
        return result;
    }

    /**
     * @param numberOfDays the number of rows
     * @param value        the displacement of every axis on every day
     * @return a series that never moves
     */
    public static double[][] constant(int numberOfDays, double value) {
        double[][] result = new double[numberOfDays][3];
        for (double[] row : result) {
            Arrays.fill(row, value);
        }
        return result;
    }

    /**
     * Marks a run of days as not observed by setting every axis to NaN.
     *
     * @param data   rows of displacements, changed in place
     * @param from   the first missing day
     * @param length the number of missing days
     * @return the same rows
     */
    public static double[][] removeDays(double[][] data, int from, int length) {
        for (int t = from; t < Math.min(data.length, from + length); t++) {
            Arrays.fill(data[t], Double.NaN);
        }
        return data;
    }

    /**
     * Adds an offset to every axis from a day onwards, the signature of an
     * antenna change or an earthquake.
     *
     * @param data   rows of displacements, changed in place
     * @param from   the first displaced day
     * @param offset the offset in meters
     * @return the same rows
     */
    public static double[][] addStep(double[][] data, int from, double offset) {
        for (int t = from; t < data.length; t++) {
            for (int axis = 0; axis < data[t].length; axis++) {
                data[t][axis] += offset;
            }
        }
        return data;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
