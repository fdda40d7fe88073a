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

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Features a synthetic trial is scored on. They stand in for the residual
 * features of real stations, which a trend-free synthetic signal does not need
 * a decomposition for.
 */
public class FeatureEngineering {

    public static final int ROLLING_WINDOW = 7;

    public static final int FEATURE_COUNT = 4;

    private FeatureEngineering() {
    }

    /**
     * @param signal a series without missing values
     * @return per day: the value, its first difference, its second difference and
     *         the centred rolling standard deviation
     */
    public static double[][] features(double[] signal) {
        double[] velocity = difference(signal);
        double[] acceleration = difference(velocity);
        double[] rollingStd = rollingStandardDeviation(signal, ROLLING_WINDOW);
        double[][] features = new double[signal.length][FEATURE_COUNT];
        for (int t = 0; t < signal.length; t++) {
            features[t][0] = signal[t];
            features[t][1] = velocity[t];
            features[t][2] = acceleration[t];
            features[t][3] = rollingStd[t];
        }
        return features;
    }

    /**
     * @param values a series
     * @return {@code x[t] - x[t-1]}, 0 on the first day
     */
    public static double[] difference(double[] values) {
        double[] result = new double[values.length];
        for (int t = 1; t < values.length; t++) {
            result[t] = values[t] - values[t - 1];
        }
        return result;
    }

    /**
     * Sample standard deviation over a centred window. Days whose window does not
     * fit in the series get 0.
     *
     * @param values a series
     * @param window an odd window length
     * @return one value per day
     */
    public static double[] rollingStandardDeviation(double[] values, int window) {
        checkArgument(window > 1 && window % 2 == 1, "window must be odd and greater than 1");
        int half = window / 2;
        double[] result = new double[values.length];
        StandardDeviation deviation = new StandardDeviation(true);
        for (int t = half; t < values.length - half; t++) {
            result[t] = deviation.evaluate(values, t - half, window);
        }
        return result;
    }
}
