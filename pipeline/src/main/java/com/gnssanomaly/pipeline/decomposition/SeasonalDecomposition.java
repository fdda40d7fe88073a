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

package com.gnssanomaly.pipeline.decomposition;

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.Arrays;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Classical additive decomposition of a gap-free series into trend, seasonal
 * and residual components: {@code x = trend + seasonal + residual}.
 * <p>
 * The trend is a centred moving average over one period. For an even period
 * the window spans {@code period + 1} samples with half weight at both ends. The
 * moving average is undefined for half a window at each edge; there the trend
 * is extrapolated by a least-squares line through the nearest
 * {@code period - 1} trend values. The seasonal component is the mean of the
 * detrended series at each phase of the period, shifted to zero mean and
 * repeated over the series.
 */
public class SeasonalDecomposition {

    private final int period;

    public SeasonalDecomposition(int period) {
        checkArgument(period >= 3, "period must be at least 3");
        this.period = period;
    }

    public int getPeriod() {
        return period;
    }

    /**
     * @param x a series without missing values, at least two periods long
     * @return the three components, each as long as the series
     */
    public Components decompose(double[] x) {
        checkArgument(x.length >= 2 * period, "series must cover at least two periods");
        for (double value : x) {
            checkArgument(Double.isFinite(value), "series must not contain missing or infinite values");
        }

        double[] trend = movingAverage(x);
        extrapolateEdges(trend);

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int i = 0; i < x.length; i++) {
            phaseSum[i % period] += x[i] - trend[i];
            phaseCount[i % period]++;
        }
        double[] phaseMean = new double[period];
        double offset = 0;
        for (int p = 0; p < period; p++) {
            phaseMean[p] = phaseSum[p] / phaseCount[p];
            offset += phaseMean[p];
        }
        offset /= period;

        double[] seasonal = new double[x.length];
        double[] residual = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            seasonal[i] = phaseMean[i % period] - offset;
            residual[i] = x[i] - trend[i] - seasonal[i];
        }
        return new Components(trend, seasonal, residual);
    }

    double[] movingAverage(double[] x) {
        double[] filter;
        if (period % 2 == 0) {
            filter = new double[period + 1];
            Arrays.fill(filter, 1.0 / period);
            filter[0] = 0.5 / period;
            filter[period] = 0.5 / period;
        } else {
            filter = new double[period];
            Arrays.fill(filter, 1.0 / period);
        }
        int half = (filter.length - 1) / 2;

        double[] trend = new double[x.length];
        Arrays.fill(trend, Double.NaN);
        for (int i = half; i < x.length - half; i++) {
            double sum = 0;
            for (int k = 0; k < filter.length; k++) {
                sum += filter[k] * x[i - half + k];
            }
            trend[i] = sum;
        }
        return trend;
    }

    private void extrapolateEdges(double[] trend) {
        int front = 0;
        while (Double.isNaN(trend[front])) {
            front++;
        }
        int back = trend.length - 1;
        while (Double.isNaN(trend[back])) {
            back--;
        }

        int frontLast = Math.min(front + period - 1, back);
        SimpleRegression head = fit(trend, front, frontLast);
        for (int i = 0; i < front; i++) {
            trend[i] = head.predict(i);
        }

        int backFirst = Math.max(front, back - (period - 1));
        SimpleRegression tail = fit(trend, backFirst, back);
        for (int i = back + 1; i < trend.length; i++) {
            trend[i] = tail.predict(i);
        }
    }

    private static SimpleRegression fit(double[] values, int from, int to) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = from; i < to; i++) {
            regression.addData(i, values[i]);
        }
        return regression;
    }

    /**
     * The trend, seasonal and residual components of one series.
     */
    public static class Components {
        private final double[] trend;
        private final double[] seasonal;
        private final double[] residual;

        Components(double[] trend, double[] seasonal, double[] residual) {
            this.trend = trend;
            this.seasonal = seasonal;
            this.residual = residual;
        }

        public double[] getTrend() {
            return trend;
        }

        public double[] getSeasonal() {
            return seasonal;
        }

        public double[] getResidual() {
            return residual;
        }
    }
}
