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
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.model.StationSeries;

/**
 * Removes the long-term trend and the annual cycle from every axis of a
 * station, leaving the residual motion that anomalies are searched in.
 * <p>
 * Short gaps are interpolated first. The available samples are then compacted
 * and decomposed with a {@link SeasonalDecomposition}. When the history is too
 * short, the calendar too fragmented or the decomposition fails, the axis is
 * detrended by a least-squares line instead and the result is marked degraded.
 * An axis with fewer than {@link #MIN_FIT_SAMPLES} samples yields no residual
 * at all. Decomposing never fails for a valid series.
 */
public class Decomposer {

    private static final Logger LOG = LogManager.getLogger(Decomposer.class);

    /**
     * Default seasonal period in days.
     */
    public static final int DEFAULT_SEASONAL_PERIOD = 365;

    /**
     * Default longest run of missing days that is interpolated.
     */
    public static final int DEFAULT_GAP_LIMIT = 5;

    /**
     * Default largest fraction of missing days for which the seasonal
     * decomposition is attempted.
     */
    public static final double DEFAULT_MAX_MISSING_FRACTION = 0.5;

    /**
     * The fewest samples a linear fit is attempted on.
     */
    public static final int MIN_FIT_SAMPLES = 11;

    private final int seasonalPeriod;
    private final int gapLimit;
    private final double maxMissingFraction;
    private final SeasonalDecomposition decomposition;

    protected Decomposer(Builder builder) {
        checkArgument(builder.seasonalPeriod >= 3, "seasonalPeriod must be at least 3");
        checkArgument(builder.gapLimit >= 0, "gapLimit must be non-negative");
        checkArgument(builder.maxMissingFraction >= 0 && builder.maxMissingFraction <= 1,
                "maxMissingFraction must be in the range [0, 1]");
        seasonalPeriod = builder.seasonalPeriod;
        gapLimit = builder.gapLimit;
        maxMissingFraction = builder.maxMissingFraction;
        decomposition = new SeasonalDecomposition(seasonalPeriod);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decomposes all three axes of a station.
     *
     * @param series the station series, in meters
     * @return residuals and raw uncertainties on the station calendar
     */
    public DecomposedSeries decompose(StationSeries series) {
        checkNotNull(series, "series must not be null");
        Map<Axis, DecompositionResult> results = new EnumMap<>(Axis.class);
        Map<Axis, double[]> sigmas = new EnumMap<>(Axis.class);
        for (Axis axis : Axis.values()) {
            results.put(axis, decompose(series.getStation(), axis, series.toCalendar(axis::displacementOf)));
            sigmas.put(axis, series.toCalendar(axis::sigmaOf));
        }
        return new DecomposedSeries(series.getStation(), series.getFirstDate(), results, sigmas);
    }

    /**
     * Decomposes one axis.
     *
     * @param station  the station name, for logging
     * @param axis     the axis, for logging
     * @param calendar daily values on the station calendar, NaN where missing
     * @return the decomposition, aligned with the calendar
     */
    public DecompositionResult decompose(String station, Axis axis, double[] calendar) {
        double[] filled = GapInterpolator.fill(calendar, gapLimit);
        int[] positions = availablePositions(filled);
        double[] samples = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            samples[i] = filled[positions[i]];
        }

        if (samples.length < MIN_FIT_SAMPLES) {
            LOG.warn("station {} axis {}: only {} samples, no residual computed", station, axis, samples.length);
            double[] missing = new double[calendar.length];
            Arrays.fill(missing, Double.NaN);
            return DecompositionResult.detrended(missing, Arrays.copyOf(missing, missing.length),
                    DegradationReason.INSUFFICIENT_SAMPLES);
        }
        if (samples.length < 2 * seasonalPeriod) {
            return detrend(station, axis, calendar.length, positions, samples, DegradationReason.INSUFFICIENT_HISTORY);
        }
        double missingFraction = GapInterpolator.missingFraction(filled);
        if (missingFraction > maxMissingFraction) {
            return detrend(station, axis, calendar.length, positions, samples, DegradationReason.FRAGMENTED_CALENDAR);
        }

        SeasonalDecomposition.Components components;
        try {
            components = decomposition.decompose(samples);
        } catch (RuntimeException e) {
            LOG.warn("station {} axis {}: seasonal decomposition failed", station, axis, e);
            return detrend(station, axis, calendar.length, positions, samples, DegradationReason.DECOMPOSITION_FAILED);
        }
        return DecompositionResult.decomposed(scatter(components.getTrend(), positions, calendar.length),
                scatter(components.getSeasonal(), positions, calendar.length),
                scatter(components.getResidual(), positions, calendar.length));
    }

    private DecompositionResult detrend(String station, Axis axis, int length, int[] positions, double[] samples,
            DegradationReason reason) {
        LOG.warn("station {} axis {}: falling back to linear detrending ({}, {} samples)", station, axis, reason,
                samples.length);
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < samples.length; i++) {
            regression.addData(i, samples[i]);
        }
        double[] trend = new double[samples.length];
        double[] residual = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            trend[i] = regression.predict(i);
            residual[i] = samples[i] - trend[i];
        }
        return DecompositionResult.detrended(scatter(trend, positions, length), scatter(residual, positions, length),
                reason);
    }

    private static int[] availablePositions(double[] values) {
        int[] positions = new int[values.length];
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                positions[count++] = i;
            }
        }
        return Arrays.copyOf(positions, count);
    }

    private static double[] scatter(double[] compacted, int[] positions, int length) {
        double[] result = new double[length];
        Arrays.fill(result, Double.NaN);
        for (int i = 0; i < positions.length; i++) {
            result[positions[i]] = compacted[i];
        }
        return result;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public int getGapLimit() {
        return gapLimit;
    }

    public double getMaxMissingFraction() {
        return maxMissingFraction;
    }

    public static class Builder {
        private int seasonalPeriod = DEFAULT_SEASONAL_PERIOD;
        private int gapLimit = DEFAULT_GAP_LIMIT;
        private double maxMissingFraction = DEFAULT_MAX_MISSING_FRACTION;

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        public Builder gapLimit(int gapLimit) {
            this.gapLimit = gapLimit;
            return this;
        }

        public Builder maxMissingFraction(double maxMissingFraction) {
            this.maxMissingFraction = maxMissingFraction;
            return this;
        }

        public Decomposer build() {
            return new Decomposer(this);
        }
    }
}
