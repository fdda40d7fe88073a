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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gnssanomaly.pipeline.StationSeriesFixtures;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.model.StationSeries;
import com.gnssanomaly.testutils.DisplacementTestData;

public class DecomposerTest {

    private Decomposer decomposer;

    @BeforeEach
    public void setUp() {
        decomposer = Decomposer.builder().build();
    }

    @Test
    public void testDefaults() {
        assertEquals(Decomposer.DEFAULT_SEASONAL_PERIOD, decomposer.getSeasonalPeriod());
        assertEquals(Decomposer.DEFAULT_GAP_LIMIT, decomposer.getGapLimit());
        assertEquals(Decomposer.DEFAULT_MAX_MISSING_FRACTION, decomposer.getMaxMissingFraction());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> Decomposer.builder().seasonalPeriod(2).build());
        assertThrows(IllegalArgumentException.class, () -> Decomposer.builder().gapLimit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Decomposer.builder().maxMissingFraction(1.5).build());
    }

    @Test
    public void testFourYearsAreFullyDecomposed() {
        StationSeries series = StationSeriesFixtures.seasonal("ALPH", 1461, 7L);

        DecomposedSeries decomposed = decomposer.decompose(series);

        assertEquals(1461, decomposed.getCalendarLength());
        assertTrue(decomposed.getDegradedAxes().isEmpty());
        for (Axis axis : Axis.values()) {
            DecompositionResult result = decomposed.getResult(axis);
            assertFalse(result.isDegraded());
            assertEquals(Optional.empty(), result.getReason());
            double[] residual = decomposed.getResidual(axis);
            double sum = 0;
            for (double value : residual) {
                assertTrue(Double.isFinite(value));
                assertTrue(Math.abs(value) < 0.006);
                sum += value;
            }
            assertEquals(0.0, sum / residual.length, 5e-4);
        }
    }

    @Test
    public void testShortHistoryFallsBackToLinearDetrending() {
        StationSeries series = StationSeriesFixtures.seasonal("BETA", 400, 11L);

        DecomposedSeries decomposed = decomposer.decompose(series);

        assertEquals(3, decomposed.getDegradedAxes().size());
        DecompositionResult result = decomposed.getResult(Axis.UP);
        assertTrue(result.isDegraded());
        assertEquals(Optional.of(DegradationReason.INSUFFICIENT_HISTORY), result.getReason());
        double sum = 0;
        for (double value : result.getResidual()) {
            sum += value;
        }
        assertEquals(0.0, sum, 1e-9);
    }

    @Test
    public void testTooFewSamplesProduceNoResidual() {
        DecompositionResult result = decomposer.decompose(StationSeriesFixtures.seasonal("GAMA", 8, 3L))
                .getResult(Axis.EAST);

        assertEquals(Optional.of(DegradationReason.INSUFFICIENT_SAMPLES), result.getReason());
        for (double value : result.getResidual()) {
            assertTrue(Double.isNaN(value));
        }
    }

    @Test
    public void testFragmentedCalendarFallsBack() {
        double[][] rows = new DisplacementTestData().generateTestData(4500, 5L);
        for (int t = 5; t < rows.length; t += 15) {
            DisplacementTestData.removeDays(rows, t, 10);
        }
        StationSeries series = StationSeriesFixtures.series("DELT", StationSeriesFixtures.START, rows);

        DecomposedSeries decomposed = decomposer.decompose(series);

        assertEquals(DegradationReason.FRAGMENTED_CALENDAR, decomposed.getDegradedAxes().get(Axis.NORTH));
        double[] residual = decomposed.getResidual(Axis.NORTH);
        assertTrue(Double.isFinite(residual[0]));
        assertTrue(Double.isNaN(residual[10]));
    }

    @Test
    public void testShortGapsAreFilledAndLongGapsKept() {
        double[][] rows = new DisplacementTestData().generateTestData(1461, 13L);
        DisplacementTestData.removeDays(rows, 100, 3);
        DisplacementTestData.removeDays(rows, 500, 10);
        StationSeries series = StationSeriesFixtures.series("EPSI", StationSeriesFixtures.START, rows);

        DecomposedSeries decomposed = decomposer.decompose(series);

        assertTrue(decomposed.getDegradedAxes().isEmpty());
        double[] residual = decomposed.getResidual(Axis.EAST);
        assertTrue(Double.isFinite(residual[101]));
        assertTrue(Double.isNaN(residual[505]));
        assertTrue(Double.isFinite(residual[510]));
    }

    @Test
    public void testUncertaintiesPassThrough() {
        double[][] rows = new DisplacementTestData().generateTestData(30, 17L);
        DisplacementTestData.removeDays(rows, 10, 2);
        DecomposedSeries decomposed = decomposer
                .decompose(StationSeriesFixtures.series("ZETA", StationSeriesFixtures.START, rows));

        double[] sigma = decomposed.getSigma(Axis.UP);
        assertEquals(2 * StationSeriesFixtures.SIGMA, sigma[0]);
        assertTrue(Double.isNaN(sigma[10]));
        assertEquals(StationSeriesFixtures.SIGMA, decomposed.getSigma(Axis.EAST)[29]);
    }

    @Test
    public void testSeasonalFallbackOnFailure() {
        Decomposer weekly = Decomposer.builder().seasonalPeriod(7).build();
        double[] calendar = new double[28];
        for (int t = 0; t < calendar.length; t++) {
            calendar[t] = t % 7 == 0 ? 1.0 : 0.0;
        }
        calendar[5] = Double.POSITIVE_INFINITY;

        DecompositionResult result = weekly.decompose("ETA", Axis.UP, calendar);

        assertEquals(Optional.of(DegradationReason.DECOMPOSITION_FAILED), result.getReason());
    }
}
