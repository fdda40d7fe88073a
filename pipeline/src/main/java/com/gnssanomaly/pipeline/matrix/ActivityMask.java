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

package com.gnssanomaly.pipeline.matrix;

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.Arrays;

import com.gnssanomaly.pipeline.model.Axis;

/**
 * Marks the days on which a station was active: the sum of the absolute
 * millimetre residuals of its three axes exceeds a small epsilon. Missing
 * values count as zero, so days outside a station's record are inactive.
 */
public class ActivityMask {

    public static final double DEFAULT_EPSILON = 1e-4;

    private final boolean[] active;
    private final int activeCount;

    ActivityMask(boolean[] active) {
        this.active = active;
        int count = 0;
        for (boolean value : active) {
            count += value ? 1 : 0;
        }
        this.activeCount = count;
    }

    /**
     * @param matrix  a normalized matrix with millimetre displacement columns
     * @param station the station
     * @param epsilon the activity threshold in millimetres
     * @return the activity of every row of the matrix
     */
    public static ActivityMask of(CombinedMatrix matrix, String station, double epsilon) {
        checkArgument(epsilon >= 0, "epsilon must be non-negative");
        boolean[] active = new boolean[matrix.getRowCount()];
        double[] magnitude = new double[matrix.getRowCount()];
        for (Axis axis : Axis.values()) {
            double[] values = Normalizer.zeroFilled(matrix.getColumn(axis.column(station)));
            for (int i = 0; i < values.length; i++) {
                magnitude[i] += Math.abs(values[i]);
            }
        }
        for (int i = 0; i < active.length; i++) {
            active[i] = magnitude[i] > epsilon;
        }
        return new ActivityMask(active);
    }

    public boolean isActive(int row) {
        return active[row];
    }

    public int getActiveCount() {
        return activeCount;
    }

    public int size() {
        return active.length;
    }

    /**
     * @return the indices of the active rows, increasing
     */
    public int[] getActiveRows() {
        int[] rows = new int[activeCount];
        int next = 0;
        for (int i = 0; i < active.length; i++) {
            if (active[i]) {
                rows[next++] = i;
            }
        }
        return rows;
    }

    public boolean[] toArray() {
        return Arrays.copyOf(active, active.length);
    }
}
