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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import com.gnssanomaly.pipeline.model.Axis;

/**
 * Converts residual displacements to millimetres and adds a standardized copy
 * of every displacement column.
 * <p>
 * Standardized columns are computed over all rows with missing values taken as
 * zero, so idle days pull the mean towards zero and shrink the spread. Anomaly
 * scoring only looks at active days, but its features inherit this scaling.
 */
public class Normalizer {

    public static final double MILLIMETRES_PER_METRE = 1000.0;

    private Normalizer() {
    }

    /**
     * @param raw a matrix of residuals in meters and raw uncertainties
     * @return the displacement columns in millimetres with NaN kept, the
     *         uncertainty columns unchanged, followed by one {@code _norm} column
     *         per displacement column
     */
    public static CombinedMatrix normalize(CombinedMatrix raw) {
        Map<String, double[]> physical = new LinkedHashMap<>();
        Map<String, double[]> normalized = new LinkedHashMap<>();
        List<String> names = raw.getColumnNames();
        for (String name : names) {
            double[] values = raw.getColumn(name);
            if (isSigmaColumn(name)) {
                physical.put(name, values);
                continue;
            }
            for (int i = 0; i < values.length; i++) {
                values[i] *= MILLIMETRES_PER_METRE;
            }
            physical.put(name, values);
            normalized.put(name + CombinedMatrix.NORMALIZED_SUFFIX, standardize(zeroFilled(values)));
        }
        Map<String, double[]> columns = new LinkedHashMap<>(physical);
        columns.putAll(normalized);
        return new CombinedMatrix(raw.getDates(), columns);
    }

    /**
     * Population z-score. A column without spread is only centred.
     *
     * @param values values without NaN
     * @return {@code (x - mean) / std}, with a standard deviation of 0 treated as
     *         1
     */
    public static double[] standardize(double[] values) {
        if (values.length == 0) {
            return new double[0];
        }
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values, mean);
        if (std == 0 || Double.isNaN(std)) {
            std = 1.0;
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / std;
        }
        return result;
    }

    public static double[] zeroFilled(double[] values) {
        double[] result = Arrays.copyOf(values, values.length);
        for (int i = 0; i < result.length; i++) {
            if (Double.isNaN(result[i])) {
                result[i] = 0;
            }
        }
        return result;
    }

    public static boolean isSigmaColumn(String name) {
        for (Axis axis : Axis.values()) {
            if (name.endsWith("_" + axis.getSigmaSuffix())) {
                return true;
            }
        }
        return false;
    }
}
