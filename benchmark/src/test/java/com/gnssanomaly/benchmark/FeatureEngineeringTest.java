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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class FeatureEngineeringTest {

    @Test
    public void testDifferences() {
        double[] signal = { 1.0, 4.0, 9.0, 16.0 };

        assertArrayEquals(new double[] { 0.0, 3.0, 5.0, 7.0 }, FeatureEngineering.difference(signal));
        assertArrayEquals(new double[] { 0.0, 3.0, 2.0, 2.0 },
                FeatureEngineering.difference(FeatureEngineering.difference(signal)));
    }

    @Test
    public void testRollingStandardDeviation() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9 };

        double[] rolling = FeatureEngineering.rollingStandardDeviation(values, 7);

        double expected = Math.sqrt(28.0 / 6.0);
        assertArrayEquals(new double[] { 0, 0, 0, expected, expected, expected, 0, 0, 0 }, rolling, 1e-12);
        assertThrows(IllegalArgumentException.class, () -> FeatureEngineering.rollingStandardDeviation(values, 4));
    }

    @Test
    public void testFeatures() {
        double[] signal = { 0, 0, 0, 10, 0, 0, 0, 0 };

        double[][] features = FeatureEngineering.features(signal);

        assertEquals(8, features.length);
        assertArrayEquals(new double[] { 10.0, 10.0, 10.0, Math.sqrt(100.0 / 7.0) }, features[3], 1e-12);
        assertArrayEquals(new double[] { 0.0, -10.0, -20.0, Math.sqrt(100.0 / 7.0) }, features[4], 1e-12);
        assertArrayEquals(new double[] { 0.0, 0.0, 10.0, 0.0 }, features[5], 1e-12);
    }
}
