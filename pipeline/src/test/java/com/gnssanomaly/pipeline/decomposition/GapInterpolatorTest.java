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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class GapInterpolatorTest {

    private static final double NaN = Double.NaN;

    @Test
    public void testShortInteriorGapIsInterpolated() {
        double[] filled = GapInterpolator.fill(new double[] { 1.0, NaN, NaN, 4.0, NaN, 6.0 }, 5);
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0 }, filled, 1e-12);
    }

    @Test
    public void testLongGapStaysMissing() {
        double[] calendar = new double[] { 0.0, NaN, NaN, NaN, NaN, NaN, NaN, 7.0, NaN, 9.0 };
        double[] filled = GapInterpolator.fill(calendar, 5);

        for (int i = 1; i <= 6; i++) {
            assertTrue(Double.isNaN(filled[i]));
        }
        assertEquals(8.0, filled[8], 1e-12);
        assertTrue(Double.isNaN(calendar[8]));
    }

    @Test
    public void testEdgesAreNotExtrapolated() {
        double[] filled = GapInterpolator.fill(new double[] { NaN, 1.0, NaN, 3.0, NaN }, 5);
        assertTrue(Double.isNaN(filled[0]));
        assertEquals(2.0, filled[2], 1e-12);
        assertTrue(Double.isNaN(filled[4]));
    }

    @Test
    public void testZeroLimitFillsNothing() {
        double[] filled = GapInterpolator.fill(new double[] { 1.0, NaN, 3.0 }, 0);
        assertTrue(Double.isNaN(filled[1]));
        assertThrows(IllegalArgumentException.class, () -> GapInterpolator.fill(new double[0], -1));
    }

    @Test
    public void testMissingFraction() {
        assertEquals(0.5, GapInterpolator.missingFraction(new double[] { 1.0, NaN, NaN, 2.0 }));
        assertEquals(0.0, GapInterpolator.missingFraction(new double[] { 1.0 }));
        assertEquals(1.0, GapInterpolator.missingFraction(new double[0]));
    }
}
