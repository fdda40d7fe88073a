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

package com.gnssanomaly.tree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gnssanomaly.config.SeparationMode;

public class CutTest {

    private BoundingBox box;

    @BeforeEach
    public void setUp() {
        box = BoundingBox.of(new double[][] { { 0.0, 5.0, 1.0 }, { 4.0, 5.0, 3.0 } }, Arrays.asList(0, 1));
    }

    @Test
    public void testRandomCutSkipsDimensionsWithoutRange() {
        Random rng = mock(Random.class);
        // dimension draw lands in the second weighted dimension, which is dimension 2
        when(rng.nextDouble()).thenReturn(0.75, 0.5);

        Cut cut = Cut.randomCut(box, SeparationMode.UNIFORM, rng);

        assertEquals(2, cut.getDimension());
        assertEquals(2.0, cut.getValue(), 1e-12);
    }

    @Test
    public void testRangeWeightedCut() {
        Random rng = mock(Random.class);
        // weights are 4 and 2, the break point 0.6 * 6 = 3.6 falls in dimension 0
        when(rng.nextDouble()).thenReturn(0.6, 0.25);

        Cut cut = Cut.randomCut(box, SeparationMode.RANGE_WEIGHTED, rng);

        assertEquals(0, cut.getDimension());
        assertEquals(1.0, cut.getValue(), 1e-12);
    }

    @Test
    public void testCutValueStaysBelowMaximum() {
        Random random = new Random(0);
        for (int i = 0; i < 1000; i++) {
            Cut cut = Cut.randomCut(box, SeparationMode.UNIFORM, random);
            assertThat(cut.getValue(), greaterThanOrEqualTo(box.getMinValue(cut.getDimension())));
            assertThat(cut.getValue(), lessThan(box.getMaxValue(cut.getDimension())));
        }
    }

    @Test
    public void testCutOfDegenerateBox() {
        BoundingBox point = new BoundingBox(new double[] { 1.0, 1.0 });
        assertThrows(IllegalArgumentException.class,
                () -> Cut.randomCut(point, SeparationMode.UNIFORM, new Random(0)));
    }

    @Test
    public void testIsLeftOf() {
        Cut cut = new Cut(1, 2.5);
        assertTrue(Cut.isLeftOf(new double[] { 100.0, 2.5 }, cut));
        assertTrue(Cut.isLeftOf(new double[] { 100.0, -1.0 }, cut));
        assertFalse(Cut.isLeftOf(new double[] { -100.0, 2.6 }, cut));
        assertEquals("Cut(1, 2.500000)", cut.toString());
    }

    @Test
    public void testBoundingBox() {
        assertEquals(3, box.getDimensions());
        assertThat(box.getRangeSum(), closeTo(6.0, 1e-12));
        assertEquals(0.0, box.getRange(1));

        box.addPoint(new double[] { -1.0, 7.0, 2.0 });
        assertEquals(-1.0, box.getMinValue(0));
        assertEquals(7.0, box.getMaxValue(1));
        assertThat(box.getRangeSum(), closeTo(9.0, 1e-12));

        assertThrows(IllegalArgumentException.class, () -> box.addPoint(new double[] { 1.0 }));
        List<Integer> none = Arrays.asList();
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.of(new double[][] { { 1.0 } }, none));
    }
}
