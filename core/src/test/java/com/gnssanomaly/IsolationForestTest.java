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

package com.gnssanomaly;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gnssanomaly.config.SeparationMode;

public class IsolationForestTest {

    private double[][] data;

    @BeforeEach
    public void setUp() {
        Random random = new Random(2024);
        data = new double[500][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[] { random.nextGaussian(), random.nextGaussian(), random.nextGaussian() };
        }
        data[123] = new double[] { 9.0, -9.0, 9.0 };
    }

    @Test
    public void testDefaults() {
        IsolationForest forest = IsolationForest.builder().dimensions(3).build();

        assertEquals(3, forest.getDimensions());
        assertEquals(IsolationForest.DEFAULT_NUMBER_OF_TREES, forest.getNumberOfTrees());
        assertEquals(IsolationForest.DEFAULT_SAMPLE_SIZE, forest.getSampleSize());
        assertEquals(IsolationForest.DEFAULT_CONTAMINATION, forest.getContamination());
        assertEquals(SeparationMode.UNIFORM, forest.getSeparationMode());
        assertFalse(forest.isParallelExecutionEnabled());
        assertEquals(0, forest.getThreadPoolSize());
        assertFalse(forest.isFitted());
        assertTrue(Double.isNaN(forest.getThreshold()));
        assertFalse(forest.getTrainingScores().isPresent());
    }

    @Test
    public void testIllegalArguments() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForest.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForest.builder().dimensions(2).contamination(0.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForest.builder().dimensions(2).contamination(0.6).build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForest.builder().dimensions(2).numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForest.builder().dimensions(2).parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testOutlierIsLabeledAnomalous() {
        IsolationForest forest = IsolationForest.builder().dimensions(3).numberOfTrees(100).contamination(0.01)
                .randomSeed(42L).build();

        boolean[] labels = forest.fitPredict(data);

        assertTrue(forest.isFitted());
        assertTrue(labels[123]);
        double[] scores = forest.getTrainingScores().get();
        for (int i = 0; i < scores.length; i++) {
            assertThat(scores[i], lessThanOrEqualTo(1.0));
            assertEquals(scores[i] > forest.getThreshold(), labels[i]);
            if (i != 123) {
                assertThat(scores[123], greaterThan(scores[i]));
            }
        }

        int flagged = 0;
        for (boolean label : labels) {
            flagged += label ? 1 : 0;
        }
        assertThat(flagged, lessThanOrEqualTo(6));
        assertTrue(forest.isAnomaly(new double[] { -12.0, 12.0, -12.0 }));
        assertFalse(forest.isAnomaly(new double[] { 0.0, 0.0, 0.0 }));
    }

    @Test
    public void testSameSeedSameScores() {
        IsolationForest first = IsolationForest.builder().dimensions(3).numberOfTrees(50).randomSeed(7L).build();
        IsolationForest second = IsolationForest.builder().dimensions(3).numberOfTrees(50).randomSeed(7L).build();
        IsolationForest parallel = IsolationForest.builder().dimensions(3).numberOfTrees(50).randomSeed(7L)
                .parallelExecutionEnabled(true).threadPoolSize(2).build();

        first.fit(data);
        second.fit(data);
        parallel.fit(data);

        assertArrayEquals(first.getTrainingScores().get(), second.getTrainingScores().get(), 0.0);
        assertArrayEquals(first.getTrainingScores().get(), parallel.getTrainingScores().get(), 1e-12);
        assertEquals(2, parallel.getThreadPoolSize());
    }

    @Test
    public void testConstantDataHasNoAnomalies() {
        double[][] constant = new double[300][];
        for (int i = 0; i < constant.length; i++) {
            constant[i] = new double[] { 0.0, 0.0 };
        }
        IsolationForest forest = IsolationForest.builder().dimensions(2).randomSeed(42L).build();

        boolean[] labels = forest.fitPredict(constant);

        for (boolean label : labels) {
            assertFalse(label);
        }
        assertEquals(0.5, forest.getThreshold(), 1e-12);
    }

    @Test
    public void testSmallDataUsesWholeSample() {
        double[][] small = new double[][] { { 0.0 }, { 1.0 }, { 2.0 }, { 3.0 }, { 50.0 } };
        IsolationForest forest = IsolationForest.builder().dimensions(1).numberOfTrees(20).randomSeed(1L)
                .contamination(0.2).build();

        boolean[] labels = forest.fitPredict(small);

        assertEquals(5, forest.getEffectiveSampleSize());
        assertEquals(5, labels.length);
        assertArrayEquals(labels, forest.predict(small));
    }

    @Test
    public void testInvalidUse() {
        IsolationForest forest = IsolationForest.builder().dimensions(3).numberOfTrees(10).randomSeed(3L).build();
        assertThrows(IllegalStateException.class, () -> forest.getAnomalyScore(new double[] { 0, 0, 0 }));
        assertThrows(IllegalArgumentException.class, () -> forest.fit(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> forest.fit(new double[][] { { 1.0 } }));

        forest.fit(data);
        assertThrows(IllegalStateException.class, () -> forest.fit(data));
        assertThrows(IllegalArgumentException.class, () -> forest.getAnomalyScore(new double[] { 0.0 }));
    }
}
