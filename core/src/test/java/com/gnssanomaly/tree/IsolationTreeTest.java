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

import static com.gnssanomaly.CommonUtils.averagePathLength;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gnssanomaly.config.SeparationMode;

public class IsolationTreeTest {

    private static final double EPSILON = 1e-10;

    private double[][] data;
    private List<Integer> sample;

    @BeforeEach
    public void setUp() {
        Random random = new Random(7);
        data = new double[64][];
        sample = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[] { random.nextGaussian(), random.nextGaussian() };
            sample.add(i);
        }
    }

    @Test
    public void testFullyGrownTreeIsolatesEveryPoint() {
        IsolationTree tree = IsolationTree.builder().randomSeed(3L).maxDepth(100).build();
        assertFalse(tree.isBuilt());

        tree.makeTree(data, sample);

        assertTrue(tree.isBuilt());
        assertEquals(data.length, tree.getSampleSize());
        assertEquals(data.length, tree.getLeafCount());
        assertEquals(2 * data.length - 1, tree.getNodeCount());
        for (double[] point : data) {
            // a point of the sample ends alone in its leaf
            double length = tree.pathLength(point);
            assertEquals(Math.floor(length), length, EPSILON);
        }
    }

    @Test
    public void testDepthLimitedLeavesAddAveragePathLength() {
        IsolationTree tree = IsolationTree.builder().randomSeed(3L).maxDepth(1).build();
        tree.makeTree(data, sample);

        assertEquals(3, tree.getNodeCount());
        assertEquals(2, tree.getLeafCount());
        double total = 0;
        for (double[] point : data) {
            double length = tree.pathLength(point);
            assertTrue(length >= 1.0);
            total += length;
        }
        // at least one leaf holds several points
        assertTrue(total > data.length);
    }

    @Test
    public void testIdenticalPointsFormSingleLeaf() {
        double[][] same = new double[][] { { 1.0, 2.0 }, { 1.0, 2.0 }, { 1.0, 2.0 }, { 1.0, 2.0 } };
        IsolationTree tree = IsolationTree.builder().randomSeed(5L).maxDepth(8).build();
        tree.makeTree(same, Arrays.asList(0, 1, 2, 3));

        assertEquals(1, tree.getNodeCount());
        assertEquals(averagePathLength(4), tree.pathLength(new double[] { 1.0, 2.0 }), EPSILON);
        assertEquals(averagePathLength(4), tree.pathLength(new double[] { 50.0, -50.0 }), EPSILON);
    }

    @Test
    public void testOutlierIsIsolatedEarly() {
        data[0] = new double[] { 40.0, -40.0 };
        double outlierDepth = 0;
        double inlierDepth = 0;
        for (long seed = 0; seed < 50; seed++) {
            IsolationTree tree = IsolationTree.builder().randomSeed(seed).maxDepth(6)
                    .separationMode(SeparationMode.UNIFORM).build();
            tree.makeTree(data, sample);
            outlierDepth += tree.pathLength(data[0]);
            inlierDepth += tree.pathLength(new double[] { 0.0, 0.0 });
        }
        assertThat(outlierDepth, lessThan(inlierDepth));
    }

    @Test
    public void testSameSeedBuildsSameTree() {
        IsolationTree first = IsolationTree.builder().randomSeed(99L).maxDepth(6).build();
        IsolationTree second = IsolationTree.builder().randomSeed(99L).maxDepth(6).build();
        first.makeTree(data, sample);
        second.makeTree(data, sample);

        Random random = new Random(1);
        for (int i = 0; i < 100; i++) {
            double[] point = new double[] { 3 * random.nextGaussian(), 3 * random.nextGaussian() };
            assertEquals(first.pathLength(point), second.pathLength(point), 0.0);
        }
        assertEquals(first.getNodeCount(), second.getNodeCount());
    }

    @Test
    public void testInvalidUse() {
        IsolationTree tree = IsolationTree.builder().randomSeed(1L).build();
        assertThrows(IllegalStateException.class, () -> tree.pathLength(new double[] { 0.0, 0.0 }));
        assertThrows(IllegalArgumentException.class, () -> tree.makeTree(data, new ArrayList<>()));
        assertThrows(IllegalArgumentException.class, () -> IsolationTree.builder().maxDepth(0).build());
    }
}
