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
import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;
import static com.gnssanomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.gnssanomaly.config.SeparationMode;

/**
 * A tree built once from a fixed sample of points by recursive random cuts.
 * Each node is split until it holds a single point, its points cannot be told
 * apart, or the maximum depth is reached. The nodes are stored in parallel
 * arrays indexed by node number; a leaf has no children and remembers how many
 * sample points ended there.
 *
 * The depth at which a query point lands, corrected by the expected depth of
 * the unresolved points in its leaf, is the tree's isolation depth for that
 * point. Anomalies are isolated close to the root.
 */
public class IsolationTree {

    public static final int NULL = -1;

    @Getter
    private final long randomSeed;

    @Getter
    private final int maxDepth;

    @Getter
    private final SeparationMode separationMode;

    private int[] leftIndex;
    private int[] rightIndex;
    private int[] cutDimension;
    private double[] cutValue;
    private int[] mass;
    private int nodeCount;
    private int root = NULL;

    @Getter
    private int sampleSize;

    protected IsolationTree(Builder builder) {
        checkArgument(builder.maxDepth > 0, "maxDepth must be greater than 0");
        this.randomSeed = builder.randomSeed;
        this.maxDepth = builder.maxDepth;
        this.separationMode = checkNotNull(builder.separationMode, "separationMode must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the tree over the given rows. The same rows and seed always produce
     * the same tree.
     *
     * @param data   the full data set
     * @param sample indices of the rows this tree is built from, not empty
     */
    public void makeTree(double[][] data, List<Integer> sample) {
        checkNotNull(data, "data must not be null");
        checkArgument(sample != null && !sample.isEmpty(), "sample must not be empty");
        int capacity = 2 * sample.size() - 1;
        leftIndex = new int[capacity];
        rightIndex = new int[capacity];
        cutDimension = new int[capacity];
        cutValue = new double[capacity];
        mass = new int[capacity];
        nodeCount = 0;
        sampleSize = sample.size();
        root = makeTreeInt(data, sample, randomSeed, 0);
    }

    private int makeTreeInt(double[][] data, List<Integer> pointList, long seed, int depth) {
        int node = nodeCount++;
        mass[node] = pointList.size();
        leftIndex[node] = NULL;
        rightIndex[node] = NULL;

        if (pointList.size() <= 1 || depth >= maxDepth) {
            return node;
        }
        BoundingBox box = BoundingBox.of(data, pointList);
        if (box.getRangeSum() <= 0) {
            return node;
        }

        Random ring = new Random(seed);
        long leftSeed = ring.nextLong();
        long rightSeed = ring.nextLong();
        Cut cut = Cut.randomCut(box, separationMode, ring);

        List<Integer> leftList = new ArrayList<>();
        List<Integer> rightList = new ArrayList<>();
        for (Integer index : pointList) {
            if (Cut.isLeftOf(data[index], cut)) {
                leftList.add(index);
            } else {
                rightList.add(index);
            }
        }

        cutDimension[node] = cut.getDimension();
        cutValue[node] = cut.getValue();
        leftIndex[node] = makeTreeInt(data, leftList, leftSeed, depth + 1);
        rightIndex[node] = makeTreeInt(data, rightList, rightSeed, depth + 1);
        return node;
    }

    /**
     * Follows the cuts from the root to the leaf the point falls into.
     *
     * @param point the query point
     * @return the depth of the leaf plus the average path length of the sample
     *         points left unresolved in that leaf
     */
    public double pathLength(double[] point) {
        checkState(isBuilt(), "tree has not been built");
        int node = root;
        int depth = 0;
        while (leftIndex[node] != NULL) {
            node = (point[cutDimension[node]] <= cutValue[node]) ? leftIndex[node] : rightIndex[node];
            depth++;
        }
        return depth + averagePathLength(mass[node]);
    }

    public boolean isBuilt() {
        return root != NULL;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    /**
     * @return the number of leaves, or 0 before the tree is built
     */
    public int getLeafCount() {
        int count = 0;
        for (int i = 0; i < nodeCount; i++) {
            if (leftIndex[i] == NULL) {
                count++;
            }
        }
        return count;
    }

    public static class Builder {
        private long randomSeed;
        private int maxDepth = 8;
        private SeparationMode separationMode = SeparationMode.UNIFORM;

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder separationMode(SeparationMode separationMode) {
            this.separationMode = separationMode;
            return this;
        }

        public IsolationTree build() {
            return new IsolationTree(this);
        }
    }
}
