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

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.Random;

import com.gnssanomaly.config.SeparationMode;

/**
 * A Cut splits space into two half-spaces along one dimension. Internal nodes
 * of an {@link IsolationTree} each hold one cut.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * Chooses a random cut that separates the points of a box. The dimension is
     * picked according to the separation mode and the value uniformly inside the
     * range of that dimension. The value is strictly below the maximum, so both
     * sides of the cut receive at least one point of the box.
     *
     * @param box  a box with a positive range sum
     * @param mode how dimensions are weighted
     * @param rng  the random source of the node being split
     * @return a cut that separates the box
     */
    public static Cut randomCut(BoundingBox box, SeparationMode mode, Random rng) {
        double dimf = rng.nextDouble();
        double cutf = rng.nextDouble();
        double[] weights = mode.weights(box);
        double weightSum = 0;
        for (double weight : weights) {
            weightSum += weight;
        }
        checkArgument(weightSum > 0, "box has no extent to cut");

        double breakPoint = dimf * weightSum;
        int td = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) {
                td = i;
                if (breakPoint < weights[i]) {
                    break;
                }
                breakPoint -= weights[i];
            }
        }

        double cutValue = box.getMinValue(td) + box.getRange(td) * cutf;
        if (cutValue >= box.getMaxValue(td)) {
            cutValue = box.getMinValue(td);
        }
        return new Cut(td, cutValue);
    }

    /**
     * Returns true if the point's coordinate in the cut dimension is less than or
     * equal to the cut value, that is, the point lies to the left of the cut.
     *
     * @param point A point that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the point falls on the left side of the cut
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] <= cut.getValue();
    }

    public int getDimension() {
        return dimension;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
