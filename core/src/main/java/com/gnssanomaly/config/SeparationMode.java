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

package com.gnssanomaly.config;

import com.gnssanomaly.tree.BoundingBox;

/**
 * Determines how the dimension of a cut is chosen when a tree node is split.
 */
public enum SeparationMode {

    /**
     * Every dimension with a positive range is equally likely. This is the
     * classic isolation forest.
     */
    UNIFORM,

    /**
     * A dimension is chosen with probability proportional to its range, as in a
     * random cut forest. Wide dimensions are cut more often.
     */
    RANGE_WEIGHTED;

    /**
     * Returns the unnormalized probability of cutting in each dimension of the
     * box. Dimensions with zero range always receive weight 0.
     *
     * @param box the bounding box of the points at a node
     * @return an array of non-negative weights, one per dimension
     */
    public double[] weights(BoundingBox box) {
        double[] answer = new double[box.getDimensions()];
        for (int i = 0; i < answer.length; i++) {
            double range = box.getRange(i);
            if (range > 0) {
                answer[i] = (this == UNIFORM) ? 1.0 : range;
            }
        }
        return answer;
    }
}
