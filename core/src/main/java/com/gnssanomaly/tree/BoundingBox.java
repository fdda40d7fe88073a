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

import java.util.Arrays;
import java.util.List;

/**
 * An axis-aligned box, the smallest one containing a set of points. Trees use
 * the box of the points at a node to choose where a cut can separate them.
 */
public class BoundingBox {

    private final double[] minValues;
    private final double[] maxValues;
    private double rangeSum;

    public BoundingBox(double[] point) {
        checkArgument(point != null && point.length > 0, "point must not be empty");
        minValues = Arrays.copyOf(point, point.length);
        maxValues = Arrays.copyOf(point, point.length);
        rangeSum = 0;
    }

    /**
     * Builds the box of a subset of rows.
     *
     * @param data    the rows of the full data set
     * @param indices the indices of the rows contained in the box, not empty
     * @return the bounding box
     */
    public static BoundingBox of(double[][] data, List<Integer> indices) {
        checkArgument(!indices.isEmpty(), "cannot build a box of no points");
        BoundingBox box = new BoundingBox(data[indices.get(0)]);
        for (int i = 1; i < indices.size(); i++) {
            box.addPoint(data[indices.get(i)]);
        }
        return box;
    }

    /**
     * Extends the box, in place, so that it contains the point.
     *
     * @param point a point of the same dimension
     */
    public void addPoint(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect dimensions");
        for (int i = 0; i < point.length; i++) {
            minValues[i] = Math.min(minValues[i], point[i]);
            maxValues[i] = Math.max(maxValues[i], point[i]);
        }
        double sum = 0;
        for (int i = 0; i < point.length; i++) {
            sum += maxValues[i] - minValues[i];
        }
        rangeSum = sum;
    }

    public int getDimensions() {
        return minValues.length;
    }

    public double getMinValue(int dimension) {
        return minValues[dimension];
    }

    public double getMaxValue(int dimension) {
        return maxValues[dimension];
    }

    public double getRange(int dimension) {
        return maxValues[dimension] - minValues[dimension];
    }

    public double getRangeSum() {
        return rangeSum;
    }
}
