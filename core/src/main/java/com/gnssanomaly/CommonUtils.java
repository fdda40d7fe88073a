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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    public static final double EULER_GAMMA = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree of
     * {@code n} points. This is the normalizer of isolation depths: a leaf holding
     * {@code n} points that could not be separated further contributes this much
     * additional depth, and the expected depth over a sample of size {@code n} is
     * divided by it to produce a score in [0, 1].
     *
     * @param n the number of points
     * @return the average path length, 0 for {@code n <= 1}
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n <= 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    /**
     * Converts a mean isolation depth into the isolation score
     * {@code 2^(-depth / c(sampleSize))}. Scores close to 1 indicate points that
     * are isolated after very few cuts; scores well below 0.5 indicate points deep
     * inside the bulk of the data.
     *
     * @param meanDepth  the mean depth over all trees
     * @param sampleSize the number of points each tree was built from
     * @return the isolation score
     */
    public static double isolationScore(double meanDepth, int sampleSize) {
        double normalizer = averagePathLength(sampleSize);
        if (normalizer <= 0) {
            return 0.5;
        }
        return Math.pow(2.0, -meanDepth / normalizer);
    }
}
