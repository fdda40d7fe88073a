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

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * Fills short runs of missing days by linear interpolation between the
 * observations that bound them.
 */
public class GapInterpolator {

    private GapInterpolator() {
    }

    /**
     * Interior runs of at most {@code gapLimit} missing values are filled. Longer
     * runs stay missing in full, as do missing values before the first and after
     * the last observation.
     *
     * @param calendar daily values, NaN where missing
     * @param gapLimit the longest run that is filled
     * @return a new array with short gaps filled
     */
    public static double[] fill(double[] calendar, int gapLimit) {
        checkArgument(gapLimit >= 0, "gapLimit must be non-negative");
        double[] result = Arrays.copyOf(calendar, calendar.length);
        int previous = -1;
        for (int i = 0; i < result.length; i++) {
            if (Double.isNaN(result[i])) {
                continue;
            }
            int run = i - previous - 1;
            if (previous >= 0 && run > 0 && run <= gapLimit) {
                double slope = (result[i] - result[previous]) / (i - previous);
                for (int j = previous + 1; j < i; j++) {
                    result[j] = result[previous] + slope * (j - previous);
                }
            }
            previous = i;
        }
        return result;
    }

    /**
     * @param calendar daily values
     * @return the fraction of NaN values, 1 for an empty array
     */
    public static double missingFraction(double[] calendar) {
        if (calendar.length == 0) {
            return 1.0;
        }
        return (double) countMissing(calendar) / calendar.length;
    }

    static int countMissing(double[] calendar) {
        int missing = 0;
        for (double value : calendar) {
            if (Double.isNaN(value)) {
                missing++;
            }
        }
        return missing;
    }
}
