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

package com.gnssanomaly.benchmark;

import lombok.Getter;
import lombok.ToString;

/**
 * One point of the sensitivity curve.
 */
@Getter
@ToString
public class SensitivityPoint {

    private final double slope;
    private final double recallPercent;
    private final double rampRecallPercent;

    public SensitivityPoint(double slope, double recallPercent, double rampRecallPercent) {
        this.slope = slope;
        this.recallPercent = recallPercent;
        this.rampRecallPercent = rampRecallPercent;
    }

    public boolean reaches(double referencePercent) {
        return rampRecallPercent >= referencePercent;
    }
}
