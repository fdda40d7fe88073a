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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import lombok.Getter;
import lombok.ToString;

/**
 * Where a fault was injected and which days it marks as anomalous.
 */
@Getter
@ToString
public class InjectedFault {

    private final FaultType type;
    private final int onset;
    private final int length;
    private final double severity;

    /**
     * @param type     the archetype
     * @param onset    the first affected day
     * @param length   the number of days marked anomalous from the onset
     * @param severity the step offset, the ramp slope per day or the standard
     *                 deviation of the extra noise, in millimetres
     */
    public InjectedFault(FaultType type, int onset, int length, double severity) {
        this.type = checkNotNull(type, "type must not be null");
        checkArgument(onset >= 0, "onset must be non-negative");
        checkArgument(length > 0, "length must be greater than 0");
        this.onset = onset;
        this.length = length;
        this.severity = severity;
    }

    public boolean covers(int day) {
        return day >= onset && day < onset + length;
    }
}
