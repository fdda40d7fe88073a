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

package com.gnssanomaly.pipeline.model;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One daily position solution of a station: displacements in meters along the
 * east, north and up axes and their formal uncertainties.
 */
@Data
@AllArgsConstructor
public class StationRecord {
    private final LocalDate date;
    private final double east;
    private final double north;
    private final double up;
    private final double sigmaEast;
    private final double sigmaNorth;
    private final double sigmaUp;
}
