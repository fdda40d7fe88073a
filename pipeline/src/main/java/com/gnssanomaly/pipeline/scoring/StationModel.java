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

package com.gnssanomaly.pipeline.scoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.gnssanomaly.IsolationForest;

/**
 * The forest fitted for one station, the feature columns it was trained on and
 * the matrix rows it was trained with.
 */
public class StationModel {

    @Getter
    private final String station;

    @Getter
    private final IsolationForest forest;

    @Getter
    private final List<String> featureColumns;

    private final int[] trainingRows;

    public StationModel(String station, IsolationForest forest, List<String> featureColumns, int[] trainingRows) {
        this.station = station;
        this.forest = forest;
        this.featureColumns = Collections.unmodifiableList(new ArrayList<>(featureColumns));
        this.trainingRows = Arrays.copyOf(trainingRows, trainingRows.length);
    }

    public int[] getTrainingRows() {
        return Arrays.copyOf(trainingRows, trainingRows.length);
    }
}
