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

import static com.gnssanomaly.CommonUtils.checkNotNull;
import static com.gnssanomaly.CommonUtils.checkState;

import java.util.Arrays;
import java.util.Optional;

/**
 * The outcome of scoring one station: either a fitted model with one label per
 * matrix row, or the reason the station was skipped.
 */
public class StationScoringResult {

    private final String station;
    private final StationModel model;
    private final AnomalyLabel[] labels;
    private final SkipReason skipReason;

    private StationScoringResult(String station, StationModel model, AnomalyLabel[] labels, SkipReason skipReason) {
        this.station = checkNotNull(station, "station must not be null");
        this.model = model;
        this.labels = labels;
        this.skipReason = skipReason;
    }

    public static StationScoringResult scored(StationModel model, AnomalyLabel[] labels) {
        checkNotNull(model, "model must not be null");
        checkNotNull(labels, "labels must not be null");
        return new StationScoringResult(model.getStation(), model, Arrays.copyOf(labels, labels.length), null);
    }

    public static StationScoringResult skipped(String station, SkipReason reason) {
        return new StationScoringResult(station, null, null, checkNotNull(reason, "reason must not be null"));
    }

    public String getStation() {
        return station;
    }

    public boolean isScored() {
        return model != null;
    }

    public Optional<StationModel> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<SkipReason> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    /**
     * @return one label per matrix row
     * @throws IllegalStateException if the station was skipped
     */
    public AnomalyLabel[] getLabels() {
        checkState(isScored(), "station " + station + " was not scored");
        return Arrays.copyOf(labels, labels.length);
    }

    public int getAnomalyCount() {
        if (!isScored()) {
            return 0;
        }
        int count = 0;
        for (AnomalyLabel label : labels) {
            count += label.isAnomalous() ? 1 : 0;
        }
        return count;
    }
}
