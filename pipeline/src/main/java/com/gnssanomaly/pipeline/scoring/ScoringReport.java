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

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The results of one scoring run, by station name. The station to model map of
 * a run lives here and nowhere else.
 */
public class ScoringReport {

    private final SortedMap<String, StationScoringResult> results;

    public ScoringReport(Map<String, StationScoringResult> results) {
        this.results = Collections.unmodifiableSortedMap(new TreeMap<>(results));
    }

    public SortedMap<String, StationScoringResult> getResults() {
        return results;
    }

    public Optional<StationScoringResult> getResult(String station) {
        return Optional.ofNullable(results.get(station));
    }

    public SortedMap<String, StationModel> getModels() {
        SortedMap<String, StationModel> models = new TreeMap<>();
        results.forEach((station, result) -> result.getModel().ifPresent(model -> models.put(station, model)));
        return models;
    }

    public SortedMap<String, SkipReason> getSkipped() {
        SortedMap<String, SkipReason> skipped = new TreeMap<>();
        results.forEach((station, result) -> result.getSkipReason().ifPresent(reason -> skipped.put(station, reason)));
        return skipped;
    }

    public int getTotalAnomalies() {
        return results.values().stream().mapToInt(StationScoringResult::getAnomalyCount).sum();
    }
}
