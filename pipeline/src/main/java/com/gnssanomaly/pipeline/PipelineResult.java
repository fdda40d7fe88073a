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

package com.gnssanomaly.pipeline;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Getter;

import com.gnssanomaly.pipeline.decomposition.DegradationReason;
import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.matrix.SynchronizationResult;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.scoring.ScoringReport;
import com.gnssanomaly.pipeline.validation.ValidationReport;

/**
 * Everything one detection run produced.
 */
@Getter
public class PipelineResult {

    private final SynchronizationResult synchronization;
    private final CombinedMatrix normalized;
    private final ScoringReport scoring;
    private final ValidationReport validation;

    public PipelineResult(SynchronizationResult synchronization, CombinedMatrix normalized, ScoringReport scoring,
            ValidationReport validation) {
        this.synchronization = synchronization;
        this.normalized = normalized;
        this.scoring = scoring;
        this.validation = validation;
    }

    /**
     * @return the stations with at least one degraded axis, and the reason of
     *         every such axis
     */
    public SortedMap<String, Map<Axis, DegradationReason>> getDegradedAxes() {
        SortedMap<String, Map<Axis, DegradationReason>> degraded = new TreeMap<>();
        synchronization.getDecomposed().forEach((station, series) -> {
            Map<Axis, DegradationReason> axes = series.getDegradedAxes();
            if (!axes.isEmpty()) {
                degraded.put(station, axes);
            }
        });
        return degraded;
    }

    /**
     * @return stations that could not be decomposed, with their error message
     */
    public SortedMap<String, String> getFailedStations() {
        return synchronization.getFailures();
    }
}
