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

package com.gnssanomaly.pipeline.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Getter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gnssanomaly.pipeline.PipelineResult;
import com.gnssanomaly.pipeline.decomposition.DegradationReason;
import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.scoring.SkipReason;
import com.gnssanomaly.pipeline.validation.Agreement;
import com.gnssanomaly.pipeline.validation.StationReconciliation;
import com.gnssanomaly.pipeline.validation.ValidationReport;

/**
 * The summary of a detection run as written to the JSON report.
 */
@Getter
@JsonPropertyOrder({ "firstDate", "lastDate", "days", "stations", "totalAnomalies", "anomalies", "skipped", "failed",
        "degradedAxes", "totals", "jaccard", "reconciliation" })
public class DetectionReport {

    private final String firstDate;
    private final String lastDate;
    private final int days;
    private final int stations;
    private final int totalAnomalies;
    private final SortedMap<String, Integer> anomalies;
    private final SortedMap<String, SkipReason> skipped;
    private final SortedMap<String, String> failed;
    private final SortedMap<String, Map<Axis, DegradationReason>> degradedAxes;
    private final Map<Agreement, Integer> totals;
    private final double jaccard;
    private final List<StationReconciliation> reconciliation;

    public DetectionReport(PipelineResult result) {
        CombinedMatrix matrix = result.getNormalized();
        days = matrix.getRowCount();
        firstDate = days > 0 ? matrix.getDates().get(0).toString() : null;
        lastDate = days > 0 ? matrix.getDates().get(days - 1).toString() : null;
        stations = result.getScoring().getResults().size();
        totalAnomalies = result.getScoring().getTotalAnomalies();
        anomalies = new TreeMap<>();
        result.getScoring().getModels().keySet().forEach(station -> anomalies.put(station,
                result.getScoring().getResults().get(station).getAnomalyCount()));
        skipped = result.getScoring().getSkipped();
        failed = result.getFailedStations();
        degradedAxes = result.getDegradedAxes();
        ValidationReport validation = result.getValidation();
        totals = validation.getTotals();
        jaccard = validation.getJaccard();
        reconciliation = new ArrayList<>(validation.getStations().values());
    }
}
