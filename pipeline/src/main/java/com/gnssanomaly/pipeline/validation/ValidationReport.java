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

package com.gnssanomaly.pipeline.validation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The reconciliation of every scored station, and totals over all of them.
 */
public class ValidationReport {

    private final SortedMap<String, StationReconciliation> stations;

    public ValidationReport(Map<String, StationReconciliation> stations) {
        this.stations = Collections.unmodifiableSortedMap(new TreeMap<>(stations));
    }

    public SortedMap<String, StationReconciliation> getStations() {
        return stations;
    }

    public Map<Agreement, Integer> getTotals() {
        Map<Agreement, Integer> totals = new EnumMap<>(Agreement.class);
        for (Agreement agreement : Agreement.values()) {
            totals.put(agreement, stations.values().stream().mapToInt(s -> s.getCount(agreement)).sum());
        }
        return totals;
    }

    /**
     * @return the Jaccard similarity over the days of all stations
     */
    public double getJaccard() {
        Map<Agreement, Integer> totals = getTotals();
        int both = totals.get(Agreement.BOTH_ANOMALOUS);
        return RobustValidator.jaccard(both,
                both + totals.get(Agreement.MODEL_ONLY) + totals.get(Agreement.STATISTIC_ONLY));
    }
}
