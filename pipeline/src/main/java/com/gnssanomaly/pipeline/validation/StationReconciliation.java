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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gnssanomaly.pipeline.model.Axis;

/**
 * The day-by-day comparison of the anomaly model with the robust statistic for
 * one station, and its summary counts.
 */
@JsonPropertyOrder({ "station", "days", "modelAnomalies", "statisticAnomalies", "counts", "jaccard" })
public class StationReconciliation {

    private final String station;
    private final Agreement[] agreements;
    private final Map<Axis, double[]> scores;
    private final Map<Agreement, Integer> counts;

    public StationReconciliation(String station, Agreement[] agreements, Map<Axis, double[]> scores) {
        this.station = station;
        this.agreements = Arrays.copyOf(agreements, agreements.length);
        this.scores = Collections.unmodifiableMap(new EnumMap<>(scores));
        Map<Agreement, Integer> tally = new EnumMap<>(Agreement.class);
        for (Agreement agreement : Agreement.values()) {
            tally.put(agreement, 0);
        }
        for (Agreement agreement : agreements) {
            tally.merge(agreement, 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(tally);
    }

    public String getStation() {
        return station;
    }

    public int getDays() {
        return agreements.length;
    }

    @JsonIgnore
    public Agreement[] getAgreements() {
        return Arrays.copyOf(agreements, agreements.length);
    }

    /**
     * @return the modified z-scores of every audited axis, one per day
     */
    @JsonIgnore
    public Map<Axis, double[]> getScores() {
        return scores;
    }

    public Map<Agreement, Integer> getCounts() {
        return counts;
    }

    public int getCount(Agreement agreement) {
        return counts.get(agreement);
    }

    public int getModelAnomalies() {
        return getCount(Agreement.BOTH_ANOMALOUS) + getCount(Agreement.MODEL_ONLY);
    }

    public int getStatisticAnomalies() {
        return getCount(Agreement.BOTH_ANOMALOUS) + getCount(Agreement.STATISTIC_ONLY);
    }

    /**
     * @return the Jaccard similarity of the two sets of anomalous days, 0 when
     *         neither method flagged a day
     */
    public double getJaccard() {
        return RobustValidator.jaccard(getCount(Agreement.BOTH_ANOMALOUS),
                getCount(Agreement.BOTH_ANOMALOUS) + getCount(Agreement.MODEL_ONLY)
                        + getCount(Agreement.STATISTIC_ONLY));
    }
}
