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

package com.gnssanomaly.pipeline.decomposition;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.gnssanomaly.pipeline.model.Axis;

/**
 * The decomposition of every axis of one station, on the station calendar that
 * starts at {@link #getFirstDate()}. The raw uncertainty columns are carried
 * along unchanged.
 */
public class DecomposedSeries {

    private final String station;
    private final LocalDate firstDate;
    private final Map<Axis, DecompositionResult> results;
    private final Map<Axis, double[]> sigmas;

    public DecomposedSeries(String station, LocalDate firstDate, Map<Axis, DecompositionResult> results,
            Map<Axis, double[]> sigmas) {
        this.station = checkNotNull(station, "station must not be null");
        this.firstDate = checkNotNull(firstDate, "firstDate must not be null");
        checkArgument(results.keySet().containsAll(Arrays.asList(Axis.values())), "every axis must be decomposed");
        checkArgument(sigmas.keySet().containsAll(Arrays.asList(Axis.values())), "every axis needs a sigma column");
        int length = results.get(Axis.EAST).length();
        for (Axis axis : Axis.values()) {
            checkArgument(results.get(axis).length() == length && sigmas.get(axis).length == length,
                    "all columns of station " + station + " must cover the same calendar");
        }
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
        this.sigmas = Collections.unmodifiableMap(new EnumMap<>(sigmas));
    }

    public String getStation() {
        return station;
    }

    public LocalDate getFirstDate() {
        return firstDate;
    }

    public int getCalendarLength() {
        return results.get(Axis.EAST).length();
    }

    public DecompositionResult getResult(Axis axis) {
        return results.get(axis);
    }

    public double[] getResidual(Axis axis) {
        return results.get(axis).getResidual();
    }

    public double[] getSigma(Axis axis) {
        double[] sigma = sigmas.get(axis);
        return Arrays.copyOf(sigma, sigma.length);
    }

    /**
     * @return the axes that fell back to linear detrending, with their reasons
     */
    public Map<Axis, DegradationReason> getDegradedAxes() {
        Map<Axis, DegradationReason> degraded = new EnumMap<>(Axis.class);
        results.forEach((axis, result) -> result.getReason().ifPresent(reason -> degraded.put(axis, reason)));
        return degraded;
    }
}
