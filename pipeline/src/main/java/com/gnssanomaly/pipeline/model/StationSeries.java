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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * The time series of one station: records with strictly increasing dates. Days
 * without a record are gaps. The station calendar runs daily from the first to
 * the last record.
 */
public class StationSeries {

    private final String station;
    private final List<StationRecord> records;

    public StationSeries(String station, List<StationRecord> records) {
        checkArgument(station != null && !station.isEmpty(), "station name must not be empty");
        checkNotNull(records, "records must not be null");
        checkArgument(!records.isEmpty(), "station " + station + " has no records");
        for (int i = 1; i < records.size(); i++) {
            checkArgument(records.get(i).getDate().isAfter(records.get(i - 1).getDate()),
                    "dates of station " + station + " must be strictly increasing at " + records.get(i).getDate());
        }
        this.station = station;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public String getStation() {
        return station;
    }

    public List<StationRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public LocalDate getFirstDate() {
        return records.get(0).getDate();
    }

    public LocalDate getLastDate() {
        return records.get(records.size() - 1).getDate();
    }

    /**
     * @return the number of days from the first to the last record, inclusive
     */
    public int getCalendarLength() {
        return (int) ChronoUnit.DAYS.between(getFirstDate(), getLastDate()) + 1;
    }

    /**
     * Places one value of every record on the station calendar.
     *
     * @param field extracts the value from a record
     * @return an array of {@link #getCalendarLength()} values, NaN on days without
     *         a record
     */
    public double[] toCalendar(ToDoubleFunction<StationRecord> field) {
        double[] result = new double[getCalendarLength()];
        Arrays.fill(result, Double.NaN);
        LocalDate first = getFirstDate();
        for (StationRecord record : records) {
            result[(int) ChronoUnit.DAYS.between(first, record.getDate())] = field.applyAsDouble(record);
        }
        return result;
    }
}
