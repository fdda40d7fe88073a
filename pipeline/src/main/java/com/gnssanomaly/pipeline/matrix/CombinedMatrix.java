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

package com.gnssanomaly.pipeline.matrix;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import com.gnssanomaly.pipeline.model.Axis;

/**
 * A table of all stations on one shared daily calendar. Rows are dates in
 * increasing order; columns are named and keep their insertion order. NaN
 * marks a missing value.
 * <p>
 * Column names follow {@code <station>_<axis>} for displacements,
 * {@code <station>_sigma<Axis>} for uncertainties, and carry the
 * {@link #NORMALIZED_SUFFIX} once standardized.
 */
public class CombinedMatrix {

    public static final String NORMALIZED_SUFFIX = "_norm";

    private final List<LocalDate> dates;
    private final Map<String, double[]> columns;

    public CombinedMatrix(List<LocalDate> dates, Map<String, double[]> columns) {
        checkNotNull(dates, "dates must not be null");
        checkNotNull(columns, "columns must not be null");
        for (int i = 1; i < dates.size(); i++) {
            checkArgument(dates.get(i).isAfter(dates.get(i - 1)), "dates must be strictly increasing");
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            checkArgument(values.length == dates.size(), "column " + name + " does not match the calendar");
            copy.put(name, Arrays.copyOf(values, values.length));
        });
        this.dates = Collections.unmodifiableList(new ArrayList<>(dates));
        this.columns = copy;
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public int getRowCount() {
        return dates.size();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @param name a column name
     * @return a copy of the column
     * @throws IllegalArgumentException if there is no such column
     */
    public double[] getColumn(String name) {
        double[] values = columns.get(name);
        checkArgument(values != null, "no column " + name);
        return Arrays.copyOf(values, values.length);
    }

    /**
     * Gathers selected rows of selected columns into a point array.
     *
     * @param names the columns, in the order of the point coordinates
     * @param rows  the row indices
     * @return one point per selected row
     */
    public double[][] getRows(List<String> names, int[] rows) {
        double[][] result = new double[rows.length][names.size()];
        for (int j = 0; j < names.size(); j++) {
            double[] values = columns.get(names.get(j));
            checkArgument(values != null, "no column " + names.get(j));
            for (int i = 0; i < rows.length; i++) {
                result[i][j] = values[rows[i]];
            }
        }
        return result;
    }

    /**
     * @return the names of all stations with at least one column, sorted
     */
    public SortedSet<String> getStations() {
        SortedSet<String> stations = new TreeSet<>();
        for (String name : columns.keySet()) {
            stationOf(name).ifPresent(stations::add);
        }
        return stations;
    }

    /**
     * Recovers the station a column belongs to.
     *
     * @param column a column name
     * @return the station, empty if the name does not follow the column naming
     */
    public static Optional<String> stationOf(String column) {
        String name = column.endsWith(NORMALIZED_SUFFIX)
                ? column.substring(0, column.length() - NORMALIZED_SUFFIX.length())
                : column;
        for (Axis axis : Axis.values()) {
            for (String suffix : Arrays.asList("_" + axis.getSuffix(), "_" + axis.getSigmaSuffix())) {
                if (name.endsWith(suffix) && name.length() > suffix.length()) {
                    return Optional.of(name.substring(0, name.length() - suffix.length()));
                }
            }
        }
        return Optional.empty();
    }
}
