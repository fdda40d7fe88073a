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
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.pipeline.decomposition.DecomposedSeries;
import com.gnssanomaly.pipeline.decomposition.Decomposer;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.model.StationSeries;

/**
 * Decomposes every station independently and joins the residuals on date.
 * <p>
 * The shared calendar is the union of the daily calendars of all stations.
 * Columns are ordered by station name, then east, north and up residuals, then
 * their uncertainties, so the same input always yields the same matrix. When
 * parallel execution is enabled each station is decomposed as a separate task
 * in a dedicated {@link ForkJoinPool}; all tasks complete before the matrix is
 * assembled.
 */
public class Synchronizer {

    private static final Logger LOG = LogManager.getLogger(Synchronizer.class);

    private final Decomposer decomposer;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;

    public Synchronizer(Decomposer decomposer) {
        this(decomposer, false, 0);
    }

    public Synchronizer(Decomposer decomposer, boolean parallelExecutionEnabled, int threadPoolSize) {
        this.decomposer = checkNotNull(decomposer, "decomposer must not be null");
        checkArgument(!parallelExecutionEnabled || threadPoolSize > 0,
                "threadPoolSize must be greater than 0 when parallel execution is enabled");
        this.parallelExecutionEnabled = parallelExecutionEnabled;
        this.threadPoolSize = threadPoolSize;
    }

    /**
     * @param stations station series with distinct names
     * @return the decomposed stations, failed stations and the combined matrix
     */
    public SynchronizationResult synchronize(Collection<StationSeries> stations) {
        checkNotNull(stations, "stations must not be null");
        Set<String> names = new HashSet<>();
        for (StationSeries series : stations) {
            checkArgument(names.add(series.getStation()), "duplicate station " + series.getStation());
        }

        List<Outcome> outcomes;
        if (parallelExecutionEnabled) {
            ForkJoinPool pool = new ForkJoinPool(threadPoolSize);
            try {
                outcomes = pool.submit(() -> stations.parallelStream().map(this::decompose)
                        .collect(Collectors.toList())).join();
            } finally {
                pool.shutdown();
            }
        } else {
            outcomes = stations.stream().map(this::decompose).collect(Collectors.toList());
        }

        SortedMap<String, DecomposedSeries> decomposed = new TreeMap<>();
        SortedMap<String, String> failures = new TreeMap<>();
        for (Outcome outcome : outcomes) {
            if (outcome.series != null) {
                decomposed.put(outcome.station, outcome.series);
            } else {
                failures.put(outcome.station, outcome.error);
            }
        }
        LOG.info("decomposed {} stations, {} failed", decomposed.size(), failures.size());
        return new SynchronizationResult(decomposed, failures, combine(decomposed.values()));
    }

    private Outcome decompose(StationSeries series) {
        try {
            return new Outcome(series.getStation(), decomposer.decompose(series), null);
        } catch (RuntimeException e) {
            LOG.error("station {} could not be decomposed", series.getStation(), e);
            return new Outcome(series.getStation(), null, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Outer-joins decomposed stations on date.
     *
     * @param stations decomposed stations with distinct names
     * @return residual and uncertainty columns of every station on the union of
     *         the station calendars
     */
    public static CombinedMatrix combine(Collection<DecomposedSeries> stations) {
        SortedMap<String, DecomposedSeries> byName = new TreeMap<>();
        for (DecomposedSeries series : stations) {
            checkArgument(byName.put(series.getStation(), series) == null, "duplicate station " + series.getStation());
        }

        TreeSet<LocalDate> calendar = new TreeSet<>();
        for (DecomposedSeries series : byName.values()) {
            for (int day = 0; day < series.getCalendarLength(); day++) {
                calendar.add(series.getFirstDate().plusDays(day));
            }
        }
        List<LocalDate> dates = new ArrayList<>(calendar);
        Map<LocalDate, Integer> rowOf = new LinkedHashMap<>();
        for (int i = 0; i < dates.size(); i++) {
            rowOf.put(dates.get(i), i);
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        int rows = dates.size();
        for (DecomposedSeries series : byName.values()) {
            int offset = rowOf.get(series.getFirstDate());
            for (Axis axis : Axis.values()) {
                columns.put(axis.column(series.getStation()), place(series.getResidual(axis), offset, rows));
            }
            for (Axis axis : Axis.values()) {
                columns.put(axis.sigmaColumn(series.getStation()), place(series.getSigma(axis), offset, rows));
            }
        }
        return new CombinedMatrix(dates, columns);
    }

    // a station calendar is contiguous, so its days occupy consecutive rows of the union
    private static double[] place(double[] values, int offset, int rows) {
        double[] column = new double[rows];
        Arrays.fill(column, Double.NaN);
        System.arraycopy(values, 0, column, offset, values.length);
        return column;
    }

    private static class Outcome {
        private final String station;
        private final DecomposedSeries series;
        private final String error;

        Outcome(String station, DecomposedSeries series, String error) {
            this.station = station;
            this.series = series;
            this.error = error;
        }
    }
}
