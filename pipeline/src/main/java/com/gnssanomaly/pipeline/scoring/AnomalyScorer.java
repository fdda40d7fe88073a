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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.IsolationForest;
import com.gnssanomaly.pipeline.matrix.ActivityMask;
import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.model.Axis;

/**
 * Fits one isolation forest per station on the standardized residuals of its
 * active days and labels those days. Inactive days are always normal. A station
 * that cannot be scored is skipped with a reason and the batch goes on.
 */
public class AnomalyScorer {

    private static final Logger LOG = LogManager.getLogger(AnomalyScorer.class);

    private final int numberOfTrees;
    private final int sampleSize;
    private final double contamination;
    private final long randomSeed;
    private final double activityEpsilon;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;

    protected AnomalyScorer(Builder builder) {
        checkArgument(builder.activityEpsilon >= 0, "activityEpsilon must be non-negative");
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater than 0 when parallel execution is enabled"));
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        contamination = builder.contamination;
        randomSeed = builder.randomSeed;
        activityEpsilon = builder.activityEpsilon;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.parallelExecutionEnabled
                ? builder.threadPoolSize.orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1))
                : 0;
        // validates the forest configuration
        newForest(1, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Scores every station that has a column in the matrix.
     *
     * @param matrix a normalized matrix
     * @return one result per station
     */
    public ScoringReport score(CombinedMatrix matrix) {
        return score(matrix, matrix.getStations());
    }

    /**
     * Scores the given stations. When parallel execution is enabled stations are
     * scored concurrently; the report is ordered by station either way.
     *
     * @param matrix   a normalized matrix
     * @param stations the stations to score
     * @return one result per station
     */
    public ScoringReport score(CombinedMatrix matrix, Collection<String> stations) {
        checkNotNull(matrix, "matrix must not be null");
        checkNotNull(stations, "stations must not be null");
        List<StationScoringResult> results;
        if (parallelExecutionEnabled) {
            ForkJoinPool pool = new ForkJoinPool(threadPoolSize);
            try {
                results = pool.submit(() -> stations.parallelStream().map(s -> scoreStation(matrix, s))
                        .collect(Collectors.toList())).join();
            } finally {
                pool.shutdown();
            }
        } else {
            results = stations.stream().map(s -> scoreStation(matrix, s)).collect(Collectors.toList());
        }
        ScoringReport report = new ScoringReport(
                results.stream().collect(Collectors.toMap(StationScoringResult::getStation, Function.identity())));
        LOG.info("scored {} stations, skipped {}, {} anomalies in total", report.getModels().size(),
                report.getSkipped().size(), report.getTotalAnomalies());
        return report;
    }

    /**
     * Scores one station. Never throws for a valid matrix: failures are reported
     * as {@link SkipReason#SCORING_FAILED}.
     *
     * @param matrix  a normalized matrix
     * @param station the station
     * @return the labels of every matrix row, or the skip reason
     */
    public StationScoringResult scoreStation(CombinedMatrix matrix, String station) {
        List<String> features = new ArrayList<>();
        boolean complete = true;
        for (Axis axis : Axis.values()) {
            features.add(axis.column(station) + CombinedMatrix.NORMALIZED_SUFFIX);
            complete &= matrix.hasColumn(axis.column(station));
        }
        if (!complete || !features.stream().allMatch(matrix::hasColumn)) {
            LOG.warn("station {} skipped: missing feature columns", station);
            return StationScoringResult.skipped(station, SkipReason.MISSING_FEATURE_COLUMNS);
        }

        try {
            ActivityMask mask = ActivityMask.of(matrix, station, activityEpsilon);
            if (mask.getActiveCount() == 0) {
                LOG.warn("station {} skipped: no active days", station);
                return StationScoringResult.skipped(station, SkipReason.NO_ACTIVE_DAYS);
            }
            int[] rows = mask.getActiveRows();
            IsolationForest forest = newForest(features.size(), false);
            boolean[] flagged = forest.fitPredict(matrix.getRows(features, rows));

            AnomalyLabel[] labels = new AnomalyLabel[matrix.getRowCount()];
            Arrays.fill(labels, AnomalyLabel.NORMAL);
            for (int i = 0; i < rows.length; i++) {
                labels[rows[i]] = AnomalyLabel.of(flagged[i]);
            }
            StationScoringResult result = StationScoringResult.scored(new StationModel(station, forest, features, rows),
                    labels);
            LOG.info("station {}: {} anomalies on {} active days", station, result.getAnomalyCount(), rows.length);
            return result;
        } catch (RuntimeException e) {
            LOG.error("station {} could not be scored", station, e);
            return StationScoringResult.skipped(station, SkipReason.SCORING_FAILED);
        }
    }

    /**
     * Fits a forest with this configuration on a single feature matrix and labels
     * its rows. Trees are built in parallel when parallel execution is enabled.
     *
     * @param features one row of features per sample
     * @return true at anomalous rows
     */
    public boolean[] fitAndLabel(double[][] features) {
        checkArgument(features != null && features.length > 0, "features must not be empty");
        try (IsolationForest forest = newForest(features[0].length, parallelExecutionEnabled)) {
            return forest.fitPredict(features);
        }
    }

    IsolationForest newForest(int dimensions, boolean parallel) {
        IsolationForest.Builder<?> builder = IsolationForest.builder().dimensions(dimensions)
                .numberOfTrees(numberOfTrees).sampleSize(sampleSize).contamination(contamination)
                .randomSeed(randomSeed).parallelExecutionEnabled(parallel);
        if (parallel) {
            builder.threadPoolSize(threadPoolSize);
        }
        return builder.build();
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public double getActivityEpsilon() {
        return activityEpsilon;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public static class Builder {
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForest.DEFAULT_SAMPLE_SIZE;
        private double contamination = IsolationForest.DEFAULT_CONTAMINATION;
        private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;
        private double activityEpsilon = ActivityMask.DEFAULT_EPSILON;
        private boolean parallelExecutionEnabled = IsolationForest.DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder activityEpsilon(double activityEpsilon) {
            this.activityEpsilon = activityEpsilon;
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        public AnomalyScorer build() {
            return new AnomalyScorer(this);
        }
    }
}
