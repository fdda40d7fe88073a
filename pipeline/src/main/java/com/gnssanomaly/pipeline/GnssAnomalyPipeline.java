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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.IsolationForest;
import com.gnssanomaly.pipeline.decomposition.Decomposer;
import com.gnssanomaly.pipeline.matrix.ActivityMask;
import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.matrix.Normalizer;
import com.gnssanomaly.pipeline.matrix.SynchronizationResult;
import com.gnssanomaly.pipeline.matrix.Synchronizer;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.model.StationSeries;
import com.gnssanomaly.pipeline.scoring.AnomalyScorer;
import com.gnssanomaly.pipeline.scoring.ScoringReport;
import com.gnssanomaly.pipeline.validation.RobustValidator;
import com.gnssanomaly.pipeline.validation.ValidationReport;

/**
 * Detects anomalous days in a network of GNSS stations. A run decomposes every
 * station, joins the residuals on a shared calendar, normalizes them, scores
 * each station with its own isolation forest and audits the labels with a
 * robust statistic.
 * <p>
 * A pipeline is configured once through its {@link Builder} and can be run any
 * number of times; runs share no state.
 */
public class GnssAnomalyPipeline {

    private static final Logger LOG = LogManager.getLogger(GnssAnomalyPipeline.class);

    private final Synchronizer synchronizer;
    private final AnomalyScorer scorer;
    private final RobustValidator validator;

    protected GnssAnomalyPipeline(Builder builder) {
        Decomposer decomposer = Decomposer.builder().seasonalPeriod(builder.seasonalPeriod).gapLimit(builder.gapLimit)
                .maxMissingFraction(builder.maxMissingFraction).build();

        AnomalyScorer.Builder scorerBuilder = AnomalyScorer.builder().numberOfTrees(builder.numberOfTrees)
                .sampleSize(builder.sampleSize).contamination(builder.contamination).randomSeed(builder.randomSeed)
                .activityEpsilon(builder.activityEpsilon).parallelExecutionEnabled(builder.parallelExecutionEnabled);
        builder.threadPoolSize.ifPresent(scorerBuilder::threadPoolSize);
        scorer = scorerBuilder.build();

        synchronizer = new Synchronizer(decomposer, scorer.isParallelExecutionEnabled(), scorer.getThreadPoolSize());

        checkNotNull(builder.validationAxis, "validationAxis must not be null");
        validator = new RobustValidator(builder.madThreshold,
                builder.validateAllAxes ? EnumSet.allOf(Axis.class) : EnumSet.of(builder.validationAxis));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param stations station series with distinct names
     * @return the products of every stage
     */
    public PipelineResult run(Collection<StationSeries> stations) {
        checkArgument(stations != null && !stations.isEmpty(), "at least one station is required");
        LOG.info("running detection on {} stations", stations.size());

        SynchronizationResult synchronization = synchronizer.synchronize(stations);
        CombinedMatrix normalized = Normalizer.normalize(synchronization.getMatrix());
        LOG.info("combined matrix has {} days and {} columns", normalized.getRowCount(),
                normalized.getColumnNames().size());

        ScoringReport scoring = scorer.score(normalized);
        ValidationReport validation = validator.validate(normalized, scoring);
        LOG.info("model and statistic agree with Jaccard similarity {}",
                String.format("%.3f", validation.getJaccard()));
        return new PipelineResult(synchronization, normalized, scoring, validation);
    }

    public AnomalyScorer getScorer() {
        return scorer;
    }

    public RobustValidator getValidator() {
        return validator;
    }

    public static class Builder {

        private double contamination = IsolationForest.DEFAULT_CONTAMINATION;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForest.DEFAULT_SAMPLE_SIZE;
        private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;
        private double madThreshold = RobustValidator.DEFAULT_THRESHOLD;
        private int seasonalPeriod = Decomposer.DEFAULT_SEASONAL_PERIOD;
        private int gapLimit = Decomposer.DEFAULT_GAP_LIMIT;
        private double maxMissingFraction = Decomposer.DEFAULT_MAX_MISSING_FRACTION;
        private double activityEpsilon = ActivityMask.DEFAULT_EPSILON;
        private Axis validationAxis = RobustValidator.DEFAULT_AXIS;
        private boolean validateAllAxes = false;
        private boolean parallelExecutionEnabled = IsolationForest.DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder madThreshold(double madThreshold) {
            this.madThreshold = madThreshold;
            return this;
        }

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        public Builder gapLimit(int gapLimit) {
            this.gapLimit = gapLimit;
            return this;
        }

        public Builder maxMissingFraction(double maxMissingFraction) {
            this.maxMissingFraction = maxMissingFraction;
            return this;
        }

        public Builder activityEpsilon(double activityEpsilon) {
            this.activityEpsilon = activityEpsilon;
            return this;
        }

        public Builder validationAxis(Axis validationAxis) {
            this.validationAxis = validationAxis;
            return this;
        }

        public Builder validateAllAxes(boolean validateAllAxes) {
            this.validateAllAxes = validateAllAxes;
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

        public GnssAnomalyPipeline build() {
            return new GnssAnomalyPipeline(this);
        }
    }
}
