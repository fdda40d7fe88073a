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

package com.gnssanomaly.benchmark;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.IsolationForest;
import com.gnssanomaly.pipeline.matrix.Normalizer;
import com.gnssanomaly.pipeline.scoring.AnomalyScorer;

/**
 * Measures how well the per-station detector finds faults whose position is
 * known. Every trial is generated from the same seed, so trials for different
 * ramp slopes share their clean signal and noise.
 */
public class SyntheticBenchmark {

    private static final Logger LOG = LogManager.getLogger(SyntheticBenchmark.class);

    public static final int DEFAULT_DAYS = 4 * 365;

    public static final double DEFAULT_SEASONAL_AMPLITUDE = 6.0;

    public static final double DEFAULT_NOISE_LEVEL = 2.0;

    public static final double DEFAULT_CONTAMINATION = 0.05;

    /**
     * Ramp slopes of the sensitivity sweep, in millimetres per day.
     */
    public static final List<Double> DEFAULT_SLOPES = Collections
            .unmodifiableList(Arrays.asList(0.1, 0.3, 0.5, 0.8, 1.0, 1.5, 2.0, 2.5, 3.0));

    /**
     * Ramp slopes of the demonstration trials: hidden in the noise, detected late,
     * detected at once.
     */
    public static final List<Double> DEMONSTRATION_SLOPES = Collections
            .unmodifiableList(Arrays.asList(0.3, 1.0, 2.5));

    /**
     * Recall, in percent, above which a ramp counts as detectable.
     */
    public static final double HIGH_EFFECTIVENESS_RECALL = 90.0;

    private final SyntheticSignalGenerator generator;
    private final FaultInjector injector;
    private final Set<FaultType> faults;
    private final AnomalyScorer scorer;
    private final long randomSeed;

    protected SyntheticBenchmark(Builder builder) {
        checkArgument(builder.faults != null && !builder.faults.isEmpty(), "at least one fault must be injected");
        generator = new SyntheticSignalGenerator(builder.days, builder.seasonalAmplitude, builder.noiseLevel);
        injector = FaultInjector.builder().stepMagnitude(builder.stepMagnitude).rampDuration(builder.rampDuration)
                .noiseDuration(builder.noiseDuration).noiseMultiplier(builder.noiseMultiplier)
                .baselineNoise(builder.noiseLevel).build();
        faults = Collections.unmodifiableSet(EnumSet.copyOf(builder.faults));
        AnomalyScorer.Builder scorerBuilder = AnomalyScorer.builder().contamination(builder.contamination)
                .numberOfTrees(builder.numberOfTrees).sampleSize(builder.sampleSize).randomSeed(builder.randomSeed)
                .parallelExecutionEnabled(builder.parallelExecutionEnabled);
        builder.threadPoolSize.ifPresent(scorerBuilder::threadPoolSize);
        scorer = scorerBuilder.build();
        randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param rampSlope the drift per day of the ramp in millimetres
     * @return a reproducible trial with the configured faults
     */
    public SyntheticTrial generateTrial(double rampSlope) {
        RandomGenerator random = new Well19937c(randomSeed);
        double[] clean = generator.generate(random);
        return injector.inject(clean, faults, rampSlope, random);
    }

    /**
     * Scores the engineered features of a trial, standardized column by column,
     * and compares the labels with the ground truth.
     *
     * @param trial a trial
     * @return the detections and their recall
     */
    public TrialResult evaluate(SyntheticTrial trial) {
        checkNotNull(trial, "trial must not be null");
        double[][] features = standardizeColumns(FeatureEngineering.features(trial.getSignal()));
        return new TrialResult(trial, scorer.fitAndLabel(features));
    }

    public TrialResult run(double rampSlope) {
        return evaluate(generateTrial(rampSlope));
    }

    /**
     * @param slopes ramp slopes in millimetres per day
     * @return one point per slope, in the given order
     */
    public List<SensitivityPoint> sweep(List<Double> slopes) {
        checkNotNull(slopes, "slopes must not be null");
        List<SensitivityPoint> curve = new ArrayList<>();
        for (double slope : slopes) {
            TrialResult result = run(slope);
            double rampRecall = result.getRecallPercent(FaultType.RAMP).orElse(Double.NaN);
            LOG.info("slope {} mm/day: recall {}%, ramp recall {}%", slope,
                    String.format("%.1f", result.getRecallPercent()), String.format("%.1f", rampRecall));
            curve.add(new SensitivityPoint(slope, result.getRecallPercent(), rampRecall));
        }
        return curve;
    }

    /**
     * @param curve            a sensitivity curve ordered by slope
     * @param referencePercent the recall a ramp must reach
     * @return the smallest slope whose ramp recall reaches the reference, empty
     *         if none does
     */
    public static Optional<Double> detectableThreshold(List<SensitivityPoint> curve, double referencePercent) {
        return curve.stream().filter(p -> p.reaches(referencePercent)).map(SensitivityPoint::getSlope).findFirst();
    }

    /**
     * @param groundTruth 1 on anomalous days
     * @param detected    true on detected days
     * @return detected anomalous days over anomalous days, in percent; 0 when
     *         there is no anomalous day
     */
    public static double recallPercent(int[] groundTruth, boolean[] detected) {
        checkArgument(groundTruth.length == detected.length, "groundTruth and detected must have the same length");
        int positives = 0;
        int truePositives = 0;
        for (int t = 0; t < groundTruth.length; t++) {
            if (groundTruth[t] == 1) {
                positives++;
                truePositives += detected[t] ? 1 : 0;
            }
        }
        return positives == 0 ? 0.0 : 100.0 * truePositives / positives;
    }

    /**
     * @param fault    an injected fault
     * @param detected true on detected days
     * @return the percentage of the days marked by the fault that were detected
     */
    public static double recallPercent(InjectedFault fault, boolean[] detected) {
        int[] groundTruth = new int[detected.length];
        for (int t = 0; t < detected.length; t++) {
            groundTruth[t] = fault.covers(t) ? 1 : 0;
        }
        return recallPercent(groundTruth, detected);
    }

    static double[][] standardizeColumns(double[][] features) {
        int columns = features.length == 0 ? 0 : features[0].length;
        double[][] result = new double[features.length][columns];
        for (int j = 0; j < columns; j++) {
            double[] column = new double[features.length];
            for (int i = 0; i < features.length; i++) {
                column[i] = features[i][j];
            }
            double[] standardized = Normalizer.standardize(column);
            for (int i = 0; i < features.length; i++) {
                result[i][j] = standardized[i];
            }
        }
        return result;
    }

    public SyntheticSignalGenerator getGenerator() {
        return generator;
    }

    public FaultInjector getInjector() {
        return injector;
    }

    public Set<FaultType> getFaults() {
        return faults;
    }

    public AnomalyScorer getScorer() {
        return scorer;
    }

    public static class Builder {
        private int days = DEFAULT_DAYS;
        private double seasonalAmplitude = DEFAULT_SEASONAL_AMPLITUDE;
        private double noiseLevel = DEFAULT_NOISE_LEVEL;
        private double stepMagnitude = FaultInjector.DEFAULT_STEP_MAGNITUDE;
        private int rampDuration = FaultInjector.DEFAULT_RAMP_DURATION;
        private int noiseDuration = FaultInjector.DEFAULT_NOISE_DURATION;
        private double noiseMultiplier = FaultInjector.DEFAULT_NOISE_MULTIPLIER;
        private Set<FaultType> faults = EnumSet.allOf(FaultType.class);
        private double contamination = DEFAULT_CONTAMINATION;
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForest.DEFAULT_SAMPLE_SIZE;
        private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;
        private boolean parallelExecutionEnabled = IsolationForest.DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public Builder days(int days) {
            this.days = days;
            return this;
        }

        public Builder seasonalAmplitude(double seasonalAmplitude) {
            this.seasonalAmplitude = seasonalAmplitude;
            return this;
        }

        public Builder noiseLevel(double noiseLevel) {
            this.noiseLevel = noiseLevel;
            return this;
        }

        public Builder stepMagnitude(double stepMagnitude) {
            this.stepMagnitude = stepMagnitude;
            return this;
        }

        public Builder rampDuration(int rampDuration) {
            this.rampDuration = rampDuration;
            return this;
        }

        public Builder noiseDuration(int noiseDuration) {
            this.noiseDuration = noiseDuration;
            return this;
        }

        public Builder noiseMultiplier(double noiseMultiplier) {
            this.noiseMultiplier = noiseMultiplier;
            return this;
        }

        public Builder faults(Set<FaultType> faults) {
            this.faults = faults;
            return this;
        }

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

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        public SyntheticBenchmark build() {
            return new SyntheticBenchmark(this);
        }
    }
}
