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

package com.gnssanomaly;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;
import static com.gnssanomaly.CommonUtils.checkState;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.config.SeparationMode;
import com.gnssanomaly.executor.AbstractForestTraversalExecutor;
import com.gnssanomaly.executor.ParallelForestTraversalExecutor;
import com.gnssanomaly.executor.SequentialForestTraversalExecutor;
import com.gnssanomaly.tree.IsolationTree;

/**
 * An ensemble of isolation trees fitted once on a batch of points. Each tree is
 * built from a random sub-sample drawn without replacement; the anomaly score
 * of a point is derived from its mean isolation depth over all trees. Fitting
 * also calibrates a score threshold so that the expected fraction of the
 * training points, the contamination, lies above it. Points scoring strictly
 * above the threshold are labeled anomalous.
 *
 * Everything random in a forest derives from its seed: two forests built with
 * the same configuration and seed and fitted on the same data produce the same
 * scores and labels, whether or not parallel execution is enabled.
 */
public class IsolationForest implements Closeable {

    private static final Logger LOG = LogManager.getLogger(IsolationForest.class);

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 200;

    /**
     * Default sample size. Each tree is built from at most this many points.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Default expected fraction of anomalies in the training data.
     */
    public static final double DEFAULT_CONTAMINATION = 0.004;

    /**
     * Default random seed.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    /**
     * Parallel execution is not enabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    public static final SeparationMode DEFAULT_SEPARATION_MODE = SeparationMode.UNIFORM;

    /**
     * Random number generator used by the forest.
     */
    protected final Random rng;
    /**
     * The number of dimensions in the input data.
     */
    protected final int dimensions;
    /**
     * The number of trees in this forest.
     */
    protected final int numberOfTrees;
    /**
     * The largest sample a tree is built from.
     */
    protected final int sampleSize;
    /**
     * The expected fraction of anomalies, used to calibrate the threshold.
     */
    protected final double contamination;
    /**
     * How cut dimensions are chosen.
     */
    protected final SeparationMode separationMode;
    /**
     * Enable parallel execution.
     */
    protected final boolean parallelExecutionEnabled;
    /**
     * Number of threads to use in the thread pool if parallel execution is enabled.
     */
    protected final int threadPoolSize;

    protected final List<IsolationTree> trees;

    /**
     * An implementation of forest traversal algorithms.
     */
    protected final AbstractForestTraversalExecutor traversalExecutor;

    private int effectiveSampleSize;
    private double threshold = Double.NaN;
    private double[] trainingScores;

    public IsolationForest(Builder<?> builder) {
        checkArgument(builder.dimensions > 0, "dimensions must be greater than 0");
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 1, "sampleSize must be greater than 1");
        checkArgument(builder.contamination > 0 && builder.contamination <= 0.5,
                "contamination must be in the range (0, 0.5]");
        builder.threadPoolSize.ifPresent(n -> checkArgument(
                (n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. "
                        + "To disable thread pool, set parallel execution to 'false'."));

        dimensions = builder.dimensions;
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        contamination = builder.contamination;
        separationMode = checkNotNull(builder.separationMode, "separationMode must not be null");
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        rng = builder.getRandom();
        trees = new ArrayList<>(numberOfTrees);

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            traversalExecutor = new ParallelForestTraversalExecutor(trees, threadPoolSize);
        } else {
            threadPoolSize = 0;
            traversalExecutor = new SequentialForestTraversalExecutor(trees);
        }
    }

    /**
     * @return a new IsolationForest builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Builds all trees from the data and calibrates the anomaly threshold on it.
     * A forest can be fitted only once.
     *
     * @param data the training points, each of length {@link #getDimensions()}
     */
    public void fit(double[][] data) {
        checkState(!isFitted(), "forest is already fitted");
        checkArgument(data != null && data.length > 0, "data must not be empty");
        for (double[] row : data) {
            checkArgument(row != null && row.length == dimensions, "incorrect dimensions in training data");
        }

        effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(Math.max(effectiveSampleSize, 2)) / Math.log(2.0)));

        Map<IsolationTree, List<Integer>> samples = new IdentityHashMap<>();
        for (int i = 0; i < numberOfTrees; i++) {
            IsolationTree tree = IsolationTree.builder().randomSeed(rng.nextLong()).maxDepth(maxDepth)
                    .separationMode(separationMode).build();
            samples.put(tree, drawSample(data.length, effectiveSampleSize, new Random(rng.nextLong())));
            trees.add(tree);
        }
        traversalExecutor.forEachTree(tree -> tree.makeTree(data, samples.get(tree)));

        trainingScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingScores[i] = getAnomalyScore(data[i]);
        }
        threshold = new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(trainingScores,
                100.0 * (1.0 - contamination));
        LOG.debug("fitted {} trees on {} points (sample size {}), threshold {}", numberOfTrees, data.length,
                effectiveSampleSize, threshold);
    }

    /**
     * Fits the forest and labels the training points.
     *
     * @param data the training points
     * @return true at the positions of points labeled anomalous
     */
    public boolean[] fitPredict(double[][] data) {
        fit(data);
        boolean[] result = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = trainingScores[i] > threshold;
        }
        return result;
    }

    /**
     * Compute the isolation score of a point: {@code 2^(-E[h(x)] / c(n))} where
     * {@code E[h(x)]} is the mean isolation depth over the trees and {@code c(n)}
     * the average path length for the tree sample size. Scores lie in (0, 1];
     * higher is more anomalous.
     *
     * @param point A point being scored.
     * @return the isolation score of the point.
     */
    public double getAnomalyScore(double[] point) {
        checkState(!trees.isEmpty(), "forest is not fitted");
        checkArgument(point != null && point.length == dimensions, "incorrect point dimensions");
        return traversalExecutor.traverseForest(point, IsolationTree::pathLength, Double::sum,
                sum -> CommonUtils.isolationScore(sum / numberOfTrees, effectiveSampleSize));
    }

    /**
     * @param point A point being labeled.
     * @return true if the score of the point exceeds the calibrated threshold
     */
    public boolean isAnomaly(double[] point) {
        checkState(isFitted(), "forest is not fitted");
        return getAnomalyScore(point) > threshold;
    }

    /**
     * @param points points being labeled
     * @return true at the positions of points labeled anomalous
     */
    public boolean[] predict(double[][] points) {
        checkNotNull(points, "points must not be null");
        boolean[] result = new boolean[points.length];
        for (int i = 0; i < points.length; i++) {
            result[i] = isAnomaly(points[i]);
        }
        return result;
    }

    private static List<Integer> drawSample(int populationSize, int size, Random random) {
        int[] indices = new int[populationSize];
        for (int i = 0; i < populationSize; i++) {
            indices[i] = i;
        }
        List<Integer> sample = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(populationSize - i);
            int swap = indices[i];
            indices[i] = indices[j];
            indices[j] = swap;
            sample.add(indices[i]);
        }
        return sample;
    }

    /**
     * Releases the thread pool of a parallel forest. A sequential forest holds no
     * threads.
     */
    @Override
    public void close() {
        traversalExecutor.close();
    }

    public boolean isFitted() {
        return trainingScores != null;
    }

    /**
     * @return the score threshold, NaN before fitting
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return a copy of the scores of the training points, empty before fitting
     */
    public Optional<double[]> getTrainingScores() {
        return Optional.ofNullable(trainingScores).map(s -> Arrays.copyOf(s, s.length));
    }

    /**
     * @return the sample size the trees were actually built with
     */
    public int getEffectiveSampleSize() {
        return effectiveSampleSize;
    }

    public int getDimensions() {
        return dimensions;
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

    public SeparationMode getSeparationMode() {
        return separationMode;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private int dimensions;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();
        private SeparationMode separationMode = DEFAULT_SEPARATION_MODE;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T separationMode(SeparationMode separationMode) {
            this.separationMode = separationMode;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
