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

package com.gnssanomaly.benchmark.runner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.benchmark.SensitivityCsvWriter;
import com.gnssanomaly.benchmark.SensitivityPoint;
import com.gnssanomaly.benchmark.SyntheticBenchmark;
import com.gnssanomaly.benchmark.TrialResult;

/**
 * Runs the demonstration trials and the sensitivity sweep and writes them as
 * CSV tables.
 */
public class BenchmarkRunner {

    private static final Logger LOG = LogManager.getLogger(BenchmarkRunner.class);

    public static final String CURVE_FILE = "sensitivity_curve.csv";

    public static final String TRIAL_FILE_FORMAT = "sim_example_slope_%.1f.csv";

    protected final BenchmarkArgumentParser argumentParser;

    public BenchmarkRunner() {
        this(new BenchmarkArgumentParser(BenchmarkRunner.class.getName(),
                "Measure the recall of the detector on synthetic series with injected step, ramp and noise faults."));
    }

    public BenchmarkRunner(BenchmarkArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        BenchmarkRunner runner = new BenchmarkRunner();
        runner.parse(args);
        runner.run();
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public SyntheticBenchmark buildBenchmark() {
        SyntheticBenchmark.Builder builder = SyntheticBenchmark.builder().days(argumentParser.getDays())
                .noiseLevel(argumentParser.getNoiseLevel()).seasonalAmplitude(argumentParser.getSeasonalAmplitude())
                .stepMagnitude(argumentParser.getStepMagnitude()).rampDuration(argumentParser.getRampDuration())
                .noiseDuration(argumentParser.getNoiseDuration()).noiseMultiplier(argumentParser.getNoiseMultiplier())
                .contamination(argumentParser.getContamination()).numberOfTrees(argumentParser.getNumberOfTrees())
                .sampleSize(argumentParser.getSampleSize()).randomSeed(argumentParser.getRandomSeed())
                .parallelExecutionEnabled(argumentParser.getParallelExecutionEnabled());
        argumentParser.getThreadPoolSize().ifPresent(builder::threadPoolSize);
        return builder.build();
    }

    /**
     * @return the sensitivity curve
     * @throws IOException if an output cannot be written
     */
    public List<SensitivityPoint> run() throws IOException {
        SyntheticBenchmark benchmark = buildBenchmark();
        Path output = Paths.get(argumentParser.getOutputDirectory());
        Files.createDirectories(output);
        SensitivityCsvWriter writer = new SensitivityCsvWriter();

        for (double slope : argumentParser.getExampleSlopes()) {
            TrialResult result = benchmark.run(slope);
            Path file = output.resolve(String.format(Locale.ROOT, TRIAL_FILE_FORMAT, slope));
            writer.writeTrial(result, file);
            LOG.info("demonstration trial with slope {} mm/day: recall {}%, {} days detected, written to {}", slope,
                    String.format(Locale.ROOT, "%.1f", result.getRecallPercent()), result.getDetectedCount(),
                    file.getFileName());
        }

        List<SensitivityPoint> curve = new ArrayList<>(benchmark.sweep(argumentParser.getSlopes()));
        writer.writeCurve(curve, SyntheticBenchmark.HIGH_EFFECTIVENESS_RECALL, output.resolve(CURVE_FILE));

        Optional<Double> threshold = SyntheticBenchmark.detectableThreshold(curve,
                SyntheticBenchmark.HIGH_EFFECTIVENESS_RECALL);
        if (threshold.isPresent()) {
            LOG.info("ramps of {} mm/day and faster are detected with at least {}% recall", threshold.get(),
                    SyntheticBenchmark.HIGH_EFFECTIVENESS_RECALL);
        } else {
            LOG.warn("no swept slope reached {}% recall", SyntheticBenchmark.HIGH_EFFECTIVENESS_RECALL);
        }
        return curve;
    }
}
