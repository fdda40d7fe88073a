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

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.gnssanomaly.benchmark.FaultInjector;
import com.gnssanomaly.benchmark.SyntheticBenchmark;
import com.gnssanomaly.pipeline.runner.ArgumentParser;

/**
 * The detection flags that apply to synthetic trials, plus the parameters of
 * the synthetic signal and its faults.
 */
public class BenchmarkArgumentParser extends ArgumentParser {

    public static final String ARCHIVE_NAME = "target/gnss-anomaly-benchmark-1.0.0.jar";

    private final StringArgument outputDirectory;
    private final IntegerArgument days;
    private final DoubleArgument noiseLevel;
    private final DoubleArgument seasonalAmplitude;
    private final DoubleArgument stepMagnitude;
    private final IntegerArgument rampDuration;
    private final IntegerArgument noiseDuration;
    private final DoubleArgument noiseMultiplier;
    private final Argument<List<Double>> slopes;
    private final Argument<List<Double>> exampleSlopes;

    public BenchmarkArgumentParser(String runnerClass, String runnerDescription) {
        super(runnerClass, runnerDescription, SyntheticBenchmark.DEFAULT_CONTAMINATION);

        removeArgument("--input-dir");
        removeArgument("--mad-threshold");
        removeArgument("--seasonal-period");
        removeArgument("--gap-limit");
        removeArgument("--activity-epsilon");
        removeArgument("--validation-axis");
        removeArgument("--output-dir");

        outputDirectory = new StringArgument("-o", "--output-dir", "Directory the curve and trials are written to.",
                "data/simulated");

        addArgument(outputDirectory);

        days = new IntegerArgument("-d", "--days", "Length of every synthetic series in days.",
                SyntheticBenchmark.DEFAULT_DAYS, n -> checkArgument(n >= 10, "days should be at least 10"));

        addArgument(days);

        noiseLevel = new DoubleArgument(null, "--noise-level", "Standard deviation of the baseline noise in mm.",
                SyntheticBenchmark.DEFAULT_NOISE_LEVEL,
                x -> checkArgument(x >= 0, "noise level should be greater/equal than 0"));

        addArgument(noiseLevel);

        seasonalAmplitude = new DoubleArgument(null, "--seasonal-amplitude", "Amplitude of the annual signal in mm.",
                SyntheticBenchmark.DEFAULT_SEASONAL_AMPLITUDE);

        addArgument(seasonalAmplitude);

        stepMagnitude = new DoubleArgument(null, "--step-magnitude", "Offset of the step fault in mm.",
                FaultInjector.DEFAULT_STEP_MAGNITUDE);

        addArgument(stepMagnitude);

        rampDuration = new IntegerArgument(null, "--ramp-duration", "Length of the ramp fault in days.",
                FaultInjector.DEFAULT_RAMP_DURATION,
                n -> checkArgument(n > 0, "ramp duration should be greater than 0"));

        addArgument(rampDuration);

        noiseDuration = new IntegerArgument(null, "--noise-duration", "Length of the noise burst in days.",
                FaultInjector.DEFAULT_NOISE_DURATION,
                n -> checkArgument(n > 0, "noise duration should be greater than 0"));

        addArgument(noiseDuration);

        noiseMultiplier = new DoubleArgument(null, "--noise-multiplier",
                "Standard deviation of the burst noise as a multiple of the baseline noise.",
                FaultInjector.DEFAULT_NOISE_MULTIPLIER,
                x -> checkArgument(x >= 0, "noise multiplier should be greater/equal than 0"));

        addArgument(noiseMultiplier);

        slopes = new Argument<>(null, "--slopes", "Comma-separated ramp slopes of the sensitivity sweep in mm/day.",
                SyntheticBenchmark.DEFAULT_SLOPES, BenchmarkArgumentParser::parseSlopes);

        addArgument(slopes);

        exampleSlopes = new Argument<>(null, "--example-slopes",
                "Comma-separated ramp slopes of the demonstration trials in mm/day.",
                SyntheticBenchmark.DEMONSTRATION_SLOPES, BenchmarkArgumentParser::parseSlopes);

        addArgument(exampleSlopes);
    }

    static List<Double> parseSlopes(String value) {
        List<Double> result = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.trim().isEmpty()) {
                double slope = Double.parseDouble(part.trim());
                checkArgument(slope >= 0, "slopes should be greater/equal than 0");
                result.add(slope);
            }
        }
        checkArgument(!result.isEmpty(), "at least one slope is required");
        return Collections.unmodifiableList(result);
    }

    @Override
    protected String getArchiveName() {
        return ARCHIVE_NAME;
    }

    @Override
    public String getOutputDirectory() {
        return outputDirectory.getValue();
    }

    public int getDays() {
        return days.getValue();
    }

    public double getNoiseLevel() {
        return noiseLevel.getValue();
    }

    public double getSeasonalAmplitude() {
        return seasonalAmplitude.getValue();
    }

    public double getStepMagnitude() {
        return stepMagnitude.getValue();
    }

    public int getRampDuration() {
        return rampDuration.getValue();
    }

    public int getNoiseDuration() {
        return noiseDuration.getValue();
    }

    public double getNoiseMultiplier() {
        return noiseMultiplier.getValue();
    }

    public List<Double> getSlopes() {
        return slopes.getValue();
    }

    public List<Double> getExampleSlopes() {
        return exampleSlopes.getValue();
    }
}
