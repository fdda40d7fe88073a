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

package com.gnssanomaly.pipeline.runner;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import com.gnssanomaly.IsolationForest;
import com.gnssanomaly.pipeline.decomposition.Decomposer;
import com.gnssanomaly.pipeline.matrix.ActivityMask;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.validation.RobustValidator;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/gnss-anomaly-pipeline-1.0.0.jar";

    /**
     * Value of the validation axis flag that audits every axis.
     */
    public static final String ALL_AXES = "ALL";

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final DoubleArgument contamination;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final IntegerArgument randomSeed;
    private final BooleanArgument parallelExecutionEnabled;
    private final IntegerArgument threadPoolSize;
    private final StringArgument inputDirectory;
    private final StringArgument outputDirectory;
    private final DoubleArgument madThreshold;
    private final IntegerArgument seasonalPeriod;
    private final IntegerArgument gapLimit;
    private final DoubleArgument activityEpsilon;
    private final StringArgument validationAxis;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this(runnerClass, runnerDescription, IsolationForest.DEFAULT_CONTAMINATION);
    }

    protected ArgumentParser(String runnerClass, String runnerDescription, double defaultContamination) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        contamination = new DoubleArgument("-c", "--contamination", "Expected fraction of anomalous days.",
                defaultContamination, x -> checkArgument(x > 0 && x <= 0.5, "contamination should be in (0, 0.5]"));

        addArgument(contamination);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees to use in each forest.",
                IsolationForest.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));

        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size", "Largest number of days each tree is built from.",
                IsolationForest.DEFAULT_SAMPLE_SIZE, n -> checkArgument(n > 1, "sample size should be greater than 1"));

        addArgument(sampleSize);

        randomSeed = new IntegerArgument(null, "--random-seed", "Random seed to use in the forests.",
                (int) IsolationForest.DEFAULT_RANDOM_SEED);

        addArgument(randomSeed);

        parallelExecutionEnabled = new BooleanArgument("-p", "--parallel-execution-enabled",
                "Set to 'true' to process stations in parallel.",
                IsolationForest.DEFAULT_PARALLEL_EXECUTION_ENABLED);

        addArgument(parallelExecutionEnabled);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of threads when parallel execution is enabled, or 0 for one less than the processors.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be greater/equal than 0"));

        addArgument(threadPoolSize);

        inputDirectory = new StringArgument("-i", "--input-dir", "Directory of <STATION>.csv files.", "data/processed");

        addArgument(inputDirectory);

        outputDirectory = new StringArgument("-o", "--output-dir", "Directory the results are written to.",
                "data/results");

        addArgument(outputDirectory);

        madThreshold = new DoubleArgument("-m", "--mad-threshold",
                "Absolute modified z-score above which the statistic flags a day.", RobustValidator.DEFAULT_THRESHOLD,
                x -> checkArgument(x > 0, "MAD threshold should be greater than 0"));

        addArgument(madThreshold);

        seasonalPeriod = new IntegerArgument(null, "--seasonal-period", "Seasonal period in days.",
                Decomposer.DEFAULT_SEASONAL_PERIOD, n -> checkArgument(n >= 3, "seasonal period should be at least 3"));

        addArgument(seasonalPeriod);

        gapLimit = new IntegerArgument("-g", "--gap-limit", "Longest run of missing days that is interpolated.",
                Decomposer.DEFAULT_GAP_LIMIT, n -> checkArgument(n >= 0, "gap limit should be greater/equal than 0"));

        addArgument(gapLimit);

        activityEpsilon = new DoubleArgument(null, "--activity-epsilon",
                "Smallest summed absolute residual, in millimetres, of an active day.", ActivityMask.DEFAULT_EPSILON,
                x -> checkArgument(x >= 0, "activity epsilon should be greater/equal than 0"));

        addArgument(activityEpsilon);

        validationAxis = new StringArgument("-a", "--validation-axis",
                "Axis audited by the robust statistic: EAST, NORTH, UP or ALL.", RobustValidator.DEFAULT_AXIS.name(),
                ArgumentParser::checkAxis);

        addArgument(validationAxis);
    }

    private static void checkAxis(String value) {
        String axis = value.toUpperCase(Locale.ROOT);
        if (!ALL_AXES.equals(axis)) {
            Axis.valueOf(axis);
        }
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Remove the argument with the given long flag. This allows subclasses to
     * suppress arguments they do not use. The argument keeps its default value.
     *
     * @param longFlag The long flag corresponding to the argument being removed
     */
    protected void removeArgument(String longFlag) {
        Argument<?> argument = longFlags.get(longFlag);
        if (argument != null) {
            longFlags.remove(longFlag);
            if (argument.getShortFlag() != null) {
                shortFlags.remove(argument.getShortFlag());
            }
        }
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options]", getArchiveName(), runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    protected String getArchiveName() {
        return ARCHIVE_NAME;
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    public int getSampleSize() {
        return sampleSize.getValue();
    }

    public int getRandomSeed() {
        return randomSeed.getValue();
    }

    public boolean getParallelExecutionEnabled() {
        return parallelExecutionEnabled.getValue();
    }

    /**
     * @return the user-specified thread pool size, empty for the default
     */
    public Optional<Integer> getThreadPoolSize() {
        int value = threadPoolSize.getValue();
        return value > 0 ? Optional.of(value) : Optional.empty();
    }

    public String getInputDirectory() {
        return inputDirectory.getValue();
    }

    public String getOutputDirectory() {
        return outputDirectory.getValue();
    }

    public double getMadThreshold() {
        return madThreshold.getValue();
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod.getValue();
    }

    public int getGapLimit() {
        return gapLimit.getValue();
    }

    public double getActivityEpsilon() {
        return activityEpsilon.getValue();
    }

    /**
     * @return the audited axis, empty when every axis is audited
     */
    public Optional<Axis> getValidationAxis() {
        String axis = validationAxis.getValue().toUpperCase(Locale.ROOT);
        return ALL_AXES.equals(axis) ? Optional.empty() : Optional.of(Axis.valueOf(axis));
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
