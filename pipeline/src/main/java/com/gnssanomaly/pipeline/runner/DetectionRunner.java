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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.pipeline.GnssAnomalyPipeline;
import com.gnssanomaly.pipeline.PipelineResult;
import com.gnssanomaly.pipeline.io.ReconciliationCsvWriter;
import com.gnssanomaly.pipeline.io.ReportJsonWriter;
import com.gnssanomaly.pipeline.io.ResultCsvWriter;
import com.gnssanomaly.pipeline.io.StationCsvReader;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.model.StationSeries;
import com.gnssanomaly.pipeline.validation.StationReconciliation;

/**
 * Runs anomaly detection over a directory of station files and writes the
 * labeled matrix, the JSON report and one reconciliation table per station.
 */
public class DetectionRunner {

    private static final Logger LOG = LogManager.getLogger(DetectionRunner.class);

    public static final String RESULTS_FILE = "gnss_anomalies.csv";
    public static final String REPORT_FILE = "report.json";
    public static final String RECONCILIATION_DIRECTORY = "reconciliation";

    protected final ArgumentParser argumentParser;

    public DetectionRunner() {
        this(new ArgumentParser(DetectionRunner.class.getName(),
                "Detect anomalous days in the residual motion of every station and audit them with the "
                        + "modified z-score."));
    }

    public DetectionRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        DetectionRunner runner = new DetectionRunner();
        runner.parse(args);
        runner.run();
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public GnssAnomalyPipeline buildPipeline() {
        GnssAnomalyPipeline.Builder builder = GnssAnomalyPipeline.builder()
                .contamination(argumentParser.getContamination()).numberOfTrees(argumentParser.getNumberOfTrees())
                .sampleSize(argumentParser.getSampleSize()).randomSeed(argumentParser.getRandomSeed())
                .madThreshold(argumentParser.getMadThreshold()).seasonalPeriod(argumentParser.getSeasonalPeriod())
                .gapLimit(argumentParser.getGapLimit()).activityEpsilon(argumentParser.getActivityEpsilon())
                .parallelExecutionEnabled(argumentParser.getParallelExecutionEnabled());
        argumentParser.getThreadPoolSize().ifPresent(builder::threadPoolSize);
        Optional<Axis> validationAxis = argumentParser.getValidationAxis();
        if (validationAxis.isPresent()) {
            builder.validationAxis(validationAxis.get());
        } else {
            builder.validateAllAxes(true);
        }
        return builder.build();
    }

    /**
     * Reads the input directory, runs the pipeline and writes all outputs.
     *
     * @return the result of the run
     * @throws IOException if reading or writing fails
     */
    public PipelineResult run() throws IOException {
        Path input = Paths.get(argumentParser.getInputDirectory());
        Path output = Paths.get(argumentParser.getOutputDirectory());

        List<StationSeries> stations = new StationCsvReader().readDirectory(input);
        if (stations.isEmpty()) {
            throw new IOException("no station files in " + input);
        }
        PipelineResult result = buildPipeline().run(stations);

        Files.createDirectories(output);
        new ResultCsvWriter().write(result.getNormalized(), result.getScoring(), output.resolve(RESULTS_FILE));
        new ReportJsonWriter().write(result, output.resolve(REPORT_FILE));

        Path reconciliationDirectory = output.resolve(RECONCILIATION_DIRECTORY);
        Files.createDirectories(reconciliationDirectory);
        ReconciliationCsvWriter reconciliationWriter = new ReconciliationCsvWriter();
        for (StationReconciliation reconciliation : result.getValidation().getStations().values()) {
            reconciliationWriter.write(result.getNormalized(), reconciliation,
                    reconciliationDirectory.resolve(reconciliation.getStation() + ".csv"));
        }
        LOG.info("results written to {}", output.toAbsolutePath());
        return result;
    }
}
