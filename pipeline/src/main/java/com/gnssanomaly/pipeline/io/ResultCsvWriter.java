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

package com.gnssanomaly.pipeline.io;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.scoring.AnomalyLabel;
import com.gnssanomaly.pipeline.scoring.ScoringReport;
import com.gnssanomaly.pipeline.scoring.StationScoringResult;

/**
 * Writes the normalized matrix with one {@code <station>_anomaly} column per
 * scored station: {@code -1} on anomalous days and {@code 1} otherwise. Missing
 * values are written as empty fields.
 */
public class ResultCsvWriter {

    public static final String ANOMALY_SUFFIX = "_anomaly";

    private final String delimiter;

    public ResultCsvWriter() {
        this(",");
    }

    public ResultCsvWriter(String delimiter) {
        this.delimiter = delimiter;
    }

    public void write(CombinedMatrix matrix, ScoringReport report, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(matrix, report, writer);
        }
    }

    public void write(CombinedMatrix matrix, ScoringReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        List<String> names = matrix.getColumnNames();
        List<double[]> columns = new ArrayList<>();
        for (String name : names) {
            columns.add(matrix.getColumn(name));
        }
        List<StationScoringResult> scored = new ArrayList<>();
        List<AnomalyLabel[]> labels = new ArrayList<>();
        for (StationScoringResult result : report.getResults().values()) {
            if (result.isScored()) {
                scored.add(result);
                labels.add(result.getLabels());
            }
        }

        StringJoiner header = new StringJoiner(delimiter);
        header.add("date");
        names.forEach(header::add);
        scored.forEach(result -> header.add(result.getStation() + ANOMALY_SUFFIX));
        out.println(header.toString());

        for (int row = 0; row < matrix.getRowCount(); row++) {
            StringJoiner joiner = new StringJoiner(delimiter);
            joiner.add(matrix.getDates().get(row).toString());
            for (double[] column : columns) {
                joiner.add(format(column[row]));
            }
            for (AnomalyLabel[] stationLabels : labels) {
                joiner.add(Integer.toString(stationLabels[row].getCode()));
            }
            out.println(joiner.toString());
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("failed to write results");
        }
    }

    static String format(double value) {
        return Double.isNaN(value) ? "" : Double.toString(value);
    }
}
