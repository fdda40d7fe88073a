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
import java.util.Map;
import java.util.StringJoiner;

import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.validation.Agreement;
import com.gnssanomaly.pipeline.validation.StationReconciliation;

/**
 * Writes the day-by-day comparison of one station: the millimetre residual and
 * modified z-score of every audited axis, both verdicts and their agreement.
 */
public class ReconciliationCsvWriter {

    public void write(CombinedMatrix matrix, StationReconciliation reconciliation, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(matrix, reconciliation, writer);
        }
    }

    public void write(CombinedMatrix matrix, StationReconciliation reconciliation, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        String station = reconciliation.getStation();
        Map<Axis, double[]> scores = reconciliation.getScores();
        List<Axis> axes = new ArrayList<>(scores.keySet());
        List<double[]> values = new ArrayList<>();
        for (Axis axis : axes) {
            values.add(matrix.getColumn(axis.column(station)));
        }

        StringJoiner header = new StringJoiner(",");
        header.add("date");
        for (Axis axis : axes) {
            header.add(axis.getSuffix() + "_mm");
            header.add(axis.getSuffix() + "_score");
        }
        header.add("model").add("statistic").add("agreement");
        out.println(header.toString());

        Agreement[] agreements = reconciliation.getAgreements();
        for (int row = 0; row < agreements.length; row++) {
            StringJoiner joiner = new StringJoiner(",");
            joiner.add(matrix.getDates().get(row).toString());
            for (int a = 0; a < axes.size(); a++) {
                joiner.add(ResultCsvWriter.format(values.get(a)[row]));
                joiner.add(Double.toString(scores.get(axes.get(a))[row]));
            }
            Agreement agreement = agreements[row];
            joiner.add(verdict(agreement.isModelAnomalous())).add(verdict(agreement.isStatisticAnomalous()))
                    .add(agreement.name());
            out.println(joiner.toString());
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("failed to write reconciliation of station " + station);
        }
    }

    private static String verdict(boolean anomalous) {
        return anomalous ? "ANOMALY" : "OK";
    }
}
