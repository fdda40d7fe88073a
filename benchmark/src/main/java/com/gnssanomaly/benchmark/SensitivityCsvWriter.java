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

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes the sensitivity curve and the day-by-day tables of demonstration
 * trials.
 */
public class SensitivityCsvWriter {

    public void writeCurve(List<SensitivityPoint> curve, double referencePercent, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeCurve(curve, referencePercent, writer);
        }
    }

    /**
     * One row per slope with the overall and ramp recall, and whether the ramp
     * recall reaches the reference.
     */
    public void writeCurve(List<SensitivityPoint> curve, double referencePercent, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        out.println("slope,recall_percent,ramp_recall_percent,reference_percent,reaches_reference");
        for (SensitivityPoint point : curve) {
            out.println(String.join(",", Double.toString(point.getSlope()), format(point.getRecallPercent()),
                    format(point.getRampRecallPercent()), format(referencePercent),
                    Boolean.toString(point.reaches(referencePercent))));
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("failed to write the sensitivity curve");
        }
    }

    public void writeTrial(TrialResult result, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeTrial(result, writer);
        }
    }

    public void writeTrial(TrialResult result, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        double[] signal = result.getTrial().getSignal();
        int[] groundTruth = result.getTrial().getGroundTruth();
        boolean[] detected = result.getDetected();
        out.println("day,signal,ground_truth,detected");
        for (int t = 0; t < signal.length; t++) {
            out.println(t + "," + signal[t] + "," + groundTruth[t] + "," + (detected[t] ? 1 : 0));
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("failed to write the trial");
        }
    }

    static String format(double percent) {
        return String.format(Locale.ROOT, "%.1f", percent);
    }
}
