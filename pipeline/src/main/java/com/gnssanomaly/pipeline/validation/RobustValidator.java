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

package com.gnssanomaly.pipeline.validation;

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.pipeline.matrix.CombinedMatrix;
import com.gnssanomaly.pipeline.model.Axis;
import com.gnssanomaly.pipeline.scoring.AnomalyLabel;
import com.gnssanomaly.pipeline.scoring.ScoringReport;
import com.gnssanomaly.pipeline.scoring.StationScoringResult;

/**
 * Audits the anomaly model with the modified z-score of Iglewicz and Hoaglin,
 * a statistic that does not depend on the model:
 * {@code 0.6745 * (x - median) / MAD}, where MAD is the median absolute
 * deviation from the median. A day is flagged when the absolute score of an
 * audited axis exceeds the threshold.
 */
public class RobustValidator {

    private static final Logger LOG = LogManager.getLogger(RobustValidator.class);

    /**
     * The 0.75 quantile of the standard normal distribution; scales the MAD to
     * a standard deviation.
     */
    public static final double CONSISTENCY_CONSTANT = 0.6745;

    public static final double DEFAULT_THRESHOLD = 3.5;

    public static final Axis DEFAULT_AXIS = Axis.UP;

    private final double threshold;
    private final Set<Axis> auditedAxes;

    public RobustValidator() {
        this(DEFAULT_THRESHOLD, EnumSet.of(DEFAULT_AXIS));
    }

    /**
     * @param threshold   the absolute score above which a day is flagged
     * @param auditedAxes the axes whose millimetre residuals are audited; a day is
     *                    flagged if any of them is
     */
    public RobustValidator(double threshold, Collection<Axis> auditedAxes) {
        checkArgument(threshold > 0, "threshold must be positive");
        checkArgument(auditedAxes != null && !auditedAxes.isEmpty(), "at least one axis must be audited");
        this.threshold = threshold;
        this.auditedAxes = Collections.unmodifiableSet(EnumSet.copyOf(auditedAxes));
    }

    /**
     * Computes modified z-scores. Missing values are ignored for the median and
     * the MAD and score 0. When the MAD is 0 every score is 0.
     *
     * @param values a series, NaN where missing
     * @return one score per value
     */
    public static double[] modifiedZScores(double[] values) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        double[] scores = new double[values.length];
        if (present.length == 0) {
            return scores;
        }
        Median median = new Median();
        double center = median.evaluate(present);
        double[] deviations = new double[present.length];
        for (int i = 0; i < present.length; i++) {
            deviations[i] = Math.abs(present[i] - center);
        }
        double mad = median.evaluate(deviations);
        if (mad == 0) {
            return scores;
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                scores[i] = CONSISTENCY_CONSTANT * (values[i] - center) / mad;
            }
        }
        return scores;
    }

    /**
     * @param scores modified z-scores
     * @return true where the absolute score exceeds the threshold
     */
    public boolean[] flag(double[] scores) {
        boolean[] flags = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = Math.abs(scores[i]) > threshold;
        }
        return flags;
    }

    /**
     * Compares the model labels of one station with the statistic computed on
     * its millimetre residuals.
     *
     * @param station the station
     * @param values  the millimetre residuals of each audited axis
     * @param labels  the model labels, one per day
     * @return the reconciliation of the station
     */
    public StationReconciliation reconcile(String station, Map<Axis, double[]> values, AnomalyLabel[] labels) {
        checkNotNull(labels, "labels must not be null");
        Map<Axis, double[]> scores = new EnumMap<>(Axis.class);
        boolean[] statistic = new boolean[labels.length];
        for (Axis axis : auditedAxes) {
            double[] column = values.get(axis);
            checkArgument(column != null && column.length == labels.length,
                    "station " + station + " has no " + axis + " values matching its labels");
            double[] axisScores = modifiedZScores(column);
            boolean[] axisFlags = flag(axisScores);
            for (int i = 0; i < statistic.length; i++) {
                statistic[i] |= axisFlags[i];
            }
            scores.put(axis, axisScores);
        }

        Agreement[] agreements = new Agreement[labels.length];
        for (int i = 0; i < labels.length; i++) {
            agreements[i] = Agreement.of(labels[i].isAnomalous(), statistic[i]);
        }
        return new StationReconciliation(station, agreements, scores);
    }

    /**
     * Reconciles every scored station. Skipped stations are left out.
     *
     * @param matrix the normalized matrix the stations were scored on
     * @param report the scoring report
     * @return the reconciliation of every scored station
     */
    public ValidationReport validate(CombinedMatrix matrix, ScoringReport report) {
        SortedMap<String, StationReconciliation> stations = new TreeMap<>();
        for (StationScoringResult result : report.getResults().values()) {
            if (!result.isScored()) {
                continue;
            }
            Map<Axis, double[]> values = new EnumMap<>(Axis.class);
            for (Axis axis : auditedAxes) {
                values.put(axis, matrix.getColumn(axis.column(result.getStation())));
            }
            StationReconciliation reconciliation = reconcile(result.getStation(), values, result.getLabels());
            LOG.info("station {}: model {}, statistic {}, both {}", result.getStation(),
                    reconciliation.getModelAnomalies(), reconciliation.getStatisticAnomalies(),
                    reconciliation.getCount(Agreement.BOTH_ANOMALOUS));
            stations.put(result.getStation(), reconciliation);
        }
        return new ValidationReport(stations);
    }

    static double jaccard(int intersection, int union) {
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    public double getThreshold() {
        return threshold;
    }

    public Set<Axis> getAuditedAxes() {
        return auditedAxes;
    }
}
