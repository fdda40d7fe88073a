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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class TrialResult {

    private final SyntheticTrial trial;
    private final boolean[] detected;
    private final double recallPercent;
    private final Map<FaultType, Double> faultRecallPercent;

    public TrialResult(SyntheticTrial trial, boolean[] detected) {
        this.trial = trial;
        this.detected = Arrays.copyOf(detected, detected.length);
        this.recallPercent = SyntheticBenchmark.recallPercent(trial.getGroundTruth(), detected);
        Map<FaultType, Double> perFault = new EnumMap<>(FaultType.class);
        for (InjectedFault fault : trial.getFaults()) {
            perFault.put(fault.getType(), SyntheticBenchmark.recallPercent(fault, detected));
        }
        this.faultRecallPercent = Collections.unmodifiableMap(perFault);
    }

    public SyntheticTrial getTrial() {
        return trial;
    }

    public boolean[] getDetected() {
        return Arrays.copyOf(detected, detected.length);
    }

    public int getDetectedCount() {
        int count = 0;
        for (boolean flag : detected) {
            count += flag ? 1 : 0;
        }
        return count;
    }

    /**
     * @return the percentage of anomalous days, over all faults, that were
     *         detected
     */
    public double getRecallPercent() {
        return recallPercent;
    }

    /**
     * @param type a fault archetype
     * @return the percentage of the days marked by this fault that were detected,
     *         empty if the fault was not injected
     */
    public Optional<Double> getRecallPercent(FaultType type) {
        return Optional.ofNullable(faultRecallPercent.get(type));
    }
}
