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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A labeled synthetic series: the signal in millimetres, the ground truth of
 * every day and the faults that produced it.
 */
public class SyntheticTrial {

    private final double[] signal;
    private final int[] groundTruth;
    private final List<InjectedFault> faults;

    public SyntheticTrial(double[] signal, int[] groundTruth, List<InjectedFault> faults) {
        checkNotNull(signal, "signal must not be null");
        checkNotNull(groundTruth, "groundTruth must not be null");
        checkArgument(signal.length == groundTruth.length, "signal and groundTruth must have the same length");
        this.signal = Arrays.copyOf(signal, signal.length);
        this.groundTruth = Arrays.copyOf(groundTruth, groundTruth.length);
        this.faults = Collections.unmodifiableList(new ArrayList<>(faults));
    }

    public double[] getSignal() {
        return Arrays.copyOf(signal, signal.length);
    }

    /**
     * @return 1 on anomalous days, 0 elsewhere
     */
    public int[] getGroundTruth() {
        return Arrays.copyOf(groundTruth, groundTruth.length);
    }

    public List<InjectedFault> getFaults() {
        return faults;
    }

    public Optional<InjectedFault> getFault(FaultType type) {
        return faults.stream().filter(f -> f.getType() == type).findFirst();
    }

    public int length() {
        return signal.length;
    }

    public int getPositiveCount() {
        return Arrays.stream(groundTruth).sum();
    }
}
