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

package com.gnssanomaly.pipeline.scoring;

/**
 * The verdict of the anomaly scorer for one day of one station. The codes are
 * those written to result files.
 */
public enum AnomalyLabel {

    NORMAL(1), ANOMALOUS(-1);

    private final int code;

    AnomalyLabel(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isAnomalous() {
        return this == ANOMALOUS;
    }

    public static AnomalyLabel of(boolean anomalous) {
        return anomalous ? ANOMALOUS : NORMAL;
    }
}
