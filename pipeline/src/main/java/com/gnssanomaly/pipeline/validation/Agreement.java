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

/**
 * How the anomaly model and the robust statistic judged one day.
 */
public enum Agreement {

    BOTH_ANOMALOUS, MODEL_ONLY, STATISTIC_ONLY, BOTH_NORMAL;

    public static Agreement of(boolean model, boolean statistic) {
        if (model) {
            return statistic ? BOTH_ANOMALOUS : MODEL_ONLY;
        }
        return statistic ? STATISTIC_ONLY : BOTH_NORMAL;
    }

    public boolean isModelAnomalous() {
        return this == BOTH_ANOMALOUS || this == MODEL_ONLY;
    }

    public boolean isStatisticAnomalous() {
        return this == BOTH_ANOMALOUS || this == STATISTIC_ONLY;
    }
}
