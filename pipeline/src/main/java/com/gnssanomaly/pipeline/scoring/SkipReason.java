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
 * Why a station was not scored.
 */
public enum SkipReason {

    /**
     * One of the standardized displacement columns of the station is absent.
     */
    MISSING_FEATURE_COLUMNS,

    /**
     * The station has no active day to train on.
     */
    NO_ACTIVE_DAYS,

    /**
     * Fitting or labeling raised an error.
     */
    SCORING_FAILED
}
