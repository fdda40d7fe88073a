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

package com.gnssanomaly.pipeline.decomposition;

/**
 * Why an axis was detrended by a straight line instead of being decomposed.
 */
public enum DegradationReason {

    /**
     * Fewer than two seasonal periods of samples are available.
     */
    INSUFFICIENT_HISTORY,

    /**
     * Too large a fraction of the calendar is missing after gap filling.
     */
    FRAGMENTED_CALENDAR,

    /**
     * The seasonal decomposition raised an error.
     */
    DECOMPOSITION_FAILED,

    /**
     * Too few samples to fit even a line; the residual is entirely missing.
     */
    INSUFFICIENT_SAMPLES
}
