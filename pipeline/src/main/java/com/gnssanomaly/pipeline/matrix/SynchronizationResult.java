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

package com.gnssanomaly.pipeline.matrix;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Getter;

import com.gnssanomaly.pipeline.decomposition.DecomposedSeries;

/**
 * The stations decomposed by a {@link Synchronizer}, the stations that failed
 * with the message of their error, and the combined residual matrix of the
 * decomposed ones.
 */
@Getter
public class SynchronizationResult {

    private final SortedMap<String, DecomposedSeries> decomposed;
    private final SortedMap<String, String> failures;
    private final CombinedMatrix matrix;

    public SynchronizationResult(SortedMap<String, DecomposedSeries> decomposed, SortedMap<String, String> failures,
            CombinedMatrix matrix) {
        this.decomposed = Collections.unmodifiableSortedMap(new TreeMap<>(decomposed));
        this.failures = Collections.unmodifiableSortedMap(new TreeMap<>(failures));
        this.matrix = matrix;
    }
}
