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

import static com.gnssanomaly.CommonUtils.checkArgument;
import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Optional;

/**
 * The outcome of removing long-term motion from one axis of a station. Either
 * the full seasonal decomposition succeeded ({@link Decomposed}) or the axis
 * was detrended by a straight line ({@link Detrended}) for a recorded reason.
 * All arrays are aligned with the station calendar; NaN marks days that were
 * neither observed nor interpolated.
 */
public abstract class DecompositionResult {

    private final double[] trend;
    private final double[] residual;

    protected DecompositionResult(double[] trend, double[] residual) {
        checkNotNull(trend, "trend must not be null");
        checkNotNull(residual, "residual must not be null");
        checkArgument(trend.length == residual.length, "trend and residual must have the same length");
        this.trend = trend;
        this.residual = residual;
    }

    public static Decomposed decomposed(double[] trend, double[] seasonal, double[] residual) {
        return new Decomposed(trend, seasonal, residual);
    }

    public static Detrended detrended(double[] trend, double[] residual, DegradationReason reason) {
        return new Detrended(trend, residual, reason);
    }

    /**
     * @return true if the axis fell back to linear detrending
     */
    public abstract boolean isDegraded();

    /**
     * @return the reason of the fallback, empty for a full decomposition
     */
    public abstract Optional<DegradationReason> getReason();

    public double[] getTrend() {
        return Arrays.copyOf(trend, trend.length);
    }

    public double[] getResidual() {
        return Arrays.copyOf(residual, residual.length);
    }

    public int length() {
        return residual.length;
    }

    public static final class Decomposed extends DecompositionResult {

        private final double[] seasonal;

        private Decomposed(double[] trend, double[] seasonal, double[] residual) {
            super(trend, residual);
            checkArgument(seasonal != null && seasonal.length == residual.length,
                    "seasonal must have the same length as the residual");
            this.seasonal = seasonal;
        }

        public double[] getSeasonal() {
            return Arrays.copyOf(seasonal, seasonal.length);
        }

        @Override
        public boolean isDegraded() {
            return false;
        }

        @Override
        public Optional<DegradationReason> getReason() {
            return Optional.empty();
        }
    }

    public static final class Detrended extends DecompositionResult {

        private final DegradationReason reason;

        private Detrended(double[] trend, double[] residual, DegradationReason reason) {
            super(trend, residual);
            this.reason = checkNotNull(reason, "reason must not be null");
        }

        @Override
        public boolean isDegraded() {
            return true;
        }

        @Override
        public Optional<DegradationReason> getReason() {
            return Optional.of(reason);
        }
    }
}
