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

package com.gnssanomaly.pipeline.model;

/**
 * The three displacement axes of a station in its local east-north-up frame.
 * Each axis names its displacement column and its formal uncertainty column.
 */
public enum Axis {

    EAST("east", "sigmaEast"), NORTH("north", "sigmaNorth"), UP("up", "sigmaUp");

    private final String suffix;
    private final String sigmaSuffix;

    Axis(String suffix, String sigmaSuffix) {
        this.suffix = suffix;
        this.sigmaSuffix = sigmaSuffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getSigmaSuffix() {
        return sigmaSuffix;
    }

    /**
     * @param station the station name
     * @return the displacement column of this axis, for example {@code WROC_up}
     */
    public String column(String station) {
        return station + "_" + suffix;
    }

    /**
     * @param station the station name
     * @return the uncertainty column of this axis, for example {@code WROC_sigmaUp}
     */
    public String sigmaColumn(String station) {
        return station + "_" + sigmaSuffix;
    }

    public double displacementOf(StationRecord record) {
        switch (this) {
        case EAST:
            return record.getEast();
        case NORTH:
            return record.getNorth();
        default:
            return record.getUp();
        }
    }

    public double sigmaOf(StationRecord record) {
        switch (this) {
        case EAST:
            return record.getSigmaEast();
        case NORTH:
            return record.getSigmaNorth();
        default:
            return record.getSigmaUp();
        }
    }
}
