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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class StationSeriesTest {

    private static StationRecord record(LocalDate date, double up) {
        return new StationRecord(date, 0.001, 0.002, up, 0.1, 0.2, 0.3);
    }

    @Test
    public void testCalendarWithGaps() {
        LocalDate start = LocalDate.of(2020, 2, 27);
        StationSeries series = new StationSeries("WROC",
                Arrays.asList(record(start, 1.0), record(start.plusDays(1), 2.0), record(start.plusDays(4), 5.0)));

        assertEquals(3, series.size());
        assertEquals(5, series.getCalendarLength());
        assertEquals(start.plusDays(4), series.getLastDate());

        double[] up = series.toCalendar(Axis.UP::displacementOf);
        assertEquals(1.0, up[0]);
        assertEquals(2.0, up[1]);
        assertTrue(Double.isNaN(up[2]));
        assertTrue(Double.isNaN(up[3]));
        assertEquals(5.0, up[4]);

        double[] sigma = series.toCalendar(Axis.NORTH::sigmaOf);
        assertEquals(0.2, sigma[0]);
    }

    @Test
    public void testDatesMustIncrease() {
        LocalDate date = LocalDate.of(2021, 1, 1);
        assertThrows(IllegalArgumentException.class,
                () -> new StationSeries("BOGO", Arrays.asList(record(date, 1.0), record(date, 2.0))));
        assertThrows(IllegalArgumentException.class, () -> new StationSeries("BOGO",
                Arrays.asList(record(date.plusDays(1), 1.0), record(date, 2.0))));
        List<StationRecord> none = new ArrayList<>();
        assertThrows(IllegalArgumentException.class, () -> new StationSeries("BOGO", none));
        assertThrows(IllegalArgumentException.class, () -> new StationSeries("", Arrays.asList(record(date, 1.0))));
    }

    @Test
    public void testAxisColumns() {
        assertEquals("WROC_east", Axis.EAST.column("WROC"));
        assertEquals("WROC_sigmaUp", Axis.UP.sigmaColumn("WROC"));
        StationRecord record = record(LocalDate.of(2021, 1, 1), 3.0);
        assertEquals(0.001, Axis.EAST.displacementOf(record));
        assertEquals(3.0, Axis.UP.displacementOf(record));
        assertEquals(0.1, Axis.EAST.sigmaOf(record));
        assertEquals(0.3, Axis.UP.sigmaOf(record));
    }
}
