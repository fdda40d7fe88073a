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

package com.gnssanomaly.pipeline.io;

import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.gnssanomaly.pipeline.model.StationRecord;
import com.gnssanomaly.pipeline.model.StationSeries;

/**
 * Reads station series from comma-separated files with a header row naming the
 * columns {@code date,east,north,up,sigmaE,sigmaN,sigmaU}; other columns are
 * ignored. Dates are ISO dates, optionally followed by a time. Displacements
 * are in meters; an empty field or {@code NaN} is a missing value.
 * <p>
 * Unreadable rows are skipped with a warning. Rows are sorted by date and the
 * first row of a repeated date wins.
 */
public class StationCsvReader {

    private static final Logger LOG = LogManager.getLogger(StationCsvReader.class);

    public static final String FILE_EXTENSION = ".csv";

    static final String[] COLUMNS = { "date", "east", "north", "up", "sigmaE", "sigmaN", "sigmaU" };

    private final String delimiter;

    public StationCsvReader() {
        this(",");
    }

    public StationCsvReader(String delimiter) {
        this.delimiter = checkNotNull(delimiter, "delimiter must not be null");
    }

    /**
     * Reads every {@code <STATION>.csv} file of a directory. Files without a
     * readable row are left out.
     *
     * @param directory the directory
     * @return the series, ordered by station name
     * @throws IOException if the directory or a file cannot be read, or a file has
     *                     no valid header
     */
    public List<StationSeries> readDirectory(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(FILE_EXTENSION)).sorted()
                    .collect(Collectors.toList());
        }
        List<StationSeries> stations = new ArrayList<>();
        for (Path file : files) {
            read(file).ifPresent(stations::add);
        }
        LOG.info("read {} stations from {}", stations.size(), directory);
        return stations;
    }

    /**
     * @param file a station file, named after the station
     * @return the series, empty if the file has no readable row
     * @throws IOException if the file cannot be read or has no valid header
     */
    public Optional<StationSeries> read(Path file) throws IOException {
        String name = file.getFileName().toString();
        String station = name.endsWith(FILE_EXTENSION) ? name.substring(0, name.length() - FILE_EXTENSION.length())
                : name;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(station, reader);
        }
    }

    /**
     * @param station the station name
     * @param reader  the file content
     * @return the series, empty if there is no readable row
     * @throws IOException if the content cannot be read or has no valid header
     */
    public Optional<StationSeries> read(String station, Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String header = in.readLine();
        if (header == null) {
            throw new IOException("station " + station + ": empty file");
        }
        int[] index = columnIndexes(station, header.trim().split(Pattern.quote(delimiter), -1));

        TreeMap<LocalDate, StationRecord> records = new TreeMap<>();
        String line;
        int lineNumber = 1;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(Pattern.quote(delimiter), -1);
            try {
                StationRecord record = parseRecord(values, index);
                if (records.putIfAbsent(record.getDate(), record) != null) {
                    LOG.warn("station {} line {}: repeated date {}, keeping the first record", station, lineNumber,
                            record.getDate());
                }
            } catch (IllegalArgumentException | DateTimeParseException | ArrayIndexOutOfBoundsException e) {
                LOG.warn("station {} line {}: skipping unreadable row ({})", station, lineNumber, e.getMessage());
            }
        }

        if (records.isEmpty()) {
            LOG.warn("station {}: no readable rows", station);
            return Optional.empty();
        }
        return Optional.of(new StationSeries(station, new ArrayList<>(records.values())));
    }

    private static int[] columnIndexes(String station, String[] header) throws IOException {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            positions.putIfAbsent(header[i].trim(), i);
        }
        int[] index = new int[COLUMNS.length];
        for (int i = 0; i < COLUMNS.length; i++) {
            Integer position = positions.get(COLUMNS[i]);
            if (position == null) {
                throw new IOException("station " + station + ": missing column " + COLUMNS[i]);
            }
            index[i] = position;
        }
        return index;
    }

    private static StationRecord parseRecord(String[] values, int[] index) {
        String date = values[index[0]].trim();
        if (date.length() > 10) {
            date = date.substring(0, 10);
        }
        return new StationRecord(LocalDate.parse(date), parseValue(values[index[1]]), parseValue(values[index[2]]),
                parseValue(values[index[3]]), parseValue(values[index[4]]), parseValue(values[index[5]]),
                parseValue(values[index[6]]));
    }

    private static double parseValue(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Double.NaN : Double.parseDouble(trimmed);
    }
}
