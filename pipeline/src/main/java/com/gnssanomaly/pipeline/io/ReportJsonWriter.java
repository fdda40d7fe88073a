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

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gnssanomaly.pipeline.PipelineResult;

/**
 * Writes the {@link DetectionReport} of a run as JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class ReportJsonWriter {

    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(PipelineResult result, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }

    public void write(PipelineResult result, Writer writer) throws IOException {
        mapper.writeValue(writer, new DetectionReport(result));
    }

    public String toJson(PipelineResult result) throws IOException {
        return mapper.writeValueAsString(new DetectionReport(result));
    }
}
