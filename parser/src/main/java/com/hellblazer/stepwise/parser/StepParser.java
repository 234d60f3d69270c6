/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Stepwise.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.stepwise.parser;

import com.hellblazer.stepwise.parser.properties.PropertyReader;
import com.hellblazer.stepwise.parser.spatial.SpatialTree;
import com.hellblazer.stepwise.parser.spatial.SpatialTreeBuilder;
import com.hellblazer.stepwise.parser.units.UnitScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Entry point for reading a STEP file: scan, then derive units, spatial tree and property index.
 * <p>
 * Progress phases, in order: {@value StepScanner#PHASE}, {@value #PHASE_UNITS}, {@value #PHASE_SPATIAL},
 * {@value #PHASE_PROPERTIES}, {@value #PHASE_COMPLETE}. Interrupting the parsing thread cancels the scan with
 * {@link StepException.Cancelled}.
 *
 * @author hal.hildebrand
 */
public class StepParser {
    public static final String PHASE_UNITS      = "units";
    public static final String PHASE_SPATIAL    = "spatial";
    public static final String PHASE_PROPERTIES = "properties";
    public static final String PHASE_COMPLETE   = "complete";

    private static final Logger log = LoggerFactory.getLogger(StepParser.class);

    private final ParserConfig config;

    public StepParser() {
        this(ParserConfig.defaultConfig());
    }

    public StepParser(ParserConfig config) {
        this.config = config;
    }

    public ParserConfig getConfig() {
        return config;
    }

    /**
     * Read a file as ISO-8859-1, so that every reported offset is also a byte offset. Non ASCII text in a STEP file
     * is carried by escape sequences, which the tokenizer decodes.
     */
    public ParsedModel parse(Path file) throws IOException {
        return parse(file, ProgressListener.NONE);
    }

    public ParsedModel parse(Path file, ProgressListener listener) throws IOException {
        log.info("Parsing {}", file);
        return parse(Files.readString(file, StandardCharsets.ISO_8859_1), listener);
    }

    public ParsedModel parse(String content) {
        return parse(content, ProgressListener.NONE);
    }

    /**
     * @throws StepException.MalformedRecord in strict mode, on the first record that cannot be read
     * @throws StepException.Cancelled       when the thread is interrupted while scanning
     */
    public ParsedModel parse(String content, ProgressListener listener) {
        var start = System.nanoTime();
        var errors = new ArrayList<StepException>();
        var scanner = new StepScanner(content, listener, config.getProgressInterval());
        var model = StepModel.scan(scanner, content, e -> {
            if (config.isStrict()) {
                throw e;
            }
            log.warn("Skipping malformed record: {}", e.getMessage());
            errors.add(e);
        });
        var header = StepHeader.parse(content);

        var unitScale = UnitScale.extract(model);
        listener.onProgress(PHASE_UNITS, 1.0);

        var spatialTree = config.isBuildSpatialTree() ? SpatialTreeBuilder.build(model) : SpatialTree.empty();
        listener.onProgress(PHASE_SPATIAL, 1.0);

        Optional<PropertyReader> properties = config.isExtractProperties() ? Optional.of(new PropertyReader(model))
                                                                           : Optional.empty();
        listener.onProgress(PHASE_PROPERTIES, 1.0);

        listener.onProgress(PHASE_COMPLETE, 1.0);
        log.info("Parsed {} entities in {} ms, unit scale {}, {} errors", model.entityCount(),
                 (System.nanoTime() - start) / 1_000_000, unitScale, errors.size());
        return new ParsedModel(model, header, unitScale, spatialTree, properties, errors);
    }
}
