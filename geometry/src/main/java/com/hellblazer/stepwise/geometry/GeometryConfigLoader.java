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
package com.hellblazer.stepwise.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;

/**
 * Reads {@link GeometryConfig} from JSON. Every field is optional; absent fields keep their defaults:
 *
 * <pre>
 * {
 *   "unitScale": 0.001,
 *   "circleSegments": { "min": 8, "max": 32 },
 *   "revolveSegments": 24,
 *   "sweptDiskSegments": 12,
 *   "parallelism": 4,
 *   "representations": ["Body", "Facetation"]
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class GeometryConfigLoader {
    public static final  String CONFIG_RESOURCE = "/stepwise-geometry.json";
    private static final Logger log             = LoggerFactory.getLogger(GeometryConfigLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws IOException              if the stream is not readable JSON
     * @throws IllegalArgumentException if a value is out of range or of the wrong type
     */
    public GeometryConfig load(InputStream in) throws IOException {
        var root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Geometry config must be a JSON object");
        }
        var builder = GeometryConfig.builder();
        var unitScale = root.get("unitScale");
        if (unitScale != null && !unitScale.isNull()) {
            builder.withUnitScale(number(unitScale, "unitScale"));
        }
        var circle = root.get("circleSegments");
        if (circle != null) {
            var defaults = GeometryConfig.defaultConfig();
            var min = circle.has("min") ? integer(circle.get("min"), "circleSegments.min")
                                        : defaults.getMinCircleSegments();
            var max = circle.has("max") ? integer(circle.get("max"), "circleSegments.max")
                                        : defaults.getMaxCircleSegments();
            builder.withCircleSegments(min, max);
        }
        if (root.has("revolveSegments")) {
            builder.withRevolveSegments(integer(root.get("revolveSegments"), "revolveSegments"));
        }
        if (root.has("sweptDiskSegments")) {
            builder.withSweptDiskSegments(integer(root.get("sweptDiskSegments"), "sweptDiskSegments"));
        }
        if (root.has("parallelism")) {
            builder.withParallelism(integer(root.get("parallelism"), "parallelism"));
        }
        var representations = root.get("representations");
        if (representations != null) {
            if (!representations.isArray()) {
                throw new IllegalArgumentException("representations must be an array of strings");
            }
            var identifiers = new LinkedHashSet<String>();
            representations.forEach(node -> identifiers.add(node.asText()));
            builder.withRepresentations(identifiers);
        }
        var config = builder.build();
        log.debug("Loaded {}", config);
        return config;
    }

    /**
     * Load {@value #CONFIG_RESOURCE} from the classpath, falling back to defaults when it is absent.
     *
     * @throws IOException if the resource exists but cannot be read
     */
    public GeometryConfig loadDefault() throws IOException {
        try (InputStream is = getClass().getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                log.debug("Config resource not found: {}, using defaults", CONFIG_RESOURCE);
                return GeometryConfig.defaultConfig();
            }
            return load(is);
        }
    }

    private int integer(JsonNode node, String field) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(String.format("%s must be an integer: %s", field, node));
        }
        return node.asInt();
    }

    private double number(JsonNode node, String field) {
        if (!node.isNumber()) {
            throw new IllegalArgumentException(String.format("%s must be a number: %s", field, node));
        }
        return node.asDouble();
    }
}
