/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GeometryConfigLoaderTest {

    private final GeometryConfigLoader loader = new GeometryConfigLoader();

    private GeometryConfig load(String json) throws IOException {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testBadValues() {
        assertThrows(IllegalArgumentException.class, () -> load("[]"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"revolveSegments\": \"many\"}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"revolveSegments\": 2.5}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"unitScale\": \"mm\"}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"unitScale\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"representations\": \"Body\"}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"circleSegments\": {\"min\": 40}}"));
        assertThrows(JsonProcessingException.class, () -> load("{unitScale"));
    }

    @Test
    void testBundledDefaults() throws IOException {
        var config = loader.loadDefault();
        assertTrue(config.getUnitScale().isEmpty());
        assertEquals(8, config.getMinCircleSegments());
        assertEquals(32, config.getMaxCircleSegments());
        assertEquals(24, config.getRevolveSegments());
        assertEquals(12, config.getSweptDiskSegments());
        assertEquals(Set.of("Body", "Facetation"), config.getRepresentationIdentifiers());
    }

    @Test
    void testLoad() throws IOException {
        var config = load("""
                          {
                            "unitScale": 0.001,
                            "circleSegments": { "min": 4, "max": 12 },
                            "revolveSegments": 48,
                            "sweptDiskSegments": 6,
                            "parallelism": 2,
                            "representations": ["Body", "Mesh"]
                          }
                          """);
        assertEquals(0.001, config.getUnitScale().orElseThrow(), 1e-12);
        assertEquals(4, config.getMinCircleSegments());
        assertEquals(12, config.getMaxCircleSegments());
        assertEquals(48, config.getRevolveSegments());
        assertEquals(6, config.getSweptDiskSegments());
        assertEquals(2, config.getParallelism());
        assertEquals(Set.of("Body", "Mesh"), config.getRepresentationIdentifiers());
    }

    @Test
    void testPartialConfigKeepsDefaults() throws IOException {
        var config = load("{\"circleSegments\": {\"max\": 64}, \"unitScale\": null}");
        assertTrue(config.getUnitScale().isEmpty());
        assertEquals(8, config.getMinCircleSegments());
        assertEquals(64, config.getMaxCircleSegments());
        assertEquals(GeometryConfig.DEFAULT_REVOLVE_SEGMENTS, config.getRevolveSegments());
    }
}
