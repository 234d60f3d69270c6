/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.io;

import com.hellblazer.stepwise.geometry.MeshData;
import com.hellblazer.stepwise.parser.EntityId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MeshDataWriterTest {

    private static MeshData triangle(float z) {
        return new MeshData(new float[] { 0, 0, z, 1, 0, z, 0, 1, z }, new float[] { 0, 0, 1, 0, 0, 1, 0, 0, 1 },
                            new int[] { 0, 1, 2 });
    }

    @Test
    void testFileRoundTrip(@TempDir Path dir) throws IOException {
        var meshes = new HashMap<EntityId, MeshData>();
        meshes.put(EntityId.of(7), triangle(1));
        meshes.put(EntityId.of(3), triangle(0));
        var file = dir.resolve("meshes.json");
        var writer = new MeshDataWriter(true);
        writer.write(meshes, file);
        assertTrue(Files.size(file) > 0);

        try (var in = Files.newInputStream(file)) {
            var read = writer.read(in);
            assertEquals(meshes, read);
        }
    }

    @Test
    void testJsonLayout() throws IOException {
        var json = new MeshDataWriter().toJson(Map.of(EntityId.of(7), triangle(1), EntityId.of(3), triangle(0)));
        assertTrue(json.startsWith("{\"version\":1,"), json);
        // meshes are written in id order
        assertTrue(json.indexOf("\"id\":3") < json.indexOf("\"id\":7"), json);
        assertTrue(json.contains("\"indices\":[0,1,2]"), json);
    }

    @Test
    void testRejectsInconsistentMesh() {
        var json = "{\"version\":1,\"meshes\":[{\"id\":1,\"positions\":[0,0,0],\"normals\":[],\"indices\":[0]}]}";
        assertThrows(IllegalArgumentException.class, () -> new MeshDataWriter().read(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testRejectsUnknownVersion() {
        var json = "{\"version\":2,\"meshes\":[]}";
        var e = assertThrows(IllegalArgumentException.class, () -> new MeshDataWriter().read(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("2"));
    }
}
