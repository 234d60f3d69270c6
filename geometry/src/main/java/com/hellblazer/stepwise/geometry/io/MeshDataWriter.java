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
package com.hellblazer.stepwise.geometry.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hellblazer.stepwise.geometry.MeshData;
import com.hellblazer.stepwise.parser.EntityId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON export of tessellated meshes for renderers:
 *
 * <pre>
 * { "version": 1, "meshes": [ { "id": 100, "positions": [...], "normals": [...], "indices": [...] } ] }
 * </pre>
 * <p>
 * Meshes are written in id order. Instances are thread safe.
 *
 * @author hal.hildebrand
 */
public class MeshDataWriter {
    public static final  int    FORMAT_VERSION = 1;
    private static final Logger log            = LoggerFactory.getLogger(MeshDataWriter.class);

    private final ObjectMapper objectMapper;

    public MeshDataWriter() {
        this(false);
    }

    /**
     * @param pretty indent the output
     */
    public MeshDataWriter(boolean pretty) {
        this.objectMapper = new ObjectMapper();
        if (pretty) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    /**
     * @throws IOException              if the stream is not readable JSON
     * @throws IllegalArgumentException if the version is unknown or a mesh is inconsistent
     */
    public Map<EntityId, MeshData> read(InputStream in) throws IOException {
        var file = objectMapper.readValue(in, MeshFile.class);
        if (file.version() != FORMAT_VERSION) {
            throw new IllegalArgumentException(String.format("Unsupported mesh file version: %d", file.version()));
        }
        var meshes = new TreeMap<EntityId, MeshData>();
        for (var entry : file.meshes()) {
            meshes.put(EntityId.of(entry.id()), new MeshData(entry.positions(), entry.normals(), entry.indices()));
        }
        return meshes;
    }

    public String toJson(Map<EntityId, MeshData> meshes) throws IOException {
        return objectMapper.writeValueAsString(toFile(meshes));
    }

    public void write(Map<EntityId, MeshData> meshes, OutputStream out) throws IOException {
        objectMapper.writeValue(out, toFile(meshes));
    }

    public void write(Map<EntityId, MeshData> meshes, Path path) throws IOException {
        try (var out = Files.newOutputStream(path)) {
            write(meshes, out);
        }
        log.info("Wrote {} meshes to {}", meshes.size(), path);
    }

    private MeshFile toFile(Map<EntityId, MeshData> meshes) {
        var entries = new ArrayList<MeshEntry>(meshes.size());
        new TreeMap<>(meshes).forEach(
        (id, data) -> entries.add(new MeshEntry(id.value(), data.positions(), data.normals(), data.indices())));
        return new MeshFile(FORMAT_VERSION, entries);
    }

    record MeshEntry(long id, float[] positions, float[] normals, int[] indices) {
    }

    record MeshFile(int version, List<MeshEntry> meshes) {
    }
}
