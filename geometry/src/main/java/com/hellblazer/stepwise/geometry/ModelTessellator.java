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

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.ParsedModel;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Tessellates every product of a model in parallel.
 * <p>
 * Products are tessellated independently on a fixed pool of {@link GeometryConfig#getParallelism()} threads, sharing
 * the model's entity cache and one {@link GeometryRouter}. A product that fails is recorded as a
 * {@link TessellationResult.Failure} and the rest carry on; products without geometry are left out of the result.
 * Call {@link #shutdown()} when done.
 *
 * @author hal.hildebrand
 */
public class ModelTessellator {
    private static final Logger log = LoggerFactory.getLogger(ModelTessellator.class);

    private final GeometryConfig  config;
    private final ExecutorService executor;

    public ModelTessellator() {
        this(GeometryConfig.defaultConfig());
    }

    public ModelTessellator(GeometryConfig config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.getParallelism());
    }

    /**
     * Products of the model: every entity whose Representation (attribute 6) names an IFCPRODUCTDEFINITIONSHAPE, in
     * id order. Entities that fail to decode are not products.
     */
    public static List<EntityId> productElements(EntityResolver resolver) {
        var products = new ArrayList<EntityId>();
        for (var id : resolver.allIds()) {
            var typeName = resolver.typeName(id).orElse("");
            if (typeName.startsWith("IFCREL") || GeometryRouter.SUPPORTED_TYPES.contains(typeName)) {
                continue;
            }
            try {
                var entity = resolver.get(id);
                if (entity.isEmpty()) {
                    continue;
                }
                var representation = entity.get().getRef(6);
                if (representation.isPresent() && GeometryRouter.IFCPRODUCTDEFINITIONSHAPE.equals(
                resolver.typeName(representation.get()).orElse(null))) {
                    products.add(id);
                }
            } catch (StepException.Syntax e) {
                log.debug("{} not considered as a product: {}", id, e.getMessage());
            }
        }
        products.sort(null);
        return products;
    }

    public GeometryConfig getConfig() {
        return config;
    }

    public void shutdown() {
        if (!executor.isShutdown()) {
            executor.shutdown();
        }
    }

    /**
     * Tessellate every product of a parsed model at the model's unit scale.
     *
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public TessellationResult tessellate(ParsedModel model) throws InterruptedException {
        var resolver = model.resolver();
        return tessellate(resolver, GeometryRouter.forModel(model, config), productElements(resolver));
    }

    /**
     * Tessellate the given products with {@code router}.
     *
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public TessellationResult tessellate(EntityResolver resolver, GeometryRouter router, Collection<EntityId> products)
    throws InterruptedException {
        var start = System.currentTimeMillis();
        var futures = new ArrayList<Map.Entry<EntityId, Future<Mesh>>>(products.size());
        for (var id : products) {
            futures.add(Map.entry(id, executor.submit(() -> router.processElement(id, resolver))));
        }

        var meshes = new TreeMap<EntityId, Mesh>();
        var failures = new ArrayList<TessellationResult.Failure>();
        for (var entry : futures) {
            var id = entry.getKey();
            try {
                var mesh = entry.getValue().get();
                if (!mesh.isEmpty()) {
                    meshes.put(id, mesh);
                }
            } catch (ExecutionException e) {
                var cause = e.getCause() instanceof RuntimeException re ? re : new IllegalStateException(e.getCause());
                var typeName = resolver.typeName(id).orElse("?");
                log.warn("Skipped {} {}: {}", id, typeName, cause.getMessage());
                failures.add(new TessellationResult.Failure(id, typeName, cause));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.getValue().cancel(true));
                throw e;
            }
        }

        var result = new TessellationResult(meshes, failures);
        log.info("Tessellated {} of {} products in {} ms: {} triangles, {} failures", meshes.size(), products.size(),
                 System.currentTimeMillis() - start, result.triangleCount(), failures.size());
        return result;
    }
}
