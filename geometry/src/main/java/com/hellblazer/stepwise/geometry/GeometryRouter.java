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

import com.hellblazer.stepwise.geometry.processors.ExtrudedAreaSolidProcessor;
import com.hellblazer.stepwise.geometry.processors.FacetedBrepProcessor;
import com.hellblazer.stepwise.geometry.processors.GeometryProcessor;
import com.hellblazer.stepwise.geometry.processors.PlacementResolver;
import com.hellblazer.stepwise.geometry.processors.ProfileExtractor;
import com.hellblazer.stepwise.geometry.processors.RevolvedAreaSolidProcessor;
import com.hellblazer.stepwise.geometry.processors.SweptDiskSolidProcessor;
import com.hellblazer.stepwise.geometry.processors.TriangulatedFaceSetProcessor;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.ParsedModel;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches IFC representation items to their {@link GeometryProcessor}, one per supported solid kind, and assembles
 * element meshes.
 * <p>
 * Every mesh leaving the router is in meters: positions are multiplied by the unit scale after all placements have
 * been applied. The router is safe to share between threads and between models; its only state is a cache of
 * tessellated mapped representations, kept per resolver and keyed by representation id within it. Resolvers are held
 * weakly.
 *
 * @author hal.hildebrand
 */
public class GeometryRouter {
    public static final  String IFCMAPPEDITEM             = "IFCMAPPEDITEM";
    public static final  String IFCPRODUCTDEFINITIONSHAPE = "IFCPRODUCTDEFINITIONSHAPE";
    /**
     * Mapped items nested deeper than this are treated as cyclic.
     */
    public static final  int    MAX_MAPPING_DEPTH         = 16;
    private static final Logger log                       = LoggerFactory.getLogger(GeometryRouter.class);

    /**
     * Representation item types with a processor.
     */
    public static final  Set<String> SUPPORTED_TYPES = Set.of(ExtrudedAreaSolidProcessor.TYPE_NAME,
                                                               RevolvedAreaSolidProcessor.TYPE_NAME,
                                                               SweptDiskSolidProcessor.TYPE_NAME,
                                                               FacetedBrepProcessor.TYPE_NAME,
                                                               TriangulatedFaceSetProcessor.TYPE_NAME);

    private final GeometryConfig                           config;
    private final double                                   unitScale;
    private final ExtrudedAreaSolidProcessor               extrusions;
    private final RevolvedAreaSolidProcessor               revolutions;
    private final SweptDiskSolidProcessor                  sweptDisks;
    private final FacetedBrepProcessor                     breps;
    private final TriangulatedFaceSetProcessor             faceSets;
    private final Map<EntityResolver, Map<EntityId, Mesh>> mappedRepresentations = Collections.synchronizedMap(
    new WeakHashMap<>());

    public GeometryRouter() {
        this(GeometryConfig.defaultConfig(), 1.0);
    }

    /**
     * @param fileUnitScale meters per file length unit, used unless the config overrides it
     */
    public GeometryRouter(GeometryConfig config, double fileUnitScale) {
        this.config = config;
        this.unitScale = config.getUnitScale().orElse(fileUnitScale);
        var profiles = new ProfileExtractor(config);
        this.extrusions = new ExtrudedAreaSolidProcessor(profiles);
        this.revolutions = new RevolvedAreaSolidProcessor(profiles, config.getRevolveSegments());
        this.sweptDisks = new SweptDiskSolidProcessor(profiles, config.getSweptDiskSegments());
        this.breps = new FacetedBrepProcessor();
        this.faceSets = new TriangulatedFaceSetProcessor();
    }

    /**
     * A router using the model's unit scale.
     */
    public static GeometryRouter forModel(ParsedModel model, GeometryConfig config) {
        return new GeometryRouter(config, model.unitScale());
    }

    public void clearCache() {
        mappedRepresentations.clear();
    }

    public GeometryConfig getConfig() {
        return config;
    }

    /**
     * @return meters per file length unit applied to every mesh
     */
    public double getUnitScale() {
        return unitScale;
    }

    /**
     * Tessellate one representation item, scaled to meters. Only the item's own placement is applied.
     *
     * @throws GeometryException.UnsupportedType if no processor handles the item's type
     * @throws GeometryException                 if the item cannot be tessellated
     * @throws StepException                     for missing attributes or dangling references
     */
    public Mesh process(EntityId id, EntityResolver resolver) {
        var mesh = tessellate(resolver.resolve(id), resolver);
        mesh.scale(unitScale);
        return mesh;
    }

    /**
     * Tessellate every accepted representation item of a product and place the result in world coordinates, scaled to
     * meters. Items that fail are logged and skipped; a product without representation yields an empty mesh.
     * <p>
     * The chain followed: product Representation (6), an IFCPRODUCTDEFINITIONSHAPE whose Representations (2) are
     * IFCSHAPEREPRESENTATIONs with an accepted RepresentationIdentifier (1) and Items (3); product ObjectPlacement (5)
     * composed through its IFCLOCALPLACEMENT parents.
     *
     * @throws StepException for a dangling representation or placement reference, or a cyclic placement chain
     */
    public Mesh processElement(EntityId elementId, EntityResolver resolver) {
        var element = resolver.resolve(elementId);
        var mesh = new Mesh();
        var representation = element.getRef(6);
        if (representation.isEmpty()) {
            return mesh;
        }
        for (var shapeId : shapeRepresentations(resolver.resolve(representation.get()))) {
            var shape = resolver.resolve(shapeId);
            var identifier = shape.getString(1).orElse(null);
            if (!config.acceptsRepresentation(identifier)) {
                log.debug("{} skipped representation {} ({})", elementId, shapeId, identifier);
                continue;
            }
            addItems(mesh, elementId, shape.getRefs(3), resolver, 0);
        }
        var placement = element.getRef(5);
        if (placement.isPresent() && !mesh.isEmpty()) {
            mesh.transform(PlacementResolver.localPlacement(placement.get(), resolver));
        }
        mesh.scale(unitScale);
        return mesh;
    }

    public boolean supports(String typeName) {
        return SUPPORTED_TYPES.contains(typeName);
    }

    private void addItems(Mesh into, EntityId owner, List<EntityId> items, EntityResolver resolver, int depth) {
        for (var itemId : items) {
            try {
                var item = resolver.resolve(itemId);
                into.merge(item.isType(IFCMAPPEDITEM) ? mappedItem(item, resolver, depth) : tessellate(item, resolver));
            } catch (GeometryException | StepException e) {
                log.warn("{} skipped item {}: {}", owner, itemId, e.getMessage());
            }
        }
    }

    /**
     * IFCMAPPEDITEM: MappingSource 0 (an IFCREPRESENTATIONMAP with MappingOrigin 0 and MappedRepresentation 1) placed
     * by MappingTarget 1. The mapped representation is tessellated once and copied for every use.
     */
    private Mesh mappedItem(DecodedEntity item, EntityResolver resolver, int depth) {
        if (depth >= MAX_MAPPING_DEPTH) {
            throw new StepException.InvalidAttribute(item.getId(), 0,
                                                     String.format("mapped items nested deeper than %d",
                                                                   MAX_MAPPING_DEPTH));
        }
        var source = resolver.resolve(item.requireRef(0, "MappingSource"));
        var representationId = source.requireRef(1, "MappedRepresentation");
        var cache = mappedRepresentations.computeIfAbsent(resolver, r -> new ConcurrentHashMap<>());
        var cached = cache.get(representationId);
        if (cached == null) {
            var representation = resolver.resolve(representationId);
            var tessellated = new Mesh();
            addItems(tessellated, representationId, representation.getRefs(3), resolver, depth + 1);
            var previous = cache.putIfAbsent(representationId, tessellated);
            cached = previous == null ? tessellated : previous;
        } else {
            log.trace("Mapped representation {} served from cache", representationId);
        }

        var mesh = cached.copy();
        var transform = new Matrix4d();
        transform.setIdentity();
        var target = item.getRef(1);
        if (target.isPresent()) {
            transform.set(PlacementResolver.placement(resolver.resolve(target.get()), resolver));
        }
        var origin = source.getRef(0);
        if (origin.isPresent()) {
            transform.mul(PlacementResolver.placement(resolver.resolve(origin.get()), resolver));
        }
        mesh.transform(transform);
        return mesh;
    }

    private List<EntityId> shapeRepresentations(DecodedEntity productShape) {
        var representations = productShape.getRefs(2);
        if (representations.isEmpty()) {
            // some exporters shift the list one attribute left
            representations = productShape.getRefs(1);
        }
        return representations;
    }

    private GeometryProcessor processorFor(String typeName) {
        switch (typeName) {
            case ExtrudedAreaSolidProcessor.TYPE_NAME:
                return extrusions;
            case RevolvedAreaSolidProcessor.TYPE_NAME:
                return revolutions;
            case SweptDiskSolidProcessor.TYPE_NAME:
                return sweptDisks;
            case FacetedBrepProcessor.TYPE_NAME:
                return breps;
            case TriangulatedFaceSetProcessor.TYPE_NAME:
                return faceSets;
            default:
                throw new GeometryException.UnsupportedType(typeName);
        }
    }

    private Mesh tessellate(DecodedEntity item, EntityResolver resolver) {
        return processorFor(item.getTypeName()).process(item, resolver);
    }
}
