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
package com.hellblazer.stepwise.parser.spatial;

import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link SpatialTree} from IFCRELAGGREGATES (RelatingObject 4, RelatedObjects 5) and
 * IFCRELCONTAINEDINSPATIALSTRUCTURE (RelatedElements 4, RelatingStructure 5).
 * <p>
 * Relationships are applied in file order. The first relationship to claim a child wins; later claims on the same
 * child are ignored, as are claims that would close a cycle. Only nodes reachable from the first IFCPROJECT are part
 * of the tree.
 *
 * @author hal.hildebrand
 */
public class SpatialTreeBuilder {
    public static final String REL_AGGREGATES = "IFCRELAGGREGATES";
    public static final String REL_CONTAINED  = "IFCRELCONTAINEDINSPATIALSTRUCTURE";

    private static final Logger log = LoggerFactory.getLogger(SpatialTreeBuilder.class);

    private final EntityResolver                resolver;
    private final Map<EntityId, EntityId>       parentOf   = new HashMap<>();
    private final Map<EntityId, List<EntityId>> childrenOf = new HashMap<>();

    public SpatialTreeBuilder(EntityResolver resolver) {
        this.resolver = resolver;
    }

    public static SpatialTree build(EntityResolver resolver) {
        return new SpatialTreeBuilder(resolver).build();
    }

    public SpatialTree build() {
        var projects = resolver.findByTypeName("IFCPROJECT");
        if (projects.isEmpty()) {
            log.debug("No IFCPROJECT, spatial tree is empty");
            return SpatialTree.empty();
        }
        collectRelationships();
        return assemble(projects.get(0));
    }

    private SpatialTree assemble(EntityId rootId) {
        var nodes = new LinkedHashMap<EntityId, SpatialNode>();
        var parents = new HashMap<EntityId, EntityId>();
        var storeyOf = new HashMap<EntityId, EntityId>();

        // (id, nearest storey above it)
        var stack = new ArrayDeque<EntityId[]>();
        stack.push(new EntityId[] { rootId, null });
        while (!stack.isEmpty()) {
            var frame = stack.pop();
            var id = frame[0];
            var storey = frame[1];
            var entity = decode(id);
            if (entity == null) {
                continue;
            }
            var children = new ArrayList<EntityId>();
            for (var child : childrenOf.getOrDefault(id, List.of())) {
                if (resolver.contains(child)) {
                    children.add(child);
                } else {
                    log.warn("Spatial child {} of {} is not in the file", child, id);
                }
            }
            var node = toNode(entity, children);
            nodes.put(id, node);
            if (storey != null) {
                storeyOf.put(id, storey);
            }
            var below = node.getType() == SpatialNodeType.STOREY ? id : storey;
            for (int i = children.size() - 1; i >= 0; i--) {
                parents.put(children.get(i), id);
                stack.push(new EntityId[] { children.get(i), below });
            }
        }
        // children that failed to decode were dropped above
        nodes.replaceAll((id, node) -> {
            var kept = node.getChildren().stream().filter(nodes::containsKey).toList();
            if (kept.size() == node.getChildren().size()) {
                return node;
            }
            return new SpatialNode(node.getId(), node.getType(), node.getName(), node.getTypeName(),
                                   node.getElevation().isPresent() ? node.getElevation().getAsDouble() : null,
                                   node.hasGeometry(), kept);
        });
        parents.keySet().retainAll(nodes.keySet());

        var storeys = new ArrayList<StoreyInfo>();
        for (var node : nodes.values()) {
            if (node.getType() == SpatialNodeType.STOREY) {
                int elements = (int) node.getChildren()
                                         .stream()
                                         .filter(c -> nodes.get(c).getType() == SpatialNodeType.ELEMENT)
                                         .count();
                storeys.add(new StoreyInfo(node.getId(), node.getName(), node.getElevation().orElse(0.0), elements));
            }
        }
        storeys.sort(Comparator.comparingDouble(StoreyInfo::elevation));
        log.debug("Spatial tree: {} nodes, {} storeys", nodes.size(), storeys.size());
        return new SpatialTree(rootId, nodes, parents, storeyOf, storeys);
    }

    private void claim(EntityId parent, EntityId child) {
        if (parent.equals(child)) {
            return;
        }
        var existing = parentOf.get(child);
        if (existing != null) {
            if (!existing.equals(parent)) {
                log.debug("{} already belongs to {}, ignoring claim by {}", child, existing, parent);
            }
            return;
        }
        for (var up = parent; up != null; up = parentOf.get(up)) {
            if (up.equals(child)) {
                log.debug("Ignoring {} -> {}, it would close a cycle", parent, child);
                return;
            }
        }
        parentOf.put(child, parent);
        childrenOf.computeIfAbsent(parent, p -> new ArrayList<>()).add(child);
    }

    private void collectRelationships() {
        for (var id : resolver.allIds()) {
            var type = resolver.typeName(id).orElse("");
            int parentIndex;
            int childIndex;
            if (REL_AGGREGATES.equals(type)) {
                parentIndex = 4;
                childIndex = 5;
            } else if (REL_CONTAINED.equals(type)) {
                parentIndex = 5;
                childIndex = 4;
            } else {
                continue;
            }
            var rel = decode(id);
            if (rel == null) {
                continue;
            }
            var parent = rel.getRef(parentIndex);
            if (parent.isEmpty()) {
                log.warn("{} {} has no relating object", type, id);
                continue;
            }
            for (var child : rel.getRefs(childIndex)) {
                claim(parent.get(), child);
            }
        }
    }

    private DecodedEntity decode(EntityId id) {
        try {
            return resolver.get(id).orElse(null);
        } catch (StepException.Syntax e) {
            log.warn("Skipping {} in spatial tree: {}", id, e.getMessage());
            return null;
        }
    }

    private SpatialNode toNode(DecodedEntity entity, List<EntityId> children) {
        var type = SpatialNodeType.fromTypeName(entity.getTypeName());
        Double elevation = null;
        if (type == SpatialNodeType.STOREY) {
            var value = entity.getFloat(9);
            if (value.isPresent()) {
                elevation = value.getAsDouble();
            }
        }
        boolean hasGeometry = type != SpatialNodeType.PROJECT && entity.getRef(6).isPresent();
        return new SpatialNode(entity.getId(), type, entity.getString(2).orElse(""), entity.getTypeName(), elevation,
                               hasGeometry, children);
    }
}
