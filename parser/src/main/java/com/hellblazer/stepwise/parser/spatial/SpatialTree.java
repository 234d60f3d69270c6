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

import com.hellblazer.stepwise.parser.EntityId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Spatial containment hierarchy rooted at the project: project, site, building, storey, space and the elements
 * contained in them. Immutable once built.
 *
 * @author hal.hildebrand
 */
public final class SpatialTree {
    private static final SpatialTree EMPTY = new SpatialTree(null, Map.of(), Map.of(), Map.of(), List.of());

    private final EntityId                   root;
    private final Map<EntityId, SpatialNode> nodes;
    private final Map<EntityId, EntityId>    parents;
    private final Map<EntityId, EntityId>    storeyOf;
    private final List<StoreyInfo>           storeys;

    SpatialTree(EntityId root, Map<EntityId, SpatialNode> nodes, Map<EntityId, EntityId> parents,
                Map<EntityId, EntityId> storeyOf, List<StoreyInfo> storeys) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.parents = Collections.unmodifiableMap(parents);
        this.storeyOf = Collections.unmodifiableMap(storeyOf);
        this.storeys = List.copyOf(storeys);
    }

    /**
     * @return the tree of a file without an IFCPROJECT
     */
    public static SpatialTree empty() {
        return EMPTY;
    }

    public List<SpatialNode> children(EntityId id) {
        var node = nodes.get(id);
        if (node == null) {
            return List.of();
        }
        var result = new ArrayList<SpatialNode>(node.getChildren().size());
        for (var child : node.getChildren()) {
            result.add(nodes.get(child));
        }
        return result;
    }

    /**
     * @return the nearest storey above the element, if any
     */
    public Optional<SpatialNode> containingStorey(EntityId element) {
        return Optional.ofNullable(storeyOf.get(element)).map(nodes::get);
    }

    /**
     * @return the elements of the storey and of everything nested below it, in tree order
     */
    public List<EntityId> elementsInStorey(EntityId storey) {
        var node = nodes.get(storey);
        if (node == null || node.getType() != SpatialNodeType.STOREY) {
            return List.of();
        }
        var elements = new ArrayList<EntityId>();
        walk(storey, n -> {
            if (n.getType() == SpatialNodeType.ELEMENT) {
                elements.add(n.getId());
            }
        });
        return elements;
    }

    /**
     * @return nodes whose STEP type name equals {@code typeName}, in tree order
     */
    public List<SpatialNode> elementsByType(String typeName) {
        var matches = new ArrayList<SpatialNode>();
        walk(n -> {
            if (n.getTypeName().equals(typeName)) {
                matches.add(n);
            }
        });
        return matches;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public Optional<SpatialNode> node(EntityId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<SpatialNode> parent(EntityId id) {
        return Optional.ofNullable(parents.get(id)).map(nodes::get);
    }

    public Optional<SpatialNode> root() {
        return root == null ? Optional.empty() : Optional.of(nodes.get(root));
    }

    /**
     * Case insensitive substring match against node names and type names.
     */
    public List<SpatialNode> search(String text) {
        var needle = text.toLowerCase(Locale.ROOT);
        var matches = new ArrayList<SpatialNode>();
        walk(n -> {
            if (n.getName().toLowerCase(Locale.ROOT).contains(needle) || n.getTypeName()
                                                                          .toLowerCase(Locale.ROOT)
                                                                          .contains(needle)) {
                matches.add(n);
            }
        });
        return matches;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return storeys sorted by elevation, lowest first
     */
    public List<StoreyInfo> storeys() {
        return storeys;
    }

    /**
     * Depth first, parents before children, children in file order.
     */
    public void walk(Consumer<SpatialNode> visitor) {
        if (root != null) {
            walk(root, visitor);
        }
    }

    private void walk(EntityId from, Consumer<SpatialNode> visitor) {
        var stack = new ArrayDeque<EntityId>();
        stack.push(from);
        while (!stack.isEmpty()) {
            var node = nodes.get(stack.pop());
            visitor.accept(node);
            var children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    @Override
    public String toString() {
        return String.format("SpatialTree[root=%s, nodes=%d, storeys=%d]", root, nodes.size(), storeys.size());
    }
}
