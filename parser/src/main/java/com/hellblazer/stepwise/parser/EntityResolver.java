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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the entities of a parsed file. The only way to follow a reference from one entity to another.
 * Implementations are safe for concurrent use once parsing has completed.
 *
 * @author hal.hildebrand
 */
public interface EntityResolver {

    /**
     * @return every entity id in file order
     */
    Collection<EntityId> allIds();

    boolean contains(EntityId id);

    /**
     * @return the decoded entities of one type, in file order
     */
    default List<DecodedEntity> entitiesByType(String typeName) {
        var ids = findByTypeName(typeName);
        var entities = new ArrayList<DecodedEntity>(ids.size());
        for (var id : ids) {
            get(id).ifPresent(entities::add);
        }
        return entities;
    }

    int entityCount();

    /**
     * Exact, case sensitive type lookup. STEP writes type names in upper case, so {@code "IFCWALL"}.
     *
     * @return ids of that type in file order
     */
    List<EntityId> findByTypeName(String typeName);

    /**
     * Decode on miss, one entity and one level deep: references in the result stay ids.
     *
     * @return the entity, or empty when the id is not in the file
     * @throws StepException.Syntax when the entity's arguments do not decode
     */
    Optional<DecodedEntity> get(EntityId id);

    /**
     * @throws StepException.EntityNotFound when the id is not in the file
     */
    default DecodedEntity resolve(EntityId id) {
        return get(id).orElseThrow(() -> new StepException.EntityNotFound(id));
    }

    /**
     * @throws StepException.EntityNotFound when the referenced id is not in the file
     * @throws StepException.InvalidAttribute when {@code value} is not an entity reference
     */
    default DecodedEntity resolveRef(AttributeValue value) {
        if (value instanceof AttributeValue.EntityRef ref) {
            return resolve(ref.id());
        }
        throw new StepException.InvalidAttribute(null, -1, "expected entity reference but found " + value);
    }

    /**
     * @return the type name recorded by the scanner, without decoding
     */
    Optional<String> typeName(EntityId id);
}
