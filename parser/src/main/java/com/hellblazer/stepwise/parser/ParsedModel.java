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

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link StepParser}: the entity store plus what was derived from it.
 *
 * @param unitScale   metres per file length unit
 * @param spatialTree empty when spatial building was disabled or the file has no project
 * @param properties  empty when property extraction was disabled
 * @param errors      records skipped by a lenient parse, in file order
 * @author hal.hildebrand
 */
public record ParsedModel(StepModel resolver, StepHeader header, double unitScale, SpatialTree spatialTree,
                          Optional<PropertyReader> properties, List<StepException> errors) {

    public ParsedModel {
        errors = List.copyOf(errors);
    }

    public int entityCount() {
        return resolver.entityCount();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
