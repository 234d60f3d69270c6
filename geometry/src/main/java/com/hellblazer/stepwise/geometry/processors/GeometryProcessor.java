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
package com.hellblazer.stepwise.geometry.processors;

import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.Mesh;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;

/**
 * Tessellates one kind of IFC solid.
 * <p>
 * Implementations are stateless and safe to share between threads. The mesh they return is in the file's length
 * units and the solid's own placement is applied; unit scaling and the element placement are the router's job.
 *
 * @author hal.hildebrand
 */
public sealed interface GeometryProcessor
permits ExtrudedAreaSolidProcessor, RevolvedAreaSolidProcessor, SweptDiskSolidProcessor, FacetedBrepProcessor,
        TriangulatedFaceSetProcessor {

    /**
     * @return the upper case IFC type name this processor handles
     */
    String getTypeName();

    /**
     * @throws GeometryException for geometry that cannot be tessellated
     * @throws StepException     for missing or mistyped attributes and dangling references
     */
    Mesh process(DecodedEntity entity, EntityResolver resolver);
}
