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

import com.hellblazer.stepwise.geometry.Mesh;
import com.hellblazer.stepwise.geometry.profile.Extrusion;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityResolver;

/**
 * IFCEXTRUDEDAREASOLID: SweptArea 0, Position 1, ExtrudedDirection 2, Depth 3.
 *
 * @author hal.hildebrand
 */
public final class ExtrudedAreaSolidProcessor implements GeometryProcessor {
    public static final String TYPE_NAME = "IFCEXTRUDEDAREASOLID";

    private final ProfileExtractor profiles;

    public ExtrudedAreaSolidProcessor(ProfileExtractor profiles) {
        this.profiles = profiles;
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    @Override
    public Mesh process(DecodedEntity entity, EntityResolver resolver) {
        var profile = profiles.extract(resolver.resolve(entity.requireRef(0, "SweptArea")), resolver);
        var direction = entity.getRef(2).map(id -> PlacementResolver.direction(id, resolver)).orElse(null);
        var depth = entity.requireFloat(3, "Depth");

        var mesh = Extrusion.extrudeProfile(profile, depth, direction);
        var position = entity.getRef(1);
        if (position.isPresent()) {
            Extrusion.applyTransform(mesh, PlacementResolver.axis2Placement3D(resolver.resolve(position.get()),
                                                                              resolver));
        }
        return mesh;
    }
}
