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

/**
 * Base exception for tessellation failures.
 * <p>
 * Exception hierarchy:
 * <ul>
 * <li>{@link Profile} - a profile that cannot be built, such as a non positive dimension</li>
 * <li>{@link Triangulation} - a polygon that cannot be triangulated</li>
 * <li>{@link Csg} - an invalid combination of solids or voids</li>
 * <li>{@link UnsupportedType} - a representation item with no processor</li>
 * </ul>
 * Missing or mistyped attributes and dangling references surface as the parser's
 * {@link com.hellblazer.stepwise.parser.StepException}.
 *
 * @author hal.hildebrand
 */
public sealed class GeometryException extends RuntimeException
permits GeometryException.Profile, GeometryException.Triangulation, GeometryException.Csg,
        GeometryException.UnsupportedType {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class Profile extends GeometryException {
        public Profile(String message) {
            super("Invalid profile: " + message);
        }
    }

    public static final class Triangulation extends GeometryException {
        public Triangulation(String message) {
            super("Triangulation failed: " + message);
        }
    }

    public static final class Csg extends GeometryException {
        public Csg(String message) {
            super("CSG operation failed: " + message);
        }
    }

    public static final class UnsupportedType extends GeometryException {
        private final String typeName;

        public UnsupportedType(String typeName) {
            super(String.format("Unsupported geometry type: %s", typeName));
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }
    }
}
