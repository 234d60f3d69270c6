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

import com.hellblazer.stepwise.geometry.profile.Profile2D;

import java.util.LinkedHashSet;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Tessellation options for {@link GeometryRouter} and {@link ModelTessellator}. Immutable; create through
 * {@link #builder()}, or load from JSON with {@link GeometryConfigLoader}.
 *
 * @author hal.hildebrand
 */
public class GeometryConfig {
    public static final Set<String> DEFAULT_REPRESENTATIONS = Set.of("Body", "Facetation");
    public static final int         DEFAULT_REVOLVE_SEGMENTS = 24;
    public static final int         DEFAULT_SWEPT_DISK_SEGMENTS = 12;

    private final Double      unitScale;
    private final int         minCircleSegments;
    private final int         maxCircleSegments;
    private final int         revolveSegments;
    private final int         sweptDiskSegments;
    private final int         parallelism;
    private final Set<String> representationIdentifiers;

    private GeometryConfig(Builder builder) {
        this.unitScale = builder.unitScale;
        this.minCircleSegments = builder.minCircleSegments;
        this.maxCircleSegments = builder.maxCircleSegments;
        this.revolveSegments = builder.revolveSegments;
        this.sweptDiskSegments = builder.sweptDiskSegments;
        this.parallelism = builder.parallelism;
        this.representationIdentifiers = Set.copyOf(builder.representationIdentifiers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GeometryConfig defaultConfig() {
        return builder().build();
    }

    public int getMaxCircleSegments() {
        return maxCircleSegments;
    }

    public int getMinCircleSegments() {
        return minCircleSegments;
    }

    /**
     * @return worker threads used by {@link ModelTessellator}
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * @return shape representation identifiers that are tessellated; a representation with no identifier is always
     * accepted
     */
    public Set<String> getRepresentationIdentifiers() {
        return representationIdentifiers;
    }

    /**
     * Segments for a full turn of a revolved solid; partial turns use a proportional count with a floor of 4.
     */
    public int getRevolveSegments() {
        return revolveSegments;
    }

    public int getSweptDiskSegments() {
        return sweptDiskSegments;
    }

    /**
     * @return meters per file length unit overriding the file's own unit assignment, if set
     */
    public OptionalDouble getUnitScale() {
        return unitScale == null ? OptionalDouble.empty() : OptionalDouble.of(unitScale);
    }

    /**
     * @return true if a representation with this identifier should be tessellated
     */
    public boolean acceptsRepresentation(String identifier) {
        return identifier == null || representationIdentifiers.contains(identifier);
    }

    @Override
    public String toString() {
        return String.format(
        "GeometryConfig[unitScale=%s, circleSegments=%d..%d, revolveSegments=%d, sweptDiskSegments=%d, parallelism=%d, representations=%s]",
        unitScale == null ? "file" : unitScale, minCircleSegments, maxCircleSegments, revolveSegments,
        sweptDiskSegments, parallelism, representationIdentifiers);
    }

    public static class Builder {
        private final Set<String> representationIdentifiers = new LinkedHashSet<>(DEFAULT_REPRESENTATIONS);
        private       Double      unitScale;
        private       int         minCircleSegments         = Profile2D.MIN_CIRCLE_SEGMENTS;
        private       int         maxCircleSegments         = Profile2D.MAX_CIRCLE_SEGMENTS;
        private       int         revolveSegments           = DEFAULT_REVOLVE_SEGMENTS;
        private       int         sweptDiskSegments         = DEFAULT_SWEPT_DISK_SEGMENTS;
        private       int         parallelism               = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the minimum exceeds the maximum
         */
        public GeometryConfig build() {
            if (minCircleSegments > maxCircleSegments) {
                throw new IllegalArgumentException(
                String.format("Circle segment bounds inverted: %d > %d", minCircleSegments, maxCircleSegments));
            }
            return new GeometryConfig(this);
        }

        /**
         * @throws IllegalArgumentException if either bound is below 3
         */
        public Builder withCircleSegments(int min, int max) {
            if (min < 3 || max < 3) {
                throw new IllegalArgumentException(
                String.format("Circle segments must be at least 3: %d..%d", min, max));
            }
            this.minCircleSegments = min;
            this.maxCircleSegments = max;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code threads} is not positive
         */
        public Builder withParallelism(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("Parallelism must be positive: " + threads);
            }
            this.parallelism = threads;
            return this;
        }

        /**
         * Replace the accepted shape representation identifiers.
         *
         * @throws IllegalArgumentException if {@code identifiers} is empty
         */
        public Builder withRepresentations(Set<String> identifiers) {
            if (identifiers == null || identifiers.isEmpty()) {
                throw new IllegalArgumentException("At least one representation identifier is required");
            }
            this.representationIdentifiers.clear();
            this.representationIdentifiers.addAll(identifiers);
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code segments} is below 4
         */
        public Builder withRevolveSegments(int segments) {
            if (segments < 4) {
                throw new IllegalArgumentException("Revolve segments must be at least 4: " + segments);
            }
            this.revolveSegments = segments;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code segments} is below 3
         */
        public Builder withSweptDiskSegments(int segments) {
            if (segments < 3) {
                throw new IllegalArgumentException("Swept disk segments must be at least 3: " + segments);
            }
            this.sweptDiskSegments = segments;
            return this;
        }

        /**
         * Override the file's length unit.
         *
         * @param metersPerUnit meters per file unit, e.g. 0.001 for millimeters
         * @throws IllegalArgumentException if the scale is not positive
         */
        public Builder withUnitScale(double metersPerUnit) {
            if (!(metersPerUnit > 0)) {
                throw new IllegalArgumentException("Unit scale must be positive: " + metersPerUnit);
            }
            this.unitScale = metersPerUnit;
            return this;
        }
    }
}
