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

/**
 * Options for {@link StepParser}. Immutable; create through {@link #builder()}.
 *
 * @author hal.hildebrand
 */
public class ParserConfig {
    public static final int DEFAULT_PROGRESS_INTERVAL = 10_000;

    private final boolean buildSpatialTree;
    private final boolean extractProperties;
    private final boolean strict;
    private final int     progressInterval;

    private ParserConfig(Builder builder) {
        this.buildSpatialTree = builder.buildSpatialTree;
        this.extractProperties = builder.extractProperties;
        this.strict = builder.strict;
        this.progressInterval = builder.progressInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ParserConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Skip the spatial tree and property index, for callers that only tessellate.
     */
    public static ParserConfig geometryOnly() {
        return builder().withSpatialTree(false).withProperties(false).build();
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public boolean isBuildSpatialTree() {
        return buildSpatialTree;
    }

    public boolean isExtractProperties() {
        return extractProperties;
    }

    /**
     * @return true when the first malformed record aborts the parse, false when it is recorded and skipped
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public String toString() {
        return String.format("ParserConfig[spatialTree=%s, properties=%s, strict=%s, progressInterval=%d]",
                             buildSpatialTree, extractProperties, strict, progressInterval);
    }

    public static class Builder {
        private boolean buildSpatialTree  = true;
        private boolean extractProperties = true;
        private boolean strict            = true;
        private int     progressInterval  = DEFAULT_PROGRESS_INTERVAL;

        private Builder() {
        }

        public ParserConfig build() {
            return new ParserConfig(this);
        }

        /**
         * @throws IllegalArgumentException if {@code records} is not positive
         */
        public Builder withProgressInterval(int records) {
            if (records <= 0) {
                throw new IllegalArgumentException("Progress interval must be positive: " + records);
            }
            this.progressInterval = records;
            return this;
        }

        public Builder withProperties(boolean extract) {
            this.extractProperties = extract;
            return this;
        }

        public Builder withSpatialTree(boolean build) {
            this.buildSpatialTree = build;
            return this;
        }

        public Builder withStrict(boolean strict) {
            this.strict = strict;
            return this;
        }
    }
}
