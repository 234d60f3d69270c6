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

import java.util.Optional;

/**
 * Base exception for STEP parsing and entity resolution failures.
 * <p>
 * Exception hierarchy:
 * <ul>
 * <li>{@link MalformedRecord} - an entity record prefix that is not {@code #id = TYPE(}</li>
 * <li>{@link Syntax} - an argument token matching no STEP value form</li>
 * <li>{@link EntityNotFound} - a reference to an id absent from the file</li>
 * <li>{@link InvalidAttribute} - an attribute missing or of the wrong kind for its consumer</li>
 * <li>{@link Cancelled} - the parsing thread was interrupted</li>
 * </ul>
 * Offsets are character offsets into the parsed text; text read with
 * {@link java.nio.charset.StandardCharsets#ISO_8859_1} makes them byte offsets.
 *
 * @author hal.hildebrand
 */
public sealed class StepException extends RuntimeException
permits StepException.MalformedRecord, StepException.Syntax, StepException.EntityNotFound,
        StepException.InvalidAttribute, StepException.Cancelled {

    public StepException(String message) {
        super(message);
    }

    public StepException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Structural error: a record whose prefix cannot be read as {@code #id = TYPE(}.
     */
    public static final class MalformedRecord extends StepException {
        private final int    offset;
        private final String fragment;

        public MalformedRecord(int offset, String fragment, String detail) {
            super(String.format("Malformed entity record at offset %d: %s [%s]", offset, detail, fragment));
            this.offset = offset;
            this.fragment = fragment;
        }

        public String getFragment() {
            return fragment;
        }

        public int getOffset() {
            return offset;
        }
    }

    /**
     * A token in an argument list matching none of the STEP value forms.
     */
    public static final class Syntax extends StepException {
        private final int      offset;
        private final EntityId entityId;
        private final String   detail;

        public Syntax(int offset, String detail) {
            this(offset, null, detail, null);
        }

        public Syntax(int offset, EntityId entityId, String detail, Throwable cause) {
            super(entityId == null ? String.format("Syntax error at offset %d: %s", offset, detail)
                                   : String.format("Syntax error in %s at offset %d: %s", entityId, offset, detail),
                  cause);
            this.offset = offset;
            this.entityId = entityId;
            this.detail = detail;
        }

        public String getDetail() {
            return detail;
        }

        /**
         * @return the entity whose arguments failed to decode, if known
         */
        public Optional<EntityId> getEntityId() {
            return Optional.ofNullable(entityId);
        }

        public int getOffset() {
            return offset;
        }
    }

    /**
     * A dereferenced id that is not present in the model.
     */
    public static final class EntityNotFound extends StepException {
        private final EntityId entityId;

        public EntityNotFound(EntityId entityId) {
            super(String.format("Entity not found: %s", entityId));
            this.entityId = entityId;
        }

        public EntityId getEntityId() {
            return entityId;
        }
    }

    /**
     * An attribute that is absent or of the wrong kind for the operation reading it.
     */
    public static final class InvalidAttribute extends StepException {
        private final EntityId entityId;
        private final int      index;

        public InvalidAttribute(EntityId entityId, int index, String detail) {
            super(entityId == null ? String.format("Invalid attribute at index %d: %s", index, detail)
                                   : String.format("Invalid attribute %d of %s: %s", index, entityId, detail));
            this.entityId = entityId;
            this.index = index;
        }

        public Optional<EntityId> getEntityId() {
            return Optional.ofNullable(entityId);
        }

        public int getIndex() {
            return index;
        }
    }

    /**
     * The parsing thread was interrupted between records.
     */
    public static final class Cancelled extends StepException {
        public Cancelled(int offset) {
            super(String.format("Parse cancelled at offset %d", offset));
        }
    }
}
