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
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * An entity with its argument list decoded into {@link AttributeValue}s. Immutable, shared read only by every caller
 * of the resolver.
 *
 * @author hal.hildebrand
 */
public final class DecodedEntity {
    private final EntityId             id;
    private final String               typeName;
    private final List<AttributeValue> attributes;

    public DecodedEntity(EntityId id, String typeName, List<AttributeValue> attributes) {
        this.id = id;
        this.typeName = typeName;
        this.attributes = List.copyOf(attributes);
    }

    public int attributeCount() {
        return attributes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodedEntity that)) {
            return false;
        }
        return id.equals(that.id) && typeName.equals(that.typeName) && attributes.equals(that.attributes);
    }

    /**
     * @return the attribute at {@code index}, empty when the index is past the end
     */
    public Optional<AttributeValue> get(int index) {
        return index >= 0 && index < attributes.size() ? Optional.of(attributes.get(index)) : Optional.empty();
    }

    public List<AttributeValue> getAttributes() {
        return attributes;
    }

    public Optional<String> getEnum(int index) {
        return get(index).flatMap(AttributeValue::asEnum);
    }

    public OptionalDouble getFloat(int index) {
        var value = get(index);
        return value.isPresent() ? value.get().asDouble() : OptionalDouble.empty();
    }

    public EntityId getId() {
        return id;
    }

    public OptionalLong getInteger(int index) {
        var value = get(index);
        return value.isPresent() ? value.get().asLong() : OptionalLong.empty();
    }

    public Optional<List<AttributeValue>> getList(int index) {
        return get(index).flatMap(AttributeValue::asList);
    }

    public Optional<EntityId> getRef(int index) {
        return get(index).flatMap(AttributeValue::asEntityRef);
    }

    /**
     * @return the entity references of a list attribute, skipping non reference items
     */
    public List<EntityId> getRefs(int index) {
        var refs = new ArrayList<EntityId>();
        getList(index).ifPresent(items -> items.forEach(item -> item.asEntityRef().ifPresent(refs::add)));
        return refs;
    }

    public Optional<String> getString(int index) {
        return get(index).flatMap(AttributeValue::asString);
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public int hashCode() {
        return id.hashCode() * 31 + typeName.hashCode();
    }

    public boolean isType(String name) {
        return typeName.equals(name);
    }

    public double requireFloat(int index, String what) {
        var value = getFloat(index);
        if (value.isEmpty()) {
            throw new StepException.InvalidAttribute(id, index, "missing " + what);
        }
        return value.getAsDouble();
    }

    public List<AttributeValue> requireList(int index, String what) {
        return getList(index).orElseThrow(() -> new StepException.InvalidAttribute(id, index, "missing " + what));
    }

    public EntityId requireRef(int index, String what) {
        return getRef(index).orElseThrow(() -> new StepException.InvalidAttribute(id, index, "missing " + what));
    }

    @Override
    public String toString() {
        return String.format("%s=%s%s", id, typeName, attributes);
    }
}
