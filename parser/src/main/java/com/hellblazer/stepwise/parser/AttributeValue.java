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
 * Decoded attribute of an entity. A closed set of variants; references are held as {@link EntityId}s only, never as
 * decoded entities, so reference cycles in a file are plain data.
 *
 * @author hal.hildebrand
 */
public sealed interface AttributeValue {

    Null    NULL    = new Null();
    Derived DERIVED = new Derived();

    /**
     * Structural conversion of a token tree, no interpretation of type names.
     */
    static AttributeValue of(Token token) {
        if (token instanceof Token.Ref ref) {
            return new EntityRef(EntityId.of(ref.id()));
        } else if (token instanceof Token.Str str) {
            return new StringValue(str.value());
        } else if (token instanceof Token.Int i) {
            return new IntegerValue(i.value());
        } else if (token instanceof Token.Real r) {
            return new FloatValue(r.value());
        } else if (token instanceof Token.Enumeration e) {
            return new EnumValue(e.name());
        } else if (token instanceof Token.Group group) {
            return new ListValue(ofAll(group.items()));
        } else if (token instanceof Token.Typed typed) {
            return new TypedValue(typed.name(), ofAll(typed.args()));
        } else if (token instanceof Token.Null) {
            return NULL;
        } else if (token instanceof Token.Derived) {
            return DERIVED;
        }
        throw new IllegalStateException("Unknown token: " + token);
    }

    static List<AttributeValue> ofAll(List<Token> tokens) {
        var values = new ArrayList<AttributeValue>(tokens.size());
        for (var token : tokens) {
            values.add(of(token));
        }
        return values;
    }

    /**
     * Enumerations {@code .T.} and {@code .F.}; {@code .U.} (unknown) and everything else is empty.
     */
    default Optional<Boolean> asBoolean() {
        if (this instanceof EnumValue e) {
            if ("T".equals(e.name()) || "TRUE".equals(e.name())) {
                return Optional.of(Boolean.TRUE);
            }
            if ("F".equals(e.name()) || "FALSE".equals(e.name())) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /**
     * Numeric view: floats, integers widened, and typed values such as {@code IFCLENGTHMEASURE(2.5)} unwrapped.
     */
    default OptionalDouble asDouble() {
        if (this instanceof FloatValue f) {
            return OptionalDouble.of(f.value());
        } else if (this instanceof IntegerValue i) {
            return OptionalDouble.of(i.value());
        } else if (this instanceof TypedValue t && t.args().size() == 1) {
            return t.args().get(0).asDouble();
        }
        return OptionalDouble.empty();
    }

    default Optional<EntityId> asEntityRef() {
        return this instanceof EntityRef ref ? Optional.of(ref.id()) : Optional.empty();
    }

    default Optional<String> asEnum() {
        return this instanceof EnumValue e ? Optional.of(e.name()) : Optional.empty();
    }

    default Optional<List<AttributeValue>> asList() {
        return this instanceof ListValue list ? Optional.of(list.items()) : Optional.empty();
    }

    default OptionalLong asLong() {
        if (this instanceof IntegerValue i) {
            return OptionalLong.of(i.value());
        } else if (this instanceof TypedValue t && t.args().size() == 1) {
            return t.args().get(0).asLong();
        }
        return OptionalLong.empty();
    }

    /**
     * Strings, and typed values wrapping a string such as {@code IFCLABEL('x')}.
     */
    default Optional<String> asString() {
        if (this instanceof StringValue s) {
            return Optional.of(s.value());
        } else if (this instanceof TypedValue t && t.args().size() == 1) {
            return t.args().get(0).asString();
        }
        return Optional.empty();
    }

    default boolean isNull() {
        return this instanceof Null;
    }

    record EntityRef(EntityId id) implements AttributeValue {
    }

    record StringValue(String value) implements AttributeValue {
    }

    record IntegerValue(long value) implements AttributeValue {
    }

    record FloatValue(double value) implements AttributeValue {
    }

    record EnumValue(String name) implements AttributeValue {
    }

    record ListValue(List<AttributeValue> items) implements AttributeValue {
        public ListValue {
            items = List.copyOf(items);
        }
    }

    record TypedValue(String name, List<AttributeValue> args) implements AttributeValue {
        public TypedValue {
            args = List.copyOf(args);
        }
    }

    record Null() implements AttributeValue {
    }

    record Derived() implements AttributeValue {
    }
}
