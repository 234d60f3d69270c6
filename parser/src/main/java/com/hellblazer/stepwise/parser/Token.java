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

import java.util.List;

/**
 * Structural token of a STEP argument list. Carries no IFC semantics.
 *
 * @author hal.hildebrand
 */
public sealed interface Token {

    /** {@code #n} */
    record Ref(long id) implements Token {
    }

    /** {@code 'text'}, escapes already decoded */
    record Str(String value) implements Token {
    }

    record Int(long value) implements Token {
    }

    record Real(double value) implements Token {
    }

    /** {@code .NAME.}, stored without the dots */
    record Enumeration(String name) implements Token {
    }

    /** {@code ( ... )} */
    record Group(List<Token> items) implements Token {
        public Group {
            items = List.copyOf(items);
        }
    }

    /** {@code NAME( ... )} */
    record Typed(String name, List<Token> args) implements Token {
        public Typed {
            args = List.copyOf(args);
        }
    }

    /** {@code $} */
    record Null() implements Token {
    }

    /** {@code *} */
    record Derived() implements Token {
    }
}
