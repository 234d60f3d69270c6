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

/**
 * Lexes one entity's argument list into a {@link Token} tree.
 * <p>
 * Grammar: entity reference {@code #123}, string {@code 'it''s'}, integer, real ({@code 1.}, {@code -2.5E-3}),
 * enumeration {@code .NAME.}, list {@code (a, b)}, typed value {@code NAME(a)}, null {@code $}, derived {@code *}.
 * An identifier followed by {@code (} is always a typed value; a token between dots is always an enumeration.
 * <p>
 * Stateless entry points; every call works on its own cursor, so concurrent use is safe.
 *
 * @author hal.hildebrand
 */
public final class StepTokenizer {

    private final CharSequence text;
    private final int          end;
    private       int          pos;

    private StepTokenizer(CharSequence text, int start, int end) {
        this.text = text;
        this.pos = start;
        this.end = end;
    }

    /**
     * Tokenize a complete parenthesized argument list.
     *
     * @param text  the text holding the list
     * @param start offset of the opening parenthesis
     * @param end   offset one past the closing parenthesis
     * @return the top level arguments
     * @throws StepException.Syntax with the offset of the offending character
     */
    public static List<Token> tokenize(CharSequence text, int start, int end) {
        if (start < 0 || end > text.length() || start > end) {
            throw new IllegalArgumentException(String.format("Invalid span [%d, %d) of %d", start, end, text.length()));
        }
        var tokenizer = new StepTokenizer(text, start, end);
        tokenizer.skipBlanks();
        var arguments = tokenizer.list();
        tokenizer.skipBlanks();
        if (tokenizer.pos < end) {
            throw new StepException.Syntax(tokenizer.pos, "unexpected text after argument list");
        }
        return arguments;
    }

    public static List<Token> tokenize(CharSequence text) {
        return tokenize(text, 0, text.length());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int hex(char c) {
        return Character.digit(c, 16);
    }

    private char at(int i) {
        return i < end ? text.charAt(i) : '\0';
    }

    private Token derived() {
        pos++;
        return new Token.Derived();
    }

    private Token.Enumeration enumeration() {
        var start = pos;
        pos++;
        var nameStart = pos;
        while (pos < end && StepScanner.isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        if (pos == nameStart || at(pos) != '.') {
            throw new StepException.Syntax(start, "unterminated enumeration");
        }
        var name = text.subSequence(nameStart, pos).toString();
        pos++;
        return new Token.Enumeration(name);
    }

    private Token.Ref reference() {
        var start = pos;
        pos++;
        var digits = pos;
        while (pos < end && isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos == digits || pos - digits > 10) {
            throw new StepException.Syntax(start, "invalid entity reference");
        }
        var id = Long.parseLong(text, digits, pos, 10);
        if (id > EntityId.MAX_VALUE) {
            throw new StepException.Syntax(start, "entity reference out of range");
        }
        return new Token.Ref(id);
    }

    /**
     * {@code (} value {@code ,} value ... {@code )}, cursor on the opening parenthesis.
     */
    private List<Token> list() {
        if (at(pos) != '(') {
            throw new StepException.Syntax(pos, "expected '('");
        }
        pos++;
        var items = new ArrayList<Token>();
        skipBlanks();
        if (at(pos) == ')') {
            pos++;
            return items;
        }
        while (true) {
            items.add(value());
            skipBlanks();
            var c = at(pos);
            if (c == ',') {
                pos++;
            } else if (c == ')') {
                pos++;
                return items;
            } else if (pos >= end) {
                throw new StepException.Syntax(pos, "unterminated list");
            } else {
                throw new StepException.Syntax(pos, String.format("expected ',' or ')' but found '%s'", c));
            }
        }
    }

    private Token number() {
        var start = pos;
        if (at(pos) == '-' || at(pos) == '+') {
            pos++;
        }
        var digits = pos;
        while (pos < end && isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos == digits) {
            throw new StepException.Syntax(start, "expected digits");
        }
        var real = false;
        if (at(pos) == '.') {
            real = true;
            pos++;
            while (pos < end && isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (at(pos) == 'E' || at(pos) == 'e') {
            var mark = pos;
            pos++;
            if (at(pos) == '-' || at(pos) == '+') {
                pos++;
            }
            var exponent = pos;
            while (pos < end && isDigit(text.charAt(pos))) {
                pos++;
            }
            if (pos == exponent) {
                throw new StepException.Syntax(mark, "malformed exponent");
            }
            real = true;
        }
        var literal = text.subSequence(start, pos).toString();
        if (real) {
            return new Token.Real(Double.parseDouble(literal));
        }
        try {
            return new Token.Int(Long.parseLong(literal));
        } catch (NumberFormatException e) {
            return new Token.Real(Double.parseDouble(literal));
        }
    }

    private void skipBlanks() {
        while (pos < end) {
            var c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && at(pos + 1) == '*') {
                var close = pos + 2;
                while (close + 1 < end && !(text.charAt(close) == '*' && text.charAt(close + 1) == '/')) {
                    close++;
                }
                pos = Math.min(end, close + 2);
            } else {
                return;
            }
        }
    }

    /**
     * Quoted string with {@code ''} for an embedded quote, {@code \\} for a backslash and the {@code \X\hh},
     * {@code \X2\...\X0\}, {@code \X4\...\X0\} and {@code \S\c} character encodings.
     */
    private Token.Str string() {
        var start = pos;
        pos++;
        var sb = new StringBuilder();
        while (pos < end) {
            var c = text.charAt(pos);
            if (c == '\'') {
                if (at(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token.Str(sb.toString());
            }
            if (c == '\\') {
                pos = escape(sb, pos);
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new StepException.Syntax(start, "unterminated string");
    }

    /**
     * Decode one backslash directive starting at {@code i}, returning the offset after it. Unknown directives are
     * kept literally.
     */
    private int escape(StringBuilder sb, int i) {
        if (at(i + 1) == '\\') {
            sb.append('\\');
            return i + 2;
        }
        if (at(i + 1) == 'X' && at(i + 2) == '\\' && hex(at(i + 3)) >= 0 && hex(at(i + 4)) >= 0) {
            sb.append((char) (hex(at(i + 3)) * 16 + hex(at(i + 4))));
            return i + 5;
        }
        if (at(i + 1) == 'X' && (at(i + 2) == '2' || at(i + 2) == '4') && at(i + 3) == '\\') {
            var width = at(i + 2) == '2' ? 4 : 8;
            var j = i + 4;
            while (j + width <= end && hex(at(j)) >= 0) {
                var codePoint = 0;
                for (int k = 0; k < width; k++) {
                    var d = hex(at(j + k));
                    if (d < 0) {
                        throw new StepException.Syntax(j + k, "invalid hex digit in string escape");
                    }
                    codePoint = codePoint * 16 + d;
                }
                sb.appendCodePoint(codePoint);
                j += width;
            }
            if (at(j) == '\\' && at(j + 1) == 'X' && at(j + 2) == '0' && at(j + 3) == '\\') {
                return j + 4;
            }
            throw new StepException.Syntax(i, "unterminated \\X2\\ or \\X4\\ escape");
        }
        if (at(i + 1) == 'S' && at(i + 2) == '\\' && i + 3 < end) {
            sb.append((char) (at(i + 3) + 128));
            return i + 4;
        }
        sb.append('\\');
        return i + 1;
    }

    private Token typed() {
        var start = pos;
        while (pos < end && StepScanner.isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        var name = text.subSequence(start, pos).toString();
        skipBlanks();
        if (at(pos) != '(') {
            throw new StepException.Syntax(start, String.format("bare identifier '%s' is not a value", name));
        }
        return new Token.Typed(name, list());
    }

    private Token value() {
        skipBlanks();
        if (pos >= end) {
            throw new StepException.Syntax(pos, "unexpected end of arguments");
        }
        var c = text.charAt(pos);
        return switch (c) {
            case '#' -> reference();
            case '\'' -> string();
            case '"' -> binary();
            case '$' -> nil();
            case '*' -> derived();
            case '.' -> enumeration();
            case '(' -> new Token.Group(list());
            default -> {
                if (c == '-' || c == '+' || isDigit(c)) {
                    yield number();
                }
                if (StepScanner.isLetter(c)) {
                    yield typed();
                }
                throw new StepException.Syntax(pos, String.format("unexpected character '%s'", c));
            }
        };
    }

    /**
     * {@code "0ABC"} binary literal, kept as its hex text.
     */
    private Token binary() {
        var start = pos;
        var close = pos + 1;
        while (close < end && text.charAt(close) != '"') {
            close++;
        }
        if (close >= end) {
            throw new StepException.Syntax(start, "unterminated binary literal");
        }
        pos = close + 1;
        return new Token.Str(text.subSequence(start + 1, close).toString());
    }

    private Token nil() {
        pos++;
        return new Token.Null();
    }
}
