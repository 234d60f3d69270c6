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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Metadata from the HEADER section: FILE_DESCRIPTION, FILE_NAME and FILE_SCHEMA. Absent fields are empty strings.
 *
 * @author hal.hildebrand
 */
public record StepHeader(String schema, String description, String fileName, String timestamp, String author,
                         String organization, String preprocessorVersion, String originatingSystem) {
    private static final Logger log = LoggerFactory.getLogger(StepHeader.class);

    public static final StepHeader EMPTY = new StepHeader("", "", "", "", "", "", "", "");

    /**
     * Read the header section of {@code content}. A header record that does not tokenize is logged and skipped.
     */
    public static StepHeader parse(String content) {
        var start = content.indexOf("HEADER;");
        if (start < 0) {
            return EMPTY;
        }
        var end = content.indexOf("ENDSEC;", start);
        if (end < 0) {
            end = content.length();
        }
        var schema = "";
        var description = "";
        List<Token> fileName = List.of();
        var pos = start + "HEADER;".length();
        while (pos < end) {
            var open = content.indexOf('(', pos);
            if (open < 0 || open >= end) {
                break;
            }
            var name = content.substring(pos, open).strip();
            var close = recordEnd(content, open, end);
            if (close < 0) {
                break;
            }
            try {
                var args = StepTokenizer.tokenize(content, open, close);
                switch (name) {
                    case "FILE_SCHEMA" -> schema = first(args, 0);
                    case "FILE_DESCRIPTION" -> description = first(args, 0);
                    case "FILE_NAME" -> fileName = args;
                    default -> log.trace("Ignoring header record {}", name);
                }
            } catch (StepException.Syntax e) {
                log.warn("Skipping unreadable header record {}: {}", name, e.getMessage());
            }
            pos = content.indexOf(';', close) + 1;
            if (pos <= 0) {
                break;
            }
        }
        return new StepHeader(schema, description, first(fileName, 0), first(fileName, 1), first(fileName, 2),
                              first(fileName, 3), first(fileName, 4), first(fileName, 5));
    }

    /**
     * The string at {@code index}, or the first string of a list at {@code index}.
     */
    private static String first(List<Token> args, int index) {
        if (index >= args.size()) {
            return "";
        }
        return text(args.get(index)).orElse("");
    }

    /**
     * Offset one past the closing parenthesis matching {@code open}, or -1.
     */
    private static int recordEnd(String content, int open, int limit) {
        var depth = 0;
        var inString = false;
        for (int i = open; i < limit; i++) {
            var c = content.charAt(i);
            if (c == '\'') {
                if (inString && i + 1 < limit && content.charAt(i + 1) == '\'') {
                    i++;
                } else {
                    inString = !inString;
                }
            } else if (!inString && c == '(') {
                depth++;
            } else if (!inString && c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private static Optional<String> text(Token token) {
        if (token instanceof Token.Str s) {
            return Optional.of(s.value());
        }
        if (token instanceof Token.Group g) {
            for (var item : g.items()) {
                var value = text(item);
                if (value.isPresent() && !value.get().isEmpty()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }
}
