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
 * Single pass scanner over the DATA section of a STEP exchange file. Locates {@code #id = TYPE(args);} records
 * without tokenizing their arguments; the argument list is kept as a span into the text.
 * <p>
 * Not thread safe and not restartable. A record whose prefix cannot be read fails with
 * {@link StepException.MalformedRecord}; the scanner has already moved past that record, so scanning may continue
 * with the next call.
 *
 * @author hal.hildebrand
 */
public class StepScanner {

    public static final String PHASE = "scanning";

    private static final String DATA_SECTION = "DATA;";
    private static final String END_SECTION  = "ENDSEC;";

    private final String           content;
    private final int              length;
    private final ProgressListener progress;
    private final int              progressInterval;
    private       int              pos;
    private       int              scanned;
    private       boolean          finished;
    private       double           lastFraction;

    public StepScanner(String content) {
        this(content, ProgressListener.NONE, Integer.MAX_VALUE);
    }

    /**
     * @param content          the complete file text
     * @param progress         invoked every {@code progressInterval} records and once at the end
     * @param progressInterval records between progress reports, positive
     */
    public StepScanner(String content, ProgressListener progress, int progressInterval) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("Progress interval must be positive: " + progressInterval);
        }
        this.content = content;
        this.length = content.length();
        this.progress = progress;
        this.progressInterval = progressInterval;
        var data = content.indexOf(DATA_SECTION);
        this.pos = data < 0 ? 0 : data + DATA_SECTION.length();
    }

    /**
     * @return the number of well formed records returned so far
     */
    public int getScanned() {
        return scanned;
    }

    /**
     * @return the offset the next scan starts from
     */
    public int getPosition() {
        return pos;
    }

    /**
     * @return the next record in file order, or empty at the end of the DATA section
     */
    public Optional<RawEntity> next() {
        if (finished) {
            return Optional.empty();
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new StepException.Cancelled(pos);
        }
        skipBlanks();
        if (pos >= length || content.startsWith(END_SECTION, pos)) {
            finish();
            return Optional.empty();
        }

        var start = pos;
        if (content.charAt(pos) != '#') {
            throw malformed(start, "expected '#'");
        }
        pos++;
        var digitsStart = pos;
        while (pos < length && isDigit(content.charAt(pos))) {
            pos++;
        }
        if (pos == digitsStart) {
            throw malformed(start, "expected entity id digits");
        }
        if (pos - digitsStart > 10) {
            throw malformed(start, "entity id too large");
        }
        var value = Long.parseLong(content, digitsStart, pos, 10);
        if (value > EntityId.MAX_VALUE) {
            throw malformed(start, "entity id too large");
        }
        skipInlineBlanks();
        if (pos >= length || content.charAt(pos) != '=') {
            throw malformed(start, "expected '=' after entity id");
        }
        pos++;
        skipInlineBlanks();
        var typeStart = pos;
        if (pos < length && isLetter(content.charAt(pos))) {
            while (pos < length && isIdentifierPart(content.charAt(pos))) {
                pos++;
            }
        }
        if (pos == typeStart) {
            throw malformed(start, "expected type name");
        }
        var typeName = content.substring(typeStart, pos);
        skipInlineBlanks();
        if (pos >= length || content.charAt(pos) != '(') {
            throw malformed(start, "expected '(' after type name");
        }
        var argStart = pos;
        var terminator = findTerminator(pos);
        if (terminator < 0) {
            pos = length;
            throw new StepException.MalformedRecord(start, fragment(start, length), "unterminated record");
        }
        var argEnd = trimTrailing(argStart, terminator);
        pos = terminator + 1;
        if (argEnd - argStart < 2 || content.charAt(argEnd - 1) != ')') {
            throw new StepException.MalformedRecord(start, fragment(start, pos), "expected ')' before ';'");
        }

        scanned++;
        if (scanned % progressInterval == 0) {
            report((double) pos / Math.max(1, length));
        }
        return Optional.of(new RawEntity(EntityId.of(value), typeName, start, argStart, argEnd));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }

    static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private boolean isCommentStart(int i) {
        return content.charAt(i) == '/' && i + 1 < length && content.charAt(i + 1) == '*';
    }

    /**
     * @return the offset of the last character of the comment opening at {@code i}, or -1 if it is not closed
     */
    private int commentEnd(int i) {
        var close = content.indexOf("*/", i + 2);
        return close < 0 ? -1 : close + 1;
    }

    /**
     * @return the offset of the {@code ;} ending the record that starts at {@code from}, or -1
     */
    private int findTerminator(int from) {
        var inString = false;
        for (int i = from; i < length; i++) {
            var c = content.charAt(i);
            if (c == '\'') {
                if (inString && i + 1 < length && content.charAt(i + 1) == '\'') {
                    i++;
                } else {
                    inString = !inString;
                }
            } else if (!inString && isCommentStart(i)) {
                i = commentEnd(i);
                if (i < 0) {
                    return -1;
                }
            } else if (c == ';' && !inString) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return {@code end} moved back over whitespace and comments, not past {@code start}
     */
    private int trimTrailing(int start, int end) {
        while (end > start) {
            if (Character.isWhitespace(content.charAt(end - 1))) {
                end--;
            } else if (end - start >= 4 && content.startsWith("*/", end - 2)) {
                var open = content.lastIndexOf("/*", end - 3);
                if (open < start) {
                    return end;
                }
                end = open;
            } else {
                return end;
            }
        }
        return end;
    }

    private void finish() {
        finished = true;
        report(1.0);
    }

    private String fragment(int from, int to) {
        var end = Math.min(to, from + 40);
        return content.substring(from, end).strip();
    }

    /**
     * Consume the bad record: through its {@code ;}, or up to the next line that starts a record, whichever is first.
     * A line starting with {@code #} inside an open argument list continues the record.
     */
    private StepException.MalformedRecord malformed(int start, String detail) {
        var inString = false;
        var depth = 0;
        var i = start;
        var resume = length;
        while (i < length) {
            var c = content.charAt(i);
            if (c == '\'') {
                if (inString && i + 1 < length && content.charAt(i + 1) == '\'') {
                    i++;
                } else {
                    inString = !inString;
                }
            } else if (!inString && isCommentStart(i)) {
                var end = commentEnd(i);
                if (end < 0) {
                    break;
                }
                i = end;
            } else if (!inString && c == '(') {
                depth++;
            } else if (!inString && c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (!inString && c == ';') {
                resume = i + 1;
                break;
            } else if (!inString && c == '\n' && depth == 0) {
                var j = i + 1;
                while (j < length && (content.charAt(j) == ' ' || content.charAt(j) == '\t'
                                      || content.charAt(j) == '\r')) {
                    j++;
                }
                if (j < length && content.charAt(j) == '#') {
                    resume = j;
                    break;
                }
            }
            i++;
        }
        pos = resume;
        return new StepException.MalformedRecord(start, fragment(start, resume), detail);
    }

    private void report(double fraction) {
        var clamped = Math.max(lastFraction, Math.min(1.0, fraction));
        lastFraction = clamped;
        progress.onProgress(PHASE, clamped);
    }

    private void skipBlanks() {
        while (pos < length) {
            var c = content.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (isCommentStart(pos)) {
                var end = commentEnd(pos);
                pos = end < 0 ? length : end + 1;
            } else {
                return;
            }
        }
    }

    private void skipInlineBlanks() {
        while (pos < length && Character.isWhitespace(content.charAt(pos))) {
            pos++;
        }
    }
}
