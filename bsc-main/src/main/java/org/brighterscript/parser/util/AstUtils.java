/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.brighterscript.parser.util;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.expr.CallExpression;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.IndexedGetExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.Block;
import org.brighterscript.parser.ast.stmt.MethodStatement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

public class AstUtils {

    /**
     * The range given to synthesized nodes. Fragments at this range are emitted without a mapping.
     */
    public static final Range INTERPOLATED_RANGE = Range.range(-1, -1, -1, -1);

    private AstUtils() {
    }

    public static boolean isInterpolated(Range range) {
        return range.begin.line < 0;
    }

    public static Range createRange(int beginLine, int beginColumn, int endLine, int endColumn) {
        return Range.range(beginLine, beginColumn, endLine, endColumn);
    }

    public static Range createRangeFromPositions(Position begin, Position end) {
        return new Range(begin, end);
    }

    /**
     * The smallest range covering every located item. Missing and synthesized items are skipped;
     * when nothing is left the interpolated range is returned.
     */
    public static Range createBoundingRange(Located... items) {
        Position begin = null;
        Position end = null;
        for (Located item : items) {
            if (item == null || item.getRange() == null || isInterpolated(item.getRange())) {
                continue;
            }
            Range range = item.getRange();
            if (begin == null || range.begin.isBefore(begin)) {
                begin = range.begin;
            }
            if (end == null || range.end.isAfter(end)) {
                end = range.end;
            }
        }
        if (begin == null) {
            return INTERPOLATED_RANGE;
        }
        return new Range(begin, end);
    }

    public static Range createBoundingRange(List<? extends Located> items) {
        return createBoundingRange(items.toArray(new Located[0]));
    }

    /**
     * Whether any start or end line of {@code a} equals any start or end line of {@code b}.
     */
    public static boolean linesTouch(Located a, Located b) {
        if (a == null || b == null || a.getRange() == null || b.getRange() == null) {
            return false;
        }
        Range ra = a.getRange();
        Range rb = b.getRange();
        if (isInterpolated(ra) || isInterpolated(rb)) {
            return false;
        }
        return ra.begin.line == rb.begin.line
                || ra.begin.line == rb.end.line
                || ra.end.line == rb.begin.line
                || ra.end.line == rb.end.line;
    }

    /**
     * Qualify an undotted class name with the namespace it is referenced from.
     */
    public static String getFullyQualifiedClassName(String className, String namespaceName) {
        if (className != null && !className.contains(".") && namespaceName != null && !namespaceName.isEmpty()) {
            return namespaceName + "." + className;
        }
        return className;
    }

    /**
     * The name of the synthesized builder function for a class, e.g. {@code __Alpha_Animal_builder}.
     */
    public static String getBuilderName(String className) {
        return "__" + className.replace('.', '_') + "_builder";
    }

    /**
     * The variable at the root of a chain of dotted gets, indexed gets and calls, e.g. {@code a} in
     * {@code a.b[0].c()}.
     */
    public static Optional<VariableExpression> findBeginningVariableExpression(Expression expression) {
        Expression current = expression;
        while (current != null) {
            if (current instanceof VariableExpression) {
                return Optional.of((VariableExpression) current);
            } else if (current instanceof DottedGetExpression) {
                current = ((DottedGetExpression) current).getObj();
            } else if (current instanceof IndexedGetExpression) {
                current = ((IndexedGetExpression) current).getObj();
            } else if (current instanceof CallExpression) {
                current = ((CallExpression) current).getCallee();
            } else {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * The identifier parts of a pure member-access chain such as {@code Alpha.Color.Red}, or empty
     * when the chain contains anything but variables and dotted gets.
     */
    public static Optional<List<String>> getDottedNameParts(Expression expression) {
        Deque<String> parts = new ArrayDeque<>();
        Expression current = expression;
        while (current instanceof DottedGetExpression) {
            DottedGetExpression dotted = (DottedGetExpression) current;
            parts.addFirst(dotted.getName().getText());
            current = dotted.getObj();
        }
        if (!(current instanceof VariableExpression)) {
            return Optional.empty();
        }
        parts.addFirst(((VariableExpression) current).getName().getText());
        return Optional.of(List.copyOf(parts));
    }

    /**
     * Parse the leading integer of a literal: decimal, {@code &h} or {@code 0x} hex, optionally
     * signed, ignoring trailing type designators such as {@code &} or {@code %}.
     */
    public static OptionalLong parseIntegerLiteral(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String value = text.trim();
        boolean negative = false;
        if (value.startsWith("-") || value.startsWith("+")) {
            negative = value.charAt(0) == '-';
            value = value.substring(1);
        }
        String lower = value.toLowerCase(Locale.ROOT);
        int radix = 10;
        if (lower.startsWith("&h") || lower.startsWith("0x")) {
            radix = 16;
            value = value.substring(2);
        }
        int end = 0;
        while (end < value.length() && Character.digit(value.charAt(end), radix) >= 0) {
            end++;
        }
        if (end == 0) {
            return OptionalLong.empty();
        }
        try {
            long parsed = Long.parseLong(value.substring(0, end), radix);
            return OptionalLong.of(negative ? -parsed : parsed);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    // creators for synthesized nodes

    public static Token createToken(TokenKind kind, String text) {
        return new Token(kind, text, INTERPOLATED_RANGE);
    }

    public static Token createToken(TokenKind kind, String text, Range range) {
        return new Token(kind, text, range == null ? INTERPOLATED_RANGE : range);
    }

    public static Token createIdentifier(String name, Range range) {
        return createToken(TokenKind.IDENTIFIER, name, range);
    }

    public static VariableExpression createVariableExpression(String name, Range range) {
        return new VariableExpression(createIdentifier(name, range));
    }

    public static LiteralExpression createInvalidLiteral(Range range) {
        return new LiteralExpression(createToken(TokenKind.INVALID, "invalid", range));
    }

    public static LiteralExpression createLiteral(TokenKind kind, String text, Range range) {
        return new LiteralExpression(createToken(kind, text, range));
    }

    /**
     * An empty {@code sub()}/{@code function()} with no parameters.
     */
    public static FunctionExpression createFunctionExpression(TokenKind kind) {
        boolean isSub = kind == TokenKind.SUB;
        return new FunctionExpression(
                createToken(kind, isSub ? "sub" : "function"),
                createToken(TokenKind.LEFT_PAREN, "("),
                List.of(),
                createToken(TokenKind.RIGHT_PAREN, ")"),
                null,
                null,
                new Block(List.of(), INTERPOLATED_RANGE),
                createToken(isSub ? TokenKind.END_SUB : TokenKind.END_FUNCTION, isSub ? "end sub" : "end function"));
    }

    public static MethodStatement createMethodStatement(String name, TokenKind kind) {
        return new MethodStatement(List.of(), createIdentifier(name, INTERPOLATED_RANGE), createFunctionExpression(kind), null);
    }

    /**
     * A zero-argument call {@code name()} whose tokens all sit at {@code range}.
     */
    public static CallExpression createCall(String name, Range range) {
        return new CallExpression(
                createVariableExpression(name, range),
                createToken(TokenKind.LEFT_PAREN, "(", range),
                createToken(TokenKind.RIGHT_PAREN, ")", range),
                List.of());
    }
}
