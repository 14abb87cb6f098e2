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

package org.brighterscript.parser.ast.expr;

import com.github.javaparser.Range;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * {@code left op right}. Compound assignments such as {@code x += 1} are binary expressions whose
 * operator {@link org.brighterscript.parser.TokenKind#isCompoundAssignment() is a compound assignment}.
 */
public class BinaryExpression extends Expression {

    private Expression left;
    private final Token operator;
    private Expression right;

    public BinaryExpression(Expression left, Token operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = left;
    }

    public Token getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = right;
    }

    public boolean isCompoundAssignment() {
        return operator.getKind().isCompoundAssignment();
    }

    /**
     * Whether {@code expression} is a compound assignment, which already carries its own target.
     */
    public static boolean isCompoundAssignment(Expression expression) {
        return expression instanceof BinaryExpression && ((BinaryExpression) expression).isCompoundAssignment();
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(left, operator, right);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult()
                .addAll(left.transpile(state))
                .add(" ")
                .add(state.transpileToken(operator))
                .add(" ")
                .addAll(right.transpile(state));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getLeft, this::setLeft, visitor, options);
            walkChild(this::getRight, this::setRight, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
