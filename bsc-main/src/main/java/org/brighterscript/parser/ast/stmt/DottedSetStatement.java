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

package org.brighterscript.parser.ast.stmt;

import com.github.javaparser.Range;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.BinaryExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * {@code obj.name = value}
 */
public class DottedSetStatement extends Statement {

    private Expression obj;
    private final Token name;
    private Expression value;
    private final Token dot;
    private final Token operator;

    public DottedSetStatement(Expression obj, Token name, Expression value, Token dot, Token operator) {
        this.obj = obj;
        this.name = name;
        this.value = value;
        this.dot = dot;
        this.operator = operator;
    }

    public Expression getObj() {
        return obj;
    }

    public void setObj(Expression obj) {
        this.obj = obj;
    }

    public Token getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    public Token getDot() {
        return dot;
    }

    public Token getOperator() {
        return operator;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(obj, dot, name, operator, value);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        if (BinaryExpression.isCompoundAssignment(value)) {
            return value.transpile(state);
        }
        return new TranspileResult()
                .addAll(obj.transpile(state))
                .add(".")
                .add(state.transpileToken(name))
                .add(" = ")
                .addAll(value.transpile(state));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getObj, this::setObj, visitor, options);
            walkChild(this::getValue, this::setValue, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
