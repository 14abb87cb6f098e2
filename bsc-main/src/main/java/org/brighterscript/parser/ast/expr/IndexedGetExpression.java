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
 * {@code obj[index]}
 */
public class IndexedGetExpression extends Expression {

    private Expression obj;
    private Expression index;
    private final Token openingSquare;
    private final Token closingSquare;

    public IndexedGetExpression(Expression obj, Token openingSquare, Expression index, Token closingSquare) {
        this.obj = obj;
        this.openingSquare = openingSquare;
        this.index = index;
        this.closingSquare = closingSquare;
    }

    public Expression getObj() {
        return obj;
    }

    public void setObj(Expression obj) {
        this.obj = obj;
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = index;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(obj, openingSquare, index, closingSquare);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult()
                .addAll(obj.transpile(state))
                .add(state.transpileToken(openingSquare, "["))
                .addAll(index.transpile(state))
                .add(state.transpileToken(closingSquare, "]"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getObj, this::setObj, visitor, options);
            walkChild(this::getIndex, this::setIndex, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
