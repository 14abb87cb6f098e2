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
 * {@code obj.name}
 */
public class DottedGetExpression extends Expression {

    private Expression obj;
    private final Token dot;
    private Token name;

    public DottedGetExpression(Expression obj, Token dot, Token name) {
        this.obj = obj;
        this.dot = dot;
        this.name = name;
    }

    public Expression getObj() {
        return obj;
    }

    public void setObj(Expression obj) {
        this.obj = obj;
    }

    public Token getDot() {
        return dot;
    }

    public Token getName() {
        return name;
    }

    public void setName(Token name) {
        this.name = name;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(obj, dot, name);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult()
                .addAll(obj.transpile(state))
                .add(state.transpileToken(dot, "."))
                .add(state.transpileToken(name));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getObj, this::setObj, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
