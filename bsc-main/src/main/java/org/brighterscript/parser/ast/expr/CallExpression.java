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

import java.util.ArrayList;
import java.util.List;

/**
 * {@code callee(arg1, arg2)}
 */
public class CallExpression extends Expression {

    private Expression callee;
    private final Token openingParen;
    private final Token closingParen;
    private final List<Expression> args;

    public CallExpression(Expression callee, Token openingParen, Token closingParen, List<Expression> args) {
        this.callee = callee;
        this.openingParen = openingParen;
        this.closingParen = closingParen;
        this.args = new ArrayList<>(args);
    }

    public Expression getCallee() {
        return callee;
    }

    public void setCallee(Expression callee) {
        this.callee = callee;
    }

    public Token getOpeningParen() {
        return openingParen;
    }

    public Token getClosingParen() {
        return closingParen;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(callee, openingParen, closingParen);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .addAll(callee.transpile(state))
                .add(state.transpileToken(openingParen, "("));
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            result.addAll(args.get(i).transpile(state));
        }
        return result.add(state.transpileToken(closingParen, ")"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getCallee, this::setCallee, visitor, options);
            walkList(args, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
