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
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

public class ThrowStatement extends Statement {

    /**
     * Thrown in place of a missing expression.
     */
    public static final String DEFAULT_MESSAGE = "\"An error has occurred\"";

    private final Token throwToken;
    private Expression expression;

    public ThrowStatement(Token throwToken, Expression expression) {
        this.throwToken = throwToken;
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(throwToken, expression);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(throwToken, "throw"))
                .add(" ");
        if (expression != null) {
            return result.addAll(expression.transpile(state));
        }
        return result.add(DEFAULT_MESSAGE);
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (expression != null && options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getExpression, this::setExpression, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
