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
 * {@code name = defaultValue as type}; the default value and type are optional.
 */
public class FunctionParameterExpression extends Expression {

    private final Token name;
    private final Token equals;
    private Expression defaultValue;
    private final Token asToken;
    private final Token typeToken;

    public FunctionParameterExpression(Token name, Token equals, Expression defaultValue, Token asToken, Token typeToken) {
        this.name = name;
        this.equals = equals;
        this.defaultValue = defaultValue;
        this.asToken = asToken;
        this.typeToken = typeToken;
    }

    public Token getName() {
        return name;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(Expression defaultValue) {
        this.defaultValue = defaultValue;
    }

    public Token getAsToken() {
        return asToken;
    }

    public Token getTypeToken() {
        return typeToken;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(name, equals, defaultValue, asToken, typeToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult().add(state.transpileToken(name));
        if (defaultValue != null) {
            result.add(" = ").addAll(defaultValue.transpile(state));
        }
        if (asToken != null && typeToken != null) {
            result.add(" ")
                    .add(state.transpileToken(asToken))
                    .add(" ")
                    .add(state.transpileToken(typeToken));
        }
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getDefaultValue, this::setDefaultValue, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
