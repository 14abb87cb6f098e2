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
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.stmt.Block;
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
 * A {@code function}/{@code sub} with parameters, optional return type and body. Named functions
 * are wrapped by a {@link org.brighterscript.parser.ast.stmt.FunctionStatement}; anonymous ones
 * appear directly as values, which is also how class methods are emitted.
 */
public class FunctionExpression extends Expression {

    private final Token functionType;
    private final Token leftParen;
    private final List<FunctionParameterExpression> parameters;
    private final Token rightParen;
    private final Token asToken;
    private final Token returnTypeToken;
    private Block body;
    private final Token end;

    public FunctionExpression(Token functionType, Token leftParen, List<FunctionParameterExpression> parameters,
                              Token rightParen, Token asToken, Token returnTypeToken, Block body, Token end) {
        this.functionType = functionType;
        this.leftParen = leftParen;
        this.parameters = new ArrayList<>(parameters);
        this.rightParen = rightParen;
        this.asToken = asToken;
        this.returnTypeToken = returnTypeToken;
        this.body = body;
        this.end = end;
    }

    public Token getFunctionType() {
        return functionType;
    }

    public boolean isSub() {
        return functionType.getKind() == TokenKind.SUB;
    }

    public List<FunctionParameterExpression> getParameters() {
        return parameters;
    }

    public Token getAsToken() {
        return asToken;
    }

    public Token getReturnTypeToken() {
        return returnTypeToken;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    public Token getEnd() {
        return end;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(functionType, leftParen, rightParen, asToken, returnTypeToken, body, end);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return transpile(state, null, true);
    }

    /**
     * @param name        the emitted name, or {@code null} for an anonymous function
     * @param includeBody {@code false} renders the signature followed directly by the end keyword
     */
    public TranspileResult transpile(BrsTranspileState state, Token name, boolean includeBody) {
        TranspileResult result = new TranspileResult().add(state.transpileToken(functionType));
        if (name != null) {
            result.add(" ").add(state.transpileToken(name));
        }
        result.add(state.transpileToken(leftParen, "("));
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            result.addAll(parameters.get(i).transpile(state));
        }
        result.add(state.transpileToken(rightParen, ")"));
        if (asToken != null && returnTypeToken != null) {
            result.add(" ")
                    .add(state.transpileToken(asToken))
                    .add(" ")
                    .add(state.transpileToken(returnTypeToken));
        }
        if (includeBody) {
            result.addAll(state.withLineage(this, () -> body.transpile(state)));
        }
        result.add(state.newline())
                .add(state.indent())
                .add(state.transpileToken(end, isSub() ? "end sub" : "end function"));
        return result;
    }

    public TranspileResult getTypedef(BrsTranspileState state, Token name) {
        return transpile(state, name, false);
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkList(parameters, visitor, options);
        }
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getBody, this::setBody, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
