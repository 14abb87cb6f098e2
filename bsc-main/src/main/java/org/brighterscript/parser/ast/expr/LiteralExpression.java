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
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * A literal, printed as its token text. String literals keep their quotes.
 */
public class LiteralExpression extends Expression {

    private final Token token;

    public LiteralExpression(Token token) {
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    /**
     * The BrightScript type name this literal evaluates to.
     */
    public String getTypeName() {
        switch (token.getKind()) {
            case STRING_LITERAL:
                return "string";
            case INTEGER_LITERAL:
                return "integer";
            case LONG_INTEGER_LITERAL:
                return "longinteger";
            case FLOAT_LITERAL:
                return "float";
            case DOUBLE_LITERAL:
                return "double";
            case TRUE:
            case FALSE:
                return "boolean";
            case INVALID:
                return "invalid";
            default:
                return "dynamic";
        }
    }

    @Override
    public Range getRange() {
        return token.getRange();
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult().add(state.transpileToken(token));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        // leaf
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
