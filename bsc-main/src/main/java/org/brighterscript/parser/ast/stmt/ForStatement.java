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

/**
 * {@code for i = 0 to n step 2 ... end for}
 */
public class ForStatement extends Statement {

    private final Token forToken;
    private AssignmentStatement counterDeclaration;
    private final Token toToken;
    private Expression finalValue;
    private Block body;
    private final Token endForToken;
    private final Token stepToken;
    private Expression increment;

    public ForStatement(Token forToken, AssignmentStatement counterDeclaration, Token toToken, Expression finalValue,
                        Block body, Token endForToken, Token stepToken, Expression increment) {
        this.forToken = forToken;
        this.counterDeclaration = counterDeclaration;
        this.toToken = toToken;
        this.finalValue = finalValue;
        this.body = body;
        this.endForToken = endForToken;
        this.stepToken = stepToken;
        this.increment = increment;
    }

    public AssignmentStatement getCounterDeclaration() {
        return counterDeclaration;
    }

    public void setCounterDeclaration(AssignmentStatement counterDeclaration) {
        this.counterDeclaration = counterDeclaration;
    }

    public Expression getFinalValue() {
        return finalValue;
    }

    public void setFinalValue(Expression finalValue) {
        this.finalValue = finalValue;
    }

    public Expression getIncrement() {
        return increment;
    }

    public void setIncrement(Expression increment) {
        this.increment = increment;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(forToken, endForToken == null ? body : endForToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(forToken))
                .add(" ")
                .addAll(counterDeclaration.transpile(state))
                .add(" ")
                .add(state.transpileToken(toToken, "to"))
                .add(" ")
                .addAll(finalValue.transpile(state));
        if (stepToken != null) {
            result.add(" ")
                    .add(state.transpileToken(stepToken))
                    .add(" ")
                    .addAll(increment.transpile(state));
        }
        result.addAll(state.withLineage(this, () -> body.transpile(state)));
        return result.add("\n")
                .add(state.indent())
                .add(state.transpileToken(endForToken, "end for"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getCounterDeclaration, this::setCounterDeclaration, visitor, options);
        }
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getFinalValue, this::setFinalValue, visitor, options);
            walkChild(this::getIncrement, this::setIncrement, visitor, options);
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
