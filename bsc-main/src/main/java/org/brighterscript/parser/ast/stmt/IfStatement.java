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
 * {@code if ... then ... else ... end if}. The else branch is either a {@link Block} or, for
 * {@code else if} chains, another {@code IfStatement} that emits the rest of the chain itself.
 */
public class IfStatement extends Statement {

    private final Token ifToken;
    private final Token thenToken;
    private final Token elseToken;
    private final Token endIfToken;
    private Expression condition;
    private Block thenBranch;
    private Statement elseBranch;
    private final boolean inline;

    public IfStatement(Token ifToken, Token thenToken, Token elseToken, Token endIfToken,
                       Expression condition, Block thenBranch, Statement elseBranch) {
        this(ifToken, thenToken, elseToken, endIfToken, condition, thenBranch, elseBranch, false);
    }

    public IfStatement(Token ifToken, Token thenToken, Token elseToken, Token endIfToken,
                       Expression condition, Block thenBranch, Statement elseBranch, boolean inline) {
        if (elseBranch != null && !(elseBranch instanceof Block) && !(elseBranch instanceof IfStatement)) {
            throw new IllegalArgumentException("Else branch must be a block or an if statement");
        }
        this.ifToken = ifToken;
        this.thenToken = thenToken;
        this.elseToken = elseToken;
        this.endIfToken = endIfToken;
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
        this.inline = inline;
    }

    public Token getIfToken() {
        return ifToken;
    }

    public Token getElseToken() {
        return elseToken;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public void setThenBranch(Block thenBranch) {
        this.thenBranch = thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public void setElseBranch(Statement elseBranch) {
        this.elseBranch = elseBranch;
    }

    public boolean isInline() {
        return inline;
    }

    @Override
    public Range getRange() {
        Statement last = elseBranch != null ? elseBranch : thenBranch;
        return AstUtils.createBoundingRange(ifToken, endIfToken != null ? endIfToken : last);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(ifToken))
                .add(" ")
                .addAll(condition.transpile(state));
        if (thenToken != null) {
            result.add(" ").add(state.transpileToken(thenToken));
        }
        TranspileResult thenNodes = state.withLineage(this, () -> thenBranch.transpile(state));
        if (!thenNodes.isEmpty()) {
            result.addAll(thenNodes);
        }
        result.add("\n");

        if (elseToken != null) {
            result.add(state.indent()).add(state.transpileToken(elseToken));
        }

        if (elseBranch instanceof IfStatement) {
            IfStatement elseIf = (IfStatement) elseBranch;
            TranspileResult body = state.withLineage(elseIf, () -> elseIf.transpile(state));
            if (!body.isEmpty()) {
                // the chained if emits everything up to and including the final end if
                result.add(elseIf.getIfToken().getLeadingWhitespace());
                return result.addAll(body);
            }
            result.add("\n");
        } else if (elseBranch != null) {
            TranspileResult body = state.withLineage(elseToken, () -> elseBranch.transpile(state));
            result.addAll(body).add("\n");
        }

        return result.add(state.indent())
                .add(state.transpileToken(endIfToken, "end if"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getCondition, this::setCondition, visitor, options);
        }
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getThenBranch, this::setThenBranch, visitor, options);
            walkChild(this::getElseBranch, this::setElseBranch, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
