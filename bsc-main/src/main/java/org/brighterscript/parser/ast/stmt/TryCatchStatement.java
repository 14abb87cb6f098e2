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
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * {@code try ... catch e ... end try}. A missing catch clause still emits a bare {@code catch}
 * line so the output stays valid.
 */
public class TryCatchStatement extends Statement {

    private final Token tryToken;
    private final Token endTryToken;
    private Block tryBranch;
    private CatchStatement catchStatement;

    public TryCatchStatement(Token tryToken, Token endTryToken, Block tryBranch, CatchStatement catchStatement) {
        this.tryToken = tryToken;
        this.endTryToken = endTryToken;
        this.tryBranch = tryBranch;
        this.catchStatement = catchStatement;
    }

    public Block getTryBranch() {
        return tryBranch;
    }

    public void setTryBranch(Block tryBranch) {
        this.tryBranch = tryBranch;
    }

    public CatchStatement getCatchStatement() {
        return catchStatement;
    }

    public void setCatchStatement(CatchStatement catchStatement) {
        this.catchStatement = catchStatement;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(tryToken, tryBranch, catchStatement, endTryToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult().add(state.transpileToken(tryToken, "try"));
        if (tryBranch != null) {
            result.addAll(state.withLineage(this, () -> tryBranch.transpile(state)));
        }
        result.add(state.newline()).add(state.indent());
        if (catchStatement != null) {
            result.addAll(catchStatement.transpile(state));
        } else {
            result.add("catch");
        }
        return result.add(state.newline())
                .add(state.indent())
                .add(state.transpileToken(endTryToken, "end try"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getTryBranch, this::setTryBranch, visitor, options);
            walkChild(this::getCatchStatement, this::setCatchStatement, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
