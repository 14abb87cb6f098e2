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

public class CatchStatement extends Statement {

    private static final String DEFAULT_EXCEPTION_VARIABLE = "e";

    private final Token catchToken;
    private final Token exceptionVariable;
    private Block catchBranch;

    public CatchStatement(Token catchToken, Token exceptionVariable, Block catchBranch) {
        this.catchToken = catchToken;
        this.exceptionVariable = exceptionVariable;
        this.catchBranch = catchBranch;
    }

    public Token getExceptionVariable() {
        return exceptionVariable;
    }

    public Block getCatchBranch() {
        return catchBranch;
    }

    public void setCatchBranch(Block catchBranch) {
        this.catchBranch = catchBranch;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(catchToken, exceptionVariable, catchBranch);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(catchToken, "catch"))
                .add(" ")
                .add(exceptionVariable == null ? DEFAULT_EXCEPTION_VARIABLE : exceptionVariable.getText());
        if (catchBranch != null) {
            result.addAll(state.withLineage(this, () -> catchBranch.transpile(state)));
        }
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getCatchBranch, this::setCatchBranch, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
