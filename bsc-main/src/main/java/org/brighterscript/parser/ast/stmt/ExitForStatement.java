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
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

public class ExitForStatement extends Statement {

    private final Token exitForToken;

    public ExitForStatement(Token exitForToken) {
        this.exitForToken = exitForToken;
    }

    public Token getExitForToken() {
        return exitForToken;
    }

    @Override
    public Range getRange() {
        return exitForToken.getRange();
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult().add(state.transpileToken(exitForToken));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        // nothing to walk
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
