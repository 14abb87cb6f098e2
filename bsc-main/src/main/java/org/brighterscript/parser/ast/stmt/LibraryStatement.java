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
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * {@code library "v30/bslCore.brs"}. A missing path is a parse error upstream; here it is tolerated.
 */
public class LibraryStatement extends Statement implements TypedefProvider {

    private final Token libraryToken;
    private final Token filePath;

    public LibraryStatement(Token libraryToken, Token filePath) {
        this.libraryToken = libraryToken;
        this.filePath = filePath;
    }

    public Token getFilePath() {
        return filePath;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(libraryToken, filePath);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult().add(state.transpileToken(libraryToken));
        if (filePath != null) {
            result.add(" ").add(state.transpileToken(filePath));
        }
        return result;
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        return transpile(state);
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
