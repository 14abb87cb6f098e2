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

import java.util.regex.Pattern;

/**
 * {@code import "pkg:/source/lib.bs"}. Scripts are wired up by the component xml, so the emitted
 * code only keeps the import as a comment.
 */
public class ImportStatement extends Statement implements TypedefProvider {

    private static final Pattern BS_EXTENSION = Pattern.compile("\\.bs\"?$", Pattern.CASE_INSENSITIVE);

    private final Token importToken;
    private final Token filePathToken;

    public ImportStatement(Token importToken, Token filePathToken) {
        this.importToken = importToken;
        this.filePathToken = filePathToken;
    }

    /**
     * The imported path without quotes, or {@code null} when the path is missing.
     */
    public String getFilePath() {
        return filePathToken == null ? null : filePathToken.getText().replace("\"", "");
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(importToken, filePathToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult()
                .add("'")
                .add(state.transpileToken(importToken))
                .add(" ")
                .add(state.transpileToken(requireToken(filePathToken, "import path")));
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        String path = requireToken(filePathToken, "import path").getText();
        return TranspileResult.of(importToken.getText(), " ", BS_EXTENSION.matcher(path).replaceFirst(".brs\""));
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
