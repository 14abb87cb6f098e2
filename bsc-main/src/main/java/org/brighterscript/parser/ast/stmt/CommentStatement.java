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
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more consecutive comment lines. Comments may sit wherever a statement or an expression
 * may, so they are visited in both modes.
 */
public class CommentStatement extends Statement implements TypedefProvider {

    private final List<Token> comments;

    public CommentStatement(List<Token> comments) {
        this.comments = List.copyOf(comments);
    }

    public List<Token> getComments() {
        return comments;
    }

    public String getText() {
        return comments.stream().map(Token::getText).collect(Collectors.joining("\n"));
    }

    @Override
    public int getVisitMode() {
        return WalkMode.VISIT_STATEMENTS_FLAG | WalkMode.VISIT_EXPRESSIONS_FLAG;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(comments);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult();
        for (int i = 0; i < comments.size(); i++) {
            if (i > 0) {
                result.add(state.indent());
            }
            result.add(state.transpileToken(comments.get(i)));
            if (i < comments.size() - 1) {
                result.add("\n");
            }
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
