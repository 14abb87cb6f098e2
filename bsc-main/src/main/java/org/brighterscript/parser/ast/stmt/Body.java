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
import org.brighterscript.symbols.SymbolTable;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;

/**
 * The statements of a file or a namespace. Top-level bodies carry the end-of-file token.
 */
public class Body extends Statement implements TypedefProvider {

    private final List<Statement> statements;
    private final Token eofToken;
    private final SymbolTable symbolTable =
            new SymbolTable("Body", () -> getParent() == null ? null : getParent().getSymbolTable());

    public Body(List<Statement> statements) {
        this(statements, null);
    }

    public Body(List<Statement> statements, Token eofToken) {
        this.statements = new ArrayList<>(statements);
        this.eofToken = eofToken;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Token getEofToken() {
        return eofToken;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(statements);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult();
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            Statement previous = i > 0 ? statements.get(i - 1) : null;
            Statement next = i < statements.size() - 1 ? statements.get(i + 1) : null;

            if (previous == null) {
                // first statement, no separator
            } else if (statement instanceof CommentStatement
                    && statement.getRange().begin.line == previous.getRange().end.line
                    && !AstUtils.isInterpolated(statement.getRange())) {
                result.add(" ");
            } else if (statement instanceof CommentStatement && next instanceof FunctionStatement) {
                result.add("\n\n");
            } else if (statement instanceof FunctionStatement && !(previous instanceof CommentStatement)) {
                result.add("\n\n");
            } else {
                result.add("\n");
            }
            result.addAll(statement.transpile(state));
        }
        return result;
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = new TranspileResult();
        for (Statement statement : statements) {
            if (statement instanceof TypedefProvider) {
                result.add(state.indent())
                        .addAll(((TypedefProvider) statement).getTypedef(state))
                        .add(state.newline());
            }
        }
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkList(statements, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
