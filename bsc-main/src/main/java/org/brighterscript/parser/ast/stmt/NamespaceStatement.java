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
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.expr.NamespacedVariableNameExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.symbols.SymbolTable;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.Optional;

/**
 * {@code namespace Alpha.Beta ... end namespace}. Namespaces have no runtime form: the body is
 * emitted at the namespace's own indentation and the names it declares are qualified instead.
 */
public class NamespaceStatement extends Statement implements TypedefProvider {

    private final Token keyword;
    private NamespacedVariableNameExpression nameExpression;
    private Body body;
    private final Token endKeyword;
    private final SymbolTable symbolTable;

    public NamespaceStatement(Token keyword, NamespacedVariableNameExpression nameExpression, Body body, Token endKeyword) {
        this.keyword = keyword;
        this.nameExpression = nameExpression;
        this.body = body;
        this.endKeyword = endKeyword;
        this.symbolTable = new SymbolTable("NamespaceStatement: '" + nameExpression.getName(ParseMode.BRIGHTERSCRIPT) + "'",
                () -> getParent() == null ? null : getParent().getSymbolTable());
    }

    public NamespacedVariableNameExpression getNameExpression() {
        return nameExpression;
    }

    public void setNameExpression(NamespacedVariableNameExpression nameExpression) {
        this.nameExpression = nameExpression;
    }

    public Body getBody() {
        return body;
    }

    public void setBody(Body body) {
        this.body = body;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    /**
     * The full name including every enclosing namespace, joined by the separator of {@code parseMode}.
     */
    public String getName(ParseMode parseMode) {
        String name = nameExpression.getName(parseMode);
        Optional<NamespaceStatement> parentNamespace = findAncestor(NamespaceStatement.class);
        if (parentNamespace.isPresent()) {
            name = parentNamespace.get().getName(parseMode) + parseMode.getNamespaceSeparator() + name;
        }
        return name;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(keyword, nameExpression, body, endKeyword);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return body.transpile(state);
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = TranspileResult.of("namespace ", getName(ParseMode.BRIGHTERSCRIPT), state.newline());
        state.incrementBlockDepth();
        result.addAll(body.getTypedef(state));
        state.decrementBlockDepth();
        return result.add(state.indent()).add("end namespace");
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getNameExpression, this::setNameExpression, visitor, options);
        } else {
            nameExpression.setParent(this);
        }
        body.setParent(this);
        if (!body.getStatements().isEmpty() && options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getBody, this::setBody, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
