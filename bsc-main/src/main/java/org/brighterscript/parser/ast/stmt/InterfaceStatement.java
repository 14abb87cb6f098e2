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
import org.brighterscript.parser.Located;
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
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code interface Name extends Parent ... end interface}. Interfaces only exist for type checking;
 * they lower to nothing and only appear in typedefs.
 */
public class InterfaceStatement extends Statement implements TypedefProvider {

    private final Token interfaceToken;
    private final Token name;
    private final Token extendsToken;
    private final NamespacedVariableNameExpression parentInterfaceName;
    private final List<Statement> body;
    private final Token endInterfaceToken;

    public InterfaceStatement(Token interfaceToken, Token name, Token extendsToken,
                              NamespacedVariableNameExpression parentInterfaceName,
                              List<Statement> body, Token endInterfaceToken) {
        this.interfaceToken = interfaceToken;
        this.name = name;
        this.extendsToken = extendsToken;
        this.parentInterfaceName = parentInterfaceName;
        this.body = new ArrayList<>(body);
        this.endInterfaceToken = endInterfaceToken;
    }

    public String getName() {
        return name.getText();
    }

    public List<Statement> getBody() {
        return body;
    }

    public NamespacedVariableNameExpression getParentInterfaceName() {
        return parentInterfaceName;
    }

    public List<InterfaceFieldStatement> getFields() {
        return body.stream()
                .filter(InterfaceFieldStatement.class::isInstance)
                .map(InterfaceFieldStatement.class::cast)
                .collect(Collectors.toList());
    }

    public List<InterfaceMethodStatement> getMethods() {
        return body.stream()
                .filter(InterfaceMethodStatement.class::isInstance)
                .map(InterfaceMethodStatement.class::cast)
                .collect(Collectors.toList());
    }

    public String getName(ParseMode parseMode) {
        Optional<NamespaceStatement> namespace = findAncestor(NamespaceStatement.class);
        if (namespace.isPresent()) {
            return namespace.get().getName(parseMode) + parseMode.getNamespaceSeparator() + name.getText();
        }
        return name.getText();
    }

    public String getFullName() {
        return getName(ParseMode.BRIGHTERSCRIPT);
    }

    @Override
    public Range getRange() {
        List<Located> parts = new ArrayList<>();
        parts.add(interfaceToken);
        parts.add(name);
        parts.add(extendsToken);
        parts.add(parentInterfaceName);
        parts.addAll(body);
        parts.add(endInterfaceToken);
        return AstUtils.createBoundingRange(parts.toArray(new Located[0]));
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return TranspileResult.empty();
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state)
                .add(interfaceToken == null ? "interface" : interfaceToken.getText())
                .add(" ")
                .add(name.getText());
        if (parentInterfaceName != null) {
            result.add(" extends ").add(parentInterfaceName.getName(ParseMode.BRIGHTERSCRIPT));
        }
        if (!body.isEmpty()) {
            state.incrementBlockDepth();
        }
        for (Statement statement : body) {
            result.add(state.newline()).add(state.indent());
            if (statement instanceof InterfaceFieldStatement || statement instanceof InterfaceMethodStatement) {
                result.addAll(((TypedefProvider) statement).getTypedef(state));
            } else {
                result.addAll(statement.transpile(state));
            }
        }
        if (!body.isEmpty()) {
            state.decrementBlockDepth();
        }
        return result.add(state.newline())
                .add(state.indent())
                .add("end interface")
                .add(state.newline());
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (parentInterfaceName != null) {
            parentInterfaceName.setParent(this);
            parentInterfaceName.walk(null, options);
        }
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkList(body, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
