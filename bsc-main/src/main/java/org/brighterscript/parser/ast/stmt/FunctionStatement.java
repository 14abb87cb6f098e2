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
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.Optional;

/**
 * A named function or sub. Inside a namespace the emitted name is flattened, e.g.
 * {@code Alpha_Beta_doWork}.
 */
public class FunctionStatement extends Statement implements TypedefProvider {

    private final Token name;
    private FunctionExpression func;

    public FunctionStatement(Token name, FunctionExpression func) {
        this.name = name;
        this.func = func;
    }

    public Token getName() {
        return name;
    }

    public FunctionExpression getFunc() {
        return func;
    }

    public void setFunc(FunctionExpression func) {
        this.func = func;
    }

    public Optional<NamespaceStatement> getNamespace() {
        return findAncestor(NamespaceStatement.class);
    }

    public String getName(ParseMode parseMode) {
        Optional<NamespaceStatement> namespace = getNamespace();
        if (namespace.isPresent()) {
            return namespace.get().getName(parseMode) + parseMode.getNamespaceSeparator() + name.getText();
        }
        return name.getText();
    }

    @Override
    public Range getRange() {
        return func.getRange();
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return func.transpile(state, name.withText(getName(ParseMode.BRIGHTSCRIPT)), true);
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        return getAnnotationTypedef(state).addAll(func.getTypedef(state, name));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getFunc, this::setFunc, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
