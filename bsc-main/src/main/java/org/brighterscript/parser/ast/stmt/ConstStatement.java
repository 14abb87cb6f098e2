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
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.Optional;

/**
 * {@code const NAME = value}. Constants lower to nothing; references are replaced by the value.
 */
public class ConstStatement extends Statement implements TypedefProvider {

    private final Token constToken;
    private final Token name;
    private final Token equals;
    private Expression value;

    public ConstStatement(Token constToken, Token name, Token equals, Expression value) {
        this.constToken = constToken;
        this.name = name;
        this.equals = equals;
        this.value = value;
    }

    public String getName() {
        return name.getText();
    }

    public String getFullName() {
        Optional<NamespaceStatement> namespace = findAncestor(NamespaceStatement.class);
        return namespace.map(ns -> ns.getName(ParseMode.BRIGHTERSCRIPT) + "." + name.getText())
                .orElse(name.getText());
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(constToken, name, equals, value);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return TranspileResult.empty();
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        return new TranspileResult()
                .add(state.transpileToken(constToken, "const"))
                .add(" ")
                .add(state.transpileToken(name))
                .add(" ")
                .add(state.transpileToken(equals, "="))
                .add(" ")
                .addAll(value.transpile(state));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (value != null && options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getValue, this::setValue, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
