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
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.brighterscript.transpiler.lowering.MethodLowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A method of a class. Emitted as an anonymous function assigned onto the instance by the class
 * builder, so it can only be lowered while its class is the current class of the state.
 */
public class MethodStatement extends FunctionStatement {

    private final List<Token> modifiers;
    private final Token overrideToken;

    public MethodStatement(List<Token> modifiers, Token name, FunctionExpression func, Token overrideToken) {
        super(name, func);
        this.modifiers = modifiers == null ? new ArrayList<>() : new ArrayList<>(modifiers);
        this.overrideToken = overrideToken;
    }

    public List<Token> getModifiers() {
        return modifiers;
    }

    public Token getAccessModifier() {
        for (Token modifier : modifiers) {
            if (modifier.getKind().isAccessModifier()) {
                return modifier;
            }
        }
        return null;
    }

    public boolean isOverride() {
        return overrideToken != null;
    }

    public boolean isConstructor() {
        return "new".equals(getName().getText().toLowerCase(Locale.ROOT));
    }

    /**
     * Method names are never namespace qualified.
     */
    @Override
    public String getName(ParseMode parseMode) {
        return getName().getText();
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(getAccessModifier(), overrideToken, getFunc());
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return MethodLowering.transpile(this, state);
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state);
        Token accessModifier = getAccessModifier();
        if (accessModifier != null) {
            result.add(accessModifier.getText()).add(" ");
        }
        if (isOverride()) {
            result.add("override ");
        }
        return result.addAll(getFunc().getTypedef(state, getName()));
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
