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
import org.brighterscript.StructuralContractException;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.Locale;
import java.util.Set;

/**
 * {@code public name as string = "x"} inside a class. Fields have no code of their own: the
 * constructor assigns them on {@code m}.
 */
public class FieldStatement extends Statement implements TypedefProvider {

    private static final Set<String> BUILT_IN_TYPES = Set.of(
            "boolean", "integer", "longinteger", "float", "double", "string", "object", "dynamic",
            "function", "invalid", "void");

    private final Token accessModifier;
    private final Token name;
    private final Token asToken;
    private final Token typeToken;
    private final Token equals;
    private Expression initialValue;

    public FieldStatement(Token accessModifier, Token name, Token asToken, Token typeToken, Token equals, Expression initialValue) {
        this.accessModifier = accessModifier;
        this.name = name;
        this.asToken = asToken;
        this.typeToken = typeToken;
        this.equals = equals;
        this.initialValue = initialValue;
    }

    public Token getAccessModifier() {
        return accessModifier;
    }

    public Token getName() {
        return name;
    }

    public Token getEquals() {
        return equals;
    }

    public Expression getInitialValue() {
        return initialValue;
    }

    public void setInitialValue(Expression initialValue) {
        this.initialValue = initialValue;
    }

    /**
     * The declared type name, else the type of a literal initializer, else {@code dynamic}.
     */
    public String getType() {
        if (typeToken != null) {
            String text = typeToken.getText();
            String lower = text.toLowerCase(Locale.ROOT);
            return BUILT_IN_TYPES.contains(lower) ? lower : text;
        } else if (initialValue instanceof LiteralExpression) {
            return ((LiteralExpression) initialValue).getTypeName();
        }
        return "dynamic";
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(accessModifier, name, asToken, typeToken, equals, initialValue);
    }

    /**
     * @throws StructuralContractException always; fields are lowered by their class
     */
    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        throw new StructuralContractException("Class fields cannot be transpiled on their own", toString());
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state);
        String type = getType();
        if ("invalid".equals(type) || "void".equals(type)) {
            type = "dynamic";
        }
        return result.add(accessModifier == null ? "public" : accessModifier.getText())
                .add(" ")
                .add(name.getText())
                .add(" as ")
                .add(type);
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (initialValue != null && options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getInitialValue, this::setInitialValue, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
