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
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.expr.FunctionParameterExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code function name(a as string) as integer} inside an interface: a signature without a body.
 */
public class InterfaceMethodStatement extends Statement implements TypedefProvider {

    private final Token functionType;
    private final Token name;
    private final Token leftParen;
    private final List<FunctionParameterExpression> params;
    private final Token rightParen;
    private final Token asToken;
    private final Token returnTypeToken;

    public InterfaceMethodStatement(Token functionType, Token name, Token leftParen, List<FunctionParameterExpression> params,
                                    Token rightParen, Token asToken, Token returnTypeToken) {
        this.functionType = functionType;
        this.name = name;
        this.leftParen = leftParen;
        this.params = new ArrayList<>(params);
        this.rightParen = rightParen;
        this.asToken = asToken;
        this.returnTypeToken = returnTypeToken;
    }

    public String getName() {
        return name.getText();
    }

    public List<FunctionParameterExpression> getParams() {
        return params;
    }

    @Override
    public Range getRange() {
        List<Located> parts = new ArrayList<>();
        parts.add(functionType);
        parts.add(name);
        parts.add(leftParen);
        parts.addAll(params);
        parts.add(rightParen);
        parts.add(asToken);
        parts.add(returnTypeToken);
        return AstUtils.createBoundingRange(parts.toArray(new Located[0]));
    }

    /**
     * @throws StructuralContractException always; interface members only take part in typedefs
     */
    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        throw new StructuralContractException("Interface methods cannot be transpiled", toString());
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state)
                .add(functionType.getText())
                .add(" ")
                .add(name.getText())
                .add("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            FunctionParameterExpression param = params.get(i);
            result.add(param.getName().getText());
            if (param.getTypeToken() != null && !param.getTypeToken().getText().isEmpty()) {
                result.add(" as ").add(param.getTypeToken().getText());
            }
        }
        result.add(")");
        if (returnTypeToken != null && !returnTypeToken.getText().isEmpty()) {
            result.add(" as ").add(returnTypeToken.getText());
        }
        return result;
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
