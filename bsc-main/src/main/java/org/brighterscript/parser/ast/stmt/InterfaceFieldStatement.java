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
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

/**
 * {@code name as type} inside an interface.
 */
public class InterfaceFieldStatement extends Statement implements TypedefProvider {

    private final Token name;
    private final Token asToken;
    private final Token typeToken;

    public InterfaceFieldStatement(Token name, Token asToken, Token typeToken) {
        this.name = name;
        this.asToken = asToken;
        this.typeToken = typeToken;
    }

    public String getName() {
        return name.getText();
    }

    public Token getTypeToken() {
        return typeToken;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(name, asToken, typeToken);
    }

    /**
     * @throws StructuralContractException always; interface members only take part in typedefs
     */
    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        throw new StructuralContractException("Interface fields cannot be transpiled", toString());
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state).add(name.getText());
        if (typeToken != null && !typeToken.getText().isEmpty()) {
            result.add(" as ").add(typeToken.getText());
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
