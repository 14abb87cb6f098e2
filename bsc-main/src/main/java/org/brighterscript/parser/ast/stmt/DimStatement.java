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
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code dim name[d1, d2]}
 */
public class DimStatement extends Statement {

    private final Token dimToken;
    private final Token identifier;
    private final Token openingSquare;
    private final List<Expression> dimensions;
    private final Token closingSquare;

    public DimStatement(Token dimToken, Token identifier, Token openingSquare, List<Expression> dimensions, Token closingSquare) {
        this.dimToken = dimToken;
        this.identifier = identifier;
        this.openingSquare = openingSquare;
        this.dimensions = dimensions == null ? new ArrayList<>() : new ArrayList<>(dimensions);
        this.closingSquare = closingSquare;
    }

    public Token getIdentifier() {
        return identifier;
    }

    public List<Expression> getDimensions() {
        return dimensions;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(dimToken, identifier, openingSquare,
                dimensions.isEmpty() ? null : dimensions.get(dimensions.size() - 1), closingSquare);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(dimToken))
                .add(" ")
                .add(state.transpileToken(requireToken(identifier, "dim identifier")))
                .add(state.transpileToken(openingSquare, "["));
        for (int i = 0; i < dimensions.size(); i++) {
            if (i > 0) {
                result.add(", ");
            }
            result.addAll(dimensions.get(i).transpile(state));
        }
        return result.add(state.transpileToken(closingSquare, "]"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (!dimensions.isEmpty() && options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkList(dimensions, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
