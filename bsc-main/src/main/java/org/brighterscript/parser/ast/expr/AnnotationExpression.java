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

package org.brighterscript.parser.ast.expr;

import com.github.javaparser.Range;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.Expression;
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
 * {@code @name} or {@code @name(args)} in front of a declaration. Annotations only exist in
 * typedefs and never reach the emitted code.
 */
public class AnnotationExpression extends Expression {

    private final Token atToken;
    private final Token name;
    private final List<Expression> arguments;

    public AnnotationExpression(Token atToken, Token name) {
        this.atToken = atToken;
        this.name = name;
        this.arguments = null;
    }

    public AnnotationExpression(Token atToken, Token name, List<Expression> arguments) {
        this.atToken = atToken;
        this.name = name;
        this.arguments = new ArrayList<>(arguments);
    }

    public Token getName() {
        return name;
    }

    public boolean hasArguments() {
        return arguments != null;
    }

    public List<Expression> getArguments() {
        return arguments == null ? List.of() : arguments;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(atToken, name);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return TranspileResult.empty();
    }

    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = TranspileResult.of("@", name.getText());
        if (arguments != null) {
            result.add("(");
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    result.add(", ");
                }
                result.addAll(arguments.get(i).transpile(state));
            }
            result.add(")");
        }
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (arguments != null && options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkList(arguments, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
