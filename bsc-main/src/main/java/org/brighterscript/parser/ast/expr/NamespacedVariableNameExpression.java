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
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A possibly dotted name such as {@code Alpha.Beta} used by namespace, class-parent and interface-parent
 * declarations. Wraps a {@link VariableExpression} or a chain of {@link DottedGetExpression}s.
 */
public class NamespacedVariableNameExpression extends Expression {

    private Expression expression;

    public NamespacedVariableNameExpression(Expression expression) {
        if (!(expression instanceof VariableExpression) && !(expression instanceof DottedGetExpression)) {
            throw new IllegalArgumentException("Expected a variable or dotted get expression, got "
                    + expression.getClass().getSimpleName());
        }
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public List<String> getNameParts() {
        Deque<String> parts = new ArrayDeque<>();
        Expression current = expression;
        while (current instanceof DottedGetExpression) {
            DottedGetExpression dotted = (DottedGetExpression) current;
            parts.addFirst(dotted.getName().getText());
            current = dotted.getObj();
        }
        if (current instanceof VariableExpression) {
            parts.addFirst(((VariableExpression) current).getName().getText());
        }
        return List.copyOf(parts);
    }

    public String getName(ParseMode parseMode) {
        return String.join(parseMode.getNamespaceSeparator(), getNameParts());
    }

    @Override
    public Range getRange() {
        return expression.getRange();
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return new TranspileResult().add(state.sourceNode(this, getName(ParseMode.BRIGHTSCRIPT)));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        // the parts of a declared name are not references; only link them
        expression.setParent(this);
        expression.link();
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
