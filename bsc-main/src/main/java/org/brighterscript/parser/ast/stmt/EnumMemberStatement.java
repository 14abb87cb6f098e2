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
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

public class EnumMemberStatement extends Statement implements TypedefProvider {

    private final Token name;
    private final Token equals;
    private Expression value;

    public EnumMemberStatement(Token name, Token equals, Expression value) {
        this.name = name;
        this.equals = equals;
        this.value = value;
    }

    public String getName() {
        return name.getText();
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(name, equals, value);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return TranspileResult.empty();
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = TranspileResult.of(name.getText());
        if (equals != null) {
            result.add(" ").add(equals.getText()).add(" ");
            if (value != null) {
                result.addAll(value.transpile(state));
            }
        }
        return result;
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
