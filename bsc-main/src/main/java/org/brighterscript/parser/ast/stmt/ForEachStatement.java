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

/**
 * {@code for each item in target ... end for}
 */
public class ForEachStatement extends Statement {

    private final Token forEachToken;
    private final Token inToken;
    private final Token endForToken;
    private final Token item;
    private Expression target;
    private Block body;

    public ForEachStatement(Token forEachToken, Token inToken, Token endForToken, Token item, Expression target, Block body) {
        this.forEachToken = forEachToken;
        this.inToken = inToken;
        this.endForToken = endForToken;
        this.item = item;
        this.target = target;
        this.body = body;
    }

    public Token getItem() {
        return item;
    }

    public Expression getTarget() {
        return target;
    }

    public void setTarget(Expression target) {
        this.target = target;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = body;
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(forEachToken, endForToken == null ? body : endForToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(forEachToken))
                .add(" ")
                .add(state.transpileToken(item))
                .add(" ")
                .add(state.transpileToken(inToken, "in"))
                .add(" ")
                .addAll(target.transpile(state));
        result.addAll(state.withLineage(this, () -> body.transpile(state)));
        return result.add("\n")
                .add(state.indent())
                .add(state.transpileToken(endForToken, "end for"));
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_EXPRESSIONS)) {
            walkChild(this::getTarget, this::setTarget, visitor, options);
        }
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkChild(this::getBody, this::setBody, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
