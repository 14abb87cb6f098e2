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
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
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
 * {@code print a; b, c}. Items are expressions interleaved with {@code ,} (tab to the next print
 * zone) and {@code ;} (no spacing) separator tokens.
 */
public class PrintStatement extends Statement {

    private final Token printToken;
    private final List<Located> items;

    public PrintStatement(Token printToken, List<? extends Located> items) {
        for (Located item : items) {
            if (!(item instanceof Expression) && !isSeparator(item)) {
                throw new IllegalArgumentException("Print items must be expressions or separators, got " + item);
            }
        }
        this.printToken = printToken;
        this.items = new ArrayList<>(items);
    }

    private static boolean isSeparator(Located item) {
        return item instanceof Token
                && (((Token) item).getKind() == TokenKind.COMMA || ((Token) item).getKind() == TokenKind.SEMICOLON);
    }

    public Token getPrintToken() {
        return printToken;
    }

    public List<Located> getItems() {
        return items;
    }

    @Override
    public Range getRange() {
        List<Located> all = new ArrayList<>(items);
        all.add(printToken);
        return AstUtils.createBoundingRange(all);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        TranspileResult result = new TranspileResult()
                .add(state.transpileToken(printToken, "print"))
                .add(" ");
        for (int i = 0; i < items.size(); i++) {
            Located item = items.get(i);
            if (item instanceof Expression) {
                result.addAll(((Expression) item).transpile(state));
            } else {
                result.add(state.transpileToken((Token) item));
            }
            if (i + 1 < items.size() && items.get(i + 1) instanceof Expression) {
                result.add(" ");
            }
        }
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (!options.walks(WalkMode.WALK_EXPRESSIONS)) {
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Expression) {
                final int index = i;
                walkChild(() -> (Expression) items.get(index), e -> items.set(index, e), visitor, options);
            }
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
