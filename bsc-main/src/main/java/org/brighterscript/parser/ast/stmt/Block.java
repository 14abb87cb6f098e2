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
 * An indented statement list: the body of a function, branch or loop. Every statement starts on
 * its own line, except comments that share a line with the enclosing statement or the previous
 * sibling. An empty block lowers to nothing.
 */
public class Block extends Statement {

    private final List<Statement> statements;
    private final Range startingRange;

    public Block(List<Statement> statements, Range startingRange) {
        this.statements = new ArrayList<>(statements);
        this.startingRange = startingRange == null ? AstUtils.INTERPOLATED_RANGE : startingRange;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public Range getRange() {
        if (AstUtils.isInterpolated(startingRange) || statements.isEmpty()) {
            return statements.isEmpty() ? startingRange : AstUtils.createBoundingRange(statements);
        }
        Range last = statements.get(statements.size() - 1).getRange();
        if (AstUtils.isInterpolated(last)) {
            return startingRange;
        }
        return AstUtils.createRangeFromPositions(startingRange.begin, last.end);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        state.incrementBlockDepth();
        TranspileResult result = new TranspileResult();
        for (int i = 0; i < statements.size(); i++) {
            Statement previous = i > 0 ? statements.get(i - 1) : null;
            Statement statement = statements.get(i);
            if (statement instanceof CommentStatement
                    && (AstUtils.linesTouch(state.getLineageHead(), statement) || AstUtils.linesTouch(previous, statement))) {
                result.add(" ");
            } else {
                result.add(state.newline()).add(state.indent());
            }
            result.addAll(state.withLineage(this, () -> statement.transpile(state)));
        }
        state.decrementBlockDepth();
        return result;
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkList(statements, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
