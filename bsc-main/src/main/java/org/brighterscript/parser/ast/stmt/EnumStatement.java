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
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.UnaryExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@code enum Name ... end enum}. Enums lower to nothing; references to their members are replaced
 * by the member values before emission.
 */
public class EnumStatement extends Statement implements TypedefProvider {

    private final Token enumToken;
    private final Token name;
    private final Token endEnumToken;
    private final List<Statement> body;

    /**
     * @param body {@link EnumMemberStatement}s and {@link CommentStatement}s
     */
    public EnumStatement(Token enumToken, Token name, Token endEnumToken, List<? extends Statement> body) {
        this.enumToken = enumToken;
        this.name = name;
        this.endEnumToken = endEnumToken;
        this.body = body == null ? new ArrayList<>() : new ArrayList<>(body);
    }

    public String getName() {
        return name.getText();
    }

    public List<Statement> getBody() {
        return body;
    }

    /**
     * The name qualified by every enclosing namespace, e.g. {@code Alpha.Color}.
     */
    public String getFullName() {
        Optional<NamespaceStatement> namespace = findAncestor(NamespaceStatement.class);
        return namespace.map(ns -> ns.getName(ParseMode.BRIGHTERSCRIPT) + "." + name.getText())
                .orElse(name.getText());
    }

    public List<EnumMemberStatement> getMembers() {
        List<EnumMemberStatement> members = new ArrayList<>();
        for (Statement statement : body) {
            if (statement instanceof EnumMemberStatement) {
                members.add((EnumMemberStatement) statement);
            }
        }
        return members;
    }

    /**
     * Resolve every member to the literal text it stands for, keyed by lower-case member name in
     * declaration order. Members without a value count up from 0; an integer literal restarts the
     * count after its own value. The map is rebuilt on each call.
     */
    public Map<String, String> getMemberValueMap() {
        Map<String, String> result = new LinkedHashMap<>();
        long currentIntValue = 0;
        for (EnumMemberStatement member : getMembers()) {
            String key = member.getName().toLowerCase(Locale.ROOT);
            Expression value = member.getValue();
            if (value == null) {
                result.put(key, Long.toString(currentIntValue));
                currentIntValue++;
            } else if (value instanceof LiteralExpression
                    && ((LiteralExpression) value).getToken().getKind() == TokenKind.INTEGER_LITERAL) {
                String text = ((LiteralExpression) value).getToken().getText();
                OptionalLong parsed = AstUtils.parseIntegerLiteral(text);
                if (parsed.isPresent()) {
                    currentIntValue = parsed.getAsLong() + 1;
                }
                result.put(key, text);
            } else if (value instanceof UnaryExpression && ((UnaryExpression) value).getRight() instanceof LiteralExpression) {
                UnaryExpression unary = (UnaryExpression) value;
                result.put(key, unary.getOperator().getText() + ((LiteralExpression) unary.getRight()).getToken().getText());
            } else if (value instanceof LiteralExpression) {
                result.put(key, ((LiteralExpression) value).getToken().getText());
            } else {
                result.put(key, "invalid");
            }
        }
        return result;
    }

    /**
     * The resolved value of the named member, case-insensitive, or {@code null} when there is no
     * such member.
     */
    public String getMemberValue(String memberName) {
        return getMemberValueMap().get(memberName.toLowerCase(Locale.ROOT));
    }

    @Override
    public Range getRange() {
        return AstUtils.createBoundingRange(enumToken, name, endEnumToken);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return TranspileResult.empty();
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state)
                .add(enumToken == null ? "enum" : enumToken.getText())
                .add(" ")
                .add(name.getText())
                .add(state.newline());
        state.incrementBlockDepth();
        for (Statement member : body) {
            if (member instanceof TypedefProvider) {
                result.add(state.indent())
                        .addAll(((TypedefProvider) member).getTypedef(state))
                        .add(state.newline());
            }
        }
        state.decrementBlockDepth();
        return result.add(state.indent())
                .add(endEnumToken == null ? "end enum" : endEnumToken.getText());
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkList(body, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
