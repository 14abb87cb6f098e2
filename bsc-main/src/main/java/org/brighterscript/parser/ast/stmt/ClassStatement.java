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
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.TypedefProvider;
import org.brighterscript.parser.ast.expr.NamespacedVariableNameExpression;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.brighterscript.transpiler.lowering.ClassLowering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code class Name extends Parent ... end class}.
 * <p>
 * A class lowers to two functions: a builder {@code __Name_builder} that assembles the method
 * table on top of the parent's builder, and {@code Name(...)} which builds an instance and runs
 * its constructor. Members are indexed by lower-case name when the statement is created.
 */
public class ClassStatement extends Statement implements TypedefProvider {

    private final Token classKeyword;
    private final Token name;
    private final Token extendsKeyword;
    private final NamespacedVariableNameExpression parentClassName;
    private final List<Statement> body;
    private final Token end;

    private final Map<String, Statement> memberMap = new LinkedHashMap<>();
    private final List<MethodStatement> methods = new ArrayList<>();
    private final List<FieldStatement> fields = new ArrayList<>();

    public ClassStatement(Token classKeyword, Token name, List<Statement> body, Token end) {
        this(classKeyword, name, body, end, null, null);
    }

    public ClassStatement(Token classKeyword, Token name, List<Statement> body, Token end,
                          Token extendsKeyword, NamespacedVariableNameExpression parentClassName) {
        this.classKeyword = classKeyword;
        this.name = name;
        this.body = new ArrayList<>(body);
        this.end = end;
        this.extendsKeyword = extendsKeyword;
        this.parentClassName = parentClassName;

        for (Statement statement : this.body) {
            if (statement instanceof MethodStatement) {
                MethodStatement method = (MethodStatement) statement;
                methods.add(method);
                memberMap.put(method.getName().getText().toLowerCase(Locale.ROOT), method);
            } else if (statement instanceof FieldStatement) {
                FieldStatement field = (FieldStatement) statement;
                fields.add(field);
                memberMap.put(field.getName().getText().toLowerCase(Locale.ROOT), field);
            }
        }
    }

    public Token getClassKeyword() {
        return classKeyword;
    }

    public Token getNameToken() {
        return name;
    }

    public NamespacedVariableNameExpression getParentClassName() {
        return parentClassName;
    }

    public boolean hasParentClass() {
        return parentClassName != null;
    }

    public List<Statement> getBody() {
        return body;
    }

    public Map<String, Statement> getMemberMap() {
        return Collections.unmodifiableMap(memberMap);
    }

    public List<MethodStatement> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    public List<FieldStatement> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public Optional<NamespaceStatement> getNamespace() {
        return findAncestor(NamespaceStatement.class);
    }

    /**
     * The dotted name of the enclosing namespace, or {@code null} at the top level.
     */
    public String getNamespaceName() {
        return getNamespace().map(ns -> ns.getName(ParseMode.BRIGHTERSCRIPT)).orElse(null);
    }

    /**
     * The class name qualified by its namespace: {@code Alpha.Animal} or {@code Alpha_Animal}.
     */
    public String getName(ParseMode parseMode) {
        Optional<NamespaceStatement> namespace = getNamespace();
        if (namespace.isPresent()) {
            return namespace.get().getName(parseMode) + parseMode.getNamespaceSeparator() + name.getText();
        }
        return name.getText();
    }

    /**
     * The explicit constructor, matched case-insensitively on {@code new}.
     */
    public Optional<MethodStatement> getConstructorFunction() {
        return methods.stream().filter(MethodStatement::isConstructor).findFirst();
    }

    /**
     * The members to lower, with an empty {@code sub new()} in front when the class declares no
     * constructor. The class body itself is not modified.
     */
    public List<Statement> getBodyWithConstructor() {
        if (getConstructorFunction().isPresent()) {
            return body;
        }
        MethodStatement constructor = AstUtils.createMethodStatement("new", TokenKind.SUB);
        constructor.setParent(this);
        constructor.link();
        List<Statement> result = new ArrayList<>(body.size() + 1);
        result.add(constructor);
        result.addAll(body);
        return result;
    }

    public boolean isFieldDeclaredByAncestor(String fieldName, List<ClassStatement> ancestors) {
        String lowerFieldName = fieldName.toLowerCase(Locale.ROOT);
        for (ClassStatement ancestor : ancestors) {
            if (ancestor.memberMap.containsKey(lowerFieldName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Range getRange() {
        List<Located> parts = new ArrayList<>();
        parts.add(classKeyword);
        parts.add(name);
        parts.add(extendsKeyword);
        parts.add(parentClassName);
        parts.addAll(body);
        parts.add(end);
        return AstUtils.createBoundingRange(parts);
    }

    @Override
    public TranspileResult transpile(BrsTranspileState state) {
        return ClassLowering.transpile(this, state);
    }

    @Override
    public TranspileResult getTypedef(BrsTranspileState state) {
        TranspileResult result = getAnnotationTypedef(state)
                .add("class ")
                .add(name.getText());
        if (extendsKeyword != null && parentClassName != null) {
            String fqName = AstUtils.getFullyQualifiedClassName(
                    parentClassName.getName(ParseMode.BRIGHTERSCRIPT), getNamespaceName());
            result.add(" extends " + fqName);
        }
        result.add(state.newline());
        state.incrementBlockDepth();
        for (Statement member : getBodyWithConstructor()) {
            if (member instanceof TypedefProvider) {
                result.add(state.indent())
                        .addAll(((TypedefProvider) member).getTypedef(state))
                        .add(state.newline());
            }
        }
        state.decrementBlockDepth();
        return result.add(state.indent()).add("end class");
    }

    @Override
    public void walk(WalkVisitor visitor, WalkOptions options) {
        if (parentClassName != null) {
            parentClassName.setParent(this);
            parentClassName.walk(null, options);
        }
        if (options.walks(WalkMode.WALK_STATEMENTS)) {
            walkList(body, visitor, options);
        }
    }

    @Override
    public <R, A> R accept(GenericVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
