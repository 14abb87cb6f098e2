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

package org.brighterscript.parser.ast;

import org.brighterscript.StructuralContractException;
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.ast.visitor.GenericVisitor;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.sourcemap.SourceNode;
import org.brighterscript.symbols.SymbolTable;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Base of every statement and expression.
 * <p>
 * A node owns its children. The parent reference is a plain back-link that is set whenever a walk
 * passes through the node, so it is only reliable after the tree has been {@link #link() linked}.
 */
public abstract class AstNode implements Located {

    private AstNode parent;

    public AstNode getParent() {
        return parent;
    }

    public void setParent(AstNode parent) {
        this.parent = parent;
    }

    /**
     * The {@link WalkMode} visit flags under which this node is handed to a visitor.
     */
    public abstract int getVisitMode();

    /**
     * Lower this node to the fragment sequence of the emitted BrightScript.
     */
    public abstract TranspileResult transpile(BrsTranspileState state);

    /**
     * Lower this node to a tree of position-tagged fragments. The text of the tree is always the
     * text of {@link #transpile(BrsTranspileState)}.
     */
    public SourceNode toSourceNode(BrsTranspileState state) {
        return state.toSourceNode(this, transpile(state));
    }

    /**
     * Hand the children selected by {@code options} to {@code visitor}, depth first. The node
     * itself is not visited. {@code visitor} may be {@code null} to only establish parent links.
     */
    public abstract void walk(WalkVisitor visitor, WalkOptions options);

    public abstract <R, A> R accept(GenericVisitor<R, A> visitor, A arg);

    /**
     * Set parent references for the whole subtree.
     */
    public void link() {
        walk(null, WalkOptions.of(WalkMode.VISIT_ALL));
    }

    public <T extends AstNode> Optional<T> findAncestor(Class<T> type) {
        AstNode node = parent;
        while (node != null) {
            if (type.isInstance(node)) {
                return Optional.of(type.cast(node));
            }
            node = node.parent;
        }
        return Optional.empty();
    }

    public Optional<AstNode> findAncestor(Predicate<AstNode> matcher) {
        AstNode node = parent;
        while (node != null) {
            if (matcher.test(node)) {
                return Optional.of(node);
            }
            node = node.parent;
        }
        return Optional.empty();
    }

    /**
     * The nearest symbol table at or above this node, or {@code null} when the node is detached.
     */
    public SymbolTable getSymbolTable() {
        return parent == null ? null : parent.getSymbolTable();
    }

    protected <T extends AstNode> void walkChild(Supplier<T> getter, Consumer<T> setter, WalkVisitor visitor, WalkOptions options) {
        T element = getter.get();
        if (element == null) {
            return;
        }
        element.setParent(this);
        if (visitor != null && options.walks(element.getVisitMode())) {
            AstNode replacement = visitor.visit(element, this);
            if (replacement != null && replacement != element) {
                T typed = cast(replacement);
                if (options.getEditor() != null) {
                    options.getEditor().setProperty(getter, setter, typed);
                } else {
                    setter.accept(typed);
                }
                typed.setParent(this);
                element = typed;
            }
        }
        element.walk(visitor, options);
    }

    protected <T extends AstNode> void walkList(List<T> children, WalkVisitor visitor, WalkOptions options) {
        for (int i = 0; i < children.size(); i++) {
            T element = children.get(i);
            if (element == null) {
                continue;
            }
            element.setParent(this);
            if (visitor != null && options.walks(element.getVisitMode())) {
                AstNode replacement = visitor.visit(element, this);
                if (replacement != null && replacement != element) {
                    T typed = cast(replacement);
                    if (options.getEditor() != null) {
                        options.getEditor().setArrayValue(children, i, typed);
                    } else {
                        children.set(i, typed);
                    }
                    typed.setParent(this);
                    element = typed;
                }
            }
            element.walk(visitor, options);
        }
    }

    /**
     * A token the parser always supplies for this node kind.
     *
     * @throws StructuralContractException when it is missing
     */
    protected Token requireToken(Token token, String role) {
        if (token == null) {
            throw new StructuralContractException("Missing " + role + " token", toString());
        }
        return token;
    }

    @SuppressWarnings("unchecked")
    private static <T extends AstNode> T cast(AstNode node) {
        return (T) node;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + getRange();
    }
}
