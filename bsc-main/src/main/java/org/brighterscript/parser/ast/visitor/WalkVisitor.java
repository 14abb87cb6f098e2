package org.brighterscript.parser.ast.visitor;

import org.brighterscript.parser.ast.AstNode;

/**
 * Called for each node a walk reaches. Returning a non-null node replaces the visited node in its
 * parent; returning {@code null} leaves it in place.
 */
@FunctionalInterface
public interface WalkVisitor {

    AstNode visit(AstNode node, AstNode parent);

    /**
     * Adapts a typed visitor: each node dispatches to its own {@code visit} overload.
     */
    static WalkVisitor of(GenericVisitor<AstNode, AstNode> visitor) {
        return (node, parent) -> node.accept(visitor, parent);
    }
}
