package org.brighterscript.parser.ast.visitor;

/**
 * Bit flags selecting which parts of the tree a walk descends into and which nodes it hands to
 * the visitor. The public modes combine the walk and visit flags.
 */
public final class WalkMode {

    public static final int WALK_STATEMENTS = 1;
    public static final int WALK_EXPRESSIONS = 1 << 1;
    public static final int VISIT_STATEMENTS_FLAG = 1 << 2;
    public static final int VISIT_EXPRESSIONS_FLAG = 1 << 3;

    public static final int VISIT_STATEMENTS = WALK_STATEMENTS | VISIT_STATEMENTS_FLAG;
    public static final int VISIT_EXPRESSIONS = WALK_STATEMENTS | WALK_EXPRESSIONS | VISIT_EXPRESSIONS_FLAG;
    public static final int VISIT_ALL = VISIT_STATEMENTS | VISIT_EXPRESSIONS;

    private WalkMode() {
    }

    public static boolean has(int walkMode, int flag) {
        return (walkMode & flag) != 0;
    }
}
