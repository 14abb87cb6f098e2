package org.brighterscript.transpiler.lowering;

import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.visitor.AstEditor;
import org.brighterscript.parser.ast.visitor.GenericVisitorWithDefaults;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;

import java.util.List;
import java.util.Locale;

/**
 * Rewrites {@code super} inside a method body so it reaches the inherited members the builder
 * preserved: {@code super(...)} becomes {@code m.super<index>_new(...)} and
 * {@code super.name} becomes {@code m.super<index>_name}. Only a {@code super} directly in front
 * of the member access is rewritten. All edits go through the editor.
 */
public class SuperCallRewriter extends GenericVisitorWithDefaults<AstNode, AstNode> {

    private static final String SUPER = "super";

    private final int parentClassIndex;
    private final AstEditor editor;

    public SuperCallRewriter(int parentClassIndex, AstEditor editor) {
        this.parentClassIndex = parentClassIndex;
        this.editor = editor;
    }

    public void rewrite(List<Statement> statements) {
        WalkVisitor visitor = WalkVisitor.of(this);
        WalkOptions options = WalkOptions.of(WalkMode.VISIT_EXPRESSIONS);
        for (Statement statement : statements) {
            visitor.visit(statement, null);
            statement.walk(visitor, options);
        }
    }

    @Override
    public AstNode visit(VariableExpression n, AstNode parent) {
        if (isSuper(n)) {
            editor.setProperty(n::getName, n::setName, n.getName().withText("m.super" + parentClassIndex + "_new"));
        }
        return null;
    }

    @Override
    public AstNode visit(DottedGetExpression n, AstNode parent) {
        if (n.getObj() instanceof VariableExpression && isSuper((VariableExpression) n.getObj())) {
            VariableExpression obj = (VariableExpression) n.getObj();
            editor.setProperty(obj::getName, obj::setName, obj.getName().withText("m"));
            editor.setProperty(n::getName, n::setName,
                    n.getName().withText("super" + parentClassIndex + "_" + n.getName().getText()));
        }
        return null;
    }

    private static boolean isSuper(VariableExpression expression) {
        return SUPER.equals(expression.getName().getText().toLowerCase(Locale.ROOT));
    }
}
