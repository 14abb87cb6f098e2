package org.brighterscript.transpiler.lowering;

import com.github.javaparser.Range;
import org.brighterscript.StructuralContractException;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.CallExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.CommentStatement;
import org.brighterscript.parser.ast.stmt.DottedSetStatement;
import org.brighterscript.parser.ast.stmt.ExpressionStatement;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.transpiler.TranspileResult;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lowers a class method to an anonymous function. Constructors of derived classes first get a
 * {@code super()} call if they lack one, then every constructor gets the field initializers.
 */
public final class MethodLowering {

    private MethodLowering() {
    }

    public static TranspileResult transpile(MethodStatement method, BrsTranspileState state) {
        ClassStatement cls = state.getClassStatement();
        if (cls == null) {
            throw new StructuralContractException("Method '" + method.getName().getText()
                    + "' must be lowered by its class", method.toString());
        }
        List<ClassStatement> ancestors = state.getAncestors(cls);
        if (method.isConstructor()) {
            ensureSuperConstructorCall(method, cls, ancestors, state);
            injectFieldInitializers(method, cls, ancestors, state);
        }
        OptionalInt parentClassIndex = AncestorResolver.parentClassIndex(ancestors);
        if (parentClassIndex.isPresent()) {
            new SuperCallRewriter(parentClassIndex.getAsInt(), state.getEditor())
                    .rewrite(method.getFunc().getBody().getStatements());
        }
        return method.getFunc().transpile(state);
    }

    /**
     * Derived constructors must call the parent constructor. Prepend a {@code super()} call, located
     * at the class name, unless the first non-comment statement already is one.
     */
    static void ensureSuperConstructorCall(MethodStatement method, ClassStatement cls,
                                           List<ClassStatement> ancestors, BrsTranspileState state) {
        if (ancestors.isEmpty()) {
            return;
        }
        List<Statement> statements = method.getFunc().getBody().getStatements();
        Statement first = statements.stream()
                .filter(s -> !(s instanceof CommentStatement))
                .findFirst()
                .orElse(null);
        if (first instanceof ExpressionStatement && ((ExpressionStatement) first).getExpression() instanceof CallExpression) {
            CallExpression call = (CallExpression) ((ExpressionStatement) first).getExpression();
            Optional<VariableExpression> beginning = AstUtils.findBeginningVariableExpression(call.getCallee());
            if (beginning.isPresent() && "super".equals(beginning.get().getName().getText().toLowerCase(Locale.ROOT))) {
                return;
            }
        }
        ExpressionStatement superCall = new ExpressionStatement(AstUtils.createCall("super", cls.getNameToken().getRange()));
        superCall.setParent(method.getFunc().getBody());
        superCall.link();
        state.getEditor().arrayUnshift(statements, superCall);
    }

    /**
     * Assign every field on {@code m} in declaration order, right after the {@code super()} call
     * when the class has a parent. Fields without an initializer get {@code invalid}.
     */
    static void injectFieldInitializers(MethodStatement method, ClassStatement cls,
                                        List<ClassStatement> ancestors, BrsTranspileState state) {
        List<Statement> initializers = new ArrayList<>();
        for (FieldStatement field : cls.getFields()) {
            Range range = field.getName().getRange();
            DottedSetStatement assignment = new DottedSetStatement(
                    AstUtils.createVariableExpression("m", range),
                    field.getName(),
                    field.getInitialValue() != null ? field.getInitialValue() : AstUtils.createInvalidLiteral(range),
                    AstUtils.createToken(TokenKind.DOT, ".", range),
                    field.getEquals() != null ? field.getEquals() : AstUtils.createToken(TokenKind.EQUAL, "=", range));
            assignment.setParent(method.getFunc().getBody());
            initializers.add(assignment);
        }
        if (initializers.isEmpty()) {
            return;
        }
        List<Statement> statements = method.getFunc().getBody().getStatements();
        int startingIndex = ancestors.isEmpty() ? 0 : 1;
        state.getEditor().arraySplice(statements, Math.min(startingIndex, statements.size()), 0, initializers);
    }
}
