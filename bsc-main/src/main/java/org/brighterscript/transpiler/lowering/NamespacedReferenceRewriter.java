package org.brighterscript.transpiler.lowering;

import com.github.javaparser.Range;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.brighterscript.parser.ParseMode;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.expr.BinaryExpression;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.visitor.AstEditor;
import org.brighterscript.parser.ast.visitor.GenericVisitorWithDefaults;
import org.brighterscript.parser.ast.visitor.WalkMode;
import org.brighterscript.parser.ast.visitor.WalkOptions;
import org.brighterscript.parser.ast.visitor.WalkVisitor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.symbols.SymbolIndex;
import org.brighterscript.transpiler.context.BrsTranspileState;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces references to erased declarations before a file is lowered:
 * <ul>
 *     <li>{@code Color.Red} and {@code Alpha.Color.Red} become the enum member's value;</li>
 *     <li>a constant reference becomes the constant's value;</li>
 *     <li>{@code Alpha.Beta.run} becomes {@code Alpha_Beta_run}, as does a bare {@code run} inside
 *     {@code Alpha.Beta}.</li>
 * </ul>
 * Replacements are returned to the walk, which records them in the state's editor.
 */
public class NamespacedReferenceRewriter extends GenericVisitorWithDefaults<AstNode, AstNode> {

    private static final Logger logger = LogManager.getLogger(NamespacedReferenceRewriter.class);

    private final SymbolIndex index;
    private final BrsTranspileState state;
    private final Set<ConstStatement> resolving = Collections.newSetFromMap(new IdentityHashMap<>());

    public NamespacedReferenceRewriter(SymbolIndex index, BrsTranspileState state) {
        this.index = index;
        this.state = state;
    }

    public void rewrite(Body body) {
        body.walk(WalkVisitor.of(this), WalkOptions.of(WalkMode.VISIT_EXPRESSIONS, state.getEditor()));
    }

    @Override
    public AstNode visit(DottedGetExpression n, AstNode parent) {
        Optional<List<String>> parts = AstUtils.getDottedNameParts(n);
        if (parts.isEmpty() || isErasedConstValue(n)) {
            return null;
        }
        List<String> names = parts.get();
        String namespace = containingNamespace(n);
        String fullName = String.join(".", names);

        String enumName = String.join(".", names.subList(0, names.size() - 1));
        String memberName = names.get(names.size() - 1);
        Optional<EnumStatement> enumStatement = index.resolveEnum(enumName, namespace);
        if (enumStatement.isPresent()) {
            String value = enumStatement.get().getMemberValue(memberName);
            if (value != null) {
                logger.debug("Replacing enum reference {} with {}", fullName, value);
                return AstUtils.createLiteral(literalKind(value), value, n.getRange());
            }
        }

        Optional<ConstStatement> constStatement = index.resolveConst(fullName, namespace);
        if (constStatement.isPresent()) {
            return constValue(constStatement.get(), n.getRange());
        }

        Optional<FunctionStatement> function = index.resolveFunction(fullName, namespace);
        if (function.isPresent() && function.get().getNamespace().isPresent()) {
            return AstUtils.createVariableExpression(function.get().getName(ParseMode.BRIGHTSCRIPT), n.getRange());
        }
        return null;
    }

    @Override
    public AstNode visit(VariableExpression n, AstNode parent) {
        if (isErasedConstValue(n)) {
            return null;
        }
        String name = n.getName().getText();
        String namespace = containingNamespace(n);

        Optional<ConstStatement> constStatement = index.resolveConst(name, namespace);
        if (constStatement.isPresent()) {
            return constValue(constStatement.get(), n.getRange());
        }

        Optional<FunctionStatement> function = index.resolveFunction(name, namespace);
        if (function.isPresent() && function.get().getNamespace().isPresent()) {
            return AstUtils.createVariableExpression(function.get().getName(ParseMode.BRIGHTSCRIPT), n.getRange());
        }
        return null;
    }

    /**
     * The value a reference to {@code constStatement} is replaced with. References inside the value
     * are resolved first, wherever the constant is declared; the value itself is left unchanged. A
     * constant that refers back to itself is left as a plain reference.
     */
    private Expression constValue(ConstStatement constStatement, Range range) {
        Expression value = constStatement.getValue();
        if (value instanceof LiteralExpression) {
            return copyLiteral((LiteralExpression) value, range);
        }
        if (!resolving.add(constStatement)) {
            logger.warn("Constant {} refers to itself in {}", constStatement.getFullName(), state.getSrcPath());
            return null;
        }
        AstEditor scratch = new AstEditor();
        try {
            AstNode replaced = value.accept(this, constStatement);
            if (replaced instanceof LiteralExpression) {
                return copyLiteral((LiteralExpression) replaced, range);
            }
            Expression resolved = replaced instanceof Expression ? (Expression) replaced : value;
            if (resolved == value) {
                value.walk(WalkVisitor.of(this), WalkOptions.of(WalkMode.VISIT_EXPRESSIONS, scratch));
            }
            String text = resolved.transpile(state).toString();
            if (value instanceof BinaryExpression) {
                text = "(" + text + ")";
            }
            return AstUtils.createLiteral(TokenKind.IDENTIFIER, text, range);
        } finally {
            scratch.undoAll();
            resolving.remove(constStatement);
        }
    }

    /**
     * Constant declarations emit nothing, so their values are only rewritten while a reference to
     * the constant is being resolved.
     */
    private boolean isErasedConstValue(AstNode node) {
        return resolving.isEmpty() && node.findAncestor(ConstStatement.class).isPresent();
    }

    private static LiteralExpression copyLiteral(LiteralExpression literal, Range range) {
        return AstUtils.createLiteral(literal.getToken().getKind(), literal.getToken().getText(), range);
    }

    private static String containingNamespace(AstNode node) {
        return node.findAncestor(NamespaceStatement.class)
                .map(ns -> ns.getName(ParseMode.BRIGHTERSCRIPT))
                .orElse(null);
    }

    static TokenKind literalKind(String value) {
        if (value.startsWith("\"")) {
            return TokenKind.STRING_LITERAL;
        } else if ("invalid".equalsIgnoreCase(value)) {
            return TokenKind.INVALID;
        } else if ("true".equalsIgnoreCase(value)) {
            return TokenKind.TRUE;
        } else if ("false".equalsIgnoreCase(value)) {
            return TokenKind.FALSE;
        } else if (value.contains(".")) {
            return TokenKind.FLOAT_LITERAL;
        }
        return TokenKind.INTEGER_LITERAL;
    }
}
