package org.brighterscript.benchmark;

import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.NamespacedVariableNameExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.Block;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.EnumMemberStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.stmt.PrintStatement;
import org.brighterscript.parser.ast.stmt.ReturnStatement;
import org.brighterscript.parser.util.AstUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic programs for the benchmarks: a namespace holding a linear class hierarchy where every
 * class adds a field and overrides one method, plus an enum that the methods print from.
 */
final class ProgramFixtures {

    private ProgramFixtures() {
    }

    static Body classHierarchy(int depth) {
        List<Statement> members = new ArrayList<>();
        members.add(new EnumStatement(tok(TokenKind.ENUM, "enum"), id("Level"), tok(TokenKind.END_ENUM, "end enum"),
                new ArrayList<>(List.of(new EnumMemberStatement(id("low"), null, null),
                        new EnumMemberStatement(id("high"), null, null)))));
        for (int i = 0; i < depth; i++) {
            members.add(classStatement(i));
        }
        NamespaceStatement namespace = new NamespaceStatement(tok(TokenKind.NAMESPACE, "namespace"),
                new NamespacedVariableNameExpression(new VariableExpression(id("Zoo"))),
                new Body(members), tok(TokenKind.END_NAMESPACE, "end namespace"));
        return new Body(new ArrayList<>(List.of(namespace)));
    }

    private static ClassStatement classStatement(int index) {
        List<Statement> members = new ArrayList<>();
        members.add(new FieldStatement(null, id("field" + index), null, null, tok(TokenKind.EQUAL, "="),
                new LiteralExpression(tok(TokenKind.INTEGER_LITERAL, String.valueOf(index)))));
        Statement print = new PrintStatement(tok(TokenKind.PRINT, "print"), new ArrayList<>(List.of(
                new DottedGetExpression(new VariableExpression(id("Level")), tok(TokenKind.DOT, "."), id("high")))));
        Statement ret = new ReturnStatement(tok(TokenKind.RETURN, "return"),
                new LiteralExpression(tok(TokenKind.STRING_LITERAL, "\"class" + index + "\"")));
        Token override = index == 0 ? null : tok(TokenKind.OVERRIDE, "override");
        members.add(new MethodStatement(List.of(), id("describe"), function(print, ret), override));

        Token classKeyword = tok(TokenKind.CLASS, "class");
        Token end = tok(TokenKind.END_CLASS, "end class");
        if (index == 0) {
            return new ClassStatement(classKeyword, id("Class0"), members, end);
        }
        return new ClassStatement(classKeyword, id("Class" + index), members, end, tok(TokenKind.EXTENDS, "extends"),
                new NamespacedVariableNameExpression(new VariableExpression(id("Class" + (index - 1)))));
    }

    private static FunctionExpression function(Statement... statements) {
        return new FunctionExpression(tok(TokenKind.FUNCTION, "function"), tok(TokenKind.LEFT_PAREN, "("), List.of(),
                tok(TokenKind.RIGHT_PAREN, ")"), null, null,
                new Block(new ArrayList<>(List.of(statements)), AstUtils.INTERPOLATED_RANGE),
                tok(TokenKind.END_FUNCTION, "end function"));
    }

    private static Token tok(TokenKind kind, String text) {
        return AstUtils.createToken(kind, text);
    }

    private static Token id(String name) {
        return tok(TokenKind.IDENTIFIER, name);
    }
}
