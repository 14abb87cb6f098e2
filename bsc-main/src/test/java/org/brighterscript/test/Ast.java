package org.brighterscript.test;

import com.github.javaparser.Range;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.Expression;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.BinaryExpression;
import org.brighterscript.parser.ast.expr.CallExpression;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.FunctionParameterExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.NamespacedVariableNameExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.AssignmentStatement;
import org.brighterscript.parser.ast.stmt.Block;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.CommentStatement;
import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.EnumMemberStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.ExpressionStatement;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.stmt.PrintStatement;
import org.brighterscript.parser.ast.stmt.ReturnStatement;
import org.brighterscript.parser.util.AstUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds syntax trees the way the parser would hand them over. Tokens carry no position unless
 * one is given, so most trees render without mappings.
 */
public final class Ast {

    private Ast() {
    }

    // tokens

    public static Token tok(TokenKind kind, String text) {
        return AstUtils.createToken(kind, text);
    }

    public static Token tok(TokenKind kind, String text, int line, int column) {
        return new Token(kind, text, at(line, column, text));
    }

    public static Token id(String name) {
        return tok(TokenKind.IDENTIFIER, name);
    }

    public static Token id(String name, int line, int column) {
        return tok(TokenKind.IDENTIFIER, name, line, column);
    }

    public static Range at(int line, int column, String text) {
        return Range.range(line, column, line, column + Math.max(text.length() - 1, 0));
    }

    // expressions

    public static VariableExpression var(String name) {
        return new VariableExpression(id(name));
    }

    /**
     * A chain of member accesses from a dotted name, e.g. {@code Alpha.Color.Red}.
     */
    public static Expression dotted(String dottedName) {
        String[] parts = dottedName.split("\\.");
        Expression result = var(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            result = new DottedGetExpression(result, tok(TokenKind.DOT, "."), id(parts[i]));
        }
        return result;
    }

    public static LiteralExpression str(String value) {
        return new LiteralExpression(tok(TokenKind.STRING_LITERAL, "\"" + value + "\""));
    }

    public static LiteralExpression num(String text) {
        return new LiteralExpression(tok(TokenKind.INTEGER_LITERAL, text));
    }

    public static LiteralExpression invalid() {
        return new LiteralExpression(tok(TokenKind.INVALID, "invalid"));
    }

    public static BinaryExpression binary(Expression left, TokenKind operator, String operatorText, Expression right) {
        return new BinaryExpression(left, tok(operator, operatorText), right);
    }

    public static CallExpression call(Expression callee, Expression... args) {
        return new CallExpression(callee, tok(TokenKind.LEFT_PAREN, "("), tok(TokenKind.RIGHT_PAREN, ")"), list(args));
    }

    public static NamespacedVariableNameExpression nsName(String dottedName) {
        return new NamespacedVariableNameExpression(dotted(dottedName));
    }

    public static FunctionParameterExpression param(String name) {
        return new FunctionParameterExpression(id(name), null, null, null, null);
    }

    public static FunctionParameterExpression param(String name, String type) {
        return new FunctionParameterExpression(id(name), null, null, tok(TokenKind.AS, "as"), id(type));
    }

    public static FunctionExpression subExpr(List<FunctionParameterExpression> params, Statement... statements) {
        return new FunctionExpression(tok(TokenKind.SUB, "sub"), tok(TokenKind.LEFT_PAREN, "("), params,
                tok(TokenKind.RIGHT_PAREN, ")"), null, null, block(statements), tok(TokenKind.END_SUB, "end sub"));
    }

    public static FunctionExpression functionExpr(List<FunctionParameterExpression> params, Statement... statements) {
        return new FunctionExpression(tok(TokenKind.FUNCTION, "function"), tok(TokenKind.LEFT_PAREN, "("), params,
                tok(TokenKind.RIGHT_PAREN, ")"), null, null, block(statements), tok(TokenKind.END_FUNCTION, "end function"));
    }

    // statements

    public static Block block(Statement... statements) {
        return new Block(list(statements), AstUtils.INTERPOLATED_RANGE);
    }

    public static Body body(Statement... statements) {
        return new Body(list(statements));
    }

    public static ExpressionStatement exprStmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static AssignmentStatement assign(String name, Expression value) {
        return new AssignmentStatement(tok(TokenKind.EQUAL, "="), id(name), value);
    }

    public static ReturnStatement ret(Expression value) {
        return new ReturnStatement(tok(TokenKind.RETURN, "return"), value);
    }

    public static PrintStatement print(Expression... items) {
        return new PrintStatement(tok(TokenKind.PRINT, "print"), list(items));
    }

    public static CommentStatement comment(String text) {
        return new CommentStatement(List.of(tok(TokenKind.COMMENT, text)));
    }

    public static CommentStatement comment(String text, int line, int column) {
        return new CommentStatement(List.of(tok(TokenKind.COMMENT, text, line, column)));
    }

    public static FunctionStatement sub(String name, Statement... statements) {
        return new FunctionStatement(id(name), subExpr(List.of(), statements));
    }

    public static FunctionStatement function(String name, Statement... statements) {
        return new FunctionStatement(id(name), functionExpr(List.of(), statements));
    }

    public static NamespaceStatement namespace(String name, Statement... statements) {
        return new NamespaceStatement(tok(TokenKind.NAMESPACE, "namespace"), nsName(name), body(statements),
                tok(TokenKind.END_NAMESPACE, "end namespace"));
    }

    public static ClassStatement classStmt(String name, Statement... members) {
        return new ClassStatement(tok(TokenKind.CLASS, "class"), id(name), list(members), tok(TokenKind.END_CLASS, "end class"));
    }

    public static ClassStatement classStmt(String name, String parentName, Statement... members) {
        return new ClassStatement(tok(TokenKind.CLASS, "class"), id(name), list(members), tok(TokenKind.END_CLASS, "end class"),
                tok(TokenKind.EXTENDS, "extends"), nsName(parentName));
    }

    public static MethodStatement method(String name, Statement... statements) {
        return new MethodStatement(List.of(), id(name), functionExpr(List.of(), statements), null);
    }

    public static MethodStatement overrideMethod(String name, Statement... statements) {
        return new MethodStatement(List.of(), id(name), functionExpr(List.of(), statements), tok(TokenKind.OVERRIDE, "override"));
    }

    public static MethodStatement constructor(List<FunctionParameterExpression> params, Statement... statements) {
        return new MethodStatement(List.of(), id("new"), subExpr(params, statements), null);
    }

    public static FieldStatement field(String name, Expression initialValue) {
        return new FieldStatement(null, id(name), null, null,
                initialValue == null ? null : tok(TokenKind.EQUAL, "="), initialValue);
    }

    public static FieldStatement field(String access, String name, String type) {
        return new FieldStatement(tok(TokenKind.valueOf(access.toUpperCase()), access), id(name),
                tok(TokenKind.AS, "as"), id(type), null, null);
    }

    public static EnumStatement enumStmt(String name, Statement... members) {
        return new EnumStatement(tok(TokenKind.ENUM, "enum"), id(name), tok(TokenKind.END_ENUM, "end enum"), list(members));
    }

    public static EnumMemberStatement member(String name) {
        return new EnumMemberStatement(id(name), null, null);
    }

    public static EnumMemberStatement member(String name, Expression value) {
        return new EnumMemberStatement(id(name), tok(TokenKind.EQUAL, "="), value);
    }

    public static ConstStatement constStmt(String name, Expression value) {
        return new ConstStatement(tok(TokenKind.CONST, "const"), id(name), tok(TokenKind.EQUAL, "="), value);
    }

    @SafeVarargs
    private static <T> List<T> list(T... items) {
        return new ArrayList<>(Arrays.asList(items));
    }
}
