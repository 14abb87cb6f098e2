package org.brighterscript.parser.ast.visitor;

import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.stmt.AssignmentStatement;
import org.brighterscript.parser.ast.stmt.Block;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.CatchStatement;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.CommentStatement;
import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.ContinueStatement;
import org.brighterscript.parser.ast.stmt.DimStatement;
import org.brighterscript.parser.ast.stmt.DottedSetStatement;
import org.brighterscript.parser.ast.stmt.EmptyStatement;
import org.brighterscript.parser.ast.stmt.EndStatement;
import org.brighterscript.parser.ast.stmt.EnumMemberStatement;
import org.brighterscript.parser.ast.stmt.EnumStatement;
import org.brighterscript.parser.ast.stmt.ExitForStatement;
import org.brighterscript.parser.ast.stmt.ExitWhileStatement;
import org.brighterscript.parser.ast.stmt.ExpressionStatement;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.parser.ast.stmt.ForEachStatement;
import org.brighterscript.parser.ast.stmt.ForStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.GotoStatement;
import org.brighterscript.parser.ast.stmt.IfStatement;
import org.brighterscript.parser.ast.stmt.ImportStatement;
import org.brighterscript.parser.ast.stmt.IncrementStatement;
import org.brighterscript.parser.ast.stmt.IndexedSetStatement;
import org.brighterscript.parser.ast.stmt.InterfaceFieldStatement;
import org.brighterscript.parser.ast.stmt.InterfaceMethodStatement;
import org.brighterscript.parser.ast.stmt.InterfaceStatement;
import org.brighterscript.parser.ast.stmt.LabelStatement;
import org.brighterscript.parser.ast.stmt.LibraryStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.stmt.PrintStatement;
import org.brighterscript.parser.ast.stmt.ReturnStatement;
import org.brighterscript.parser.ast.stmt.StopStatement;
import org.brighterscript.parser.ast.stmt.ThrowStatement;
import org.brighterscript.parser.ast.stmt.TryCatchStatement;
import org.brighterscript.parser.ast.stmt.WhileStatement;
import org.brighterscript.parser.ast.expr.AnnotationExpression;
import org.brighterscript.parser.ast.expr.BinaryExpression;
import org.brighterscript.parser.ast.expr.CallExpression;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.FunctionParameterExpression;
import org.brighterscript.parser.ast.expr.GroupingExpression;
import org.brighterscript.parser.ast.expr.IndexedGetExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.NamespacedVariableNameExpression;
import org.brighterscript.parser.ast.expr.UnaryExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;

/**
 * A visitor that returns {@link #defaultAction(AstNode, Object)} for every node. Override only
 * the overloads of interest.
 */
public abstract class GenericVisitorWithDefaults<R, A> implements GenericVisitor<R, A> {

    /**
     * Called for every node that is not handled by an overridden {@code visit} method.
     */
    public R defaultAction(AstNode n, A arg) {
        return null;
    }

    @Override
    public R visit(Body n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EmptyStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AssignmentStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Block n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ExpressionStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CommentStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ExitForStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ExitWhileStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunctionStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IfStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IncrementStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(PrintStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DimStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(GotoStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(LabelStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ReturnStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EndStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StopStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ForStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ForEachStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(WhileStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DottedSetStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IndexedSetStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(LibraryStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(NamespaceStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ImportStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InterfaceStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InterfaceFieldStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InterfaceMethodStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ClassStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MethodStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FieldStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TryCatchStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CatchStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ThrowStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EnumStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EnumMemberStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ConstStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ContinueStatement n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(VariableExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DottedGetExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IndexedGetExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CallExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(LiteralExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BinaryExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnaryExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(GroupingExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunctionExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FunctionParameterExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(NamespacedVariableNameExpression n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AnnotationExpression n, A arg) {
        return defaultAction(n, arg);
    }
}
