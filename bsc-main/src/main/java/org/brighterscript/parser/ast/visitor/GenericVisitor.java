package org.brighterscript.parser.ast.visitor;

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
 * A visitor with a return value and an argument, one overload per node kind.
 *
 * @param <R> the return type
 * @param <A> the argument passed along
 */
public interface GenericVisitor<R, A> {

    // statements

    R visit(Body n, A arg);

    R visit(EmptyStatement n, A arg);

    R visit(AssignmentStatement n, A arg);

    R visit(Block n, A arg);

    R visit(ExpressionStatement n, A arg);

    R visit(CommentStatement n, A arg);

    R visit(ExitForStatement n, A arg);

    R visit(ExitWhileStatement n, A arg);

    R visit(FunctionStatement n, A arg);

    R visit(IfStatement n, A arg);

    R visit(IncrementStatement n, A arg);

    R visit(PrintStatement n, A arg);

    R visit(DimStatement n, A arg);

    R visit(GotoStatement n, A arg);

    R visit(LabelStatement n, A arg);

    R visit(ReturnStatement n, A arg);

    R visit(EndStatement n, A arg);

    R visit(StopStatement n, A arg);

    R visit(ForStatement n, A arg);

    R visit(ForEachStatement n, A arg);

    R visit(WhileStatement n, A arg);

    R visit(DottedSetStatement n, A arg);

    R visit(IndexedSetStatement n, A arg);

    R visit(LibraryStatement n, A arg);

    R visit(NamespaceStatement n, A arg);

    R visit(ImportStatement n, A arg);

    R visit(InterfaceStatement n, A arg);

    R visit(InterfaceFieldStatement n, A arg);

    R visit(InterfaceMethodStatement n, A arg);

    R visit(ClassStatement n, A arg);

    R visit(MethodStatement n, A arg);

    R visit(FieldStatement n, A arg);

    R visit(TryCatchStatement n, A arg);

    R visit(CatchStatement n, A arg);

    R visit(ThrowStatement n, A arg);

    R visit(EnumStatement n, A arg);

    R visit(EnumMemberStatement n, A arg);

    R visit(ConstStatement n, A arg);

    R visit(ContinueStatement n, A arg);

    // expressions

    R visit(VariableExpression n, A arg);

    R visit(DottedGetExpression n, A arg);

    R visit(IndexedGetExpression n, A arg);

    R visit(CallExpression n, A arg);

    R visit(LiteralExpression n, A arg);

    R visit(BinaryExpression n, A arg);

    R visit(UnaryExpression n, A arg);

    R visit(GroupingExpression n, A arg);

    R visit(FunctionExpression n, A arg);

    R visit(FunctionParameterExpression n, A arg);

    R visit(NamespacedVariableNameExpression n, A arg);

    R visit(AnnotationExpression n, A arg);
}
