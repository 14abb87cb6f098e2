package org.brighterscript.parser.ast.visitor;

import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.CatchStatement;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.ast.stmt.NamespaceStatement;
import org.brighterscript.parser.ast.stmt.PrintStatement;
import org.brighterscript.parser.ast.stmt.ReturnStatement;
import org.brighterscript.parser.ast.stmt.TryCatchStatement;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.parser.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.brighterscript.test.Ast.block;
import static org.brighterscript.test.Ast.body;
import static org.brighterscript.test.Ast.classStmt;
import static org.brighterscript.test.Ast.id;
import static org.brighterscript.test.Ast.method;
import static org.brighterscript.test.Ast.namespace;
import static org.brighterscript.test.Ast.print;
import static org.brighterscript.test.Ast.ret;
import static org.brighterscript.test.Ast.sub;
import static org.brighterscript.test.Ast.tok;
import static org.brighterscript.test.Ast.var;

class WalkTest {

    @Test
    void link_setsParentsThroughStatementsAndExpressions() {
        VariableExpression value = var("x");
        ReturnStatement returnStatement = ret(value);
        MethodStatement speak = method("speak", returnStatement);
        ClassStatement dog = classStmt("Dog", speak);
        NamespaceStatement alpha = namespace("Alpha", dog);
        Body body = body(alpha);

        body.link();

        assertThat(value.getParent()).isSameAs(returnStatement);
        assertThat(returnStatement.getParent()).isSameAs(speak.getFunc().getBody());
        assertThat(speak.getParent()).isSameAs(dog);
        assertThat(dog.getParent()).isSameAs(alpha.getBody());
        assertThat(alpha.getParent()).isSameAs(body);
        assertThat(value.findAncestor(ClassStatement.class)).containsSame(dog);
        assertThat(value.findAncestor(NamespaceStatement.class)).containsSame(alpha);
    }

    @Test
    void link_reachesCatchOfTryWithoutBody() {
        VariableExpression value = var("e");
        PrintStatement report = print(value);
        CatchStatement catchStatement = new CatchStatement(tok(TokenKind.CATCH, "catch"), id("e"), block(report));
        TryCatchStatement tryCatch = new TryCatchStatement(tok(TokenKind.TRY, "try"), tok(TokenKind.END_TRY, "end try"),
                null, catchStatement);

        body(sub("main", tryCatch)).link();

        assertThat(catchStatement.getParent()).isSameAs(tryCatch);
        assertThat(value.getParent()).isSameAs(report);
        assertThat(value.findAncestor(TryCatchStatement.class)).containsSame(tryCatch);
    }

    @Test
    void visitStatements_doesNotEnterFunctionBodies() {
        Body body = body(sub("main", print(var("x"))), namespace("Alpha", sub("go")));
        List<String> visited = new ArrayList<>();

        body.walk((node, parent) -> {
            visited.add(node.getClass().getSimpleName());
            return null;
        }, WalkOptions.of(WalkMode.VISIT_STATEMENTS));

        assertThat(visited).containsExactly("FunctionStatement", "NamespaceStatement", "Body", "FunctionStatement");
    }

    @Test
    void visitExpressions_seesOnlyExpressions() {
        Body body = body(sub("main", print(var("x"), var("y"))));
        List<String> visited = new ArrayList<>();

        body.walk((node, parent) -> {
            visited.add(node.getClass().getSimpleName());
            return null;
        }, WalkOptions.of(WalkMode.VISIT_EXPRESSIONS));

        assertThat(visited).containsExactly("FunctionExpression", "VariableExpression", "VariableExpression");
    }

    @Test
    void replacement_isRecordedByEditorAndUndone() {
        PrintStatement printStatement = print(var("x"));
        FunctionStatement main = sub("main", printStatement);
        Body body = body(main);
        AstEditor editor = new AstEditor();

        body.walk(WalkVisitor.of(new GenericVisitorWithDefaults<AstNode, AstNode>() {
            @Override
            public AstNode visit(VariableExpression n, AstNode parent) {
                return AstUtils.createLiteral(TokenKind.INTEGER_LITERAL, "42", n.getRange());
            }
        }), WalkOptions.of(WalkMode.VISIT_EXPRESSIONS, editor));

        assertThat(printStatement.getItems()).singleElement().isInstanceOf(LiteralExpression.class);
        assertThat(printStatement.getItems().get(0)).extracting(item -> ((AstNode) item).getParent()).isSameAs(printStatement);

        editor.undoAll();

        assertThat(printStatement.getItems()).singleElement().isInstanceOf(VariableExpression.class);
    }
}
