package org.brighterscript.parser.ast.stmt;

import com.github.javaparser.Range;
import org.brighterscript.StructuralContractException;
import org.brighterscript.config.TranspileConfig;
import org.brighterscript.diagnostics.DiagnosticManager;
import org.brighterscript.parser.Located;
import org.brighterscript.parser.Token;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.AstNode;
import org.brighterscript.parser.ast.Statement;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.visitor.AstEditor;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.symbols.ClassResolver;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.brighterscript.test.Ast.binary;
import static org.brighterscript.test.Ast.block;
import static org.brighterscript.test.Ast.body;
import static org.brighterscript.test.Ast.comment;
import static org.brighterscript.test.Ast.dotted;
import static org.brighterscript.test.Ast.field;
import static org.brighterscript.test.Ast.id;
import static org.brighterscript.test.Ast.method;
import static org.brighterscript.test.Ast.num;
import static org.brighterscript.test.Ast.print;
import static org.brighterscript.test.Ast.str;
import static org.brighterscript.test.Ast.sub;
import static org.brighterscript.test.Ast.tok;
import static org.brighterscript.test.Ast.var;

class StatementTranspileTest {

    private BrsTranspileState state;

    @BeforeEach
    void setUp() {
        state = new BrsTranspileState("source/main.bs", ClassResolver.NONE);
    }

    private String transpile(AstNode node) {
        return node.transpile(state).toString();
    }

    // body layout

    @Test
    void body_separatesFunctionsWithBlankLine() {
        Body body = body(comment("' header"), sub("a"), sub("b"));

        assertThat(transpile(body)).isEqualTo("' header\nsub a()\nend sub\n\nsub b()\nend sub");
    }

    @Test
    void body_commentBeforeFunctionStartsNewParagraph() {
        Body body = body(sub("a"), comment("' docs for b", 5, 1), sub("b"));

        assertThat(transpile(body)).isEqualTo("sub a()\nend sub\n\n' docs for b\nsub b()\nend sub");
    }

    @Test
    void body_trailingCommentStaysOnItsLine() {
        LibraryStatement library = new LibraryStatement(tok(TokenKind.LIBRARY, "Library", 1, 1),
                tok(TokenKind.STRING_LITERAL, "\"v30/bslCore.brs\"", 1, 9));
        Body body = body(library, comment("' core", 1, 27));

        assertThat(transpile(body)).isEqualTo("Library \"v30/bslCore.brs\" ' core");
    }

    // blocks

    private FunctionStatement positionedSub(Statement... statements) {
        FunctionExpression func = new FunctionExpression(tok(TokenKind.SUB, "sub", 1, 1),
                tok(TokenKind.LEFT_PAREN, "(", 1, 9), List.of(), tok(TokenKind.RIGHT_PAREN, ")", 1, 10),
                null, null, new Block(List.of(statements), AstUtils.createRange(1, 11, 1, 11)),
                tok(TokenKind.END_SUB, "end sub", 5, 1));
        return new FunctionStatement(id("main", 1, 5), func);
    }

    @Test
    void block_keepsTrailingCommentOnStatementLine() {
        AssignmentStatement assignment = new AssignmentStatement(tok(TokenKind.EQUAL, "=", 2, 7), id("x", 2, 5),
                new LiteralExpression(tok(TokenKind.INTEGER_LITERAL, "1", 2, 9)));
        FunctionStatement main = positionedSub(assignment, comment("' set x", 2, 11), comment("' alone", 3, 5));

        assertThat(transpile(main)).isEqualTo("sub main()\n    x = 1 ' set x\n    ' alone\nend sub");
    }

    @Test
    void block_indentsNestedBlocks() {
        WhileStatement loop = new WhileStatement(tok(TokenKind.WHILE, "while"), tok(TokenKind.END_WHILE, "end while"),
                var("running"), block(print(str("tick"))));

        assertThat(transpile(sub("main", loop)))
                .isEqualTo("sub main()\n    while running\n        print \"tick\"\n    end while\nend sub");
    }

    @Test
    void indentUnit_comesFromConfig() {
        state = new BrsTranspileState("source/main.bs", ClassResolver.NONE, new DiagnosticManager(),
                TranspileConfig.defaults().withIndent("\t"), new AstEditor());

        assertThat(transpile(sub("main", print(num("1"))))).isEqualTo("sub main()\n\tprint 1\nend sub");
    }

    // if

    private static IfStatement ifThen(Token elseToken, Token endIf, Statement elseBranch) {
        return new IfStatement(tok(TokenKind.IF, "if"), tok(TokenKind.THEN, "then"), elseToken, endIf,
                var("ready"), block(print(num("1"))), elseBranch);
    }

    @Test
    void if_withElseBlock() {
        IfStatement statement = ifThen(tok(TokenKind.ELSE, "else"), tok(TokenKind.END_IF, "end if"), block(print(num("2"))));

        assertThat(transpile(statement)).isEqualTo("if ready then\n    print 1\nelse\n    print 2\nend if");
    }

    @Test
    void if_elseIfChainKeepsWhitespaceBetweenElseAndIf() {
        IfStatement nested = new IfStatement(new Token(TokenKind.IF, "if", AstUtils.INTERPOLATED_RANGE, " "),
                tok(TokenKind.THEN, "then"), null, tok(TokenKind.END_IF, "end if"), var("other"), block(print(num("2"))), null);
        IfStatement statement = ifThen(tok(TokenKind.ELSE, "else"), null, nested);

        assertThat(transpile(statement)).isEqualTo("if ready then\n    print 1\nelse if other then\n    print 2\nend if");
    }

    @Test
    void if_withoutEndIfToken_emitsEndIf() {
        assertThat(transpile(ifThen(null, null, null))).isEqualTo("if ready then\n    print 1\nend if");
    }

    @Test
    void if_commentOnConditionLineStaysThere() {
        IfStatement statement = new IfStatement(tok(TokenKind.IF, "if", 1, 1), tok(TokenKind.THEN, "then", 1, 10),
                null, tok(TokenKind.END_IF, "end if", 3, 1), var("ready"),
                block(comment("' note", 1, 15), print(num("1"))), null);

        assertThat(transpile(statement)).isEqualTo("if ready then ' note\n    print 1\nend if");
    }

    @Test
    void if_commentOnElseLineStaysThere() {
        IfStatement statement = new IfStatement(tok(TokenKind.IF, "if", 1, 1), tok(TokenKind.THEN, "then", 1, 10),
                tok(TokenKind.ELSE, "else", 3, 1), tok(TokenKind.END_IF, "end if", 5, 1), var("ready"),
                block(print(num("1"))), block(comment("' fallback", 3, 6), print(num("2"))));

        assertThat(transpile(statement)).isEqualTo("if ready then\n    print 1\nelse ' fallback\n    print 2\nend if");
    }

    @Test
    void forEach_commentOnLoopLineStaysThere() {
        ForEachStatement loop = new ForEachStatement(tok(TokenKind.FOR_EACH, "for each", 1, 1),
                tok(TokenKind.IN, "in", 1, 15), tok(TokenKind.END_FOR, "end for", 3, 1), id("item", 1, 10),
                var("items"), block(comment("' each", 1, 24), print(var("item"))));

        assertThat(transpile(loop)).isEqualTo("for each item in items ' each\n    print item\nend for");
    }

    // try, catch, throw

    @Test
    void tryCatch_defaultsCatchVariable() {
        TryCatchStatement statement = new TryCatchStatement(tok(TokenKind.TRY, "try"), tok(TokenKind.END_TRY, "end try"),
                block(print(num("1"))),
                new CatchStatement(tok(TokenKind.CATCH, "catch"), null, block(print(num("2")))));

        assertThat(transpile(statement)).isEqualTo("try\n    print 1\ncatch e\n    print 2\nend try");
    }

    @Test
    void tryWithoutCatch_emitsBareCatch() {
        TryCatchStatement statement = new TryCatchStatement(tok(TokenKind.TRY, "try"), null, block(print(num("1"))), null);

        assertThat(transpile(statement)).isEqualTo("try\n    print 1\ncatch\nend try");
    }

    @Test
    void throwWithoutExpression_usesDefaultMessage() {
        assertThat(transpile(new ThrowStatement(tok(TokenKind.THROW, "throw"), null)))
                .isEqualTo("throw \"An error has occurred\"");
        assertThat(transpile(new ThrowStatement(tok(TokenKind.THROW, "throw"), str("boom"))))
                .isEqualTo("throw \"boom\"");
    }

    // simple statements

    @Test
    void print_keepsSeparators() {
        List<Located> items = List.of(var("a"), tok(TokenKind.SEMICOLON, ";"), var("b"), tok(TokenKind.COMMA, ","), var("c"));
        PrintStatement statement = new PrintStatement(tok(TokenKind.PRINT, "print"), items);

        assertThat(transpile(statement)).isEqualTo("print a; b, c");
        assertThat(transpile(print(var("a"), var("b")))).isEqualTo("print a b");
    }

    @Test
    void dimAndContinue() {
        DimStatement dim = new DimStatement(tok(TokenKind.DIM, "dim"), id("grid"), tok(TokenKind.LEFT_SQUARE, "["),
                List.of(num("3"), num("4")), tok(TokenKind.RIGHT_SQUARE, "]"));
        ContinueStatement next = new ContinueStatement(tok(TokenKind.CONTINUE, "continue"), tok(TokenKind.FOR, "for"));

        assertThat(transpile(dim)).isEqualTo("dim grid[3, 4]");
        assertThat(transpile(next)).isEqualTo("continue for");
    }

    @Test
    void compoundSet_emitsOnlyTheOperation() {
        DottedSetStatement dottedSet = new DottedSetStatement(var("m"), id("count"),
                binary(dotted("m.count"), TokenKind.PLUS_EQUAL, "+=", num("1")), tok(TokenKind.DOT, "."), tok(TokenKind.PLUS_EQUAL, "+="));
        IndexedSetStatement indexedSet = new IndexedSetStatement(var("items"), num("0"),
                str("x"), tok(TokenKind.LEFT_SQUARE, "["), tok(TokenKind.RIGHT_SQUARE, "]"), tok(TokenKind.EQUAL, "="));

        assertThat(transpile(dottedSet)).isEqualTo("m.count += 1");
        assertThat(transpile(indexedSet)).isEqualTo("items[0] = \"x\"");
    }

    @Test
    void import_lowersToComment() {
        ImportStatement statement = new ImportStatement(tok(TokenKind.IMPORT, "import"),
                tok(TokenKind.STRING_LITERAL, "\"pkg:/source/lib.bs\""));

        assertThat(transpile(statement)).isEqualTo("'import \"pkg:/source/lib.bs\"");
        assertThat(statement.getTypedef(state).toString()).isEqualTo("import \"pkg:/source/lib.brs\"");
    }

    @Test
    void erasedDeclarations_emitNothing() {
        assertThat(transpile(new ConstStatement(tok(TokenKind.CONST, "const"), id("A"), tok(TokenKind.EQUAL, "="), num("1"))))
                .isEmpty();
        assertThat(transpile(new EnumStatement(tok(TokenKind.ENUM, "enum"), id("E"), tok(TokenKind.END_ENUM, "end enum"), List.of())))
                .isEmpty();
        assertThat(transpile(new InterfaceStatement(tok(TokenKind.INTERFACE, "interface"), id("I"), null, null,
                List.of(new InterfaceFieldStatement(id("name"), tok(TokenKind.AS, "as"), id("string"))),
                tok(TokenKind.END_INTERFACE, "end interface"))))
                .isEmpty();
    }

    @Test
    void membersOutsideTheirContainer_areContractViolations() {
        assertThatThrownBy(() -> transpile(new InterfaceFieldStatement(id("name"), null, null)))
                .isInstanceOf(StructuralContractException.class);
        assertThatThrownBy(() -> transpile(field("name", str("x"))))
                .isInstanceOf(StructuralContractException.class);
        assertThatThrownBy(() -> transpile(method("speak")))
                .isInstanceOf(StructuralContractException.class)
                .hasMessageContaining("speak");
    }

    @Test
    void missingRequiredToken_isContractViolation() {
        ContinueStatement statement = new ContinueStatement(tok(TokenKind.CONTINUE, "continue"), null);

        assertThatThrownBy(() -> transpile(statement))
                .isInstanceOf(StructuralContractException.class)
                .hasMessageContaining("continue loop type");
    }

    @Test
    void boundingRange_skipsSynthesizedParts() {
        AssignmentStatement assignment = new AssignmentStatement(tok(TokenKind.EQUAL, "="), id("x", 4, 5), num("1"));

        Range range = assignment.getRange();

        assertThat(range.begin.line).isEqualTo(4);
        assertThat(range.end.line).isEqualTo(4);
    }
}
