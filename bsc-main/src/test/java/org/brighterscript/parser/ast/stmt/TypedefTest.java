package org.brighterscript.parser.ast.stmt;

import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.expr.AnnotationExpression;
import org.brighterscript.parser.ast.expr.FunctionParameterExpression;
import org.brighterscript.symbols.ClassResolver;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.brighterscript.test.Ast.body;
import static org.brighterscript.test.Ast.classStmt;
import static org.brighterscript.test.Ast.constStmt;
import static org.brighterscript.test.Ast.constructor;
import static org.brighterscript.test.Ast.enumStmt;
import static org.brighterscript.test.Ast.field;
import static org.brighterscript.test.Ast.functionExpr;
import static org.brighterscript.test.Ast.id;
import static org.brighterscript.test.Ast.invalid;
import static org.brighterscript.test.Ast.member;
import static org.brighterscript.test.Ast.num;
import static org.brighterscript.test.Ast.param;
import static org.brighterscript.test.Ast.print;
import static org.brighterscript.test.Ast.str;
import static org.brighterscript.test.Ast.sub;
import static org.brighterscript.test.Ast.tok;

class TypedefTest {

    private BrsTranspileState state;

    @BeforeEach
    void setUp() {
        state = new BrsTranspileState("source/main.bs", ClassResolver.NONE);
    }

    @Test
    void function_dropsBodyAndKeepsAnnotations() {
        FunctionStatement main = sub("main", print(str("hidden")));
        main.setAnnotations(List.of(new AnnotationExpression(tok(TokenKind.AT, "@"), id("test"), List.of(str("fast")))));

        assertThat(body(main).getTypedef(state).toString()).isEqualTo("@test(\"fast\")\nsub main()\nend sub\n");
    }

    @Test
    void fieldTypes_fallBackToInitializerThenDynamic() {
        assertThat(field("name", str("x")).getTypedef(state).toString()).isEqualTo("public name as string");
        assertThat(field("count", num("1")).getTypedef(state).toString()).isEqualTo("public count as integer");
        assertThat(field("thing", invalid()).getTypedef(state).toString()).isEqualTo("public thing as dynamic");
        assertThat(field("other", null).getTypedef(state).toString()).isEqualTo("public other as dynamic");
        assertThat(field("private", "secret", "MyType").getTypedef(state).toString()).isEqualTo("private secret as MyType");
        assertThat(field("protected", "flag", "Boolean").getTypedef(state).toString()).isEqualTo("protected flag as boolean");
    }

    @Test
    void class_listsConstructorAndMethods() {
        MethodStatement speak = new MethodStatement(List.of(tok(TokenKind.PUBLIC, "public")), id("speak"),
                functionExpr(List.of()), tok(TokenKind.OVERRIDE, "override"));
        ClassStatement dog = classStmt("Dog", constructor(List.of(param("name", "string"))), speak);

        assertThat(dog.getTypedef(state).toString()).isEqualTo(String.join("\n",
                "class Dog",
                "    sub new(name as string)",
                "    end sub",
                "    public override function speak()",
                "    end function",
                "end class"));
    }

    @Test
    void enumAndConst() {
        EnumStatement color = enumStmt("Color", member("Red"), member("Blue", num("5")));
        ConstStatement max = constStmt("MAX", num("10"));

        assertThat(color.getTypedef(state).toString()).isEqualTo("enum Color\n    Red\n    Blue = 5\nend enum");
        assertThat(max.getTypedef(state).toString()).isEqualTo("const MAX = 10");
    }

    @Test
    void interface_listsMembers() {
        List<FunctionParameterExpression> params = List.of(param("other", "string"));
        InterfaceStatement person = new InterfaceStatement(tok(TokenKind.INTERFACE, "interface"), id("Person"), null, null,
                List.of(
                        new InterfaceFieldStatement(id("name"), tok(TokenKind.AS, "as"), id("string")),
                        new InterfaceMethodStatement(tok(TokenKind.FUNCTION, "function"), id("greet"),
                                tok(TokenKind.LEFT_PAREN, "("), params, tok(TokenKind.RIGHT_PAREN, ")"),
                                tok(TokenKind.AS, "as"), id("string"))),
                tok(TokenKind.END_INTERFACE, "end interface"));

        assertThat(person.getTypedef(state).toString()).isEqualTo(String.join("\n",
                "interface Person",
                "    name as string",
                "    function greet(other as string) as string",
                "end interface",
                ""));
    }
}
