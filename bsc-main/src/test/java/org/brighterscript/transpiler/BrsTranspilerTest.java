package org.brighterscript.transpiler;

import org.brighterscript.ClassHierarchyCycleException;
import org.brighterscript.config.TranspileConfig;
import org.brighterscript.diagnostics.BsDiagnostic;
import org.brighterscript.diagnostics.DiagnosticMessages;
import org.brighterscript.diagnostics.DiagnosticSeverity;
import org.brighterscript.parser.TokenKind;
import org.brighterscript.parser.ast.expr.BinaryExpression;
import org.brighterscript.parser.ast.expr.DottedGetExpression;
import org.brighterscript.parser.ast.expr.VariableExpression;
import org.brighterscript.parser.ast.stmt.Body;
import org.brighterscript.parser.ast.stmt.ClassStatement;
import org.brighterscript.parser.ast.stmt.ConstStatement;
import org.brighterscript.parser.ast.stmt.MethodStatement;
import org.brighterscript.parser.ast.stmt.ReturnStatement;
import org.brighterscript.parser.ast.expr.CallExpression;
import org.brighterscript.parser.ast.expr.FunctionExpression;
import org.brighterscript.parser.ast.expr.LiteralExpression;
import org.brighterscript.parser.ast.stmt.Block;
import org.brighterscript.parser.ast.stmt.FunctionStatement;
import org.brighterscript.parser.ast.stmt.PrintStatement;
import org.brighterscript.parser.util.AstUtils;
import org.brighterscript.sourcemap.Mapping;
import org.brighterscript.program.BrsFile;
import org.brighterscript.program.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.brighterscript.test.Ast.assign;
import static org.brighterscript.test.Ast.binary;
import static org.brighterscript.test.Ast.body;
import static org.brighterscript.test.Ast.call;
import static org.brighterscript.test.Ast.classStmt;
import static org.brighterscript.test.Ast.constStmt;
import static org.brighterscript.test.Ast.constructor;
import static org.brighterscript.test.Ast.dotted;
import static org.brighterscript.test.Ast.enumStmt;
import static org.brighterscript.test.Ast.exprStmt;
import static org.brighterscript.test.Ast.field;
import static org.brighterscript.test.Ast.id;
import static org.brighterscript.test.Ast.member;
import static org.brighterscript.test.Ast.method;
import static org.brighterscript.test.Ast.namespace;
import static org.brighterscript.test.Ast.num;
import static org.brighterscript.test.Ast.overrideMethod;
import static org.brighterscript.test.Ast.param;
import static org.brighterscript.test.Ast.print;
import static org.brighterscript.test.Ast.ret;
import static org.brighterscript.test.Ast.str;
import static org.brighterscript.test.Ast.sub;
import static org.brighterscript.test.Ast.tok;
import static org.brighterscript.test.Ast.var;

class BrsTranspilerTest {

    private static final String MAIN = "source/main.bs";

    private static final String ANIMAL = String.join("\n",
            "function __Animal_builder()",
            "    instance = {}",
            "    instance.new = sub()",
            "        m.name = \"animal\"",
            "    end sub",
            "    instance.speak = function()",
            "        return \"generic\"",
            "    end function",
            "    return instance",
            "end function",
            "function Animal()",
            "    instance = __Animal_builder()",
            "    instance.new()",
            "    return instance",
            "end function");

    private Program program;
    private BrsTranspiler transpiler;

    @BeforeEach
    void setUp() {
        program = new Program(TranspileConfig.defaults());
        transpiler = new BrsTranspiler(program);
    }

    private ClassStatement animal() {
        return classStmt("Animal",
                field("name", str("animal")),
                constructor(List.of()),
                method("speak", ret(str("generic"))));
    }

    private String transpile(Body body) {
        BrsFile file = program.addFile(MAIN, body);
        return transpiler.transpile(file).code();
    }

    @Test
    void classWithoutParent_emitsBuilderAndClassFunction() {
        assertThat(transpile(body(animal()))).isEqualTo(ANIMAL);
    }

    @Test
    void derivedClass_preservesOverriddenMembersAndCallsParentConstructor() {
        String code = transpile(body(
                animal(),
                classStmt("Dog", "Animal",
                        overrideMethod("speak", ret(call(dotted("super.speak")))))));

        assertThat(code).isEqualTo(ANIMAL + "\n" + String.join("\n",
                "function __Dog_builder()",
                "    instance = __Animal_builder()",
                "    instance.super0_new = instance.new",
                "    instance.new = sub()",
                "        m.super0_new()",
                "    end sub",
                "    instance.super0_speak = instance.speak",
                "    instance.speak = function()",
                "        return m.super0_speak()",
                "    end function",
                "    return instance",
                "end function",
                "function Dog()",
                "    instance = __Dog_builder()",
                "    instance.new()",
                "    return instance",
                "end function"));
    }

    @Test
    void derivedConstructor_getsFieldInitializersAfterSuperCall() {
        String code = transpile(body(
                animal(),
                classStmt("Dog", "Animal",
                        field("sound", str("woof")),
                        constructor(List.of(), print(str("hi"))))));

        assertThat(code).contains(String.join("\n",
                "    instance.super0_new = instance.new",
                "    instance.new = sub()",
                "        m.super0_new()",
                "        m.sound = \"woof\"",
                "        print \"hi\"",
                "    end sub"));
    }

    @Test
    void explicitSuperCall_isNotDuplicated() {
        String code = transpile(body(
                animal(),
                classStmt("Dog", "Animal",
                        constructor(List.of(), exprStmt(call(var("super")))))));

        assertThat(code).contains(String.join("\n",
                "    instance.new = sub()",
                "        m.super0_new()",
                "    end sub"));
        assertThat(code.split("m\\.super0_new\\(\\)", -1)).hasSize(2);
    }

    @Test
    void fieldWithoutInitializer_isAssignedInvalid() {
        String code = transpile(body(classStmt("Box", field("content", null))));

        assertThat(code).contains(String.join("\n",
                "    instance.new = sub()",
                "        m.content = invalid",
                "    end sub"));
    }

    @Test
    void grandchild_usesAncestorCountForSuperIndex() {
        String code = transpile(body(
                animal(),
                classStmt("Dog", "Animal"),
                classStmt("Puppy", "Dog", overrideMethod("speak", ret(call(dotted("super.speak")))))));

        assertThat(code).contains(String.join("\n",
                "function __Puppy_builder()",
                "    instance = __Dog_builder()",
                "    instance.super1_new = instance.new",
                "    instance.new = sub()",
                "        m.super1_new()",
                "    end sub",
                "    instance.super1_speak = instance.speak",
                "    instance.speak = function()",
                "        return m.super1_speak()",
                "    end function"));
    }

    @Test
    void constructorParameters_areForwardedByClassFunction() {
        String code = transpile(body(classStmt("Person",
                constructor(List.of(param("name"), param("age", "integer"))))));

        assertThat(code).contains(String.join("\n",
                "    instance.new = sub(name, age as integer)",
                "    end sub"));
        assertThat(code).endsWith(String.join("\n",
                "function Person(name, age as integer)",
                "    instance = __Person_builder()",
                "    instance.new(name, age)",
                "    return instance",
                "end function"));
    }

    @Test
    void namespacedClass_isFlattened() {
        String code = transpile(body(
                namespace("Alpha", classStmt("Animal")),
                classStmt("Dog", "Alpha.Animal")));

        assertThat(code).isEqualTo(String.join("\n",
                "function __Alpha_Animal_builder()",
                "    instance = {}",
                "    instance.new = sub()",
                "    end sub",
                "    return instance",
                "end function",
                "function Alpha_Animal()",
                "    instance = __Alpha_Animal_builder()",
                "    instance.new()",
                "    return instance",
                "end function",
                "function __Dog_builder()",
                "    instance = __Alpha_Animal_builder()",
                "    instance.super0_new = instance.new",
                "    instance.new = sub()",
                "        m.super0_new()",
                "    end sub",
                "    return instance",
                "end function",
                "function Dog()",
                "    instance = __Dog_builder()",
                "    instance.new()",
                "    return instance",
                "end function"));
    }

    @Test
    void parentName_resolvesRelativeToNamespace() {
        String code = transpile(body(namespace("Alpha",
                classStmt("Animal"),
                classStmt("Dog", "Animal"))));

        assertThat(code).contains("    instance = __Alpha_Animal_builder()\n    instance.super0_new = instance.new");
    }

    @Test
    void parentDeclaredInAnotherFile_isResolved() {
        program.addFile("source/animal.bs", body(animal()));
        BrsFile dog = program.addFile(MAIN, body(classStmt("Dog", "Animal")));

        String code = transpiler.transpile(dog).code();

        assertThat(code).startsWith(String.join("\n",
                "function __Dog_builder()",
                "    instance = __Animal_builder()",
                "    instance.super0_new = instance.new"));
    }

    @Test
    void unresolvedParent_lowersAsRootClassAndWarns() {
        String code = transpile(body(classStmt("Dog", "Missing")));

        assertThat(code).startsWith(String.join("\n",
                "function __Dog_builder()",
                "    instance = {}",
                "    instance.new = sub()",
                "    end sub",
                "    return instance",
                "end function"));
        List<BsDiagnostic> diagnostics = program.getDiagnostics().getDiagnostics(MAIN);
        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).code()).isEqualTo(DiagnosticMessages.CLASS_COULD_NOT_BE_FOUND);
        assertThat(diagnostics.get(0).severity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(diagnostics.get(0).message()).contains("Missing");
    }

    @Test
    void cyclicHierarchy_fails() {
        BrsFile file = program.addFile(MAIN, body(
                classStmt("A", "B"),
                classStmt("B", "A")));

        assertThatThrownBy(() -> transpiler.transpile(file))
                .isInstanceOf(ClassHierarchyCycleException.class)
                .satisfies(e -> assertThat(((ClassHierarchyCycleException) e).getChain())
                        .containsExactly("A", "B", "A"));
    }

    @Test
    void transpilingTwice_isDeterministicAndRestoresTree() {
        MethodStatement speak = overrideMethod("speak", ret(call(dotted("super.speak"))));
        ClassStatement dog = classStmt("Dog", "Animal", speak);
        BrsFile file = program.addFile(MAIN, body(animal(), dog));

        String first = transpiler.transpile(file).code();
        String second = transpiler.transpile(file).code();

        assertThat(second).isEqualTo(first);
        ReturnStatement returnStatement = (ReturnStatement) speak.getFunc().getBody().getStatements().get(0);
        DottedGetExpression callee = (DottedGetExpression) ((CallExpression) returnStatement.getValue()).getCallee();
        assertThat(((VariableExpression) callee.getObj()).getName().getText()).isEqualTo("super");
        assertThat(callee.getName().getText()).isEqualTo("speak");
        assertThat(speak.getFunc().getBody().getStatements()).hasSize(1);
    }

    @Test
    void enumReferences_areReplacedByValues() {
        String code = transpile(body(
                enumStmt("Color", member("Red"), member("Green"), member("Blue", num("5")), member("Yellow")),
                sub("main", print(dotted("Color.Red")), print(dotted("Color.Yellow")))));

        assertThat(code).isEqualTo("\n\nsub main()\n    print 0\n    print 6\nend sub");
    }

    @Test
    void namespacedReferences_areQualifiedAndFlattened() {
        String code = transpile(body(
                namespace("Alpha",
                        enumStmt("Direction", member("up", str("up")), member("down", str("down"))),
                        sub("go", print(dotted("Direction.up")))),
                sub("main",
                        print(dotted("Alpha.Direction.down")),
                        exprStmt(call(dotted("Alpha.go"))))));

        assertThat(code).isEqualTo(String.join("\n",
                "",
                "",
                "sub Alpha_go()",
                "    print \"up\"",
                "end sub",
                "",
                "sub main()",
                "    print \"down\"",
                "    Alpha_go()",
                "end sub"));
    }

    @Test
    void unqualifiedFunctionInsideNamespace_isFlattened() {
        String code = transpile(body(namespace("Alpha.Beta",
                sub("helper"),
                sub("run", exprStmt(call(var("helper")))))));

        assertThat(code).contains("sub Alpha_Beta_run()\n    Alpha_Beta_helper()\nend sub");
    }

    @Test
    void constReferences_areReplacedByValues() {
        String code = transpile(body(
                constStmt("API_URL", str("https://example.com")),
                namespace("Alpha",
                        constStmt("MAX", num("10")),
                        constStmt("TOTAL", binary(num("1"), TokenKind.PLUS, "+", num("2"))),
                        sub("limit", print(var("MAX")), print(var("TOTAL")))),
                sub("main", print(var("API_URL")), print(dotted("Alpha.MAX")))));

        assertThat(code).contains("sub Alpha_limit()\n    print 10\n    print (1 + 2)\nend sub");
        assertThat(code).contains("sub main()\n    print \"https://example.com\"\n    print 10\nend sub");
        assertThat(code).doesNotContain("const");
    }

    @Test
    void constFromOtherFile_resolvesReferencesInItsValue() {
        ConstStatement total = constStmt("B", binary(var("A"), TokenKind.PLUS, "+", num("1")));
        program.addFile("source/lib.bs", body(constStmt("A", num("1")), total));

        String code = transpile(body(sub("main", print(var("B")))));

        assertThat(code).isEqualTo("sub main()\n    print (1 + 1)\nend sub");
        // the declaring file keeps its original value
        assertThat(((BinaryExpression) total.getValue()).getLeft()).isInstanceOf(VariableExpression.class);
    }

    @Test
    void constDeclaredAfterUse_resolvesReferencesInItsValue() {
        String code = transpile(body(
                sub("main", print(var("B"))),
                constStmt("A", num("1")),
                constStmt("B", binary(var("A"), TokenKind.PLUS, "+", num("1")))));

        assertThat(code).contains("    print (1 + 1)\n");
    }

    @Test
    void constHoldingEnumMember_becomesMemberValue() {
        program.addFile("source/lib.bs", body(
                enumStmt("Color", member("Red"), member("Green")),
                constStmt("FAV", dotted("Color.Green"))));

        String code = transpile(body(sub("main", print(var("FAV")))));

        assertThat(code).isEqualTo("sub main()\n    print 1\nend sub");
    }

    @Test
    void selfReferencingConst_keepsInnerReference() {
        String code = transpile(body(
                constStmt("A", binary(var("A"), TokenKind.PLUS, "+", num("1"))),
                sub("main", print(var("A")))));

        assertThat(code).contains("    print (A + 1)\n");
    }

    @Test
    void compoundAssignment_emitsOperatorOnce() {
        String code = transpile(body(sub("main",
                assign("x", num("1")),
                assign("x", binary(var("x"), TokenKind.PLUS_EQUAL, "+=", num("2"))))));

        assertThat(code).isEqualTo("sub main()\n    x = 1\n    x += 2\nend sub");
    }

    @Test
    void sourceMapsDisabled_yieldsNoMappings() {
        program = new Program(TranspileConfig.defaults().withSourceMaps(false));
        transpiler = new BrsTranspiler(program);
        BrsFile file = program.addFile(MAIN, body(sub("main", print(str("hi")))));

        TranspiledResult result = transpiler.transpile(file);

        assertThat(result.code()).isEqualTo("sub main()\n    print \"hi\"\nend sub");
        assertThat(result.mappings()).isEmpty();
        assertThat(result.sourceNode().toString()).isEqualTo(result.code());
    }

    @Test
    void sourceMap_mapsTokensToTheirOriginalPositions() {
        PrintStatement printStatement = new PrintStatement(tok(TokenKind.PRINT, "print", 2, 5),
                List.of(new LiteralExpression(tok(TokenKind.STRING_LITERAL, "\"hi\"", 2, 11))));
        FunctionExpression func = new FunctionExpression(tok(TokenKind.SUB, "sub", 1, 1),
                tok(TokenKind.LEFT_PAREN, "(", 1, 9), List.of(), tok(TokenKind.RIGHT_PAREN, ")", 1, 10),
                null, null, new Block(List.of(printStatement), AstUtils.createRange(1, 11, 1, 11)),
                tok(TokenKind.END_SUB, "end sub", 3, 1));
        BrsFile file = program.addFile(MAIN, body(new FunctionStatement(id("main", 1, 5), func)));

        TranspiledResult result = transpiler.transpile(file);

        assertThat(result.code()).isEqualTo("sub main()\n    print \"hi\"\nend sub");
        assertThat(result.sourceNode().toString()).isEqualTo(result.code());
        assertThat(result.mappings()).contains(
                new Mapping(1, 0, MAIN, 1, 0),
                new Mapping(1, 4, MAIN, 1, 4),
                new Mapping(2, 4, MAIN, 2, 4),
                new Mapping(2, 10, MAIN, 2, 10),
                new Mapping(3, 0, MAIN, 3, 0));
    }

    @Test
    void typedef_rendersDeclarationsOnly() {
        BrsFile file = program.addFile(MAIN, body(
                namespace("Alpha", sub("go", print(str("x")))),
                classStmt("Dog", "Alpha.Animal", field("public", "name", "String"))));

        assertThat(transpiler.getTypedef(file)).isEqualTo(String.join("\n",
                "namespace Alpha",
                "    sub go()",
                "    end sub",
                "end namespace",
                "class Dog extends Alpha.Animal",
                "    sub new()",
                "    end sub",
                "    public name as string",
                "end class",
                ""));
    }
}
