package org.brighterscript;

import org.brighterscript.config.TranspileConfig;
import org.brighterscript.parser.ast.stmt.FieldStatement;
import org.brighterscript.program.Program;
import org.brighterscript.transpiler.BrsTranspiler;
import org.brighterscript.transpiler.context.BrsTranspileState;
import org.brighterscript.symbols.ClassResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.brighterscript.test.Ast.body;
import static org.brighterscript.test.Ast.classStmt;
import static org.brighterscript.test.Ast.field;
import static org.brighterscript.test.Ast.str;

class ErrorHandlingTest {

    // 1. StructuralContractException - node routed to the wrong place
    @Test
    void contractViolation_carriesNodeDescription() {
        FieldStatement field = field("name", str("x"));
        BrsTranspileState state = new BrsTranspileState("source/main.bs", ClassResolver.NONE);

        assertThatThrownBy(() -> field.transpile(state))
                .isInstanceOf(StructuralContractException.class)
                .satisfies(e -> {
                    StructuralContractException sce = (StructuralContractException) e;
                    assertThat(sce.getNodeDescription()).isNotNull();
                    assertThat(sce).isInstanceOf(TranspileException.class);
                    assertThat(sce).isInstanceOf(BrighterScriptException.class);
                });
    }

    // 2. ClassHierarchyCycleException - structured fields
    @Test
    void hierarchyCycle_reportsClassAndChain() {
        ClassHierarchyCycleException ex = new ClassHierarchyCycleException("A", List.of("A", "B", "A"));
        assertThat(ex.getNodeDescription()).isEqualTo("A");
        assertThat(ex.getChain()).containsExactly("A", "B", "A");
        assertThat(ex.getMessage()).contains("A -> B -> A");
        assertThat(ex).isInstanceOf(StructuralContractException.class);
    }

    // 3. Transpiling a broken hierarchy surfaces as the common base type
    @Test
    void cyclicProgram_catchableAtRoot() {
        Program program = new Program(TranspileConfig.defaults());
        program.addFile("source/main.bs", body(classStmt("A", "B"), classStmt("B", "A")));
        BrsTranspiler transpiler = new BrsTranspiler(program);

        assertThatThrownBy(() -> transpiler.transpileAll(program.getFiles()))
                .isInstanceOf(BrighterScriptException.class)
                .hasMessageContaining("cyclic inheritance chain");
    }

    // 4. Chained causes are preserved
    @Test
    void transpileException_keepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        TranspileException ex = new TranspileException("failed", "PrintStatement", cause);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getNodeDescription()).isEqualTo("PrintStatement");
    }
}
