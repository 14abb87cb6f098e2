package org.brighterscript.diagnostics;

import com.github.javaparser.Range;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticManagerTest {

    @Test
    void register_keepsOneEntryPerProblem() {
        DiagnosticManager manager = new DiagnosticManager();
        Range range = Range.range(3, 1, 3, 10);

        manager.register(DiagnosticMessages.classCouldNotBeFound("Animal", "a.bs", range));
        manager.register(DiagnosticMessages.classCouldNotBeFound("Animal", "a.bs", range));
        manager.register(DiagnosticMessages.classCouldNotBeFound("Animal", "a.bs", Range.range(9, 1, 9, 10)));

        assertThat(manager.getDiagnostics()).hasSize(2)
                .allSatisfy(d -> {
                    assertThat(d.code()).isEqualTo(DiagnosticMessages.CLASS_COULD_NOT_BE_FOUND);
                    assertThat(d.severity()).isEqualTo(DiagnosticSeverity.WARNING);
                });
    }

    @Test
    void diagnostics_areFilteredAndClearedPerFile() {
        DiagnosticManager manager = new DiagnosticManager();
        Range range = Range.range(1, 1, 1, 5);
        manager.register(List.of(
                DiagnosticMessages.classCouldNotBeFound("Animal", "a.bs", range),
                DiagnosticMessages.duplicateClassDeclaration("Dog", "b.bs", range)));

        assertThat(manager.getDiagnostics("b.bs")).extracting(BsDiagnostic::code)
                .containsExactly(DiagnosticMessages.DUPLICATE_CLASS_DECLARATION);

        manager.clearForFile("a.bs");

        assertThat(manager.getDiagnostics()).extracting(BsDiagnostic::srcPath).containsExactly("b.bs");

        manager.clear();

        assertThat(manager.getDiagnostics()).isEmpty();
    }

    @Test
    void messages_nameTheClass() {
        BsDiagnostic diagnostic = DiagnosticMessages.classCouldNotBeFound("Animal", "a.bs", Range.range(1, 1, 1, 1));

        assertThat(diagnostic.message()).isEqualTo("Class 'Animal' could not be found when this file is transpiled");
    }
}
