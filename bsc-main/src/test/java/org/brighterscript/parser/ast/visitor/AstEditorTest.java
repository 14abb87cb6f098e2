package org.brighterscript.parser.ast.visitor;

import org.brighterscript.parser.ast.expr.VariableExpression;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.brighterscript.test.Ast.var;

class AstEditorTest {

    @Test
    void undoAll_revertsEveryEditInReverseOrder() {
        AstEditor editor = new AstEditor();
        VariableExpression variable = var("original");
        List<String> list = new ArrayList<>(List.of("a", "b", "c"));

        editor.setProperty(variable::getName, variable::setName, variable.getName().withText("renamed"));
        editor.setProperty(variable::getName, variable::setName, variable.getName().withText("again"));
        editor.arrayUnshift(list, "first");
        editor.setArrayValue(list, 1, "A");
        editor.arraySplice(list, 2, 1, List.of("x", "y"));
        editor.addToArray(list, list.size(), "last");

        assertThat(variable.getName().getText()).isEqualTo("again");
        assertThat(list).containsExactly("first", "A", "x", "y", "c", "last");
        assertThat(editor.getEditCount()).isEqualTo(6);

        editor.undoAll();

        assertThat(variable.getName().getText()).isEqualTo("original");
        assertThat(list).containsExactly("a", "b", "c");
        assertThat(editor.getEditCount()).isZero();
    }

    @Test
    void edit_runsApplyNowAndUndoLater() {
        AstEditor editor = new AstEditor();
        List<String> log = new ArrayList<>();

        editor.edit(() -> log.add("apply"), () -> log.add("undo"));
        assertThat(log).containsExactly("apply");

        editor.undoAll();
        assertThat(log).containsExactly("apply", "undo");
    }
}
