package org.brighterscript.parser.ast.stmt;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.brighterscript.test.Ast.classStmt;
import static org.brighterscript.test.Ast.constructor;
import static org.brighterscript.test.Ast.field;
import static org.brighterscript.test.Ast.method;
import static org.brighterscript.test.Ast.str;

class ClassStatementTest {

    @Test
    void fieldDeclaredByAnyAncestor_isFoundIgnoringCase() {
        ClassStatement animal = classStmt("Animal", field("name", str("animal")));
        ClassStatement dog = classStmt("Dog", "Animal", field("breed", str("mutt")), method("bark"));
        ClassStatement puppy = classStmt("Puppy", "Dog", field("age", null));

        List<ClassStatement> ancestors = List.of(dog, animal);

        assertThat(puppy.isFieldDeclaredByAncestor("NAME", ancestors)).isTrue();
        assertThat(puppy.isFieldDeclaredByAncestor("breed", ancestors)).isTrue();
        assertThat(puppy.isFieldDeclaredByAncestor("age", ancestors)).isFalse();
        assertThat(puppy.isFieldDeclaredByAncestor("name", List.of())).isFalse();
    }

    @Test
    void constructorFunction_isLookedUpByName() {
        assertThat(classStmt("Animal", constructor(List.of())).getConstructorFunction()).isPresent();
        assertThat(classStmt("Animal", method("speak")).getConstructorFunction()).isEmpty();
    }
}
