package org.brighterscript.symbols;

import org.brighterscript.parser.util.AstUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableTest {

    @Test
    void lookup_isCaseInsensitiveAndFallsBackToParent() {
        SymbolTable global = new SymbolTable("global");
        SymbolTable local = new SymbolTable("local", () -> global);
        global.addSymbol("Main", SymbolKind.FUNCTION, AstUtils.INTERPOLATED_RANGE, null);
        local.addSymbol("helper", SymbolKind.FUNCTION, AstUtils.INTERPOLATED_RANGE, null);

        assertThat(local.hasSymbol("MAIN")).isTrue();
        assertThat(local.getSymbol("main")).singleElement()
                .satisfies(symbol -> assertThat(symbol.kind()).isEqualTo(SymbolKind.FUNCTION));
        assertThat(global.hasSymbol("helper")).isFalse();
        assertThat(local.getOwnSymbols()).hasSize(1);
        assertThat(local.getParent()).isSameAs(global);
    }

    @Test
    void nearestDeclarationWins() {
        SymbolTable global = new SymbolTable("global");
        SymbolTable local = new SymbolTable("local", () -> global);
        global.addSymbol("value", SymbolKind.CONST, AstUtils.INTERPOLATED_RANGE, null);
        local.addSymbol("Value", SymbolKind.ENUM, AstUtils.INTERPOLATED_RANGE, null);

        assertThat(local.getSymbol("value")).extracting(BscSymbol::kind).containsExactly(SymbolKind.ENUM);

        local.clear();

        assertThat(local.getSymbol("value")).extracting(BscSymbol::kind).containsExactly(SymbolKind.CONST);
        assertThat(local.getSymbol("unknown")).isEmpty();
    }
}
