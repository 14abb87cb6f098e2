package org.brighterscript.parser.util;

import com.github.javaparser.Range;
import org.brighterscript.parser.Located;
import org.brighterscript.parser.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.brighterscript.test.Ast.call;
import static org.brighterscript.test.Ast.dotted;
import static org.brighterscript.test.Ast.num;
import static org.brighterscript.test.Ast.tok;

class AstUtilsTest {

    @Test
    void parseIntegerLiteral_handlesRadixSignAndSuffix() {
        assertThat(AstUtils.parseIntegerLiteral("42")).hasValue(42);
        assertThat(AstUtils.parseIntegerLiteral("&HFF")).hasValue(255);
        assertThat(AstUtils.parseIntegerLiteral("0x1f")).hasValue(31);
        assertThat(AstUtils.parseIntegerLiteral("-7")).hasValue(-7);
        assertThat(AstUtils.parseIntegerLiteral("10&")).hasValue(10);
        assertThat(AstUtils.parseIntegerLiteral("abc")).isEmpty();
        assertThat(AstUtils.parseIntegerLiteral("&h")).isEmpty();
        assertThat(AstUtils.parseIntegerLiteral(null)).isEmpty();
    }

    @Test
    void classNames() {
        assertThat(AstUtils.getBuilderName("Alpha.Animal")).isEqualTo("__Alpha_Animal_builder");
        assertThat(AstUtils.getFullyQualifiedClassName("Animal", "Alpha")).isEqualTo("Alpha.Animal");
        assertThat(AstUtils.getFullyQualifiedClassName("Beta.Animal", "Alpha")).isEqualTo("Beta.Animal");
        assertThat(AstUtils.getFullyQualifiedClassName("Animal", null)).isEqualTo("Animal");
    }

    @Test
    void boundingRange_ignoresMissingAndSynthesizedItems() {
        Located first = tok(TokenKind.IDENTIFIER, "a", 2, 3);
        Located last = tok(TokenKind.IDENTIFIER, "bc", 4, 1);

        Range range = AstUtils.createBoundingRange(null, last, tok(TokenKind.DOT, "."), first);

        assertThat(range).isEqualTo(Range.range(2, 3, 4, 2));
        assertThat(AstUtils.createBoundingRange(List.of(tok(TokenKind.DOT, ".")))).isSameAs(AstUtils.INTERPOLATED_RANGE);
    }

    @Test
    void linesTouch_comparesStartAndEndLines() {
        Located multiLine = () -> Range.range(1, 1, 3, 7);

        assertThat(AstUtils.linesTouch(multiLine, tok(TokenKind.COMMENT, "'x", 3, 9))).isTrue();
        assertThat(AstUtils.linesTouch(multiLine, tok(TokenKind.COMMENT, "'x", 2, 1))).isFalse();
        assertThat(AstUtils.linesTouch(multiLine, tok(TokenKind.COMMENT, "'x"))).isFalse();
        assertThat(AstUtils.linesTouch(null, multiLine)).isFalse();
    }

    @Test
    void dottedNameParts() {
        assertThat(AstUtils.getDottedNameParts(dotted("Alpha.Color.Red"))).hasValue(List.of("Alpha", "Color", "Red"));
        assertThat(AstUtils.getDottedNameParts(call(dotted("a.b")))).isEmpty();
        assertThat(AstUtils.getDottedNameParts(num("1"))).isEmpty();
    }

    @Test
    void beginningVariable_followsCallsAndMemberAccess() {
        assertThat(AstUtils.findBeginningVariableExpression(call(dotted("super.speak"))))
                .hasValueSatisfying(v -> assertThat(v.getName().getText()).isEqualTo("super"));
        assertThat(AstUtils.findBeginningVariableExpression(num("1"))).isEmpty();
    }
}
