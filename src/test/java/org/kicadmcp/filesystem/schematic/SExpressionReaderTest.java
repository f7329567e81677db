package org.kicadmcp.filesystem.schematic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kicadmcp.filesystem.schematic.SExpr.list;
import static org.kicadmcp.filesystem.schematic.SExpr.num;
import static org.kicadmcp.filesystem.schematic.SExpr.str;
import static org.kicadmcp.filesystem.schematic.SExpr.symbol;

class SExpressionReaderTest {

    @Test
    void read_distinguishesSymbolsStringsAndNumbers() {
        SExpr root = SExpressionReader.read("(at 100.33 -50.8 0 \"R1\" 5c7b-uuid 1e3 + .)");

        assertThat(root).isEqualTo(list(
                symbol("at"),
                num("100.33"),
                num("-50.8"),
                num("0"),
                str("R1"),
                symbol("5c7b-uuid"),
                num("1e3"),
                symbol("+"),
                symbol(".")
        ));
    }

    @Test
    void read_handlesNestedListsAcrossLines() {
        String text = """
                (kicad_sch
                  (title_block
                    (title "Power Supply"))
                  (symbol (property "Reference" "R1")))
                """;

        SExpr root = SExpressionReader.read(text);

        assertThat(root).isEqualTo(list(
                symbol("kicad_sch"),
                list(symbol("title_block"), list(symbol("title"), str("Power Supply"))),
                list(symbol("symbol"), list(symbol("property"), str("Reference"), str("R1")))
        ));
    }

    @Test
    void read_emptyListIsAnEmptyList() {
        SExpr root = SExpressionReader.read("()");

        assertThat(root).isInstanceOf(SExpr.SList.class);
        assertThat(((SExpr.SList) root).children()).isEmpty();
        assertThat(((SExpr.SList) root).head()).isNull();
    }

    @Test
    void read_decodesEscapesInsideStrings() {
        SExpr root = SExpressionReader.read("(title \"say \\\"hi\\\" \\\\ (not a list)\\nnext\")");

        assertThat(root).isEqualTo(list(symbol("title"), str("say \"hi\" \\ (not a list)\nnext")));
    }

    @Test
    void read_keepsNumberPrecision() {
        SExpr.SList root = (SExpr.SList) SExpressionReader.read("(pin 1 1.0)");

        assertThat(root.get(1)).isEqualTo(new SExpr.Num("1"));
        assertThat(root.get(2)).isNotEqualTo(new SExpr.Num("1"));
        assertThat(SExpr.atomText(root.get(1))).isEqualTo("1");
        assertThat(SExpr.atomText(root.get(2))).isEqualTo("1.0");
    }

    @Test
    void read_hugeExponentStaysANumberWithItsSourceText() {
        SExpr.SList root = (SExpr.SList) SExpressionReader.read("(foo 1e9999999999 -2E-9999999999)");

        assertThat(root.get(1)).isEqualTo(new SExpr.Num("1e9999999999"));
        assertThat(root.get(2)).isEqualTo(new SExpr.Num("-2E-9999999999"));
    }

    @Test
    void read_missingCloseParenFailsAtEndOfInput() {
        String text = "(symbol (property \"Reference\" \"R1\")";

        assertThatThrownBy(() -> SExpressionReader.read(text))
                .isInstanceOfSatisfying(SExpressionParseException.class, e -> {
                    assertThat(e.reason()).isEqualTo(SExpressionParseException.Reason.UNEXPECTED_END);
                    assertThat(e.offset()).isEqualTo(text.length());
                });
    }

    @Test
    void read_extraCloseParenFailsWhereDetected() {
        assertThatThrownBy(() -> SExpressionReader.read("())"))
                .isInstanceOfSatisfying(SExpressionParseException.class, e -> {
                    assertThat(e.reason()).isEqualTo(SExpressionParseException.Reason.UNBALANCED_CLOSE);
                    assertThat(e.offset()).isEqualTo(2);
                });
    }

    @Test
    void read_unterminatedStringReportsOpeningQuote() {
        assertThatThrownBy(() -> SExpressionReader.read("(a \"bc)"))
                .isInstanceOfSatisfying(SExpressionParseException.class, e -> {
                    assertThat(e.reason()).isEqualTo(SExpressionParseException.Reason.UNTERMINATED_STRING);
                    assertThat(e.offset()).isEqualTo(3);
                });
    }

    @Test
    void read_secondTopLevelExpressionIsRejected() {
        assertThatThrownBy(() -> SExpressionReader.read("(a) (b)"))
                .isInstanceOfSatisfying(SExpressionParseException.class, e -> {
                    assertThat(e.reason()).isEqualTo(SExpressionParseException.Reason.TRAILING_CONTENT);
                    assertThat(e.offset()).isEqualTo(4);
                });
    }

    @Test
    void read_blankInputFails() {
        assertThatThrownBy(() -> SExpressionReader.read("  \n "))
                .isInstanceOfSatisfying(SExpressionParseException.class,
                        e -> assertThat(e.reason()).isEqualTo(SExpressionParseException.Reason.UNEXPECTED_END));
    }

    @Test
    void read_deepNestingDoesNotOverflowTheStack() {
        int depth = 200_000;
        String text = "(".repeat(depth) + "leaf" + ")".repeat(depth);

        SExpr node = SExpressionReader.read(text);

        int levels = 0;
        while (node instanceof SExpr.SList list) {
            levels++;
            node = list.get(0);
        }
        assertThat(levels).isEqualTo(depth);
        assertThat(node).isEqualTo(symbol("leaf"));
    }
}
