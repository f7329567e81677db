package org.kicadmcp.filesystem.schematic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SExpressionTreesTest {

    @Test
    void findAll_returnsNestedMatchesInPreorder() {
        SExpr root = SExpressionReader.read("(root (net (code 1) (net (code 2))) (x (y (net (code 3)))) (net (code 4)))");

        List<SExpr.SList> nets = SExpressionTrees.findAll("net", root);

        assertThat(nets).extracting(net -> SExpr.atomText(SExpressionTrees.children(net, "code").get(0).get(1)))
                .containsExactly("1", "2", "3", "4");
    }

    @Test
    void findAll_includesTheRootItself() {
        SExpr root = SExpressionReader.read("(net (code 1) (node (ref R1) (pin 1)))");

        assertThat(SExpressionTrees.findAll("net", root)).containsExactly((SExpr.SList) root);
    }

    @Test
    void findAll_onlyMatchesSymbolHeads() {
        SExpr root = SExpressionReader.read("(root (\"net\" 1) (1 net) (net))");

        assertThat(SExpressionTrees.findAll("net", root)).hasSize(1);
    }

    @Test
    void findAll_isRepeatableAndEmptyWithoutMatches() {
        SExpr root = SExpressionReader.read("(kicad_sch (symbol (lib_id \"Device:R\")) (symbol (lib_id \"Device:C\")))");

        assertThat(SExpressionTrees.findAll("symbol", root)).isEqualTo(SExpressionTrees.findAll("symbol", root));
        assertThat(SExpressionTrees.findAll("net", root)).isEmpty();
        assertThat(SExpressionTrees.findAll("symbol", SExpr.str("symbol"))).isEmpty();
    }

    @Test
    void children_doesNotDescend() {
        SExpr.SList root = (SExpr.SList) SExpressionReader.read("(symbol (property \"A\" \"1\") (pin (property \"B\" \"2\")))");

        assertThat(SExpressionTrees.children(root, "property")).hasSize(1);
    }
}
