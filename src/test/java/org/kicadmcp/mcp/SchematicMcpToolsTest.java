package org.kicadmcp.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kicadmcp.filesystem.SchematicServerProperties;
import org.kicadmcp.filesystem.SecurePathResolver;
import org.kicadmcp.filesystem.dto.SchematicBlockListResult;
import org.kicadmcp.filesystem.dto.SchematicSummaryResult;
import org.kicadmcp.filesystem.dto.schematic.NetConnection;
import org.kicadmcp.filesystem.dto.schematic.SchematicComponent;
import org.springframework.util.unit.DataSize;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchematicMcpToolsTest {

    private static final String SCHEMATIC = """
            (kicad_sch (version 20231120) (generator "eeschema")
              (title_block (title "Power Supply") (rev "A"))
              (lib_symbols (symbol "Device:R" (symbol "R_0_1")))
              (symbol (lib_id "Device:R") (at 100.33 50.8 0)
                (property "Reference" "R1" (at 102 49 0))
                (property "Value" "10k" (at 102 52 0))
                (property "Footprint" "Resistor_SMD:R_0603" (at 100 50 0)))
              (net (code "1") (name "GND") (node (ref "R1") (pin "1"))))
            """;

    @TempDir
    Path tempDir;

    private SchematicServerProperties properties;
    private SchematicMcpTools tools;

    @BeforeEach
    void setUp() {
        properties = new SchematicServerProperties();
        properties.setRoots(List.of(tempDir.toString()));
        tools = new SchematicMcpTools(properties, new SecurePathResolver(properties));
    }

    @Test
    void readSchematicSummary_returnsCanonicalSummary() throws Exception {
        Files.writeString(tempDir.resolve("psu.kicad_sch"), SCHEMATIC);

        SchematicSummaryResult result = tools.readSchematicSummary(null, "psu.kicad_sch");

        assertThat(result.error()).isNull();
        assertThat(result.rootId()).isEqualTo("root0");
        assertThat(result.path()).isEqualTo("psu.kicad_sch");
        assertThat(result.decodedWith()).isEqualTo("utf-8");
        assertThat(result.title()).isEqualTo("Power Supply");
        assertThat(result.componentCount()).isEqualTo(3);
        assertThat(result.components()).extracting(SchematicComponent::reference).containsExactly(null, null, "R1");
        assertThat(result.components().get(2).footprint()).isEqualTo("Device:R");
        assertThat(result.netCount()).isEqualTo(1);
        assertThat(result.nets().get(0).connections()).containsExactly(new NetConnection("R1", "1"));
        assertThat(result.warnings()).isNull();
    }

    @Test
    void readSchematicSummary_malformedFileReturnsErrorWithoutEntities() throws Exception {
        Files.writeString(tempDir.resolve("broken.kicad_sch"), "(kicad_sch (symbol (property \"Reference\" \"R1\")");

        SchematicSummaryResult result = tools.readSchematicSummary("root0", "broken.kicad_sch");

        assertThat(result.error()).isNotNull();
        assertThat(result.error().reason()).isEqualTo("UNEXPECTED_END");
        assertThat(result.error().error()).isNotBlank();
        assertThat(result.components()).isNull();
        assertThat(result.nets()).isNull();
        assertThat(result.title()).isNull();
    }

    @Test
    void readSchematicSummary_decodesNonUtf8FilesAsGb18030() throws Exception {
        Files.write(tempDir.resolve("cn.kicad_sch"),
                "(kicad_sch (title_block (title \"电源板\")))".getBytes(Charset.forName("GB18030")));

        SchematicSummaryResult result = tools.readSchematicSummary(null, "cn.kicad_sch");

        assertThat(result.decodedWith()).isEqualTo("gb18030");
        assertThat(result.title()).isEqualTo("电源板");
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void readSchematicSummary_rejectsUnsupportedOversizedAndEscapingPaths() throws Exception {
        Files.writeString(tempDir.resolve("notes.txt"), "()");
        Files.writeString(tempDir.resolve("big.net"), SCHEMATIC);
        properties.setReadMaxBytes(DataSize.ofBytes(16));

        assertThatThrownBy(() -> tools.readSchematicSummary(null, "notes.txt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.readSchematicSummary(null, "big.net"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("big.net");
        assertThatThrownBy(() -> tools.readSchematicSummary(null, "../outside.kicad_sch"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseSchematicText_summarizesInlineText() {
        SchematicSummaryResult result = tools.parseSchematicText("\uFEFF(export (components (comp (ref \"C1\") (value \"100nF\") (footprint \"0603\"))))");

        assertThat(result.rootId()).isNull();
        assertThat(result.path()).isNull();
        assertThat(result.components()).containsExactly(new SchematicComponent("C1", "100nF", "0603", null));
        assertThat(result.nets()).isEmpty();
    }

    @Test
    void parseSchematicText_rejectsBlankText() {
        assertThatThrownBy(() -> tools.parseSchematicText("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findBlocks_pagesThroughMatchesInDocumentOrder() throws Exception {
        Files.writeString(tempDir.resolve("psu.kicad_sch"), SCHEMATIC);

        SchematicBlockListResult first = tools.findBlocks(null, "psu.kicad_sch", "symbol", 0, 1, null);

        assertThat(first.totalCount()).isEqualTo(3);
        assertThat(first.hasMore()).isTrue();
        assertThat(first.nextOffset()).isEqualTo(1);
        assertThat(first.blocks()).hasSize(1);
        assertThat(first.blocks().get(0).text()).isEqualTo("(symbol \"Device:R\" (symbol \"R_0_1\"))");
        assertThat(first.blocks().get(0).truncated()).isFalse();

        SchematicBlockListResult rest = tools.findBlocks(null, "psu.kicad_sch", "symbol", 1, 10, 20);

        assertThat(rest.hasMore()).isFalse();
        assertThat(rest.nextOffset()).isNull();
        assertThat(rest.blocks()).extracting(b -> b.index()).containsExactly(1, 2);
        assertThat(rest.blocks().get(1).truncated()).isTrue();
        assertThat(rest.blocks().get(1).text()).startsWith("(symbol (lib_id");
    }

    @Test
    void findBlocks_malformedFileIsAnArgumentError() throws Exception {
        Files.writeString(tempDir.resolve("broken.net"), "(export (nets (net (code 1))");

        assertThatThrownBy(() -> tools.findBlocks(null, "broken.net", "net", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken.net");
    }

    @Test
    void listRoots_reportsConfiguredRoot() {
        assertThat(tools.listRoots().roots()).hasSize(1);
        assertThat(tools.listRoots().roots().get(0).rootId()).isEqualTo("root0");
    }
}
