package org.kicadmcp.filesystem.schematic;

import org.kicadmcp.filesystem.dto.schematic.NetConnection;
import org.kicadmcp.filesystem.dto.schematic.Schematic;
import org.kicadmcp.filesystem.dto.schematic.SchematicComponent;
import org.kicadmcp.filesystem.dto.schematic.SchematicNet;
import org.kicadmcp.filesystem.dto.schematic.SchematicPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * KiCad 原理图/网表摘要抽取器（尽力而为）。
 * <p>
 * 抽取范围：
 * <ul>
 *   <li>标题：第一个 {@code title_block} 下的 {@code (title "...")}</li>
 *   <li>元件：所有 {@code symbol} 块，其后是所有 {@code comp} 块</li>
 *   <li>网络：所有 {@code net} 块及其 {@code (node (ref ..) (pin ..))} 连接</li>
 * </ul>
 * <p>
 * KiCad 各版本的元件写法互不兼容，这里不按文件判断版本，而是对每个元件块依次应用三条规则：
 * <ol>
 *   <li>{@code (property "Reference"|"Value"|"Footprint" VALUE)}，键名区分大小写</li>
 *   <li>{@code (ref X)} / {@code (value X)} / {@code (footprint X)}</li>
 *   <li>{@code (reference X)} / {@code (value X)} / {@code (lib_id X)} / {@code (at X Y)}</li>
 * </ol>
 * 后应用的规则覆盖先前规则写入的同名字段；同一规则内同一字段多次出现时以最后一次为准。
 * <p>
 * 字段缺失或格式不符只会得到 null，不会抛异常；唯一的失败来源是 {@link SExpressionReader} 的
 * {@link SExpressionParseException}。同位号元件不合并，网络 code/name 不做统一。
 */
public final class SchematicExtractor {

    private SchematicExtractor() {
    }

    private static final List<ComponentRule> COMPONENT_RULES = List.of(
            SchematicExtractor::applyPropertyFields,
            SchematicExtractor::applyNetlistFields,
            SchematicExtractor::applyPlacementFields
    );

    @FunctionalInterface
    private interface ComponentRule {
        void apply(SExpr.SList block, ComponentFields fields);
    }

    public static Schematic parse(String text) {
        return extract(SExpressionReader.read(text));
    }

    public static Schematic extract(SExpr root) {
        String title = extractTitle(root);

        List<SchematicComponent> components = new ArrayList<>();
        List<SExpr.SList> componentBlocks = new ArrayList<>(SExpressionTrees.findAll("symbol", root));
        componentBlocks.addAll(SExpressionTrees.findAll("comp", root));
        for (SExpr.SList block : componentBlocks) {
            components.add(extractComponent(block));
        }

        List<SchematicNet> nets = new ArrayList<>();
        for (SExpr.SList block : SExpressionTrees.findAll("net", root)) {
            nets.add(extractNet(block));
        }

        return new Schematic(title, components, nets);
    }

    static String extractTitle(SExpr root) {
        List<SExpr.SList> titleBlocks = SExpressionTrees.findAll("title_block", root);
        if (titleBlocks.isEmpty()) {
            return null;
        }
        // 只看第一个 title_block 的直接子节点，取第一个 (title ...)
        List<SExpr.SList> titles = SExpressionTrees.children(titleBlocks.get(0), "title");
        return titles.isEmpty() ? null : SExpr.atomText(titles.get(0).get(1));
    }

    static SchematicComponent extractComponent(SExpr.SList block) {
        ComponentFields fields = new ComponentFields();
        for (ComponentRule rule : COMPONENT_RULES) {
            rule.apply(block, fields);
        }
        return new SchematicComponent(fields.reference, fields.value, fields.footprint, fields.position);
    }

    // (property "Reference" "R1" (at ...) (effects ...))
    private static void applyPropertyFields(SExpr.SList block, ComponentFields fields) {
        for (SExpr.SList property : SExpressionTrees.children(block, "property")) {
            if (property.size() < 3) {
                continue;
            }
            String key = SExpr.atomText(property.get(1));
            String value = SExpr.atomText(property.get(2));
            if (key == null || value == null) {
                continue;
            }
            switch (key) {
                case "Reference" -> fields.reference = value;
                case "Value" -> fields.value = value;
                case "Footprint" -> fields.footprint = value;
                default -> {
                    // 其它属性（Datasheet、Description、自定义字段）不进入摘要
                }
            }
        }
    }

    // (comp (ref "C1") (value "100nF") (footprint "Capacitor_SMD:C_0603"))
    private static void applyNetlistFields(SExpr.SList block, ComponentFields fields) {
        for (SExpr child : block.children()) {
            if (!(child instanceof SExpr.SList list)) {
                continue;
            }
            String head = list.head();
            String value = SExpr.atomText(list.get(1));
            if (head == null || value == null) {
                continue;
            }
            switch (head) {
                case "ref" -> fields.reference = value;
                case "value" -> fields.value = value;
                case "footprint" -> fields.footprint = value;
                default -> {
                }
            }
        }
    }

    // (symbol (lib_id "Device:R") (at 100.33 50.8 0) (reference "R1") (value "10k"))
    private static void applyPlacementFields(SExpr.SList block, ComponentFields fields) {
        for (SExpr child : block.children()) {
            if (!(child instanceof SExpr.SList list) || list.head() == null) {
                continue;
            }
            switch (list.head()) {
                case "reference" -> fields.reference = orElse(SExpr.atomText(list.get(1)), fields.reference);
                case "value" -> fields.value = orElse(SExpr.atomText(list.get(1)), fields.value);
                case "lib_id" -> fields.footprint = orElse(SExpr.atomText(list.get(1)), fields.footprint);
                case "at" -> {
                    Double x = SExpr.atomNumber(list.get(1));
                    Double y = SExpr.atomNumber(list.get(2));
                    if (x != null && y != null) {
                        fields.position = new SchematicPosition(x, y);
                    }
                }
                default -> {
                }
            }
        }
    }

    static SchematicNet extractNet(SExpr.SList block) {
        String code = null;
        String name = null;
        List<NetConnection> connections = new ArrayList<>();
        for (SExpr child : block.children()) {
            if (!(child instanceof SExpr.SList list) || list.head() == null) {
                continue;
            }
            switch (list.head()) {
                case "code" -> code = orElse(SExpr.atomText(list.get(1)), code);
                case "name" -> name = orElse(SExpr.atomText(list.get(1)), name);
                case "node" -> {
                    NetConnection connection = extractConnection(list);
                    if (connection != null) {
                        connections.add(connection);
                    }
                }
                default -> {
                }
            }
        }
        return new SchematicNet(code != null ? code : name, name, connections);
    }

    /**
     * {@code (node (ref "R1") (pin "1"))}；ref 或 pin 任一缺失时返回 null。
     */
    private static NetConnection extractConnection(SExpr.SList node) {
        String ref = null;
        String pin = null;
        for (SExpr child : node.children()) {
            if (!(child instanceof SExpr.SList list)) {
                continue;
            }
            if (list.isHeadedBy("ref")) {
                ref = orElse(SExpr.atomText(list.get(1)), ref);
            } else if (list.isHeadedBy("pin")) {
                pin = orElse(SExpr.atomText(list.get(1)), pin);
            }
        }
        return (ref != null && pin != null) ? new NetConnection(ref, pin) : null;
    }

    private static String orElse(String value, String fallback) {
        return (value != null) ? value : fallback;
    }

    private static final class ComponentFields {
        private String reference;
        private String value;
        private String footprint;
        private SchematicPosition position;
    }
}
