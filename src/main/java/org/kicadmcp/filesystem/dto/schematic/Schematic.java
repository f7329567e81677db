package org.kicadmcp.filesystem.dto.schematic;

import java.util.List;

/**
 * 原理图规范化摘要。
 * <p>
 * {@code components}/{@code nets} 保持源文档顺序，不去重、不合并同位号元件；没有匹配时为空列表（不为 null）。
 *
 * @param title      {@code title_block} 中的标题（可能为空）
 * @param components 元件列表
 * @param nets       网络列表
 */
public record Schematic(
        String title,
        List<SchematicComponent> components,
        List<SchematicNet> nets
) {
    public Schematic {
        components = (components == null) ? List.of() : List.copyOf(components);
        nets = (nets == null) ? List.of() : List.copyOf(nets);
    }
}
