package org.kicadmcp.filesystem.dto.schematic;

/**
 * 元件（尽力而为）。
 * <p>
 * 字段来源随文件版本不同：
 * <ul>
 *   <li>{@code (symbol (property "Reference" "R1") ...)}：新版原理图</li>
 *   <li>{@code (comp (ref R1) (value 10k) (footprint ...))}：网表</li>
 *   <li>{@code (symbol (lib_id "Device:R") (at 100 50 0) ...)}：按位置展开的写法</li>
 * </ul>
 * 任何字段都可能为 null；所有字段都为空的元件同样会返回，用于说明该块存在。
 *
 * @param reference 位号，例如 {@code R1}
 * @param value     值，例如 {@code 10k}
 * @param footprint 封装，或 {@code lib_id}（两者同时存在时 lib_id 优先）
 * @param position  放置坐标
 */
public record SchematicComponent(
        String reference,
        String value,
        String footprint,
        SchematicPosition position
) {
}
