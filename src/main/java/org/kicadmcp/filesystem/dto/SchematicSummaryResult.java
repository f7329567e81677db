package org.kicadmcp.filesystem.dto;

import org.kicadmcp.filesystem.dto.schematic.Schematic;
import org.kicadmcp.filesystem.dto.schematic.SchematicComponent;
import org.kicadmcp.filesystem.dto.schematic.SchematicNet;
import org.kicadmcp.filesystem.dto.schematic.SchematicParseError;

import java.util.List;

/**
 * {@code kicad_read_schematic_summary} / {@code kicad_parse_schematic_text} 的返回结果。
 * <p>
 * 解析成功时 {@code error} 为 null；解析失败时只返回 {@code error}，不返回任何部分抽取结果
 * （{@code components}/{@code nets} 为 null，计数为 null）。
 *
 * @param rootId         根目录标识（内联文本时为 null）
 * @param path           统一后的路径（使用 '/' 分隔；内联文本时为 null）
 * @param decodedWith    对文件字节流使用的解码字符集（例如 {@code utf-8}/{@code gb18030}）
 * @param title          标题
 * @param componentCount 元件块数量
 * @param netCount       网络块数量
 * @param components     元件列表（文档顺序）
 * @param nets           网络列表（文档顺序）
 * @param error          解析失败信息
 * @param warnings       非致命告警（编码回退等）
 */
public record SchematicSummaryResult(
        String rootId,
        String path,
        String decodedWith,
        String title,
        Integer componentCount,
        Integer netCount,
        List<SchematicComponent> components,
        List<SchematicNet> nets,
        SchematicParseError error,
        List<String> warnings
) {

    public static SchematicSummaryResult success(String rootId, String path, String decodedWith,
                                                 Schematic schematic, List<String> warnings) {
        return new SchematicSummaryResult(
                rootId,
                path,
                decodedWith,
                schematic.title(),
                schematic.components().size(),
                schematic.nets().size(),
                schematic.components(),
                schematic.nets(),
                null,
                emptyToNull(warnings)
        );
    }

    public static SchematicSummaryResult failure(String rootId, String path, String decodedWith,
                                                 SchematicParseError error, List<String> warnings) {
        return new SchematicSummaryResult(rootId, path, decodedWith, null, null, null, null, null, error, emptyToNull(warnings));
    }

    private static List<String> emptyToNull(List<String> value) {
        return (value == null || value.isEmpty()) ? null : List.copyOf(value);
    }
}
