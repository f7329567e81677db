package org.kicadmcp.filesystem.dto;

import org.kicadmcp.filesystem.dto.schematic.SchematicBlockSnippet;

import java.util.List;

/**
 * {@code kicad_find_blocks} 的返回结果（分页）。
 *
 * @param rootId      根目录标识
 * @param path        统一后的路径
 * @param symbol      查找的头符号（例如 {@code symbol}/{@code net}/{@code title_block}）
 * @param totalCount  命中的块总数
 * @param offset      本页起始序号（0-based）
 * @param limit       本页大小
 * @param hasMore     是否还有下一页
 * @param nextOffset  下一页 offset（没有下一页时为 null）
 * @param blocks      本页的块片段
 */
public record SchematicBlockListResult(
        String rootId,
        String path,
        String symbol,
        int totalCount,
        int offset,
        int limit,
        boolean hasMore,
        Integer nextOffset,
        List<SchematicBlockSnippet> blocks
) {
}
